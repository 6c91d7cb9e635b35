package org.gerken.secretsanta.model;

import java.util.Objects;

/**
 * A participant in the exchange.
 * People are identified by name within a roster; the email address is carried
 * along for whoever delivers the assignment and is never interpreted here.
 */
public class Person {

    private final String name;
    private final String email;

    /**
     * Creates a person.
     *
     * @param name the unique name within the roster
     * @param email the delivery address, may be empty
     */
    public Person(String name, String email) {
        this.name = Objects.requireNonNull(name, "name");
        this.email = email == null ? "" : email;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    /**
     * Gets the mailbox form used by mail clients, e.g. "John &lt;john@email.com&gt;".
     *
     * @return the name and address
     */
    public String getMailbox() {
        return name + " <" + email + ">";
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Person person = (Person) o;
        return name.equals(person.name) && email.equals(person.email);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + email.hashCode();
    }
}
