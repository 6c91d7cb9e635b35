package org.gerken.secretsanta.model;

import org.gerken.secretsanta.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The people taking part in one draw.
 * Each person is addressed by a stable index (their position in the roster), which is
 * what the search works with; names are resolved once through {@link #indexOf(String)}.
 *
 * A roster is immutable once created.
 */
public class Roster {

    private final List<Person> people;
    private final Map<String, Integer> indexByName;

    /**
     * Creates a roster from the given people, in order.
     *
     * @param people the participants
     * @throws ConfigurationException if a name is blank or appears more than once
     */
    public Roster(List<Person> people) {
        List<String> conflicts = new ArrayList<>();
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < people.size(); i++) {
            String name = people.get(i).getName();
            if (name.isBlank()) {
                conflicts.add("person at position " + i + " has a blank name");
            } else if (index.putIfAbsent(name, i) != null) {
                conflicts.add("person '" + name + "' appears more than once in the roster");
            }
        }
        if (!conflicts.isEmpty()) {
            throw new ConfigurationException(conflicts);
        }
        this.people = Collections.unmodifiableList(new ArrayList<>(people));
        this.indexByName = index;
    }

    public static Roster of(Person... people) {
        return new Roster(List.of(people));
    }

    /**
     * Gets the number of people in the roster.
     *
     * @return the roster size
     */
    public int size() {
        return people.size();
    }

    public List<Person> getPeople() {
        return people;
    }

    /**
     * Gets the person at the given index.
     *
     * @param index the roster index (0-based)
     * @return the person
     */
    public Person getPerson(int index) {
        return people.get(index);
    }

    /**
     * Gets the roster index of the named person.
     *
     * @param name the person's name
     * @return the index, or -1 if nobody by that name is in the roster
     */
    public int indexOf(String name) {
        Integer index = indexByName.get(name);
        return index == null ? -1 : index;
    }

    public boolean contains(String name) {
        return indexByName.containsKey(name);
    }

    /**
     * Gets the named person.
     *
     * @param name the person's name
     * @return the person, or null if not in the roster
     */
    public Person get(String name) {
        int index = indexOf(name);
        return index < 0 ? null : people.get(index);
    }

    @Override
    public String toString() {
        return people.toString();
    }
}
