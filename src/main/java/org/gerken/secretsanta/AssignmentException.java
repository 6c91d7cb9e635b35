package org.gerken.secretsanta;

/**
 * Base class for every way a draw can fail.
 * All failures are terminal for the solve call that raised them; the engine never
 * retries or drops a rule on its own.
 */
public abstract class AssignmentException extends RuntimeException {

    protected AssignmentException(String message) {
        super(message);
    }

    protected AssignmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
