package org.codesonify.api;

/**
 * Thrown when a request cannot be sonified because its input is structurally invalid,
 * for example a missing code payload or an unknown style name.
 * <p>
 * The pipeline itself never throws this for odd content; any text yields a composition.
 */
public class SonificationException extends RuntimeException {

    /**
     * Constructs a new SonificationException.
     * @param message The detail message.
     */
    public SonificationException(String message) {
        super(message);
    }

    /**
     * Constructs a new SonificationException.
     * @param message The detail message.
     * @param cause The cause.
     */
    public SonificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
