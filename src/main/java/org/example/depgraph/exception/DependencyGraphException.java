package org.example.depgraph.exception;

/**
 * Base exception for all dependency graph errors.
 *
 * <p>Failures in this library indicate an inconsistent or malformed graph delivered by the
 * analyzer and are never retried. They are unchecked because they are raised inside the lazy
 * {@link java.util.stream.Stream}s of the navigators, whose functional interfaces cannot declare
 * checked exceptions.</p>
 */
public class DependencyGraphException extends RuntimeException {

    public DependencyGraphException(String message) {
        super(message);
    }

    public DependencyGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
