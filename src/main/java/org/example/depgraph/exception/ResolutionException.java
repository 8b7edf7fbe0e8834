package org.example.depgraph.exception;

/**
 * Exception thrown when a reference in a dependency graph cannot be resolved,
 * or when a traversal does not reach a dependency it is expected to reach.
 */
public class ResolutionException extends DependencyGraphException {

    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
