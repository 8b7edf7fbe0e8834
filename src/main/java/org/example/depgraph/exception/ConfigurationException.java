package org.example.depgraph.exception;

import java.util.Collections;
import java.util.List;

/**
 * Exception thrown when a navigator cannot be set up from the provided graphs,
 * or when a graph fails structural validation.
 */
public class ConfigurationException extends DependencyGraphException {

    private final List<String> errors;

    public ConfigurationException(String message) {
        this(message, Collections.emptyList());
    }

    public ConfigurationException(String message, List<String> errors) {
        super(message);
        this.errors = List.copyOf(errors);
    }

    /**
     * Returns the validation errors if this exception was raised by validation, otherwise an empty list.
     */
    public List<String> getErrors() {
        return errors;
    }
}
