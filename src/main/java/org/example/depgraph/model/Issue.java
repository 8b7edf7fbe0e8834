package org.example.depgraph.model;

import java.util.Objects;

/**
 * A problem that occurred while resolving a single dependency occurrence.
 */
public final class Issue {

    /**
     * Severity of an issue.
     */
    public enum Severity {
        ERROR,
        WARNING,
        HINT
    }

    private final String source;
    private final String message;
    private final Severity severity;

    public Issue(String source, String message, Severity severity) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.message = Objects.requireNonNull(message, "message cannot be null");
        this.severity = severity != null ? severity : Severity.ERROR;
    }

    /**
     * Creates an issue with {@link Severity#ERROR}.
     */
    public static Issue error(String source, String message) {
        return new Issue(source, message, Severity.ERROR);
    }

    public String getSource() {
        return source;
    }

    public String getMessage() {
        return message;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Issue issue = (Issue) o;
        return source.equals(issue.source) &&
               message.equals(issue.message) &&
               severity == issue.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, message, severity);
    }

    @Override
    public String toString() {
        return severity + " [" + source + "] " + message;
    }
}
