package org.example.depgraph.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * An analyzed project.
 *
 * <p>The dependencies of a project are stored in one of two formats: either in a shared
 * {@link DependencyGraph}, in which case only the names of the project's scopes are recorded here,
 * or directly as a tree of {@link Scope}s.</p>
 */
public class Project {

    private final Identifier id;
    private final String definitionFilePath;
    private final SortedSet<String> scopeNames;
    private final Set<Scope> scopes;

    public Project(Identifier id, String definitionFilePath, Set<String> scopeNames, Set<Scope> scopes) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.definitionFilePath = definitionFilePath != null ? definitionFilePath : "";
        this.scopeNames = scopeNames != null
                ? Collections.unmodifiableSortedSet(new TreeSet<>(scopeNames))
                : Collections.emptySortedSet();
        this.scopes = scopes != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(scopes))
                : Collections.emptySet();
    }

    /**
     * Creates a new Project using the builder pattern.
     */
    public static Builder builder(Identifier id) {
        return new Builder(id);
    }

    // Getters

    public Identifier getId() {
        return id;
    }

    public String getDefinitionFilePath() {
        return definitionFilePath;
    }

    /**
     * Returns the names of the scopes whose dependencies are stored in a {@link DependencyGraph}.
     */
    public SortedSet<String> getScopeNames() {
        return scopeNames;
    }

    /**
     * Returns the scopes whose dependencies are stored directly in this project as trees.
     */
    public Set<Scope> getScopes() {
        return scopes;
    }

    /**
     * Returns the name of the package manager that produced this project. This is the key of the
     * {@link DependencyGraph} holding the project's dependencies.
     */
    public String getManagerName() {
        return id.getType();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Project project = (Project) o;
        return id.equals(project.id) &&
               definitionFilePath.equals(project.definitionFilePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, definitionFilePath);
    }

    @Override
    public String toString() {
        return "Project{" + id + ", scopeNames=" + scopeNames + ", scopes=" + scopes.size() + "}";
    }

    /**
     * Builder for Project.
     */
    public static class Builder {
        private final Identifier id;
        private String definitionFilePath = "";
        private final Set<String> scopeNames = new LinkedHashSet<>();
        private final Set<Scope> scopes = new LinkedHashSet<>();

        public Builder(Identifier id) {
            this.id = id;
        }

        public Builder definitionFilePath(String definitionFilePath) {
            this.definitionFilePath = definitionFilePath;
            return this;
        }

        public Builder scopeName(String scopeName) {
            this.scopeNames.add(scopeName);
            return this;
        }

        public Builder scopeNames(Set<String> scopeNames) {
            this.scopeNames.addAll(scopeNames);
            return this;
        }

        public Builder scope(Scope scope) {
            this.scopes.add(scope);
            return this;
        }

        public Project build() {
            return new Project(id, definitionFilePath, scopeNames, scopes);
        }
    }
}
