package org.example.depgraph.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A named group of direct dependencies of a project, stored as plain dependency trees.
 */
public class Scope {

    private final String name;
    private final List<PackageReference> dependencies;

    public Scope(String name, List<PackageReference> dependencies) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : Collections.emptyList();
    }

    public static Scope of(String name, PackageReference... dependencies) {
        return new Scope(name, Arrays.asList(dependencies));
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the direct dependencies of this scope in their declared order.
     */
    public List<PackageReference> getDependencies() {
        return dependencies;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Scope scope = (Scope) o;
        return name.equals(scope.name) && dependencies.equals(scope.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dependencies);
    }

    @Override
    public String toString() {
        return "Scope{" + name + ", dependencies=" + dependencies.size() + "}";
    }
}
