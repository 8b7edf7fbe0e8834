package org.example.depgraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single occurrence of a package in a {@link DependencyGraph}.
 *
 * <p>The package is referenced by its index in the graph's catalog. If the same package is resolved
 * with different transitive dependencies in different places, each resolution is a separate reference
 * with its own fragment number. A reference can be the child of multiple parents; this is how
 * subtrees are shared between scopes and projects.</p>
 *
 * <p>Two references are equal if they point to the same package index and fragment.</p>
 */
public class DependencyReference {

    private final int pkg;
    private final int fragment;
    private final PackageLinkage linkage;
    private final List<Issue> issues;
    private final List<DependencyReference> dependencies;

    /**
     * Creates a new DependencyReference. The dependencies have to be created before their parents, so
     * the references always form an acyclic graph.
     *
     * @param pkg          the index of the package in the catalog
     * @param fragment     the fragment distinguishing this resolution of the package
     * @param linkage      the linkage of the package (null = DYNAMIC)
     * @param issues       issues encountered when resolving this occurrence (null = none)
     * @param dependencies the direct dependencies in declared order (null = none)
     */
    public DependencyReference(int pkg, int fragment, PackageLinkage linkage, List<Issue> issues,
                               List<DependencyReference> dependencies) {
        this.pkg = pkg;
        this.fragment = fragment;
        this.linkage = linkage != null ? linkage : PackageLinkage.DYNAMIC;
        this.issues = issues != null ? List.copyOf(issues) : Collections.emptyList();
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : Collections.emptyList();
    }

    /**
     * Creates a new DependencyReference using the builder pattern.
     */
    public static Builder builder(int pkg) {
        return new Builder(pkg);
    }

    // Getters

    public int getPkg() {
        return pkg;
    }

    public int getFragment() {
        return fragment;
    }

    public PackageLinkage getLinkage() {
        return linkage;
    }

    public List<Issue> getIssues() {
        return issues;
    }

    /**
     * Returns the direct dependencies of this occurrence in their declared order.
     */
    public List<DependencyReference> getDependencies() {
        return dependencies;
    }

    /**
     * Returns whether this occurrence has any dependencies.
     */
    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DependencyReference that = (DependencyReference) o;
        return pkg == that.pkg && fragment == that.fragment;
    }

    @Override
    public int hashCode() {
        return Objects.hash(pkg, fragment);
    }

    @Override
    public String toString() {
        return "DependencyReference{pkg=" + pkg + ", fragment=" + fragment +
               ", linkage=" + linkage + ", dependencies=" + dependencies.size() + "}";
    }

    /**
     * Builder for DependencyReference.
     */
    public static class Builder {
        private final int pkg;
        private int fragment = 0;
        private PackageLinkage linkage = PackageLinkage.DYNAMIC;
        private final List<Issue> issues = new ArrayList<>();
        private final List<DependencyReference> dependencies = new ArrayList<>();

        public Builder(int pkg) {
            this.pkg = pkg;
        }

        public Builder fragment(int fragment) {
            this.fragment = fragment;
            return this;
        }

        public Builder linkage(PackageLinkage linkage) {
            this.linkage = linkage;
            return this;
        }

        public Builder issue(Issue issue) {
            this.issues.add(issue);
            return this;
        }

        public Builder dependency(DependencyReference dependency) {
            this.dependencies.add(Objects.requireNonNull(dependency, "dependency cannot be null"));
            return this;
        }

        public Builder dependencies(List<DependencyReference> dependencies) {
            this.dependencies.addAll(dependencies);
            return this;
        }

        public DependencyReference build() {
            return new DependencyReference(pkg, fragment, linkage, issues, dependencies);
        }
    }
}
