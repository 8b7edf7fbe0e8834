package org.example.depgraph.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * A node in a plain dependency tree as stored in a {@link Scope}.
 *
 * <p>Unlike the references in a {@link DependencyGraph}, every package reference is a separate object,
 * so it can act as a {@link DependencyNode} directly and is its own stable reference.</p>
 */
public class PackageReference implements DependencyNode {

    private final Identifier id;
    private final PackageLinkage linkage;
    private final List<Issue> issues;
    private final List<PackageReference> dependencies;

    public PackageReference(Identifier id, PackageLinkage linkage, List<Issue> issues,
                            List<PackageReference> dependencies) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.linkage = linkage != null ? linkage : PackageLinkage.DYNAMIC;
        this.issues = issues != null ? List.copyOf(issues) : Collections.emptyList();
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : Collections.emptyList();
    }

    /**
     * Creates a new PackageReference using the builder pattern.
     */
    public static Builder builder(Identifier id) {
        return new Builder(id);
    }

    @Override
    public Identifier getId() {
        return id;
    }

    @Override
    public PackageLinkage getLinkage() {
        return linkage;
    }

    @Override
    public List<Issue> getIssues() {
        return issues;
    }

    public List<PackageReference> getDependencies() {
        return dependencies;
    }

    @Override
    public <T> T visitDependencies(Function<Stream<DependencyNode>, T> block) {
        return block.apply(dependencies.stream().map(DependencyNode.class::cast));
    }

    @Override
    public DependencyNode getStableReference() {
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PackageReference that = (PackageReference) o;
        return id.equals(that.id) &&
               linkage == that.linkage &&
               issues.equals(that.issues) &&
               dependencies.equals(that.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, linkage, issues, dependencies);
    }

    @Override
    public String toString() {
        return "PackageReference{" + id + ", linkage=" + linkage + ", dependencies=" + dependencies.size() + "}";
    }

    /**
     * Builder for PackageReference.
     */
    public static class Builder {
        private final Identifier id;
        private PackageLinkage linkage = PackageLinkage.DYNAMIC;
        private final List<Issue> issues = new ArrayList<>();
        private final List<PackageReference> dependencies = new ArrayList<>();

        public Builder(Identifier id) {
            this.id = id;
        }

        public Builder linkage(PackageLinkage linkage) {
            this.linkage = linkage;
            return this;
        }

        public Builder issue(Issue issue) {
            this.issues.add(issue);
            return this;
        }

        public Builder dependency(PackageReference dependency) {
            this.dependencies.add(dependency);
            return this;
        }

        public PackageReference build() {
            return new PackageReference(id, linkage, issues, dependencies);
        }
    }
}
