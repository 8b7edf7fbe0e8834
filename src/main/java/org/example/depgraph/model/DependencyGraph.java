package org.example.depgraph.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The compact representation of the dependencies found by a single package manager.
 *
 * <p>The graph consists of three parts:</p>
 * <ul>
 *   <li>a catalog of all the packages; packages are referenced by their index in this list,</li>
 *   <li>a forest of {@link DependencyReference}s; subtrees are shared between all the places where
 *       the same resolution of a package occurs,</li>
 *   <li>a mapping from qualified scope names to the roots of the scope's dependency trees.</li>
 * </ul>
 *
 * <p>One graph can hold the dependencies of multiple projects. Therefore, scope names are qualified
 * with the identity of the owning project, see {@link #qualifyScope(Project, String)}.</p>
 */
public class DependencyGraph {

    private final List<Identifier> packages;
    private final List<DependencyReference> scopeRoots;
    private final Map<String, List<RootDependencyIndex>> scopes;

    /**
     * Creates a new DependencyGraph.
     *
     * @param packages   the catalog of packages
     * @param scopeRoots the top-level references of the dependency forest
     * @param scopes     the root indices of each qualified scope
     */
    public DependencyGraph(List<Identifier> packages, List<DependencyReference> scopeRoots,
                           Map<String, List<RootDependencyIndex>> scopes) {
        this.packages = List.copyOf(Objects.requireNonNull(packages, "packages cannot be null"));
        this.scopeRoots = scopeRoots != null ? List.copyOf(scopeRoots) : Collections.emptyList();

        Map<String, List<RootDependencyIndex>> scopesCopy = new LinkedHashMap<>();
        if (scopes != null) {
            scopes.forEach((name, roots) -> scopesCopy.put(name, List.copyOf(roots)));
        }
        this.scopes = Collections.unmodifiableMap(scopesCopy);
    }

    /**
     * Creates a new DependencyGraph using the builder pattern.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the name of a scope qualified by the identity of the given project.
     * Required because a graph can be shared by multiple projects using the same scope names.
     */
    public static String qualifyScope(Project project, String scopeName) {
        return qualifyScope(project.getId(), scopeName);
    }

    /**
     * Returns the name of a scope qualified by the given project identifier.
     */
    public static String qualifyScope(Identifier projectId, String scopeName) {
        return projectId.getNamespace() + ":" + projectId.getName() + ":" + projectId.getVersion() + ":" + scopeName;
    }

    /**
     * Extracts the plain scope name from a qualified scope name.
     */
    public static String unqualifyScope(String qualifiedScopeName) {
        return qualifiedScopeName.substring(qualifiedScopeName.lastIndexOf(':') + 1);
    }

    // Getters

    public List<Identifier> getPackages() {
        return packages;
    }

    public List<DependencyReference> getScopeRoots() {
        return scopeRoots;
    }

    public Map<String, List<RootDependencyIndex>> getScopes() {
        return scopes;
    }

    // Query methods

    /**
     * Returns the number of packages in the catalog.
     */
    public int getPackageCount() {
        return packages.size();
    }

    /**
     * Returns whether the catalog contains no packages.
     */
    public boolean isEmpty() {
        return packages.isEmpty();
    }

    /**
     * Returns the package stored at the given catalog index.
     *
     * @throws IndexOutOfBoundsException if the index is not in the catalog
     */
    public Identifier getPackage(int index) {
        return packages.get(index);
    }

    /**
     * Returns the root indices of the given qualified scope, or an empty list if the scope is unknown.
     */
    public List<RootDependencyIndex> getScopeRootIndices(String qualifiedScopeName) {
        return scopes.getOrDefault(qualifiedScopeName, Collections.emptyList());
    }

    @Override
    public String toString() {
        return "DependencyGraph{" +
                "packageCount=" + packages.size() +
                ", scopeRootCount=" + scopeRoots.size() +
                ", scopeCount=" + scopes.size() +
                '}';
    }

    /**
     * Builder for DependencyGraph.
     */
    public static class Builder {
        private final List<Identifier> packages = new ArrayList<>();
        private final List<DependencyReference> scopeRoots = new ArrayList<>();
        private final Map<String, List<RootDependencyIndex>> scopes = new LinkedHashMap<>();

        public Builder packages(List<Identifier> packages) {
            this.packages.addAll(packages);
            return this;
        }

        public Builder addPackage(Identifier id) {
            this.packages.add(id);
            return this;
        }

        public Builder scopeRoot(DependencyReference root) {
            this.scopeRoots.add(root);
            return this;
        }

        public Builder scope(String qualifiedScopeName, RootDependencyIndex... roots) {
            this.scopes.computeIfAbsent(qualifiedScopeName, k -> new ArrayList<>()).addAll(Arrays.asList(roots));
            return this;
        }

        public Builder scope(Project project, String scopeName, RootDependencyIndex... roots) {
            return scope(qualifyScope(project, scopeName), roots);
        }

        public DependencyGraph build() {
            return new DependencyGraph(packages, scopeRoots, scopes);
        }
    }
}
