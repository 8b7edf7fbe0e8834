package org.example.depgraph.navigator;

import org.example.depgraph.exception.ResolutionException;
import org.example.depgraph.model.AnalyzerResult;
import org.example.depgraph.model.DependencyMatcher;
import org.example.depgraph.model.DependencyNode;
import org.example.depgraph.model.Identifier;
import org.example.depgraph.model.Issue;
import org.example.depgraph.model.PackageLinkage;
import org.example.depgraph.model.Project;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Navigates through the dependencies of the projects in an {@link AnalyzerResult}, independent of
 * the concrete storage representation.
 *
 * <p>Implementations only have to provide the scope names of a project and the direct dependencies of
 * a scope. All other queries are derived from these by traversing the resulting {@link DependencyNode}s.</p>
 *
 * <p>Depth parameters count levels starting with the direct dependencies (level 1). A depth of 0
 * selects nothing; negative values mean that the depth is not restricted.</p>
 */
public interface DependencyNavigator {

    /**
     * A matcher that matches all dependencies. It can be used to traverse the whole dependency graph.
     */
    DependencyMatcher MATCH_ALL = DependencyMatcher.matchAll();

    /**
     * Returns a navigator suitable for the storage format used by the given result.
     */
    static DependencyNavigator forResult(AnalyzerResult result) {
        Objects.requireNonNull(result, "result cannot be null");
        return result.usesDependencyGraphs()
                ? new DependencyGraphNavigator(result)
                : new DependencyTreeNavigator();
    }

    /**
     * Returns a sorted set with all the identifiers contained in the given map of scope dependencies.
     * This is useful if all dependencies are needed independent of the scope they belong to.
     */
    static SortedSet<Identifier> collectDependencies(Map<String, Set<Identifier>> scopeDependencies) {
        SortedSet<Identifier> result = new TreeSet<>();
        scopeDependencies.values().forEach(result::addAll);
        return result;
    }

    /**
     * Returns the names of all the scopes defined for the given project.
     */
    Set<String> scopeNames(Project project);

    /**
     * Returns a stream with the direct dependencies of the given scope of a project, in the order they
     * were declared. From these nodes the whole dependency tree of the scope can be traversed.
     *
     * <p>The nodes of the stream may be aliased, see {@link DependencyNode}.</p>
     */
    Stream<DependencyNode> directDependencies(Project project, String scopeName);

    /**
     * Returns a map with the dependencies of a project grouped by scopes. The keys are the scope names,
     * the values the identifiers of the dependencies in this scope up to the given depth that are
     * accepted by the matcher. The matcher does not stop the traversal; dependencies of nodes it
     * rejects are still visited.
     */
    default Map<String, Set<Identifier>> scopeDependencies(Project project, int maxDepth, DependencyMatcher matcher) {
        Map<String, Set<Identifier>> result = new LinkedHashMap<>();

        for (String scope : scopeNames(project)) {
            result.put(scope, dependenciesForScope(project, scope, maxDepth, matcher));
        }

        return result;
    }

    default Map<String, Set<Identifier>> scopeDependencies(Project project, int maxDepth) {
        return scopeDependencies(project, maxDepth, MATCH_ALL);
    }

    default Map<String, Set<Identifier>> scopeDependencies(Project project) {
        return scopeDependencies(project, -1, MATCH_ALL);
    }

    /**
     * Returns the identifiers of the dependencies of a single scope up to the given depth that are
     * accepted by the matcher.
     */
    default Set<Identifier> dependenciesForScope(Project project, String scopeName, int maxDepth,
                                                 DependencyMatcher matcher) {
        Set<Identifier> ids = new LinkedHashSet<>();
        DependencyTraversals.collectDependencies(directDependencies(project, scopeName), maxDepth, matcher, ids);
        return ids;
    }

    /**
     * Returns the identifiers of all the dependencies of a project independent of their scope.
     */
    default SortedSet<Identifier> projectDependencies(Project project, int maxDepth, DependencyMatcher matcher) {
        return collectDependencies(scopeDependencies(project, maxDepth, matcher));
    }

    default SortedSet<Identifier> projectDependencies(Project project) {
        return projectDependencies(project, -1, MATCH_ALL);
    }

    /**
     * Returns the dependencies of the given package in the given project. The package may occur
     * multiple times in the project's dependency trees with different dependencies; the result is the
     * union over all occurrences. Depth and matcher apply relative to each occurrence.
     */
    default Set<Identifier> packageDependencies(Project project, Identifier packageId, int maxDepth,
                                                DependencyMatcher matcher) {
        Objects.requireNonNull(packageId, "packageId cannot be null");
        Set<Identifier> dependencies = new LinkedHashSet<>();

        for (String scope : scopeNames(project)) {
            directDependencies(project, scope)
                    .forEach(node -> DependencyTraversals.collectPackageDependencies(
                            node, packageId, maxDepth, matcher, dependencies));
        }

        return dependencies;
    }

    default Set<Identifier> packageDependencies(Project project, Identifier packageId) {
        return packageDependencies(project, packageId, -1, MATCH_ALL);
    }

    /**
     * Returns the identifiers of the sub-projects the given project depends on.
     */
    default SortedSet<Identifier> collectSubProjects(Project project) {
        return collectDependencies(
                scopeDependencies(project, -1, DependencyMatcher.linkageIn(PackageLinkage.PROJECT_LINKAGE)));
    }

    /**
     * Returns the shortest path from the root of each scope to each of its dependencies. A path is the
     * list of the identifiers of all intermediate packages; it is empty for direct dependencies.
     *
     * @throws ResolutionException if a dependency of a scope could not be reached by the traversal
     */
    default Map<String, Map<Identifier, List<Identifier>>> getShortestPaths(Project project) {
        Map<String, Set<Identifier>> scopeDependencies = scopeDependencies(project);
        Map<String, Map<Identifier, List<Identifier>>> result = new LinkedHashMap<>();

        for (String scope : scopeNames(project)) {
            result.put(scope, DependencyTraversals.shortestPaths(directDependencies(project, scope),
                    scopeDependencies.getOrDefault(scope, Collections.emptySet())));
        }

        return result;
    }

    /**
     * Returns the depth of the dependency tree of the given scope. A scope without dependencies has
     * depth 0, a scope with only direct dependencies depth 1.
     */
    default int dependencyTreeDepth(Project project, String scopeName) {
        return DependencyTraversals.treeDepth(directDependencies(project, scopeName));
    }

    /**
     * Returns the issues found on the dependencies of the given project, grouped by the identifier of
     * the affected package.
     */
    default Map<Identifier, Set<Issue>> projectIssues(Project project) {
        Map<Identifier, Set<Issue>> result = new TreeMap<>();

        for (String scope : scopeNames(project)) {
            DependencyTraversals.collectIssues(directDependencies(project, scope), result);
        }

        return result;
    }
}
