package org.example.depgraph.navigator;

import org.example.depgraph.exception.ResolutionException;
import org.example.depgraph.model.DependencyMatcher;
import org.example.depgraph.model.DependencyNode;
import org.example.depgraph.model.Identifier;
import org.example.depgraph.model.Issue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The traversal algorithms behind the queries of {@link DependencyNavigator}.
 *
 * <p>All algorithms work on streams of possibly aliased {@link DependencyNode}s. A node is only
 * accessed while the stream is positioned on it; nodes that are kept are replaced by their stable
 * reference first.</p>
 */
final class DependencyTraversals {

    private DependencyTraversals() {
    }

    /**
     * Traverses the given nodes recursively up to the given depth and adds the identifiers of all
     * nodes accepted by the matcher to {@code ids}.
     */
    static void collectDependencies(Stream<DependencyNode> nodes, int maxDepth, DependencyMatcher matcher,
                                    Set<Identifier> ids) {
        if (maxDepth == 0) {
            return;
        }

        nodes.forEach(node -> {
            if (matcher.matches(node)) {
                ids.add(node.getId());
            }

            node.visitDependencies(children -> {
                collectDependencies(children, maxDepth - 1, matcher, ids);
                return null;
            });
        });
    }

    /**
     * Searches the tree below the given node for occurrences of a package and collects the
     * dependencies of every occurrence found.
     */
    static void collectPackageDependencies(DependencyNode node, Identifier packageId, int maxDepth,
                                           DependencyMatcher matcher, Set<Identifier> ids) {
        if (node.getId().equals(packageId)) {
            node.visitDependencies(children -> {
                collectDependencies(children, maxDepth, matcher, ids);
                return null;
            });
        }

        node.visitDependencies(children -> {
            children.forEach(child -> collectPackageDependencies(child, packageId, maxDepth, matcher, ids));
            return null;
        });
    }

    /**
     * Computes the shortest paths to the given target identifiers using a breadth-first search
     * starting at the direct dependencies of a scope.
     *
     * @throws ResolutionException if not all targets are reached
     */
    static SortedMap<Identifier, List<Identifier>> shortestPaths(Stream<DependencyNode> directDependencies,
                                                                 Set<Identifier> targetIds) {
        Set<Identifier> remainingIds = new HashSet<>(targetIds);
        Queue<PathItem> queue = new ArrayDeque<>();
        SortedMap<Identifier, List<Identifier>> result = new TreeMap<>();

        directDependencies.forEach(node ->
                queue.offer(new PathItem(node.getStableReference(), Collections.emptyList())));

        while (!queue.isEmpty()) {
            PathItem item = queue.poll();
            Identifier id = item.node.getId();

            if (remainingIds.remove(id)) {
                result.put(id, item.parents);
            }

            List<Identifier> parents = new ArrayList<>(item.parents.size() + 1);
            parents.addAll(item.parents);
            parents.add(id);
            List<Identifier> childParents = Collections.unmodifiableList(parents);

            item.node.visitDependencies(children -> {
                children.forEach(child -> queue.offer(new PathItem(child.getStableReference(), childParents)));
                return null;
            });
        }

        if (!remainingIds.isEmpty()) {
            throw new ResolutionException("Could not find the shortest path for these dependencies: " +
                    remainingIds.stream()
                            .sorted()
                            .map(Identifier::toCoordinates)
                            .collect(Collectors.joining(", ")));
        }

        return result;
    }

    /**
     * Returns the length of the longest chain of dependencies starting at the given nodes.
     */
    static int treeDepth(Stream<DependencyNode> nodes) {
        return nodes.mapToInt(node -> 1 + node.<Integer>visitDependencies(DependencyTraversals::treeDepth))
                .max()
                .orElse(0);
    }

    /**
     * Collects the issues of the given nodes and all their dependencies.
     */
    static void collectIssues(Stream<DependencyNode> nodes, Map<Identifier, Set<Issue>> result) {
        nodes.forEach(node -> {
            if (!node.getIssues().isEmpty()) {
                result.computeIfAbsent(node.getId(), id -> new LinkedHashSet<>()).addAll(node.getIssues());
            }

            node.visitDependencies(children -> {
                collectIssues(children, result);
                return null;
            });
        });
    }

    /**
     * An entry in the queue of the shortest path search: a stable node and the identifiers of its
     * ancestors.
     */
    private static final class PathItem {
        private final DependencyNode node;
        private final List<Identifier> parents;

        PathItem(DependencyNode node, List<Identifier> parents) {
            this.node = node;
            this.parents = parents;
        }
    }
}
