package org.example.depgraph.model;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Decides whether a {@link DependencyNode} is included in the result of a navigation query.
 *
 * <p>A matcher only filters results. Dependencies of a node that does not match are still visited.</p>
 */
@FunctionalInterface
public interface DependencyMatcher {

    /**
     * Tests whether the given node is matched.
     */
    boolean matches(DependencyNode node);

    /**
     * Returns a matcher that matches all dependencies.
     */
    static DependencyMatcher matchAll() {
        return node -> true;
    }

    /**
     * Returns a matcher that matches dependencies with one of the given linkages.
     */
    static DependencyMatcher linkageIn(Set<PackageLinkage> linkages) {
        Set<PackageLinkage> allowed = linkages.isEmpty()
                ? EnumSet.noneOf(PackageLinkage.class)
                : EnumSet.copyOf(linkages);
        return node -> allowed.contains(node.getLinkage());
    }

    /**
     * Returns a matcher that matches dependencies referring to the given package.
     */
    static DependencyMatcher idEquals(Identifier id) {
        Objects.requireNonNull(id, "id cannot be null");
        return node -> id.equals(node.getId());
    }

    default DependencyMatcher and(DependencyMatcher other) {
        Objects.requireNonNull(other, "other cannot be null");
        return node -> matches(node) && other.matches(node);
    }

    default DependencyMatcher or(DependencyMatcher other) {
        Objects.requireNonNull(other, "other cannot be null");
        return node -> matches(node) || other.matches(node);
    }

    default DependencyMatcher negate() {
        return node -> !matches(node);
    }
}
