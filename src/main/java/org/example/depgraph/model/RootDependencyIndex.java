package org.example.depgraph.model;

import java.util.Objects;

/**
 * Points to the root of a dependency tree in a {@link DependencyGraph}.
 * Consists of the index of the package in the catalog and the fragment of the occurrence.
 */
public final class RootDependencyIndex {

    private final int root;
    private final int fragment;

    public RootDependencyIndex(int root, int fragment) {
        this.root = root;
        this.fragment = fragment;
    }

    /**
     * Creates a root index for the default fragment 0.
     */
    public static RootDependencyIndex of(int root) {
        return new RootDependencyIndex(root, 0);
    }

    public int getRoot() {
        return root;
    }

    public int getFragment() {
        return fragment;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RootDependencyIndex that = (RootDependencyIndex) o;
        return root == that.root && fragment == that.fragment;
    }

    @Override
    public int hashCode() {
        return Objects.hash(root, fragment);
    }

    @Override
    public String toString() {
        return "RootDependencyIndex{root=" + root + ", fragment=" + fragment + "}";
    }
}
