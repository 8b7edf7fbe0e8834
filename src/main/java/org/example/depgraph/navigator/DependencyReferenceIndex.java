package org.example.depgraph.navigator;

import org.example.depgraph.exception.ResolutionException;
import org.example.depgraph.model.DependencyGraph;
import org.example.depgraph.model.DependencyReference;
import org.example.depgraph.model.RootDependencyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Allows fast access to the {@link DependencyReference}s of a {@link DependencyGraph} by their
 * package index and fragment.
 *
 * <p>The lookup structure is a list indexed by package index. Each slot lists the references of that
 * package for all its fragments. It is built on first access by walking the whole graph from all scope
 * roots. A reference reachable via multiple parents is added once per parent, so a slot may contain
 * duplicates; lookups select by fragment.</p>
 *
 * <p>Initialization is safe under concurrent first access: racing threads may each compute the
 * structure, but only the first result is published and all callers use that one.</p>
 */
final class DependencyReferenceIndex {

    private static final Logger log = LoggerFactory.getLogger(DependencyReferenceIndex.class);

    private final String manager;
    private final DependencyGraph graph;
    private final AtomicReference<List<List<DependencyReference>>> mapping = new AtomicReference<>();

    DependencyReferenceIndex(String manager, DependencyGraph graph) {
        this.manager = manager;
        this.graph = graph;
    }

    /**
     * Returns the reference with the given package index and fragment.
     *
     * @throws ResolutionException if the graph contains no such reference
     */
    DependencyReference resolve(int pkgIndex, int fragment) {
        for (DependencyReference ref : referencesFor(pkgIndex)) {
            if (ref.getFragment() == fragment) {
                return ref;
            }
        }

        log.error("Unresolvable reference in graph for package manager '{}': index = {}, fragment = {}",
                manager, pkgIndex, fragment);
        throw new ResolutionException(String.format(
                "Could not resolve a DependencyReference for package manager '%s' with index = %d and fragment %d.",
                manager, pkgIndex, fragment));
    }

    /**
     * Returns the reference a scope root points to.
     *
     * @throws ResolutionException if the graph contains no such reference
     */
    DependencyReference resolve(RootDependencyIndex rootIndex) {
        return resolve(rootIndex.getRoot(), rootIndex.getFragment());
    }

    /**
     * Returns the references stored for the given package index, possibly containing duplicates. An
     * index outside of the catalog yields an empty list.
     */
    List<DependencyReference> referencesFor(int pkgIndex) {
        List<List<DependencyReference>> refs = mapping();
        if (pkgIndex < 0 || pkgIndex >= refs.size()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(refs.get(pkgIndex));
    }

    private List<List<DependencyReference>> mapping() {
        List<List<DependencyReference>> current = mapping.get();
        if (current != null) {
            return current;
        }

        mapping.compareAndSet(null, build());
        return mapping.get();
    }

    private List<List<DependencyReference>> build() {
        long start = System.currentTimeMillis();
        int packageCount = graph.getPackageCount();
        List<List<DependencyReference>> refs = new ArrayList<>(packageCount);
        for (int i = 0; i < packageCount; i++) {
            refs.add(new ArrayList<>());
        }

        int count = 0;
        for (DependencyReference root : graph.getScopeRoots()) {
            count += addReference(refs, root);
        }

        log.debug("Built reference index for package manager '{}' with {} entries for {} packages in {}ms",
                manager, count, packageCount, System.currentTimeMillis() - start);
        return refs;
    }

    private int addReference(List<List<DependencyReference>> refs, DependencyReference ref) {
        if (ref.getPkg() < 0 || ref.getPkg() >= refs.size()) {
            throw new ResolutionException(String.format(
                    "DependencyReference in graph for package manager '%s' points to index %d outside of "
                            + "the package catalog of size %d.", manager, ref.getPkg(), refs.size()));
        }

        refs.get(ref.getPkg()).add(ref);
        int count = 1;
        for (DependencyReference dependency : ref.getDependencies()) {
            count += addReference(refs, dependency);
        }
        return count;
    }
}
