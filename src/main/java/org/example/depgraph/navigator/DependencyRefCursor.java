package org.example.depgraph.navigator;

import org.example.depgraph.model.DependencyGraph;
import org.example.depgraph.model.DependencyNode;
import org.example.depgraph.model.DependencyReference;
import org.example.depgraph.model.Identifier;
import org.example.depgraph.model.Issue;
import org.example.depgraph.model.PackageLinkage;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Supports the efficient traversal of a collection of {@link DependencyReference}s.
 *
 * <p>Only a single instance is created for a collection of sibling references. Like a database cursor,
 * it moves on to the next reference when the stream produced by {@link #asStream()} advances, and
 * implements {@link DependencyNode} by delegating to the current reference. So the references do not
 * have to be wrapped into adapter objects, but every element of the stream is this same instance.</p>
 */
final class DependencyRefCursor implements DependencyNode {

    private final DependencyGraph graph;
    private final Iterator<DependencyReference> references;
    private DependencyReference current;

    /**
     * Creates a cursor that walks over the given references.
     */
    DependencyRefCursor(DependencyGraph graph, Collection<DependencyReference> references) {
        this.graph = graph;
        this.references = references.iterator();
    }

    /**
     * Creates a cursor pinned to a single reference.
     */
    private DependencyRefCursor(DependencyGraph graph, DependencyReference fixed) {
        this.graph = graph;
        this.references = Collections.emptyIterator();
        this.current = fixed;
    }

    /**
     * Returns a stream of nodes for the given references of the graph. Empty collections yield an
     * empty stream without creating a cursor.
     */
    static Stream<DependencyNode> dependenciesStream(DependencyGraph graph,
                                                     Collection<DependencyReference> dependencies) {
        if (dependencies.isEmpty()) {
            return Stream.empty();
        }
        return new DependencyRefCursor(graph, dependencies).asStream();
    }

    /**
     * Returns a node adapting a single reference of the given graph.
     */
    static DependencyNode forReference(DependencyGraph graph, DependencyReference reference) {
        return new DependencyRefCursor(graph, reference);
    }

    @Override
    public Identifier getId() {
        return graph.getPackage(current().getPkg());
    }

    @Override
    public PackageLinkage getLinkage() {
        return current().getLinkage();
    }

    @Override
    public List<Issue> getIssues() {
        return current().getIssues();
    }

    @Override
    public <T> T visitDependencies(Function<Stream<DependencyNode>, T> block) {
        return block.apply(dependenciesStream(graph, current().getDependencies()));
    }

    @Override
    public DependencyNode getStableReference() {
        return new DependencyRefCursor(graph, current());
    }

    /**
     * Returns a stream whose elements all refer to this instance. Each step positions this cursor on
     * the next reference.
     */
    Stream<DependencyNode> asStream() {
        Iterator<DependencyNode> iterator = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return references.hasNext();
            }

            @Override
            public DependencyNode next() {
                if (!references.hasNext()) {
                    throw new NoSuchElementException();
                }
                current = references.next();
                return DependencyRefCursor.this;
            }
        };

        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    private DependencyReference current() {
        if (current == null) {
            throw new IllegalStateException("Cursor is not positioned on a dependency.");
        }
        return current;
    }

    @Override
    public String toString() {
        return current != null
                ? "DependencyRefCursor{" + getId() + ", fragment=" + current.getFragment() + "}"
                : "DependencyRefCursor{unpositioned}";
    }
}
