package org.example.depgraph.model;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * A view on a single dependency while navigating a dependency tree, independent of the way the
 * dependency information is stored.
 *
 * <p><strong>Aliasing:</strong> implementations may reuse a single instance for all elements of a
 * stream of siblings. A node obtained from such a stream is only valid until the stream advances.
 * Callers that need to keep a node beyond that point must call {@link #getStableReference()}.</p>
 */
public interface DependencyNode {

    /**
     * Returns the identifier of the package this node refers to.
     */
    Identifier getId();

    /**
     * Returns the linkage of this dependency.
     */
    PackageLinkage getLinkage();

    /**
     * Returns the issues encountered when resolving this dependency.
     */
    List<Issue> getIssues();

    /**
     * Invokes the given function with a stream of the direct dependencies of this node and returns
     * its result. The stream must not be used after the function returns.
     *
     * @param block the function consuming the dependencies
     * @param <T>   the result type
     * @return the result of the function
     */
    <T> T visitDependencies(Function<Stream<DependencyNode>, T> block);

    /**
     * Returns a node for the same dependency that is not affected by further traversal and can be
     * stored safely.
     */
    DependencyNode getStableReference();
}
