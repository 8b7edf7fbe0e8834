package org.example.depgraph.navigator;

import org.example.depgraph.exception.ConfigurationException;
import org.example.depgraph.model.AnalyzerResult;
import org.example.depgraph.model.DependencyGraph;
import org.example.depgraph.model.DependencyNode;
import org.example.depgraph.model.DependencyReference;
import org.example.depgraph.model.Project;
import org.example.depgraph.model.RootDependencyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A {@link DependencyNavigator} implementation based on the dependency graph format. It obtains the
 * dependencies of a project from the shared {@link DependencyGraph} of the package manager that
 * produced the project.
 *
 * <p>The graphs are not copied. The only state this navigator adds is a lazily built
 * {@link DependencyReferenceIndex} per graph, which is safe to initialize concurrently.</p>
 */
public class DependencyGraphNavigator implements DependencyNavigator {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphNavigator.class);

    private final Map<String, DependencyGraph> graphs;
    private final Map<String, DependencyReferenceIndex> referenceIndices;

    /**
     * Creates a navigator for the dependency graphs contained in the given result.
     *
     * @throws ConfigurationException if the result contains no dependency graphs
     */
    public DependencyGraphNavigator(AnalyzerResult result) {
        this(Objects.requireNonNull(result, "result cannot be null").getDependencyGraphs());
    }

    /**
     * Creates a navigator for the given dependency graphs, keyed by package manager name.
     *
     * @throws ConfigurationException if no graphs are provided
     */
    public DependencyGraphNavigator(Map<String, DependencyGraph> graphs) {
        if (graphs == null || graphs.isEmpty()) {
            throw new ConfigurationException("No dependency graph available to initialize DependencyGraphNavigator.");
        }

        // The graphs are shared with the caller, the mapping of managers is fixed.
        this.graphs = Collections.unmodifiableMap(new LinkedHashMap<>(graphs));

        Map<String, DependencyReferenceIndex> indices = new LinkedHashMap<>();
        this.graphs.forEach((manager, graph) -> indices.put(manager, new DependencyReferenceIndex(manager, graph)));
        this.referenceIndices = Collections.unmodifiableMap(indices);

        log.info("Initialized DependencyGraphNavigator for package managers {}", getManagerNames());
    }

    @Override
    public Set<String> scopeNames(Project project) {
        Objects.requireNonNull(project, "project cannot be null");
        if (project.getScopeNames().isEmpty()) {
            log.debug("Project {} does not declare any scopes", project.getId());
        }
        return project.getScopeNames();
    }

    /**
     * {@inheritDoc}
     *
     * <p>The roots of the scope are resolved before the stream is returned, so unresolvable roots are
     * reported immediately.</p>
     *
     * @throws ConfigurationException if there is no graph for the project's package manager
     * @throws org.example.depgraph.exception.ResolutionException if a root of the scope cannot be resolved
     */
    @Override
    public Stream<DependencyNode> directDependencies(Project project, String scopeName) {
        Objects.requireNonNull(project, "project cannot be null");
        Objects.requireNonNull(scopeName, "scopeName cannot be null");

        String manager = project.getManagerName();
        DependencyGraph graph = graphForManager(manager);
        DependencyReferenceIndex index = referenceIndices.get(manager);

        List<RootDependencyIndex> rootIndices =
                graph.getScopeRootIndices(DependencyGraph.qualifyScope(project, scopeName));
        List<DependencyReference> rootDependencies = new ArrayList<>(rootIndices.size());
        for (RootDependencyIndex root : rootIndices) {
            rootDependencies.add(index.resolve(root));
        }

        return DependencyRefCursor.dependenciesStream(graph, rootDependencies);
    }

    /**
     * Returns the names of the package managers this navigator has graphs for.
     */
    public Set<String> getManagerNames() {
        return graphs.keySet();
    }

    /**
     * Returns the dependency graph for the given package manager.
     *
     * @throws ConfigurationException if there is no graph for this manager or the graph has no packages
     */
    DependencyGraph graphForManager(String manager) {
        DependencyGraph graph = graphs.get(manager);
        if (graph == null || graph.isEmpty()) {
            log.error("No DependencyGraph for package manager '{}' available", manager);
            throw new ConfigurationException("No DependencyGraph for package manager '" + manager + "' available.");
        }
        return graph;
    }
}
