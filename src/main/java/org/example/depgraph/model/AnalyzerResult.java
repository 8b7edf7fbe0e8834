package org.example.depgraph.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The output of the dependency analysis: the analyzed projects and the shared dependency graphs,
 * keyed by the name of the package manager that produced them.
 */
public class AnalyzerResult {

    private final Set<Project> projects;
    private final Map<String, DependencyGraph> dependencyGraphs;

    public AnalyzerResult(Set<Project> projects, Map<String, DependencyGraph> dependencyGraphs) {
        this.projects = projects != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(projects))
                : Collections.emptySet();
        this.dependencyGraphs = dependencyGraphs != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(dependencyGraphs))
                : Collections.emptyMap();
    }

    public Set<Project> getProjects() {
        return projects;
    }

    public Map<String, DependencyGraph> getDependencyGraphs() {
        return dependencyGraphs;
    }

    /**
     * Returns whether the dependencies of this result are stored in the dependency graph format.
     */
    public boolean usesDependencyGraphs() {
        return !dependencyGraphs.isEmpty();
    }

    /**
     * Finds a project by its identifier.
     */
    public Optional<Project> findProject(Identifier id) {
        return projects.stream()
                .filter(p -> p.getId().equals(id))
                .findFirst();
    }

    @Override
    public String toString() {
        return "AnalyzerResult{projects=" + projects.size() +
               ", dependencyGraphs=" + dependencyGraphs.keySet() + "}";
    }
}
