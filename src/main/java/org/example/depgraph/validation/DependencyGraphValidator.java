package org.example.depgraph.validation;

import org.example.depgraph.exception.ConfigurationException;
import org.example.depgraph.model.DependencyGraph;
import org.example.depgraph.model.DependencyReference;
import org.example.depgraph.model.RootDependencyIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates the structure of a {@link DependencyGraph} delivered by the analyzer.
 *
 * <p>Navigation trusts the graph to be well-formed and fails hard on violations. This validator allows
 * checking a graph up front and reports all problems at once:</p>
 * <ul>
 *   <li>references pointing outside the package catalog,</li>
 *   <li>scope roots without a matching reference,</li>
 *   <li>multiple distinct reference objects for the same package index and fragment.</li>
 * </ul>
 *
 * <p>Cycles cannot occur, because a {@link DependencyReference} receives its dependencies on
 * construction.</p>
 */
public class DependencyGraphValidator {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphValidator.class);

    /**
     * Validates the given graph.
     *
     * @param graph the graph to validate
     * @return list of validation errors (empty if valid)
     */
    public List<String> validate(DependencyGraph graph) {
        List<String> errors = new ArrayList<>();

        Map<RootDependencyIndex, DependencyReference> references = new HashMap<>();
        Set<DependencyReference> visited = Collections.newSetFromMap(new IdentityHashMap<>());

        for (DependencyReference root : graph.getScopeRoots()) {
            validateReference(graph, root, references, visited, errors);
        }

        validateScopes(graph, references, errors);

        log.debug("Validated {}: {} error(s)", graph, errors.size());
        return errors;
    }

    /**
     * Validates the given graph and throws an exception if it is invalid.
     *
     * @param graph the graph to validate
     * @throws ConfigurationException if validation fails
     */
    public void validateOrThrow(DependencyGraph graph) {
        List<String> errors = validate(graph);
        if (!errors.isEmpty()) {
            throw new ConfigurationException(
                    "Invalid dependency graph:\n- " + String.join("\n- ", errors),
                    errors
            );
        }
    }

    private void validateReference(DependencyGraph graph, DependencyReference ref,
                                   Map<RootDependencyIndex, DependencyReference> references,
                                   Set<DependencyReference> visited, List<String> errors) {
        if (!visited.add(ref)) {
            return;
        }

        if (ref.getPkg() < 0 || ref.getPkg() >= graph.getPackageCount()) {
            errors.add(String.format("Reference points to index %d outside of the package catalog of size %d",
                    ref.getPkg(), graph.getPackageCount()));
        }

        RootDependencyIndex key = new RootDependencyIndex(ref.getPkg(), ref.getFragment());
        DependencyReference existing = references.putIfAbsent(key, ref);
        if (existing != null && existing != ref) {
            errors.add(String.format("Multiple references exist for index %d, fragment %d", ref.getPkg(),
                    ref.getFragment()));
        }

        for (DependencyReference dependency : ref.getDependencies()) {
            validateReference(graph, dependency, references, visited, errors);
        }
    }

    private void validateScopes(DependencyGraph graph, Map<RootDependencyIndex, DependencyReference> references,
                                List<String> errors) {
        graph.getScopes().forEach((scopeName, roots) -> {
            for (RootDependencyIndex root : roots) {
                if (!references.containsKey(root)) {
                    errors.add(String.format("Scope '%s' has unresolvable root: index %d, fragment %d",
                            scopeName, root.getRoot(), root.getFragment()));
                }
            }
        });
    }
}
