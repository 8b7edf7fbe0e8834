package org.example.depgraph.navigator;

import org.example.depgraph.model.DependencyNode;
import org.example.depgraph.model.Project;
import org.example.depgraph.model.Scope;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A {@link DependencyNavigator} implementation for projects that store their dependencies directly as
 * trees of {@link Scope}s.
 */
public class DependencyTreeNavigator implements DependencyNavigator {

    @Override
    public Set<String> scopeNames(Project project) {
        Objects.requireNonNull(project, "project cannot be null");
        Set<String> names = new LinkedHashSet<>();
        for (Scope scope : project.getScopes()) {
            names.add(scope.getName());
        }
        return Collections.unmodifiableSet(names);
    }

    @Override
    public Stream<DependencyNode> directDependencies(Project project, String scopeName) {
        Objects.requireNonNull(project, "project cannot be null");
        return project.getScopes().stream()
                .filter(scope -> scope.getName().equals(scopeName))
                .findFirst()
                .map(scope -> scope.getDependencies().stream().map(DependencyNode.class::cast))
                .orElseGet(Stream::empty);
    }
}
