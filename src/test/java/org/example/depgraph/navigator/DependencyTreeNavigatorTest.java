package org.example.depgraph.navigator;

import org.example.depgraph.model.DependencyMatcher;
import org.example.depgraph.model.DependencyNode;
import org.example.depgraph.model.Identifier;
import org.example.depgraph.model.Issue;
import org.example.depgraph.model.Project;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;
import static org.example.depgraph.navigator.GraphFixtures.*;

/**
 * Unit tests for DependencyTreeNavigator.
 */
class DependencyTreeNavigatorTest {

    private DependencyTreeNavigator navigator;
    private Project project;

    @BeforeEach
    void setUp() {
        navigator = new DependencyTreeNavigator();
        project = diamondTreeProject();
    }

    @Test
    @DisplayName("should return scope names in declared order")
    void shouldReturnScopeNames() {
        assertThat(navigator.scopeNames(project)).containsExactly("compile", "test");
    }

    @Test
    @DisplayName("should return direct dependencies in declared order")
    void shouldReturnDirectDependencies() {
        List<Identifier> ids = navigator.directDependencies(project, "compile")
                .map(DependencyNode::getId)
                .collect(Collectors.toList());

        assertThat(ids).containsExactly(A, B);
    }

    @Test
    @DisplayName("should return an empty stream for an unknown scope")
    void shouldReturnEmptyStreamForUnknownScope() {
        assertThat(navigator.directDependencies(project, "provided")).isEmpty();
    }

    @Test
    @DisplayName("should reject a null project")
    void shouldRejectNullProject() {
        assertThatThrownBy(() -> navigator.scopeNames(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessage("project cannot be null");
    }

    @Nested
    @DisplayName("Consistency with DependencyGraphNavigator")
    class Consistency {

        private DependencyGraphNavigator graphNavigator;

        @BeforeEach
        void setUp() {
            graphNavigator = new DependencyGraphNavigator(Map.of(MANAGER, diamondGraph()));
        }

        @ParameterizedTest(name = "maxDepth = {0}")
        @ValueSource(ints = {-1, 0, 1, 2, 3, 4})
        @DisplayName("should find the same scope dependencies")
        void shouldFindSameScopeDependencies(int maxDepth) {
            assertThat(navigator.scopeDependencies(project, maxDepth))
                    .isEqualTo(graphNavigator.scopeDependencies(PROJECT, maxDepth));
        }

        @Test
        @DisplayName("should find the same package dependencies")
        void shouldFindSamePackageDependencies() {
            Set<Identifier> fromTree = navigator.packageDependencies(project, D);

            assertThat(fromTree)
                    .isEqualTo(graphNavigator.packageDependencies(PROJECT, D))
                    .containsExactlyInAnyOrder(E, F);
        }

        @Test
        @DisplayName("should find the same shortest paths")
        void shouldFindSameShortestPaths() {
            Map<String, Map<Identifier, List<Identifier>>> fromTree = navigator.getShortestPaths(project);

            assertThat(fromTree).isEqualTo(graphNavigator.getShortestPaths(PROJECT));
            assertThat(fromTree.get("compile").get(F)).containsExactly(A, C, D);
        }

        @Test
        @DisplayName("should find the same issues")
        void shouldFindSameIssues() {
            Map<Identifier, Set<Issue>> fromTree = navigator.projectIssues(project);

            assertThat(fromTree).isEqualTo(graphNavigator.projectIssues(PROJECT));
            assertThat(fromTree).containsOnlyKeys(D);
        }

        @Test
        @DisplayName("should compute the same tree depth")
        void shouldComputeSameTreeDepth() {
            assertThat(navigator.dependencyTreeDepth(project, "compile"))
                    .isEqualTo(graphNavigator.dependencyTreeDepth(PROJECT, "compile"))
                    .isEqualTo(4);
        }

        @Test
        @DisplayName("should apply matchers the same way")
        void shouldApplyMatchersTheSameWay() {
            DependencyMatcher notD = DependencyMatcher.idEquals(D).negate();

            assertThat(navigator.scopeDependencies(project, -1, notD))
                    .isEqualTo(graphNavigator.scopeDependencies(PROJECT, -1, notD));
        }
    }

    @Test
    @DisplayName("should find no sub-projects in plain trees")
    void shouldFindNoSubProjects() {
        assertThat(navigator.collectSubProjects(project)).isEmpty();
    }
}
