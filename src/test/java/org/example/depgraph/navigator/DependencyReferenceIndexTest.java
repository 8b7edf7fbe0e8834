package org.example.depgraph.navigator;

import org.example.depgraph.exception.ResolutionException;
import org.example.depgraph.model.DependencyGraph;
import org.example.depgraph.model.DependencyReference;
import org.example.depgraph.model.RootDependencyIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.example.depgraph.navigator.GraphFixtures.*;

/**
 * Unit tests for DependencyReferenceIndex.
 */
class DependencyReferenceIndexTest {

    private DependencyGraph graph;
    private DependencyReferenceIndex index;

    @BeforeEach
    void setUp() {
        graph = diamondGraph();
        index = new DependencyReferenceIndex(MANAGER, graph);
    }

    @Nested
    @DisplayName("Initialization")
    class Initialization {

        @Test
        @DisplayName("should not walk the graph before first access")
        void shouldNotWalkGraphBeforeFirstAccess() {
            DependencyGraph broken = DependencyGraph.builder()
                    .packages(List.of(A))
                    .scopeRoot(DependencyReference.builder(2).build())
                    .build();

            DependencyReferenceIndex lazyIndex = new DependencyReferenceIndex(MANAGER, broken);

            assertThatThrownBy(() -> lazyIndex.referencesFor(0))
                    .isInstanceOf(ResolutionException.class)
                    .hasMessageContaining("points to index 2");
        }

        @Test
        @DisplayName("should return the same references on repeated access")
        void shouldReturnSameReferencesOnRepeatedAccess() {
            assertThat(index.resolve(0, 0)).isSameAs(index.resolve(0, 0));
        }

        @Test
        @DisplayName("should return no references for an index outside of the catalog")
        void shouldReturnNoReferencesOutsideCatalog() {
            assertThat(index.referencesFor(-1)).isEmpty();
            assertThat(index.referencesFor(6)).isEmpty();
        }

        @Test
        @DisplayName("should add shared references once per reaching path")
        void shouldAddSharedReferencesOncePerPath() {
            // e is reached via a and via b -> d#0
            assertThat(index.referencesFor(4)).hasSize(2);
            // d#1 is reached from root a and from root c, d#0 from root b
            assertThat(index.referencesFor(3))
                    .extracting(DependencyReference::getFragment)
                    .containsExactlyInAnyOrder(0, 1, 1);
        }

        @Test
        @DisplayName("should publish the same index to concurrent callers")
        void shouldPublishSameIndexToConcurrentCallers() throws Exception {
            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);

            try {
                List<Future<DependencyReference>> futures = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    Callable<DependencyReference> task = () -> {
                        start.await();
                        return index.resolve(3, 1);
                    };
                    futures.add(executor.submit(task));
                }
                start.countDown();

                DependencyReference expected = futures.get(0).get(5, TimeUnit.SECONDS);
                for (Future<DependencyReference> future : futures) {
                    assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(expected);
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Resolution")
    class Resolution {

        @Test
        @DisplayName("should resolve references by index and fragment")
        void shouldResolveByIndexAndFragment() {
            DependencyReference d0 = index.resolve(3, 0);
            DependencyReference d1 = index.resolve(3, 1);

            assertThat(d0.getDependencies()).extracting(DependencyReference::getPkg).containsExactly(4);
            assertThat(d1.getDependencies()).extracting(DependencyReference::getPkg).containsExactly(5);
            assertThat(d1.getIssues()).containsExactly(D_ISSUE);
        }

        @Test
        @DisplayName("should resolve scope roots")
        void shouldResolveScopeRoots() {
            DependencyReference root = index.resolve(RootDependencyIndex.of(1));

            assertThat(root).isSameAs(graph.getScopeRoots().get(1));
        }

        @Test
        @DisplayName("should fail for an unknown fragment")
        void shouldFailForUnknownFragment() {
            assertThatThrownBy(() -> index.resolve(3, 7))
                    .isInstanceOf(ResolutionException.class)
                    .hasMessageContaining("'Maven'")
                    .hasMessageContaining("index = 3")
                    .hasMessageContaining("fragment 7");
        }

        @Test
        @DisplayName("should fail for an index outside of the catalog")
        void shouldFailForIndexOutsideCatalog() {
            assertThatThrownBy(() -> index.resolve(42, 0))
                    .isInstanceOf(ResolutionException.class)
                    .hasMessageContaining("index = 42");
        }

        @Test
        @DisplayName("should fail when a reference points outside of the catalog")
        void shouldFailWhenReferencePointsOutsideCatalog() {
            DependencyGraph broken = DependencyGraph.builder()
                    .packages(List.of(A))
                    .scopeRoot(DependencyReference.builder(0)
                            .dependency(DependencyReference.builder(3).build())
                            .build())
                    .build();
            DependencyReferenceIndex brokenIndex = new DependencyReferenceIndex(MANAGER, broken);

            assertThatThrownBy(() -> brokenIndex.resolve(0, 0))
                    .isInstanceOf(ResolutionException.class)
                    .hasMessageContaining("points to index 3")
                    .hasMessageContaining("size 1");
        }
    }
}
