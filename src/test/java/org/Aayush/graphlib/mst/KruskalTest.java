package org.Aayush.graphlib.mst;

import org.Aayush.graphlib.graph.Edge;
import org.Aayush.graphlib.graph.EdgeList;
import org.Aayush.graphlib.testutil.GraphFixtures;
import org.Aayush.graphlib.unionfind.DisjointSet;
import org.Aayush.graphlib.weight.WeightTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Kruskal Tests")
class KruskalTest {

    @Test
    @DisplayName("Scenario graph: MST weight is 6")
    void testScenario() {
        EdgeList<Integer> edges = GraphFixtures.createScenarioFixture().undirectedEdges();

        SpanningForest<Integer> forest = Kruskal.spanningForest(edges, 4);

        assertEquals(6, forest.totalWeight());
        assertEquals(6, Kruskal.totalWeight(edges, 4));
        assertEquals(List.of(Edge.of(0, 2, 1), Edge.of(2, 3, 2), Edge.of(1, 2, 3)), forest.edges());
        assertTrue(forest.isSpanningTree());
    }

    @Test
    @DisplayName("Disconnected input yields a spanning forest")
    void testForest() {
        EdgeList<Integer> edges = EdgeList.create(WeightTypes.INTEGER);
        edges.add(0, 1, 5).add(2, 3, 2).add(3, 2, 1);

        SpanningForest<Integer> forest = Kruskal.spanningForest(edges, 5);

        assertEquals(6, forest.totalWeight());
        assertEquals(2, forest.edges().size());
        assertEquals(3, forest.componentCount(), "Two trees plus isolated vertex 4");
        assertFalse(forest.isSpanningTree());
    }

    @Test
    @DisplayName("Self-loops are never selected and negative weights are allowed")
    void testSelfLoopsAndNegativeWeights() {
        EdgeList<Long> edges = EdgeList.create(WeightTypes.LONG);
        edges.add(0, 0, -10L).add(0, 1, -3L).add(1, 2, 4L).add(0, 2, 7L);

        assertEquals(1L, Kruskal.totalWeight(edges, 3));
    }

    @Test
    @DisplayName("Equal weights keep input order")
    void testStableTies() {
        EdgeList<Integer> edges = EdgeList.create(WeightTypes.INTEGER);
        edges.add(1, 2, 1).add(0, 1, 1).add(0, 2, 1);

        assertEquals(List.of(Edge.of(1, 2, 1), Edge.of(0, 1, 1)), Kruskal.spanningForest(edges, 3).edges());
    }

    @Test
    @DisplayName("Caller's edge list keeps its order")
    void testInputUntouched() {
        EdgeList<Integer> edges = EdgeList.create(WeightTypes.INTEGER);
        edges.add(0, 1, 9).add(1, 2, 1).add(0, 2, 5);
        List<Edge<Integer>> before = List.copyOf(edges.edges());

        Kruskal.totalWeight(edges, 3);

        assertEquals(before, edges.edges());
    }

    @Test
    @DisplayName("Edgeless input has zero weight")
    void testEmpty() {
        SpanningForest<Integer> forest = Kruskal.spanningForest(EdgeList.create(WeightTypes.INTEGER), 3);
        assertEquals(0, forest.totalWeight());
        assertTrue(forest.edges().isEmpty());
        assertEquals(3, forest.componentCount());
    }

    @Test
    @DisplayName("Endpoints beyond the vertex count fail fast")
    void testBounds() {
        EdgeList<Integer> edges = EdgeList.create(WeightTypes.INTEGER);
        edges.add(0, 3, 1);
        assertThrows(IndexOutOfBoundsException.class, () -> Kruskal.totalWeight(edges, 3));
    }

    @ParameterizedTest(name = "seed={0}")
    @ValueSource(longs = {2L, 19L, 77L, 4096L, 65537L})
    @DisplayName("Matches an independent Prim computation on connected graphs")
    void testMatchesPrim(long seed) {
        Random random = new Random(seed);
        for (int round = 0; round < 20; round++) {
            int vertexCount = 1 + random.nextInt(25);
            EdgeList<Integer> edges = EdgeList.create(WeightTypes.INTEGER);
            for (int v = 1; v < vertexCount; v++) {
                edges.add(v, random.nextInt(v), random.nextInt(100));
            }
            int extra = random.nextInt(vertexCount * 2 + 1);
            for (int i = 0; i < extra; i++) {
                edges.add(random.nextInt(vertexCount), random.nextInt(vertexCount), random.nextInt(100));
            }

            SpanningForest<Integer> forest = Kruskal.spanningForest(edges, vertexCount);

            assertEquals(prim(edges, vertexCount), forest.totalWeight(), "seed=" + seed + " round=" + round);
            assertEquals(vertexCount - 1, forest.edges().size());
            assertTrue(forest.isSpanningTree());
            assertForestIsAcyclic(forest, vertexCount);
        }
    }

    private static int prim(EdgeList<Integer> edges, int vertexCount) {
        int[][] lightest = new int[vertexCount][vertexCount];
        for (int[] row : lightest) {
            Arrays.fill(row, Integer.MAX_VALUE);
        }
        for (Edge<Integer> edge : edges.edges()) {
            int w = Math.min(lightest[edge.from()][edge.to()], edge.weight());
            lightest[edge.from()][edge.to()] = w;
            lightest[edge.to()][edge.from()] = w;
        }
        boolean[] inTree = new boolean[vertexCount];
        int[] attach = new int[vertexCount];
        Arrays.fill(attach, Integer.MAX_VALUE);
        attach[0] = 0;
        int total = 0;
        for (int step = 0; step < vertexCount; step++) {
            int next = -1;
            for (int v = 0; v < vertexCount; v++) {
                if (!inTree[v] && (next < 0 || attach[v] < attach[next])) {
                    next = v;
                }
            }
            inTree[next] = true;
            total += attach[next];
            for (int v = 0; v < vertexCount; v++) {
                if (!inTree[v] && lightest[next][v] < attach[v]) {
                    attach[v] = lightest[next][v];
                }
            }
        }
        return total;
    }

    private static void assertForestIsAcyclic(SpanningForest<Integer> forest, int vertexCount) {
        DisjointSet check = DisjointSet.create(vertexCount);
        for (Edge<Integer> edge : forest.edges()) {
            assertTrue(check.unite(edge.from(), edge.to()), "Selected edge closes a cycle: " + edge);
        }
    }
}
