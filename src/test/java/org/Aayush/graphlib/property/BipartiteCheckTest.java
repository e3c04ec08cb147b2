package org.Aayush.graphlib.property;

import it.unimi.dsi.fastutil.ints.IntList;
import org.Aayush.graphlib.graph.Edge;
import org.Aayush.graphlib.graph.Graph;
import org.Aayush.graphlib.testutil.GraphFixtures;
import org.Aayush.graphlib.weight.WeightTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Random;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BipartiteCheck Tests")
class BipartiteCheckTest {

    @Test
    @DisplayName("Triangle is not bipartite")
    void testTriangle() {
        Graph<Integer> graph = GraphFixtures.createUndirected(3, new int[][]{
                {0, 1, 1},
                {1, 2, 1},
                {2, 0, 1}
        }).graph();

        assertFalse(BipartiteCheck.isBipartite(graph));
        assertFalse(BipartiteCheck.isComponentBipartite(graph, 0));
        assertTrue(BipartiteCheck.twoColoring(graph).isEmpty());
    }

    @Test
    @DisplayName("Even cycle is bipartite with alternating sides")
    void testEvenCycle() {
        Graph<Integer> graph = GraphFixtures.createUndirected(4, new int[][]{
                {0, 1, 1},
                {1, 2, 1},
                {2, 3, 1},
                {3, 0, 1}
        }).graph();

        TwoColoring coloring = BipartiteCheck.twoColoring(graph).orElseThrow();

        assertTrue(BipartiteCheck.isBipartite(graph));
        assertEquals(IntList.of(0, 2), coloring.side(0));
        assertEquals(IntList.of(1, 3), coloring.side(1));
        assertEquals(2, coloring.sideSize(1));
    }

    @Test
    @DisplayName("Odd cycle in another component only fails the whole-graph check")
    void testOddCycleElsewhere() {
        Graph<Integer> graph = GraphFixtures.createUndirected(5, new int[][]{
                {0, 1, 1},
                {2, 3, 1},
                {3, 4, 1},
                {4, 2, 1}
        }).graph();

        assertTrue(BipartiteCheck.isComponentBipartite(graph, 0));
        assertFalse(BipartiteCheck.isComponentBipartite(graph, 3));
        assertFalse(BipartiteCheck.isBipartite(graph));
    }

    @Test
    @DisplayName("Every component root starts with color 0")
    void testComponentRoots() {
        Graph<Integer> graph = GraphFixtures.createUndirected(4, new int[][]{
                {1, 0, 1},
                {3, 2, 1}
        }).graph();

        TwoColoring coloring = BipartiteCheck.twoColoring(graph).orElseThrow();

        assertEquals(0, coloring.colorOf(0));
        assertEquals(1, coloring.colorOf(1));
        assertEquals(0, coloring.colorOf(2));
        assertEquals(1, coloring.colorOf(3));
        assertEquals(4, coloring.vertexCount());
    }

    @Test
    @DisplayName("Empty and edgeless graphs are bipartite")
    void testTrivialGraphs() {
        assertTrue(BipartiteCheck.isBipartite(Graph.create(0, WeightTypes.INTEGER)));

        TwoColoring coloring = BipartiteCheck.twoColoring(Graph.create(3, WeightTypes.INTEGER)).orElseThrow();
        assertEquals(3, coloring.sideSize(0));
        assertEquals(0, coloring.sideSize(1));
    }

    @Test
    @DisplayName("Self-loop is an odd cycle")
    void testSelfLoop() {
        Graph<Integer> graph = Graph.create(2, WeightTypes.INTEGER);
        graph.addEdge(0, 1).addEdge(1, 1);
        assertFalse(BipartiteCheck.isBipartite(graph));
    }

    @Test
    @DisplayName("Invalid arguments fail fast")
    void testContracts() {
        Graph<Integer> graph = Graph.create(2, WeightTypes.INTEGER);
        assertThrows(IndexOutOfBoundsException.class, () -> BipartiteCheck.isComponentBipartite(graph, 2));

        TwoColoring coloring = BipartiteCheck.twoColoring(graph).orElseThrow();
        assertThrows(IllegalArgumentException.class, () -> coloring.side(2));
        assertThrows(IndexOutOfBoundsException.class, () -> coloring.colorOf(-1));
    }

    @ParameterizedTest(name = "seed={0}")
    @ValueSource(longs = {4L, 40L, 400L})
    @DisplayName("Returned colorings are proper")
    void testColoringIsProper(long seed) {
        Random random = new Random(seed);
        for (int round = 0; round < 30; round++) {
            int vertexCount = 2 + random.nextInt(20);
            Graph<Integer> graph = Graph.create(vertexCount, WeightTypes.INTEGER);
            // Edges only between even and odd ids keep the graph bipartite.
            for (int i = 0; i < vertexCount * 2; i++) {
                int even = 2 * random.nextInt((vertexCount + 1) / 2);
                int odd = 2 * random.nextInt(vertexCount / 2) + 1;
                graph.addEdge(even, odd);
            }

            TwoColoring coloring = BipartiteCheck.twoColoring(graph).orElseThrow();

            for (int v = 0; v < vertexCount; v++) {
                for (Edge<Integer> edge : graph.edgesFrom(v)) {
                    assertNotEquals(coloring.colorOf(edge.from()), coloring.colorOf(edge.to()));
                }
            }
            assertEquals(vertexCount, coloring.sideSize(0) + coloring.sideSize(1));
        }
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("Long paths are handled without recursion")
    void testDeepPath() {
        int n = 100_000;
        Graph<Integer> graph = Graph.create(n, WeightTypes.INTEGER);
        for (int v = 0; v + 1 < n; v++) {
            graph.addEdge(v, v + 1);
        }

        assertTrue(BipartiteCheck.isBipartite(graph));
        graph.addEdge(0, 2);
        assertFalse(BipartiteCheck.isBipartite(graph));
    }
}
