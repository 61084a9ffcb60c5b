package com.photo.panogroup.core.graph;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ComponentGrouperTest {

    private final ComponentGrouper grouper = new ComponentGrouper();

    @Test
    void transitiveOverlapJoinsOneGroup() {
        OverlapGraph graph = OverlapGraph.builder()
                .addEdge("1", "2")
                .addEdge("2", "3")
                .addEdge("4", "5")
                .build();

        List<List<String>> groups = grouper.group(graph);

        assertEquals(List.of(List.of("1", "2", "3"), List.of("4", "5")), groups);
        assertTrue(!graph.hasEdge("1", "3"));
    }

    @Test
    void isolatedNodesBecomeSingletons() {
        OverlapGraph graph = OverlapGraph.builder()
                .addNode("a")
                .addEdge("b", "c")
                .addNode("d")
                .build();

        List<List<String>> groups = grouper.group(graph);

        assertEquals(List.of(List.of("a"), List.of("b", "c"), List.of("d")), groups);
    }

    @Test
    void singleImageYieldsSingleSingleton() {
        OverlapGraph graph = OverlapGraph.builder().addNode("only.jpg").build();

        assertEquals(List.of(List.of("only.jpg")), grouper.group(graph));
    }

    @Test
    void emptyGraphHasNoComponents() {
        assertTrue(grouper.group(OverlapGraph.empty()).isEmpty());
    }

    @Test
    void everyNodeAppearsInExactlyOneComponent() {
        OverlapGraph.Builder builder = OverlapGraph.builder();
        for (int i = 0; i < 40; i++) {
            builder.addNode("n" + i);
        }
        // 链 + 环 + 星形
        for (int i = 0; i < 9; i++) {
            builder.addEdge("n" + i, "n" + (i + 1));
        }
        builder.addEdge("n10", "n11").addEdge("n11", "n12").addEdge("n12", "n10");
        for (int i = 21; i < 30; i++) {
            builder.addEdge("n20", "n" + i);
        }
        OverlapGraph graph = builder.build();

        List<List<String>> groups = grouper.group(graph);

        Set<String> seen = new HashSet<>();
        int total = 0;
        for (List<String> group : groups) {
            seen.addAll(group);
            total += group.size();
        }
        assertEquals(40, total);
        assertEquals(graph.nodes(), seen);
        assertTrue(groups.contains(List.of("n0", "n1", "n2", "n3", "n4", "n5", "n6", "n7", "n8", "n9")));
        assertTrue(groups.contains(List.of("n10", "n11", "n12")));
    }

    @Test
    void repeatedRunsAreIdentical() {
        OverlapGraph graph = OverlapGraph.builder()
                .addEdge("x", "y").addEdge("p", "q").addEdge("q", "r").addNode("z")
                .build();

        assertEquals(grouper.group(graph), grouper.group(graph));
        assertEquals(grouper.group(graph), grouper.group(new OverlapGraph(graph.getAdjacency())));
    }
}
