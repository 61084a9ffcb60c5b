package com.photo.panogroup.core.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 无向重叠图：图像标识 → 与之重叠的图像集合
 * <p>
 * 不变式：对称（b ∈ overlap(a) ⇔ a ∈ overlap(b)），无自环。
 * 没有边的图像仍作为孤立节点保留。返回后不可变。
 */
public final class OverlapGraph {

    private final SortedMap<String, SortedSet<String>> adjacency;

    public OverlapGraph(Map<String, ? extends Collection<String>> adjacency) {
        SortedMap<String, SortedSet<String>> copy = new TreeMap<>();
        if (adjacency != null) {
            adjacency.forEach((node, neighbours) -> copy.put(node,
                    Collections.unmodifiableSortedSet(new TreeSet<>(neighbours == null ? Set.of() : neighbours))));
        }
        validateSymmetry(copy);
        this.adjacency = Collections.unmodifiableSortedMap(copy);
    }

    @JsonCreator
    static OverlapGraph fromJson(@JsonProperty("adjacency") Map<String, List<String>> adjacency) {
        return new OverlapGraph(adjacency);
    }

    public static OverlapGraph empty() {
        return new OverlapGraph(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    private static void validateSymmetry(Map<String, SortedSet<String>> adjacency) {
        adjacency.forEach((node, neighbours) -> {
            for (String other : neighbours) {
                if (other.equals(node)) {
                    throw new IllegalArgumentException("Self loop on " + node);
                }
                Set<String> back = adjacency.get(other);
                if (back == null || !back.contains(node)) {
                    throw new IllegalArgumentException("Asymmetric edge " + node + " -> " + other);
                }
            }
        });
    }

    /**
     * 邻接表（按标识排序，只读）
     */
    public SortedMap<String, SortedSet<String>> getAdjacency() {
        return adjacency;
    }

    @JsonIgnore
    public Set<String> nodes() {
        return adjacency.keySet();
    }

    public Set<String> overlaps(String node) {
        SortedSet<String> neighbours = adjacency.get(node);
        return neighbours != null ? neighbours : Collections.emptySortedSet();
    }

    public boolean hasEdge(String a, String b) {
        return overlaps(a).contains(b);
    }

    @JsonIgnore
    public int nodeCount() {
        return adjacency.size();
    }

    @JsonIgnore
    public int edgeCount() {
        int degrees = 0;
        for (SortedSet<String> neighbours : adjacency.values()) {
            degrees += neighbours.size();
        }
        return degrees / 2;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OverlapGraph)) return false;
        return adjacency.equals(((OverlapGraph) o).adjacency);
    }

    @Override
    public int hashCode() {
        return adjacency.hashCode();
    }

    @Override
    public String toString() {
        return "OverlapGraph{" + nodeCount() + " nodes, " + edgeCount() + " edges}";
    }

    /**
     * 增量构建器：只追加，重复加同一条边无副作用；可被多个匹配线程并发调用
     */
    public static final class Builder {
        private final Map<String, SortedSet<String>> adjacency = new TreeMap<>();

        public synchronized Builder addNode(String node) {
            adjacency.computeIfAbsent(node, k -> new TreeSet<>());
            return this;
        }

        public synchronized Builder addEdge(String a, String b) {
            if (a.equals(b)) {
                throw new IllegalArgumentException("Self loop on " + a);
            }
            adjacency.computeIfAbsent(a, k -> new TreeSet<>()).add(b);
            adjacency.computeIfAbsent(b, k -> new TreeSet<>()).add(a);
            return this;
        }

        public synchronized OverlapGraph build() {
            return new OverlapGraph(adjacency);
        }
    }
}
