package com.photo.panogroup.core.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 重叠图连通分量
 * <p>
 * 对每个未访问节点做一次基于栈的遍历，收集可达节点为一个分量，直到所有节点都被访问。
 * 每个节点恰好访问一次；孤立节点自成单元素分量。
 * 节点按标识顺序遍历、分量内排序，相同输入得到相同输出。
 */
public class ComponentGrouper {

    public List<List<String>> group(OverlapGraph graph) {
        List<List<String>> components = new ArrayList<>();
        Set<String> visited = new HashSet<>();

        for (String start : graph.nodes()) {
            if (!visited.add(start)) {
                continue;
            }
            List<String> component = new ArrayList<>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                String node = stack.pop();
                component.add(node);
                for (String next : graph.overlaps(node)) {
                    if (visited.add(next)) {
                        stack.push(next);
                    }
                }
            }
            Collections.sort(component);
            components.add(Collections.unmodifiableList(component));
        }
        return components;
    }
}
