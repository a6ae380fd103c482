package com.formulatrace.app.services;

import com.formulatrace.app.models.DependencyNode;
import com.formulatrace.app.models.TraceSummary;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Counts nodes and parent-to-child edges of a dependency tree.
 * Circular markers count as nodes and as an edge from their parent.
 */
public final class TraceSummarizer {

    private TraceSummarizer() {
    }

    public static TraceSummary summarize(DependencyNode root) {
        if (root == null) {
            return new TraceSummary(0, 0);
        }
        int nodeCount = 0;
        int edgeCount = 0;
        Deque<DependencyNode> stack = new ArrayDeque<>();
        stack.push(root);

        while (!stack.isEmpty()) {
            DependencyNode node = stack.pop();
            nodeCount++;
            edgeCount += node.getChildren().size();
            for (DependencyNode child : node.getChildren()) {
                stack.push(child);
            }
        }
        return new TraceSummary(nodeCount, edgeCount);
    }
}
