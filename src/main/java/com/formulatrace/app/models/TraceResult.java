package com.formulatrace.app.models;

import java.util.List;

/**
 * Outcome of one trace call.
 * root is null only when a precedents trace targets a cell without a formula.
 */
public class TraceResult {
    private final String target;
    private final DependencyNode root;
    private final TraceMode mode;
    private final int maxDepth;
    private final int nodeCount;
    private final int edgeCount;
    private final TraceSource source;
    private final boolean truncated;
    private final List<String> skippedSheets;

    public TraceResult(String target, DependencyNode root, TraceMode mode, int maxDepth,
                       TraceSummary summary, TraceSource source, boolean truncated,
                       List<String> skippedSheets) {
        this.target = target;
        this.root = root;
        this.mode = mode;
        this.maxDepth = maxDepth;
        this.nodeCount = summary.getNodeCount();
        this.edgeCount = summary.getEdgeCount();
        this.source = source;
        this.truncated = truncated;
        this.skippedSheets = List.copyOf(skippedSheets);
    }

    /**
     * Result for a precedents trace whose target holds a plain value or nothing.
     */
    public static TraceResult noFormula(String target, TraceMode mode, int maxDepth) {
        return new TraceResult(target, null, mode, maxDepth, new TraceSummary(0, 0),
                TraceSource.NONE, false, List.of());
    }

    public String getTarget() {
        return target;
    }

    public DependencyNode getRoot() {
        return root;
    }

    public TraceMode getMode() {
        return mode;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public int getEdgeCount() {
        return edgeCount;
    }

    public TraceSource getSource() {
        return source;
    }

    public boolean isTruncated() {
        return truncated;
    }

    /**
     * Sheets left out of a dependents scan for budget reasons. Non-empty
     * implies truncated.
     */
    public List<String> getSkippedSheets() {
        return skippedSheets;
    }

    public boolean hasRoot() {
        return root != null;
    }

    /**
     * Explanation shown when there is nothing to trace, otherwise null.
     */
    public String getMessage() {
        if (root != null) {
            return null;
        }
        return target + " has no formula (direct value or empty).";
    }
}
