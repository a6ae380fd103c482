package com.formulatrace.app.models;

/**
 * Node and parent-to-child edge counts of a dependency tree.
 */
public final class TraceSummary {
    private final int nodeCount;
    private final int edgeCount;

    public TraceSummary(int nodeCount, int edgeCount) {
        this.nodeCount = nodeCount;
        this.edgeCount = edgeCount;
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public int getEdgeCount() {
        return edgeCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceSummary)) return false;
        TraceSummary that = (TraceSummary) o;
        return nodeCount == that.nodeCount && edgeCount == that.edgeCount;
    }

    @Override
    public int hashCode() {
        return 31 * nodeCount + edgeCount;
    }

    @Override
    public String toString() {
        return "TraceSummary{nodes=" + nodeCount + ", edges=" + edgeCount + "}";
    }
}
