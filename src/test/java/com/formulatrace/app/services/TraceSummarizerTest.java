package com.formulatrace.app.services;

import com.formulatrace.app.models.CellSnapshot;
import com.formulatrace.app.models.DependencyNode;
import com.formulatrace.app.models.TraceSummary;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TraceSummarizerTest {

    @Test
    void testCountsNodesAndEdges() {
        DependencyNode root = new DependencyNode("Sheet1!D10", 42, null, "=B10+C10");
        DependencyNode c10 = new DependencyNode("Sheet1!C10", 22, null, "=C5+C6");
        c10.addChild(new DependencyNode("Sheet1!C5", 10, null, null));
        root.addChild(new DependencyNode("Sheet1!B10", 20, null, null));
        root.addChild(c10);

        assertEquals(new TraceSummary(4, 3), TraceSummarizer.summarize(root));
    }

    @Test
    void testCircularMarkerCountsAsNodeAndEdge() {
        DependencyNode a1 = new DependencyNode("Sheet1!A1", null, null, "=B1+1");
        DependencyNode b1 = new DependencyNode("Sheet1!B1", null, null, "=A1+1");
        b1.addChild(DependencyNode.circular(new CellSnapshot("Sheet1!A1", null, "=B1+1", null)));
        a1.addChild(b1);

        assertEquals(new TraceSummary(3, 2), TraceSummarizer.summarize(a1));
    }

    @Test
    void testNullRoot() {
        assertEquals(new TraceSummary(0, 0), TraceSummarizer.summarize(null));
    }
}
