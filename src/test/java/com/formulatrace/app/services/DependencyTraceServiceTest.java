package com.formulatrace.app.services;

import com.formulatrace.app.config.TraceProperties;
import com.formulatrace.app.datasource.InMemoryWorkbookDataSource;
import com.formulatrace.app.models.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Traversal tests against the in-memory workbook, once with the host
 * index available and once with it reported as unsupported.
 */
class DependencyTraceServiceTest {

    private Workbook workbook;
    private WorkbookService workbookService;
    private TraceProperties properties;

    @BeforeEach
    void setUp() {
        workbook = new Workbook();
        workbookService = new WorkbookService(workbook);
        properties = new TraceProperties();
        workbookService.createSheet("Sheet1");
        workbookService.createSheet("Sheet2");
    }

    private DependencyTraceService tracer(boolean hostIndex) {
        return new DependencyTraceService(
                new InMemoryWorkbookDataSource(workbook, hostIndex),
                new DependentCandidateBuilder(),
                properties);
    }

    private void set(String sheet, String address, String input) {
        workbookService.setCellValue(sheet, address, input, null);
    }

    private static Set<String> childAddresses(DependencyNode node) {
        return node.getChildren().stream().map(DependencyNode::getAddress).collect(Collectors.toSet());
    }

    private static int height(DependencyNode node) {
        int max = 0;
        for (DependencyNode child : node.getChildren()) {
            max = Math.max(max, 1 + height(child));
        }
        return max;
    }

    @Test
    void testPrecedentOfPlainValueIsLeaf() {
        set("Sheet1", "A1", "10");
        set("Sheet1", "B1", "=A1*2");

        for (boolean hostIndex : new boolean[]{true, false}) {
            TraceResult result = tracer(hostIndex).trace("Sheet1!B1", "precedents", 2);

            DependencyNode root = result.getRoot();
            assertEquals("Sheet1!B1", root.getAddress());
            assertEquals("=A1*2", root.getFormula());
            assertEquals(1, root.getChildren().size());

            DependencyNode leaf = root.getChildren().get(0);
            assertEquals("Sheet1!A1", leaf.getAddress());
            assertEquals(10, leaf.getValue());
            assertNull(leaf.getFormula());
            assertTrue(leaf.getChildren().isEmpty());

            assertEquals(2, result.getNodeCount());
            assertEquals(1, result.getEdgeCount());
            assertEquals(hostIndex ? TraceSource.API : TraceSource.FORMULA_SCAN, result.getSource());
            assertFalse(result.isTruncated());
        }
    }

    @Test
    void testCycleEndsInCircularMarker() {
        set("Sheet1", "A1", "=B1+1");
        set("Sheet1", "B1", "=A1+1");

        for (boolean hostIndex : new boolean[]{true, false}) {
            TraceResult result = tracer(hostIndex).trace("Sheet1!A1", "precedents", 3);

            DependencyNode a1 = result.getRoot();
            DependencyNode b1 = a1.getChildren().get(0);
            DependencyNode again = b1.getChildren().get(0);

            assertEquals("Sheet1!B1", b1.getAddress());
            assertEquals("Sheet1!A1", again.getAddress());
            assertTrue(again.isCircular());
            assertEquals(DependencyNode.CIRCULAR_REFERENCE, again.getFormula());
            assertTrue(again.getChildren().isEmpty());
            assertEquals(3, result.getNodeCount());
            assertEquals(2, result.getEdgeCount());
        }
    }

    @Test
    void testSelfReferenceInDependentsMode() {
        set("Sheet1", "A1", "=A1+1");

        TraceResult result = tracer(false).trace("Sheet1!A1", "dependents", 5);

        assertEquals(1, result.getRoot().getChildren().size());
        assertTrue(result.getRoot().getChildren().get(0).isCircular());
    }

    @Test
    void testNoFormulaRootInPrecedentsMode() {
        set("Sheet1", "A1", "10");

        TraceResult result = tracer(true).trace("Sheet1!A1", "precedents", 2);

        assertNull(result.getRoot());
        assertFalse(result.hasRoot());
        assertEquals(0, result.getNodeCount());
        assertEquals(TraceSource.NONE, result.getSource());
        assertEquals("Sheet1!A1 has no formula (direct value or empty).", result.getMessage());
    }

    @Test
    void testEmptyCellInDependentsModeIsTraced() {
        TraceResult result = tracer(false).trace("Sheet1!Z99", "dependents", 2);

        assertNotNull(result.getRoot());
        assertTrue(result.getRoot().getChildren().isEmpty());
        assertEquals(TraceSource.FORMULA_SCAN, result.getSource());
        assertEquals(1, result.getNodeCount());
    }

    @Test
    void testDependentsByFormulaScanAcrossSheets() {
        set("Sheet1", "A1", "5");
        set("Sheet1", "C3", "=A1+1");
        set("Sheet2", "D4", "=Sheet1!A1*2");
        set("Sheet2", "A1", "=A1+0");

        TraceResult result = tracer(false).trace("Sheet1!A1", "dependents", 1);

        assertEquals(Set.of("Sheet1!C3", "Sheet2!D4"), childAddresses(result.getRoot()));
        assertEquals(TraceSource.FORMULA_SCAN, result.getSource());
        assertEquals(TraceMode.DEPENDENTS, result.getMode());
        assertFalse(result.isTruncated());
    }

    @Test
    void testDependentsByHostIndexAcrossSheets() {
        set("Sheet1", "A1", "5");
        set("Sheet1", "C3", "=A1+1");
        set("Sheet2", "D4", "=Sheet1!A1*2");

        TraceResult result = tracer(true).trace("Sheet1!A1", "dependents", 1);

        assertEquals(Set.of("Sheet1!C3", "Sheet2!D4"), childAddresses(result.getRoot()));
        assertEquals(TraceSource.API, result.getSource());
    }

    @Test
    void testDependentsThroughRange() {
        set("Sheet1", "C1", "=SUM(A1:B2)");
        set("Sheet1", "C2", "=SUM(A3:B4)");

        for (boolean hostIndex : new boolean[]{true, false}) {
            TraceResult result = tracer(hostIndex).trace("Sheet1!B2", "dependents", 2);
            assertEquals(Set.of("Sheet1!C1"), childAddresses(result.getRoot()));
        }
    }

    @Test
    void testRangePrecedentResolvesToAnchorCell() {
        set("Sheet1", "B2", "7");
        set("Sheet1", "C1", "=SUM(B2:B9)");

        TraceResult result = tracer(false).trace("Sheet1!C1", "precedents", 2);

        DependencyNode anchor = result.getRoot().getChildren().get(0);
        assertEquals("Sheet1!B2", anchor.getAddress());
        assertEquals(7, anchor.getValue());
    }

    @Test
    void testDependentsCycle() {
        set("Sheet1", "A1", "=B1");
        set("Sheet1", "B1", "=A1");

        TraceResult result = tracer(false).trace("Sheet1!A1", "dependents", 3);

        DependencyNode b1 = result.getRoot().getChildren().get(0);
        assertEquals("Sheet1!B1", b1.getAddress());
        assertTrue(b1.getChildren().get(0).isCircular());
        assertEquals(3, result.getNodeCount());
    }

    @Test
    void testDepthIsClampedToOneAndFive() {
        for (int i = 1; i <= 7; i++) {
            set("Sheet1", "A" + i, "=A" + (i + 1));
        }
        set("Sheet1", "A8", "1");

        TraceResult deep = tracer(false).trace("Sheet1!A1", "precedents", 99);
        assertEquals(5, deep.getMaxDepth());
        assertEquals(5, height(deep.getRoot()));

        TraceResult shallow = tracer(false).trace("Sheet1!A1", "precedents", 0);
        assertEquals(1, shallow.getMaxDepth());
        assertEquals(1, height(shallow.getRoot()));
        assertTrue(shallow.getRoot().getChildren().get(0).getChildren().isEmpty());

        TraceResult byDefault = tracer(false).trace("Sheet1!A1", "precedents", null);
        assertEquals(2, byDefault.getMaxDepth());
    }

    @Test
    void testChildCapSetsTruncated() {
        properties.setMaxChildrenPerNode(3);
        set("Sheet1", "A10", "=A1+A2+A3+A4+A5");
        set("Sheet1", "B1", "1");
        for (int i = 1; i <= 5; i++) {
            set("Sheet1", "C" + i, "=B1");
        }

        for (boolean hostIndex : new boolean[]{true, false}) {
            TraceResult precedents = tracer(hostIndex).trace("Sheet1!A10", "precedents", 1);
            assertEquals(3, precedents.getRoot().getChildren().size());
            assertTrue(precedents.isTruncated());

            TraceResult dependents = tracer(hostIndex).trace("Sheet1!B1", "dependents", 1);
            assertEquals(3, dependents.getRoot().getChildren().size());
            assertTrue(dependents.isTruncated());
        }
    }

    @Test
    void testChildrenAtCapAreNotTruncated() {
        properties.setMaxChildrenPerNode(2);
        set("Sheet1", "A10", "=A1+A2+A1");

        TraceResult result = tracer(false).trace("Sheet1!A10", "precedents", 1);

        assertEquals(2, result.getRoot().getChildren().size());
        assertFalse(result.isTruncated());
    }

    @Test
    void testPrecedentFallbackReferenceCap() {
        properties.setMaxPrecedentFallbackRefs(2);
        set("Sheet1", "D1", "=A1+B1+C1");

        TraceResult result = tracer(false).trace("Sheet1!D1", "precedents", 1);

        assertEquals(List.of("Sheet1!A1", "Sheet1!B1"), result.getRoot().getChildren().stream()
                .map(DependencyNode::getAddress).collect(Collectors.toList()));
        assertTrue(result.isTruncated());
    }

    @Test
    void testBudgetSkipsWholeSheetButScansOthers() {
        properties.setDependentScanBudget(10);
        workbookService.createSheet("Big");
        workbookService.createSheet("Small");
        set("Big", "A1", "=Small!A1");
        set("Big", "E5", "=Small!A1*2");
        set("Small", "A1", "1");
        set("Small", "B1", "=A1");

        TraceResult result = tracer(false).trace("Small!A1", "dependents", 1);

        assertEquals(Set.of("Small!B1"), childAddresses(result.getRoot()));
        assertTrue(result.isTruncated());
        assertEquals(List.of("Big"), result.getSkippedSheets());
    }

    @Test
    void testCandidatesAreBuiltOncePerTrace() {
        set("Sheet1", "A1", "1");
        set("Sheet1", "B1", "=A1");
        set("Sheet1", "C1", "=B1");
        set("Sheet2", "A1", "=Sheet1!C1");

        DependentCandidateBuilder builder = spy(new DependentCandidateBuilder());
        DependencyTraceService service = new DependencyTraceService(
                new InMemoryWorkbookDataSource(workbook, false), builder, properties);

        TraceResult result = service.trace("Sheet1!A1", "dependents", 3);

        DependencyNode c1 = result.getRoot().getChildren().get(0).getChildren().get(0);
        assertEquals("Sheet1!C1", c1.getAddress());
        assertEquals("Sheet2!A1", c1.getChildren().get(0).getAddress());
        verify(builder, times(1)).buildCandidates(any(), anyLong(), any());

        // A second trace gets its own scan
        service.trace("Sheet1!A1", "dependents", 1);
        verify(builder, times(2)).buildCandidates(any(), anyLong(), any());
    }

    @Test
    void testUnqualifiedTargetUsesFirstSheet() {
        set("Sheet1", "B1", "=A1");

        TraceResult result = tracer(true).trace("B1", "precedents", 1);

        assertEquals("Sheet1!B1", result.getTarget());
        assertEquals("Sheet1!A1", result.getRoot().getChildren().get(0).getAddress());
    }

    @Test
    void testUnknownModeMeansPrecedents() {
        set("Sheet1", "B1", "=A1");

        TraceResult result = tracer(true).trace("Sheet1!B1", "sideways", 1);

        assertEquals(TraceMode.PRECEDENTS, result.getMode());
    }

    @Test
    void testTraceAsync() throws Exception {
        set("Sheet1", "B1", "=A1");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            TraceResult result = tracer(true)
                    .traceAsync("Sheet1!B1", TraceMode.PRECEDENTS, 2, executor)
                    .get(5, TimeUnit.SECONDS);
            assertEquals(2, result.getNodeCount());
        } finally {
            executor.shutdownNow();
        }
    }
}
