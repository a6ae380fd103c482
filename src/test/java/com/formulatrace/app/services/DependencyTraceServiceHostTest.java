package com.formulatrace.app.services;

import com.formulatrace.app.config.TraceProperties;
import com.formulatrace.app.datasource.WorkbookDataSource;
import com.formulatrace.app.exceptions.DataSourceException;
import com.formulatrace.app.exceptions.InvalidInputException;
import com.formulatrace.app.exceptions.TraceCancelledException;
import com.formulatrace.app.models.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Traversal tests against a mocked host, covering host index shapes,
 * provenance, failures and cancellation.
 */
class DependencyTraceServiceHostTest {

    private static final CellAddress D10 = new CellAddress("Calc", 3, 9);

    private WorkbookDataSource dataSource;
    private DependencyTraceService service;

    @BeforeEach
    void setUp() {
        dataSource = mock(WorkbookDataSource.class);
        service = new DependencyTraceService(dataSource, new DependentCandidateBuilder(), new TraceProperties());
    }

    private void cell(String address, Object value, String formula) {
        when(dataSource.readCell(address)).thenReturn(new CellSnapshot(address, value, formula, null));
    }

    @Test
    void testBareHostAddressesAreQualifiedAndDeduped() {
        cell("Calc!D10", 42, "=B10+C10+B10");
        cell("Calc!B10", 20, null);
        cell("Calc!C10", 22, null);
        when(dataSource.getDirectPrecedents("Calc!D10"))
                .thenReturn(List.of(List.of("B10", "$C$10", "b10")));

        TraceResult result = service.trace(dataSource, D10, TraceMode.PRECEDENTS, 2, CancellationSignal.none());

        assertEquals(List.of("Calc!B10", "Calc!C10"), result.getRoot().getChildren().stream()
                .map(DependencyNode::getAddress).collect(Collectors.toList()));
        assertEquals(TraceSource.API, result.getSource());
    }

    @Test
    void testEmptyHostListMeansNoPrecedents() {
        cell("Calc!D10", 0, "=NOW()");
        when(dataSource.getDirectPrecedents("Calc!D10")).thenReturn(List.of());

        TraceResult result = service.trace(dataSource, D10, TraceMode.PRECEDENTS, 2, CancellationSignal.none());

        assertTrue(result.getRoot().getChildren().isEmpty());
        assertEquals(TraceSource.API, result.getSource());
    }

    @Test
    void testMixedSourceWhenHostIndexIsPartial() {
        cell("Calc!D10", 3, "=B10");
        cell("Calc!B10", 2, "=A10+1");
        cell("Calc!A10", 1, null);
        when(dataSource.getDirectPrecedents("Calc!D10")).thenReturn(List.of(List.of("Calc!B10")));
        when(dataSource.getDirectPrecedents("Calc!B10")).thenReturn(null);

        TraceResult result = service.trace(dataSource, D10, TraceMode.PRECEDENTS, 3, CancellationSignal.none());

        DependencyNode a10 = result.getRoot().getChildren().get(0).getChildren().get(0);
        assertEquals("Calc!A10", a10.getAddress());
        assertEquals(TraceSource.MIXED, result.getSource());
        assertEquals(3, result.getNodeCount());
    }

    @Test
    void testRangeTargetIsRejectedBeforeAnyRead() {
        assertThrows(InvalidInputException.class, () -> service.trace("A1:B2", "precedents", 2));
        assertThrows(InvalidInputException.class, () -> service.trace("Calc!A1,Calc!C3", "dependents", 2));
        verifyNoInteractions(dataSource);
    }

    @Test
    void testReadFailureAbortsTrace() {
        cell("Calc!D10", 3, "=B10");
        when(dataSource.getDirectPrecedents("Calc!D10")).thenReturn(List.of(List.of("Calc!B10")));
        when(dataSource.readCell("Calc!B10")).thenThrow(new DataSourceException("connection reset"));

        DataSourceException ex = assertThrows(DataSourceException.class,
                () -> service.trace(dataSource, D10, TraceMode.PRECEDENTS, 2, CancellationSignal.none()));
        assertEquals("connection reset", ex.getMessage());
    }

    @Test
    void testUnexpectedHostErrorIsReportedAsDataSourceFailure() {
        when(dataSource.readCell(anyString())).thenThrow(new IllegalStateException("host gone"));

        DataSourceException ex = assertThrows(DataSourceException.class,
                () -> service.trace(dataSource, D10, TraceMode.PRECEDENTS, 2, CancellationSignal.none()));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void testCancelledBeforeStartMakesNoReads() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThrows(TraceCancelledException.class,
                () -> service.trace(dataSource, D10, TraceMode.PRECEDENTS, 2, signal));
        verifyNoInteractions(dataSource);
    }

    @Test
    void testCancelledMidTraceStopsReading() {
        CancellationSignal signal = new CancellationSignal();
        when(dataSource.readCell("Calc!D10")).thenAnswer(invocation -> {
            signal.cancel();
            return new CellSnapshot("Calc!D10", 3, "=B10", null);
        });

        assertThrows(TraceCancelledException.class,
                () -> service.trace(dataSource, D10, TraceMode.PRECEDENTS, 2, signal));
        verify(dataSource, never()).getDirectPrecedents(anyString());
        verify(dataSource, never()).readCell("Calc!B10");
    }

    @Test
    void testDependentsFallbackUsesUsedRangeScan() {
        cell("Calc!D10", 5, null);
        cell("Calc!E10", 10, "=D10*2");
        cell("Calc!E11", 5, "=SUM(D10:D11)");
        when(dataSource.getDirectDependents("Calc!D10")).thenReturn(null);
        when(dataSource.listSheets()).thenReturn(List.of("Calc"));
        when(dataSource.readUsedRangeAddress("Calc")).thenReturn("Calc!D10:E11");
        when(dataSource.readUsedRangeFormulas(List.of("Calc"))).thenReturn(Map.of("Calc",
                new UsedRangeFormulas("Calc", "Calc!D10:E11", List.of(
                        Arrays.asList(null, "=D10*2"),
                        Arrays.asList("text", "=SUM(D10:D11)")))));

        TraceResult result = service.trace(dataSource, D10, TraceMode.DEPENDENTS, 1, CancellationSignal.none());

        assertEquals(List.of("Calc!E10", "Calc!E11"), result.getRoot().getChildren().stream()
                .map(DependencyNode::getAddress).collect(Collectors.toList()));
        assertEquals(TraceSource.FORMULA_SCAN, result.getSource());
    }
}
