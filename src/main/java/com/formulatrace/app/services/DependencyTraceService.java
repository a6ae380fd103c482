package com.formulatrace.app.services;

import com.formulatrace.app.config.TraceProperties;
import com.formulatrace.app.datasource.WorkbookDataSource;
import com.formulatrace.app.exceptions.DataSourceException;
import com.formulatrace.app.exceptions.InvalidInputException;
import com.formulatrace.app.exceptions.SheetNotFoundException;
import com.formulatrace.app.exceptions.TraceCancelledException;
import com.formulatrace.app.formula.FormulaReferenceParser;
import com.formulatrace.app.models.*;
import com.formulatrace.app.util.CellAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Traces formula lineage of a single cell: precedents (what feeds it) or
 * dependents (what it feeds), recursively up to a bounded depth.
 *
 * Children come from the host's own index when it has one for the address;
 * otherwise precedents are parsed from the node's formula and dependents
 * are found by scanning the workbook's formula cells once per trace.
 * Children are visited one at a time, so the visited set needs no locking.
 */
@Service
public class DependencyTraceService {

    private static final Logger log = LoggerFactory.getLogger(DependencyTraceService.class);

    /** Hard ceiling for depth, whatever the configuration says. */
    public static final int ABSOLUTE_MAX_DEPTH = 5;

    private final WorkbookDataSource dataSource;
    private final DependentCandidateBuilder candidateBuilder;
    private final TraceProperties properties;

    public DependencyTraceService(WorkbookDataSource dataSource,
                                  DependentCandidateBuilder candidateBuilder,
                                  TraceProperties properties) {
        this.dataSource = dataSource;
        this.candidateBuilder = candidateBuilder;
        this.properties = properties;
    }

    /**
     * Request-level entry point: validates that cellRef is a single cell,
     * normalizes mode and depth, and traces against the configured workbook.
     */
    public TraceResult trace(String cellRef, String mode, Integer depth) {
        return trace(cellRef, TraceMode.fromValue(mode), depth, CancellationSignal.none());
    }

    public TraceResult trace(String cellRef, TraceMode mode, Integer depth, CancellationSignal cancellation) {
        CellAddress target = resolveTarget(cellRef);
        return trace(dataSource, target, mode, properties.clampDepth(depth), cancellation);
    }

    /**
     * Runs a trace on the given executor. Cancelling the returned future
     * stops the trace at its next workbook read.
     */
    public CompletableFuture<TraceResult> traceAsync(String cellRef, TraceMode mode, Integer depth, Executor executor) {
        CancellationSignal cancellation = new CancellationSignal();
        CompletableFuture<TraceResult> future =
                CompletableFuture.supplyAsync(() -> trace(cellRef, mode, depth, cancellation), executor);
        future.whenComplete((result, error) -> {
            if (future.isCancelled()) {
                cancellation.cancel();
            }
        });
        return future;
    }

    /**
     * Core trace over any data source. maxDepth is clamped to [1, 5].
     *
     * @throws DataSourceException     if a workbook read fails
     * @throws TraceCancelledException if the signal trips mid-trace
     */
    public TraceResult trace(WorkbookDataSource source, CellAddress target, TraceMode mode,
                             int maxDepth, CancellationSignal cancellation) {
        int depth = Math.max(1, Math.min(maxDepth, ABSOLUTE_MAX_DEPTH));
        String targetAddress = target.toQualifiedAddress();
        TraceContext ctx = new TraceContext(mode, depth, cancellation);
        log.info("Tracing {} of {} (depth {})", mode.wireName(), targetAddress, depth);

        DependencyNode root = visit(source, targetAddress, 0, ctx);
        if (root == null) {
            log.info("{} has no formula; nothing to trace", targetAddress);
            return TraceResult.noFormula(targetAddress, mode, depth);
        }

        TraceSummary summary = TraceSummarizer.summarize(root);
        TraceSource traceSource = ctx.resolveSource();
        if (ctx.isTruncated()) {
            log.warn("Trace of {} truncated ({} nodes, skipped sheets: {})",
                    root.getAddress(), summary.getNodeCount(), ctx.getSkippedSheets());
        }
        log.info("Traced {}: {} nodes, {} edges, source={}",
                root.getAddress(), summary.getNodeCount(), summary.getEdgeCount(), traceSource.getWireName());
        return new TraceResult(root.getAddress(), root, mode, depth, summary, traceSource,
                ctx.isTruncated(), ctx.getSkippedSheets());
    }

    // ----------------------------------------------------------------
    // Traversal
    // ----------------------------------------------------------------

    /**
     * Expands one address. Returns null in precedents mode when the cell
     * has no formula; callers reaching such a cell as a child attach a
     * plain leaf instead.
     */
    private DependencyNode visit(WorkbookDataSource source, String address, int depth, TraceContext ctx) {
        CellSnapshot cell = readCell(source, address, ctx);

        if (!ctx.markVisited(visitKey(cell.getAddress()))) {
            log.debug("Circular reference at {}", cell.getAddress());
            return DependencyNode.circular(cell);
        }

        if (ctx.getMode() == TraceMode.PRECEDENTS && !cell.hasFormula()) {
            return null;
        }

        DependencyNode node = DependencyNode.leaf(cell);
        if (depth >= ctx.getMaxDepth()) {
            return node;
        }

        List<String> childAddresses = ctx.getMode() == TraceMode.PRECEDENTS
                ? resolvePrecedents(source, cell, ctx)
                : resolveDependents(source, cell, ctx);
        log.debug("{} has {} {} at depth {}", cell.getAddress(), childAddresses.size(),
                ctx.getMode().wireName(), depth);

        for (String childAddress : childAddresses) {
            DependencyNode child = visit(source, childAddress, depth + 1, ctx);
            if (child == null) {
                child = DependencyNode.leaf(readCell(source, childAddress, ctx));
            }
            node.addChild(child);
        }
        return node;
    }

    private List<String> resolvePrecedents(WorkbookDataSource source, CellSnapshot cell, TraceContext ctx) {
        String sheet = sheetOf(cell.getAddress());
        ChildCollector children = new ChildCollector(properties.getMaxChildrenPerNode(), ctx);

        List<List<String>> hostPrecedents = call(ctx, "reading precedents of " + cell.getAddress(),
                () -> source.getDirectPrecedents(cell.getAddress()));
        if (hostPrecedents != null) {
            ctx.markHostIndexUsed();
            children.addGroups(hostPrecedents, sheet);
            return children.toList();
        }

        if (!cell.hasFormula()) {
            return children.toList();
        }
        ctx.markFormulaScanUsed();
        List<ParsedReference> references = FormulaReferenceParser.extractReferences(cell.getFormula(), sheet);
        int limit = properties.getMaxPrecedentFallbackRefs();
        if (references.size() > limit) {
            ctx.markTruncated();
        }
        for (ParsedReference reference : references.subList(0, Math.min(limit, references.size()))) {
            if (!children.add(reference.getQualifiedAnchor())) {
                break;
            }
        }
        return children.toList();
    }

    private List<String> resolveDependents(WorkbookDataSource source, CellSnapshot cell, TraceContext ctx) {
        String sheet = sheetOf(cell.getAddress());
        ChildCollector children = new ChildCollector(properties.getMaxChildrenPerNode(), ctx);

        List<List<String>> hostDependents = call(ctx, "reading dependents of " + cell.getAddress(),
                () -> source.getDirectDependents(cell.getAddress()));
        if (hostDependents != null) {
            ctx.markHostIndexUsed();
            children.addGroups(hostDependents, sheet);
            return children.toList();
        }

        ctx.markFormulaScanUsed();
        CellAddress target = CellAddresses.parseQualified(cell.getAddress(), sheet);
        if (target == null) {
            return children.toList();
        }
        for (DependentCandidate candidate : candidates(source, ctx)) {
            if (candidate.references(target) && !children.add(candidate.getDependentAddress())) {
                break;
            }
        }
        return children.toList();
    }

    /**
     * Builds the dependent candidates on first use and caches them on the context.
     */
    private List<DependentCandidate> candidates(WorkbookDataSource source, TraceContext ctx) {
        if (ctx.getCandidateCache() == null) {
            DependentCandidateBuilder.CandidateScan scan = call(ctx, "scanning formulas",
                    () -> candidateBuilder.buildCandidates(source, properties.getDependentScanBudget(),
                            ctx.getCancellation()));
            if (scan.isTruncated()) {
                ctx.markTruncated();
            }
            ctx.getSkippedSheets().addAll(scan.getSkippedSheets());
            ctx.setCandidateCache(scan.getCandidates());
        }
        return ctx.getCandidateCache();
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    private CellAddress resolveTarget(String cellRef) {
        if (!CellAddresses.isSingleCell(cellRef)) {
            throw new InvalidInputException("Expected a single cell, not a range: " + cellRef);
        }
        String[] parts = CellAddresses.splitQualified(cellRef);
        String defaultSheet = parts[0];
        if (defaultSheet == null) {
            List<String> sheets = dataSource.listSheets();
            if (sheets.isEmpty()) {
                throw new SheetNotFoundException("Workbook has no sheets");
            }
            defaultSheet = sheets.get(0);
        }
        CellAddress target = CellAddresses.parseQualified(cellRef, defaultSheet);
        if (target == null) {
            throw new InvalidInputException("Invalid cell address: " + cellRef);
        }
        return target;
    }

    private CellSnapshot readCell(WorkbookDataSource source, String address, TraceContext ctx) {
        return call(ctx, "reading " + address, () -> source.readCell(address));
    }

    /**
     * Runs one data-source call after a cancellation check. Unexpected
     * runtime failures from the host are reported as data-source failures.
     */
    private <T> T call(TraceContext ctx, String what, Supplier<T> read) {
        ctx.getCancellation().throwIfCancelled(what);
        try {
            return read.get();
        } catch (DataSourceException | SheetNotFoundException | TraceCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DataSourceException("Failed " + what + ": " + e.getMessage(), e);
        }
    }

    private static String sheetOf(String qualifiedAddress) {
        String sheet = CellAddresses.splitQualified(qualifiedAddress)[0];
        return sheet == null ? "" : sheet;
    }

    /**
     * Visited-set key: qualified address with the sheet lower-cased.
     */
    static String visitKey(String qualifiedAddress) {
        CellAddress parsed = CellAddresses.parseQualified(qualifiedAddress, "");
        if (parsed == null) {
            return qualifiedAddress.toLowerCase(Locale.ROOT);
        }
        return CellAddresses.sheetKey(parsed.getSheet()) + "!" + parsed.toLocalAddress();
    }

    /**
     * Ordered, de-duplicated child list with a hard cap. Attempting to add a
     * new address once full marks the trace truncated.
     */
    private static final class ChildCollector {
        private final int cap;
        private final TraceContext ctx;
        private final Map<String, String> children = new LinkedHashMap<>();

        ChildCollector(int cap, TraceContext ctx) {
            this.cap = cap;
            this.ctx = ctx;
        }

        /**
         * Returns false once the cap has been hit.
         */
        boolean add(String address) {
            if (address == null) {
                return true;
            }
            String key = visitKey(address);
            if (children.containsKey(key)) {
                return true;
            }
            if (children.size() >= cap) {
                ctx.markTruncated();
                return false;
            }
            children.put(key, address);
            return true;
        }

        /**
         * Flattens host index groups, qualifying bare addresses with the node's sheet.
         */
        void addGroups(List<List<String>> groups, String defaultSheet) {
            for (List<String> group : groups) {
                if (group == null) {
                    continue;
                }
                for (String address : group) {
                    if (!add(CellAddresses.normalize(address, defaultSheet))) {
                        return;
                    }
                }
            }
        }

        List<String> toList() {
            return new ArrayList<>(children.values());
        }
    }
}
