package com.formulatrace.app.services;

import com.formulatrace.app.datasource.WorkbookDataSource;
import com.formulatrace.app.formula.FormulaReferenceParser;
import com.formulatrace.app.models.DependentCandidate;
import com.formulatrace.app.models.ParsedReference;
import com.formulatrace.app.models.UsedRangeFormulas;
import com.formulatrace.app.util.CellAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scans the workbook's formula cells to answer "who references this cell"
 * when the host has no dependents index.
 *
 * Sheets are admitted in workbook order while their used-range cell count
 * fits the remaining budget. A sheet that does not fit is skipped whole,
 * never scanned partially, and the scan is reported as truncated.
 */
@Service
public class DependentCandidateBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependentCandidateBuilder.class);

    /**
     * Result of one workbook scan.
     */
    public static final class CandidateScan {
        private final List<DependentCandidate> candidates;
        private final boolean truncated;
        private final List<String> skippedSheets;

        public CandidateScan(List<DependentCandidate> candidates, boolean truncated, List<String> skippedSheets) {
            this.candidates = candidates;
            this.truncated = truncated;
            this.skippedSheets = skippedSheets;
        }

        public List<DependentCandidate> getCandidates() {
            return candidates;
        }

        public boolean isTruncated() {
            return truncated;
        }

        public List<String> getSkippedSheets() {
            return skippedSheets;
        }
    }

    public CandidateScan buildCandidates(WorkbookDataSource dataSource, long budget) {
        return buildCandidates(dataSource, budget, CancellationSignal.none());
    }

    public CandidateScan buildCandidates(WorkbookDataSource dataSource, long budget, CancellationSignal cancellation) {
        cancellation.throwIfCancelled("listing sheets");
        List<String> sheets = dataSource.listSheets();

        long remaining = budget;
        boolean truncated = false;
        List<String> admitted = new ArrayList<>();
        List<String> skipped = new ArrayList<>();

        // Sizes first; formula bodies are only loaded for admitted sheets
        for (String sheet : sheets) {
            cancellation.throwIfCancelled("reading the used range of " + sheet);
            String usedRange = dataSource.readUsedRangeAddress(sheet);
            if (usedRange == null) {
                continue;
            }
            long cells = estimateCellCount(usedRange);
            if (cells > remaining) {
                log.warn("Skipping sheet '{}' in dependents scan: {} cells exceed remaining budget {}",
                        sheet, cells, remaining);
                truncated = true;
                skipped.add(sheet);
                continue;
            }
            remaining -= cells;
            admitted.add(sheet);
        }

        List<DependentCandidate> candidates = new ArrayList<>();
        if (!admitted.isEmpty()) {
            cancellation.throwIfCancelled("loading formulas");
            Map<String, UsedRangeFormulas> grids = dataSource.readUsedRangeFormulas(admitted);
            for (String sheet : admitted) {
                UsedRangeFormulas grid = grids.get(sheet);
                if (grid != null) {
                    collectCandidates(sheet, grid, candidates);
                }
            }
        }

        log.debug("Dependents scan: {} sheets scanned, {} skipped, {} formula cells with references",
                admitted.size(), skipped.size(), candidates.size());
        return new CandidateScan(candidates, truncated, skipped);
    }

    /**
     * Number of cells covered by a used-range address such as "Sheet1!A1:D9"
     * or "A1:B2,D4:E5". Unparseable areas count as zero.
     */
    static long estimateCellCount(String address) {
        long total = 0;
        for (String area : CellAddresses.splitAreas(address)) {
            String[] corners = CellAddresses.splitQualified(area)[1].split(":");
            try {
                int[] start = CellAddresses.parseCell(corners[0]);
                int[] end = corners.length > 1 ? CellAddresses.parseCell(corners[1]) : start;
                total += (long) (Math.abs(end[0] - start[0]) + 1) * (Math.abs(end[1] - start[1]) + 1);
            } catch (IllegalArgumentException e) {
                log.debug("Cannot size used-range area '{}': {}", area, e.getMessage());
            }
        }
        return total;
    }

    private void collectCandidates(String sheet, UsedRangeFormulas grid, List<DependentCandidate> out) {
        String firstArea = CellAddresses.splitAreas(grid.getAreaAddress()).get(0);
        String firstCell = CellAddresses.splitQualified(firstArea)[1].split(":")[0];
        int[] origin;
        try {
            origin = CellAddresses.parseCell(firstCell);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring sheet '{}': unreadable used range '{}'", sheet, grid.getAreaAddress());
            return;
        }

        List<List<String>> rows = grid.getFormulas();
        if (rows == null) {
            return;
        }
        for (int r = 0; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            if (row == null) {
                continue;
            }
            for (int c = 0; c < row.size(); c++) {
                String formula = row.get(c);
                if (formula == null || !formula.startsWith("=")) {
                    continue;
                }
                List<ParsedReference> references = FormulaReferenceParser.extractReferences(formula, sheet);
                if (references.isEmpty()) {
                    continue;
                }
                String address = CellAddresses.qualify(sheet, CellAddresses.cellAddress(origin[0] + c, origin[1] + r));
                out.add(new DependentCandidate(address, references));
            }
        }
    }
}
