package com.formulatrace.app.datasource;

import com.formulatrace.app.exceptions.DataSourceException;
import com.formulatrace.app.models.CellSnapshot;
import com.formulatrace.app.models.UsedRangeFormulas;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of a host workbook: cell snapshots, sheet listing,
 * used-range formulas and, where the host has one, its own
 * precedent/dependent index.
 *
 * Every call returns a point-in-time snapshot; no consistency is promised
 * across calls. Transport or storage failures surface as
 * {@link DataSourceException}.
 */
public interface WorkbookDataSource {

    /**
     * Reads one cell. The returned snapshot carries the resolved,
     * sheet-qualified address.
     */
    CellSnapshot readCell(String qualifiedAddress);

    /**
     * Sheet names in workbook order.
     */
    List<String> listSheets();

    /**
     * Formulas of the sheet's used range, or null when the sheet is empty.
     */
    UsedRangeFormulas readUsedRangeFormulas(String sheetName);

    /**
     * Direct precedents grouped by sheet, or null when the host cannot
     * answer for this address. An empty list means "supported, none".
     */
    List<List<String>> getDirectPrecedents(String qualifiedAddress);

    /**
     * Direct dependents grouped by sheet, or null when unsupported.
     */
    List<List<String>> getDirectDependents(String qualifiedAddress);

    /**
     * Address of the sheet's used range without loading formulas,
     * or null when the sheet is empty. Hosts that can answer this cheaply
     * should override it.
     */
    default String readUsedRangeAddress(String sheetName) {
        UsedRangeFormulas usedRange = readUsedRangeFormulas(sheetName);
        return usedRange == null ? null : usedRange.getAreaAddress();
    }

    /**
     * Loads formula grids for several sheets. Sheets with no used range are
     * absent from the result. Hosts with request batching should override it.
     */
    default Map<String, UsedRangeFormulas> readUsedRangeFormulas(List<String> sheetNames) {
        Map<String, UsedRangeFormulas> grids = new LinkedHashMap<>();
        for (String sheetName : sheetNames) {
            UsedRangeFormulas usedRange = readUsedRangeFormulas(sheetName);
            if (usedRange != null) {
                grids.put(sheetName, usedRange);
            }
        }
        return grids;
    }
}
