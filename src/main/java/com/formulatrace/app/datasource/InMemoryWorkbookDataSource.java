package com.formulatrace.app.datasource;

import com.formulatrace.app.exceptions.SheetNotFoundException;
import com.formulatrace.app.models.*;
import com.formulatrace.app.util.CellAddresses;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * {@link WorkbookDataSource} over the in-memory {@link Workbook}.
 *
 * When the host index is disabled, precedent and dependent queries answer
 * null ("unsupported") so callers fall back to scanning formula text.
 */
public class InMemoryWorkbookDataSource implements WorkbookDataSource {

    private final Workbook workbook;
    private final boolean hostIndexEnabled;

    public InMemoryWorkbookDataSource(Workbook workbook, boolean hostIndexEnabled) {
        this.workbook = workbook;
        this.hostIndexEnabled = hostIndexEnabled;
    }

    @Override
    public CellSnapshot readCell(String qualifiedAddress) {
        workbook.getLock().readLock().lock();
        try {
            CellAddress address = resolve(qualifiedAddress);
            Sheet sheet = requireSheet(address.getSheet());
            String resolved = CellAddresses.qualify(sheet.getName(), address.toLocalAddress());
            Cell cell = sheet.getCell(address.getCol(), address.getRow());
            if (cell == null) {
                return CellSnapshot.blank(resolved);
            }
            return new CellSnapshot(resolved, cell.getValue(), cell.getFormula(), cell.getNumberFormat());
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    @Override
    public List<String> listSheets() {
        workbook.getLock().readLock().lock();
        try {
            return workbook.getSheets().stream()
                    .map(Sheet::getName)
                    .collect(Collectors.toList());
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    @Override
    public String readUsedRangeAddress(String sheetName) {
        workbook.getLock().readLock().lock();
        try {
            AreaRef usedRange = requireSheet(sheetName).usedRange();
            return usedRange == null ? null : usedRange.toQualifiedAddress();
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    @Override
    public UsedRangeFormulas readUsedRangeFormulas(String sheetName) {
        workbook.getLock().readLock().lock();
        try {
            Sheet sheet = requireSheet(sheetName);
            AreaRef usedRange = sheet.usedRange();
            if (usedRange == null) {
                return null;
            }
            List<List<String>> grid = new ArrayList<>();
            for (int row = usedRange.getStartRow(); row <= usedRange.getEndRow(); row++) {
                List<String> line = new ArrayList<>();
                for (int col = usedRange.getStartCol(); col <= usedRange.getEndCol(); col++) {
                    Cell cell = sheet.getCell(col, row);
                    line.add(cell == null ? null : cell.getRawInput());
                }
                grid.add(line);
            }
            return new UsedRangeFormulas(sheet.getName(), usedRange.toQualifiedAddress(), grid);
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    @Override
    public List<List<String>> getDirectPrecedents(String qualifiedAddress) {
        if (!hostIndexEnabled) {
            return null;
        }
        workbook.getLock().readLock().lock();
        try {
            CellAddress address = resolve(qualifiedAddress);
            requireSheet(address.getSheet());
            Map<String, List<String>> bySheet = new LinkedHashMap<>();
            for (AreaRef area : workbook.getPrecedentAreas(address)) {
                bySheet.computeIfAbsent(CellAddresses.sheetKey(area.getSheet()), k -> new ArrayList<>())
                        .add(area.toQualifiedAddress());
            }
            return new ArrayList<>(bySheet.values());
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    @Override
    public List<List<String>> getDirectDependents(String qualifiedAddress) {
        if (!hostIndexEnabled) {
            return null;
        }
        workbook.getLock().readLock().lock();
        try {
            CellAddress address = resolve(qualifiedAddress);
            requireSheet(address.getSheet());
            return groupBySheet(workbook.getDependentCells(address));
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    /**
     * Unqualified addresses resolve against the first sheet.
     */
    private CellAddress resolve(String qualifiedAddress) {
        List<Sheet> sheets = workbook.getSheets();
        String defaultSheet = sheets.isEmpty() ? null : sheets.get(0).getName();
        CellAddress address = CellAddresses.parseQualified(qualifiedAddress, defaultSheet);
        if (address == null) {
            throw new SheetNotFoundException("Cannot resolve address: " + qualifiedAddress);
        }
        return address;
    }

    private Sheet requireSheet(String sheetName) {
        Sheet sheet = workbook.getSheet(sheetName);
        if (sheet == null) {
            throw SheetNotFoundException.forSheet(sheetName);
        }
        return sheet;
    }

    private List<List<String>> groupBySheet(Collection<CellAddress> cells) {
        Map<String, List<String>> bySheet = new LinkedHashMap<>();
        for (CellAddress cell : cells) {
            Sheet sheet = workbook.getSheet(cell.getSheet());
            String sheetName = sheet == null ? cell.getSheet() : sheet.getName();
            bySheet.computeIfAbsent(CellAddresses.sheetKey(sheetName), k -> new ArrayList<>())
                    .add(CellAddresses.qualify(sheetName, cell.toLocalAddress()));
        }
        return new ArrayList<>(bySheet.values());
    }
}
