package com.formulatrace.app.services;

import com.formulatrace.app.exceptions.InvalidInputException;
import com.formulatrace.app.exceptions.SheetNotFoundException;
import com.formulatrace.app.formula.FormulaReferenceParser;
import com.formulatrace.app.models.*;
import com.formulatrace.app.util.CellAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Business logic for editing the in-memory workbook: creating sheets,
 * setting cells, and keeping the formula reference graphs in step.
 * Formulas are stored and indexed but never evaluated.
 */
@Service
public class WorkbookService {

    private static final Logger log = LoggerFactory.getLogger(WorkbookService.class);

    private static final Pattern INT_PATTERN = Pattern.compile("^[-+]?\\d{1,9}$");
    private static final Pattern DOUBLE_PATTERN = Pattern.compile("^[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?$");

    private final Workbook workbook;

    public WorkbookService(Workbook workbook) {
        this.workbook = workbook;
    }

    /**
     * Creates a sheet if no sheet with that name (ignoring case) exists yet.
     */
    public String createSheet(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidInputException("Sheet name must not be blank");
        }
        workbook.getLock().writeLock().lock();
        try {
            return workbook.addSheet(name).getName();
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    public List<String> listSheetNames() {
        workbook.getLock().readLock().lock();
        try {
            return workbook.getSheets().stream()
                    .map(Sheet::getName)
                    .collect(Collectors.toList());
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    /**
     * Sets a cell's raw input with these steps:
     * 1) Confirm the sheet exists and the address is a single cell.
     * 2) Drop the cell's old formula references.
     * 3) Blank input clears the cell; otherwise store it, parsing literals
     *    into Integer, Double, Boolean or String.
     * 4) For formulas, record every referenced area in the graphs.
     */
    public CellSnapshot setCellValue(String sheetName, String address, String rawInput, String numberFormat) {
        workbook.getLock().writeLock().lock();
        try {
            Sheet sheet = requireSheet(sheetName);
            CellAddress cellAddress = parseLocalCell(sheet.getName(), address);

            workbook.clearDependencies(cellAddress);

            if (rawInput == null || rawInput.isEmpty()) {
                sheet.removeCell(cellAddress.getCol(), cellAddress.getRow());
                log.debug("Cleared {}", cellAddress);
                return CellSnapshot.blank(cellAddress.toQualifiedAddress());
            }

            Cell cell = new Cell(cellAddress.getCol(), cellAddress.getRow(), rawInput,
                    parseLiteralValue(rawInput), numberFormat);
            sheet.setCell(cell);

            if (cell.hasFormula()) {
                List<ParsedReference> references =
                        FormulaReferenceParser.extractReferences(cell.getFormula(), sheet.getName());
                for (ParsedReference reference : references) {
                    workbook.addDependency(cellAddress, reference.getArea());
                }
                log.debug("Set {} to {} ({} references)", cellAddress, rawInput, references.size());
            }
            return toSnapshot(sheet, cell);
        } finally {
            workbook.getLock().writeLock().unlock();
        }
    }

    public CellSnapshot getCell(String sheetName, String address) {
        workbook.getLock().readLock().lock();
        try {
            Sheet sheet = requireSheet(sheetName);
            CellAddress cellAddress = parseLocalCell(sheet.getName(), address);
            Cell cell = sheet.getCell(cellAddress.getCol(), cellAddress.getRow());
            if (cell == null) {
                return CellSnapshot.blank(cellAddress.toQualifiedAddress());
            }
            return toSnapshot(sheet, cell);
        } finally {
            workbook.getLock().readLock().unlock();
        }
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private Sheet requireSheet(String sheetName) {
        Sheet sheet = workbook.getSheet(sheetName);
        if (sheet == null) {
            throw SheetNotFoundException.forSheet(sheetName);
        }
        return sheet;
    }

    private CellAddress parseLocalCell(String sheetName, String address) {
        if (!CellAddresses.isSingleCell(address)) {
            throw new InvalidInputException("Expected a single cell, got: " + address);
        }
        try {
            int[] cell = CellAddresses.parseCell(address);
            return new CellAddress(sheetName, cell[0], cell[1]);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Invalid cell address: " + address);
        }
    }

    /**
     * Converts raw input into a typed literal: Integer, Double, Boolean, or
     * the text itself. Formulas have no literal value.
     */
    private Object parseLiteralValue(String rawInput) {
        if (rawInput.startsWith("=")) {
            return null;
        }
        String trimmed = rawInput.trim();
        if (INT_PATTERN.matcher(trimmed).matches()) {
            return Integer.parseInt(trimmed);
        }
        if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
            return Boolean.valueOf(trimmed);
        }
        if (DOUBLE_PATTERN.matcher(trimmed).matches()) {
            return Double.parseDouble(trimmed);
        }
        return rawInput;
    }

    private CellSnapshot toSnapshot(Sheet sheet, Cell cell) {
        return new CellSnapshot(
                CellAddresses.qualify(sheet.getName(), CellAddresses.cellAddress(cell.getCol(), cell.getRow())),
                cell.getValue(),
                cell.getFormula(),
                cell.getNumberFormat());
    }
}
