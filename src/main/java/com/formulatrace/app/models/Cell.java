package com.formulatrace.app.models;

/**
 * Represents a single populated cell in the in-memory workbook.
 * Stores:
 * - its position (0-based column and row)
 * - rawInput exactly as entered
 * - formula, when the input starts with "="
 * - value, the parsed literal (formula cells carry no value; nothing is evaluated)
 * - an optional number format such as "0.00%"
 */
public class Cell {
    private final int col;
    private final int row;
    private final String rawInput;
    private final String formula;
    private final Object value;
    private final String numberFormat;

    public Cell(int col, int row, String rawInput, Object value, String numberFormat) {
        this.col = col;
        this.row = row;
        this.rawInput = rawInput;
        this.formula = rawInput != null && rawInput.startsWith("=") ? rawInput : null;
        this.value = this.formula == null ? value : null;
        this.numberFormat = numberFormat;
    }

    public int getCol() {
        return col;
    }

    public int getRow() {
        return row;
    }

    public String getRawInput() {
        return rawInput;
    }

    public String getFormula() {
        return formula;
    }

    public Object getValue() {
        return value;
    }

    public String getNumberFormat() {
        return numberFormat;
    }

    public boolean hasFormula() {
        return formula != null;
    }
}
