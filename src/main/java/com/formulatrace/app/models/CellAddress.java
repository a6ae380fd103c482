package com.formulatrace.app.models;

import com.formulatrace.app.util.CellAddresses;

import java.util.Objects;

/**
 * A single cell on a named sheet.
 * Column and row are 0-based, so "Sheet1!B3" is (sheet=Sheet1, col=1, row=2).
 */
public final class CellAddress {
    private final String sheet;
    private final int col;
    private final int row;

    public CellAddress(String sheet, int col, int row) {
        if (col < 0 || row < 0) {
            throw new IllegalArgumentException("Negative cell coordinates: col=" + col + ", row=" + row);
        }
        this.sheet = sheet;
        this.col = col;
        this.row = row;
    }

    public String getSheet() {
        return sheet;
    }

    public int getCol() {
        return col;
    }

    public int getRow() {
        return row;
    }

    /**
     * Address without the sheet prefix, e.g. "B3".
     */
    public String toLocalAddress() {
        return CellAddresses.cellAddress(col, row);
    }

    /**
     * Sheet-qualified address, e.g. "Sheet1!B3" or "'Sales, Q1'!B3".
     */
    public String toQualifiedAddress() {
        return CellAddresses.qualify(sheet, toLocalAddress());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CellAddress)) return false;
        CellAddress that = (CellAddress) o;
        return col == that.col
                && row == that.row
                && CellAddresses.sameSheet(sheet, that.sheet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(CellAddresses.sheetKey(sheet), col, row);
    }

    @Override
    public String toString() {
        return toQualifiedAddress();
    }
}
