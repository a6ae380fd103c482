package com.formulatrace.app.models;

import com.formulatrace.app.util.CellAddresses;

import java.util.Objects;

/**
 * A rectangular block of cells on one sheet. A single cell is the
 * degenerate area where start equals end.
 * Corners must already be normalized (start <= end on both axes).
 */
public final class AreaRef {
    private final String sheet;
    private final int startCol;
    private final int startRow;
    private final int endCol;
    private final int endRow;

    public AreaRef(String sheet, int startCol, int startRow, int endCol, int endRow) {
        if (startCol < 0 || startRow < 0) {
            throw new IllegalArgumentException("Negative area corner: " + startCol + "," + startRow);
        }
        if (startCol > endCol || startRow > endRow) {
            throw new IllegalArgumentException("Area corners are not normalized: ("
                    + startCol + "," + startRow + ")-(" + endCol + "," + endRow + ")");
        }
        this.sheet = sheet;
        this.startCol = startCol;
        this.startRow = startRow;
        this.endCol = endCol;
        this.endRow = endRow;
    }

    /**
     * Builds an area from two arbitrary corners, swapping them as needed.
     */
    public static AreaRef spanning(String sheet, int colA, int rowA, int colB, int rowB) {
        return new AreaRef(sheet,
                Math.min(colA, colB), Math.min(rowA, rowB),
                Math.max(colA, colB), Math.max(rowA, rowB));
    }

    public static AreaRef singleCell(CellAddress cell) {
        return new AreaRef(cell.getSheet(), cell.getCol(), cell.getRow(), cell.getCol(), cell.getRow());
    }

    public String getSheet() {
        return sheet;
    }

    public int getStartCol() {
        return startCol;
    }

    public int getStartRow() {
        return startRow;
    }

    public int getEndCol() {
        return endCol;
    }

    public int getEndRow() {
        return endRow;
    }

    public boolean isSingleCell() {
        return startCol == endCol && startRow == endRow;
    }

    public long cellCount() {
        return (long) (endCol - startCol + 1) * (endRow - startRow + 1);
    }

    public CellAddress topLeft() {
        return new CellAddress(sheet, startCol, startRow);
    }

    /**
     * True when the cell lies inside this rectangle on the same sheet.
     * Sheet names compare case-insensitively.
     */
    public boolean contains(CellAddress cell) {
        return CellAddresses.sameSheet(sheet, cell.getSheet())
                && cell.getCol() >= startCol && cell.getCol() <= endCol
                && cell.getRow() >= startRow && cell.getRow() <= endRow;
    }

    /**
     * Local address, "A1" or "A1:C3".
     */
    public String toLocalAddress() {
        String start = CellAddresses.cellAddress(startCol, startRow);
        if (isSingleCell()) {
            return start;
        }
        return start + ":" + CellAddresses.cellAddress(endCol, endRow);
    }

    public String toQualifiedAddress() {
        return CellAddresses.qualify(sheet, toLocalAddress());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AreaRef)) return false;
        AreaRef that = (AreaRef) o;
        return startCol == that.startCol && startRow == that.startRow
                && endCol == that.endCol && endRow == that.endRow
                && CellAddresses.sameSheet(sheet, that.sheet);
    }

    @Override
    public int hashCode() {
        return Objects.hash(CellAddresses.sheetKey(sheet), startCol, startRow, endCol, endRow);
    }

    @Override
    public String toString() {
        return toQualifiedAddress();
    }
}
