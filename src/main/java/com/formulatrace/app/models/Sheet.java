package com.formulatrace.app.models;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Represents one worksheet of the in-memory workbook:
 * - a name (unique within the workbook, compared case-insensitively)
 * - a map of "col:row" -> Cell for populated cells only
 */
public class Sheet {

    private final String name;
    // Key format: "<col>:<row>" -> Cell object
    private final Map<String, Cell> cells = new ConcurrentHashMap<>();

    public Sheet(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Collection<Cell> getCells() {
        return cells.values();
    }

    /**
     * Helper to insert/update a cell in this sheet's 'cells' map.
     */
    public void setCell(Cell cell) {
        cells.put(generateKey(cell.getCol(), cell.getRow()), cell);
    }

    /**
     * Retrieves the cell from the 'cells' map, if it exists.
     */
    public Cell getCell(int col, int row) {
        return cells.get(generateKey(col, row));
    }

    public Cell removeCell(int col, int row) {
        return cells.remove(generateKey(col, row));
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    /**
     * Bounding rectangle of all populated cells, or null for an empty sheet.
     */
    public AreaRef usedRange() {
        if (cells.isEmpty()) {
            return null;
        }
        int minCol = Integer.MAX_VALUE;
        int minRow = Integer.MAX_VALUE;
        int maxCol = -1;
        int maxRow = -1;
        for (Cell cell : cells.values()) {
            minCol = Math.min(minCol, cell.getCol());
            minRow = Math.min(minRow, cell.getRow());
            maxCol = Math.max(maxCol, cell.getCol());
            maxRow = Math.max(maxRow, cell.getRow());
        }
        return new AreaRef(name, minCol, minRow, maxCol, maxRow);
    }

    /**
     * Builds a consistent key like "1:9" for col=1, row=9.
     */
    private String generateKey(int col, int row) {
        return col + ":" + row;
    }
}
