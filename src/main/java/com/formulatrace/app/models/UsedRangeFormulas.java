package com.formulatrace.app.models;

import java.util.List;

/**
 * Formula text of every cell in a sheet's used range.
 * Row i, column j of the grid is the cell offset (j, i) from the top-left
 * of areaAddress. Entries are null or non-formula text for plain cells.
 */
public final class UsedRangeFormulas {
    private final String sheet;
    private final String areaAddress;
    private final List<List<String>> formulas;

    public UsedRangeFormulas(String sheet, String areaAddress, List<List<String>> formulas) {
        this.sheet = sheet;
        this.areaAddress = areaAddress;
        this.formulas = formulas;
    }

    public String getSheet() {
        return sheet;
    }

    public String getAreaAddress() {
        return areaAddress;
    }

    public List<List<String>> getFormulas() {
        return formulas;
    }
}
