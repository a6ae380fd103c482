package com.formulatrace.app.models;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Point-in-time read of one cell from a workbook data source.
 * address is the resolved, sheet-qualified address of the cell.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CellSnapshot {
    private final String address;
    private final Object value;
    private final String formula;
    private final String numberFormat;

    public CellSnapshot(String address, Object value, String formula, String numberFormat) {
        this.address = address;
        this.value = value;
        // Only "="-prefixed text counts as a formula
        this.formula = formula != null && formula.startsWith("=") ? formula : null;
        this.numberFormat = numberFormat != null && !numberFormat.isEmpty() ? numberFormat : null;
    }

    public static CellSnapshot blank(String address) {
        return new CellSnapshot(address, null, null, null);
    }

    public String getAddress() {
        return address;
    }

    public Object getValue() {
        return value;
    }

    public String getFormula() {
        return formula;
    }

    public String getNumberFormat() {
        return numberFormat;
    }

    public boolean hasFormula() {
        return formula != null;
    }
}
