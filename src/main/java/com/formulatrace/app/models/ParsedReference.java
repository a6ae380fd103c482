package com.formulatrace.app.models;

/**
 * One reference extracted from formula text.
 * The anchor address is the unqualified top-left cell of the area, ready
 * for a follow-up single-cell read.
 */
public final class ParsedReference {
    private final String sheet;
    private final AreaRef area;
    private final String anchorAddress;

    public ParsedReference(AreaRef area) {
        this.sheet = area.getSheet();
        this.area = area;
        this.anchorAddress = area.topLeft().toLocalAddress();
    }

    public String getSheet() {
        return sheet;
    }

    public AreaRef getArea() {
        return area;
    }

    public String getAnchorAddress() {
        return anchorAddress;
    }

    /**
     * The anchor cell with its sheet, e.g. "Calc!A1".
     */
    public String getQualifiedAnchor() {
        return area.topLeft().toQualifiedAddress();
    }

    /**
     * The whole area with its sheet, e.g. "Calc!A1:B2".
     */
    public String getQualifiedAddress() {
        return area.toQualifiedAddress();
    }

    public boolean references(CellAddress target) {
        return area.contains(target);
    }

    @Override
    public String toString() {
        return getQualifiedAddress();
    }
}
