package com.formulatrace.app.exceptions;

/**
 * Thrown when an address or request names a sheet the workbook does not
 * have. sheetName is null when no particular sheet could be blamed, e.g.
 * an empty workbook or an address that does not parse.
 */
public class SheetNotFoundException extends RuntimeException {
    private final String sheetName;

    public SheetNotFoundException(String message) {
        super(message);
        this.sheetName = null;
    }

    public static SheetNotFoundException forSheet(String sheetName) {
        return new SheetNotFoundException("Sheet not found: " + sheetName, sheetName);
    }

    private SheetNotFoundException(String message, String sheetName) {
        super(message);
        this.sheetName = sheetName;
    }

    public String getSheetName() {
        return sheetName;
    }
}
