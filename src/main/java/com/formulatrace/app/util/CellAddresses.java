package com.formulatrace.app.util;

import com.formulatrace.app.models.CellAddress;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for A1-style addresses: column letters, sheet qualification
 * and quoting, and single-cell parsing.
 */
public final class CellAddresses {

    public static final int MAX_COLUMNS = 16_384;
    public static final int MAX_ROWS = 1_048_576;

    // "$B$7", "b7", "AA10"
    private static final Pattern CELL_PATTERN = Pattern.compile("^\\$?([A-Za-z]{1,3})\\$?(\\d{1,7})$");

    // Sheet names that can be written without quotes
    private static final Pattern BARE_SHEET_PATTERN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]*$");

    private CellAddresses() {
    }

    /**
     * 0-based column index to letters: 0 -> "A", 25 -> "Z", 26 -> "AA".
     */
    public static String columnLetters(int col) {
        if (col < 0 || col >= MAX_COLUMNS) {
            throw new IllegalArgumentException("Column index out of range: " + col);
        }
        StringBuilder sb = new StringBuilder(3);
        int n = col + 1;
        while (n > 0) {
            int rem = (n - 1) % 26;
            sb.append((char) ('A' + rem));
            n = (n - 1) / 26;
        }
        return sb.reverse().toString();
    }

    /**
     * Column letters to 0-based index: "A" -> 0, "AA" -> 26. Case-insensitive.
     */
    public static int columnIndex(String letters) {
        if (letters == null || letters.isEmpty()) {
            throw new IllegalArgumentException("Empty column letters");
        }
        int n = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z') {
                throw new IllegalArgumentException("Invalid column letters: " + letters);
            }
            n = n * 26 + (c - 'A' + 1);
        }
        if (n > MAX_COLUMNS) {
            throw new IllegalArgumentException("Column out of range: " + letters);
        }
        return n - 1;
    }

    public static String cellAddress(int col, int row) {
        return columnLetters(col) + (row + 1);
    }

    /**
     * Parses an unqualified single cell such as "B7" or "$B$7" into 0-based
     * coordinates { col, row }.
     *
     * @throws IllegalArgumentException if the token is not a valid cell
     */
    public static int[] parseCell(String token) {
        Matcher m = CELL_PATTERN.matcher(token == null ? "" : token.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a cell address: " + token);
        }
        int col = columnIndex(m.group(1));
        long rowNumber = Long.parseLong(m.group(2));
        if (rowNumber < 1 || rowNumber > MAX_ROWS) {
            throw new IllegalArgumentException("Row out of range: " + token);
        }
        return new int[]{col, (int) rowNumber - 1};
    }

    /**
     * Writes a sheet name the way it appears in a formula: bare when it is a
     * plain identifier, otherwise single-quoted with embedded quotes doubled.
     */
    public static String formatSheetName(String sheet) {
        if (BARE_SHEET_PATTERN.matcher(sheet).matches() && !looksLikeCell(sheet)) {
            return sheet;
        }
        return "'" + sheet.replace("'", "''") + "'";
    }

    public static String qualify(String sheet, String localAddress) {
        if (sheet == null || sheet.isEmpty()) {
            return localAddress;
        }
        return formatSheetName(sheet) + "!" + localAddress;
    }

    /**
     * Splits "Sheet1!A1:B2" or "'My Sheet'!C3" into { sheet, address }.
     * The sheet element is null when the input has no qualifier.
     */
    public static String[] splitQualified(String address) {
        String trimmed = address.trim();
        int bang = trimmed.lastIndexOf('!');
        if (bang < 0) {
            return new String[]{null, trimmed};
        }
        String sheetPart = trimmed.substring(0, bang).trim();
        String local = trimmed.substring(bang + 1).trim();
        if (sheetPart.length() >= 2 && sheetPart.startsWith("'") && sheetPart.endsWith("'")) {
            sheetPart = sheetPart.substring(1, sheetPart.length() - 1).replace("''", "'");
        }
        return new String[]{sheetPart, local};
    }

    /**
     * Splits a multi-area address on commas that sit outside quoted sheet
     * names: "Sheet1!A1:B2,Sheet1!D4" -> ["Sheet1!A1:B2", "Sheet1!D4"].
     */
    public static List<String> splitAreas(String address) {
        List<String> areas = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < address.length(); i++) {
            char c = address.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
            }
            if (c == ',' && !quoted) {
                areas.add(current.toString().trim());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        areas.add(current.toString().trim());
        return areas;
    }

    /**
     * Resolves the first cell of the first area of an address. Tolerates
     * absolute markers, ranges and comma-separated areas.
     *
     * @return the parsed cell, or null when the address cannot be parsed
     */
    public static CellAddress parseQualified(String address, String defaultSheet) {
        if (address == null || address.isBlank()) {
            return null;
        }
        String[] parts = splitQualified(splitAreas(address).get(0));
        String sheet = parts[0] != null ? parts[0] : defaultSheet;
        if (sheet == null || sheet.isEmpty()) {
            return null;
        }
        String firstCell = parts[1].split(":")[0].trim();
        if (firstCell.isEmpty()) {
            return null;
        }
        try {
            int[] cell = parseCell(firstCell);
            return new CellAddress(sheet, cell[0], cell[1]);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Canonical qualified single-cell form of an address, or null.
     */
    public static String normalize(String address, String defaultSheet) {
        CellAddress parsed = parseQualified(address, defaultSheet);
        return parsed == null ? null : parsed.toQualifiedAddress();
    }

    /**
     * True when the input names exactly one cell: no range and no multi-area list.
     */
    public static boolean isSingleCell(String address) {
        if (address == null || address.isBlank()) {
            return false;
        }
        List<String> areas = splitAreas(address);
        return areas.size() == 1 && !splitQualified(areas.get(0))[1].contains(":");
    }

    public static String sheetKey(String sheet) {
        return sheet == null ? "" : sheet.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean sameSheet(String a, String b) {
        return sheetKey(a).equals(sheetKey(b));
    }

    private static boolean looksLikeCell(String name) {
        try {
            parseCell(name);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
