package com.formulatrace.app.formula;

import com.formulatrace.app.models.AreaRef;
import com.formulatrace.app.models.CellAddress;
import com.formulatrace.app.models.ParsedReference;
import com.formulatrace.app.util.CellAddresses;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Extracts cell and range references from formula text.
 *
 * Recognized forms:
 * - A1, $A$1, A1:C3
 * - Sheet2!D4, Sheet2!D4:D9
 * - 'Sales, Q1'!A1 (a doubled quote inside the name is a literal quote)
 *
 * Text inside double-quoted string literals is never matched, and names
 * that merely look like cells (LOG10(, A1B, Table1[Col]) are skipped.
 * Malformed tokens are dropped; parsing never fails as a whole.
 * Each distinct area is returned once, in order of first appearance.
 */
public final class FormulaReferenceParser {

    private FormulaReferenceParser() {
    }

    public static List<ParsedReference> extractReferences(String formula, String ownerSheet) {
        Set<AreaRef> areas = new LinkedHashSet<>();
        if (formula == null || formula.isEmpty()) {
            return new ArrayList<>();
        }

        int i = 0;
        int n = formula.length();
        while (i < n) {
            char c = formula.charAt(i);

            if (c == '"') {
                i = skipStringLiteral(formula, i);
                continue;
            }

            if (c == '\'') {
                int afterName = quotedNameEnd(formula, i);
                if (afterName > 0 && afterName < n && formula.charAt(afterName) == '!') {
                    String sheet = formula.substring(i + 1, afterName - 1).replace("''", "'");
                    i = readArea(formula, afterName + 1, sheet, areas);
                } else {
                    i++;
                }
                continue;
            }

            if (isTokenStart(c) && (i == 0 || !isIdentifierChar(formula.charAt(i - 1)))) {
                int nameEnd = identifierEnd(formula, i);
                if (c != '$' && nameEnd < n && formula.charAt(nameEnd) == '!') {
                    String sheet = formula.substring(i, nameEnd);
                    i = readArea(formula, nameEnd + 1, sheet, areas);
                } else if (i > 0 && formula.charAt(i - 1) == '!') {
                    // Qualified by a prefix the scanner could not read as a sheet name
                    i = Math.max(nameEnd, i + 1);
                } else {
                    int next = readArea(formula, i, ownerSheet, areas);
                    i = Math.max(next, Math.max(nameEnd, i + 1));
                }
                continue;
            }

            i++;
        }

        List<ParsedReference> references = new ArrayList<>(areas.size());
        for (AreaRef area : areas) {
            references.add(new ParsedReference(area));
        }
        return references;
    }

    /**
     * True when any reference in the formula covers the target cell.
     * Unqualified references resolve against the formula's own sheet.
     */
    public static boolean referencesCell(String formula, String ownerSheet, CellAddress target) {
        for (ParsedReference reference : extractReferences(formula, ownerSheet)) {
            if (reference.references(target)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reads "cell" or "cell:cell" at start. On success adds the area and
     * returns the index just past it; otherwise returns start unchanged.
     */
    private static int readArea(String formula, int start, String sheet, Set<AreaRef> out) {
        int firstEnd = cellTokenEnd(formula, start);
        if (firstEnd < 0) {
            return start;
        }
        int end = firstEnd;
        int secondEnd = -1;
        if (end < formula.length() && formula.charAt(end) == ':') {
            secondEnd = cellTokenEnd(formula, end + 1);
        }
        if (secondEnd > 0) {
            end = secondEnd;
        }

        // A trailing identifier character or call/structured-ref bracket
        // means this was a name, not a reference.
        if (end < formula.length()) {
            char next = formula.charAt(end);
            if (isIdentifierChar(next) || next == '(' || next == '[') {
                return identifierEnd(formula, end);
            }
        }

        try {
            int[] first = CellAddresses.parseCell(formula.substring(start, firstEnd));
            int[] second = secondEnd > 0
                    ? CellAddresses.parseCell(formula.substring(firstEnd + 1, secondEnd))
                    : first;
            out.add(AreaRef.spanning(sheet, first[0], first[1], second[0], second[1]));
        } catch (IllegalArgumentException e) {
            // Malformed token (e.g. column past XFD): drop it and keep scanning
        }
        return end;
    }

    /**
     * Matches \$?[A-Za-z]+\$?[0-9]+ at start and returns the end index, or -1.
     * Range validation happens later in CellAddresses.parseCell.
     */
    private static int cellTokenEnd(String formula, int start) {
        int n = formula.length();
        int i = start;
        if (i < n && formula.charAt(i) == '$') i++;
        int lettersStart = i;
        while (i < n && isAsciiLetter(formula.charAt(i))) i++;
        if (i == lettersStart) return -1;
        if (i < n && formula.charAt(i) == '$') i++;
        int digitsStart = i;
        while (i < n && Character.isDigit(formula.charAt(i))) i++;
        if (i == digitsStart) return -1;
        return i;
    }

    private static int skipStringLiteral(String formula, int start) {
        int i = start + 1;
        while (i < formula.length()) {
            if (formula.charAt(i) == '"') {
                if (i + 1 < formula.length() && formula.charAt(i + 1) == '"') {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return formula.length();
    }

    /**
     * Index just past the closing quote of a quoted sheet name, or -1 if unterminated.
     */
    private static int quotedNameEnd(String formula, int start) {
        int i = start + 1;
        while (i < formula.length()) {
            if (formula.charAt(i) == '\'') {
                if (i + 1 < formula.length() && formula.charAt(i + 1) == '\'') {
                    i += 2;
                    continue;
                }
                return i == start + 1 ? -1 : i + 1;
            }
            i++;
        }
        return -1;
    }

    private static int identifierEnd(String formula, int start) {
        int i = start;
        if (i < formula.length() && formula.charAt(i) == '$') {
            return i + 1;
        }
        while (i < formula.length() && isIdentifierChar(formula.charAt(i))) i++;
        return i;
    }

    private static boolean isTokenStart(char c) {
        return c == '$' || c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierChar(char c) {
        return c == '_' || c == '.' || Character.isLetterOrDigit(c);
    }

    private static boolean isAsciiLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }
}
