package com.formulatrace.app.exceptions;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body returned by every failed workbook or trace request.
 * sheet is only present when the failure is tied to one sheet:
 * {
 *   "code": "SHEET_NOT_FOUND",
 *   "message": "Sheet not found: Archive",
 *   "sheet": "Archive"
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String code;
    private final String message;
    private final String sheet;

    public ErrorResponse(String code, String message) {
        this(code, message, null);
    }

    public ErrorResponse(String code, String message, String sheet) {
        this.code = code;
        this.message = message;
        this.sheet = sheet;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getSheet() {
        return sheet;
    }
}
