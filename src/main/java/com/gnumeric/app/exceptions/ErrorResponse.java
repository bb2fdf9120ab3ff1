package com.gnumeric.app.exceptions;

/**
 * Error body returned by the REST endpoints, for example:
 * {
 *   "code": "INDEX_OUT_OF_RANGE",
 *   "message": "No cell exists at position (0, 2)"
 * }
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
