package com.dealgrid.app.exceptions;

/**
 * Error body returned by {@link GlobalExceptionHandler}, e.g.
 * { "code": "INVALID_ADDRESS", "message": "Invalid cell address: A0", "path": "/workbooks/1/cells/A0" }
 */
public class ErrorResponse {
    private final String code;
    private final String message;
    private final String path;

    public ErrorResponse(String code, String message, String path) {
        this.code = code;
        this.message = message;
        this.path = path;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getPath() {
        return path;
    }
}
