package com.dealgrid.app.exceptions;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Maps engine and registry exceptions to a status and an {@link ErrorResponse}
 * carrying a stable code and the request path.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidAddressException.class)
    public ResponseEntity<ErrorResponse> handleInvalidAddress(InvalidAddressException ex, HttpServletRequest request) {
        ErrorResponse error = new ErrorResponse("INVALID_ADDRESS", ex.getMessage(), request.getRequestURI());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(WorkbookNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleWorkbookNotFound(WorkbookNotFoundException ex, HttpServletRequest request) {
        ErrorResponse error = new ErrorResponse("WORKBOOK_NOT_FOUND", ex.getMessage(), request.getRequestURI());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex, HttpServletRequest request) {
        ErrorResponse error = new ErrorResponse("SHEET_NOT_FOUND", ex.getMessage(), request.getRequestURI());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(SheetOperationException.class)
    public ResponseEntity<ErrorResponse> handleSheetOperation(SheetOperationException ex, HttpServletRequest request) {
        log.warn("Rejected sheet operation on {}: {}", request.getRequestURI(), ex.getMessage());
        ErrorResponse error = new ErrorResponse("SHEET_OPERATION_REJECTED", ex.getMessage(), request.getRequestURI());
        return new ResponseEntity<>(error, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex, HttpServletRequest request) {
        ErrorResponse error = new ErrorResponse("BAD_REQUEST", ex.getMessage(), request.getRequestURI());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex, HttpServletRequest request) {
        // Catch-all for runtime exceptions not handled above
        log.error("Unhandled error on {}", request.getRequestURI(), ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage(), request.getRequestURI());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
