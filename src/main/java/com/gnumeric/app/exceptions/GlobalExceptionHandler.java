package com.gnumeric.app.exceptions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * Catches custom exceptions from anywhere in the controllers or services,
 * returning user-friendly error JSON with an HTTP 4xx code instead of 500.
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(CellIndexOutOfRangeException.class)
    public ResponseEntity<ErrorResponse> handleIndexOutOfRange(CellIndexOutOfRangeException ex) {
        ErrorResponse error = new ErrorResponse("INDEX_OUT_OF_RANGE", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(UnsupportedSheetOperationException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedOperation(UnsupportedSheetOperationException ex) {
        ErrorResponse error = new ErrorResponse("UNSUPPORTED_OPERATION", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(CrossSheetExpressionException.class)
    public ResponseEntity<ErrorResponse> handleCrossSheet(CrossSheetExpressionException ex) {
        ErrorResponse error = new ErrorResponse("CROSS_SHEET_EXPRESSION", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(UnrecognizedCellTypeException.class)
    public ResponseEntity<ErrorResponse> handleUnrecognizedCellType(UnrecognizedCellTypeException ex) {
        ErrorResponse error = new ErrorResponse("UNRECOGNIZED_CELL_TYPE", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(StyleNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleStyleNotFound(StyleNotFoundException ex) {
        ErrorResponse error = new ErrorResponse("STYLE_NOT_FOUND", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(InvalidTypeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidType(InvalidTypeException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_TYPE", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(WorkbookFormatException.class)
    public ResponseEntity<ErrorResponse> handleWorkbookFormat(WorkbookFormatException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_WORKBOOK", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(DuplicateTitleException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateTitle(DuplicateTitleException ex) {
        ErrorResponse error = new ErrorResponse("DUPLICATE_TITLE", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.CONFLICT);
    }

    @ExceptionHandler(SheetNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSheetNotFound(SheetNotFoundException ex) {
        ErrorResponse error = new ErrorResponse("SHEET_NOT_FOUND", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(WorkbookNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleWorkbookNotFound(WorkbookNotFoundException ex) {
        ErrorResponse error = new ErrorResponse("WORKBOOK_NOT_FOUND", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        ErrorResponse error = new ErrorResponse("INVALID_ARGUMENT", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleGeneric(RuntimeException ex) {
        // Catch-all for anything not mapped above
        logger.error("Unhandled error", ex);
        ErrorResponse error = new ErrorResponse("SERVER_ERROR", ex.getMessage());
        return new ResponseEntity<>(error, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
