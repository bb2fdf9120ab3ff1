package com.gnumeric.app.controllers;

import com.gnumeric.app.models.CellOrder;
import com.gnumeric.app.models.CellValueRequest;
import com.gnumeric.app.models.CellView;
import com.gnumeric.app.models.Dimension;
import com.gnumeric.app.models.ExpressionEntry;
import com.gnumeric.app.models.SheetRequest;
import com.gnumeric.app.services.WorkbookService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for Gnumeric workbooks held in memory.
 * "/workbook" is the base path; sheets are addressed by title.
 */
@RestController
@RequestMapping("/workbook")
public class WorkbookController {

    @Autowired
    private WorkbookService workbookService;

    /**
     * POST /workbook
     * Creates an empty workbook, returns its ID.
     */
    @PostMapping
    public ResponseEntity<Long> createWorkbook() {
        return ResponseEntity.ok(workbookService.createWorkbook());
    }

    /**
     * POST /workbook/upload
     * Body: the raw .gnumeric file (gzip-compressed or plain XML).
     * Returns the new workbook's ID.
     */
    @PostMapping(value = "/upload", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public ResponseEntity<Long> uploadWorkbook(@RequestBody byte[] content) {
        return ResponseEntity.ok(workbookService.loadWorkbook(content));
    }

    /**
     * GET /workbook/{workbookId}
     * Downloads the workbook after dropping empty cells.
     */
    @GetMapping(value = "/{workbookId}", produces = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public ResponseEntity<byte[]> downloadWorkbook(@PathVariable long workbookId) {
        return ResponseEntity.ok(workbookService.saveWorkbook(workbookId));
    }

    /**
     * GET /workbook/{workbookId}/sheets
     * Returns the sheet titles in workbook order.
     */
    @GetMapping("/{workbookId}/sheets")
    public ResponseEntity<List<String>> getSheetNames(@PathVariable long workbookId) {
        return ResponseEntity.ok(workbookService.getSheetNames(workbookId));
    }

    /**
     * POST /workbook/{workbookId}/sheets
     * Body: { "title": "Sheet1", "type": "REGULAR", "rows": 100, "columns": 50 }
     * Appends a sheet, returns the updated sheet titles.
     */
    @PostMapping("/{workbookId}/sheets")
    public ResponseEntity<List<String>> createSheet(@PathVariable long workbookId, @RequestBody SheetRequest request) {
        return ResponseEntity.ok(workbookService.createSheet(workbookId, request));
    }

    /**
     * PUT /workbook/{workbookId}/sheet/{title}/cell/{row}/{column}
     * Body: { "value": 42, "valueType": "infer" }
     * Creates the cell if needed and stores the value.
     */
    @PutMapping("/{workbookId}/sheet/{title}/cell/{row}/{column}")
    public ResponseEntity<CellView> setCellValue(
            @PathVariable long workbookId,
            @PathVariable String title,
            @PathVariable int row,
            @PathVariable int column,
            @RequestBody CellValueRequest request
    ) {
        return ResponseEntity.ok(workbookService.setCellValue(workbookId, title, row, column, request));
    }

    /**
     * PUT /workbook/{workbookId}/sheet/{title}/cell/{row}/{column}/expression?fromRow=..&fromColumn=..
     * Makes the cell share the expression of the cell at (fromRow, fromColumn).
     */
    @PutMapping("/{workbookId}/sheet/{title}/cell/{row}/{column}/expression")
    public ResponseEntity<CellView> shareExpression(
            @PathVariable long workbookId,
            @PathVariable String title,
            @PathVariable int row,
            @PathVariable int column,
            @RequestParam int fromRow,
            @RequestParam int fromColumn
    ) {
        return ResponseEntity.ok(workbookService.shareExpression(workbookId, title, fromRow, fromColumn, row, column));
    }

    /**
     * GET /workbook/{workbookId}/sheet/{title}/cell/{row}/{column}
     * Returns an existing cell; 404 if there is none.
     */
    @GetMapping("/{workbookId}/sheet/{title}/cell/{row}/{column}")
    public ResponseEntity<CellView> getCell(
            @PathVariable long workbookId,
            @PathVariable String title,
            @PathVariable int row,
            @PathVariable int column
    ) {
        return ResponseEntity.ok(workbookService.getCell(workbookId, title, row, column));
    }

    /**
     * GET /workbook/{workbookId}/sheet/{title}/dimension
     * Returns the bounding rectangle of the sheet's data.
     */
    @GetMapping("/{workbookId}/sheet/{title}/dimension")
    public ResponseEntity<Dimension> getDimension(@PathVariable long workbookId, @PathVariable String title) {
        return ResponseEntity.ok(workbookService.getDimension(workbookId, title));
    }

    /**
     * GET /workbook/{workbookId}/sheet/{title}/cells?includeEmpty=false&order=none
     * order is one of none, row, column.
     */
    @GetMapping("/{workbookId}/sheet/{title}/cells")
    public ResponseEntity<List<CellView>> getCells(
            @PathVariable long workbookId,
            @PathVariable String title,
            @RequestParam(defaultValue = "false") boolean includeEmpty,
            @RequestParam(defaultValue = "none") String order
    ) {
        return ResponseEntity.ok(workbookService.getCells(workbookId, title, includeEmpty, CellOrder.fromValue(order)));
    }

    /**
     * GET /workbook/{workbookId}/sheet/{title}/expressions
     * Returns { "<exprId>": { "coordinate": {row, column}, "text": "=..." }, ... }.
     */
    @GetMapping("/{workbookId}/sheet/{title}/expressions")
    public ResponseEntity<Map<String, ExpressionEntry>> getExpressionMap(@PathVariable long workbookId,
                                                                         @PathVariable String title) {
        return ResponseEntity.ok(workbookService.getExpressionMap(workbookId, title));
    }
}
