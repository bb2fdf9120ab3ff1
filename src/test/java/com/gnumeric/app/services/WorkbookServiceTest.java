package com.gnumeric.app.services;

import com.gnumeric.app.config.WorkbookProperties;
import com.gnumeric.app.exceptions.CellIndexOutOfRangeException;
import com.gnumeric.app.exceptions.DuplicateTitleException;
import com.gnumeric.app.exceptions.InvalidTypeException;
import com.gnumeric.app.exceptions.SheetNotFoundException;
import com.gnumeric.app.exceptions.UnsupportedSheetOperationException;
import com.gnumeric.app.exceptions.WorkbookFormatException;
import com.gnumeric.app.exceptions.WorkbookNotFoundException;
import com.gnumeric.app.models.CellOrder;
import com.gnumeric.app.models.CellValueRequest;
import com.gnumeric.app.models.CellView;
import com.gnumeric.app.models.Coordinate;
import com.gnumeric.app.models.Dimension;
import com.gnumeric.app.models.ExpressionEntry;
import com.gnumeric.app.models.SheetRequest;
import com.gnumeric.app.models.SheetType;
import com.gnumeric.app.models.ValueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for WorkbookService logic, using an in-memory approach
 * (no HTTP or external server).
 */
class WorkbookServiceTest {

    private WorkbookService workbookService;
    private long workbookId;

    @BeforeEach
    void setUp() {
        WorkbookProperties properties = new WorkbookProperties();
        properties.setDefaultRows(100);
        properties.setDefaultColumns(50);
        properties.setCompressOnSave(false);
        workbookService = new WorkbookService(properties);

        workbookId = workbookService.createWorkbook();
        workbookService.createSheet(workbookId, new SheetRequest("Data", SheetType.REGULAR));
    }

    private CellView set(int row, int column, Object value, String valueType) {
        return workbookService.setCellValue(workbookId, "Data", row, column, new CellValueRequest(value, valueType));
    }

    private static byte[] sample() throws IOException {
        try (InputStream in = WorkbookServiceTest.class.getResourceAsStream("/samples/test.xml")) {
            assertNotNull(in);
            return in.readAllBytes();
        }
    }

    /**
     * Literal values are stored with the inferred type.
     */
    @Test
    void testSetLiteralValues() {
        assertEquals(ValueType.INTEGER, set(0, 0, 42, null).getValueType());
        assertEquals(ValueType.FLOAT, set(0, 1, 2.5, "infer").getValueType());
        assertEquals(ValueType.BOOLEAN, set(0, 2, true, null).getValueType());
        assertEquals(ValueType.STRING, set(0, 3, "hello", null).getValueType());

        CellView expression = set(0, 4, "=A1*2", null);
        assertEquals(ValueType.EXPR, expression.getValueType());
        assertEquals("=A1*2", expression.getValue());

        CellView bool = workbookService.getCell(workbookId, "Data", 0, 2);
        assertEquals("TRUE", bool.getText());
        assertEquals(true, bool.getValue());
    }

    /**
     * "keep" stores a new value under the cell's existing type.
     */
    @Test
    void testKeepDirective() {
        set(1, 1, "text", null);
        CellView kept = set(1, 1, 7, "keep");
        assertEquals(ValueType.STRING, kept.getValueType());
        assertEquals("7", kept.getValue());
    }

    @Test
    void testExplicitDirective() {
        CellView error = set(2, 2, "#REF!", "ERROR");
        assertEquals(ValueType.ERROR, error.getValueType());
        assertEquals("#REF!", error.getText());
    }

    /**
     * A bad directive or value fails before the sheet is touched.
     */
    @Test
    void testInvalidRequestLeavesSheetUntouched() {
        assertThrows(InvalidTypeException.class, () -> set(3, 3, 1, "NUMBER"));
        assertThrows(InvalidTypeException.class, () -> set(3, 3, List.of(1, 2), null));
        assertTrue(workbookService.getCells(workbookId, "Data", true, CellOrder.NONE).isEmpty());
    }

    @Test
    void testOutOfBounds() {
        // default size from properties: 100 rows, 50 columns
        assertThrows(CellIndexOutOfRangeException.class, () -> set(100, 0, 1, null));
        assertThrows(CellIndexOutOfRangeException.class, () -> set(0, 50, 1, null));
        assertThrows(CellIndexOutOfRangeException.class, () -> workbookService.getCell(workbookId, "Data", 5, 5));
    }

    @Test
    void testDimensionFollowsData() {
        assertEquals(new Dimension(-1, -1, -1, -1), workbookService.getDimension(workbookId, "Data"));
        set(5, 5, 42, null);
        assertEquals(new Dimension(5, 5, 5, 5), workbookService.getDimension(workbookId, "Data"));
        set(5, 5, "", null);
        assertEquals(new Dimension(-1, -1, -1, -1), workbookService.getDimension(workbookId, "Data"));
    }

    @Test
    void testShareExpression() {
        set(0, 0, "=max(A2:A5)", null);
        CellView shared = workbookService.shareExpression(workbookId, "Data", 0, 0, 4, 4);
        assertEquals(ValueType.EXPR, shared.getValueType());
        assertEquals("1", shared.getExpressionId());
        assertNull(shared.getText());
        assertEquals("=max(A2:A5)", shared.getValue());

        Map<String, ExpressionEntry> map = workbookService.getExpressionMap(workbookId, "Data");
        assertEquals(Map.of("1", new ExpressionEntry(new Coordinate(0, 0), "=max(A2:A5)")), map);
    }

    @Test
    void testShareNonExpressionFails() {
        set(0, 0, 12, null);
        assertThrows(InvalidTypeException.class,
                () -> workbookService.shareExpression(workbookId, "Data", 0, 0, 1, 1));
    }

    @Test
    void testCellsInRowMajorOrder() {
        set(3, 0, "c", null);
        set(1, 4, "b", null);
        set(1, 2, "a", null);

        List<String> texts = workbookService.getCells(workbookId, "Data", false, CellOrder.ROW_MAJOR).stream()
                .map(CellView::getText)
                .collect(Collectors.toList());
        assertEquals(List.of("a", "b", "c"), texts);
    }

    @Test
    void testSheetManagement() {
        List<String> names = workbookService.createSheet(workbookId, new SheetRequest("Chart", SheetType.OBJECT));
        assertEquals(List.of("Data", "Chart"), names);
        assertEquals(names, workbookService.getSheetNames(workbookId));

        assertThrows(DuplicateTitleException.class,
                () -> workbookService.createSheet(workbookId, new SheetRequest("Data", SheetType.REGULAR)));
        assertThrows(InvalidTypeException.class,
                () -> workbookService.createSheet(workbookId, new SheetRequest(null, SheetType.REGULAR)));
        assertThrows(UnsupportedSheetOperationException.class,
                () -> workbookService.getDimension(workbookId, "Chart"));
    }

    @Test
    void testUnknownWorkbookAndSheet() {
        assertThrows(WorkbookNotFoundException.class, () -> workbookService.getSheetNames(-1));
        assertThrows(SheetNotFoundException.class, () -> workbookService.getDimension(workbookId, "Missing"));
    }

    @Test
    void testUploadAndDownload() throws IOException {
        long uploaded = workbookService.loadWorkbook(sample());
        assertEquals(List.of("Sheet1", "BoundingRegion", "CellTypes", "Graph1"),
                workbookService.getSheetNames(uploaded));
        assertEquals(new Dimension(6, 3, 12, 9), workbookService.getDimension(uploaded, "BoundingRegion"));

        String xml = new String(workbookService.saveWorkbook(uploaded), StandardCharsets.UTF_8);
        assertTrue(xml.contains("Sheet1"));
        // empty cell (20, 20) of BoundingRegion is dropped on save
        assertFalse(xml.contains("Row=\"20\""));

        long reloaded = workbookService.loadWorkbook(xml.getBytes(StandardCharsets.UTF_8));
        assertEquals(workbookService.getSheetNames(uploaded), workbookService.getSheetNames(reloaded));
    }

    @Test
    void testUploadGarbageFails() {
        assertThrows(WorkbookFormatException.class,
                () -> workbookService.loadWorkbook("not a workbook".getBytes(StandardCharsets.UTF_8)));
        assertThrows(WorkbookFormatException.class,
                () -> workbookService.loadWorkbook(new byte[]{0x1f, (byte) 0x8b, 0x08}));
    }

    @Test
    void testWorkbooksAreIndependent() {
        long other = workbookService.createWorkbook();
        workbookService.createSheet(other, new SheetRequest("Data", SheetType.REGULAR));
        set(0, 0, "=A2", null);
        assertThrows(CellIndexOutOfRangeException.class, () -> workbookService.getCell(other, "Data", 0, 0));
    }

    /**
     * Simple concurrency test: ensures no concurrency errors
     * when two threads set different cells simultaneously.
     */
    @Test
    void testConcurrentCellUpdates() throws InterruptedException {
        Runnable task1 = () -> {
            for (int i = 0; i < 50; i++) {
                set(i, 0, "foo", null);
            }
        };
        Runnable task2 = () -> {
            for (int i = 0; i < 50; i++) {
                set(i, 1, true, null);
            }
        };

        Thread t1 = new Thread(task1);
        Thread t2 = new Thread(task2);

        t1.start();
        t2.start();
        t1.join();
        t2.join();

        List<CellView> cells = workbookService.getCells(workbookId, "Data", false, CellOrder.NONE);
        assertEquals(100, cells.size());
        assertEquals("foo", workbookService.getCell(workbookId, "Data", 49, 0).getValue());
        assertEquals(true, workbookService.getCell(workbookId, "Data", 49, 1).getValue());
    }

    /**
     * Readers of a freshly uploaded workbook all see the same sheets.
     */
    @Test
    void testConcurrentReadsOfUploadedWorkbook() throws Exception {
        long uploaded = workbookService.loadWorkbook(sample());
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Dimension>> results = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                results.add(executor.submit(() -> workbookService.getDimension(uploaded, "BoundingRegion")));
            }
            for (Future<Dimension> result : results) {
                assertEquals(new Dimension(6, 3, 12, 9), result.get());
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(List.of("Sheet1", "BoundingRegion", "CellTypes", "Graph1"),
                workbookService.getSheetNames(uploaded));
    }

    @Test
    void testUploadWithDoctypeFails() {
        String xml = "<!DOCTYPE gnm:Workbook [<!ENTITY s \"x\">]>"
                + "<gnm:Workbook xmlns:gnm=\"http://www.gnumeric.org/v10.dtd\">"
                + "<gnm:SheetNameIndex><gnm:SheetName gnm:Cols=\"1\" gnm:Rows=\"1\">&s;</gnm:SheetName></gnm:SheetNameIndex>"
                + "<gnm:Sheets><gnm:Sheet/></gnm:Sheets></gnm:Workbook>";
        assertThrows(WorkbookFormatException.class,
                () -> workbookService.loadWorkbook(xml.getBytes(StandardCharsets.UTF_8)));
    }
}
