package com.gnumeric.app.services;

import com.gnumeric.app.config.WorkbookProperties;
import com.gnumeric.app.exceptions.InvalidTypeException;
import com.gnumeric.app.exceptions.WorkbookFormatException;
import com.gnumeric.app.exceptions.WorkbookNotFoundException;
import com.gnumeric.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Holds workbooks in memory and applies cell and sheet operations to them.
 * The document model itself is single-threaded, so every workbook is guarded
 * by its own read/write lock here.
 */
@Service
public class WorkbookService {

    private static final Logger logger = LoggerFactory.getLogger(WorkbookService.class);

    // Generates unique IDs for newly created or uploaded workbooks
    private static final AtomicLong ID_GENERATOR = new AtomicLong(1);

    // All workbooks live here in memory; no persistent store
    private final Map<Long, StoredWorkbook> workbooks = new ConcurrentHashMap<>();

    private final WorkbookProperties properties;

    public WorkbookService(WorkbookProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates an empty workbook and returns its ID.
     */
    public long createWorkbook() {
        return register(new Workbook());
    }

    /**
     * Parses an uploaded .gnumeric file (compressed or plain XML) and returns its ID.
     */
    public long loadWorkbook(byte[] content) {
        try {
            return register(Workbook.load(new ByteArrayInputStream(content)));
        } catch (IOException e) {
            // truncated gzip streams and the like surface as I/O errors
            throw new WorkbookFormatException("Failed to read workbook: " + e.getMessage(), e);
        }
    }

    /**
     * Serializes a workbook. Saving compacts the sheets, so it takes the write lock.
     */
    public byte[] saveWorkbook(long workbookId) {
        return write(workbookId, workbook -> {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            try {
                workbook.save(out, properties.isCompressOnSave());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write workbook " + workbookId, e);
            }
            return out.toByteArray();
        });
    }

    public List<String> getSheetNames(long workbookId) {
        return read(workbookId, Workbook::getSheetNames);
    }

    /**
     * Appends a sheet; rows/columns default to the configured sheet size.
     */
    public List<String> createSheet(long workbookId, SheetRequest request) {
        if (request.getTitle() == null || request.getTitle().isEmpty()) {
            throw new InvalidTypeException("Sheet title is required");
        }
        SheetType type = request.getType() == null ? SheetType.REGULAR : request.getType();
        int rows = request.getRows() == null ? properties.getDefaultRows() : request.getRows();
        int columns = request.getColumns() == null ? properties.getDefaultColumns() : request.getColumns();
        return write(workbookId, workbook -> {
            workbook.createSheet(request.getTitle(), type, rows, columns);
            return workbook.getSheetNames();
        });
    }

    /**
     * Sets a cell's value with these steps:
     * 1) Convert the loosely typed value and parse the directive (fails before touching the sheet).
     * 2) Look up the sheet and get or create the cell.
     * 3) Store the value, then return the cell as it now reads.
     */
    public CellView setCellValue(long workbookId, String title, int row, int column, CellValueRequest request) {
        CellValue value = CellValue.fromObject(request.getValue());
        ValueTypeDirective directive = ValueTypeDirective.parse(request.getValueType());

        return write(workbookId, workbook -> {
            Cell cell = workbook.getSheetByName(title).cell(row, column);
            cell.setValue(value, directive);
            logger.debug("Set {}!({}, {}) to {} as {}", title, row, column, value, directive);
            return CellView.of(cell);
        });
    }

    /**
     * Makes the target cell share the expression held by the source cell.
     */
    public CellView shareExpression(long workbookId, String title, int fromRow, int fromColumn, int row, int column) {
        return write(workbookId, workbook -> {
            Sheet sheet = workbook.getSheetByName(title);
            CellValue source = sheet.cell(fromRow, fromColumn, false).getValue();
            if (source.getKind() != CellValue.Kind.EXPRESSION) {
                throw new InvalidTypeException("Cell (" + fromRow + ", " + fromColumn + ") does not hold an expression");
            }
            Cell target = sheet.cell(row, column);
            target.setValue(source);
            logger.debug("Shared expression of {}!({}, {}) into ({}, {})", title, fromRow, fromColumn, row, column);
            return CellView.of(target);
        });
    }

    /**
     * Returns an existing cell; never creates one.
     */
    public CellView getCell(long workbookId, String title, int row, int column) {
        return read(workbookId, workbook -> CellView.of(workbook.getSheetByName(title).cell(row, column, false)));
    }

    public Dimension getDimension(long workbookId, String title) {
        return read(workbookId, workbook -> workbook.getSheetByName(title).calculateDimension());
    }

    public List<CellView> getCells(long workbookId, String title, boolean includeEmpty, CellOrder order) {
        return read(workbookId, workbook -> workbook.getSheetByName(title)
                .getCellCollection(includeEmpty, order)
                .stream()
                .map(CellView::of)
                .collect(Collectors.toList()));
    }

    /**
     * Expression id (as a string) -> position and text of the cell holding it.
     */
    public Map<String, ExpressionEntry> getExpressionMap(long workbookId, String title) {
        return read(workbookId, workbook -> {
            Map<String, ExpressionEntry> result = new LinkedHashMap<>();
            for (Map.Entry<BigInteger, ExpressionEntry> e : workbook.getSheetByName(title).getExpressionMap().entrySet()) {
                result.put(e.getKey().toString(), e.getValue());
            }
            return result;
        });
    }

    // ----------------------------------------------------------------
    // Internal Helpers (used within this service only)
    // ----------------------------------------------------------------

    private long register(Workbook workbook) {
        long id = ID_GENERATOR.getAndIncrement();
        workbooks.put(id, new StoredWorkbook(workbook));
        logger.info("Registered workbook {} with sheets {}", id, workbook.getSheetNames());
        return id;
    }

    private StoredWorkbook find(long workbookId) {
        StoredWorkbook stored = workbooks.get(workbookId);
        if (stored == null) {
            throw new WorkbookNotFoundException("Workbook not found: " + workbookId);
        }
        return stored;
    }

    private <T> T read(long workbookId, Function<Workbook, T> action) {
        StoredWorkbook stored = find(workbookId);
        stored.lock.readLock().lock();
        try {
            return action.apply(stored.workbook);
        } finally {
            stored.lock.readLock().unlock();
        }
    }

    private <T> T write(long workbookId, Function<Workbook, T> action) {
        StoredWorkbook stored = find(workbookId);
        // Prevent races among multiple writers and readers of the same document
        stored.lock.writeLock().lock();
        try {
            return action.apply(stored.workbook);
        } finally {
            stored.lock.writeLock().unlock();
        }
    }

    private static final class StoredWorkbook {
        private final Workbook workbook;
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

        private StoredWorkbook(Workbook workbook) {
            this.workbook = workbook;
        }
    }
}
