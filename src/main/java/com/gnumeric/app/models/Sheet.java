package com.gnumeric.app.models;

import com.gnumeric.app.exceptions.CellIndexOutOfRangeException;
import com.gnumeric.app.exceptions.UnsupportedSheetOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;

/**
 * Represents one sheet of a workbook:
 * - its gnm:SheetName entry in the workbook's name index (title, type, capacity)
 * - its gnm:Sheet element, holding the gnm:Cells collection
 *
 * Storage is sparse: only cells that were addressed or hold data exist as elements,
 * and empty ones are dropped again by {@link #compactBeforeSave()}.
 * Bounding-rectangle queries scan the non-empty cells every time.
 *
 * Not thread-safe; callers sharing a sheet across threads must lock around it.
 */
public class Sheet {

    private static final Logger logger = LoggerFactory.getLogger(Sheet.class);

    private static final String OBJECT_SHEET_TYPE = "object";

    private final Element sheetNameElement;
    private final Element sheetElement;
    private final Workbook workbook;

    Sheet(Element sheetNameElement, Element sheetElement, Workbook workbook) {
        this.sheetNameElement = sheetNameElement;
        this.sheetElement = sheetElement;
        this.workbook = workbook;
    }

    public Workbook getWorkbook() {
        return workbook;
    }

    public String getTitle() {
        return GnumericXml.getText(sheetNameElement);
    }

    /**
     * Renames the sheet. The title lives in both the workbook's name index and the sheet's Name node.
     */
    public void setTitle(String title) {
        Element name = GnumericXml.getChild(sheetElement, "Name");
        if (name == null) {
            name = GnumericXml.createElement(sheetElement.getOwnerDocument(), "Name");
            sheetElement.insertBefore(name, sheetElement.getFirstChild());
        }
        GnumericXml.setText(name, title);
        GnumericXml.setText(sheetNameElement, title);
    }

    public SheetType getType() {
        String type = GnumericXml.getQualifiedAttribute(sheetNameElement, "SheetType");
        return OBJECT_SHEET_TYPE.equals(type) ? SheetType.OBJECT : SheetType.REGULAR;
    }

    /**
     * The maximum row allowed in the sheet.
     */
    public int getMaxAllowedRow() {
        return Integer.parseInt(GnumericXml.getQualifiedAttribute(sheetNameElement, "Rows")) - 1;
    }

    /**
     * The maximum column allowed in the sheet.
     */
    public int getMaxAllowedColumn() {
        return Integer.parseInt(GnumericXml.getQualifiedAttribute(sheetNameElement, "Cols")) - 1;
    }

    public boolean isValidRow(int row) {
        return 0 <= row && row <= getMaxAllowedRow();
    }

    public boolean isValidColumn(int column) {
        return 0 <= column && column <= getMaxAllowedColumn();
    }

    // ------------------------
    // Bounding rectangle
    // ------------------------

    /**
     * The minimum row that holds data, or -1 if the sheet is empty.
     *
     * @throws UnsupportedSheetOperationException on object sheets
     */
    public int getMinRow() {
        requireRegular("min row");
        return reduce(Cell::getRow, true);
    }

    /**
     * The minimum column that holds data, or -1 if the sheet is empty.
     *
     * @throws UnsupportedSheetOperationException on object sheets
     */
    public int getMinColumn() {
        requireRegular("min column");
        return reduce(Cell::getColumn, true);
    }

    /**
     * The maximum row that holds data, or -1 if the sheet is empty.
     *
     * @throws UnsupportedSheetOperationException on object sheets
     */
    public int getMaxRow() {
        requireRegular("max row");
        return reduce(Cell::getRow, false);
    }

    /**
     * The maximum column that holds data, or -1 if the sheet is empty.
     *
     * @throws UnsupportedSheetOperationException on object sheets
     */
    public int getMaxColumn() {
        requireRegular("max column");
        return reduce(Cell::getColumn, false);
    }

    /**
     * The minimum bounding rectangle that contains all data in the sheet.
     *
     * @throws UnsupportedSheetOperationException on object sheets
     */
    public Dimension calculateDimension() {
        requireRegular("rows or columns");
        return new Dimension(getMinRow(), getMinColumn(), getMaxRow(), getMaxColumn());
    }

    private int reduce(ToIntFunction<Cell> position, boolean min) {
        List<Cell> content = getCellCollection();
        if (content.isEmpty()) {
            return -1;
        }
        return min
                ? content.stream().mapToInt(position).min().getAsInt()
                : content.stream().mapToInt(position).max().getAsInt();
    }

    // ------------------------
    // Addressing
    // ------------------------

    /**
     * Returns the cell at the given position, creating an empty one if none exists.
     */
    public Cell cell(int row, int column) {
        return cell(row, column, true);
    }

    /**
     * Returns the cell at the given position.
     *
     * A missing cell is created empty (and stays in the sheet until the next save) unless
     * {@code create} is false, in which case nothing is created and an exception is thrown.
     *
     * @throws CellIndexOutOfRangeException if the position is outside the sheet, or no cell
     *                                      exists there and {@code create} is false
     */
    public Cell cell(int row, int column, boolean create) {
        requireRegular("cells");
        if (!isValidRow(row)) {
            throw outOfRange("Row (" + row + ") for cell is out of allowed bounds of [0, "
                    + getMaxAllowedRow() + "]", row, column);
        }
        if (!isValidColumn(column)) {
            throw outOfRange("Column (" + column + ") for cell is out of allowed bounds of [0, "
                    + getMaxAllowedColumn() + "]", row, column);
        }

        Element found = findCellElement(row, column);
        if (found == null) {
            if (!create) {
                throw outOfRange("No cell exists at position (" + row + ", " + column + ")", row, column);
            }
            found = createCellElement(row, column);
        }
        return new Cell(found, this);
    }

    /**
     * The text of an existing cell.
     *
     * @throws CellIndexOutOfRangeException if no cell exists at the position
     */
    public String cellText(int row, int column) {
        return cell(row, column, false).getText();
    }

    private CellIndexOutOfRangeException outOfRange(String message, int row, int column) {
        return new CellIndexOutOfRangeException(message, row, column, getMaxAllowedRow(), getMaxAllowedColumn());
    }

    private Element findCellElement(int row, int column) {
        for (Element element : cellElements()) {
            if (GnumericXml.getIntAttribute(element, Cell.ROW, -1) == row
                    && GnumericXml.getIntAttribute(element, Cell.COL, -1) == column) {
                return element;
            }
        }
        return null;
    }

    private Element createCellElement(int row, int column) {
        Element element = GnumericXml.appendChild(getCellsElement(true), "Cell");
        element.setAttribute(Cell.ROW, Integer.toString(row));
        element.setAttribute(Cell.COL, Integer.toString(column));
        element.setAttribute(Cell.VALUE_TYPE, Integer.toString(ValueType.EMPTY.getTag()));
        return element;
    }

    // ------------------------
    // Enumeration
    // ------------------------

    /**
     * All cells holding data, in storage order.
     */
    public List<Cell> getCellCollection() {
        return getCellCollection(false, CellOrder.NONE);
    }

    /**
     * Cells of the sheet as a list.
     *
     * @param includeEmpty also return cells that were created but hold no data
     * @param order        NONE for storage order, or row-major / column-major sorting
     */
    public List<Cell> getCellCollection(boolean includeEmpty, CellOrder order) {
        List<Cell> cells = new ArrayList<>();
        for (Element element : cellElements()) {
            if (includeEmpty || !isEmpty(element)) {
                cells.add(new Cell(element, this));
            }
        }
        if (order != null && order.getComparator() != null) {
            cells.sort(order.getComparator());
        }
        return cells;
    }

    /**
     * Maps expression ids to the position and text of the cell holding each expression.
     *
     * Incomplete by nature: an expression used only once usually has no id and is not listed.
     */
    public Map<BigInteger, ExpressionEntry> getExpressionMap() {
        Map<BigInteger, ExpressionEntry> map = new LinkedHashMap<>();
        for (Element element : cellElements()) {
            String id = GnumericXml.getAttribute(element, Cell.EXPR_ID);
            String text = GnumericXml.getText(element);
            if (id != null && text != null) {
                Coordinate coordinate = new Coordinate(GnumericXml.getIntAttribute(element, Cell.ROW, -1),
                        GnumericXml.getIntAttribute(element, Cell.COL, -1));
                map.put(new BigInteger(id.trim()), new ExpressionEntry(coordinate, text));
            }
        }
        return map;
    }

    /**
     * Cells whose ExprID is the given id.
     */
    List<Cell> getExpressionCells(BigInteger id) {
        return cellElements().stream()
                .filter(e -> e.hasAttribute(Cell.EXPR_ID) && id.equals(new BigInteger(e.getAttribute(Cell.EXPR_ID).trim())))
                .map(e -> new Cell(e, this))
                .collect(Collectors.toList());
    }

    /**
     * One more than the largest expression id used in the sheet, or 1 if there is none.
     */
    BigInteger nextExpressionId() {
        BigInteger max = BigInteger.ZERO;
        for (Element element : cellElements()) {
            String id = GnumericXml.getAttribute(element, Cell.EXPR_ID);
            if (id != null) {
                max = max.max(new BigInteger(id.trim()));
            }
        }
        return max.add(BigInteger.ONE);
    }

    /**
     * The gnm:Style applying to the given position, or null.
     */
    Element findStyle(int row, int column) {
        Element styles = GnumericXml.getChild(sheetElement, "Styles");
        if (styles == null) {
            return null;
        }
        for (Element region : GnumericXml.getChildren(styles, "StyleRegion")) {
            if (GnumericXml.getIntAttribute(region, "startRow", 0) <= row
                    && row <= GnumericXml.getIntAttribute(region, "endRow", -1)
                    && GnumericXml.getIntAttribute(region, "startCol", 0) <= column
                    && column <= GnumericXml.getIntAttribute(region, "endCol", -1)) {
                return GnumericXml.getChild(region, "Style");
            }
        }
        return null;
    }

    // ------------------------
    // Housekeeping
    // ------------------------

    /**
     * Drops empty cells and records the current max row/column. Only needed right
     * before the document is written; {@link Workbook#save} calls it.
     */
    void compactBeforeSave() {
        requireRegular("cells");
        Element cells = getCellsElement(false);
        int removed = 0;
        if (cells != null) {
            for (Element element : GnumericXml.getChildren(cells, "Cell")) {
                if (isEmpty(element)) {
                    cells.removeChild(element);
                    removed++;
                }
            }
        }

        Element maxCol = GnumericXml.getChild(sheetElement, "MaxCol");
        if (maxCol != null) {
            GnumericXml.setText(maxCol, Integer.toString(getMaxColumn()));
        }
        Element maxRow = GnumericXml.getChild(sheetElement, "MaxRow");
        if (maxRow != null) {
            GnumericXml.setText(maxRow, Integer.toString(getMaxRow()));
        }
        logger.debug("Compacted sheet \"{}\": removed {} empty cells", getTitle(), removed);
    }

    /**
     * A cell is empty when tagged EMPTY, or when it has no tag, no ExprID and no text.
     * A cell tagged with any other type counts as holding data even without text.
     */
    static boolean isEmpty(Element cell) {
        String tag = GnumericXml.getAttribute(cell, Cell.VALUE_TYPE);
        if (tag != null) {
            return tag.trim().equals(Integer.toString(ValueType.EMPTY.getTag()));
        }
        return !cell.hasAttribute(Cell.EXPR_ID) && GnumericXml.getText(cell) == null;
    }

    private List<Element> cellElements() {
        Element cells = getCellsElement(false);
        return cells == null ? new ArrayList<>() : GnumericXml.getChildren(cells, "Cell");
    }

    private Element getCellsElement(boolean create) {
        Element cells = GnumericXml.getChild(sheetElement, "Cells");
        if (cells == null && create) {
            cells = GnumericXml.appendChild(sheetElement, "Cells");
        }
        return cells;
    }

    private void requireRegular(String what) {
        if (getType() == SheetType.OBJECT) {
            throw new UnsupportedSheetOperationException("Chartsheet \"" + getTitle() + "\" does not have " + what);
        }
    }

    Element getSheetNameElement() {
        return sheetNameElement;
    }

    Element getSheetElement() {
        return sheetElement;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Sheet)) {
            return false;
        }
        Sheet other = (Sheet) o;
        return workbook == other.workbook
                && sheetNameElement == other.sheetNameElement
                && sheetElement == other.sheetElement;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(sheetElement);
    }

    @Override
    public String toString() {
        return getTitle();
    }
}
