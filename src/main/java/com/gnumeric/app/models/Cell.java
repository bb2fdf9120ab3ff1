package com.gnumeric.app.models;

import com.gnumeric.app.exceptions.CrossSheetExpressionException;
import com.gnumeric.app.exceptions.StyleNotFoundException;
import com.gnumeric.app.exceptions.UnrecognizedCellTypeException;
import org.w3c.dom.Element;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Set;

/**
 * Represents a single spreadsheet cell, backed by one gnm:Cell element.
 * Stores:
 * - Row and Col attributes (0-indexed position, fixed)
 * - the element text (raw value, absent when empty)
 * - ValueType attribute (absent for expressions)
 * - ExprID attribute when the cell shares an expression
 *
 * Cells are live views on the document, not copies. They are obtained from
 * {@link Sheet#cell(int, int)} and are not safe for concurrent mutation.
 */
public class Cell {
    static final String ROW = "Row";
    static final String COL = "Col";
    static final String VALUE_TYPE = "ValueType";
    static final String EXPR_ID = "ExprID";

    private final Element element;
    private final Sheet sheet;

    Cell(Element element, Sheet sheet) {
        this.element = element;
        this.sheet = sheet;
    }

    Element getElement() {
        return element;
    }

    public Sheet getSheet() {
        return sheet;
    }

    public int getRow() {
        return Integer.parseInt(element.getAttribute(ROW));
    }

    public int getColumn() {
        return Integer.parseInt(element.getAttribute(COL));
    }

    public Coordinate getCoordinate() {
        return new Coordinate(getRow(), getColumn());
    }

    /**
     * The raw text stored in the cell, or null if the cell is empty.
     */
    public String getText() {
        return GnumericXml.getText(element);
    }

    /**
     * The expression id this cell refers to, or null.
     */
    public BigInteger getExpressionId() {
        String id = GnumericXml.getAttribute(element, EXPR_ID);
        return id == null ? null : new BigInteger(id.trim());
    }

    /**
     * The type of value stored in the cell. Untagged cells are expressions when they
     * carry an ExprID or their text starts with '='.
     *
     * @throws UnrecognizedCellTypeException if the cell is untagged and not an expression,
     *                                       or carries an unknown tag
     */
    public ValueType getValueType() {
        String tag = GnumericXml.getAttribute(element, VALUE_TYPE);
        if (tag != null) {
            ValueType type = parseTag(tag);
            if (type == null) {
                throw new UnrecognizedCellTypeException("Unknown value type " + tag + " in cell: "
                        + GnumericXml.toXml(element));
            }
            return type;
        }
        String text = getText();
        if (element.hasAttribute(EXPR_ID) || (text != null && text.startsWith("="))) {
            return ValueType.EXPR;
        }
        throw new UnrecognizedCellTypeException("Cell is: " + GnumericXml.toXml(element));
    }

    private static ValueType parseTag(String tag) {
        try {
            return ValueType.fromTag(Integer.parseInt(tag.trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * The stored value converted according to the cell's type.
     * EMPTY cells yield {@link CellValue#empty()}; ERROR, STRING, CELLRANGE and ARRAY cells yield their raw text.
     * Booleans are written as TRUE/FALSE and read ignoring case.
     */
    public CellValue getValue() {
        String text = getText();
        switch (getValueType()) {
            case BOOLEAN:
                return CellValue.of(text != null && "TRUE".equalsIgnoreCase(text.trim()));
            case INTEGER:
                return CellValue.of(Long.parseLong(text.trim()));
            case FLOAT:
                return CellValue.of(Double.parseDouble(text.trim()));
            case EXPR:
                return CellValue.of(new Expression(getExpressionId(), sheet, this));
            default:
                return CellValue.of(text);
        }
    }

    /**
     * Sets the value, inferring the type to store it as.
     */
    public void setValue(CellValue value) {
        setValue(value, ValueTypeDirective.INFER);
    }

    /**
     * Sets the value stored in the cell.
     *
     * No type checking is done against an explicit type: a string can be stored as INTEGER,
     * which Gnumeric may then fail to open.
     *
     * @throws CrossSheetExpressionException if the value is an expression owned by another sheet
     */
    public void setValue(CellValue value, ValueTypeDirective directive) {
        ValueType valueType = directive.resolve(value, this::getValueType);

        if (valueType == ValueType.BOOLEAN) {
            setText(isTrue(value) ? "TRUE" : "FALSE");
        } else if (valueType == ValueType.EMPTY) {
            setText(null);
        } else if (valueType == ValueType.EXPR && value.getKind() == CellValue.Kind.EXPRESSION) {
            assignExpression(value.asExpression());
        } else {
            setText(value.toText());
        }

        setType(valueType);
    }

    private static boolean isTrue(CellValue value) {
        switch (value.getKind()) {
            case BOOLEAN:
                return value.asBoolean();
            case INTEGER:
                return value.asLong() != 0;
            case FLOAT:
                return value.asDouble() != 0.0;
            case STRING:
                return "TRUE".equalsIgnoreCase(value.asString().trim());
            case EXPRESSION:
                return true;
            default:
                return false;
        }
    }

    private void assignExpression(Expression expression) {
        if (!sheet.equals(expression.getSheet())) {
            throw new CrossSheetExpressionException("Copying expression from sheet \"" + expression.getSheet().getTitle()
                    + "\" to sheet \"" + sheet.getTitle() + "\" is not supported");
        }

        Set<Cell> users = expression.getAllCells();
        Cell originating = expression.getOriginatingCell();

        if (users.size() == 1 && originating.equals(this)) {
            // assigning the expression over itself, so it stays a plain literal
            setText(expression.getValue());
            return;
        }

        BigInteger existing = expression.getId();
        BigInteger id = existing != null ? existing : sheet.nextExpressionId();
        if (users.size() == 1) {
            // first share: the originating cell keeps its text and gains the id
            originating.setExpressionId(id);
        }
        setText(null);
        setExpressionId(id);
    }

    /**
     * The number format used to display the cell ("Number Format" in Gnumeric).
     *
     * @throws StyleNotFoundException if no style covers the cell or it has no format
     */
    public String getTextFormat() {
        Element style = sheet.findStyle(getRow(), getColumn());
        String format = style == null ? null : GnumericXml.getAttribute(style, "Format");
        if (format == null) {
            throw new StyleNotFoundException("No number format for cell " + getCoordinate()
                    + " in sheet \"" + sheet.getTitle() + "\"");
        }
        return format;
    }

    private void setText(String text) {
        GnumericXml.setText(element, text);
    }

    private void setExpressionId(BigInteger id) {
        element.setAttribute(EXPR_ID, id.toString());
    }

    private void setType(ValueType valueType) {
        if (valueType == ValueType.EXPR) {
            element.removeAttribute(VALUE_TYPE);
        } else {
            element.setAttribute(VALUE_TYPE, Integer.toString(valueType.getTag()));
            element.removeAttribute(EXPR_ID);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cell)) {
            return false;
        }
        Cell other = (Cell) o;
        return sheet.equals(other.sheet) && getRow() == other.getRow() && getColumn() == other.getColumn();
    }

    @Override
    public int hashCode() {
        return Objects.hash(sheet, getRow(), getColumn());
    }

    @Override
    public String toString() {
        return "Cell[" + getText() + ", " + getCoordinate() + ", ws=\"" + sheet.getTitle() + "\"]";
    }
}
