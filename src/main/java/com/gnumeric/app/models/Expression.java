package com.gnumeric.app.models;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A formula as stored by Gnumeric. Within a sheet an expression is written
 * once, in the cell where it is first used, and every other cell using it
 * refers to it through the same ExprID.
 *
 * The formula is kept as opaque text; it is never parsed or evaluated.
 */
public class Expression {
    private final BigInteger id;
    private final Sheet sheet;
    private final Cell cell;

    /**
     * @param id    the expression id, or null if the expression has not been shared yet
     * @param sheet the sheet owning the expression
     * @param cell  a cell using the expression
     */
    public Expression(BigInteger id, Sheet sheet, Cell cell) {
        this.id = id;
        this.sheet = Objects.requireNonNull(sheet, "sheet");
        this.cell = Objects.requireNonNull(cell, "cell");
    }

    /**
     * The expression id. A handle obtained before the expression was shared has no id of its
     * own and picks up the one its cell has gained since.
     */
    public BigInteger getId() {
        return id != null ? id : cell.getExpressionId();
    }

    public Sheet getSheet() {
        return sheet;
    }

    /**
     * All cells in the sheet that currently use this expression, including the originating cell.
     */
    public Set<Cell> getAllCells() {
        BigInteger current = getId();
        if (current == null) {
            return Collections.singleton(cell);
        }
        Set<Cell> cells = new LinkedHashSet<>(sheet.getExpressionCells(current));
        if (cells.isEmpty()) {
            cells.add(cell);
        }
        return cells;
    }

    /**
     * The cell holding the expression's literal text. It is looked up by id, so it may
     * differ from the cell this expression was obtained from.
     */
    public Cell getOriginatingCell() {
        BigInteger current = getId();
        if (current != null) {
            ExpressionEntry entry = sheet.getExpressionMap().get(current);
            if (entry != null) {
                return sheet.cell(entry.getCoordinate().getRow(), entry.getCoordinate().getColumn(), false);
            }
        }
        return cell;
    }

    /**
     * The formula text, e.g. "=max(A1:A5)".
     */
    public String getValue() {
        return getOriginatingCell().getText();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Expression)) {
            return false;
        }
        Expression other = (Expression) o;
        BigInteger current = getId();
        if (!sheet.equals(other.sheet) || !Objects.equals(current, other.getId())) {
            return false;
        }
        return current != null || cell.equals(other.cell);
    }

    @Override
    public int hashCode() {
        BigInteger current = getId();
        return current != null ? Objects.hash(sheet, current) : Objects.hash(sheet, cell);
    }

    @Override
    public String toString() {
        return "Expression[id=" + getId() + ", value=" + getValue() + "]";
    }
}
