///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A named column of an ASCII table.
 * <p>
 * The cells of a column are rendered as text with {@link #render}.  Numbers are rendered by their {@code toString()}
 * method, booleans as {@code 1} or {@code 0}.
 * </p>
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class TableColumn {

    /** The longest column name that fits into a TTYPE record. */
    static final int MAX_NAME_LENGTH = HeaderRecord.MAX_STRING_LENGTH;

    private final String name;
    private final List<Object> values;

    /**
     * Creates a column.
     *
     * @param name
     *     The column's display name, which is written as its {@code TTYPE}. If this is {@code null}, the column is
     *     named {@code HEADn}, where {@code n} is its 1-based position in the table.
     * @param values
     *     The cells of the column, from the first row to the last.
     *
     * @throws NullPointerException
     *     if {@code values} is {@code null} or contains {@code null}.
     * @throws IllegalArgumentException
     *     if {@code name} is not ASCII text or is longer than 68 characters, counting a quote as two characters.
     */
    public TableColumn(String name, List<?> values) {
        ArgumentUtil.checkNotNull(values, "values");
        if (name != null) {
            ArgumentUtil.checkAsciiText(name, MAX_NAME_LENGTH, "column name");
            // TTYPE values are quoted, so each quote in the name is written as two.
            if (MAX_NAME_LENGTH < name.replace("'", "''").length()) {
                throw new IllegalArgumentException("column name \"" + name + "\" must not be longer than " +
                    MAX_NAME_LENGTH + " characters, counting a quote as two characters");
            }
        }

        List<Object> copy = new ArrayList<>(values.size());
        for (Object value : values) {
            if (value == null) {
                throw new NullPointerException("values must not contain null");
            }
            copy.add(value);
        }

        this.name = name;
        this.values = Collections.unmodifiableList(copy);
    }

    /**
     * Creates an unnamed column.
     *
     * @param values
     *     The cells of the column, from the first row to the last.
     *
     * @throws NullPointerException
     *     if {@code values} is {@code null} or contains {@code null}.
     */
    public TableColumn(List<?> values) {
        this(null, values);
    }

    /**
     * Gets this column's name.
     *
     * @return The name, or {@code null} if the column is unnamed.
     */
    public String name() {
        return name;
    }

    /**
     * Gets this column's cells.
     *
     * @return An unmodifiable list of the cells.
     */
    public List<Object> values() {
        return values;
    }

    /**
     * Gets the number of rows in this column.
     *
     * @return The number of rows.
     */
    public int size() {
        return values.size();
    }

    /**
     * Gets the element type of this column, as determined by its first cell.
     *
     * @return The element type.  This is {@link ElementType#OTHER} for an empty column.
     */
    public ElementType elementType() {
        return values.isEmpty() ? ElementType.OTHER : ElementType.forValue(values.get(0));
    }

    /**
     * Renders a cell as it appears in a table row (before padding).
     *
     * @param value
     *     The cell.
     *
     * @return The text of the cell.
     */
    static String render(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value ? "1" : "0";
        }
        return value.toString();
    }
}
