///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.fits;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the {@code TFORMn} format of ASCII table columns from their data.
 * <p>
 * The type code is decided by the first row alone.  Only the width looks at every row.  Consequently, a column of
 * doubles whose first value renders as {@code 1.5} gets an {@code F} format even if a later value renders in
 * exponential notation, such as {@code 1.0E-6}; its width still accounts for the longer rendering.  Files written
 * this way are expected to stay readable by the same rule, so the sampling is kept.
 * </p>
 */
public final class TableTypeInference {

    // private constructor to prevent anyone from instantiating the class.
    private TableTypeInference() {
    }

    /**
     * Infers the format of a column.
     *
     * @param column
     *     The column. It must have at least one row.
     *
     * @return The inferred format.
     *
     * @throws NullPointerException
     *     if {@code column} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code column} has no rows.
     */
    public static TableFormat inferFormat(TableColumn column) {
        ArgumentUtil.checkNotNull(column, "column");
        if (column.size() == 0) {
            throw new IllegalArgumentException("cannot infer the format of a column with no rows");
        }

        ElementType elementType = column.elementType();
        char typeCode = elementType.tableTypeCode();

        int width = 0;
        for (Object value : column.values()) {
            width = Math.max(width, TableColumn.render(value).length());
        }

        int numberOfDigits = 0;
        if (elementType.isFloatingPoint()) {
            String firstRendering = TableColumn.render(column.values().get(0));
            if (firstRendering.indexOf('e') < 0 && firstRendering.indexOf('E') < 0) {
                typeCode = 'F';
                int decimalPoint = firstRendering.indexOf('.');
                numberOfDigits = decimalPoint < 0 ? 0 : firstRendering.length() - decimalPoint - 1;
            }
        }

        return new TableFormat(typeCode, width, numberOfDigits);
    }

    /**
     * Infers the format of each column of a table.
     *
     * @param columns
     *     The columns.
     *
     * @return The formats, in the same order as {@code columns}.
     *
     * @throws NullPointerException
     *     if {@code columns} is {@code null}.
     * @throws IllegalArgumentException
     *     if a column has no rows.
     */
    public static List<TableFormat> inferFormats(List<TableColumn> columns) {
        ArgumentUtil.checkNotNull(columns, "columns");

        List<TableFormat> formats = new ArrayList<>(columns.size());
        for (TableColumn column : columns) {
            formats.add(inferFormat(column));
        }
        return formats;
    }
}
