package com.bko.sheetsclient.notation;

import java.util.regex.Pattern;

/**
 * Builds A1 notation from zero-indexed column and row coordinates. Rows come out 1-indexed.
 *
 * <pre>
 *   build(0, 0, 2, 2)          -> "A1:C3"
 *   build(null, 4, null, 8)    -> "5:9"
 *   build(null, 4, 2, 8)       -> "5:C9"
 * </pre>
 *
 * See <a href="https://developers.google.com/sheets/api/guides/concepts#cell">A1 notation</a>.
 */
public final class A1Notation {
    private static final Pattern PLAIN_SHEET_NAME = Pattern.compile("[A-Za-z0-9_]+");

    private A1Notation() {
    }

    /**
     * Renders the range described by the present coordinates.
     *
     * @throws InvalidRangeShapeException if the coordinates do not form a known shape
     * @throws ColumnOutOfRangeException if a column is past ZZZ
     */
    public static String build(Integer startColumn, Integer startRow, Integer endColumn, Integer endRow) {
        requireNonNegativeRow(startRow);
        requireNonNegativeRow(endRow);

        boolean bothColumns = startColumn != null && endColumn != null;

        if (bothColumns && (startRow == null) != (endRow == null)) {
            // "A5:A" is everything in column A from row 5 down. "A:A5" is not valid A1,
            // so a lone end row is read as the starting row too.
            int row = startRow != null ? startRow : endRow;
            return column(startColumn) + row(row) + ":" + column(endColumn);
        }
        if (bothColumns && startRow != null) {
            return column(startColumn) + row(startRow) + ":" + column(endColumn) + row(endRow);
        }
        if (bothColumns) {
            return column(startColumn) + ":" + column(endColumn);
        }
        if (startColumn == null && startRow != null && endRow != null) {
            if (endColumn != null) {
                return row(startRow) + ":" + column(endColumn) + row(endRow);
            }
            return row(startRow) + ":" + row(endRow);
        }

        throw new InvalidRangeShapeException(new RangeRequest(startColumn, startRow, endColumn, endRow));
    }

    public static String build(RangeRequest request) {
        return build(request.startColumn(), request.startRow(), request.endColumn(), request.endRow());
    }

    /**
     * Prefixes a range with its sheet, quoting the sheet name when it needs it:
     * {@code Sheet1!A1:B2}, {@code 'Monthly totals'!A:A}.
     */
    public static String onSheet(String sheetName, String notation) {
        if (sheetName == null || sheetName.isBlank()) {
            return notation;
        }
        if (PLAIN_SHEET_NAME.matcher(sheetName).matches()) {
            return sheetName + "!" + notation;
        }
        return "'" + sheetName.replace("'", "''") + "'!" + notation;
    }

    private static String column(int column) {
        return ColumnNotation.encode(column);
    }

    private static String row(int row) {
        return Long.toString(row + 1L);
    }

    private static void requireNonNegativeRow(Integer row) {
        if (row != null && row < 0) {
            throw new IllegalArgumentException("Row index must be non-negative: " + row);
        }
    }
}
