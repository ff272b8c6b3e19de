package com.bko.sheetsclient.notation;

/**
 * Zero-indexed range coordinates, any of which may be absent ({@code null}).
 * Which ones are present decides the A1 form, see {@link A1Notation#build}.
 */
public record RangeRequest(Integer startColumn, Integer startRow, Integer endColumn, Integer endRow) {

    /** A1:B2 style rectangle. */
    public static RangeRequest cells(int startColumn, int startRow, int endColumn, int endRow) {
        return new RangeRequest(startColumn, startRow, endColumn, endRow);
    }

    /** A5:A style range, from a cell down to the bottom of the sheet. */
    public static RangeRequest columnFrom(int startColumn, int startRow, int endColumn) {
        return new RangeRequest(startColumn, startRow, endColumn, null);
    }

    /** A:B style range of whole columns. */
    public static RangeRequest columns(int startColumn, int endColumn) {
        return new RangeRequest(startColumn, null, endColumn, null);
    }

    /** 10:18 style range of whole rows. */
    public static RangeRequest rows(int startRow, int endRow) {
        return new RangeRequest(null, startRow, null, endRow);
    }

    /** 10:B18 style range of rows, bounded on the right by a column. */
    public static RangeRequest rowsToColumn(int startRow, int endColumn, int endRow) {
        return new RangeRequest(null, startRow, endColumn, endRow);
    }

    public String toA1Notation() {
        return A1Notation.build(startColumn, startRow, endColumn, endRow);
    }

    String describeShape() {
        return "startColumn=" + orDash(startColumn)
                + ", startRow=" + orDash(startRow)
                + ", endColumn=" + orDash(endColumn)
                + ", endRow=" + orDash(endRow);
    }

    private static String orDash(Integer value) {
        return value == null ? "-" : value.toString();
    }
}
