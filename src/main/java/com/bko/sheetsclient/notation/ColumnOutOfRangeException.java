package com.bko.sheetsclient.notation;

/**
 * Thrown when a column index falls outside [0, {@value ColumnNotation#MAX_COLUMN}].
 * For example, column 18278 would need a fourth letter.
 */
public class ColumnOutOfRangeException extends RangeNotationException {
    private final int column;

    public ColumnOutOfRangeException(int column) {
        super(column < 0
                ? "Column index must be non-negative: " + column
                : "Column index " + column + " is beyond column ZZZ (max " + ColumnNotation.MAX_COLUMN + ")");
        this.column = column;
    }

    public int getColumn() {
        return column;
    }
}
