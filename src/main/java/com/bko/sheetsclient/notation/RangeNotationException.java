package com.bko.sheetsclient.notation;

/**
 * Base type for coordinates that cannot be rendered as A1 notation.
 */
public class RangeNotationException extends IllegalArgumentException {
    public RangeNotationException(String message) {
        super(message);
    }
}
