package com.bko.sheetsclient.notation;

/**
 * Thrown when the present/absent combination of range coordinates has no A1 form,
 * e.g. no coordinates at all, or a start row without an end row.
 */
public class InvalidRangeShapeException extends RangeNotationException {
    private final RangeRequest request;

    public InvalidRangeShapeException(RangeRequest request) {
        super("The specified range is not valid: " + request.describeShape());
        this.request = request;
    }

    public RangeRequest getRequest() {
        return request;
    }
}
