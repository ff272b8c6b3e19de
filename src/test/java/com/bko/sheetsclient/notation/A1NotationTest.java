package com.bko.sheetsclient.notation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class A1NotationTest {

    @Test
    void singleCellRectangle() {
        assertEquals("A1:A1", A1Notation.build(0, 0, 0, 0));
    }

    @Test
    void rectangleConvertsRowsToOneBased() {
        assertEquals("A2:B5", A1Notation.build(0, 1, 1, 4));
        assertEquals("AA10:ZZZ20", A1Notation.build(26, 9, ColumnNotation.MAX_COLUMN, 19));
    }

    @Test
    void columnFromCellAcceptsEitherRow() {
        assertEquals("A1:A", A1Notation.build(0, null, 0, 0));
        assertEquals("A1:A", A1Notation.build(0, 0, 0, null));
        assertEquals("C5:E", A1Notation.build(2, 4, 4, null));
        assertEquals("C5:E", A1Notation.build(2, null, 4, 4));
    }

    @Test
    void wholeColumns() {
        assertEquals("A:D", A1Notation.build(0, null, 3, null));
        assertEquals("AB:AB", A1Notation.build(27, null, 27, null));
    }

    @Test
    void rowsBoundedByEndColumn() {
        assertEquals("10:D18", A1Notation.build(null, 9, 3, 17));
    }

    @Test
    void wholeRows() {
        assertEquals("10:18", A1Notation.build(null, 9, null, 17));
        assertEquals("1:1", A1Notation.build(null, 0, null, 0));
    }

    @Test
    void largeRowsDoNotOverflow() {
        assertEquals("2147483648:2147483648", A1Notation.build(null, Integer.MAX_VALUE, null, Integer.MAX_VALUE));
    }

    @Test
    void noCoordinatesIsRejected() {
        InvalidRangeShapeException e = assertThrows(InvalidRangeShapeException.class,
                () -> A1Notation.build(null, null, null, null));
        assertNull(e.getRequest().startColumn());
        assertTrue(e.getMessage().contains("startColumn=-"));
    }

    @Test
    void unrecognisedShapesAreRejected() {
        assertThrows(InvalidRangeShapeException.class, () -> A1Notation.build(0, null, null, null));
        assertThrows(InvalidRangeShapeException.class, () -> A1Notation.build(null, null, 0, null));
        assertThrows(InvalidRangeShapeException.class, () -> A1Notation.build(null, 0, null, null));
        assertThrows(InvalidRangeShapeException.class, () -> A1Notation.build(null, null, null, 0));
        assertThrows(InvalidRangeShapeException.class, () -> A1Notation.build(0, 0, null, 0));
        assertThrows(InvalidRangeShapeException.class, () -> A1Notation.build(null, null, 0, 0));
        assertThrows(InvalidRangeShapeException.class, () -> A1Notation.build(null, 0, 3, null));
    }

    @Test
    void columnPastZzzFailsInsideARange() {
        ColumnOutOfRangeException e = assertThrows(ColumnOutOfRangeException.class,
                () -> A1Notation.build(0, 0, ColumnNotation.MAX_COLUMN + 1, 0));
        assertEquals(ColumnNotation.MAX_COLUMN + 1, e.getColumn());
    }

    @Test
    void negativeRowIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> A1Notation.build(0, -1, 1, 2));
        assertTrue(e.getMessage().contains("-1"));
    }

    @Test
    void buildFromRequestMatchesBuildFromCoordinates() {
        RangeRequest request = RangeRequest.rowsToColumn(9, 3, 17);
        assertEquals("10:D18", A1Notation.build(request));
    }

    @Test
    void onSheetLeavesPlainNamesUnquoted() {
        assertEquals("Sheet1!A1:B2", A1Notation.onSheet("Sheet1", "A1:B2"));
    }

    @Test
    void onSheetQuotesNamesWithSpacesAndEscapesQuotes() {
        assertEquals("'Monthly totals'!A:A", A1Notation.onSheet("Monthly totals", "A:A"));
        assertEquals("'Bob''s data'!1:1", A1Notation.onSheet("Bob's data", "1:1"));
    }

    @Test
    void onSheetWithoutNameReturnsNotation() {
        String notation = "A1:B2";
        assertSame(notation, A1Notation.onSheet(null, notation));
        assertSame(notation, A1Notation.onSheet("  ", notation));
    }
}
