package com.bko.sheetsclient.sheets;

import com.google.api.services.sheets.v4.model.UpdateValuesResponse;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class UpdateSummaryTest {

    @Test
    void describesCounts() {
        UpdateValuesResponse response = new UpdateValuesResponse()
                .setUpdatedColumns(3)
                .setUpdatedRows(2)
                .setUpdatedCells(6);
        assertEquals("3 columns; 2 rows; and 6 total cells updated", UpdateSummary.describe(response));
    }

    @Test
    void missingCountsAreZero() {
        assertEquals("0 columns; 1 rows; and 0 total cells updated",
                UpdateSummary.describe(new UpdateValuesResponse().setUpdatedRows(1)));
        assertEquals("0 columns; 0 rows; and 0 total cells updated", UpdateSummary.describe(null));
    }
}
