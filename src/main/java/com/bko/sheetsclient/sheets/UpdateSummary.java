package com.bko.sheetsclient.sheets;

import com.google.api.services.sheets.v4.model.UpdateValuesResponse;

public final class UpdateSummary {
    private UpdateSummary() {
    }

    public static String describe(UpdateValuesResponse response) {
        if (response == null) {
            return describe(null, null, null);
        }
        return describe(response.getUpdatedColumns(), response.getUpdatedRows(), response.getUpdatedCells());
    }

    static String describe(Integer columns, Integer rows, Integer cells) {
        return orZero(columns) + " columns; " + orZero(rows) + " rows; and " + orZero(cells) + " total cells updated";
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
