package com.bko.sheetsclient.sheets;

import com.google.api.services.sheets.v4.model.BatchUpdateValuesResponse;
import com.google.api.services.sheets.v4.model.UpdateValuesResponse;
import com.google.api.services.sheets.v4.model.ValueRange;

import java.io.IOException;
import java.util.List;

public interface SpreadsheetPort {
    String getLinkToSheet();

    List<List<Object>> getValues(String range) throws IOException;

    /** Appends one row under the existing data of the sheet. */
    UpdateValuesResponse append(List<Object> row) throws IOException;

    BatchUpdateValuesResponse batchUpdate(List<ValueRange> data) throws IOException;

    /** Clears every value on the configured sheet and returns the cleared range. */
    String clearSheet() throws IOException;

    /** Clears the sheet, then writes {@code values} starting at A1. */
    UpdateValuesResponse refreshEntireSheet(List<List<Object>> values) throws IOException;

    UpdateValuesResponse updateValues(String range, List<List<Object>> values) throws IOException;
}
