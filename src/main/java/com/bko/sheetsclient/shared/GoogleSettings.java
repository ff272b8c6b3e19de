package com.bko.sheetsclient.shared;

public record GoogleSettings(String spreadsheetId, String serviceAccountKeyPath, String sheetName) {
    public static final String DEFAULT_SHEET_NAME = "Sheet1";

    public boolean isConfigured() {
        return hasText(spreadsheetId) && hasText(serviceAccountKeyPath);
    }

    public String sheetNameOrDefault() {
        return hasText(sheetName) ? sheetName : DEFAULT_SHEET_NAME;
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
