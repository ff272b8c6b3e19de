package com.bko.sheetsclient.shared;

public record ConfigStatus(boolean googleConfigured, String sheetName) {
    public static ConfigStatus from(AppSettings settings) {
        String sheetName = settings.google() != null
                ? settings.google().sheetNameOrDefault()
                : GoogleSettings.DEFAULT_SHEET_NAME;
        return new ConfigStatus(settings.isGoogleConfigured(), sheetName);
    }
}
