package com.bko.sheetsclient.shared;

public record AppSettings(GoogleSettings google) {
    public boolean isGoogleConfigured() {
        return google != null && google.isConfigured();
    }
}
