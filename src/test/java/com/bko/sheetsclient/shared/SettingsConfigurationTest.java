package com.bko.sheetsclient.shared;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SettingsConfigurationTest {

    @Test
    void buildsGoogleSettingsFromEnvironment() {
        EnvConfig envConfig = mock(EnvConfig.class);
        when(envConfig.get("google.spreadsheet_id")).thenReturn("sheet-id");
        when(envConfig.get("google.service_account_key_path")).thenReturn("key.json");
        when(envConfig.get("google.sheet_name")).thenReturn("Data");

        AppSettings settings = new SettingsConfiguration().appSettings(envConfig);

        assertTrue(settings.isGoogleConfigured());
        assertEquals("sheet-id", settings.google().spreadsheetId());
        assertEquals("Data", settings.google().sheetNameOrDefault());
    }

    @Test
    void sheetNameDefaultsToSheet1() {
        GoogleSettings google = new GoogleSettings("sheet-id", "key.json", " ");
        assertEquals("Sheet1", google.sheetNameOrDefault());
    }

    @Test
    void blankValuesAreNotConfigured() {
        AppSettings settings = new AppSettings(new GoogleSettings("", "key.json", null));
        assertFalse(settings.isGoogleConfigured());
        assertFalse(ConfigStatus.from(settings).googleConfigured());
        assertFalse(new AppSettings(null).isGoogleConfigured());
    }
}
