package com.bko.sheetsclient.shared;

import io.github.cdimascio.dotenv.Dotenv;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EnvConfigTest {

    @Test
    void keysAreNormalisedToEnvironmentNames() {
        assertEquals("GOOGLE_SPREADSHEET_ID", EnvConfig.toEnvKey("google.spreadsheet_id"));
        assertEquals("GOOGLE_SHEET_NAME", EnvConfig.toEnvKey("google.sheet-name"));
    }

    @Test
    void readsDotenvValuesTrimmed() {
        Dotenv dotenv = mock(Dotenv.class);
        when(dotenv.get("GOOGLE_SPREADSHEET_ID")).thenReturn("  abc123 ");

        EnvConfig config = new EnvConfig(dotenv);

        assertEquals("abc123", config.get("google.spreadsheet_id"));
    }
}
