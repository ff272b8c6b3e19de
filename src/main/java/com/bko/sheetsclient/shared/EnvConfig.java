package com.bko.sheetsclient.shared;

import io.github.cdimascio.dotenv.Dotenv;
import org.springframework.stereotype.Component;

@Component
public class EnvConfig {
    private final Dotenv dotenv;

    public EnvConfig() {
        this(Dotenv.configure()
                .ignoreIfMissing()
                .load());
    }

    EnvConfig(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    /**
     * Looks up {@code google.spreadsheet_id} as {@code GOOGLE_SPREADSHEET_ID}, first in .env
     * and then in the process environment.
     */
    public String get(String key) {
        String envKey = toEnvKey(key);
        String value = dotenv.get(envKey);
        if (value == null) {
            value = System.getenv(envKey);
        }
        return value != null ? value.trim() : null;
    }

    static String toEnvKey(String key) {
        return key.toUpperCase()
                .replace(".", "_")
                .replace("-", "_");
    }
}
