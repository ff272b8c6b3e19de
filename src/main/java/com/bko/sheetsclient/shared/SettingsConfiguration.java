package com.bko.sheetsclient.shared;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SettingsConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(SettingsConfiguration.class);

    @Bean
    public AppSettings appSettings(EnvConfig envConfig) {
        GoogleSettings google = new GoogleSettings(
                envConfig.get("google.spreadsheet_id"),
                envConfig.get("google.service_account_key_path"),
                envConfig.get("google.sheet_name")
        );
        AppSettings settings = new AppSettings(google);
        if (!settings.isGoogleConfigured()) {
            logger.warn("Google configuration incomplete. Set GOOGLE_SPREADSHEET_ID and GOOGLE_SERVICE_ACCOUNT_KEY_PATH.");
        }
        return settings;
    }
}
