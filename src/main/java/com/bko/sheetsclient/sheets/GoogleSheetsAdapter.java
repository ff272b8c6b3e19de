package com.bko.sheetsclient.sheets;

import com.bko.sheetsclient.notation.A1Notation;
import com.bko.sheetsclient.shared.AppSettings;
import com.google.api.client.googleapis.javanet.GoogleNetHttpTransport;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.sheets.v4.Sheets;
import com.google.api.services.sheets.v4.SheetsRequest;
import com.google.api.services.sheets.v4.SheetsScopes;
import com.google.api.services.sheets.v4.model.AppendValuesResponse;
import com.google.api.services.sheets.v4.model.BatchUpdateValuesRequest;
import com.google.api.services.sheets.v4.model.BatchUpdateValuesResponse;
import com.google.api.services.sheets.v4.model.ClearValuesRequest;
import com.google.api.services.sheets.v4.model.ClearValuesResponse;
import com.google.api.services.sheets.v4.model.Spreadsheet;
import com.google.api.services.sheets.v4.model.UpdateValuesResponse;
import com.google.api.services.sheets.v4.model.ValueRange;
import com.google.auth.http.HttpCredentialsAdapter;
import com.google.auth.oauth2.GoogleCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.util.Collections;
import java.util.List;

@Component
public class GoogleSheetsAdapter implements SpreadsheetPort {
    private static final Logger logger = LoggerFactory.getLogger(GoogleSheetsAdapter.class);
    private static final String APPLICATION_NAME = "SheetsRangeClient";
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();
    private static final List<String> SCOPES = Collections.singletonList(SheetsScopes.SPREADSHEETS);
    private static final String SHEET_LINK = "https://docs.google.com/spreadsheets/d/%s/";
    private static final String USER_ENTERED = "USER_ENTERED";
    private static final String INSERT_ROWS = "INSERT_ROWS";
    private static final String ROWS = "ROWS";
    private static final String FORMATTED_VALUE = "FORMATTED_VALUE";
    private static final String FORMATTED_STRING = "FORMATTED_STRING";
    private static final String CLASSPATH_PREFIX = "classpath:";

    private final AppSettings settings;
    private Sheets sheetsService;

    public GoogleSheetsAdapter(AppSettings settings) {
        this.settings = settings;
    }

    @Override
    public String getLinkToSheet() {
        return String.format(SHEET_LINK, getSpreadsheetId());
    }

    @Override
    public List<List<Object>> getValues(String range) throws IOException {
        try {
            ValueRange response = getSheetsService().spreadsheets().values()
                    .get(getSpreadsheetId(), range)
                    .execute();
            List<List<Object>> values = response.getValues();
            return values != null ? values : Collections.emptyList();
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() == 400) {
                logger.warn("Error 400: Range not found ({}). Check sheet name.", range);
                logAvailableSheets();
            }
            throw toApiException(e);
        }
    }

    @Override
    public UpdateValuesResponse append(List<Object> row) throws IOException {
        String range = sheetRange(A1Notation.build(0, null, row.size(), null));
        ValueRange body = new ValueRange().setValues(Collections.singletonList(row));

        AppendValuesResponse result = execute(getSheetsService().spreadsheets().values()
                .append(getSpreadsheetId(), range, body)
                .setValueInputOption(USER_ENTERED)
                .setInsertDataOption(INSERT_ROWS));

        UpdateValuesResponse updates = result != null ? result.getUpdates() : null;
        logger.info("Appended to {}: {}", range, UpdateSummary.describe(updates));
        return updates != null ? updates : new UpdateValuesResponse();
    }

    @Override
    public BatchUpdateValuesResponse batchUpdate(List<ValueRange> data) throws IOException {
        if (data == null || data.isEmpty()) {
            return new BatchUpdateValuesResponse().setResponses(Collections.emptyList());
        }

        BatchUpdateValuesRequest request = new BatchUpdateValuesRequest()
                .setValueInputOption(USER_ENTERED)
                .setData(data);

        BatchUpdateValuesResponse response = execute(getSheetsService().spreadsheets().values()
                .batchUpdate(getSpreadsheetId(), request));

        if (response != null && response.getTotalUpdatedCells() != null) {
            logger.info("Batch updated {} cells across {} ranges.", response.getTotalUpdatedCells(), data.size());
        }
        return response;
    }

    @Override
    public String clearSheet() throws IOException {
        String sheetName = settings.google().sheetNameOrDefault();
        ClearValuesResponse response = execute(getSheetsService().spreadsheets().values()
                .clear(getSpreadsheetId(), sheetName, new ClearValuesRequest()));

        String cleared = response != null && response.getClearedRange() != null
                ? response.getClearedRange()
                : sheetName;
        logger.info("Cleared {}", cleared);
        return cleared;
    }

    @Override
    public UpdateValuesResponse refreshEntireSheet(List<List<Object>> values) throws IOException {
        clearSheet();
        return updateValues(sheetRange("A1"), values);
    }

    @Override
    public UpdateValuesResponse updateValues(String range, List<List<Object>> values) throws IOException {
        ValueRange body = new ValueRange()
                .setRange(range)
                .setMajorDimension(ROWS)
                .setValues(values);

        UpdateValuesResponse response = execute(getSheetsService().spreadsheets().values()
                .update(getSpreadsheetId(), range, body)
                .setValueInputOption(USER_ENTERED)
                .setResponseValueRenderOption(FORMATTED_VALUE)
                .setResponseDateTimeRenderOption(FORMATTED_STRING));

        logger.info("Updated {}: {}", range, UpdateSummary.describe(response));
        return response != null ? response : new UpdateValuesResponse();
    }

    private String sheetRange(String notation) {
        return A1Notation.onSheet(settings.google().sheetNameOrDefault(), notation);
    }

    private <T> T execute(SheetsRequest<T> request) throws IOException {
        try {
            return request.execute();
        } catch (GoogleJsonResponseException e) {
            throw toApiException(e);
        }
    }

    private SheetsApiException toApiException(GoogleJsonResponseException e) {
        String body = e.getContent() != null ? e.getContent() : e.getStatusMessage();
        return new SheetsApiException(e.getStatusCode(), body, e);
    }

    private void logAvailableSheets() {
        try {
            Spreadsheet spreadsheet = getSheetsService().spreadsheets().get(getSpreadsheetId()).execute();
            if (spreadsheet != null && spreadsheet.getSheets() != null) {
                spreadsheet.getSheets().forEach(s -> logger.info("Available sheet: {}", s.getProperties().getTitle()));
            }
        } catch (IOException e) {
            logger.debug("Could not list sheets: {}", e.getMessage());
        }
    }

    private String getSpreadsheetId() {
        if (!settings.isGoogleConfigured()) {
            throw new IllegalStateException("Missing Google configuration.");
        }
        return settings.google().spreadsheetId();
    }

    private Sheets getSheetsService() throws IOException {
        if (sheetsService == null) {
            try {
                sheetsService = buildSheetsService();
            } catch (GeneralSecurityException e) {
                throw new IOException("Failed to initialize Sheets client", e);
            }
        }
        return sheetsService;
    }

    private Sheets buildSheetsService() throws GeneralSecurityException, IOException {
        if (!settings.isGoogleConfigured()) {
            throw new IllegalStateException("Missing Google configuration.");
        }
        final NetHttpTransport httpTransport = GoogleNetHttpTransport.newTrustedTransport();
        GoogleCredentials credentials;
        try (InputStream serviceAccountStream = openServiceAccountStream()) {
            credentials = GoogleCredentials.fromStream(serviceAccountStream)
                    .createScoped(SCOPES);
        }

        return new Sheets.Builder(httpTransport, JSON_FACTORY, new HttpCredentialsAdapter(credentials))
                .setApplicationName(APPLICATION_NAME)
                .build();
    }

    private InputStream openServiceAccountStream() throws IOException {
        String path = settings.google().serviceAccountKeyPath();

        if (path.startsWith(CLASSPATH_PREFIX)) {
            String resourcePath = path.substring(CLASSPATH_PREFIX.length());
            InputStream stream = GoogleSheetsAdapter.class.getResourceAsStream(
                    resourcePath.startsWith("/") ? resourcePath : "/" + resourcePath);
            if (stream == null) {
                throw new IOException("Service account resource not found: " + resourcePath);
            }
            return stream;
        }

        Path filePath = Path.of(path);
        if (!Files.exists(filePath)) {
            throw new IOException("Service account key not found at path: " + path);
        }
        return new FileInputStream(filePath.toFile());
    }
}
