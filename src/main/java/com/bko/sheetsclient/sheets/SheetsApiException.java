package com.bko.sheetsclient.sheets;

import java.io.IOException;

/**
 * A non-success response from the Google Sheets API.
 */
public class SheetsApiException extends IOException {
    private final int statusCode;
    private final String body;

    public SheetsApiException(int statusCode, String body, Throwable cause) {
        super("Error from Google Sheets API. " + statusCode + " " + body, cause);
        this.statusCode = statusCode;
        this.body = body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }
}
