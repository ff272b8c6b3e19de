package com.bko.sheetsclient.web;

import com.bko.sheetsclient.notation.RangeNotationException;
import com.bko.sheetsclient.sheets.SheetsApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice(basePackageClasses = ApiExceptionHandler.class)
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(RangeNotationException.class)
    public ResponseEntity<Map<String, Object>> handleRangeNotation(RangeNotationException e) {
        logger.warn("Rejected range: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorBody(e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        logger.warn("Bad request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorBody(e.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException e) {
        logger.warn("Service not ready: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(errorBody(e.getMessage()));
    }

    @ExceptionHandler(SheetsApiException.class)
    public ResponseEntity<Map<String, Object>> handleSheetsApi(SheetsApiException e) {
        logger.error("Google Sheets call failed with HTTP {}", e.getStatusCode());
        Map<String, Object> body = errorBody("Google Sheets API returned HTTP " + e.getStatusCode());
        body.put("upstreamStatus", e.getStatusCode());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, Object>> handleIo(IOException e) {
        logger.error("Google Sheets call failed", e);
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(errorBody("Failed to reach Google Sheets: " + e.getMessage()));
    }

    private Map<String, Object> errorBody(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("message", message);
        return body;
    }
}
