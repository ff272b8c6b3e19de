package com.bko.sheetsclient.web;

import com.bko.sheetsclient.shared.AppSettings;
import com.bko.sheetsclient.shared.ConfigStatus;
import com.bko.sheetsclient.sheets.SpreadsheetPort;
import com.bko.sheetsclient.sheets.UpdateSummary;
import com.bko.sheetsclient.web.dto.SheetInfoDto;
import com.bko.sheetsclient.web.dto.UpdateResultDto;
import com.google.api.services.sheets.v4.model.UpdateValuesResponse;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/sheet")
public class SheetController {
    private final SpreadsheetPort spreadsheetPort;
    private final AppSettings settings;

    public SheetController(SpreadsheetPort spreadsheetPort, AppSettings settings) {
        this.spreadsheetPort = spreadsheetPort;
        this.settings = settings;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public SheetInfoDto info() {
        ConfigStatus status = ConfigStatus.from(settings);
        String link = status.googleConfigured() ? spreadsheetPort.getLinkToSheet() : null;
        return new SheetInfoDto(link, status);
    }

    @GetMapping(value = "/values", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<List<Object>> values(@RequestParam("range") String range) throws IOException {
        return spreadsheetPort.getValues(range);
    }

    @PostMapping(value = "/append", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public UpdateResultDto append(@RequestBody List<Object> row) throws IOException {
        return toResult(spreadsheetPort.append(row));
    }

    @PutMapping(value = "/values", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public UpdateResultDto update(@RequestParam("range") String range,
                                  @RequestBody List<List<Object>> values) throws IOException {
        return toResult(spreadsheetPort.updateValues(range, values));
    }

    @PostMapping(value = "/refresh", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public UpdateResultDto refresh(@RequestBody List<List<Object>> values) throws IOException {
        return toResult(spreadsheetPort.refreshEntireSheet(values));
    }

    @PostMapping(value = "/clear", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> clear() throws IOException {
        return Map.of("clearedRange", spreadsheetPort.clearSheet());
    }

    private UpdateResultDto toResult(UpdateValuesResponse response) {
        return new UpdateResultDto(response.getUpdatedRange(), UpdateSummary.describe(response));
    }
}
