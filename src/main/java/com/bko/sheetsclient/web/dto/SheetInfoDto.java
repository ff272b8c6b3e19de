package com.bko.sheetsclient.web.dto;

import com.bko.sheetsclient.shared.ConfigStatus;

public record SheetInfoDto(String link, ConfigStatus config) {
}
