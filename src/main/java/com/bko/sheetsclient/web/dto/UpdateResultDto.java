package com.bko.sheetsclient.web.dto;

public record UpdateResultDto(String updatedRange, String summary) {
}
