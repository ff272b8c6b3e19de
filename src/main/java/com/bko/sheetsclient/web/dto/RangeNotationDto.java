package com.bko.sheetsclient.web.dto;

public record RangeNotationDto(String notation) {
}
