package com.bko.sheetsclient.web.dto;

public record ColumnNotationDto(int column, String notation) {
}
