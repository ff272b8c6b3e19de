package com.bko.sheetsclient.web;

import com.bko.sheetsclient.notation.A1Notation;
import com.bko.sheetsclient.notation.ColumnNotation;
import com.bko.sheetsclient.notation.RangeRequest;
import com.bko.sheetsclient.web.dto.ColumnNotationDto;
import com.bko.sheetsclient.web.dto.RangeNotationDto;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notation")
public class NotationController {

    @GetMapping(value = "/column/{index}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ColumnNotationDto column(@PathVariable("index") int index) {
        return new ColumnNotationDto(index, ColumnNotation.encode(index));
    }

    @GetMapping(value = "/range", produces = MediaType.APPLICATION_JSON_VALUE)
    public RangeNotationDto range(@RequestParam(name = "startColumn", required = false) Integer startColumn,
                                  @RequestParam(name = "startRow", required = false) Integer startRow,
                                  @RequestParam(name = "endColumn", required = false) Integer endColumn,
                                  @RequestParam(name = "endRow", required = false) Integer endRow,
                                  @RequestParam(name = "sheet", required = false) String sheet) {
        RangeRequest request = new RangeRequest(startColumn, startRow, endColumn, endRow);
        return new RangeNotationDto(A1Notation.onSheet(sheet, request.toA1Notation()));
    }
}
