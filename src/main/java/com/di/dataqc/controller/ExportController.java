package com.di.dataqc.controller;

import com.di.dataqc.controller.dto.ExportRequest;
import com.di.dataqc.export.ExportFile;
import com.di.dataqc.export.ExportService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Downloads of stored results.
 *
 * Example: POST /api/export/csv with {@code {"result_id": "...", "include_failed_rows": true}}
 */
@RestController
@RequestMapping("/api/export")
@RequiredArgsConstructor
public class ExportController {

    private final ExportService exportService;

    @PostMapping(value = "/{format}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<byte[]> export(@PathVariable("format") String format,
                                         @Valid @RequestBody ExportRequest request) {
        ExportFile file = exportService.export(format, request.getResultId(), request.isIncludeFailedRows());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(file.filename()).build().toString())
                .contentType(MediaType.parseMediaType(file.contentType()))
                .contentLength(file.content().length)
                .body(file.content());
    }

    @GetMapping(value = "/formats", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<String>> formats() {
        return ResponseEntity.ok(exportService.formats());
    }
}
