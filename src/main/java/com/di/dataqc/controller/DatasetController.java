package com.di.dataqc.controller;

import com.di.dataqc.config.QcProperties;
import com.di.dataqc.connector.ConnectorRegistry;
import com.di.dataqc.connector.ConnectorRequest;
import com.di.dataqc.connector.FileConnector;
import com.di.dataqc.controller.dto.ConnectionRequest;
import com.di.dataqc.controller.dto.PreviewResponse;
import com.di.dataqc.controller.dto.QueryRequest;
import com.di.dataqc.controller.dto.RenameRequest;
import com.di.dataqc.controller.dto.SourceSummary;
import com.di.dataqc.controller.dto.UploadResponse;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.QcException;
import com.di.dataqc.export.CsvExportRenderer;
import com.di.dataqc.exception.ResourceNotFoundException;
import com.di.dataqc.store.DatasetSession;
import com.di.dataqc.store.DatasetSessionStore;
import com.di.dataqc.util.InputValidator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loading datasets into sessions and managing them.
 */
@Slf4j
@RestController
@RequestMapping("/api/data")
@RequiredArgsConstructor
public class DatasetController {

    private static final int MAX_PREVIEW_LIMIT = 10_000;

    private final ConnectorRegistry connectorRegistry;
    private final DatasetSessionStore sessionStore;
    private final QcProperties properties;
    private final CsvExportRenderer csvRenderer;

    @GetMapping(value = "/sources", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> listSources() {
        List<SourceSummary> sources = sessionStore.list().stream().map(SourceSummary::of).toList();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("sources", sources);
        body.put("count", sources.size());
        return ResponseEntity.ok(body);
    }

    @GetMapping(value = "/sources/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SourceSummary> getSource(@PathVariable("id") String id) {
        return ResponseEntity.ok(SourceSummary.of(sessionStore.getRequired(id)));
    }

    /**
     * Example: GET /api/data/preview/{id}?offset=100&limit=50
     */
    @GetMapping(value = "/preview/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PreviewResponse> preview(@PathVariable("id") String id,
                                                   @RequestParam(value = "offset", defaultValue = "0") int offset,
                                                   @RequestParam(value = "limit", required = false) Integer limit) {
        int effectiveLimit = limit != null ? limit : properties.getPreview().getRows();
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative, got: " + offset);
        }
        if (effectiveLimit < 1 || effectiveLimit > MAX_PREVIEW_LIMIT) {
            throw new IllegalArgumentException(String.format(
                    "limit must be between 1 and %d, got: %d", MAX_PREVIEW_LIMIT, effectiveLimit));
        }
        Dataset dataset = sessionStore.getRequired(id).getDataset();
        List<Map<String, Object>> data = new ArrayList<>();
        int end = (int) Math.min((long) offset + effectiveLimit, dataset.rowCount());
        for (int row = offset; row < end; row++) {
            data.add(dataset.record(row));
        }
        return ResponseEntity.ok(PreviewResponse.builder()
                .sourceId(id)
                .columns(dataset.columnNames())
                .totalRows(dataset.rowCount())
                .offset(offset)
                .limit(effectiveLimit)
                .data(data)
                .build());
    }

    /**
     * Loads each uploaded file into its own session. A file that cannot be loaded is reported in the response
     * and does not stop the others.
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<UploadResponse> upload(@RequestPart("files") List<MultipartFile> files,
                                                 @RequestParam(value = "delimiter", defaultValue = ",") String delimiter) {
        List<UploadResponse.FileResult> results = new ArrayList<>();
        for (MultipartFile file : files) {
            String filename = file.getOriginalFilename();
            if (filename == null || filename.isBlank()) {
                continue;
            }
            results.add(loadFile(file, InputValidator.sanitizeFilename(filename), delimiter));
        }
        if (results.isEmpty()) {
            throw new IllegalArgumentException("No files selected");
        }
        UploadResponse response = UploadResponse.of(results);
        log.info("[CONTROLLER] Upload: {} file(s), {} loaded, {} failed", response.getTotalFiles(),
                response.getSuccessfulCount(), response.getFailedCount());
        return ResponseEntity.ok(response);
    }

    private UploadResponse.FileResult loadFile(MultipartFile file, String filename, String delimiter) {
        try {
            Dataset dataset = connectorRegistry.getConnector(FileConnector.TYPE).load(ConnectorRequest.builder()
                    .type(FileConnector.TYPE)
                    .filename(filename)
                    .content(file.getBytes())
                    .delimiter(delimiter)
                    .build());
            DatasetSession session = sessionStore.save(filename, FileConnector.TYPE, dataset, filename);
            return UploadResponse.FileResult.loaded(filename, SourceSummary.of(session));
        } catch (QcException | IllegalArgumentException | IOException e) {
            log.warn("[CONTROLLER] Failed to load {}: {}", filename, e.getMessage());
            return UploadResponse.FileResult.failed(filename, e.getMessage());
        }
    }

    /**
     * Runs a read-only query and stores the result set as a new session.
     */
    @PostMapping(value = "/query", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> query(@Valid @RequestBody QueryRequest request) {
        String type = databaseType(request);
        ConnectorRequest connectorRequest = connectionBuilder(request).query(request.getQuery()).build();
        Dataset dataset = connectorRegistry.getConnector(type).load(connectorRequest);
        String name = request.getName() != null && !request.getName().isBlank()
                ? request.getName().trim() : type.toUpperCase(Locale.ROOT) + " Query";
        DatasetSession session = sessionStore.save(name, type, dataset, request.getQuery());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("source", SourceSummary.of(session));
        body.put("preview", dataset.toRecords(properties.getPreview().getRows()));
        return ResponseEntity.ok(body);
    }

    @PostMapping(value = "/test-connection", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> testConnection(@RequestBody ConnectionRequest request) {
        String type = databaseType(request);
        connectorRegistry.getConnector(type).testConnection(connectionBuilder(request).build());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Connection successful");
        return ResponseEntity.ok(body);
    }

    @PutMapping(value = "/sources/{id}/name", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SourceSummary> rename(@PathVariable("id") String id, @Valid @RequestBody RenameRequest request) {
        return ResponseEntity.ok(SourceSummary.of(sessionStore.rename(id, request.getName())));
    }

    /**
     * Downloads the whole dataset of a session as CSV.
     */
    @GetMapping(value = "/sources/{id}/export/csv")
    public ResponseEntity<byte[]> exportCsv(@PathVariable("id") String id) {
        DatasetSession session = sessionStore.getRequired(id);
        byte[] content = csvRenderer.renderDataset(session.getDataset());
        String filename = "data_" + id.substring(0, Math.min(8, id.length())) + ".csv";
        log.info("[CONTROLLER] Exported source {} as CSV ({} rows)", id, session.getDataset().rowCount());
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment().filename(filename).build().toString())
                .contentType(MediaType.parseMediaType("text/csv"))
                .contentLength(content.length)
                .body(content);
    }

    @DeleteMapping(value = "/sources/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> delete(@PathVariable("id") String id) {
        if (!sessionStore.delete(id)) {
            throw new ResourceNotFoundException("Source", id);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Source deleted");
        return ResponseEntity.ok(body);
    }

    // ------------------------------------------------------------------------

    private static String databaseType(ConnectionRequest request) {
        String type = request.getSource() == null || request.getSource().isBlank()
                ? "postgres" : request.getSource().trim().toLowerCase(Locale.ROOT);
        if (FileConnector.TYPE.equals(type)) {
            throw new IllegalArgumentException("File sources are loaded through /api/data/upload");
        }
        return type;
    }

    private static ConnectorRequest.ConnectorRequestBuilder connectionBuilder(ConnectionRequest request) {
        ConnectorRequest.ConnectorRequestBuilder builder = ConnectorRequest.builder()
                .type(request.getSource())
                .host(request.getHost())
                .database(request.getDatabase())
                .user(request.getUser())
                .password(request.getPassword());
        if (request.getPort() != null) {
            builder.port(request.getPort());
        }
        return builder;
    }
}
