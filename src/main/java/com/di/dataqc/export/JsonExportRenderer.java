package com.di.dataqc.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;

/**
 * Pretty-printed JSON of {@link ExportData#toMap()}.
 */
@Component
public class JsonExportRenderer implements ExportRenderer {

    private final ObjectMapper objectMapper;

    public JsonExportRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public String contentType() {
        return "application/json";
    }

    @Override
    public String fileExtension() {
        return "json";
    }

    @Override
    public byte[] render(ExportData data) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(data.toMap());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render JSON export", e);
        }
    }
}
