package com.di.dataqc.export;

import com.di.dataqc.dataset.Dataset;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sectioned CSV: the summary table, then one table per failed-row label, then the side tables.
 * Nested values are written as JSON text. {@link #renderDataset} writes a loaded dataset as a plain table.
 */
@Component
public class CsvExportRenderer implements ExportRenderer {

    private static final String RULE = "=".repeat(50);
    private static final String SUB_RULE = "-".repeat(30);

    /** Quotes only cells holding a separator, quote or line break. */
    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();
    private final ObjectMapper objectMapper;

    public CsvExportRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String format() {
        return "csv";
    }

    @Override
    public String contentType() {
        return "text/csv";
    }

    @Override
    public String fileExtension() {
        return "csv";
    }

    @Override
    public byte[] render(ExportData data) {
        StringBuilder out = new StringBuilder();
        out.append("QC Results Summary\n").append(RULE).append("\n\n");
        out.append(table(data.getSummary()));

        if (!data.getFailedRows().isEmpty()) {
            out.append("\n\nFailed Rows Detail\n").append(RULE).append("\n\n");
            data.getFailedRows().forEach((label, rows) -> {
                out.append('\n').append(label).append('\n').append(SUB_RULE).append('\n');
                out.append(table(rows));
            });
        }
        if (data.getComparison() != null) {
            out.append("\n\nDataset Comparison\n").append(RULE).append("\n\n").append(table(data.getComparison()));
        }
        if (data.getAggregation() != null) {
            out.append("\n\nAggregation Comparison\n").append(RULE).append("\n\n").append(table(data.getAggregation()));
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * A whole dataset as one CSV table in column order, written row by row. A dataset without rows gives
     * the header line alone.
     */
    public byte[] renderDataset(Dataset dataset) {
        if (dataset.columnCount() == 0) {
            return new byte[0];
        }
        CsvSchema.Builder builder = CsvSchema.builder().setUseHeader(true);
        dataset.columnNames().forEach(builder::addColumn);
        CsvSchema schema = builder.build();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            if (dataset.isEmpty()) {
                Map<String, Object> header = new LinkedHashMap<>();
                dataset.columnNames().forEach(name -> header.put(name, name));
                return csvMapper.writer(schema.withoutHeader()).writeValueAsBytes(header);
            }
            try (SequenceWriter writer = csvMapper.writer(schema).writeValues(out)) {
                for (int row = 0; row < dataset.rowCount(); row++) {
                    writer.write(dataset.record(row));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render dataset CSV", e);
        }
        return out.toByteArray();
    }

    String table(List<Map<String, Object>> rows) {
        if (rows == null || rows.isEmpty()) {
            return "";
        }
        Set<String> columns = ExportData.columnsOf(rows);
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        columns.forEach(schema::addColumn);

        List<Map<String, Object>> flat = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (String column : columns) {
                copy.put(column, flatten(row.get(column)));
            }
            flat.add(copy);
        }
        try {
            return csvMapper.writer(schema.build()).writeValueAsString(flat);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to render CSV export", e);
        }
    }

    private Object flatten(Object value) {
        if (value instanceof Map || value instanceof Iterable) {
            try {
                return objectMapper.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Failed to serialize nested export value", e);
            }
        }
        return value;
    }
}
