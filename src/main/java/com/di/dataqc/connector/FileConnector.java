package com.di.dataqc.connector;

import com.di.dataqc.aspect.LogOperation;
import com.di.dataqc.config.QcProperties;
import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.dataset.TypeConverter;
import com.di.dataqc.exception.ConnectorException;
import com.di.dataqc.util.InputValidator;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Uploaded files with a header row: delimited text (CSV, TXT) or Excel workbooks (XLSX, XLS).
 * <p>
 * Text content is decoded as UTF-8 (a byte-order mark is dropped), falling back to ISO-8859-1 when the
 * bytes are not valid UTF-8, and cell types are inferred from the text. Short rows are padded with nulls;
 * rows with more fields than the header fail. Workbooks are read by {@link ExcelWorkbookReader}.
 */
@Slf4j
@Component
public class FileConnector implements DatasetConnector {

    public static final String TYPE = "file";

    private static final long BYTES_PER_MB = 1024L * 1024L;
    private static final Set<String> EXCEL_EXTENSIONS = Set.of("xlsx", "xls");

    private final CsvMapper csvMapper = new CsvMapper();
    private final ExcelWorkbookReader excelReader = new ExcelWorkbookReader();
    private final QcProperties properties;

    public FileConnector(QcProperties properties) {
        this.properties = properties;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    @LogOperation(eventType = "FILE_LOAD")
    public Dataset load(ConnectorRequest request) {
        String filename = InputValidator.sanitizeFilename(request.getFilename());
        String extension = InputValidator.validateFileExtension(filename, properties.getUpload().getAllowedExtensions());
        byte[] content = request.getContent();
        if (content == null) {
            throw new ConnectorException(TYPE, "No content for file: " + filename);
        }
        long maxBytes = properties.getUpload().getMaxFileSizeMb() * BYTES_PER_MB;
        if (content.length > maxBytes) {
            throw new IllegalArgumentException(String.format("File %s is %d bytes, exceeding the %d MB limit",
                    filename, content.length, properties.getUpload().getMaxFileSizeMb()));
        }

        Dataset dataset = EXCEL_EXTENSIONS.contains(extension)
                ? excelReader.read(filename, content)
                : readDelimited(filename, content, request.delimiterChar());
        log.info("[CONNECTOR] Loaded {} rows x {} columns from {}", dataset.rowCount(), dataset.columnCount(), filename);
        return dataset;
    }

    private Dataset readDelimited(String filename, byte[] content, char delimiter) {
        List<String[]> records = readRecords(filename, decode(content), delimiter);
        if (records.isEmpty()) {
            throw new ConnectorException(TYPE, "File is empty: " + filename);
        }
        List<String> header = headerNames(records.get(0));

        Dataset.Builder builder = Dataset.builder();
        header.forEach(builder::column);
        for (int i = 1; i < records.size(); i++) {
            String[] record = records.get(i);
            if (record.length > header.size()) {
                throw new ConnectorException(TYPE, String.format(
                        "Error reading %s: line %d has %d fields, expected %d", filename, i + 1, record.length, header.size()));
            }
            List<CellValue> cells = new ArrayList<>(header.size());
            for (int c = 0; c < header.size(); c++) {
                cells.add(c < record.length ? TypeConverter.inferCell(record[c]) : CellValue.nullValue());
            }
            builder.cells(cells);
        }
        return builder.build();
    }

    private List<String[]> readRecords(String filename, String text, char delimiter) {
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(delimiter);
        List<String[]> records = new ArrayList<>();
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class)
                .with(schema)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(text)) {
            while (it.hasNextValue()) {
                records.add(it.nextValue());
            }
        } catch (IOException | RuntimeException e) {
            throw new ConnectorException(TYPE, "Failed to read " + filename + ": " + e.getMessage(), e);
        }
        return records;
    }

    /**
     * Blank header cells become {@code Unnamed: i}; repeated names get {@code .1}, {@code .2} suffixes.
     */
    static List<String> headerNames(String[] raw) {
        List<String> names = new ArrayList<>(raw.length);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < raw.length; i++) {
            String base = raw[i] == null || raw[i].isBlank() ? "Unnamed: " + i : raw[i].trim();
            String name = base;
            int suffix = 1;
            while (!seen.add(name)) {
                name = base + "." + suffix++;
            }
            names.add(name);
        }
        return names;
    }

    static String decode(byte[] content) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            log.debug("[CONNECTOR] Content is not valid UTF-8, decoding as ISO-8859-1");
            text = new String(content, StandardCharsets.ISO_8859_1);
        }
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }
}
