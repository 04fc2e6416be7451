package com.di.dataqc.compare;

import com.di.dataqc.aspect.LogOperation;
import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.dataset.Column;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.ColumnNotFoundException;
import com.di.dataqc.util.Stats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compares a source dataset against a target: schema, row count, then cell values either by position
 * or by a full outer join on key columns.
 */
@Slf4j
@Service
public class DatasetComparator {

    static final int MAX_DIFFERENCES_PER_COLUMN = 100;
    static final int MAX_DIFFERENCES = 500;

    @LogOperation(eventType = "COMPARE", parameterNames = {"source", "target"})
    public ComparisonResult compare(Dataset source, Dataset target, ComparisonOptions options) {
        log.info("[COMPARE] Comparing {} with {} (keys={}, tolerance={})",
                source, target, options.getKeyColumns(), options.getTolerance());

        Map<String, Object> schemaDiff = compareSchemas(source, target);
        boolean schemaMatch = (Boolean) schemaDiff.remove("schema_match");

        List<String> compareColumns = options.getCompareColumns() == null
                ? List.of() : options.getCompareColumns();
        if (compareColumns.isEmpty()) {
            if (!schemaMatch) {
                @SuppressWarnings("unchecked")
                List<String> common = (List<String>) schemaDiff.get("common_columns");
                if (common.isEmpty()) {
                    log.info("[COMPARE] No common columns between datasets");
                    return ComparisonResult.builder()
                            .match(false)
                            .message("No common columns between datasets")
                            .summary(Map.of("schema_match", false))
                            .columnDifferences(schemaDiff)
                            .build();
                }
                compareColumns = common;
            } else {
                compareColumns = source.columnNames();
            }
        }

        boolean shapeMatch = source.rowCount() == target.rowCount();
        Map<String, Object> rowDiff = options.isKeyBased()
                ? compareWithKeys(source, target, compareColumns, options)
                : comparePositional(source, target, compareColumns, options);
        long totalDifferences = ((Number) rowDiff.get("total_differences")).longValue();

        boolean match = schemaMatch && shapeMatch && totalDifferences == 0;
        String message;
        if (match) {
            message = "Datasets are identical";
        } else {
            List<String> issues = new ArrayList<>();
            if (!schemaMatch) {
                issues.add("schema differences");
            }
            if (!shapeMatch) {
                issues.add(String.format("row count mismatch (%d vs %d)", source.rowCount(), target.rowCount()));
            }
            if (totalDifferences > 0) {
                issues.add(totalDifferences + " value differences");
            }
            message = "Differences found: " + String.join(", ", issues);
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("schema_match", schemaMatch);
        summary.put("shape_match", shapeMatch);
        summary.put("rows_compared", Math.min(source.rowCount(), target.rowCount()));
        summary.put("total_differences", totalDifferences);

        log.info("[COMPARE] {}", message);
        return ComparisonResult.builder()
                .match(match)
                .message(message)
                .summary(summary)
                .columnDifferences(schemaDiff)
                .rowDifferences(rowDiff)
                .statistics(statistics(source, target, compareColumns))
                .build();
    }

    // ------------------------------------------------------------------------
    // Schema
    // ------------------------------------------------------------------------

    private static Map<String, Object> compareSchemas(Dataset source, Dataset target) {
        List<String> onlyInSource = source.columnNames().stream()
                .filter(c -> !target.hasColumn(c)).collect(Collectors.toList());
        List<String> onlyInTarget = target.columnNames().stream()
                .filter(c -> !source.hasColumn(c)).collect(Collectors.toList());
        List<String> common = source.columnNames().stream()
                .filter(target::hasColumn).collect(Collectors.toList());

        Map<String, Object> typeMismatches = new LinkedHashMap<>();
        for (String column : common) {
            Column s = source.column(column);
            Column t = target.column(column);
            if (s.type() != t.type()) {
                Map<String, Object> mismatch = new LinkedHashMap<>();
                mismatch.put("source_type", s.type().label());
                mismatch.put("target_type", t.type().label());
                typeMismatches.put(column, mismatch);
            }
        }

        Map<String, Object> diff = new LinkedHashMap<>();
        diff.put("schema_match", onlyInSource.isEmpty() && onlyInTarget.isEmpty() && typeMismatches.isEmpty());
        diff.put("only_in_source", onlyInSource);
        diff.put("only_in_target", onlyInTarget);
        diff.put("common_columns", common);
        diff.put("type_mismatches", typeMismatches);
        return diff;
    }

    // ------------------------------------------------------------------------
    // Row strategies
    // ------------------------------------------------------------------------

    private static Map<String, Object> comparePositional(Dataset source, Dataset target,
                                                         List<String> columns, ComparisonOptions options) {
        int rows = Math.min(source.rowCount(), target.rowCount());
        List<Map<String, Object>> differences = new ArrayList<>();
        long total = 0;
        for (String column : columns) {
            if (!source.hasColumn(column) || !target.hasColumn(column)) {
                continue;
            }
            List<CellValue> left = source.values(column);
            List<CellValue> right = target.values(column);
            int recordedForColumn = 0;
            for (int i = 0; i < rows; i++) {
                if (cellsMatch(left.get(i), right.get(i), options)) {
                    continue;
                }
                total++;
                if (recordedForColumn < MAX_DIFFERENCES_PER_COLUMN && differences.size() < MAX_DIFFERENCES) {
                    Map<String, Object> difference = new LinkedHashMap<>();
                    difference.put("row_index", i);
                    difference.put("column", column);
                    difference.put("source_value", display(left.get(i)));
                    difference.put("target_value", display(right.get(i)));
                    differences.add(difference);
                    recordedForColumn++;
                }
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("total_differences", total);
        result.put("differences", differences);
        result.put("comparison_method", "positional");
        return result;
    }

    private static Map<String, Object> compareWithKeys(Dataset source, Dataset target,
                                                       List<String> columns, ComparisonOptions options) {
        List<String> keys = options.getKeyColumns();
        Set<String> missing = new LinkedHashSet<>(source.missingColumns(keys));
        missing.addAll(target.missingColumns(keys));
        if (!missing.isEmpty()) {
            throw new ColumnNotFoundException(new ArrayList<>(missing));
        }

        Map<List<CellValue>, List<Integer>> targetIndex = new LinkedHashMap<>();
        for (int i = 0; i < target.rowCount(); i++) {
            targetIndex.computeIfAbsent(keyOf(target, keys, i), k -> new ArrayList<>()).add(i);
        }
        Map<List<CellValue>, Boolean> sourceKeys = new HashMap<>();
        for (int i = 0; i < source.rowCount(); i++) {
            sourceKeys.put(keyOf(source, keys, i), Boolean.TRUE);
        }

        List<String> valueColumns = columns.stream()
                .filter(c -> !keys.contains(c) && source.hasColumn(c) && target.hasColumn(c))
                .collect(Collectors.toList());

        long onlyInSource = 0;
        long matchingRows = 0;
        long valueDifferenceCount = 0;
        Map<String, Integer> recordedPerColumn = new HashMap<>();
        List<Map<String, Object>> valueDifferences = new ArrayList<>();
        for (int i = 0; i < source.rowCount(); i++) {
            List<CellValue> key = keyOf(source, keys, i);
            List<Integer> partners = targetIndex.get(key);
            if (partners == null) {
                onlyInSource++;
                continue;
            }
            for (int j : partners) {
                matchingRows++;
                for (String column : valueColumns) {
                    CellValue left = source.cell(i, column);
                    CellValue right = target.cell(j, column);
                    if (cellsMatch(left, right, options)) {
                        continue;
                    }
                    valueDifferenceCount++;
                    int recorded = recordedPerColumn.getOrDefault(column, 0);
                    if (recorded < MAX_DIFFERENCES_PER_COLUMN && valueDifferences.size() < MAX_DIFFERENCES) {
                        Map<String, Object> keyValues = new LinkedHashMap<>();
                        for (int k = 0; k < keys.size(); k++) {
                            keyValues.put(keys.get(k), key.get(k).asText());
                        }
                        Map<String, Object> difference = new LinkedHashMap<>();
                        difference.put("keys", keyValues);
                        difference.put("column", column);
                        difference.put("source_value", display(left));
                        difference.put("target_value", display(right));
                        valueDifferences.add(difference);
                        recordedPerColumn.put(column, recorded + 1);
                    }
                }
            }
        }
        long onlyInTarget = 0;
        for (Map.Entry<List<CellValue>, List<Integer>> entry : targetIndex.entrySet()) {
            if (!sourceKeys.containsKey(entry.getKey())) {
                onlyInTarget += entry.getValue().size();
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("total_differences", valueDifferenceCount + onlyInSource + onlyInTarget);
        result.put("only_in_source", onlyInSource);
        result.put("only_in_target", onlyInTarget);
        result.put("matching_rows", matchingRows);
        result.put("value_differences", valueDifferences);
        result.put("comparison_method", "key_based");
        return result;
    }

    private static List<CellValue> keyOf(Dataset dataset, List<String> keys, int row) {
        List<CellValue> key = new ArrayList<>(keys.size());
        for (String column : keys) {
            key.add(dataset.cell(row, column));
        }
        return key;
    }

    /**
     * Null on both sides is never a difference. Numbers compare within the tolerance when one is set;
     * text is normalized for case and surrounding whitespace when requested.
     */
    static boolean cellsMatch(CellValue left, CellValue right, ComparisonOptions options) {
        if (left.isNull() && right.isNull()) {
            return true;
        }
        if (left.isNull() || right.isNull()) {
            return false;
        }
        if (left.isNumber() && right.isNumber() && options.getTolerance() > 0) {
            BigDecimal difference = left.asDecimal().subtract(right.asDecimal()).abs();
            return difference.compareTo(BigDecimal.valueOf(options.getTolerance())) <= 0;
        }
        if (left.isText() && right.isText()) {
            return normalize(left.asText(), options).equals(normalize(right.asText(), options));
        }
        return left.equals(right);
    }

    private static String normalize(String text, ComparisonOptions options) {
        String out = text;
        if (options.isIgnoreCase()) {
            out = out.toLowerCase(Locale.ROOT);
        }
        if (options.isIgnoreWhitespace()) {
            out = out.strip();
        }
        return out;
    }

    private static String display(CellValue cell) {
        return cell.isNull() ? null : cell.asText();
    }

    // ------------------------------------------------------------------------
    // Statistics
    // ------------------------------------------------------------------------

    private static Map<String, Object> statistics(Dataset source, Dataset target, List<String> columns) {
        Map<String, Object> columnStats = new LinkedHashMap<>();
        for (String column : columns) {
            if (!source.hasColumn(column) || !target.hasColumn(column)) {
                continue;
            }
            Map<String, Object> stats = new LinkedHashMap<>();
            if (source.columnType(column).isNumeric()) {
                stats.put("source", numericSummary(source.numericValues(column)));
                stats.put("target", numericSummary(target.numericValues(column)));
            }
            columnStats.put(column, stats);
        }

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("source_rows", source.rowCount());
        statistics.put("target_rows", target.rowCount());
        statistics.put("source_columns", source.columnCount());
        statistics.put("target_columns", target.columnCount());
        statistics.put("column_stats", columnStats);
        return statistics;
    }

    private static Map<String, Object> numericSummary(double[] values) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("min", Stats.min(values));
        summary.put("max", Stats.max(values));
        summary.put("mean", Stats.mean(values));
        summary.put("sum", Stats.sum(values));
        return summary;
    }
}
