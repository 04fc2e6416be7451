package com.di.dataqc.rule.checks;

import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.rule.AbstractQcRule;
import com.di.dataqc.rule.ConfigProperty;
import com.di.dataqc.rule.ConfigSchema;
import com.di.dataqc.rule.RuleConfig;
import com.di.dataqc.rule.RuleKind;
import com.di.dataqc.rule.RuleResult;
import com.di.dataqc.util.Stats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-column null counts against a maximum null percentage.
 * A column violates only when its null percentage is strictly above the threshold.
 */
@Slf4j
@Component
public class NullCheckRule extends AbstractQcRule {

    public NullCheckRule() {
        super(RuleKind.NULL_CHECK, "Null Check",
                "Validates that specified columns do not contain null or missing values");
    }

    @Override
    protected ConfigSchema buildSchema() {
        return ConfigSchema.builder()
                .property("columns", ConfigProperty.stringList("Columns to check for nulls (empty = all columns)"))
                .property("threshold", ConfigProperty.builder().type("number").minimum(0.0).maximum(100.0)
                        .defaultValue(0).description("Maximum acceptable null percentage (0-100)").build())
                .build();
    }

    @Override
    protected RuleResult evaluate(Dataset dataset, RuleConfig config) {
        List<String> columns = config.getStringList("columns");
        double threshold = config.getDouble("threshold", 0.0);
        if (columns.isEmpty()) {
            columns = dataset.columnNames();
        }
        requireColumns(dataset, columns);

        int totalRows = dataset.rowCount();
        Map<String, Object> nullCounts = new LinkedHashMap<>();
        Map<String, Object> violations = new LinkedHashMap<>();
        List<Map<String, Object>> failedRecords = new ArrayList<>();
        long failedTotal = 0;
        long totalNullCells = 0;

        for (String column : columns) {
            List<CellValue> values = dataset.values(column);
            long nullCount = 0;
            for (int i = 0; i < values.size(); i++) {
                if (values.get(i).isNull()) {
                    nullCount++;
                    if (failedRecords.size() < RuleResult.MAX_FAILED_ROWS) {
                        Map<String, Object> record = dataset.record(i);
                        record.put("_failed_column", column);
                        failedRecords.add(record);
                    }
                }
            }
            failedTotal += nullCount;
            totalNullCells += nullCount;

            Map<String, Object> columnStats = new LinkedHashMap<>();
            columnStats.put("null_count", nullCount);
            columnStats.put("null_percentage", Stats.percentage(nullCount, totalRows));
            nullCounts.put(column, columnStats);
            if (exceedsThreshold(nullCount, totalRows, threshold)) {
                violations.put(column, columnStats);
            }
        }

        boolean passed = violations.isEmpty();
        String message = passed
                ? String.format("All %d columns pass null check", columns.size())
                : String.format("%d column(s) exceed null threshold of %s%%", violations.size(), Stats.format(threshold));
        log.debug("[RULE] null_check: {} null cell(s) across {} column(s)", totalNullCells, columns.size());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("columns_checked", columns);
        details.put("null_counts", nullCounts);
        details.put("violations", violations);
        details.put("threshold", threshold);

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("total_rows", totalRows);
        statistics.put("total_null_cells", totalNullCells);
        statistics.put("columns_checked", columns.size());

        return result(passed, message)
                .details(details)
                .statistics(statistics)
                .failedRecords(failedRecords, failedTotal)
                .build();
    }

    /** Exact {@code 100 * nulls / rows > threshold}, so the boundary value passes. */
    private static boolean exceedsThreshold(long nullCount, int totalRows, double threshold) {
        if (totalRows == 0) {
            return false;
        }
        BigDecimal scaledNulls = BigDecimal.valueOf(nullCount).multiply(BigDecimal.valueOf(100));
        BigDecimal allowed = BigDecimal.valueOf(threshold).multiply(BigDecimal.valueOf(totalRows));
        return scaledNulls.compareTo(allowed) > 0;
    }
}
