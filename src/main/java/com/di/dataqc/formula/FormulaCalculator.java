package com.di.dataqc.formula;

import com.di.dataqc.aspect.LogOperation;
import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.dataset.TypeConverter;
import com.di.dataqc.exception.ColumnNotFoundException;
import com.di.dataqc.exception.RuleConfigurationException;
import com.di.dataqc.reconcile.KeyNormalizer;
import com.di.dataqc.reconcile.MatchOptions;
import com.di.dataqc.reconcile.RowKey;
import com.di.dataqc.util.Stats;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies a binary operation between a column of one dataset and a column of another, row by row.
 * Non-numeric operands and division by zero give a null result cell.
 */
@Slf4j
@Service
public class FormulaCalculator {

    static final int MAX_DATA_ROWS = 1000;

    @LogOperation(eventType = "FORMULA")
    public FormulaResult calculate(FormulaRequest request) {
        Dataset left = request.getSource1().dataset();
        Dataset right = request.getSource2().dataset();
        requireColumn(left, request.getColumn1());
        requireColumn(right, request.getColumn2());

        String leftLabel = request.getSource1().name() + "." + request.getColumn1();
        String rightLabel = request.getSource2().name() + "." + request.getColumn2();
        if (rightLabel.equals(leftLabel)) {
            rightLabel = rightLabel + " (2)";
        }
        String formula = leftLabel + " " + request.getOperation().symbol() + " " + rightLabel;
        log.info("[FORMULA] Calculating {} as '{}' by {}", formula, request.getResultName(), request.getMatchBy().id());

        List<int[]> pairs = request.getMatchBy() == MatchBy.KEY
                ? pairByKey(left, right, request.getKeyColumns())
                : pairByIndex(left, right);
        List<String> idColumns = request.getMatchBy() == MatchBy.KEY ? request.getKeyColumns() : List.of("row_index");
        checkOutputColumns(idColumns, leftLabel, rightLabel, request.getResultName());

        List<Map<String, Object>> data = new ArrayList<>();
        List<Double> results = new ArrayList<>();
        long nullResults = 0;
        for (int[] pair : pairs) {
            CellValue a = left.cell(pair[0], request.getColumn1());
            CellValue b = right.cell(pair[1], request.getColumn2());
            Double value = apply(request.getOperation(), a, b);
            if (value == null) {
                nullResults++;
            } else {
                results.add(value);
            }
            if (data.size() < MAX_DATA_ROWS) {
                Map<String, Object> row = new LinkedHashMap<>();
                if (request.getMatchBy() == MatchBy.KEY) {
                    for (String key : request.getKeyColumns()) {
                        row.put(key, left.cell(pair[0], key).toPlain());
                    }
                } else {
                    row.put("row_index", pair[0]);
                }
                row.put(leftLabel, a.toPlain());
                row.put(rightLabel, b.toPlain());
                row.put(request.getResultName(), value);
                data.add(row);
            }
        }

        double[] values = results.stream().mapToDouble(Double::doubleValue).toArray();
        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("total_rows", pairs.size());
        statistics.put("calculated_rows", values.length);
        statistics.put("null_results", nullResults);
        statistics.put("sum", values.length == 0 ? null : Stats.sum(values));
        statistics.put("mean", Stats.mean(values));
        statistics.put("min", Stats.min(values));
        statistics.put("max", Stats.max(values));

        log.info("[FORMULA] {} row(s) matched, {} calculated", pairs.size(), values.length);
        return FormulaResult.builder()
                .formula(formula)
                .resultName(request.getResultName())
                .matchBy(request.getMatchBy().id())
                .data(data)
                .statistics(statistics)
                .build();
    }

    static Double apply(FormulaOperation operation, CellValue a, CellValue b) {
        CellValue left = TypeConverter.toNumber(a);
        CellValue right = TypeConverter.toNumber(b);
        if (left.isNull() || right.isNull()) {
            return null;
        }
        BigDecimal result = operation.apply(left.asDecimal(), right.asDecimal());
        return result == null ? null : result.doubleValue();
    }

    /** Key or row-index columns, operand labels and the result name must all be distinct. */
    private static void checkOutputColumns(List<String> idColumns, String leftLabel, String rightLabel, String resultName) {
        List<String> columns = new ArrayList<>(idColumns);
        columns.add(leftLabel);
        columns.add(rightLabel);
        Set<String> seen = new HashSet<>();
        for (String column : columns) {
            if (!seen.add(column)) {
                throw new RuleConfigurationException(String.format(
                        "Key column '%s' collides with an operand column in the output", column));
            }
        }
        if (seen.contains(resultName)) {
            throw new RuleConfigurationException(String.format(
                    "result_name '%s' collides with an existing output column; choose another name", resultName));
        }
    }

    private static List<int[]> pairByIndex(Dataset left, Dataset right) {
        int rows = Math.min(left.rowCount(), right.rowCount());
        List<int[]> pairs = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            pairs.add(new int[]{i, i});
        }
        return pairs;
    }

    private static List<int[]> pairByKey(Dataset left, Dataset right, List<String> keyColumns) {
        if (keyColumns == null || keyColumns.isEmpty()) {
            throw new RuleConfigurationException("key_columns are required when match_by is 'key'");
        }
        List<String> missing = new ArrayList<>(left.missingColumns(keyColumns));
        right.missingColumns(keyColumns).stream().filter(c -> !missing.contains(c)).forEach(missing::add);
        if (!missing.isEmpty()) {
            throw new ColumnNotFoundException(missing);
        }
        KeyNormalizer normalizer = new KeyNormalizer(keyColumns, MatchOptions.defaults());
        Map<RowKey, Integer> rightIndex = new LinkedHashMap<>();
        for (int j = 0; j < right.rowCount(); j++) {
            rightIndex.putIfAbsent(normalizer.keyFor(right, j), j);
        }
        Set<RowKey> seen = new HashSet<>();
        List<int[]> pairs = new ArrayList<>();
        for (int i = 0; i < left.rowCount(); i++) {
            RowKey key = normalizer.keyFor(left, i);
            Integer j = rightIndex.get(key);
            if (j != null && seen.add(key)) {
                pairs.add(new int[]{i, j});
            }
        }
        return pairs;
    }

    private static void requireColumn(Dataset dataset, String column) {
        if (column == null || column.isBlank()) {
            throw RuleConfigurationException.missingField("column");
        }
        if (!dataset.hasColumn(column)) {
            throw new ColumnNotFoundException(List.of(column));
        }
    }
}
