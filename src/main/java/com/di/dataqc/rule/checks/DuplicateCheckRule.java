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
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rows sharing the same values over a key column subset.
 * <p>
 * {@code keep=first} marks every occurrence after the first, {@code keep=last} every occurrence before the last,
 * and {@code keep=none} marks all rows of a duplicated group. Nulls compare equal to each other.
 */
@Component
public class DuplicateCheckRule extends AbstractQcRule {

    private static final List<String> KEEP_OPTIONS = List.of("first", "last", "none");

    public DuplicateCheckRule() {
        super(RuleKind.DUPLICATE_CHECK, "Duplicate Check", "Identifies duplicate rows based on specified key columns");
    }

    @Override
    protected ConfigSchema buildSchema() {
        return ConfigSchema.builder()
                .property("columns", ConfigProperty.stringList("Columns to check for duplicates (empty = all columns)"))
                .property("keep", ConfigProperty.choice("Which duplicate to keep when identifying duplicates",
                        KEEP_OPTIONS, "first"))
                .build();
    }

    @Override
    protected RuleResult evaluate(Dataset dataset, RuleConfig config) {
        List<String> columns = config.getStringList("columns");
        String keep = config.getString("keep", "first").trim().toLowerCase(Locale.ROOT);
        if (columns.isEmpty()) {
            columns = dataset.columnNames();
        } else {
            requireColumns(dataset, columns);
        }

        Map<List<CellValue>, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < dataset.rowCount(); i++) {
            List<CellValue> key = new ArrayList<>(columns.size());
            for (String column : columns) {
                key.add(dataset.cell(i, column));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
        }

        boolean[] marked = new boolean[dataset.rowCount()];
        Map<Integer, Long> groupSizes = new TreeMap<>();
        int duplicateGroups = 0;
        for (List<Integer> rows : groups.values()) {
            if (rows.size() < 2) {
                continue;
            }
            duplicateGroups++;
            groupSizes.merge(rows.size(), 1L, Long::sum);
            int skip;
            switch (keep) {
                case "first":
                    skip = rows.get(0);
                    break;
                case "last":
                    skip = rows.get(rows.size() - 1);
                    break;
                default:
                    skip = -1;
                    break;
            }
            for (int row : rows) {
                if (row != skip) {
                    marked[row] = true;
                }
            }
        }

        List<Integer> duplicateRows = new ArrayList<>();
        for (int i = 0; i < marked.length; i++) {
            if (marked[i]) {
                duplicateRows.add(i);
            }
        }

        int totalRows = dataset.rowCount();
        int duplicateCount = duplicateRows.size();
        boolean passed = duplicateCount == 0;
        String message = passed
                ? String.format("No duplicates found in %d rows", totalRows)
                : String.format("Found %d duplicate rows (%s%%)", duplicateCount,
                        Stats.format(Stats.percentage(duplicateCount, totalRows)));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("columns_checked", columns);
        details.put("keep_strategy", keep);
        details.put("group_sizes", groupSizes);
        details.put("duplicate_groups", duplicateGroups);

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("total_rows", totalRows);
        statistics.put("unique_rows", totalRows - duplicateCount);
        statistics.put("duplicate_rows", duplicateCount);
        statistics.put("duplicate_percentage", Stats.percentage(duplicateCount, totalRows));

        return result(passed, message)
                .details(details)
                .statistics(statistics)
                .failedRowsOf(dataset, duplicateRows)
                .build();
    }
}
