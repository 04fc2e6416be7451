package com.di.dataqc.reconcile;

import com.di.dataqc.aspect.LogOperation;
import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.exception.ColumnNotFoundException;
import com.di.dataqc.exception.RuleConfigurationException;
import com.di.dataqc.reconcile.ValueComparator.ValueComparison;
import com.di.dataqc.util.QcMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Key-matches rows across two or more sources and classifies them as duplicated (present in several
 * sources), unique to one source, or matched with value differences; optionally compares grouped aggregates.
 * <p>
 * One {@link KeyIndex} pass drives every analysis. Input datasets are never modified: rows are tagged with
 * {@code _source} on copies.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationEngine {

    public static final String SOURCE_COLUMN = "_source";

    static final int MAX_DUPLICATE_KEYS = 100;
    static final int MAX_UNIQUE_ROWS = 100;
    static final int MAX_DIFFERENCE_ROWS = 100;

    private final QcMetrics metrics;

    @LogOperation(eventType = "RECONCILE")
    public ReconciliationResult reconcile(ReconciliationRequest request) {
        validate(request);
        return metrics.timeOperation("reconcile", () -> {
            ReconciliationResult result = doReconcile(request);
            metrics.recordReconciliation();
            return result;
        });
    }

    private ReconciliationResult doReconcile(ReconciliationRequest request) {
        List<NamedDataset> sources = tagged(request.getSources());
        List<String> names = sources.stream().map(NamedDataset::name).collect(Collectors.toList());
        log.info("[RECONCILE] Reconciling {} sources {} on keys {}", sources.size(), names, request.getKeyColumns());

        KeyNormalizer normalizer = new KeyNormalizer(request.getKeyColumns(), request.getOptions());
        KeyIndex index = KeyIndex.build(sources, normalizer);
        Map<String, Dataset> byName = new LinkedHashMap<>();
        sources.forEach(s -> byName.put(s.name(), s.dataset()));

        ReconciliationResult.ReconciliationResultBuilder result = ReconciliationResult.builder()
                .sources(names)
                .baselineSource(names.get(0))
                .keyColumns(request.getKeyColumns())
                .totalKeys(index.size());

        if (request.getAnalysis().isDuplicates()) {
            result.duplicates(duplicates(index, byName));
        }
        if (request.getAnalysis().isUnique()) {
            result.unique(unique(index, byName));
        }
        if (request.getAnalysis().isNotMatched()) {
            result.notMatched(differences(index, byName, request));
        }
        if (request.getAggregation() != null) {
            result.aggregation(AggregationComparator.compare(request.getSources(), request.getAggregation()));
        }
        ReconciliationResult built = result.build();
        log.info("[RECONCILE] Completed: {} keys, duplicates={}, differences={}", index.size(),
                built.getDuplicates() == null ? "-" : built.getDuplicates().getCount(),
                built.getNotMatched() == null ? "-" : built.getNotMatched().getCount());
        return built;
    }

    // ------------------------------------------------------------------------
    // Analyses
    // ------------------------------------------------------------------------

    private static ReconciliationResult.DuplicateSection duplicates(KeyIndex index, Map<String, Dataset> byName) {
        long keyCount = 0;
        long rowCount = 0;
        List<Map<String, Object>> rows = new ArrayList<>();
        for (RowKey key : index.keys()) {
            Map<String, List<Integer>> bySource = index.rowsFor(key);
            if (bySource.size() < 2) {
                continue;
            }
            keyCount++;
            for (Map.Entry<String, List<Integer>> entry : bySource.entrySet()) {
                rowCount += entry.getValue().size();
                if (keyCount <= MAX_DUPLICATE_KEYS) {
                    Dataset dataset = byName.get(entry.getKey());
                    entry.getValue().forEach(row -> rows.add(dataset.record(row)));
                }
            }
        }
        return ReconciliationResult.DuplicateSection.builder()
                .count(keyCount)
                .rowCount(rowCount)
                .rows(rows)
                .build();
    }

    private static Map<String, ReconciliationResult.UniqueSection> unique(KeyIndex index, Map<String, Dataset> byName) {
        Map<String, long[]> counts = new LinkedHashMap<>();
        Map<String, List<Map<String, Object>>> rows = new LinkedHashMap<>();
        byName.keySet().forEach(name -> {
            counts.put(name, new long[2]);
            rows.put(name, new ArrayList<>());
        });
        for (RowKey key : index.keys()) {
            Map<String, List<Integer>> bySource = index.rowsFor(key);
            if (bySource.size() != 1) {
                continue;
            }
            Map.Entry<String, List<Integer>> only = bySource.entrySet().iterator().next();
            long[] count = counts.get(only.getKey());
            count[0] += only.getValue().size();
            count[1]++;
            List<Map<String, Object>> sourceRows = rows.get(only.getKey());
            Dataset dataset = byName.get(only.getKey());
            for (int row : only.getValue()) {
                if (sourceRows.size() < MAX_UNIQUE_ROWS) {
                    sourceRows.add(dataset.record(row));
                }
            }
        }
        Map<String, ReconciliationResult.UniqueSection> sections = new LinkedHashMap<>();
        counts.forEach((name, count) -> sections.put(name, ReconciliationResult.UniqueSection.builder()
                .count(count[0])
                .keyCount(count[1])
                .rows(rows.get(name))
                .build()));
        return sections;
    }

    /**
     * For every key in two or more sources, compares the first row of the first source holding the key with
     * the first row of each other source.
     */
    private static ReconciliationResult.DifferenceSection differences(KeyIndex index, Map<String, Dataset> byName,
                                                                      ReconciliationRequest request) {
        ValueComparator comparator = new ValueComparator(request.getTolerance(), request.getOptions());
        Set<String> keyColumns = new HashSet<>(request.getKeyColumns());
        Map<String, Long> perColumn = new LinkedHashMap<>();
        List<Map<String, Object>> rows = new ArrayList<>();
        long count = 0;
        long keysWithDifferences = 0;

        for (RowKey key : index.keys()) {
            Map<String, List<Integer>> bySource = index.rowsFor(key);
            if (bySource.size() < 2) {
                continue;
            }
            List<Map.Entry<String, List<Integer>>> entries = new ArrayList<>(bySource.entrySet());
            String baseName = entries.get(0).getKey();
            Dataset base = byName.get(baseName);
            int baseRow = entries.get(0).getValue().get(0);
            boolean keyDiffers = false;

            for (Map.Entry<String, List<Integer>> other : entries.subList(1, entries.size())) {
                Dataset compared = byName.get(other.getKey());
                int comparedRow = other.getValue().get(0);
                for (String column : comparedColumns(base, compared, keyColumns, request.getValueColumns())) {
                    CellValue left = base.cell(baseRow, column);
                    CellValue right = compared.cell(comparedRow, column);
                    ValueComparison comparison = comparator.compare(left, right);
                    if (comparison.isMatch()) {
                        continue;
                    }
                    count++;
                    keyDiffers = true;
                    perColumn.merge(column, 1L, Long::sum);
                    if (rows.size() < MAX_DIFFERENCE_ROWS) {
                        rows.add(differenceRow(request.getKeyColumns(), base, baseRow, key, column,
                                baseName, left, other.getKey(), right, comparison));
                    }
                }
            }
            if (keyDiffers) {
                keysWithDifferences++;
            }
        }
        return ReconciliationResult.DifferenceSection.builder()
                .count(count)
                .keysWithDifferences(keysWithDifferences)
                .columnDifferences(perColumn)
                .rows(rows)
                .build();
    }

    private static List<String> comparedColumns(Dataset base, Dataset compared, Set<String> keyColumns,
                                                List<String> valueColumns) {
        List<String> candidates = valueColumns.isEmpty() ? base.columnNames() : valueColumns;
        return candidates.stream()
                .filter(c -> !keyColumns.contains(c) && !c.startsWith("_"))
                .filter(c -> base.hasColumn(c) && compared.hasColumn(c))
                .collect(Collectors.toList());
    }

    private static Map<String, Object> differenceRow(List<String> keyColumns, Dataset base, int baseRow, RowKey key,
                                                     String column, String baseName, CellValue baseValue,
                                                     String comparedName, CellValue comparedValue,
                                                     ValueComparison comparison) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("key", key.display());
        for (String keyColumn : keyColumns) {
            row.put(keyColumn, base.cell(baseRow, keyColumn).toPlain());
        }
        row.put("column", column);
        row.put("baseline_source", baseName);
        row.put("baseline_value", baseValue.toPlain());
        row.put("compare_source", comparedName);
        row.put("compare_value", comparedValue.toPlain());
        row.put("status", comparison.status().name());
        row.put("detail", comparison.detail());
        return row;
    }

    // ------------------------------------------------------------------------
    // Validation and tagging
    // ------------------------------------------------------------------------

    private static void validate(ReconciliationRequest request) {
        List<NamedDataset> sources = request.getSources();
        if (sources == null || sources.size() < 2) {
            throw new RuleConfigurationException("At least 2 sources are required for reconciliation");
        }
        if (request.getKeyColumns() == null || request.getKeyColumns().isEmpty()) {
            throw new RuleConfigurationException("At least one key column is required for reconciliation");
        }
        Set<String> names = new HashSet<>();
        for (NamedDataset source : sources) {
            if (!names.add(source.name())) {
                throw new RuleConfigurationException("Duplicate source name: " + source.name());
            }
        }
        Set<String> required = new LinkedHashSet<>(request.getKeyColumns());
        required.addAll(request.getValueColumns());
        Set<String> missing = new LinkedHashSet<>();
        for (NamedDataset source : sources) {
            missing.addAll(source.dataset().missingColumns(required));
        }
        if (!missing.isEmpty()) {
            throw new ColumnNotFoundException(new ArrayList<>(missing));
        }
    }

    private static List<NamedDataset> tagged(List<NamedDataset> sources) {
        return sources.stream()
                .map(s -> new NamedDataset(s.name(), s.dataset().withColumn(SOURCE_COLUMN, CellValue.text(s.name()))))
                .collect(Collectors.toList());
    }
}
