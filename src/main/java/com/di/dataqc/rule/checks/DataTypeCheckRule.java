package com.di.dataqc.rule.checks;

import com.di.dataqc.dataset.CellValue;
import com.di.dataqc.dataset.Dataset;
import com.di.dataqc.dataset.TypeConverter;
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
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Checks that every value of a column conforms to a declared logical type.
 */
@Component
public class DataTypeCheckRule extends AbstractQcRule {

    private static final Pattern EMAIL = Pattern.compile("^[\\w.-]+@[\\w.-]+\\.\\w+$");
    private static final Set<String> BOOLEAN_TEXT = Set.of("true", "false", "True", "False", "1", "0");
    private static final int SAMPLE_SIZE = 10;

    private static final Map<String, Predicate<CellValue>> VALIDATORS = new LinkedHashMap<>();

    static {
        VALIDATORS.put("integer", cell -> TypeConverter.toNumber(cell).isIntegral());
        VALIDATORS.put("float", cell -> !TypeConverter.toNumber(cell).isNull());
        VALIDATORS.put("numeric", cell -> !TypeConverter.toNumber(cell).isNull());
        VALIDATORS.put("string", CellValue::isText);
        VALIDATORS.put("date", cell -> TypeConverter.toDateTime(cell).isPresent());
        VALIDATORS.put("datetime", cell -> TypeConverter.toDateTime(cell).isPresent());
        VALIDATORS.put("boolean", DataTypeCheckRule::isBooleanLike);
        VALIDATORS.put("email", cell -> cell.isText() && EMAIL.matcher(cell.asText()).find());
    }

    public DataTypeCheckRule() {
        super(RuleKind.DATATYPE_CHECK, "Data Type Check", "Validates that column values match expected data type");
    }

    @Override
    protected ConfigSchema buildSchema() {
        return ConfigSchema.builder()
                .required("column", ConfigProperty.string("Column to check"))
                .required("expected_type", ConfigProperty.builder().type("string")
                        .allowedValues(List.copyOf(VALIDATORS.keySet())).description("Expected data type").build())
                .property("allow_nulls", ConfigProperty.flag("Whether null values are allowed", true))
                .build();
    }

    @Override
    protected RuleResult evaluate(Dataset dataset, RuleConfig config) {
        String column = config.requireString("column");
        String expectedType = config.requireString("expected_type").trim().toLowerCase(Locale.ROOT);
        boolean allowNulls = config.getBoolean("allow_nulls", true);
        requireColumns(dataset, List.of(column));
        Predicate<CellValue> validator = VALIDATORS.get(expectedType);

        List<CellValue> values = dataset.values(column);
        List<Integer> invalid = new ArrayList<>();
        List<Object> samples = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            CellValue cell = values.get(i);
            boolean valid = cell.isNull() ? allowNulls : validator.test(cell);
            if (!valid) {
                invalid.add(i);
                if (samples.size() < SAMPLE_SIZE) {
                    samples.add(cell.toPlain());
                }
            }
        }

        int totalRows = dataset.rowCount();
        boolean passed = invalid.isEmpty();
        String message = passed
                ? String.format("All values in '%s' match type '%s'", column, expectedType)
                : String.format("%d values in '%s' do not match type '%s'", invalid.size(), column, expectedType);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("column", column);
        details.put("expected_type", expectedType);
        details.put("allow_nulls", allowNulls);
        details.put("current_dtype", dataset.columnType(column).label());
        details.put("sample_invalid_values", samples);

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("total_rows", totalRows);
        statistics.put("valid_count", totalRows - invalid.size());
        statistics.put("invalid_count", invalid.size());
        statistics.put("invalid_percentage", Stats.percentage(invalid.size(), totalRows));

        return result(passed, message)
                .details(details)
                .statistics(statistics)
                .failedRowsOf(dataset, invalid)
                .build();
    }

    private static boolean isBooleanLike(CellValue cell) {
        switch (cell.kind()) {
            case BOOLEAN:
                return true;
            case NUMBER:
                double v = cell.asDouble();
                return v == 0.0 || v == 1.0;
            case TEXT:
                return BOOLEAN_TEXT.contains(cell.asText());
            default:
                return false;
        }
    }
}
