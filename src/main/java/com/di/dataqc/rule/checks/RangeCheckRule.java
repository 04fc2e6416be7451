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
import java.util.Map;

/**
 * Numeric bounds on one column. Values that do not coerce to a number are skipped, not counted as violations.
 */
@Component
public class RangeCheckRule extends AbstractQcRule {

    public RangeCheckRule() {
        super(RuleKind.RANGE_CHECK, "Range Check", "Validates that numeric values fall within specified range");
    }

    @Override
    protected ConfigSchema buildSchema() {
        return ConfigSchema.builder()
                .required("column", ConfigProperty.string("Column to check"))
                .property("min_value", ConfigProperty.number("Minimum allowed value"))
                .property("max_value", ConfigProperty.number("Maximum allowed value"))
                .property("inclusive", ConfigProperty.flag("Whether bounds are inclusive", true))
                .build();
    }

    @Override
    protected RuleResult evaluate(Dataset dataset, RuleConfig config) {
        String column = config.requireString("column");
        Double min = config.getDouble("min_value");
        Double max = config.getDouble("max_value");
        boolean inclusive = config.getBoolean("inclusive", true);
        requireColumns(dataset, List.of(column));

        List<CellValue> values = dataset.values(column);
        List<Integer> violations = new ArrayList<>();
        List<Double> numeric = new ArrayList<>();
        long belowMin = 0;
        long aboveMax = 0;
        long nonNumeric = 0;
        for (int i = 0; i < values.size(); i++) {
            CellValue number = TypeConverter.toNumber(values.get(i));
            if (number.isNull()) {
                if (!values.get(i).isNull()) {
                    nonNumeric++;
                }
                continue;
            }
            double v = number.asDouble();
            numeric.add(v);
            boolean low = min != null && (inclusive ? v < min : v <= min);
            boolean high = max != null && (inclusive ? v > max : v >= max);
            if (low) {
                belowMin++;
            }
            if (high) {
                aboveMax++;
            }
            if (low || high) {
                violations.add(i);
            }
        }

        double[] valid = numeric.stream().mapToDouble(Double::doubleValue).toArray();
        Map<String, Object> actualRange = new LinkedHashMap<>();
        actualRange.put("min", Stats.min(valid));
        actualRange.put("max", Stats.max(valid));
        actualRange.put("mean", Stats.mean(valid));
        actualRange.put("median", Stats.median(valid));

        List<String> bounds = new ArrayList<>();
        if (min != null) {
            bounds.add("min=" + Stats.format(min));
        }
        if (max != null) {
            bounds.add("max=" + Stats.format(max));
        }
        String boundsText = String.join(", ", bounds);
        boolean passed = violations.isEmpty();
        String message = passed
                ? String.format("All values in '%s' are within range (%s)", column, boundsText)
                : String.format("%d values in '%s' are out of range (%s)", violations.size(), column, boundsText);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("column", column);
        details.put("min_value", min);
        details.put("max_value", max);
        details.put("inclusive", inclusive);
        details.put("actual_range", actualRange);
        details.put("below_min", belowMin);
        details.put("above_max", aboveMax);

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("total_rows", dataset.rowCount());
        statistics.put("violation_count", violations.size());
        statistics.put("violation_percentage", Stats.percentage(violations.size(), dataset.rowCount()));
        statistics.put("non_numeric_count", nonNumeric);
        statistics.putAll(actualRange);

        return result(passed, message)
                .details(details)
                .statistics(statistics)
                .failedRowsOf(dataset, violations)
                .build();
    }
}
