package com.di.dataqc.formula;

import com.di.dataqc.exception.RuleConfigurationException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Binary operations between two numeric columns. A result of {@code null} means undefined (division by zero).
 */
public enum FormulaOperation {
    ADD("+") {
        @Override
        public BigDecimal apply(BigDecimal left, BigDecimal right) {
            return left.add(right);
        }
    },
    SUBTRACT("-") {
        @Override
        public BigDecimal apply(BigDecimal left, BigDecimal right) {
            return left.subtract(right);
        }
    },
    MULTIPLY("*") {
        @Override
        public BigDecimal apply(BigDecimal left, BigDecimal right) {
            return left.multiply(right);
        }
    },
    DIVIDE("/") {
        @Override
        public BigDecimal apply(BigDecimal left, BigDecimal right) {
            return right.signum() == 0 ? null : left.divide(right, MathContext.DECIMAL64);
        }
    },
    /** Percent change of the left value relative to the right one. */
    PERCENT_CHANGE("%") {
        @Override
        public BigDecimal apply(BigDecimal left, BigDecimal right) {
            return right.signum() == 0 ? null
                    : left.subtract(right).multiply(BigDecimal.valueOf(100)).divide(right, MathContext.DECIMAL64);
        }
    };

    private final String symbol;

    FormulaOperation(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public abstract BigDecimal apply(BigDecimal left, BigDecimal right);

    public static FormulaOperation fromSymbol(String symbol) {
        String normalized = symbol == null ? "" : symbol.trim();
        for (FormulaOperation op : values()) {
            if (op.symbol.equals(normalized)) {
                return op;
            }
        }
        throw new RuleConfigurationException(String.format("Unknown operation: %s. Supported: %s", symbol,
                Arrays.stream(values()).map(FormulaOperation::symbol).collect(Collectors.toList())));
    }
}
