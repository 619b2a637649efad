package com.ozmeta.compiler.metric;

import java.math.BigDecimal;
import java.util.List;

import lombok.Value;

/**
 * Node of a metric DSL tree. Implementations are immutable.
 */
public interface MetricExpression {

    enum AggregateFunction {
        SUM,
        COUNT,
        AVG,
        MIN,
        MAX,
        DISTINCT_COUNT
    }

    enum ArithmeticOperator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*");

        private final String symbol;

        ArithmeticOperator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    enum ComparisonOperator {
        EQ("="),
        NE("<>"),
        GT(">"),
        GE(">="),
        LT("<"),
        LE("<=");

        private final String symbol;

        ComparisonOperator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    /**
     * {@code Table.Field} reference. The physical part is filled in by
     * {@link MetricResolver}.
     */
    @Value
    class FieldRef implements MetricExpression {
        String table;
        String field;
        String physicalSchema;
        String physicalTable;
        String physicalColumn;

        public static FieldRef unresolved(String table, String field) {
            return new FieldRef(table, field, null, null, null);
        }

        public boolean isResolved() {
            return physicalColumn != null;
        }
    }

    @Value
    class MetricRef implements MetricExpression {
        String code;
    }

    @Value
    class NumberLiteral implements MetricExpression {
        BigDecimal value;
    }

    @Value
    class StringLiteral implements MetricExpression {
        String value;
    }

    @Value
    class Aggregate implements MetricExpression {
        AggregateFunction function;
        MetricExpression argument;
    }

    @Value
    class Arithmetic implements MetricExpression {
        ArithmeticOperator operator;
        MetricExpression left;
        MetricExpression right;
    }

    /**
     * Division that yields null instead of failing on a zero denominator.
     */
    @Value
    class SafeDivide implements MetricExpression {
        MetricExpression numerator;
        MetricExpression denominator;
    }

    @Value
    class Comparison implements MetricExpression {
        ComparisonOperator operator;
        MetricExpression left;
        MetricExpression right;
    }

    @Value
    class Conditional implements MetricExpression {
        MetricExpression condition;
        MetricExpression whenTrue;
        MetricExpression whenFalse;
    }

    @Value
    class Coalesce implements MetricExpression {
        List<MetricExpression> arguments;
    }
}
