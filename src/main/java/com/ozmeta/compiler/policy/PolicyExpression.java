package com.ozmeta.compiler.policy;

import java.math.BigDecimal;
import java.util.List;

import lombok.Value;

/**
 * Node of a security guard tree. Implementations are immutable.
 */
public interface PolicyExpression {

    enum ContextKey {
        TENANT_ID,
        USER_ID,
        USER_ROLE,
        NOW
    }

    enum Operator {
        AND(1, Integer.MAX_VALUE),
        OR(1, Integer.MAX_VALUE),
        NOT(1, 1),
        EQ(2, 2),
        NE(2, 2),
        GT(2, 2),
        GTE(2, 2),
        LT(2, 2),
        LTE(2, 2),
        IN(2, Integer.MAX_VALUE),
        IS_NULL(1, 1),
        IS_NOT_NULL(1, 1),
        CONTAINS(2, 2),
        STARTS_WITH(2, 2),
        ENDS_WITH(2, 2),
        REGEX(2, 2),
        COALESCE(2, Integer.MAX_VALUE);

        private final int minArgs;
        private final int maxArgs;

        Operator(int minArgs, int maxArgs) {
            this.minArgs = minArgs;
            this.maxArgs = maxArgs;
        }

        public boolean accepts(int argCount) {
            return argCount >= minArgs && argCount <= maxArgs;
        }
    }

    @Value
    class BooleanLiteral implements PolicyExpression {
        public static final BooleanLiteral TRUE = new BooleanLiteral(true);
        public static final BooleanLiteral FALSE = new BooleanLiteral(false);

        boolean value;
    }

    @Value
    class NumberLiteral implements PolicyExpression {
        BigDecimal value;
    }

    @Value
    class StringLiteral implements PolicyExpression {
        String value;
    }

    @Value
    class NullLiteral implements PolicyExpression {
        public static final NullLiteral INSTANCE = new NullLiteral();
    }

    /**
     * Column of the secured table, by canonical field name. The physical part
     * is filled in by {@link PolicyBinder}.
     */
    @Value
    class ColumnRef implements PolicyExpression {
        String field;
        String physicalColumn;
        String physicalType;

        public static ColumnRef unresolved(String field) {
            return new ColumnRef(field, null, null);
        }

        public boolean isResolved() {
            return physicalColumn != null;
        }
    }

    /**
     * Value supplied by the session at query time.
     */
    @Value
    class ContextRef implements PolicyExpression {
        ContextKey key;
    }

    @Value
    class Operation implements PolicyExpression {
        Operator operator;
        List<PolicyExpression> arguments;
    }
}
