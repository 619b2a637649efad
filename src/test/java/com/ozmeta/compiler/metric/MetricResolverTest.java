package com.ozmeta.compiler.metric;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.ozmeta.compiler.emit.sql.SqlDialect;
import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.metric.MetricExpression.Aggregate;
import com.ozmeta.compiler.metric.MetricExpression.AggregateFunction;
import com.ozmeta.compiler.metric.MetricExpression.Arithmetic;
import com.ozmeta.compiler.metric.MetricExpression.ArithmeticOperator;
import com.ozmeta.compiler.metric.MetricExpression.FieldRef;
import com.ozmeta.compiler.metric.MetricExpression.MetricRef;
import com.ozmeta.compiler.metric.MetricExpression.NumberLiteral;
import com.ozmeta.compiler.metric.MetricExpression.SafeDivide;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for metric resolution and SQL rendering.
 */
class MetricResolverTest {

    private static final MetricResolver.ColumnLookup LOOKUP = (table, field) -> {
        if ("Transaction".equals(table) && "TR_Amount".equalsIgnoreCase(field)) {
            return Optional.of(new FieldRef(table, field, "dp", "transaction", "tr_amount"));
        }
        if ("Transaction".equals(table) && "TR_ID".equalsIgnoreCase(field)) {
            return Optional.of(new FieldRef(table, field, "dp", "transaction", "tr_id"));
        }
        return Optional.empty();
    };

    private static final MetricExpression REVENUE =
            new Aggregate(AggregateFunction.SUM, FieldRef.unresolved("Transaction", "TR_Amount"));
    private static final MetricExpression ORDERS =
            new Aggregate(AggregateFunction.DISTINCT_COUNT, FieldRef.unresolved("Transaction", "TR_ID"));
    private static final MetricExpression AVERAGE =
            new SafeDivide(new MetricRef("REVENUE"), new MetricRef("ORDERS"));

    @Test
    void testInlinesReferencedMetrics() {
        MetricResolver resolver = new MetricResolver(
                Map.of("REVENUE", REVENUE, "ORDERS", ORDERS, "AVERAGE", AVERAGE), LOOKUP);

        MetricExpression resolved = resolver.resolve("AVERAGE");

        assertThat(new MetricExpressionCompiler(SqlDialect.POSTGRES).compile(resolved))
                .isEqualTo("(SUM(\"transaction\".\"tr_amount\")) / NULLIF(COUNT(DISTINCT \"transaction\".\"tr_id\"), 0)");
        assertThat(new MetricExpressionCompiler(SqlDialect.BIGQUERY).compile(resolved))
                .isEqualTo("SAFE_DIVIDE(SUM(`transaction`.`tr_amount`), COUNT(DISTINCT `transaction`.`tr_id`))");
        assertThat(new MetricExpressionCompiler(SqlDialect.SPARK).compile(resolved))
                .isEqualTo("try_divide(SUM(`transaction`.`tr_amount`), COUNT(DISTINCT `transaction`.`tr_id`))");
    }

    @Test
    void testArithmeticIsParenthesized() {
        MetricExpression net = new Arithmetic(ArithmeticOperator.SUBTRACT, new MetricRef("REVENUE"),
                new NumberLiteral(new BigDecimal("10.50")));
        MetricResolver resolver = new MetricResolver(Map.of("REVENUE", REVENUE, "NET", net), LOOKUP);

        assertThat(new MetricExpressionCompiler(SqlDialect.SNOWFLAKE).compile(resolver.resolve("NET")))
                .isEqualTo("(SUM(\"transaction\".\"tr_amount\") - 10.50)");
    }

    @Test
    void testReferenceCycleIsRejected() {
        MetricResolver resolver = new MetricResolver(
                Map.of("A", new MetricRef("B"), "B", new MetricRef("A")), LOOKUP);

        assertThatThrownBy(() -> resolver.resolve("A"))
                .isInstanceOf(CompilationException.class)
                .hasMessage("Metric reference cycle: A -> B -> A");
    }

    @Test
    void testUnknownFieldIsRejected() {
        MetricResolver resolver = new MetricResolver(
                Map.of("BAD", new Aggregate(AggregateFunction.SUM, FieldRef.unresolved("Transaction", "Missing"))),
                LOOKUP);

        assertThatThrownBy(() -> resolver.resolve("BAD"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("unknown field Transaction.Missing");
    }

    @Test
    void testUnknownMetricReference() {
        MetricResolver resolver = new MetricResolver(Map.of("X", new MetricRef("Y")), LOOKUP);

        assertThatThrownBy(() -> resolver.resolve("X"))
                .isInstanceOf(CompilationException.class)
                .hasMessage("Unknown metric 'Y' (referenced from 'X')");
    }
}
