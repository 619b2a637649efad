package com.ozmeta.compiler.metric;

import java.util.stream.Collectors;

import com.ozmeta.compiler.emit.sql.SqlDialect;
import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.metric.MetricExpression.Aggregate;
import com.ozmeta.compiler.metric.MetricExpression.Arithmetic;
import com.ozmeta.compiler.metric.MetricExpression.Coalesce;
import com.ozmeta.compiler.metric.MetricExpression.Comparison;
import com.ozmeta.compiler.metric.MetricExpression.Conditional;
import com.ozmeta.compiler.metric.MetricExpression.FieldRef;
import com.ozmeta.compiler.metric.MetricExpression.MetricRef;
import com.ozmeta.compiler.metric.MetricExpression.NumberLiteral;
import com.ozmeta.compiler.metric.MetricExpression.SafeDivide;
import com.ozmeta.compiler.metric.MetricExpression.StringLiteral;

/**
 * Renders a resolved metric tree as a SQL expression in one dialect.
 */
public class MetricExpressionCompiler {

    private final SqlDialect dialect;

    public MetricExpressionCompiler(SqlDialect dialect) {
        this.dialect = dialect;
    }

    public String compile(MetricExpression node) {
        if (node instanceof FieldRef ref) {
            if (!ref.isResolved()) {
                throw new CompilationException("Unresolved field reference " + ref.getTable() + "." + ref.getField());
            }
            return dialect.qualify(ref.getPhysicalTable(), ref.getPhysicalColumn());
        } else if (node instanceof MetricRef ref) {
            throw new CompilationException("Metric reference '" + ref.getCode() + "' was not inlined");
        } else if (node instanceof NumberLiteral literal) {
            return literal.getValue().toPlainString();
        } else if (node instanceof StringLiteral literal) {
            return dialect.stringLiteral(literal.getValue());
        } else if (node instanceof Aggregate agg) {
            String arg = compile(agg.getArgument());
            switch (agg.getFunction()) {
                case DISTINCT_COUNT:
                    return "COUNT(DISTINCT " + arg + ")";
                default:
                    return agg.getFunction().name() + "(" + arg + ")";
            }
        } else if (node instanceof Arithmetic arith) {
            return "(" + compile(arith.getLeft()) + " " + arith.getOperator().getSymbol() + " "
                    + compile(arith.getRight()) + ")";
        } else if (node instanceof SafeDivide div) {
            return dialect.safeDivide(compile(div.getNumerator()), compile(div.getDenominator()));
        } else if (node instanceof Comparison cmp) {
            return compile(cmp.getLeft()) + " " + cmp.getOperator().getSymbol() + " " + compile(cmp.getRight());
        } else if (node instanceof Conditional cond) {
            return "CASE WHEN " + compile(cond.getCondition()) + " THEN " + compile(cond.getWhenTrue())
                    + " ELSE " + compile(cond.getWhenFalse()) + " END";
        } else if (node instanceof Coalesce coalesce) {
            return coalesce.getArguments().stream()
                    .map(this::compile)
                    .collect(Collectors.joining(", ", "COALESCE(", ")"));
        }
        throw new CompilationException("Unsupported metric node " + node.getClass().getSimpleName());
    }
}
