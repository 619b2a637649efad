package com.ozmeta.compiler.metric;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.metric.MetricExpression.Aggregate;
import com.ozmeta.compiler.metric.MetricExpression.Arithmetic;
import com.ozmeta.compiler.metric.MetricExpression.Coalesce;
import com.ozmeta.compiler.metric.MetricExpression.Comparison;
import com.ozmeta.compiler.metric.MetricExpression.Conditional;
import com.ozmeta.compiler.metric.MetricExpression.FieldRef;
import com.ozmeta.compiler.metric.MetricExpression.MetricRef;
import com.ozmeta.compiler.metric.MetricExpression.SafeDivide;

/**
 * Binds field references to physical columns and inlines references to other
 * metrics. Reference cycles are compilation errors.
 */
public class MetricResolver {

    /**
     * Finds the physical column for a canonical {@code Table.Field} pair.
     */
    @FunctionalInterface
    public interface ColumnLookup {
        Optional<FieldRef> find(String table, String field);
    }

    private final Map<String, MetricExpression> parsedByCode;
    private final ColumnLookup lookup;

    /**
     * @param parsedByCode unresolved expressions of every metric visible to the target
     */
    public MetricResolver(Map<String, MetricExpression> parsedByCode, ColumnLookup lookup) {
        this.parsedByCode = parsedByCode;
        this.lookup = lookup;
    }

    public MetricExpression resolve(String metricCode) {
        return resolveMetric(metricCode, new ArrayDeque<>());
    }

    private MetricExpression resolveMetric(String metricCode, Deque<String> path) {
        if (path.contains(metricCode)) {
            List<String> cycle = new ArrayList<>(path);
            Collections.reverse(cycle);
            cycle.add(metricCode);
            throw new CompilationException("Metric reference cycle: " + String.join(" -> ", cycle));
        }
        MetricExpression expression = parsedByCode.get(metricCode);
        if (expression == null) {
            String from = path.isEmpty() ? "" : " (referenced from '" + path.peek() + "')";
            throw new CompilationException("Unknown metric '" + metricCode + "'" + from);
        }
        path.push(metricCode);
        try {
            return rewrite(metricCode, expression, path);
        } finally {
            path.pop();
        }
    }

    private MetricExpression rewrite(String metricCode, MetricExpression node, Deque<String> path) {
        if (node instanceof FieldRef ref) {
            return lookup.find(ref.getTable(), ref.getField())
                    .orElseThrow(() -> new CompilationException("Metric '" + metricCode + "' references unknown field "
                            + ref.getTable() + "." + ref.getField()));
        } else if (node instanceof MetricRef ref) {
            return resolveMetric(ref.getCode(), path);
        } else if (node instanceof Aggregate agg) {
            return new Aggregate(agg.getFunction(), rewrite(metricCode, agg.getArgument(), path));
        } else if (node instanceof Arithmetic arith) {
            return new Arithmetic(arith.getOperator(), rewrite(metricCode, arith.getLeft(), path),
                    rewrite(metricCode, arith.getRight(), path));
        } else if (node instanceof SafeDivide div) {
            return new SafeDivide(rewrite(metricCode, div.getNumerator(), path),
                    rewrite(metricCode, div.getDenominator(), path));
        } else if (node instanceof Comparison cmp) {
            return new Comparison(cmp.getOperator(), rewrite(metricCode, cmp.getLeft(), path),
                    rewrite(metricCode, cmp.getRight(), path));
        } else if (node instanceof Conditional cond) {
            return new Conditional(rewrite(metricCode, cond.getCondition(), path),
                    rewrite(metricCode, cond.getWhenTrue(), path), rewrite(metricCode, cond.getWhenFalse(), path));
        } else if (node instanceof Coalesce coalesce) {
            List<MetricExpression> args = new ArrayList<>();
            for (MetricExpression arg : coalesce.getArguments()) {
                args.add(rewrite(metricCode, arg, path));
            }
            return new Coalesce(List.copyOf(args));
        }
        return node;
    }
}
