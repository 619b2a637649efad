package com.ozmeta.compiler.metric;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.fasterxml.jackson.databind.JsonNode;
import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.metric.MetricExpression.Aggregate;
import com.ozmeta.compiler.metric.MetricExpression.AggregateFunction;
import com.ozmeta.compiler.metric.MetricExpression.Arithmetic;
import com.ozmeta.compiler.metric.MetricExpression.ArithmeticOperator;
import com.ozmeta.compiler.metric.MetricExpression.Coalesce;
import com.ozmeta.compiler.metric.MetricExpression.Comparison;
import com.ozmeta.compiler.metric.MetricExpression.ComparisonOperator;
import com.ozmeta.compiler.metric.MetricExpression.Conditional;
import com.ozmeta.compiler.metric.MetricExpression.FieldRef;
import com.ozmeta.compiler.metric.MetricExpression.MetricRef;
import com.ozmeta.compiler.metric.MetricExpression.NumberLiteral;
import com.ozmeta.compiler.metric.MetricExpression.SafeDivide;
import com.ozmeta.compiler.metric.MetricExpression.StringLiteral;

/**
 * Reads the JSON form of the metric DSL.
 *
 * <pre>
 * {"agg": "SUM", "of": {"field": "Transaction.Amount"}}
 * {"op": "-", "left": ..., "right": ...}
 * {"divide": {"numerator": ..., "denominator": ...}}
 * {"compare": "&gt;", "left": ..., "right": ...}
 * {"if": ..., "then": ..., "else": ...}
 * {"coalesce": [...]}
 * {"metric": "NetRevenue"}
 * {"literal": 100}
 * </pre>
 */
public class MetricFormulaParser {

    public MetricExpression parse(String metricCode, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new CompilationException("Metric '" + metricCode + "' has no expression");
        }
        return parseNode(metricCode, node);
    }

    private MetricExpression parseNode(String metricCode, JsonNode node) {
        if (node.isNumber()) {
            return new NumberLiteral(node.decimalValue());
        }
        if (!node.isObject()) {
            throw error(metricCode, "expected an expression object but found " + node);
        }
        if (node.has("field")) {
            String ref = node.get("field").asText();
            int dot = ref.indexOf('.');
            if (dot <= 0 || dot == ref.length() - 1) {
                throw error(metricCode, "field reference '" + ref + "' must be Table.Field");
            }
            return FieldRef.unresolved(ref.substring(0, dot), ref.substring(dot + 1));
        }
        if (node.has("metric")) {
            return new MetricRef(node.get("metric").asText());
        }
        if (node.has("literal")) {
            JsonNode literal = node.get("literal");
            return literal.isNumber() ? new NumberLiteral(literal.decimalValue()) : new StringLiteral(literal.asText());
        }
        if (node.has("agg")) {
            return new Aggregate(aggregateFunction(metricCode, node.get("agg").asText()),
                    parseNode(metricCode, required(metricCode, node, "of")));
        }
        if (node.has("op")) {
            return new Arithmetic(arithmeticOperator(metricCode, node.get("op").asText()),
                    parseNode(metricCode, required(metricCode, node, "left")),
                    parseNode(metricCode, required(metricCode, node, "right")));
        }
        if (node.has("divide")) {
            JsonNode divide = node.get("divide");
            return new SafeDivide(parseNode(metricCode, required(metricCode, divide, "numerator")),
                    parseNode(metricCode, required(metricCode, divide, "denominator")));
        }
        if (node.has("compare")) {
            return new Comparison(comparisonOperator(metricCode, node.get("compare").asText()),
                    parseNode(metricCode, required(metricCode, node, "left")),
                    parseNode(metricCode, required(metricCode, node, "right")));
        }
        if (node.has("if")) {
            return new Conditional(parseNode(metricCode, node.get("if")),
                    parseNode(metricCode, required(metricCode, node, "then")),
                    parseNode(metricCode, required(metricCode, node, "else")));
        }
        if (node.has("coalesce")) {
            List<MetricExpression> args = new ArrayList<>();
            for (JsonNode arg : node.get("coalesce")) {
                args.add(parseNode(metricCode, arg));
            }
            if (args.size() < 2) {
                throw error(metricCode, "coalesce needs at least two arguments");
            }
            return new Coalesce(List.copyOf(args));
        }
        throw error(metricCode, "unrecognized expression " + node);
    }

    private JsonNode required(String metricCode, JsonNode node, String name) {
        JsonNode child = node.get(name);
        if (child == null || child.isNull()) {
            throw error(metricCode, "missing '" + name + "' in " + node);
        }
        return child;
    }

    private AggregateFunction aggregateFunction(String metricCode, String text) {
        String normalized = text.trim().toUpperCase(Locale.ROOT);
        if ("DISTINCTCOUNT".equals(normalized)) {
            return AggregateFunction.DISTINCT_COUNT;
        }
        try {
            return AggregateFunction.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw error(metricCode, "unknown aggregate '" + text + "'");
        }
    }

    private ArithmeticOperator arithmeticOperator(String metricCode, String symbol) {
        for (ArithmeticOperator op : ArithmeticOperator.values()) {
            if (op.getSymbol().equals(symbol)) {
                return op;
            }
        }
        if ("/".equals(symbol)) {
            throw error(metricCode, "use 'divide' for division");
        }
        throw error(metricCode, "unknown operator '" + symbol + "'");
    }

    private ComparisonOperator comparisonOperator(String metricCode, String symbol) {
        String normalized = "!=".equals(symbol) ? "<>" : symbol;
        for (ComparisonOperator op : ComparisonOperator.values()) {
            if (op.getSymbol().equals(normalized)) {
                return op;
            }
        }
        throw error(metricCode, "unknown comparison '" + symbol + "'");
    }

    private CompilationException error(String metricCode, String detail) {
        return new CompilationException("Metric '" + metricCode + "': " + detail);
    }
}
