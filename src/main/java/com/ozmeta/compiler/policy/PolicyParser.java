package com.ozmeta.compiler.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.policy.PolicyExpression.BooleanLiteral;
import com.ozmeta.compiler.policy.PolicyExpression.ColumnRef;
import com.ozmeta.compiler.policy.PolicyExpression.ContextKey;
import com.ozmeta.compiler.policy.PolicyExpression.ContextRef;
import com.ozmeta.compiler.policy.PolicyExpression.NullLiteral;
import com.ozmeta.compiler.policy.PolicyExpression.NumberLiteral;
import com.ozmeta.compiler.policy.PolicyExpression.Operation;
import com.ozmeta.compiler.policy.PolicyExpression.Operator;
import com.ozmeta.compiler.policy.PolicyExpression.StringLiteral;
import com.ozmeta.compiler.snapshot.InternalFields;
import com.ozmeta.compiler.util.JsonSupport;

/**
 * Reads the guard DSL used by security policies.
 *
 * <pre>
 * "tenant"                                      rows of the session's tenant
 * "allow" / "deny"                              constant guards
 * {"kind": "Guard", "expr": ...}                document form
 * {"op": "and", "args": [...]}                  operation
 * {"ref": "TR_Region"}                          column of the secured table
 * {"ref": "context.tenantId"}                   session value (tenantId, userId, now)
 * {"ref": "user.role"}                          session role
 * {"lit": "EMEA"}                               literal
 * </pre>
 *
 * A document without {@code expr} allows every row.
 */
public class PolicyParser {

    private static final Map<String, Operator> OPERATORS = Map.ofEntries(
            Map.entry("and", Operator.AND),
            Map.entry("or", Operator.OR),
            Map.entry("not", Operator.NOT),
            Map.entry("eq", Operator.EQ),
            Map.entry("ne", Operator.NE),
            Map.entry("gt", Operator.GT),
            Map.entry("gte", Operator.GTE),
            Map.entry("lt", Operator.LT),
            Map.entry("lte", Operator.LTE),
            Map.entry("in", Operator.IN),
            Map.entry("isnull", Operator.IS_NULL),
            Map.entry("isnotnull", Operator.IS_NOT_NULL),
            Map.entry("contains", Operator.CONTAINS),
            Map.entry("startswith", Operator.STARTS_WITH),
            Map.entry("endswith", Operator.ENDS_WITH),
            Map.entry("regex", Operator.REGEX),
            Map.entry("coalesce", Operator.COALESCE));

    private static final Map<String, ContextKey> CONTEXT = Map.of(
            "context.tenantId", ContextKey.TENANT_ID,
            "context.userId", ContextKey.USER_ID,
            "context.now", ContextKey.NOW,
            "user.role", ContextKey.USER_ROLE);

    /**
     * @throws CompilationException when the document cannot be read as a guard
     */
    public PolicyExpression parse(String policyCode, JsonNode document) {
        if (document == null || document.isNull() || document.isMissingNode()) {
            throw error(policyCode, "no expression");
        }
        if (document.isBoolean()) {
            return document.booleanValue() ? BooleanLiteral.TRUE : BooleanLiteral.FALSE;
        }
        if (document.isTextual()) {
            PolicyExpression shorthand = shorthand(document.textValue());
            if (shorthand != null) {
                return shorthand;
            }
            return parse(policyCode, readJson(policyCode, document.textValue()));
        }
        if (!document.isObject()) {
            throw error(policyCode, "expected a guard document but found " + document);
        }
        if (document.has("op") || document.has("ref") || document.has("lit")) {
            return parseNode(policyCode, document);
        }
        String kind = document.path("kind").asText("Guard");
        if (!"Guard".equals(kind)) {
            throw error(policyCode, "unsupported document kind '" + kind + "'");
        }
        JsonNode expr = document.get("expr");
        return expr == null || expr.isNull() ? BooleanLiteral.TRUE : parseNode(policyCode, expr);
    }

    private PolicyExpression parseNode(String policyCode, JsonNode node) {
        if (node.isNull()) {
            return NullLiteral.INSTANCE;
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? BooleanLiteral.TRUE : BooleanLiteral.FALSE;
        }
        if (node.isNumber()) {
            return new NumberLiteral(node.decimalValue());
        }
        if (node.isTextual()) {
            PolicyExpression shorthand = shorthand(node.textValue());
            return shorthand != null ? shorthand : new StringLiteral(node.textValue());
        }
        if (!node.isObject()) {
            throw error(policyCode, "unrecognized expression " + node);
        }
        if (node.has("lit")) {
            JsonNode literal = node.get("lit");
            if (literal.isContainerNode()) {
                throw error(policyCode, "literal must be a scalar: " + literal);
            }
            return literal.isTextual() ? new StringLiteral(literal.textValue()) : parseNode(policyCode, literal);
        }
        if (node.has("ref")) {
            return reference(policyCode, node.get("ref").asText());
        }
        if (node.has("op")) {
            String name = node.get("op").asText();
            Operator operator = OPERATORS.get(name.toLowerCase(Locale.ROOT));
            if (operator == null) {
                throw error(policyCode, "unknown operator '" + name + "'");
            }
            List<PolicyExpression> args = new ArrayList<>();
            for (JsonNode arg : node.path("args")) {
                args.add(parseNode(policyCode, arg));
            }
            if (!operator.accepts(args.size())) {
                throw error(policyCode, "operator '" + name + "' does not take " + args.size() + " argument(s)");
            }
            return new Operation(operator, List.copyOf(args));
        }
        throw error(policyCode, "unrecognized expression " + node);
    }

    private PolicyExpression reference(String policyCode, String path) {
        if (path.isBlank()) {
            throw error(policyCode, "empty reference");
        }
        ContextKey key = CONTEXT.get(path);
        if (key != null) {
            return new ContextRef(key);
        }
        if (path.startsWith("context.") || path.startsWith("user.")) {
            throw error(policyCode, "unknown session reference '" + path + "'");
        }
        if (path.contains(".")) {
            throw error(policyCode, "reference '" + path + "' must name a field of the secured table");
        }
        return ColumnRef.unresolved(path);
    }

    private static PolicyExpression shorthand(String text) {
        switch (text) {
            case "allow":
            case "true":
            case "1=1":
                return BooleanLiteral.TRUE;
            case "deny":
            case "false":
            case "1=0":
                return BooleanLiteral.FALSE;
            case "tenant":
                return new Operation(Operator.EQ,
                        List.of(ColumnRef.unresolved(InternalFields.TENANT_ID), new ContextRef(ContextKey.TENANT_ID)));
            default:
                return null;
        }
    }

    private JsonNode readJson(String policyCode, String text) {
        try {
            return JsonSupport.mapper().readTree(text);
        } catch (JsonProcessingException e) {
            throw error(policyCode, "expression is neither a shorthand nor JSON: " + e.getOriginalMessage());
        }
    }

    private CompilationException error(String policyCode, String detail) {
        return new CompilationException("Policy '" + policyCode + "': " + detail);
    }
}
