package com.ozmeta.compiler.policy;

import java.util.List;
import java.util.stream.Collectors;

import com.ozmeta.compiler.emit.sql.SqlDialect;
import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.policy.PolicyExpression.BooleanLiteral;
import com.ozmeta.compiler.policy.PolicyExpression.ColumnRef;
import com.ozmeta.compiler.policy.PolicyExpression.ContextKey;
import com.ozmeta.compiler.policy.PolicyExpression.ContextRef;
import com.ozmeta.compiler.policy.PolicyExpression.NullLiteral;
import com.ozmeta.compiler.policy.PolicyExpression.NumberLiteral;
import com.ozmeta.compiler.policy.PolicyExpression.Operation;
import com.ozmeta.compiler.policy.PolicyExpression.StringLiteral;

/**
 * Renders a bound guard as a boolean SQL predicate in one dialect. Column
 * references render as bare quoted column names, so the predicate can sit in
 * a policy body or a filter function whose parameters carry those names.
 */
public class PolicyCompiler {

    private final SqlDialect dialect;

    public PolicyCompiler(SqlDialect dialect) {
        this.dialect = dialect;
    }

    public String compile(PolicyExpression node) {
        if (node instanceof BooleanLiteral literal) {
            return literal.isValue() ? "TRUE" : "FALSE";
        } else if (node instanceof NumberLiteral literal) {
            return literal.getValue().toPlainString();
        } else if (node instanceof StringLiteral literal) {
            return dialect.stringLiteral(literal.getValue());
        } else if (node instanceof NullLiteral) {
            return "NULL";
        } else if (node instanceof ColumnRef ref) {
            if (!ref.isResolved()) {
                throw new CompilationException("Unresolved policy column " + ref.getField());
            }
            return dialect.quote(ref.getPhysicalColumn());
        } else if (node instanceof ContextRef ref) {
            return context(ref.getKey());
        } else if (node instanceof Operation op) {
            return operation(op);
        }
        throw new CompilationException("Unsupported policy node " + node.getClass().getSimpleName());
    }

    private String operation(Operation op) {
        List<PolicyExpression> args = op.getArguments();
        switch (op.getOperator()) {
            case AND:
                return joined(args, " AND ");
            case OR:
                return joined(args, " OR ");
            case NOT:
                return "(NOT " + compile(args.get(0)) + ")";
            case EQ:
                return comparison(args, "=");
            case NE:
                return comparison(args, "<>");
            case GT:
                return comparison(args, ">");
            case GTE:
                return comparison(args, ">=");
            case LT:
                return comparison(args, "<");
            case LTE:
                return comparison(args, "<=");
            case IN:
                return "(" + compile(args.get(0)) + " IN ("
                        + args.subList(1, args.size()).stream().map(this::compile).collect(Collectors.joining(", "))
                        + "))";
            case IS_NULL:
                return "(" + compile(args.get(0)) + " IS NULL)";
            case IS_NOT_NULL:
                return "(" + compile(args.get(0)) + " IS NOT NULL)";
            case CONTAINS:
                return "(" + compile(args.get(0)) + " LIKE '%' || " + compile(args.get(1)) + " || '%')";
            case STARTS_WITH:
                return "(" + compile(args.get(0)) + " LIKE " + compile(args.get(1)) + " || '%')";
            case ENDS_WITH:
                return "(" + compile(args.get(0)) + " LIKE '%' || " + compile(args.get(1)) + ")";
            case REGEX:
                return regex(compile(args.get(0)), compile(args.get(1)));
            case COALESCE:
                return args.stream().map(this::compile).collect(Collectors.joining(", ", "COALESCE(", ")"));
            default:
                throw new CompilationException("Unsupported policy operator " + op.getOperator());
        }
    }

    private String joined(List<PolicyExpression> args, String separator) {
        if (args.size() == 1) {
            return compile(args.get(0));
        }
        return args.stream().map(this::compile).collect(Collectors.joining(separator, "(", ")"));
    }

    /**
     * Session values arrive untyped on some platforms, so a session value
     * compared with a column is cast to the column's type.
     */
    private String comparison(List<PolicyExpression> args, String symbol) {
        PolicyExpression left = args.get(0);
        PolicyExpression right = args.get(1);
        return "(" + operand(left, right) + " " + symbol + " " + operand(right, left) + ")";
    }

    private String operand(PolicyExpression node, PolicyExpression other) {
        if (node instanceof ContextRef ref && ref.getKey() != ContextKey.NOW
                && other instanceof ColumnRef column && column.getPhysicalType() != null) {
            return "CAST(" + context(ref.getKey()) + " AS " + column.getPhysicalType() + ")";
        }
        return compile(node);
    }

    private String regex(String value, String pattern) {
        switch (dialect) {
            case SNOWFLAKE:
                return "REGEXP_LIKE(" + value + ", " + pattern + ")";
            case BIGQUERY:
                return "REGEXP_CONTAINS(" + value + ", " + pattern + ")";
            case SPARK:
                return "(" + value + " RLIKE " + pattern + ")";
            default:
                return "(" + value + " ~ " + pattern + ")";
        }
    }

    private String context(ContextKey key) {
        switch (dialect) {
            case POSTGRES:
            case REDSHIFT:
                switch (key) {
                    case TENANT_ID:
                        return "current_setting('app.tenant_id')";
                    case USER_ID:
                        return "current_setting('app.user_id')";
                    case USER_ROLE:
                        return "current_setting('app.user_role')";
                    default:
                        return dialect == SqlDialect.REDSHIFT ? "GETDATE()" : "NOW()";
                }
            case SNOWFLAKE:
                switch (key) {
                    case TENANT_ID:
                        return "CURRENT_SESSION()::VARIANT:tenant_id";
                    case USER_ID:
                        return "CURRENT_USER()";
                    case USER_ROLE:
                        return "CURRENT_ROLE()";
                    default:
                        return "CURRENT_TIMESTAMP()";
                }
            case SPARK:
                switch (key) {
                    case TENANT_ID:
                    case USER_ID:
                        return "current_user()";
                    case USER_ROLE:
                        throw unavailable(key);
                    default:
                        return "current_timestamp()";
                }
            case BIGQUERY:
                switch (key) {
                    case TENANT_ID:
                    case USER_ID:
                        return "SESSION_USER()";
                    case USER_ROLE:
                        throw unavailable(key);
                    default:
                        return "CURRENT_TIMESTAMP()";
                }
            default:
                throw unavailable(key);
        }
    }

    private CompilationException unavailable(ContextKey key) {
        return new CompilationException("Session value " + key + " is not available on " + dialect);
    }
}
