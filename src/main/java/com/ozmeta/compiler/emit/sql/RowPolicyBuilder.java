package com.ozmeta.compiler.emit.sql;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import com.ozmeta.compiler.exception.CompilationException;
import com.ozmeta.compiler.model.physical.PhysicalField;
import com.ozmeta.compiler.model.physical.PhysicalObject;
import com.ozmeta.compiler.model.physical.ProjectedRowPolicy;
import com.ozmeta.compiler.policy.PolicyCompiler;

/**
 * Row-level security statements for one table. Only PostgreSQL enforces the
 * write check; elsewhere it is reported in a comment and the policy filters
 * reads only.
 */
public class RowPolicyBuilder {

    private final SqlDialect dialect;
    private final PolicyCompiler compiler;

    public RowPolicyBuilder(SqlDialect dialect) {
        this.dialect = dialect;
        this.compiler = new PolicyCompiler(dialect);
    }

    public String render(ProjectedRowPolicy policy) {
        PhysicalObject object = policy.getObject();
        String table = dialect.qualify(object.getPhysicalSchema(), object.getPhysicalName());
        String filter = policy.getFilter() != null ? compiler.compile(policy.getFilter()) : null;

        StringBuilder sb = new StringBuilder("-- ").append(policy.getPhysicalName()).append(": ")
                .append(String.join(", ", policy.getPolicyCodes())).append('\n');
        if (dialect == SqlDialect.POSTGRES) {
            String name = dialect.quote(policy.getPhysicalName());
            sb.append("ALTER TABLE ").append(table).append(" ENABLE ROW LEVEL SECURITY;\n")
                    .append("DROP POLICY IF EXISTS ").append(name).append(" ON ").append(table).append(";\n")
                    .append("CREATE POLICY ").append(name).append(" ON ").append(table)
                    .append(" USING ").append(parenthesized(filter != null ? filter : "TRUE"));
            if (policy.getCheck() != null) {
                sb.append(" WITH CHECK ").append(parenthesized(compiler.compile(policy.getCheck())));
            }
            return sb.append(";\n").toString();
        }

        if (policy.getCheck() != null) {
            sb.append("-- write check not enforced on ").append(dialect.name().toLowerCase(Locale.ROOT))
                    .append("; reads are filtered only\n");
        }
        if (filter == null) {
            return sb.toString();
        }
        switch (dialect) {
            case REDSHIFT:
                return sb.append(redshift(policy, table, filter)).toString();
            case SNOWFLAKE:
                return sb.append(snowflake(policy, table, filter)).toString();
            case SPARK:
                return sb.append(spark(policy, table, filter)).toString();
            case BIGQUERY:
                return sb.append("CREATE OR REPLACE ROW ACCESS POLICY ").append(dialect.quote(policy.getPhysicalName()))
                        .append(" ON ").append(table)
                        .append(" GRANT TO ('allAuthenticatedUsers') FILTER USING ").append(parenthesized(filter))
                        .append(";\n").toString();
            default:
                throw new CompilationException("Row policies are not supported on " + dialect);
        }
    }

    private String redshift(ProjectedRowPolicy policy, String table, String filter) {
        String name = dialect.quote(policy.getPhysicalName());
        StringBuilder sb = new StringBuilder("DROP RLS POLICY IF EXISTS ").append(name).append(" CASCADE;\n")
                .append("CREATE RLS POLICY ").append(name);
        if (!policy.getColumns().isEmpty()) {
            sb.append(" WITH (").append(typedColumns(policy.getObject(), policy.getColumns())).append(')');
        }
        return sb.append(" USING ").append(parenthesized(filter)).append(";\n")
                .append("ATTACH RLS POLICY ").append(name).append(" ON ").append(table).append(" TO PUBLIC;\n")
                .append("ALTER TABLE ").append(table).append(" ROW LEVEL SECURITY ON;\n")
                .toString();
    }

    /**
     * Snowflake policies take at least one argument; a guard that reads no
     * column is bound to the table's first column.
     */
    private String snowflake(ProjectedRowPolicy policy, String table, String filter) {
        PhysicalObject object = policy.getObject();
        List<String> columns = policy.getColumns().isEmpty()
                ? List.of(object.getFields().get(0).getPhysicalName())
                : policy.getColumns();
        String name = dialect.qualify(object.getPhysicalSchema(), policy.getPhysicalName());
        return "CREATE OR REPLACE ROW ACCESS POLICY " + name + " AS (" + typedColumns(object, columns)
                + ") RETURNS BOOLEAN -> " + filter + ";\n"
                + "ALTER TABLE " + table + " ADD ROW ACCESS POLICY " + name + " ON (" + quotedList(columns) + ");\n";
    }

    private String spark(ProjectedRowPolicy policy, String table, String filter) {
        PhysicalObject object = policy.getObject();
        String name = dialect.qualify(object.getPhysicalSchema(), policy.getPhysicalName());
        return "CREATE OR REPLACE FUNCTION " + name + "(" + typedColumns(object, policy.getColumns())
                + ") RETURNS BOOLEAN RETURN " + filter + ";\n"
                + "ALTER TABLE " + table + " SET ROW FILTER " + name + " ON (" + quotedList(policy.getColumns()) + ");\n";
    }

    private String typedColumns(PhysicalObject object, List<String> columns) {
        return columns.stream()
                .map(column -> dialect.quote(column) + " " + physicalType(object, column))
                .collect(Collectors.joining(", "));
    }

    private static String physicalType(PhysicalObject object, String column) {
        return object.getFields().stream()
                .filter(f -> f.getPhysicalName().equals(column))
                .map(PhysicalField::getPhysicalType)
                .findFirst()
                .orElseThrow(() -> new CompilationException("Row policy column " + column + " is not on "
                        + object.qualifiedName()));
    }

    private String quotedList(List<String> columns) {
        return columns.stream().map(dialect::quote).collect(Collectors.joining(", "));
    }

    /** Compiled guards wrap compound expressions already. */
    private static String parenthesized(String sql) {
        return sql.startsWith("(") && sql.endsWith(")") ? sql : "(" + sql + ")";
    }
}
