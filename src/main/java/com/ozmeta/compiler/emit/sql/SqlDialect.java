package com.ozmeta.compiler.emit.sql;

/**
 * Syntax differences between the SQL families we emit.
 */
public enum SqlDialect {
    POSTGRES("\"", "\""),
    SNOWFLAKE("\"", "\""),
    BIGQUERY("`", "`"),
    SPARK("`", "`"),
    REDSHIFT("\"", "\"");

    private final String open;
    private final String close;

    SqlDialect(String open, String close) {
        this.open = open;
        this.close = close;
    }

    public String quote(String identifier) {
        return open + identifier.replace(close, close + close) + close;
    }

    public String qualify(String schema, String name) {
        return quote(schema) + "." + quote(name);
    }

    public String qualify(String schema, String table, String column) {
        return qualify(schema, table) + "." + quote(column);
    }

    public String stringLiteral(String value) {
        if (this == BIGQUERY) {
            return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
        }
        return "'" + value.replace("'", "''") + "'";
    }

    /**
     * Division returning NULL for a zero denominator.
     */
    public String safeDivide(String numerator, String denominator) {
        switch (this) {
            case BIGQUERY:
                return "SAFE_DIVIDE(" + numerator + ", " + denominator + ")";
            case SPARK:
                return "try_divide(" + numerator + ", " + denominator + ")";
            default:
                return "(" + numerator + ") / NULLIF(" + denominator + ", 0)";
        }
    }
}
