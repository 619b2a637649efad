package com.ozmeta.compiler.emit.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.ozmeta.compiler.model.physical.PhysicalField;
import com.ozmeta.compiler.model.physical.PhysicalObject;
import com.ozmeta.compiler.model.physical.ProjectedRelation;

import lombok.Builder;
import lombok.Value;

/**
 * Shared CREATE/ALTER statement assembly. Emitters pass a {@link TableStyle}
 * for the parts where platforms differ.
 */
public class DdlBuilder {

    /**
     * Platform-specific pieces of a CREATE TABLE statement.
     */
    @Value
    @Builder
    public static class TableStyle {
        /** Emit {@code CONSTRAINT pk PRIMARY KEY (...)} inside the column list. */
        boolean inlinePrimaryKey;
        /** Drop the {@code CONSTRAINT pk} prefix where the platform does not name primary keys. */
        boolean anonymousPrimaryKey;
        /** Appended after the primary key column list, e.g. {@code NOT ENFORCED}. */
        @Builder.Default
        String primaryKeySuffix = "";
        /** Per-column clause appended after the type and nullability; may return empty. */
        @Builder.Default
        Function<PhysicalField, String> columnOptions = f -> "";
        /** Clauses after the closing parenthesis, one per line. */
        @Builder.Default
        Function<PhysicalObject, List<String>> tableClauses = o -> List.of();
    }

    private final SqlDialect dialect;

    public DdlBuilder(SqlDialect dialect) {
        this.dialect = dialect;
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    public String header(String targetKey) {
        return "-- Generated by ozmeta for " + targetKey + ". Do not edit.\n";
    }

    public String createSchemas(List<String> schemas) {
        return schemas.stream()
                .sorted()
                .distinct()
                .map(s -> "CREATE SCHEMA IF NOT EXISTS " + dialect.quote(s) + ";\n")
                .collect(Collectors.joining());
    }

    public String createTable(PhysicalObject object, TableStyle style) {
        List<String> lines = new ArrayList<>();
        for (PhysicalField field : object.getFields()) {
            StringBuilder column = new StringBuilder("    ")
                    .append(dialect.quote(field.getPhysicalName()))
                    .append(' ')
                    .append(field.getPhysicalType());
            if (!field.isNullable()) {
                column.append(" NOT NULL");
            }
            String options = style.getColumnOptions().apply(field);
            if (!options.isEmpty()) {
                column.append(' ').append(options);
            }
            lines.add(column.toString());
        }
        if (style.isInlinePrimaryKey() && !object.getPrimaryKey().isEmpty()) {
            String pk = (style.isAnonymousPrimaryKey() ? "    " : "    CONSTRAINT "
                    + dialect.quote(object.getPrimaryKeyName()) + " ") + "PRIMARY KEY ("
                    + quotedList(object.getPrimaryKey()) + ")";
            if (!style.getPrimaryKeySuffix().isEmpty()) {
                pk += " " + style.getPrimaryKeySuffix();
            }
            lines.add(pk);
        }

        StringBuilder sb = new StringBuilder();
        sb.append("CREATE TABLE IF NOT EXISTS ")
                .append(dialect.qualify(object.getPhysicalSchema(), object.getPhysicalName()))
                .append(" (\n")
                .append(String.join(",\n", lines))
                .append("\n)");
        for (String clause : style.getTableClauses().apply(object)) {
            sb.append('\n').append(clause);
        }
        sb.append(";\n");
        return sb.toString();
    }

    public String addForeignKey(ProjectedRelation relation, String suffix) {
        String statement = "ALTER TABLE "
                + dialect.qualify(relation.getFromObject().getPhysicalSchema(), relation.getFromObject().getPhysicalName())
                + " ADD CONSTRAINT " + dialect.quote(relation.getConstraintName())
                + " FOREIGN KEY (" + dialect.quote(relation.getFromColumn()) + ") REFERENCES "
                + dialect.qualify(relation.getToObject().getPhysicalSchema(), relation.getToObject().getPhysicalName())
                + " (" + dialect.quote(relation.getToColumn()) + ")";
        return (suffix.isEmpty() ? statement : statement + " " + suffix) + ";\n";
    }

    public String quotedList(List<String> columns) {
        return columns.stream().map(dialect::quote).collect(Collectors.joining(", "));
    }

    public static String sensitivityNote(PhysicalField field) {
        return "sensitivity: " + field.getSensitivity().name().toLowerCase(Locale.ROOT)
                + (field.isEncrypted() ? ", encrypted" : field.isMasked() ? ", masked" : "");
    }
}
