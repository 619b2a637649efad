package com.ozmeta.compiler.drift;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A table as seen on the live target. {@code partitionColumns} and
 * {@code foreignKeys} are null when the observer did not look at them.
 */
@Value
@Builder
@Jacksonized
public class ObservedObject {
    String schema;
    String name;
    @Singular
    List<ObservedColumn> columns;
    List<String> partitionColumns;
    List<ObservedForeignKey> foreignKeys;
    Long rowCount;
    String checksum;

    public Optional<ObservedColumn> findColumn(String columnName) {
        return columns.stream().filter(c -> c.getName().equals(columnName)).findFirst();
    }

    public String qualifiedName() {
        return schema + "." + name;
    }
}
