package com.ozmeta.compiler.drift;

import java.util.Comparator;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DriftFinding {

    static final Comparator<DriftFinding> ORDER = Comparator
            .comparing(DriftFinding::getKind)
            .thenComparing(DriftFinding::getObject, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(DriftFinding::getColumn, Comparator.nullsFirst(Comparator.naturalOrder()));

    DriftFindingKind kind;
    String object;
    String column;
    String expected;
    String actual;
    String message;

    @Override
    public String toString() {
        return "[" + kind + "] " + message;
    }
}
