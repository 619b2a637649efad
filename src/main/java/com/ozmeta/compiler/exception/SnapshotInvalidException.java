package com.ozmeta.compiler.exception;

import java.util.List;
import java.util.stream.Collectors;

import com.ozmeta.compiler.snapshot.Violation;

/**
 * Raised when a snapshot fails structural or referential validation. Holds every
 * violation found, not just the first one.
 */
public class SnapshotInvalidException extends OzMetaException {

    private static final long serialVersionUID = 1L;
    private final List<Violation> violations;

    public SnapshotInvalidException(List<Violation> violations) {
        super(ErrorKind.SNAPSHOT_INVALID, violations.stream()
                .map(Violation::toString)
                .collect(Collectors.joining(System.lineSeparator())));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> getViolations() {
        return violations;
    }
}
