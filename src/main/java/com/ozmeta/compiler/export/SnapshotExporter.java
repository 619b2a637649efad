package com.ozmeta.compiler.export;

import java.io.IOException;
import java.util.UUID;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Produces a snapshot document from some metadata source.
 */
public interface SnapshotExporter {

    /** Name used on the command line, e.g. {@code stub}. */
    String provider();

    /**
     * @throws com.ozmeta.compiler.exception.ConnectionFailedException when the source cannot be reached
     */
    ObjectNode export(String connection, UUID projectId) throws IOException;
}
