package com.ozmeta.compiler.exception;

/**
 * A logical type has no physical mapping on the requested platform.
 */
public class UnmappedTypeException extends OzMetaException {

    private static final long serialVersionUID = 1L;
    private final String logicalType;
    private final String platformCode;

    public UnmappedTypeException(String logicalType, String platformCode) {
        super(ErrorKind.UNMAPPED_TYPE,
                "Logical type '" + logicalType + "' has no physical mapping for platform '" + platformCode + "'");
        this.logicalType = logicalType;
        this.platformCode = platformCode;
    }

    public String getLogicalType() {
        return logicalType;
    }

    public String getPlatformCode() {
        return platformCode;
    }
}
