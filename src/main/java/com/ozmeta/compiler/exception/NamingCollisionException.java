package com.ozmeta.compiler.exception;

/**
 * Two distinct canonical objects still normalize to the same physical name
 * after hash suffixing.
 */
public class NamingCollisionException extends OzMetaException {

    private static final long serialVersionUID = 1L;
    private final String scope;
    private final String physicalName;

    public NamingCollisionException(String scope, String physicalName, String owner, String claimant) {
        super(ErrorKind.NAMING_COLLISION, "Physical name '" + physicalName + "' in scope '" + scope
                + "' is owned by " + owner + " and cannot be assigned to " + claimant);
        this.scope = scope;
        this.physicalName = physicalName;
    }

    public String getScope() {
        return scope;
    }

    public String getPhysicalName() {
        return physicalName;
    }
}
