package com.ozmeta.compiler.exception;

/**
 * Base of all compiler failures. Carries an {@link ErrorKind} so callers can
 * branch without instanceof chains.
 */
public abstract class OzMetaException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final ErrorKind kind;

    protected OzMetaException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected OzMetaException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
