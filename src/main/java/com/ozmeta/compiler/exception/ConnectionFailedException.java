package com.ozmeta.compiler.exception;

/**
 * An export provider could not reach its source.
 */
public class ConnectionFailedException extends OzMetaException {

    private static final long serialVersionUID = 1L;

    public ConnectionFailedException(String message) {
        super(ErrorKind.CONNECTION_FAILED, message);
    }

    public ConnectionFailedException(String message, Throwable cause) {
        super(ErrorKind.CONNECTION_FAILED, message, cause);
    }
}
