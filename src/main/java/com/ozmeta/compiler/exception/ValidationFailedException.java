package com.ozmeta.compiler.exception;

public class ValidationFailedException extends OzMetaException {

    private static final long serialVersionUID = 1L;

    public ValidationFailedException(String message) {
        super(ErrorKind.VALIDATION_FAILED, message);
    }

    public ValidationFailedException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION_FAILED, message, cause);
    }
}
