package com.ozmeta.compiler.exception;

/**
 * Fatal for the target being compiled; other targets of the run continue.
 */
public class CompilationException extends OzMetaException {

    private static final long serialVersionUID = 1L;

    public CompilationException(String message) {
        super(ErrorKind.COMPILATION_ERROR, message);
    }

    public CompilationException(String message, Throwable cause) {
        super(ErrorKind.COMPILATION_ERROR, message, cause);
    }
}
