package com.ozmeta.compiler.exception;

public class DeployFailedException extends OzMetaException {

    private static final long serialVersionUID = 1L;

    public DeployFailedException(String message) {
        super(ErrorKind.DEPLOY_FAILED, message);
    }

    public DeployFailedException(String message, Throwable cause) {
        super(ErrorKind.DEPLOY_FAILED, message, cause);
    }
}
