package com.vidnyan.depscope.domain.exception;

/**
 * Base class of the fatal errors raised by the analysis engine.
 */
public abstract class DepscopeException extends RuntimeException {

    protected DepscopeException(String message) {
        super(message);
    }

    protected DepscopeException(String message, Throwable cause) {
        super(message, cause);
    }
}
