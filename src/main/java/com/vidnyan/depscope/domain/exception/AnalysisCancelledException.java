package com.vidnyan.depscope.domain.exception;

/**
 * The calling thread was interrupted while artifacts were being extracted.
 */
public class AnalysisCancelledException extends DepscopeException {

    public AnalysisCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
