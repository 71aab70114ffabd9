package com.vidnyan.depscope.domain.exception;

/**
 * An interchange document could not be turned back into a graph.
 */
public class GraphDocumentException extends DepscopeException {

    public GraphDocumentException(String message) {
        super(message);
    }

    public GraphDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
