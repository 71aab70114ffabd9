package com.vidnyan.depscope.domain.exception;

/**
 * No extractor strategy is registered for the requested artifact family.
 */
public class UnsupportedFamilyException extends DepscopeException {

    public UnsupportedFamilyException(String family) {
        super("Unsupported artifact family: " + family);
    }
}
