package com.vidnyan.depscope.domain.exception;

import java.nio.file.Path;

/**
 * The analysis root does not exist or is not a directory.
 */
public class RootNotFoundException extends DepscopeException {

    private final Path root;

    public RootNotFoundException(Path root) {
        super("Analysis root not found: " + root);
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }
}
