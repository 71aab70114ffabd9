package com.vidnyan.depscope.domain.analysis;

/**
 * Traversal direction for closure queries.
 */
public enum Direction {
    DEPENDENCIES,   // follow outgoing edges
    DEPENDENTS      // follow incoming edges
}
