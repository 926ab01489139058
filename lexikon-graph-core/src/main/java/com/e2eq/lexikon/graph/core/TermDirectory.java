package com.e2eq.lexikon.graph.core;

/**
 * Existence check against the term subsystem. The graph never reads term content.
 */
@FunctionalInterface
public interface TermDirectory {

    boolean termExists(String termId);

    static TermDirectory permissive() {
        return termId -> true;
    }
}
