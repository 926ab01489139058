package com.e2eq.lexikon.graph.core;

public enum Direction {
    OUTGOING,
    INCOMING,
    BOTH
}
