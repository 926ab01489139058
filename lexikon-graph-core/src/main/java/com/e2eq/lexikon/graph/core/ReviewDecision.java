package com.e2eq.lexikon.graph.core;

public enum ReviewDecision {
    APPROVE,
    REJECT
}
