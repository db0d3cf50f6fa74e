package com.scholarly.citegraph.service.traversal;

public enum StopReason {
    COMPLETED,
    CANCELLED,
    INTERRUPTED,
    NODE_LIMIT
}
