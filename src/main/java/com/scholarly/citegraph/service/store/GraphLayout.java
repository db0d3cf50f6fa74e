package com.scholarly.citegraph.service.store;

public enum GraphLayout {
    /** One record per identifier, keyed by identifier. */
    FLAT,
    /** Legacy reference tree: each key maps to the tree of its references. */
    NESTED_TREE
}
