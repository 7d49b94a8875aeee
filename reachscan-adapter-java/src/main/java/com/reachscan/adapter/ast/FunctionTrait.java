package com.reachscan.adapter.ast;

/**
 * Declaration facts the front end knows about a function and the entry-point policy reads.
 */
public enum FunctionTrait {
    MAIN,
    TEST,
    STATIC_INITIALIZER,
    ABSTRACT,
    OVERRIDES_EXTERNAL,
    SYNTHETIC
}
