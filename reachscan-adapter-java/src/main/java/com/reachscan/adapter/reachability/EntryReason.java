package com.reachscan.adapter.reachability;

public enum EntryReason {
    DECLARED,
    MAIN,
    TEST,
    STATIC_INITIALIZER,
    EXPORTED,
    EXTERNAL_OVERRIDE
}
