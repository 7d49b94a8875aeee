package com.reachscan.adapter.cfg;

public enum CallSiteKind {
    INVOCATION,
    /** Reflective or computed target; never resolved statically. */
    DYNAMIC,
    /** Function reference that does not invoke its target at this point. */
    REFERENCE
}
