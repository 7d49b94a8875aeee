package com.reachscan.adapter.reachability;

public enum Classification {
    LIVE,
    /** The enclosing function is never reached. */
    DEAD,
    /** The function is reached but this block never is. */
    UNREACHABLE_LOCAL,
    EXCLUDED;

    public boolean isFinding() {
        return this == DEAD || this == UNREACHABLE_LOCAL;
    }
}
