package com.reachscan.adapter.cfg;

public enum ResolutionState {
    UNRESOLVED,
    RESOLVED,
    UNKNOWN_TARGET,
    EXCLUDED
}
