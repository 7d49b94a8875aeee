package com.reachscan.adapter.cfg;

/**
 * How control leaves a basic block.
 */
public enum TerminatorKind {
    FALLTHROUGH,
    BRANCH,
    LOOP_BACK,
    RAISE,
    RETURN,
    /** Fallback for blocks whose exit could not be classified; treated as able to leave the function. */
    UNKNOWN_EXIT
}
