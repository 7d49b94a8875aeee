package com.reachscan.adapter.cfg;

public enum EdgeKind {
    SEQUENTIAL,
    TRUE_BRANCH,
    FALSE_BRANCH,
    EXCEPTION,
    /** Inter-procedural: from a call site's block to the callee's entry block. */
    CALL,
    /** From a call's block to the block that resumes after the call returns. */
    RETURN_TO_CALLER
}
