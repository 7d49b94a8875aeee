package com.reachscan.adapter.cfg;

import com.reachscan.adapter.ast.SourceLocation;

/**
 * Raised when a function's statement tree holds a construct the CFG builder cannot model.
 * Scoped to one function; the run continues without it.
 */
public class MalformedControlFlowException extends RuntimeException {

    private final String functionId;

    public MalformedControlFlowException(String functionId, String detail, SourceLocation location) {
        super("Cannot model control flow of " + functionId
                + (location != null && location.isKnown() ? " at line " + location.line() : "")
                + ": " + detail);
        this.functionId = functionId;
    }

    public String getFunctionId() { return functionId; }
}
