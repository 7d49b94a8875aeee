package com.reachscan.adapter.ast;

import java.util.List;

/**
 * One parsed file and the functions it declares, in declaration order.
 */
public record SourceUnit(
    String path,                  // relative to the project root
    List<FunctionDecl> functions
) {
    public SourceUnit {
        functions = List.copyOf(functions);
    }
}
