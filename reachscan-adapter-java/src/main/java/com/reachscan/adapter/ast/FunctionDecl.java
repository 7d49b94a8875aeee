package com.reachscan.adapter.ast;

import java.util.List;
import java.util.Set;

/**
 * A named (or synthetically named) unit of code together with its statement tree.
 * Abstract and native declarations have an empty body.
 */
public record FunctionDecl(
    String id,                 // qualified identifier, unique within a run
    String name,               // simple name, used for unqualified resolution
    String unitPath,
    String container,          // declaring type id; nullable
    Visibility visibility,
    int arity,
    SourceLocation location,
    List<Ast.Stmt> body,
    Set<FunctionTrait> traits,
    List<String> overrides     // ids of program functions this one overrides
) {
    public FunctionDecl {
        body = List.copyOf(body);
        traits = Set.copyOf(traits);
        overrides = List.copyOf(overrides);
    }

    public boolean has(FunctionTrait trait) {
        return traits.contains(trait);
    }

    public boolean isExported() {
        return visibility == Visibility.EXPORTED;
    }
}
