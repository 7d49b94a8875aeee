package com.reachscan.adapter.ast;

import java.util.List;

/**
 * Language-neutral statement tree handed over by a front end.
 * Nodes are immutable; identity matters (blocks hold references to the nodes they cover).
 */
public final class Ast {

    private Ast() {}

    public interface Node {
        SourceLocation location();
    }

    public interface Stmt extends Node {}

    public interface Expr extends Node {}

    // --- Statements ---

    public record ExprStmt(Expr expr, SourceLocation location) implements Stmt {}

    public record LocalStmt(String name, Expr initializer, SourceLocation location) implements Stmt {}  // initializer nullable

    public record BlockStmt(List<Stmt> statements, SourceLocation location) implements Stmt {
        public BlockStmt {
            statements = List.copyOf(statements);
        }
    }

    public record IfStmt(Expr condition, Stmt thenBranch, Stmt elseBranch, SourceLocation location) implements Stmt {}  // elseBranch nullable

    public record WhileStmt(Expr condition, Stmt body, SourceLocation location) implements Stmt {}

    public record DoWhileStmt(Stmt body, Expr condition, SourceLocation location) implements Stmt {}

    /** A missing condition loops forever. */
    public record ForStmt(
        List<Stmt> initializers,
        Expr condition,
        List<Expr> updates,
        Stmt body,
        SourceLocation location
    ) implements Stmt {
        public ForStmt {
            initializers = List.copyOf(initializers);
            updates = List.copyOf(updates);
        }
    }

    public record ForEachStmt(String variable, Expr iterable, Stmt body, SourceLocation location) implements Stmt {}

    public record SwitchStmt(
        Expr selector,
        List<SwitchCase> cases,
        boolean fallsThrough,      // false for arrow-style cases
        SourceLocation location
    ) implements Stmt {
        public SwitchStmt {
            cases = List.copyOf(cases);
        }
    }

    public record SwitchCase(
        List<Expr> labels,
        boolean isDefault,
        List<Stmt> body,
        SourceLocation location
    ) implements Node {
        public SwitchCase {
            labels = List.copyOf(labels);
            body = List.copyOf(body);
        }
    }

    public record TryStmt(
        List<Expr> resources,
        BlockStmt body,
        List<CatchClause> catches,
        BlockStmt finallyBlock,    // nullable
        SourceLocation location
    ) implements Stmt {
        public TryStmt {
            resources = List.copyOf(resources);
            catches = List.copyOf(catches);
        }
    }

    public record CatchClause(String exceptionType, BlockStmt body, SourceLocation location) implements Node {}

    public record ThrowStmt(Expr exception, SourceLocation location) implements Stmt {}

    public record ReturnStmt(Expr value, SourceLocation location) implements Stmt {}  // value nullable

    public record BreakStmt(String label, SourceLocation location) implements Stmt {}  // label nullable

    public record ContinueStmt(String label, SourceLocation location) implements Stmt {}  // label nullable

    /** Completes the innermost switch expression with a value. */
    public record YieldStmt(Expr value, SourceLocation location) implements Stmt {}

    public record LabeledStmt(String label, Stmt body, SourceLocation location) implements Stmt {}

    /** A construct the front end could not lower; building a CFG for its function fails. */
    public record UnsupportedStmt(String description, SourceLocation location) implements Stmt {}

    // --- Expressions ---

    /**
     * Invocation of a function. {@code target} is the qualified id when the front end resolved it,
     * otherwise null and resolution falls back to {@code name} and {@code argumentCount}.
     * Operands are the receiver (if any) followed by the arguments, in evaluation order.
     */
    public record CallExpr(
        String target,
        String name,
        int argumentCount,
        List<Expr> operands,
        boolean dynamic,           // reflective or otherwise computed target
        SourceLocation location
    ) implements Expr {
        public CallExpr {
            operands = List.copyOf(operands);
        }
    }

    /** A reference to a function that does not invoke it here: lambdas, method references, nested bodies. */
    public record FunctionRefExpr(String target, String name, SourceLocation location) implements Expr {}

    public enum LogicalOp { AND, OR }

    public record LogicalExpr(LogicalOp op, Expr left, Expr right, SourceLocation location) implements Expr {}

    public record NotExpr(Expr operand, SourceLocation location) implements Expr {}

    public record ConditionalExpr(Expr condition, Expr whenTrue, Expr whenFalse, SourceLocation location) implements Expr {}

    public record SwitchExpr(
        Expr selector,
        List<SwitchCase> cases,
        boolean fallsThrough,
        SourceLocation location
    ) implements Expr {
        public SwitchExpr {
            cases = List.copyOf(cases);
        }
    }

    public record BoolLiteral(boolean value, SourceLocation location) implements Expr {}

    /** Any other expression: its operands are evaluated left to right. */
    public record CompoundExpr(String kind, List<Expr> operands, boolean mayRaise, SourceLocation location) implements Expr {
        public CompoundExpr {
            operands = List.copyOf(operands);
        }
    }

    /** Names, literals and other expressions without sub-expressions. */
    public record LeafExpr(String text, SourceLocation location) implements Expr {}
}
