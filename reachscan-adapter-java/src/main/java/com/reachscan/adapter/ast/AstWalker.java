package com.reachscan.adapter.ast;

import com.reachscan.adapter.ast.Ast.*;

import java.util.List;
import java.util.function.Consumer;

/**
 * Pre-order traversal over every expression of a statement tree, ignoring control flow.
 */
public final class AstWalker {

    private AstWalker() {}

    public static void forEachExpr(List<Stmt> statements, Consumer<Expr> action) {
        for (Stmt s : statements) {
            forEachExpr(s, action);
        }
    }

    public static void forEachExpr(Stmt stmt, Consumer<Expr> action) {
        if (stmt == null) return;
        if (stmt instanceof ExprStmt s) {
            expr(s.expr(), action);
        } else if (stmt instanceof LocalStmt s) {
            expr(s.initializer(), action);
        } else if (stmt instanceof BlockStmt s) {
            forEachExpr(s.statements(), action);
        } else if (stmt instanceof IfStmt s) {
            expr(s.condition(), action);
            forEachExpr(s.thenBranch(), action);
            forEachExpr(s.elseBranch(), action);
        } else if (stmt instanceof WhileStmt s) {
            expr(s.condition(), action);
            forEachExpr(s.body(), action);
        } else if (stmt instanceof DoWhileStmt s) {
            forEachExpr(s.body(), action);
            expr(s.condition(), action);
        } else if (stmt instanceof ForStmt s) {
            forEachExpr(s.initializers(), action);
            expr(s.condition(), action);
            s.updates().forEach(u -> expr(u, action));
            forEachExpr(s.body(), action);
        } else if (stmt instanceof ForEachStmt s) {
            expr(s.iterable(), action);
            forEachExpr(s.body(), action);
        } else if (stmt instanceof SwitchStmt s) {
            expr(s.selector(), action);
            cases(s.cases(), action);
        } else if (stmt instanceof TryStmt s) {
            s.resources().forEach(r -> expr(r, action));
            forEachExpr(s.body(), action);
            for (CatchClause c : s.catches()) {
                forEachExpr(c.body(), action);
            }
            forEachExpr(s.finallyBlock(), action);
        } else if (stmt instanceof ThrowStmt s) {
            expr(s.exception(), action);
        } else if (stmt instanceof ReturnStmt s) {
            expr(s.value(), action);
        } else if (stmt instanceof YieldStmt s) {
            expr(s.value(), action);
        } else if (stmt instanceof LabeledStmt s) {
            forEachExpr(s.body(), action);
        }
    }

    private static void cases(List<SwitchCase> cases, Consumer<Expr> action) {
        for (SwitchCase c : cases) {
            c.labels().forEach(l -> expr(l, action));
            forEachExpr(c.body(), action);
        }
    }

    private static void expr(Expr e, Consumer<Expr> action) {
        if (e == null) return;
        action.accept(e);
        if (e instanceof CallExpr c) {
            c.operands().forEach(o -> expr(o, action));
        } else if (e instanceof LogicalExpr l) {
            expr(l.left(), action);
            expr(l.right(), action);
        } else if (e instanceof NotExpr n) {
            expr(n.operand(), action);
        } else if (e instanceof ConditionalExpr c) {
            expr(c.condition(), action);
            expr(c.whenTrue(), action);
            expr(c.whenFalse(), action);
        } else if (e instanceof SwitchExpr s) {
            expr(s.selector(), action);
            cases(s.cases(), action);
        } else if (e instanceof CompoundExpr c) {
            c.operands().forEach(o -> expr(o, action));
        }
    }
}
