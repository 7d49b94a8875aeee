package com.reachscan.adapter;

import com.reachscan.adapter.ast.Ast;
import com.reachscan.adapter.ast.Ast.*;
import com.reachscan.adapter.ast.FunctionDecl;
import com.reachscan.adapter.ast.FunctionTrait;
import com.reachscan.adapter.ast.SourceLocation;
import com.reachscan.adapter.ast.SourceUnit;
import com.reachscan.adapter.ast.Visibility;
import com.reachscan.adapter.cfg.BasicBlock;
import com.reachscan.adapter.cfg.ControlFlowGraph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static com.reachscan.adapter.ast.SourceLocation.at;

/**
 * Builders for hand-written statement trees. Statements take the line they sit on so tests can
 * look blocks up by line.
 */
final class AstFixtures {

    static final String UNIT = "src/main/java/demo/App.java";

    private AstFixtures() {}

    // --- functions and units ---

    static FunctionDecl function(String id, Stmt... body) {
        return function(id, Set.of(), List.of(), body);
    }

    static FunctionDecl function(String id, Set<FunctionTrait> traits, List<String> overrides, Stmt... body) {
        return new FunctionDecl(id, simpleName(id), UNIT, container(id), Visibility.INTERNAL, 0,
            at(1), Arrays.asList(body), traits, overrides);
    }

    static FunctionDecl exported(String id, Stmt... body) {
        return new FunctionDecl(id, simpleName(id), UNIT, container(id), Visibility.EXPORTED, 0,
            at(1), Arrays.asList(body), Set.of(), List.of());
    }

    static FunctionDecl inUnit(String unitPath, FunctionDecl fn) {
        return new FunctionDecl(fn.id(), fn.name(), unitPath, fn.container(), fn.visibility(), fn.arity(),
            fn.location(), fn.body(), fn.traits(), fn.overrides());
    }

    static SourceUnit unit(FunctionDecl... functions) {
        return new SourceUnit(UNIT, List.of(functions));
    }

    static String simpleName(String id) {
        int sep = id.lastIndexOf("::");
        int paren = id.indexOf('(', sep);
        return id.substring(sep + 2, paren < 0 ? id.length() : paren);
    }

    static String container(String id) {
        int sep = id.lastIndexOf("::");
        return sep < 0 ? null : id.substring(0, sep);
    }

    // --- statements ---

    static Stmt work(int line) {
        return new ExprStmt(new LeafExpr("work" + line, at(line)), at(line));
    }

    static Stmt call(int line, String target) {
        return new ExprStmt(callExpr(line, target), at(line));
    }

    static CallExpr callExpr(int line, String target) {
        return new CallExpr(target, simpleName(target), 0, List.of(), false, at(line));
    }

    static Stmt callByName(int line, String name, int arguments) {
        List<Expr> args = new ArrayList<>();
        for (int i = 0; i < arguments; i++) args.add(new LeafExpr("arg" + i, at(line)));
        return new ExprStmt(new CallExpr(null, name, arguments, args, false, at(line)), at(line));
    }

    static Stmt dynamicCall(int line, String name) {
        return new ExprStmt(new CallExpr(null, name, 1, List.of(), true, at(line)), at(line));
    }

    static Stmt ref(int line, String target) {
        return new ExprStmt(new FunctionRefExpr(target, simpleName(target), at(line)), at(line));
    }

    static Stmt ret(int line) {
        return new ReturnStmt(null, at(line));
    }

    static Stmt ret(int line, Expr value) {
        return new ReturnStmt(value, at(line));
    }

    static Stmt raise(int line) {
        return new ThrowStmt(new LeafExpr("error", at(line)), at(line));
    }

    static Stmt brk(int line) {
        return new BreakStmt(null, at(line));
    }

    static Stmt brk(int line, String label) {
        return new BreakStmt(label, at(line));
    }

    static Stmt cont(int line) {
        return new ContinueStmt(null, at(line));
    }

    static Stmt cont(int line, String label) {
        return new ContinueStmt(label, at(line));
    }

    static Stmt block(Stmt... statements) {
        return new BlockStmt(List.of(statements), SourceLocation.UNKNOWN);
    }

    static Stmt ifThen(int line, Expr condition, Stmt... then) {
        return new IfStmt(condition, new BlockStmt(List.of(then), at(line)), null, at(line));
    }

    static Stmt ifElse(int line, Expr condition, Stmt then, Stmt otherwise) {
        return new IfStmt(condition, then, otherwise, at(line));
    }

    static Stmt whileLoop(int line, Expr condition, Stmt... body) {
        return new WhileStmt(condition, new BlockStmt(List.of(body), at(line)), at(line));
    }

    static Stmt doWhile(int line, Expr condition, Stmt... body) {
        return new DoWhileStmt(new BlockStmt(List.of(body), at(line)), condition, at(line));
    }

    static Stmt forLoop(int line, Expr condition, Stmt... body) {
        return new ForStmt(List.of(new LocalStmt("i", new LeafExpr("0", at(line)), at(line))), condition,
            List.of(new LeafExpr("i++", at(line))), new BlockStmt(List.of(body), at(line)), at(line));
    }

    static Stmt labeled(int line, String label, Stmt body) {
        return new LabeledStmt(label, body, at(line));
    }

    static Stmt switchOf(int line, boolean fallsThrough, SwitchCase... cases) {
        return new SwitchStmt(new LeafExpr("selector", at(line)), List.of(cases), fallsThrough, at(line));
    }

    static SwitchCase caseOf(int line, Stmt... body) {
        return new SwitchCase(List.of(new LeafExpr("label" + line, at(line))), false, List.of(body), at(line));
    }

    static SwitchCase defaultCase(int line, Stmt... body) {
        return new SwitchCase(List.of(), true, List.of(body), at(line));
    }

    static Stmt tryCatch(int line, List<Stmt> body, List<Stmt> handler, List<Stmt> finallyBody) {
        List<Ast.CatchClause> catches = handler == null ? List.of()
            : List.of(new Ast.CatchClause("Exception", new BlockStmt(handler, at(line)), at(line)));
        BlockStmt fin = finallyBody == null ? null : new BlockStmt(finallyBody, at(line));
        return new TryStmt(List.of(), new BlockStmt(body, at(line)), catches, fin, at(line));
    }

    static Stmt unsupported(int line) {
        return new UnsupportedStmt("InlineAssembly", at(line));
    }

    // --- expressions ---

    static Expr cond(String name) {
        return new LeafExpr(name, SourceLocation.UNKNOWN);
    }

    static Expr bool(boolean value) {
        return new BoolLiteral(value, SourceLocation.UNKNOWN);
    }

    static Expr and(Expr left, Expr right) {
        return new LogicalExpr(LogicalOp.AND, left, right, SourceLocation.UNKNOWN);
    }

    static Expr or(Expr left, Expr right) {
        return new LogicalExpr(LogicalOp.OR, left, right, SourceLocation.UNKNOWN);
    }

    static Expr not(Expr operand) {
        return new NotExpr(operand, SourceLocation.UNKNOWN);
    }

    // --- lookups ---

    /** The block holding a statement that starts on {@code line}. */
    static BasicBlock blockAt(ControlFlowGraph cfg, int line) {
        for (BasicBlock block : cfg.blocks()) {
            if (block.lines().contains(line)) return block;
        }
        throw new AssertionError("No block of " + cfg + " holds line " + line);
    }

    static BasicBlock blockHolding(ControlFlowGraph cfg, Ast.Node node) {
        for (BasicBlock block : cfg.blocks()) {
            if (block.elements().contains(node)) return block;
        }
        throw new AssertionError("No block of " + cfg + " holds " + node);
    }
}
