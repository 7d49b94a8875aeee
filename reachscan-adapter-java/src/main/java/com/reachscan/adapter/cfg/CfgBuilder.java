package com.reachscan.adapter.cfg;

import com.reachscan.adapter.ast.Ast.*;
import com.reachscan.adapter.ast.AstWalker;
import com.reachscan.adapter.ast.FunctionDecl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers one function's statement tree into a control-flow graph.
 *
 * Blocks are split at every conditional, loop, jump and invocation. Statements that follow a
 * {@code return}, {@code throw}, {@code break} or {@code continue} land in a fresh block with no
 * incoming edges. Short-circuit operators and ternaries get one evaluation block per operand, and
 * boolean literal conditions only emit the edge that can be taken.
 *
 * The builder keeps no state between calls and may be used from several threads.
 */
public class CfgBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(CfgBuilder.class);

    /**
     * Builds the CFG of {@code function}, or a single-block fallback graph carrying every call site
     * of the tree when the tree cannot be modeled.
     */
    public ControlFlowGraph buildOrFallback(FunctionDecl function) {
        try {
            return build(function);
        } catch (MalformedControlFlowException e) {
            LOGGER.warn("{}; function will be reported as unanalyzed", e.getMessage());
            return fallback(function, e.getMessage());
        }
    }

    /**
     * @throws MalformedControlFlowException if the tree holds an unsupported construct or a jump
     *         without a target
     */
    public ControlFlowGraph build(FunctionDecl function) {
        Construction construction = new Construction(function);
        construction.run();
        LOGGER.debug("Built CFG for {}: {} blocks, {} call sites", function.id(),
                construction.cfg.blocks().size(), construction.cfg.callSites().size());
        return construction.cfg;
    }

    ControlFlowGraph fallback(FunctionDecl function, String reason) {
        ControlFlowGraph cfg = new ControlFlowGraph(function);
        BasicBlock block = cfg.newBlock();
        function.body().forEach(block::add);
        AstWalker.forEachExpr(function.body(), e -> {
            if (e instanceof CallExpr call) {
                cfg.addCallSite(block, call, call.target(), call.name(), call.argumentCount(),
                        call.dynamic() ? CallSiteKind.DYNAMIC : CallSiteKind.INVOCATION);
            } else if (e instanceof FunctionRefExpr ref) {
                cfg.addCallSite(block, ref, ref.target(), ref.name(), -1, CallSiteKind.REFERENCE);
            }
        });
        block.markCanRaise();
        block.terminate(TerminatorKind.UNKNOWN_EXIT);
        block.markExits();
        cfg.markFallback(reason);
        return cfg;
    }

    // --- construction state, one instance per function ---

    private enum ScopeKind { LOOP, SWITCH, SWITCH_EXPRESSION, LABEL }

    private enum JumpKind { BREAK, CONTINUE, RETURN }

    private record Jump(JumpKind kind, BasicBlock target, int finallyDepth) {}

    private record PendingJump(Jump jump, BasicBlock origin) {}

    /** Handler entries of one try; an exception its catches may not take continues to {@code parent}. */
    private record HandlerFrame(List<BasicBlock> targets, HandlerFrame parent) {}

    private static final class JumpScope {
        final ScopeKind kind;
        final String label;
        final BasicBlock breakTarget;
        final BasicBlock continueTarget;
        final int finallyDepth;
        final JumpScope parent;

        JumpScope(ScopeKind kind, String label, BasicBlock breakTarget, BasicBlock continueTarget,
                  int finallyDepth, JumpScope parent) {
            this.kind = kind;
            this.label = label;
            this.breakTarget = breakTarget;
            this.continueTarget = continueTarget;
            this.finallyDepth = finallyDepth;
            this.parent = parent;
        }
    }

    private static final class FinallyFrame {
        final BasicBlock entry;
        final FinallyFrame parent;
        final HandlerFrame outerHandler;
        final int depth;
        final List<PendingJump> pending = new ArrayList<>();
        BasicBlock tail;

        FinallyFrame(BasicBlock entry, FinallyFrame parent, HandlerFrame outerHandler) {
            this.entry = entry;
            this.parent = parent;
            this.outerHandler = outerHandler;
            this.depth = parent == null ? 1 : parent.depth + 1;
        }
    }

    private static final class Construction {
        final FunctionDecl function;
        final ControlFlowGraph cfg;
        final Map<BasicBlock, HandlerFrame> frames = new IdentityHashMap<>();
        final List<FinallyFrame> completedFinallies = new ArrayList<>();
        BasicBlock current;
        HandlerFrame handler;
        FinallyFrame finallyFrame;
        JumpScope scope;
        String pendingLabel;

        Construction(FunctionDecl function) {
            this.function = function;
            this.cfg = new ControlFlowGraph(function);
        }

        void run() {
            current = newBlock();
            statements(function.body());
            if (current.isOpen()) {
                current.terminate(TerminatorKind.RETURN);
                current.markExits();
            }
            addExceptionEdges();
            for (BasicBlock block : cfg.blocks()) {
                if (block.isOpen()) {
                    LOGGER.debug("Block {} left without terminator", block);
                    block.terminate(TerminatorKind.UNKNOWN_EXIT);
                    block.markExits();
                }
            }
        }

        // --- blocks and edges ---

        BasicBlock newBlock() {
            BasicBlock block = cfg.newBlock();
            if (handler != null) {
                frames.put(block, handler);
            }
            return block;
        }

        void connect(BasicBlock from, BasicBlock to, EdgeKind kind) {
            from.addSuccessor(new Edge(from, to, kind));
        }

        void connectGuarded(BasicBlock from, BasicBlock to, EdgeKind kind, List<BasicBlock> guards) {
            from.addSuccessor(new Edge(from, to, kind, guards));
        }

        void flowInto(BasicBlock target) {
            if (current.isOpen()) {
                connect(current, target, EdgeKind.SEQUENTIAL);
                current.terminate(TerminatorKind.FALLTHROUGH);
            }
        }

        void loopBack(BasicBlock header) {
            if (current.isOpen()) {
                connect(current, header, EdgeKind.SEQUENTIAL);
                current.terminate(TerminatorKind.LOOP_BACK);
            }
        }

        void branch(BasicBlock block, BasicBlock whenTrue, BasicBlock whenFalse) {
            block.terminate(TerminatorKind.BRANCH);
            connect(block, whenTrue, EdgeKind.TRUE_BRANCH);
            connect(block, whenFalse, EdgeKind.FALSE_BRANCH);
        }

        int finallyDepth() {
            return finallyFrame == null ? 0 : finallyFrame.depth;
        }

        void pushScope(ScopeKind kind, String label, BasicBlock breakTarget, BasicBlock continueTarget) {
            scope = new JumpScope(kind, label, breakTarget, continueTarget, finallyDepth(), scope);
        }

        void popScope() {
            scope = scope.parent;
        }

        String takeLabel() {
            String label = pendingLabel;
            pendingLabel = null;
            return label;
        }

        // --- statements ---

        void statements(List<Stmt> statements) {
            for (Stmt s : statements) {
                statement(s);
            }
        }

        void statement(Stmt stmt) {
            if (stmt instanceof BlockStmt s) {
                statements(s.statements());
            } else if (stmt instanceof ExprStmt s) {
                current.add(s);
                value(s.expr());
            } else if (stmt instanceof LocalStmt s) {
                current.add(s);
                value(s.initializer());
            } else if (stmt instanceof IfStmt s) {
                ifStatement(s);
            } else if (stmt instanceof WhileStmt s) {
                whileLoop(s, takeLabel());
            } else if (stmt instanceof DoWhileStmt s) {
                doWhileLoop(s, takeLabel());
            } else if (stmt instanceof ForStmt s) {
                forLoop(s, takeLabel());
            } else if (stmt instanceof ForEachStmt s) {
                forEachLoop(s, takeLabel());
            } else if (stmt instanceof SwitchStmt s) {
                String label = takeLabel();
                current.add(s);
                value(s.selector());
                switchBody(s.cases(), s.fallsThrough(), ScopeKind.SWITCH, label);
            } else if (stmt instanceof TryStmt s) {
                tryStatement(s);
            } else if (stmt instanceof ThrowStmt s) {
                current.add(s);
                value(s.exception());
                current.markCanRaise();
                current.terminate(TerminatorKind.RAISE);
                current = newBlock();
            } else if (stmt instanceof ReturnStmt s) {
                current.add(s);
                value(s.value());
                BasicBlock from = current;
                dispatch(from, new Jump(JumpKind.RETURN, null, 0), from);
                from.terminate(TerminatorKind.RETURN);
                current = newBlock();
            } else if (stmt instanceof BreakStmt s) {
                current.add(s);
                JumpScope target = findBreakTarget(s);
                jump(new Jump(JumpKind.BREAK, target.breakTarget, target.finallyDepth), TerminatorKind.FALLTHROUGH);
            } else if (stmt instanceof ContinueStmt s) {
                current.add(s);
                JumpScope target = findContinueTarget(s);
                jump(new Jump(JumpKind.CONTINUE, target.continueTarget, target.finallyDepth), TerminatorKind.LOOP_BACK);
            } else if (stmt instanceof YieldStmt s) {
                current.add(s);
                value(s.value());
                JumpScope target = findYieldTarget(s);
                jump(new Jump(JumpKind.BREAK, target.breakTarget, target.finallyDepth), TerminatorKind.FALLTHROUGH);
            } else if (stmt instanceof LabeledStmt s) {
                labeled(s);
            } else if (stmt instanceof UnsupportedStmt s) {
                throw new MalformedControlFlowException(function.id(), s.description(), s.location());
            } else {
                throw new MalformedControlFlowException(function.id(),
                        "unknown statement " + stmt.getClass().getSimpleName(), stmt.location());
            }
        }

        void ifStatement(IfStmt s) {
            current.add(s);
            BasicBlock thenEntry = newBlock();
            BasicBlock elseEntry = s.elseBranch() != null ? newBlock() : null;
            BasicBlock merge = newBlock();
            condition(s.condition(), thenEntry, elseEntry != null ? elseEntry : merge);
            current = thenEntry;
            statement(s.thenBranch());
            flowInto(merge);
            if (elseEntry != null) {
                current = elseEntry;
                statement(s.elseBranch());
                flowInto(merge);
            }
            current = merge;
        }

        void whileLoop(WhileStmt s, String label) {
            BasicBlock header = newBlock();
            flowInto(header);
            header.add(s);
            BasicBlock body = newBlock();
            BasicBlock exit = newBlock();
            pushScope(ScopeKind.LOOP, label, exit, header);
            current = header;
            condition(s.condition(), body, exit);
            current = body;
            statement(s.body());
            loopBack(header);
            popScope();
            current = exit;
        }

        void doWhileLoop(DoWhileStmt s, String label) {
            BasicBlock body = newBlock();
            flowInto(body);
            BasicBlock check = newBlock();
            BasicBlock exit = newBlock();
            pushScope(ScopeKind.LOOP, label, exit, check);
            current = body;
            body.add(s);
            statement(s.body());
            flowInto(check);
            current = check;
            check.add(s.condition());
            condition(s.condition(), body, exit);
            popScope();
            current = exit;
        }

        void forLoop(ForStmt s, String label) {
            current.add(s);
            statements(s.initializers());
            BasicBlock header = newBlock();
            flowInto(header);
            BasicBlock body = newBlock();
            BasicBlock update = newBlock();
            BasicBlock exit = newBlock();
            pushScope(ScopeKind.LOOP, label, exit, update);
            current = header;
            if (s.condition() == null) {
                header.terminate(TerminatorKind.BRANCH);
                connect(header, body, EdgeKind.TRUE_BRANCH);
            } else {
                header.add(s.condition());
                condition(s.condition(), body, exit);
            }
            current = body;
            statement(s.body());
            flowInto(update);
            current = update;
            for (Expr u : s.updates()) {
                current.add(u);
                value(u);
            }
            loopBack(header);
            popScope();
            current = exit;
        }

        void forEachLoop(ForEachStmt s, String label) {
            current.add(s);
            value(s.iterable());
            BasicBlock header = newBlock();
            flowInto(header);
            BasicBlock body = newBlock();
            BasicBlock exit = newBlock();
            pushScope(ScopeKind.LOOP, label, exit, header);
            branch(header, body, exit);
            current = body;
            statement(s.body());
            loopBack(header);
            popScope();
            current = exit;
        }

        void switchBody(List<SwitchCase> cases, boolean fallsThrough, ScopeKind kind, String label) {
            BasicBlock dispatch = current;
            BasicBlock exit = newBlock();
            List<BasicBlock> entries = new ArrayList<>();
            for (int i = 0; i < cases.size(); i++) {
                entries.add(newBlock());
            }
            dispatch.terminate(TerminatorKind.BRANCH);
            boolean hasDefault = false;
            for (int i = 0; i < cases.size(); i++) {
                boolean isDefault = cases.get(i).isDefault();
                connect(dispatch, entries.get(i), isDefault ? EdgeKind.FALSE_BRANCH : EdgeKind.TRUE_BRANCH);
                hasDefault |= isDefault;
            }
            if (!hasDefault) {
                connect(dispatch, exit, EdgeKind.FALSE_BRANCH);
            }
            pushScope(kind, label, exit, null);
            for (int i = 0; i < cases.size(); i++) {
                SwitchCase c = cases.get(i);
                current = entries.get(i);
                current.add(c);
                for (Expr l : c.labels()) {
                    value(l);
                }
                statements(c.body());
                if (fallsThrough && i + 1 < cases.size()) {
                    flowInto(entries.get(i + 1));
                } else {
                    flowInto(exit);
                }
            }
            popScope();
            current = exit;
        }

        void labeled(LabeledStmt s) {
            Stmt body = s.body();
            if (body instanceof WhileStmt || body instanceof DoWhileStmt || body instanceof ForStmt
                    || body instanceof ForEachStmt || body instanceof SwitchStmt) {
                pendingLabel = s.label();
                statement(body);
                return;
            }
            BasicBlock after = newBlock();
            pushScope(ScopeKind.LABEL, s.label(), after, null);
            statement(body);
            flowInto(after);
            popScope();
            current = after;
        }

        void tryStatement(TryStmt s) {
            current.add(s);
            HandlerFrame outer = handler;
            FinallyFrame outerFinally = finallyFrame;
            BasicBlock after = newBlock();

            FinallyFrame ff = null;
            if (s.finallyBlock() != null) {
                ff = new FinallyFrame(newBlock(), outerFinally, outer);
            }
            HandlerFrame catchFrame = ff != null ? new HandlerFrame(List.of(ff.entry), null) : outer;
            handler = catchFrame;
            List<BasicBlock> catchEntries = new ArrayList<>();
            for (int i = 0; i < s.catches().size(); i++) {
                catchEntries.add(newBlock());
            }
            List<BasicBlock> handlerTargets = new ArrayList<>(catchEntries);
            if (ff != null) {
                handlerTargets.add(ff.entry);
                finallyFrame = ff;
            }
            handler = new HandlerFrame(handlerTargets, ff != null ? null : outer);

            BasicBlock tryEntry = newBlock();
            flowInto(tryEntry);
            current = tryEntry;
            for (Expr resource : s.resources()) {
                current.add(resource);
                value(resource);
            }
            statement(s.body());
            List<BasicBlock> normalExits = new ArrayList<>();
            normalExits.add(current);

            handler = catchFrame;
            for (int i = 0; i < s.catches().size(); i++) {
                CatchClause clause = s.catches().get(i);
                current = catchEntries.get(i);
                current.add(clause);
                statement(clause.body());
                normalExits.add(current);
            }

            handler = outer;
            finallyFrame = outerFinally;
            if (ff == null) {
                for (BasicBlock exit : normalExits) {
                    current = exit;
                    flowInto(after);
                }
            } else {
                List<BasicBlock> completing = new ArrayList<>();
                for (BasicBlock exit : normalExits) {
                    if (exit.isOpen()) {
                        current = exit;
                        flowInto(ff.entry);
                        completing.add(exit);
                    }
                }
                current = ff.entry;
                current.add(s.finallyBlock());
                statement(s.finallyBlock());
                BasicBlock tail = current;
                if (tail.isOpen()) {
                    if (!completing.isEmpty()) {
                        connectGuarded(tail, after, EdgeKind.SEQUENTIAL, completing);
                    }
                    for (PendingJump pending : ff.pending) {
                        dispatch(tail, pending.jump(), pending.origin());
                    }
                    tail.terminate(finallyTerminator(tail));
                    ff.tail = tail;
                    completedFinallies.add(ff);
                }
            }
            current = after;
        }

        TerminatorKind finallyTerminator(BasicBlock tail) {
            int successors = tail.successors().size();
            if (successors == 0) {
                return tail.exitsFunction() ? TerminatorKind.RETURN : TerminatorKind.RAISE;
            }
            if (successors == 1 && !tail.exitsFunction()) {
                return TerminatorKind.FALLTHROUGH;
            }
            return TerminatorKind.BRANCH;
        }

        // --- jumps ---

        void jump(Jump jump, TerminatorKind terminator) {
            BasicBlock from = current;
            dispatch(from, jump, from);
            from.terminate(terminator);
            current = newBlock();
        }

        /**
         * Routes a jump from {@code from}, passing through the innermost finally block when the
         * target lies outside it. Edges added on behalf of another block are guarded by it.
         */
        void dispatch(BasicBlock from, Jump jump, BasicBlock origin) {
            List<BasicBlock> guards = from == origin ? List.of() : List.of(origin);
            if (finallyDepth() > jump.finallyDepth()) {
                connectGuarded(from, finallyFrame.entry, EdgeKind.SEQUENTIAL, guards);
                finallyFrame.pending.add(new PendingJump(jump, origin));
                return;
            }
            if (jump.kind() == JumpKind.RETURN) {
                if (from != origin) {
                    from.addExitGuard(origin);
                }
                from.markExits();
            } else {
                connectGuarded(from, jump.target(), EdgeKind.SEQUENTIAL, guards);
            }
        }

        JumpScope findBreakTarget(BreakStmt s) {
            for (JumpScope js = scope; js != null; js = js.parent) {
                if (s.label() == null) {
                    if (js.kind == ScopeKind.SWITCH_EXPRESSION) break;
                    if (js.kind == ScopeKind.LOOP || js.kind == ScopeKind.SWITCH) return js;
                } else if (s.label().equals(js.label)) {
                    return js;
                }
            }
            throw new MalformedControlFlowException(function.id(),
                    "break without target" + (s.label() != null ? " '" + s.label() + "'" : ""), s.location());
        }

        JumpScope findContinueTarget(ContinueStmt s) {
            for (JumpScope js = scope; js != null; js = js.parent) {
                if (js.kind == ScopeKind.SWITCH_EXPRESSION) break;
                if (js.kind == ScopeKind.LOOP && (s.label() == null || s.label().equals(js.label))) {
                    return js;
                }
            }
            throw new MalformedControlFlowException(function.id(),
                    "continue without enclosing loop" + (s.label() != null ? " '" + s.label() + "'" : ""), s.location());
        }

        JumpScope findYieldTarget(YieldStmt s) {
            for (JumpScope js = scope; js != null; js = js.parent) {
                if (js.kind == ScopeKind.SWITCH_EXPRESSION) return js;
            }
            throw new MalformedControlFlowException(function.id(), "yield outside switch expression", s.location());
        }

        // --- expressions ---

        /** Evaluates {@code e} for its effects, leaving {@code current} at the block after it. */
        void value(Expr e) {
            if (e == null) return;
            if (e instanceof CallExpr c) {
                for (Expr operand : c.operands()) {
                    value(operand);
                }
                invocation(c);
            } else if (e instanceof FunctionRefExpr r) {
                cfg.addCallSite(current, r, r.target(), r.name(), -1, CallSiteKind.REFERENCE);
            } else if (e instanceof LogicalExpr l) {
                BasicBlock right = newBlock();
                BasicBlock merge = newBlock();
                if (l.op() == LogicalOp.AND) {
                    condition(l.left(), right, merge);
                } else {
                    condition(l.left(), merge, right);
                }
                current = right;
                current.add(l.right());
                value(l.right());
                flowInto(merge);
                current = merge;
            } else if (e instanceof NotExpr n) {
                value(n.operand());
            } else if (e instanceof ConditionalExpr c) {
                BasicBlock whenTrue = newBlock();
                BasicBlock whenFalse = newBlock();
                BasicBlock merge = newBlock();
                condition(c.condition(), whenTrue, whenFalse);
                current = whenTrue;
                current.add(c.whenTrue());
                value(c.whenTrue());
                flowInto(merge);
                current = whenFalse;
                current.add(c.whenFalse());
                value(c.whenFalse());
                flowInto(merge);
                current = merge;
            } else if (e instanceof SwitchExpr s) {
                value(s.selector());
                switchBody(s.cases(), s.fallsThrough(), ScopeKind.SWITCH_EXPRESSION, null);
            } else if (e instanceof CompoundExpr c) {
                for (Expr operand : c.operands()) {
                    value(operand);
                }
                if (c.mayRaise()) {
                    current.markCanRaise();
                }
            }
        }

        void invocation(CallExpr c) {
            cfg.addCallSite(current, c, c.target(), c.name(), c.argumentCount(),
                    c.dynamic() ? CallSiteKind.DYNAMIC : CallSiteKind.INVOCATION);
            current.markCanRaise();
            BasicBlock next = newBlock();
            connect(current, next, EdgeKind.RETURN_TO_CALLER);
            current.terminate(TerminatorKind.FALLTHROUGH);
            current = next;
        }

        /**
         * Evaluates {@code e} as a branch condition, ending in edges to {@code whenTrue} and
         * {@code whenFalse}. The caller repositions {@code current} afterwards.
         */
        void condition(Expr e, BasicBlock whenTrue, BasicBlock whenFalse) {
            if (e instanceof BoolLiteral b) {
                current.terminate(TerminatorKind.BRANCH);
                if (b.value()) {
                    connect(current, whenTrue, EdgeKind.TRUE_BRANCH);
                } else {
                    connect(current, whenFalse, EdgeKind.FALSE_BRANCH);
                }
            } else if (e instanceof NotExpr n) {
                condition(n.operand(), whenFalse, whenTrue);
            } else if (e instanceof LogicalExpr l) {
                BasicBlock right = newBlock();
                if (l.op() == LogicalOp.AND) {
                    condition(l.left(), right, whenFalse);
                } else {
                    condition(l.left(), whenTrue, right);
                }
                current = right;
                current.add(l.right());
                condition(l.right(), whenTrue, whenFalse);
            } else if (e instanceof ConditionalExpr c) {
                BasicBlock first = newBlock();
                BasicBlock second = newBlock();
                condition(c.condition(), first, second);
                current = first;
                current.add(c.whenTrue());
                condition(c.whenTrue(), whenTrue, whenFalse);
                current = second;
                current.add(c.whenFalse());
                condition(c.whenFalse(), whenTrue, whenFalse);
            } else {
                value(e);
                branch(current, whenTrue, whenFalse);
            }
        }

        // --- exceptions ---

        void addExceptionEdges() {
            for (BasicBlock block : new ArrayList<>(cfg.blocks())) {
                HandlerFrame frame = frames.get(block);
                if (!block.canRaise()) continue;
                for (HandlerFrame f = frame; f != null; f = f.parent()) {
                    for (BasicBlock target : f.targets()) {
                        connect(block, target, EdgeKind.EXCEPTION);
                    }
                }
            }
            // a finally block entered by an exception re-raises it to the enclosing handlers
            for (FinallyFrame ff : completedFinallies) {
                if (ff.outerHandler == null) continue;
                List<BasicBlock> raisers = new ArrayList<>();
                for (Edge in : ff.entry.predecessors()) {
                    if (in.kind() == EdgeKind.EXCEPTION) raisers.add(in.from());
                }
                if (raisers.isEmpty()) continue;
                for (BasicBlock target : ff.outerHandler.targets()) {
                    connectGuarded(ff.tail, target, EdgeKind.EXCEPTION, raisers);
                }
            }
        }
    }
}
