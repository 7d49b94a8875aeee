package com.reachscan.adapter.static_analysis;

import com.reachscan.adapter.ast.Ast;
import com.reachscan.adapter.ast.SourceLocation;
import org.eclipse.jdt.core.dom.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lowers JDT statements and expressions into the language-neutral statement tree.
 *
 * Invocations carry the callee id from the resolved binding; calls whose binding does not resolve
 * keep only their name and argument count. Lambdas, method references and anonymous class bodies
 * become function references. Boolean compile-time constants are folded into literals.
 */
class StatementLowering {

    private static final Set<String> REFLECTIVE = Set.of(
        "java.lang.reflect.Method::invoke",
        "java.lang.reflect.Constructor::newInstance",
        "java.lang.Class::newInstance",
        "java.lang.Class::forName",
        "java.lang.invoke.MethodHandle::invoke",
        "java.lang.invoke.MethodHandle::invokeExact",
        "java.lang.invoke.MethodHandle::invokeWithArguments"
    );

    private final CompilationUnit cu;
    private final DeclarationIds ids;

    StatementLowering(CompilationUnit cu, DeclarationIds ids) {
        this.cu = cu;
        this.ids = ids;
    }

    // --- Statements ---

    List<Ast.Stmt> statements(List<?> statements) {
        List<Ast.Stmt> result = new ArrayList<>();
        for (Object s : statements) {
            result.add(statement((Statement) s));
        }
        return result;
    }

    Ast.BlockStmt block(Block block) {
        return new Ast.BlockStmt(statements(block.statements()), loc(block));
    }

    Ast.Stmt statement(Statement node) {
        if (node instanceof Block b) {
            return block(b);
        }
        if (node instanceof ExpressionStatement s) {
            return new Ast.ExprStmt(expression(s.getExpression()), loc(s));
        }
        if (node instanceof VariableDeclarationStatement s) {
            return locals(s.fragments(), loc(s));
        }
        if (node instanceof IfStatement s) {
            return new Ast.IfStmt(condition(s.getExpression()), statement(s.getThenStatement()),
                s.getElseStatement() != null ? statement(s.getElseStatement()) : null, loc(s));
        }
        if (node instanceof WhileStatement s) {
            return new Ast.WhileStmt(condition(s.getExpression()), statement(s.getBody()), loc(s));
        }
        if (node instanceof DoStatement s) {
            return new Ast.DoWhileStmt(statement(s.getBody()), condition(s.getExpression()), loc(s));
        }
        if (node instanceof ForStatement s) {
            List<Ast.Stmt> init = new ArrayList<>();
            for (Object o : s.initializers()) {
                Expression e = (Expression) o;
                if (e instanceof VariableDeclarationExpression v) {
                    init.add(locals(v.fragments(), loc(v)));
                } else {
                    init.add(new Ast.ExprStmt(expression(e), loc(e)));
                }
            }
            return new Ast.ForStmt(init,
                s.getExpression() != null ? condition(s.getExpression()) : null,
                expressions(s.updaters()), statement(s.getBody()), loc(s));
        }
        if (node instanceof EnhancedForStatement s) {
            return new Ast.ForEachStmt(s.getParameter().getName().getIdentifier(),
                expression(s.getExpression()), statement(s.getBody()), loc(s));
        }
        if (node instanceof SwitchStatement s) {
            return new Ast.SwitchStmt(expression(s.getExpression()), cases(s.statements()),
                !isArrowSwitch(s.statements()), loc(s));
        }
        if (node instanceof TryStatement s) {
            List<Ast.CatchClause> catches = new ArrayList<>();
            for (Object o : s.catchClauses()) {
                CatchClause c = (CatchClause) o;
                catches.add(new Ast.CatchClause(c.getException().getType().toString(), block(c.getBody()), loc(c)));
            }
            return new Ast.TryStmt(expressions(s.resources()), block(s.getBody()), catches,
                s.getFinally() != null ? block(s.getFinally()) : null, loc(s));
        }
        if (node instanceof ThrowStatement s) {
            return new Ast.ThrowStmt(expression(s.getExpression()), loc(s));
        }
        if (node instanceof ReturnStatement s) {
            return new Ast.ReturnStmt(s.getExpression() != null ? expression(s.getExpression()) : null, loc(s));
        }
        if (node instanceof BreakStatement s) {
            return new Ast.BreakStmt(s.getLabel() != null ? s.getLabel().getIdentifier() : null, loc(s));
        }
        if (node instanceof ContinueStatement s) {
            return new Ast.ContinueStmt(s.getLabel() != null ? s.getLabel().getIdentifier() : null, loc(s));
        }
        if (node instanceof YieldStatement s) {
            return new Ast.YieldStmt(expression(s.getExpression()), loc(s));
        }
        if (node instanceof LabeledStatement s) {
            return new Ast.LabeledStmt(s.getLabel().getIdentifier(), statement(s.getBody()), loc(s));
        }
        if (node instanceof SynchronizedStatement s) {
            return new Ast.BlockStmt(List.of(
                new Ast.ExprStmt(expression(s.getExpression()), loc(s)), block(s.getBody())), loc(s));
        }
        if (node instanceof AssertStatement s) {
            List<Ast.Expr> operands = new ArrayList<>();
            operands.add(expression(s.getExpression()));
            if (s.getMessage() != null) operands.add(expression(s.getMessage()));
            return new Ast.ExprStmt(new Ast.CompoundExpr("assert", operands, true, loc(s)), loc(s));
        }
        if (node instanceof ConstructorInvocation s) {
            return new Ast.ExprStmt(invocation(s.resolveConstructorBinding(), SymbolIdGenerator.CONSTRUCTOR,
                null, s.arguments(), s), loc(s));
        }
        if (node instanceof SuperConstructorInvocation s) {
            return new Ast.ExprStmt(invocation(s.resolveConstructorBinding(), SymbolIdGenerator.CONSTRUCTOR,
                s.getExpression(), s.arguments(), s), loc(s));
        }
        if (node instanceof TypeDeclarationStatement s) {
            // local class: its methods are extracted as functions of their own
            return new Ast.LocalStmt(s.getDeclaration().getName().getIdentifier(), null, loc(s));
        }
        if (node instanceof EmptyStatement s) {
            return new Ast.BlockStmt(List.of(), loc(s));
        }
        return new Ast.UnsupportedStmt(node.getClass().getSimpleName(), loc(node));
    }

    private Ast.Stmt locals(List<?> fragments, SourceLocation location) {
        List<Ast.Stmt> locals = new ArrayList<>();
        for (Object o : fragments) {
            VariableDeclarationFragment f = (VariableDeclarationFragment) o;
            locals.add(new Ast.LocalStmt(f.getName().getIdentifier(),
                f.getInitializer() != null ? expression(f.getInitializer()) : null, loc(f)));
        }
        return locals.size() == 1 ? locals.get(0) : new Ast.BlockStmt(locals, location);
    }

    private List<Ast.SwitchCase> cases(List<?> statements) {
        List<Ast.SwitchCase> cases = new ArrayList<>();
        SwitchCase label = null;
        List<Ast.Stmt> body = new ArrayList<>();
        for (Object o : statements) {
            if (o instanceof SwitchCase next) {
                if (label != null) cases.add(switchCase(label, body));
                label = next;
                body = new ArrayList<>();
            } else {
                body.add(statement((Statement) o));
            }
        }
        if (label != null) cases.add(switchCase(label, body));
        return cases;
    }

    private Ast.SwitchCase switchCase(SwitchCase label, List<Ast.Stmt> body) {
        return new Ast.SwitchCase(expressions(label.expressions()), label.isDefault(), body, loc(label));
    }

    private static boolean isArrowSwitch(List<?> statements) {
        for (Object o : statements) {
            if (o instanceof SwitchCase c) return c.isSwitchLabeledRule();
        }
        return false;
    }

    // --- Expressions ---

    List<Ast.Expr> expressions(List<?> expressions) {
        List<Ast.Expr> result = new ArrayList<>();
        for (Object e : expressions) {
            result.add(expression((Expression) e));
        }
        return result;
    }

    /** A branch condition: boolean constants fold to literals. */
    Ast.Expr condition(Expression e) {
        Object constant = e.resolveConstantExpressionValue();
        if (constant instanceof Boolean value) {
            return new Ast.BoolLiteral(value, loc(e));
        }
        return expression(e);
    }

    Ast.Expr expression(Expression e) {
        SourceLocation at = loc(e);
        if (e instanceof ParenthesizedExpression p) {
            return expression(p.getExpression());
        }
        if (e instanceof BooleanLiteral b) {
            return new Ast.BoolLiteral(b.booleanValue(), at);
        }
        if (e instanceof MethodInvocation m) {
            return invocation(m.resolveMethodBinding(), m.getName().getIdentifier(), m.getExpression(), m.arguments(), m);
        }
        if (e instanceof SuperMethodInvocation m) {
            return invocation(m.resolveMethodBinding(), m.getName().getIdentifier(), null, m.arguments(), m);
        }
        if (e instanceof ClassInstanceCreation c) {
            return creation(c);
        }
        if (e instanceof LambdaExpression l) {
            String id = ids.lambdaId(l);
            return new Ast.FunctionRefExpr(id, simpleName(id), at);
        }
        if (e instanceof MethodReference r) {
            return methodReference(r);
        }
        if (e instanceof InfixExpression i) {
            return infix(i);
        }
        if (e instanceof PrefixExpression p && p.getOperator() == PrefixExpression.Operator.NOT) {
            return new Ast.NotExpr(condition(p.getOperand()), at);
        }
        if (e instanceof ConditionalExpression c) {
            return new Ast.ConditionalExpr(condition(c.getExpression()),
                expression(c.getThenExpression()), expression(c.getElseExpression()), at);
        }
        if (e instanceof SwitchExpression s) {
            return new Ast.SwitchExpr(expression(s.getExpression()), cases(s.statements()),
                !isArrowSwitch(s.statements()), at);
        }
        if (e instanceof VariableDeclarationExpression v) {
            List<Ast.Expr> inits = new ArrayList<>();
            for (Object o : v.fragments()) {
                Expression init = ((VariableDeclarationFragment) o).getInitializer();
                if (init != null) inits.add(expression(init));
            }
            return new Ast.CompoundExpr("declaration", inits, false, at);
        }
        return generic(e, at);
    }

    private Ast.Expr invocation(IMethodBinding binding, String name, Expression receiver, List<?> arguments, ASTNode node) {
        List<Ast.Expr> operands = new ArrayList<>();
        if (receiver != null) operands.add(expression(receiver));
        operands.addAll(expressions(arguments));
        String target = binding != null ? SymbolIdGenerator.forMethodBinding(binding) : null;
        return new Ast.CallExpr(target, name, arguments.size(), operands, isReflective(binding), loc(node));
    }

    private Ast.Expr creation(ClassInstanceCreation c) {
        AnonymousClassDeclaration anon = c.getAnonymousClassDeclaration();
        if (anon == null) {
            return invocation(c.resolveConstructorBinding(), SymbolIdGenerator.CONSTRUCTOR,
                c.getExpression(), c.arguments(), c);
        }
        // the anonymous class runs its superclass constructor, then its own field initializers;
        // its methods are reachable through the created object
        List<Ast.Expr> parts = new ArrayList<>();
        IMethodBinding superCtor = superConstructor(anon, c.arguments().size());
        if (superCtor != null) {
            parts.add(invocation(superCtor, SymbolIdGenerator.CONSTRUCTOR, c.getExpression(), c.arguments(), c));
        } else {
            parts.addAll(expressions(c.arguments()));
        }
        String typeId = ids.typeId(anon);
        if (DeclarationIds.hasInitializers(anon.bodyDeclarations(), false)) {
            parts.add(new Ast.FunctionRefExpr(SymbolIdGenerator.forMember(typeId, SymbolIdGenerator.INSTANCE_INIT),
                SymbolIdGenerator.INSTANCE_INIT, loc(anon)));
        }
        for (Object o : anon.bodyDeclarations()) {
            if (o instanceof MethodDeclaration m) {
                parts.add(new Ast.FunctionRefExpr(ids.methodId(m), m.getName().getIdentifier(), loc(m)));
            }
        }
        return new Ast.CompoundExpr("new", parts, true, loc(c));
    }

    private static IMethodBinding superConstructor(AnonymousClassDeclaration anon, int arguments) {
        ITypeBinding type = anon.resolveBinding();
        if (type == null || type.getSuperclass() == null) return null;
        IMethodBinding match = null;
        for (IMethodBinding m : type.getSuperclass().getDeclaredMethods()) {
            if (m.isConstructor() && m.getParameterTypes().length == arguments) {
                if (match != null) return null;
                match = m;
            }
        }
        return match;
    }

    private Ast.Expr methodReference(MethodReference r) {
        IMethodBinding binding = r.resolveMethodBinding();
        String name;
        if (r instanceof ExpressionMethodReference m) name = m.getName().getIdentifier();
        else if (r instanceof TypeMethodReference m) name = m.getName().getIdentifier();
        else if (r instanceof SuperMethodReference m) name = m.getName().getIdentifier();
        else name = SymbolIdGenerator.CONSTRUCTOR;
        return new Ast.FunctionRefExpr(binding != null ? SymbolIdGenerator.forMethodBinding(binding) : null, name, loc(r));
    }

    private Ast.Expr infix(InfixExpression i) {
        SourceLocation at = loc(i);
        InfixExpression.Operator op = i.getOperator();
        List<Expression> operands = new ArrayList<>();
        operands.add(i.getLeftOperand());
        operands.add(i.getRightOperand());
        for (Object o : i.extendedOperands()) operands.add((Expression) o);

        if (op == InfixExpression.Operator.CONDITIONAL_AND || op == InfixExpression.Operator.CONDITIONAL_OR) {
            Ast.LogicalOp logical = op == InfixExpression.Operator.CONDITIONAL_AND ? Ast.LogicalOp.AND : Ast.LogicalOp.OR;
            Ast.Expr result = condition(operands.get(0));
            for (int k = 1; k < operands.size(); k++) {
                result = new Ast.LogicalExpr(logical, result, condition(operands.get(k)), at);
            }
            return result;
        }
        boolean mayRaise = op == InfixExpression.Operator.DIVIDE || op == InfixExpression.Operator.REMAINDER;
        List<Ast.Expr> lowered = new ArrayList<>();
        for (Expression operand : operands) lowered.add(expression(operand));
        return new Ast.CompoundExpr(op.toString(), lowered, mayRaise, at);
    }

    /** Any other expression: lower its expression children in source order. */
    private Ast.Expr generic(Expression e, SourceLocation at) {
        List<Ast.Expr> children = new ArrayList<>();
        for (Object p : e.structuralPropertiesForType()) {
            StructuralPropertyDescriptor property = (StructuralPropertyDescriptor) p;
            Object value = e.getStructuralProperty(property);
            if (property.isChildProperty() && value instanceof Expression child) {
                children.add(expression(child));
            } else if (property.isChildListProperty()) {
                for (Object element : (List<?>) value) {
                    if (element instanceof Expression child) children.add(expression(child));
                }
            }
        }
        boolean unboxes = e.resolveUnboxing();
        if (children.isEmpty()) {
            Ast.Expr leaf = new Ast.LeafExpr(abbreviate(e.toString()), at);
            return unboxes ? new Ast.CompoundExpr("unboxing", List.of(leaf), true, at) : leaf;
        }
        boolean mayRaise = unboxes || dereferencesInstance(e)
            || e instanceof CastExpression || e instanceof ArrayAccess || e instanceof ArrayCreation;
        return new Ast.CompoundExpr(e.getClass().getSimpleName(), children, mayRaise, at);
    }

    /** {@code obj.field} on an instance field throws when {@code obj} is null; {@code this.field} cannot. */
    private static boolean dereferencesInstance(Expression e) {
        IBinding binding;
        if (e instanceof FieldAccess f) {
            if (f.getExpression() instanceof ThisExpression) return false;
            binding = f.resolveFieldBinding();
        } else if (e instanceof QualifiedName q) {
            binding = q.resolveBinding();
        } else {
            return false;
        }
        return binding instanceof IVariableBinding field && field.isField() && !Modifier.isStatic(field.getModifiers());
    }

    private static boolean isReflective(IMethodBinding binding) {
        if (binding == null || binding.getDeclaringClass() == null) return false;
        String key = binding.getDeclaringClass().getErasure().getQualifiedName() + "::" + binding.getName();
        return REFLECTIVE.contains(key);
    }

    private static String simpleName(String id) {
        int sep = id.lastIndexOf("::");
        int paren = id.indexOf('(', sep);
        return id.substring(sep + 2, paren < 0 ? id.length() : paren);
    }

    private static String abbreviate(String text) {
        return text.length() <= 40 ? text : text.substring(0, 37) + "...";
    }

    SourceLocation loc(ASTNode node) {
        int start = node.getStartPosition();
        int line = cu.getLineNumber(start);
        if (line < 1) return SourceLocation.UNKNOWN;
        int endLine = cu.getLineNumber(start + Math.max(node.getLength() - 1, 0));
        return new SourceLocation(line, cu.getColumnNumber(start) + 1, Math.max(endLine, line));
    }
}
