package com.reachscan.adapter.static_analysis;

import com.reachscan.adapter.ast.Ast;
import com.reachscan.adapter.ast.FunctionDecl;
import com.reachscan.adapter.ast.FunctionTrait;
import com.reachscan.adapter.ast.SourceLocation;
import com.reachscan.adapter.ast.Visibility;
import org.eclipse.jdt.core.dom.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * ASTVisitor that turns every method, constructor, lambda and initializer of a compilation unit
 * into a FunctionDecl with its lowered body.
 *
 * Static field initializers and static blocks form one {@code <clinit>} function per type; instance
 * field initializers and instance blocks form {@code <fields>}, referenced from every constructor.
 * Classes without a constructor get their default one.
 */
public class FunctionExtractor extends ASTVisitor {

    private static final Set<String> TEST_ANNOTATIONS = Set.of(
        "Test", "ParameterizedTest", "RepeatedTest", "TestFactory", "TestTemplate",
        "BeforeEach", "AfterEach", "BeforeAll", "AfterAll", "Before", "After", "BeforeClass", "AfterClass"
    );

    private final String unitPath;
    private final DeclarationIds ids;
    private final StatementLowering lowering;
    private final List<FunctionDecl> functions = new ArrayList<>();
    private final Deque<TypeContext> types = new ArrayDeque<>();

    private record TypeContext(String id, boolean exported, boolean hasInstanceInit) {}

    public FunctionExtractor(String unitPath, CompilationUnit cu) {
        this.unitPath = unitPath;
        this.ids = new DeclarationIds(cu);
        this.lowering = new StatementLowering(cu, ids);
    }

    public List<FunctionDecl> getFunctions() { return functions; }

    // --- Type declarations ---

    @Override
    public boolean visit(TypeDeclaration node) {
        enterType(node, node.bodyDeclarations());
        if (!node.isInterface() && !declaresConstructor(node)) {
            defaultConstructor(node);
        }
        return true;
    }

    @Override
    public void endVisit(TypeDeclaration node) { types.pop(); }

    @Override
    public boolean visit(EnumDeclaration node) {
        enterType(node, node.bodyDeclarations());
        return true;
    }

    @Override
    public void endVisit(EnumDeclaration node) { types.pop(); }

    @Override
    public boolean visit(RecordDeclaration node) {
        enterType(node, node.bodyDeclarations());
        return true;
    }

    @Override
    public void endVisit(RecordDeclaration node) { types.pop(); }

    @Override
    public boolean visit(AnnotationTypeDeclaration node) {
        enterType(node, node.bodyDeclarations());
        return true;
    }

    @Override
    public void endVisit(AnnotationTypeDeclaration node) { types.pop(); }

    @Override
    public boolean visit(AnonymousClassDeclaration node) {
        enterType(node, node.bodyDeclarations());
        return true;
    }

    @Override
    public void endVisit(AnonymousClassDeclaration node) { types.pop(); }

    // --- Functions ---

    @Override
    public boolean visit(MethodDeclaration node) {
        TypeContext type = types.peek();
        IMethodBinding binding = node.resolveBinding();
        String id = ids.methodId(node);

        List<Ast.Stmt> body = new ArrayList<>();
        if (node.isConstructor() && !delegatesExplicitly(node)) {
            Ast.Stmt superCall = binding != null ? implicitSuperCall(binding.getDeclaringClass(), node.getName()) : null;
            if (superCall != null) body.add(superCall);
        }
        if (node.isConstructor() && type.hasInstanceInit()) {
            body.add(instanceInitRef(type, node));
        }
        if (node.getBody() != null) {
            body.addAll(lowering.statements(node.getBody().statements()));
        }

        Set<FunctionTrait> traits = EnumSet.noneOf(FunctionTrait.class);
        if (node.getBody() == null) traits.add(FunctionTrait.ABSTRACT);
        if (isMain(node)) traits.add(FunctionTrait.MAIN);
        if (isTest(node.modifiers())) traits.add(FunctionTrait.TEST);

        List<String> overrides = new ArrayList<>();
        if (binding != null && !node.isConstructor() && !Modifier.isStatic(node.getModifiers())) {
            if (collectOverrides(binding, overrides)) traits.add(FunctionTrait.OVERRIDES_EXTERNAL);
        } else if (hasAnnotation(node.modifiers(), "Override")) {
            traits.add(FunctionTrait.OVERRIDES_EXTERNAL);
        }

        boolean exported = type.exported() && (isPublic(node) || isInterfaceMember(node));
        functions.add(new FunctionDecl(
            id,
            node.isConstructor() ? SymbolIdGenerator.CONSTRUCTOR : node.getName().getIdentifier(),
            unitPath,
            type.id(),
            exported ? Visibility.EXPORTED : Visibility.INTERNAL,
            node.parameters().size(),
            lowering.loc(node.getName()),
            body,
            traits,
            overrides
        ));
        return true;
    }

    @Override
    public boolean visit(LambdaExpression node) {
        String id = ids.lambdaId(node);
        List<Ast.Stmt> body;
        if (node.getBody() instanceof Block block) {
            body = lowering.statements(block.statements());
        } else {
            Expression expr = (Expression) node.getBody();
            body = List.of(new Ast.ReturnStmt(lowering.expression(expr), lowering.loc(expr)));
        }
        String typeId = ids.typeId(DeclarationIds.enclosingType(node));
        String name = id.substring(id.lastIndexOf("::") + 2, id.length() - 2);
        functions.add(new FunctionDecl(id, name, unitPath, typeId, Visibility.INTERNAL,
            node.parameters().size(), lowering.loc(node), body, Set.of(FunctionTrait.SYNTHETIC), List.of()));
        return true;
    }

    // --- Helpers ---

    private void enterType(ASTNode node, List<?> bodyDeclarations) {
        String typeId = ids.typeId(node);
        TypeContext outer = types.peek();
        boolean exported = node instanceof AbstractTypeDeclaration decl
            && (outer == null || outer.exported())
            && (Modifier.isPublic(decl.getModifiers()) || isInterfaceMember(decl))
            && !(decl.getParent() instanceof TypeDeclarationStatement);
        boolean hasInstanceInit = DeclarationIds.hasInitializers(bodyDeclarations, false);
        TypeContext type = new TypeContext(typeId, exported, hasInstanceInit);
        types.push(type);

        if (DeclarationIds.hasInitializers(bodyDeclarations, true) || node instanceof EnumDeclaration) {
            List<Ast.Stmt> body = initializerBody(node, bodyDeclarations, true);
            if (!body.isEmpty()) {
                addSynthetic(type, SymbolIdGenerator.STATIC_INIT, node, body, FunctionTrait.STATIC_INITIALIZER);
            }
        }
        if (hasInstanceInit) {
            addSynthetic(type, SymbolIdGenerator.INSTANCE_INIT, node,
                initializerBody(node, bodyDeclarations, false), FunctionTrait.SYNTHETIC);
        }
    }

    private List<Ast.Stmt> initializerBody(ASTNode type, List<?> bodyDeclarations, boolean statics) {
        List<Ast.Stmt> body = new ArrayList<>();
        if (statics && type instanceof EnumDeclaration e) {
            for (Object o : e.enumConstants()) {
                body.add(enumConstant((EnumConstantDeclaration) o));
            }
        }
        for (Object o : bodyDeclarations) {
            BodyDeclaration decl = (BodyDeclaration) o;
            if (DeclarationIds.isStatic(decl) != statics) continue;
            if (decl instanceof Initializer init) {
                body.add(lowering.block(init.getBody()));
            } else if (decl instanceof FieldDeclaration field) {
                for (Object f : field.fragments()) {
                    VariableDeclarationFragment fragment = (VariableDeclarationFragment) f;
                    if (fragment.getInitializer() != null) {
                        body.add(new Ast.LocalStmt(fragment.getName().getIdentifier(),
                            lowering.expression(fragment.getInitializer()), lowering.loc(fragment)));
                    }
                }
            }
        }
        return body;
    }

    private Ast.Stmt enumConstant(EnumConstantDeclaration constant) {
        SourceLocation at = lowering.loc(constant);
        IMethodBinding ctor = constant.resolveConstructorBinding();
        List<Ast.Expr> parts = new ArrayList<>();
        parts.add(new Ast.CallExpr(ctor != null ? SymbolIdGenerator.forMethodBinding(ctor) : null,
            SymbolIdGenerator.CONSTRUCTOR, constant.arguments().size(),
            lowering.expressions(constant.arguments()), false, at));
        AnonymousClassDeclaration body = constant.getAnonymousClassDeclaration();
        if (body != null) {
            for (Object o : body.bodyDeclarations()) {
                if (o instanceof MethodDeclaration m) {
                    parts.add(new Ast.FunctionRefExpr(ids.methodId(m), m.getName().getIdentifier(), lowering.loc(m)));
                }
            }
        }
        return new Ast.LocalStmt(constant.getName().getIdentifier(), new Ast.CompoundExpr("enum-constant", parts, true, at), at);
    }

    private void defaultConstructor(TypeDeclaration node) {
        TypeContext type = types.peek();
        List<Ast.Stmt> body = new ArrayList<>();
        Ast.Stmt superCall = implicitSuperCall(node.resolveBinding(), node.getName());
        if (superCall != null) body.add(superCall);
        if (type.hasInstanceInit()) {
            body.add(instanceInitRef(type, node));
        }
        Visibility visibility = type.exported() && Modifier.isPublic(node.getModifiers())
            ? Visibility.EXPORTED : Visibility.INTERNAL;
        functions.add(new FunctionDecl(SymbolIdGenerator.forMember(type.id(), SymbolIdGenerator.CONSTRUCTOR),
            SymbolIdGenerator.CONSTRUCTOR, unitPath, type.id(), visibility, 0, lowering.loc(node.getName()),
            body, Set.of(FunctionTrait.SYNTHETIC), List.of()));
    }

    private void addSynthetic(TypeContext type, String member, ASTNode node, List<Ast.Stmt> body, FunctionTrait trait) {
        functions.add(new FunctionDecl(SymbolIdGenerator.forMember(type.id(), member), member, unitPath,
            type.id(), Visibility.INTERNAL, 0, lowering.loc(node), body, Set.of(trait), List.of()));
    }

    /**
     * The {@code super()} call a constructor runs when it starts with neither {@code this(...)}
     * nor {@code super(...)}. Null when the superclass is not part of the program.
     */
    private Ast.Stmt implicitSuperCall(ITypeBinding type, ASTNode at) {
        if (type == null || type.getSuperclass() == null) return null;
        ITypeBinding superclass = type.getSuperclass().getTypeDeclaration();
        if (!superclass.isFromSource()) return null;

        String target = null;
        boolean declaresAny = false;
        for (IMethodBinding m : superclass.getDeclaredMethods()) {
            if (!m.isConstructor()) continue;
            declaresAny |= !m.isDefaultConstructor();
            if (m.getParameterTypes().length == 0) {
                target = SymbolIdGenerator.forMethodBinding(m);
            }
        }
        if (target == null && declaresAny) return null;
        if (target == null) {
            target = SymbolIdGenerator.forMember(SymbolIdGenerator.forTypeBinding(superclass), SymbolIdGenerator.CONSTRUCTOR);
        }
        SourceLocation location = lowering.loc(at);
        return new Ast.ExprStmt(new Ast.CallExpr(target, SymbolIdGenerator.CONSTRUCTOR, 0, List.of(), false, location),
            location);
    }

    private static boolean delegatesExplicitly(MethodDeclaration constructor) {
        if (constructor.getBody() == null || constructor.getBody().statements().isEmpty()) return false;
        Object first = constructor.getBody().statements().get(0);
        return first instanceof ConstructorInvocation || first instanceof SuperConstructorInvocation;
    }

    private Ast.Stmt instanceInitRef(TypeContext type, ASTNode at) {
        SourceLocation location = lowering.loc(at);
        return new Ast.ExprStmt(new Ast.FunctionRefExpr(
            SymbolIdGenerator.forMember(type.id(), SymbolIdGenerator.INSTANCE_INIT),
            SymbolIdGenerator.INSTANCE_INIT, location), location);
    }

    /**
     * Adds the ids of program methods that {@code method} overrides to {@code overrides}.
     *
     * @return true if it also overrides a method declared outside the program
     */
    private boolean collectOverrides(IMethodBinding method, List<String> overrides) {
        boolean external = false;
        Set<String> seen = new HashSet<>();
        Set<ITypeBinding> supertypes = new LinkedHashSet<>();
        collectSupertypes(method.getDeclaringClass(), supertypes, seen);
        for (ITypeBinding type : supertypes) {
            for (IMethodBinding candidate : type.getDeclaredMethods()) {
                if (!candidate.isConstructor() && method.overrides(candidate)) {
                    if (type.isFromSource()) {
                        overrides.add(SymbolIdGenerator.forMethodBinding(candidate));
                    } else {
                        external = true;
                    }
                }
            }
        }
        return external;
    }

    private void collectSupertypes(ITypeBinding type, Set<ITypeBinding> out, Set<String> seen) {
        List<ITypeBinding> direct = new ArrayList<>();
        if (type.getSuperclass() != null) direct.add(type.getSuperclass());
        direct.addAll(List.of(type.getInterfaces()));
        for (ITypeBinding s : direct) {
            ITypeBinding erased = s.getErasure();
            if (seen.add(erased.getKey())) {
                out.add(erased);
                collectSupertypes(erased, out, seen);
            }
        }
    }

    private static boolean declaresConstructor(TypeDeclaration node) {
        for (MethodDeclaration m : node.getMethods()) {
            if (m.isConstructor()) return true;
        }
        return false;
    }

    private static boolean isMain(MethodDeclaration node) {
        if (!node.getName().getIdentifier().equals("main") || !Modifier.isStatic(node.getModifiers())) return false;
        if (node.parameters().size() != 1) return false;
        SingleVariableDeclaration param = (SingleVariableDeclaration) node.parameters().get(0);
        String type = param.getType().toString();
        if (type.equals("String[]") || type.equals("java.lang.String[]")) return true;
        boolean string = type.equals("String") || type.equals("java.lang.String");
        return string && (param.isVarargs() || param.getExtraDimensions() == 1);
    }

    private static boolean isTest(List<?> modifiers) {
        for (Object mod : modifiers) {
            if (mod instanceof Annotation a && TEST_ANNOTATIONS.contains(simpleName(a.getTypeName()))) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasAnnotation(List<?> modifiers, String name) {
        for (Object mod : modifiers) {
            if (mod instanceof Annotation a && simpleName(a.getTypeName()).equals(name)) return true;
        }
        return false;
    }

    private static String simpleName(Name name) {
        return name.isSimpleName() ? name.getFullyQualifiedName() : ((QualifiedName) name).getName().getIdentifier();
    }

    private static boolean isPublic(BodyDeclaration decl) {
        return Modifier.isPublic(decl.getModifiers());
    }

    /** Members of interfaces and annotation types are public unless declared private. */
    private static boolean isInterfaceMember(BodyDeclaration decl) {
        ASTNode parent = decl.getParent();
        boolean inInterface = parent instanceof TypeDeclaration t && t.isInterface()
            || parent instanceof AnnotationTypeDeclaration;
        return inInterface && !Modifier.isPrivate(decl.getModifiers());
    }
}
