package com.reachscan.adapter.static_analysis;

import org.eclipse.jdt.core.dom.*;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Function and type ids for the declarations of one compilation unit. Falls back to syntactic
 * names when bindings do not resolve, and numbers lambdas per enclosing class in the order they
 * are first asked for.
 */
class DeclarationIds {

    private final CompilationUnit cu;
    private final Map<LambdaExpression, String> lambdas = new IdentityHashMap<>();
    private final Map<String, Integer> lambdaCounters = new HashMap<>();

    DeclarationIds(CompilationUnit cu) {
        this.cu = cu;
    }

    String typeId(ASTNode type) {
        if (type instanceof AbstractTypeDeclaration decl) {
            ITypeBinding binding = decl.resolveBinding();
            if (binding != null) {
                return SymbolIdGenerator.forTypeBinding(binding);
            }
            ASTNode outer = enclosingType(decl);
            if (outer != null) {
                return typeId(outer) + "." + decl.getName().getIdentifier();
            }
            PackageDeclaration pkg = cu.getPackage();
            String prefix = pkg != null ? pkg.getName().getFullyQualifiedName() + "." : "";
            return SymbolIdGenerator.forClass(prefix + decl.getName().getIdentifier());
        }
        if (type instanceof AnonymousClassDeclaration anon) {
            ITypeBinding binding = anon.resolveBinding();
            if (binding != null) {
                return SymbolIdGenerator.forTypeBinding(binding);
            }
            return typeId(enclosingType(anon)) + "$" + anon.getStartPosition();
        }
        throw new IllegalArgumentException("Not a type declaration: " + type.getClass().getSimpleName());
    }

    String methodId(MethodDeclaration method) {
        IMethodBinding binding = method.resolveBinding();
        if (binding != null) {
            return SymbolIdGenerator.forMethodBinding(binding);
        }
        String params = ((List<?>) method.parameters()).stream()
            .map(p -> parameterType((SingleVariableDeclaration) p))
            .collect(Collectors.joining(", "));
        String name = method.isConstructor() ? SymbolIdGenerator.CONSTRUCTOR : method.getName().getIdentifier();
        return typeId(enclosingType(method)) + "::" + name + "(" + params + ")";
    }

    String lambdaId(LambdaExpression lambda) {
        return lambdas.computeIfAbsent(lambda, l -> {
            String typeId = typeId(enclosingType(l));
            int index = lambdaCounters.merge(typeId, 1, Integer::sum);
            return SymbolIdGenerator.forLambda(typeId, index);
        });
    }

    /** Nearest enclosing class, interface, enum, record or anonymous class body. */
    static ASTNode enclosingType(ASTNode node) {
        ASTNode n = node.getParent();
        while (n != null && !(n instanceof AbstractTypeDeclaration) && !(n instanceof AnonymousClassDeclaration)) {
            n = n.getParent();
        }
        return n;
    }

    static boolean hasInitializers(List<?> bodyDeclarations, boolean statics) {
        for (Object o : bodyDeclarations) {
            BodyDeclaration decl = (BodyDeclaration) o;
            if (isStatic(decl) != statics) continue;
            if (decl instanceof Initializer) return true;
            if (decl instanceof FieldDeclaration field) {
                for (Object f : field.fragments()) {
                    if (((VariableDeclarationFragment) f).getInitializer() != null) return true;
                }
            }
        }
        return false;
    }

    /** Interface fields are static without saying so. */
    static boolean isStatic(BodyDeclaration decl) {
        if (Modifier.isStatic(decl.getModifiers())) return true;
        return decl instanceof FieldDeclaration
                && decl.getParent() instanceof TypeDeclaration type && type.isInterface();
    }

    private static String parameterType(SingleVariableDeclaration p) {
        String type = p.getType().toString().replaceAll("<.*>", "");
        int dot = type.lastIndexOf('.');
        if (dot >= 0) type = type.substring(dot + 1);
        return type + "[]".repeat(p.getExtraDimensions() + (p.isVarargs() ? 1 : 0));
    }
}
