package com.reachscan.adapter.static_analysis;

import org.eclipse.jdt.core.dom.IMethodBinding;
import org.eclipse.jdt.core.dom.ITypeBinding;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Generates deterministic, stable function IDs following the convention:
 *   java::<fully-qualified-class-name>                             (class/interface)
 *   java::<fully-qualified-class-name>::<method>(<param-types>)   (method/constructor)
 *   java::<fully-qualified-class-name>::lambda$<n>()              (lambda, numbered per class)
 *   java::<fully-qualified-class-name>::<clinit>()                (static initializers)
 *   java::<fully-qualified-class-name>::<fields>()                (instance initializers)
 * Parameter types are erased simple names, so generic call sites and declarations agree.
 */
public class SymbolIdGenerator {

    public static final String PREFIX = "java::";
    public static final String CONSTRUCTOR = "<init>";
    public static final String STATIC_INIT = "<clinit>";
    public static final String INSTANCE_INIT = "<fields>";

    public static String forClass(String fullyQualifiedName) {
        return PREFIX + fullyQualifiedName;
    }

    public static String forMethod(String fullyQualifiedClassName, String methodName, String[] paramSimpleTypes) {
        String params = Arrays.stream(paramSimpleTypes)
            .collect(Collectors.joining(", "));
        return PREFIX + fullyQualifiedClassName + "::" + methodName + "(" + params + ")";
    }

    /**
     * Produce ID from a resolved ITypeBinding. Anonymous and local classes use their binary name.
     */
    public static String forTypeBinding(ITypeBinding binding) {
        return PREFIX + typeName(binding);
    }

    /**
     * Produce ID from a resolved IMethodBinding; parameterized methods map to their declaration.
     */
    public static String forMethodBinding(IMethodBinding binding) {
        IMethodBinding declaration = binding.getMethodDeclaration();
        String className = typeName(declaration.getDeclaringClass());
        String methodName = declaration.isConstructor() ? CONSTRUCTOR : declaration.getName();
        String params = Arrays.stream(declaration.getParameterTypes())
            .map(t -> t.getErasure().getName())  // simple name, not fully-qualified
            .collect(Collectors.joining(", "));
        return PREFIX + className + "::" + methodName + "(" + params + ")";
    }

    public static String forMember(String typeId, String memberName) {
        return typeId + "::" + memberName + "()";
    }

    public static String forLambda(String typeId, int index) {
        return typeId + "::lambda$" + index + "()";
    }

    static String typeName(ITypeBinding binding) {
        ITypeBinding type = binding.getErasure();
        String qualified = type.getQualifiedName();
        if (qualified != null && !qualified.isEmpty()) {
            return qualified;
        }
        String binary = type.getBinaryName();
        if (binary != null) {
            return binary;
        }
        ITypeBinding outer = type.getDeclaringClass();
        return (outer != null ? typeName(outer) : "") + "$" + type.getName();
    }
}
