package com.raditha.usage.extraction;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.resolution.MethodUsage;
import com.github.javaparser.resolution.declarations.ResolvedReferenceTypeDeclaration;
import com.github.javaparser.resolution.types.ResolvedReferenceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a method's signature is dictated from outside, in which case its
 * parameters cannot be removed even when the body ignores them.
 */
public class ContractDetector {

    private static final Logger logger = LoggerFactory.getLogger(ContractDetector.class);

    /**
     * Overridable methods of {@code java.lang.Object}, by name and arity.
     */
    private static final Map<String, Integer> OBJECT_METHODS = Map.of(
            "equals", 1,
            "hashCode", 0,
            "toString", 0,
            "clone", 0,
            "finalize", 0);

    private final SymbolResolution symbols;

    public ContractDetector(SymbolResolution symbols) {
        this.symbols = symbols;
    }

    /**
     * True if the method overrides or implements a supertype method, belongs to an
     * interface, or is declared in an anonymous class or enum constant body.
     * When the supertypes cannot be resolved a method of a type that has supertypes is
     * assumed to be bound.
     */
    public boolean isContractBound(MethodDeclaration method) {
        if (method.getAnnotationByName("Override").isPresent()) {
            return true;
        }
        if (method.isStatic() || method.isPrivate()) {
            return false;
        }
        Node owner = method.getParentNode().orElse(null);
        if (owner instanceof ObjectCreationExpr || owner instanceof EnumConstantDeclaration) {
            return true;
        }
        if (owner instanceof ClassOrInterfaceDeclaration declaration && declaration.isInterface()) {
            return true;
        }
        Integer arity = OBJECT_METHODS.get(method.getNameAsString());
        if (arity != null && arity == method.getParameters().size()) {
            return true;
        }
        if (!(owner instanceof TypeDeclaration<?> type) || !hasSupertypes(type)) {
            return false;
        }
        return overridesAncestorMethod(type, method);
    }

    /**
     * True for {@code public static void main(String[])}.
     */
    public boolean isEntryPoint(MethodDeclaration method) {
        if (!method.getNameAsString().equals("main") || !method.isPublic() || !method.isStatic()
                || !method.getType().isVoidType() || method.getParameters().size() != 1) {
            return false;
        }
        var parameter = method.getParameter(0);
        String type = parameter.getType().asString();
        return (parameter.isVarArgs() && (type.equals("String") || type.equals("java.lang.String")))
                || type.equals("String[]") || type.equals("java.lang.String[]");
    }

    private boolean overridesAncestorMethod(TypeDeclaration<?> type, MethodDeclaration method) {
        String name = method.getNameAsString();
        int arity = method.getParameters().size();
        Optional<Boolean> found = symbols.attempt(type.getNameAsString() + "." + name, () -> {
            ResolvedReferenceTypeDeclaration resolved = type.resolve();
            for (ResolvedReferenceType ancestor : resolved.getAllAncestors()) {
                for (MethodUsage candidate : ancestor.getDeclaredMethods()) {
                    if (candidate.getName().equals(name) && candidate.getNoParams() == arity) {
                        return true;
                    }
                }
            }
            return false;
        });
        if (found.isEmpty()) {
            logger.debug("Ancestors of {} not resolvable, treating {} as an override", type.getNameAsString(), name);
            return true;
        }
        return found.get();
    }

    private static boolean hasSupertypes(TypeDeclaration<?> type) {
        if (type instanceof ClassOrInterfaceDeclaration classDecl) {
            return !classDecl.getExtendedTypes().isEmpty() || !classDecl.getImplementedTypes().isEmpty();
        }
        if (type instanceof EnumDeclaration enumDecl) {
            return !enumDecl.getImplementedTypes().isEmpty();
        }
        if (type instanceof RecordDeclaration recordDecl) {
            return !recordDecl.getImplementedTypes().isEmpty();
        }
        return false;
    }
}
