package com.raditha.usage.extraction;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.github.javaparser.resolution.declarations.ResolvedValueDeclaration;
import com.github.javaparser.symbolsolver.javaparsermodel.declarations.JavaParserFieldDeclaration;
import com.raditha.usage.model.BindingKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Binds field occurrences to the keys of the fields they refer to.
 * <p>
 * Simple names and {@code this}-qualified accesses are resolved lexically. Other qualified
 * accesses, {@code super.x} included, go to the symbol solver. When it cannot resolve them
 * every same-named field of the enclosing top level type is a candidate, because a private
 * field cannot be reached from outside it.
 */
public class FieldResolver {

    private static final Logger logger = LoggerFactory.getLogger(FieldResolver.class);

    private final BindingKeys keys;
    private final LocalScopeResolver locals;
    private final SymbolResolution symbols;

    public FieldResolver(BindingKeys keys, LocalScopeResolver locals, SymbolResolution symbols) {
        this.keys = keys;
        this.locals = locals;
        this.symbols = symbols;
    }

    public FieldOccurrence resolve(Expression occurrence) {
        if (occurrence instanceof NameExpr nameExpr) {
            return resolveSimpleName(nameExpr);
        }
        if (occurrence instanceof FieldAccessExpr fieldAccess) {
            return resolveFieldAccess(fieldAccess);
        }
        return FieldOccurrence.none();
    }

    private FieldOccurrence resolveSimpleName(NameExpr nameExpr) {
        if (locals.resolve(nameExpr).isPresent()) {
            return FieldOccurrence.none();
        }
        String name = nameExpr.getNameAsString();
        Node child = nameExpr;
        Optional<Node> parent = child.getParentNode();
        while (parent.isPresent()) {
            Node scope = parent.get();
            if (LocalScopeResolver.declaresField(scope, child, name)) {
                return FieldOccurrence.exact(keys.forField(scope, name));
            }
            child = scope;
            parent = scope.getParentNode();
        }
        return FieldOccurrence.none();
    }

    private FieldOccurrence resolveFieldAccess(FieldAccessExpr fieldAccess) {
        String name = fieldAccess.getNameAsString();
        Expression scope = fieldAccess.getScope();

        if (scope instanceof ThisExpr thisExpr) {
            Optional<Node> owner = thisExpr.getTypeName()
                    .map(typeName -> enclosingTypeNamed(fieldAccess, typeName.getIdentifier()))
                    .orElseGet(() -> nearestClassBody(fieldAccess));
            return owner.filter(o -> LocalScopeResolver.declaresField(o, memberOf(o, fieldAccess), name))
                    .map(o -> FieldOccurrence.exact(keys.forField(o, name)))
                    .orElse(FieldOccurrence.none());
        }

        Optional<ResolvedValueDeclaration> resolved = symbols.attempt(fieldAccess.toString(), fieldAccess::resolve);
        if (resolved.isPresent()) {
            return keyOf(resolved.get())
                    .map(FieldOccurrence::exact)
                    .orElse(FieldOccurrence.none());
        }

        List<BindingKey> candidates = sameNamedFields(fieldAccess, name);
        if (!candidates.isEmpty()) {
            logger.debug("Unresolved access {} treated as a read of {} candidate field(s)", fieldAccess, candidates.size());
        }
        return FieldOccurrence.ambiguous(candidates);
    }

    private Optional<BindingKey> keyOf(ResolvedValueDeclaration resolved) {
        if (resolved.isField() && resolved instanceof JavaParserFieldDeclaration field) {
            return keys.forField(field.getVariableDeclarator());
        }
        return Optional.empty();
    }

    /**
     * Nearest class body, named or anonymous, that the node is a member of.
     */
    private static Optional<Node> nearestClassBody(Node node) {
        Node child = node;
        Optional<Node> parent = node.getParentNode();
        while (parent.isPresent()) {
            Node scope = parent.get();
            if (child instanceof BodyDeclaration<?> && isClassBody(scope)) {
                return Optional.of(scope);
            }
            child = scope;
            parent = scope.getParentNode();
        }
        return Optional.empty();
    }

    private static Optional<Node> enclosingTypeNamed(Node node, String simpleName) {
        Optional<Node> parent = node.getParentNode();
        while (parent.isPresent()) {
            if (parent.get() instanceof TypeDeclaration<?> type && type.getNameAsString().equals(simpleName)) {
                return parent;
            }
            parent = parent.get().getParentNode();
        }
        return Optional.empty();
    }

    private static boolean isClassBody(Node node) {
        return node instanceof TypeDeclaration<?>
                || node instanceof ObjectCreationExpr
                || node instanceof EnumConstantDeclaration;
    }

    /**
     * The direct member of the class body that contains the node.
     */
    private static Node memberOf(Node body, Node node) {
        Node current = node;
        while (current.getParentNode().isPresent() && current.getParentNode().get() != body) {
            current = current.getParentNode().get();
        }
        return current;
    }

    private List<BindingKey> sameNamedFields(Node occurrence, String name) {
        Node outermost = occurrence;
        Optional<Node> parent = occurrence.getParentNode();
        while (parent.isPresent()) {
            if (parent.get() instanceof TypeDeclaration<?>) {
                outermost = parent.get();
            }
            parent = parent.get().getParentNode();
        }
        return outermost.findAll(FieldDeclaration.class).stream()
                .flatMap(field -> field.getVariables().stream())
                .filter(v -> v.getNameAsString().equals(name))
                .map(keys::forField)
                .flatMap(Optional::stream)
                .toList();
    }
}
