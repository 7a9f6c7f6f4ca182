package com.raditha.usage.extraction;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.raditha.usage.model.BindingKey;
import com.raditha.usage.model.Range;

import java.util.Optional;

/**
 * Builds the {@link BindingKey}s that connect declarations with their occurrences.
 * <p>
 * Fields are keyed by owner and name so that a field declared in one unit and read in
 * another yield the same key. Owners without a fully qualified name (local and anonymous
 * classes, enum constant bodies) are named by their position. Parameters and locals are
 * keyed by the position of their name.
 */
public class BindingKeys {

    private final SourceUnitIndex units;

    public BindingKeys(SourceUnitIndex units) {
        this.units = units;
    }

    /**
     * Key of a field declarator.
     */
    public Optional<BindingKey> forField(VariableDeclarator variable) {
        return variable.getParentNode()
                .filter(FieldDeclaration.class::isInstance)
                .flatMap(Node::getParentNode)
                .map(owner -> BindingKey.field(ownerName(owner), variable.getNameAsString()));
    }

    /**
     * Key of a field found by name in the body of the given owner.
     */
    public BindingKey forField(Node owner, String fieldName) {
        return BindingKey.field(ownerName(owner), fieldName);
    }

    /**
     * Key of a parameter or local variable declarator.
     */
    public Optional<BindingKey> forVariable(Node declaration) {
        if (declaration instanceof Parameter parameter) {
            return Optional.of(BindingKey.variable(units.idOf(parameter), Range.of(parameter.getName()),
                    parameter.getNameAsString()));
        }
        if (declaration instanceof VariableDeclarator variable && !(variable.getParentNode().orElse(null) instanceof FieldDeclaration)) {
            return Optional.of(BindingKey.variable(units.idOf(variable), Range.of(variable.getName()),
                    variable.getNameAsString()));
        }
        return Optional.empty();
    }

    String ownerName(Node owner) {
        if (owner instanceof TypeDeclaration<?> type) {
            Optional<String> qualified = isMemberChain(type) ? type.getFullyQualifiedName() : Optional.empty();
            if (qualified.isPresent()) {
                return qualified.get();
            }
            return units.idOf(type) + "@" + Range.of(type.getName()).toDisplayString() + "$" + type.getNameAsString();
        }
        if (owner instanceof ObjectCreationExpr || owner instanceof EnumConstantDeclaration) {
            return units.idOf(owner) + "@" + Range.of(owner).toDisplayString() + "$anonymous";
        }
        return units.idOf(owner) + "@" + Range.of(owner).toDisplayString();
    }

    /**
     * True for top level types and types nested only in other named types.
     */
    static boolean isMemberChain(TypeDeclaration<?> type) {
        Node parent = type.getParentNode().orElse(null);
        if (parent instanceof CompilationUnit) {
            return true;
        }
        return parent instanceof TypeDeclaration<?> outer && isMemberChain(outer);
    }
}
