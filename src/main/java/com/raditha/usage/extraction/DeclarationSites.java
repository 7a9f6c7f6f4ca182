package com.raditha.usage.extraction;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.LiteralExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.NullLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.type.Type;
import com.raditha.usage.model.BindingKey;
import com.raditha.usage.model.DeclarationKind;
import com.raditha.usage.model.DeclarationSite;
import com.raditha.usage.model.DeclarationTrait;
import com.raditha.usage.model.Range;
import com.raditha.usage.model.SiblingGroup;
import com.raditha.usage.model.SourceLocation;
import org.jspecify.annotations.Nullable;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns JavaParser declarations into {@link DeclarationSite}s, collecting the traits the
 * exemption policies look at.
 */
public class DeclarationSites {

    /**
     * Lombok annotations that generate accessors when placed on a field.
     */
    static final Set<String> FIELD_ACCESSOR_ANNOTATIONS = Set.of("Getter", "Setter");

    /**
     * Lombok annotations that generate accessors for every field when placed on the type.
     */
    static final Set<String> TYPE_ACCESSOR_ANNOTATIONS = Set.of("Data", "Value", "Getter", "Setter");

    /**
     * Fields read by the serialization machinery.
     */
    static final Set<String> SERIALIZATION_FIELDS = Set.of("serialVersionUID", "serialPersistentFields");

    private final SourceUnitIndex units;
    private final BindingKeys keys;

    public DeclarationSites(SourceUnitIndex units, BindingKeys keys) {
        this.units = units;
        this.keys = keys;
    }

    /**
     * Site of a field declarator, or empty if the declarator does not belong to a field.
     */
    public Optional<DeclarationSite> forField(VariableDeclarator variable) {
        if (!(variable.getParentNode().orElse(null) instanceof FieldDeclaration field)) {
            return Optional.empty();
        }
        Optional<BindingKey> key = keys.forField(variable);
        if (key.isEmpty()) {
            return Optional.empty();
        }

        Set<DeclarationTrait> traits = EnumSet.noneOf(DeclarationTrait.class);
        if (field.isPrivate()) {
            traits.add(DeclarationTrait.PRIVATE);
        }
        if (field.isStatic()) {
            traits.add(DeclarationTrait.STATIC);
        }
        if (field.isFinal()) {
            traits.add(DeclarationTrait.FINAL);
            if (isConstantType(variable.getType())
                    && variable.getInitializer().map(DeclarationSites::isConstantExpression).orElse(false)) {
                traits.add(DeclarationTrait.COMPILE_TIME_CONSTANT);
            }
        }

        Set<String> annotations = simpleNames(field.getAnnotations());
        if (hasAccessors(field, annotations) || SERIALIZATION_FIELDS.contains(variable.getNameAsString())) {
            traits.add(DeclarationTrait.SYNTHESIZED_ACCESS);
        }

        return Optional.of(new DeclarationSite(key.get(), variable.getNameAsString(), DeclarationKind.FIELD,
                locationOf(variable), siblingGroup(field, field.getVariables(), variable), traits, annotations));
    }

    /**
     * Site of a parameter of the given callable. The callable's signature traits apply to
     * every parameter.
     */
    public DeclarationSite forParameter(Parameter parameter, CallableUnit callable) {
        BindingKey key = keys.forVariable(parameter).orElseThrow();
        return new DeclarationSite(key, parameter.getNameAsString(), callable.parameterKind(),
                new SourceLocation(units.idOf(parameter), Range.of(parameter.getName())),
                null, callable.signatureTraits(), simpleNames(parameter.getAnnotations()));
    }

    /**
     * Site of a local variable declarator.
     */
    public DeclarationSite forLocal(VariableDeclarator variable) {
        BindingKey key = keys.forVariable(variable).orElseThrow();
        Set<DeclarationTrait> traits = EnumSet.noneOf(DeclarationTrait.class);
        Set<String> annotations = Set.of();
        SiblingGroup sibling = null;

        if (variable.getParentNode().orElse(null) instanceof VariableDeclarationExpr declaration) {
            if (declaration.isFinal()) {
                traits.add(DeclarationTrait.FINAL);
            }
            if (declaration.getParentNode().orElse(null) instanceof TryStmt tryStmt
                    && tryStmt.getResources().stream().anyMatch(r -> r == declaration)) {
                traits.add(DeclarationTrait.TRY_RESOURCE);
            }
            annotations = simpleNames(declaration.getAnnotations());
            sibling = siblingGroup(declaration, declaration.getVariables(), variable);
        }
        return new DeclarationSite(key, variable.getNameAsString(), DeclarationKind.LOCAL_VARIABLE,
                locationOf(variable), sibling, traits, annotations);
    }

    private SourceLocation locationOf(VariableDeclarator variable) {
        return new SourceLocation(units.idOf(variable), Range.of(variable.getName()));
    }

    private @Nullable SiblingGroup siblingGroup(Node statement, NodeList<VariableDeclarator> variables, VariableDeclarator variable) {
        if (variables.size() < 2) {
            return null;
        }
        int index = 0;
        while (variables.get(index) != variable) {
            index++;
        }
        String groupId = units.idOf(statement) + "@" + Range.of(statement).toDisplayString();
        return new SiblingGroup(groupId, index, variables.size());
    }

    private static boolean hasAccessors(FieldDeclaration field, Set<String> fieldAnnotations) {
        if (fieldAnnotations.stream().anyMatch(FIELD_ACCESSOR_ANNOTATIONS::contains)) {
            return true;
        }
        if (field.getParentNode().orElse(null) instanceof TypeDeclaration<?> owner) {
            return simpleNames(owner.getAnnotations()).stream().anyMatch(TYPE_ACCESSOR_ANNOTATIONS::contains);
        }
        return false;
    }

    private static Set<String> simpleNames(NodeList<AnnotationExpr> annotations) {
        return annotations.stream()
                .map(a -> a.getName().getIdentifier())
                .collect(Collectors.toSet());
    }

    static boolean isConstantType(Type type) {
        if (type.isPrimitiveType()) {
            return true;
        }
        String name = type.asString();
        return name.equals("String") || name.equals("java.lang.String");
    }

    /**
     * Approximates a constant expression: literals, names and the operators that keep
     * an expression constant. Names are assumed to denote other constants.
     */
    static boolean isConstantExpression(Expression expression) {
        if (expression instanceof NullLiteralExpr) {
            return false;
        }
        if (expression instanceof LiteralExpr || expression instanceof NameExpr) {
            return true;
        }
        if (expression instanceof FieldAccessExpr access) {
            return access.getScope() instanceof NameExpr || access.getScope() instanceof FieldAccessExpr;
        }
        if (expression instanceof EnclosedExpr enclosed) {
            return isConstantExpression(enclosed.getInner());
        }
        if (expression instanceof UnaryExpr unary) {
            return isConstantExpression(unary.getExpression());
        }
        if (expression instanceof BinaryExpr binary) {
            return isConstantExpression(binary.getLeft()) && isConstantExpression(binary.getRight());
        }
        if (expression instanceof ConditionalExpr conditional) {
            return isConstantExpression(conditional.getCondition())
                    && isConstantExpression(conditional.getThenExpr())
                    && isConstantExpression(conditional.getElseExpr());
        }
        if (expression instanceof CastExpr cast) {
            return isConstantType(cast.getType()) && isConstantExpression(cast.getExpression());
        }
        return false;
    }
}
