package com.raditha.usage.extraction;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.raditha.usage.model.DeclarationKind;
import com.raditha.usage.model.DeclarationTrait;
import com.raditha.usage.model.Range;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finds the callables of a compilation unit, in source order.
 */
public class CallableCollector {

    private final ContractDetector contracts;

    public CallableCollector(ContractDetector contracts) {
        this.contracts = contracts;
    }

    public List<CallableUnit> collect(CompilationUnit cu) {
        List<CallableUnit> callables = new ArrayList<>();
        for (Node node : cu.findAll(Node.class)) {
            if (node instanceof MethodDeclaration method) {
                callables.add(forMethod(method));
            } else if (node instanceof ConstructorDeclaration constructor) {
                callables.add(new CallableUnit(constructor, ownerName(constructor) + ".<init>" + signature(constructor),
                        parameterKindOf(constructor), constructor.getParameters(), Set.of(), constructor.getBody()));
            } else if (node instanceof LambdaExpr lambda) {
                callables.add(new CallableUnit(lambda, "lambda@" + Range.of(lambda).toDisplayString(),
                        DeclarationKind.LAMBDA_PARAMETER, lambda.getParameters(), Set.of(), lambda.getBody()));
            } else if (node instanceof InitializerDeclaration initializer) {
                String kind = initializer.isStatic() ? ".<clinit>@" : ".<init>@";
                callables.add(new CallableUnit(initializer, ownerName(initializer) + kind + Range.of(initializer).toDisplayString(),
                        DeclarationKind.PARAMETER, List.of(), Set.of(), initializer.getBody()));
            } else if (node instanceof CompactConstructorDeclaration compact) {
                callables.add(new CallableUnit(compact, ownerName(compact) + ".<init>",
                        DeclarationKind.PARAMETER, List.of(), Set.of(), compact.getBody()));
            }
        }
        return callables;
    }

    private CallableUnit forMethod(MethodDeclaration method) {
        Set<DeclarationTrait> traits = EnumSet.noneOf(DeclarationTrait.class);
        if (method.getBody().isEmpty()) {
            traits.add(DeclarationTrait.NO_BODY);
        }
        if (contracts.isContractBound(method)) {
            traits.add(DeclarationTrait.CONTRACT_BOUND);
        }
        if (contracts.isEntryPoint(method)) {
            traits.add(DeclarationTrait.ENTRY_POINT);
        }
        return new CallableUnit(method, ownerName(method) + "." + method.getNameAsString() + signature(method),
                parameterKindOf(method), method.getParameters(), traits, method.getBody().orElse(null));
    }

    /**
     * Local variables declared directly in the callable, not in a nested lambda or class.
     */
    public static List<VariableDeclarator> ownedLocals(CallableUnit callable) {
        if (!callable.hasBody()) {
            return List.of();
        }
        return callable.body().findAll(VariableDeclarator.class).stream()
                .filter(v -> v.getParentNode().orElse(null) instanceof VariableDeclarationExpr)
                .filter(v -> enclosingCallable(v).orElse(null) == callable.node())
                .toList();
    }

    /**
     * The innermost callable whose body contains the node, without crossing a class body.
     */
    public static Optional<Node> enclosingCallable(Node node) {
        Node child = node;
        Optional<Node> parent = node.getParentNode();
        while (parent.isPresent()) {
            Node scope = parent.get();
            if (scope instanceof CallableDeclaration<?> || scope instanceof LambdaExpr
                    || scope instanceof InitializerDeclaration || scope instanceof CompactConstructorDeclaration) {
                return Optional.of(scope);
            }
            if (scope instanceof TypeDeclaration<?>) {
                return Optional.empty();
            }
            if ((scope instanceof ObjectCreationExpr || scope instanceof EnumConstantDeclaration)
                    && child instanceof BodyDeclaration<?>) {
                return Optional.empty();
            }
            child = scope;
            parent = scope.getParentNode();
        }
        return Optional.empty();
    }

    /**
     * Callables of local and anonymous classes get {@link DeclarationKind#LOCAL_FUNCTION_PARAMETER}.
     */
    static DeclarationKind parameterKindOf(CallableDeclaration<?> callable) {
        Node owner = callable.getParentNode().orElse(null);
        if (owner instanceof TypeDeclaration<?> type && BindingKeys.isMemberChain(type)) {
            return DeclarationKind.PARAMETER;
        }
        return DeclarationKind.LOCAL_FUNCTION_PARAMETER;
    }

    private static String ownerName(Node member) {
        Node owner = member.getParentNode().orElse(null);
        if (owner instanceof TypeDeclaration<?> type) {
            return type.getNameAsString();
        }
        return "<anonymous>";
    }

    private static String signature(CallableDeclaration<?> callable) {
        return callable.getParameters().stream()
                .map(Parameter::getTypeAsString)
                .collect(Collectors.joining(",", "(", ")"));
    }
}
