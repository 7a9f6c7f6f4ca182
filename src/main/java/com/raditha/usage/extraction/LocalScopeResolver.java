package com.raditha.usage.extraction;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.TryStmt;

import java.util.List;
import java.util.Optional;

/**
 * Resolves simple names to the parameter or local variable they refer to, by walking the
 * enclosing scopes outward from the occurrence.
 * <p>
 * The walk follows Java's scoping rules for blocks, {@code for} headers, {@code try}
 * resources, catch clauses, switch groups, lambdas and callables. It stops at the first
 * class body that declares a field of the same name, because from there on the name
 * refers to that field.
 */
public class LocalScopeResolver {

    /**
     * Find the declaring {@link Parameter} or {@link VariableDeclarator} of a name.
     *
     * @return the declaring node, or empty when the name is not a parameter or local in scope
     */
    public Optional<Node> resolve(NameExpr nameExpr) {
        String name = nameExpr.getNameAsString();
        Node child = nameExpr;
        Optional<Node> parent = child.getParentNode();
        while (parent.isPresent()) {
            Node scope = parent.get();
            Optional<Node> found = declaredIn(scope, child, name);
            if (found.isPresent()) {
                return found;
            }
            if (declaresField(scope, child, name)) {
                return Optional.empty();
            }
            child = scope;
            parent = scope.getParentNode();
        }
        return Optional.empty();
    }

    private Optional<Node> declaredIn(Node scope, Node child, String name) {
        if (scope instanceof BlockStmt block) {
            return precedingLocal(block.getStatements(), child, name);
        }
        if (scope instanceof SwitchEntry entry) {
            return precedingLocal(entry.getStatements(), child, name);
        }
        if (scope instanceof SwitchStmt switchStmt) {
            return earlierSwitchGroups(switchStmt, child, name);
        }
        if (scope instanceof VariableDeclarationExpr declaration) {
            return precedingDeclarator(declaration.getVariables(), child, name);
        }
        if (scope instanceof ForStmt forStmt) {
            return forInitializer(forStmt, child, name);
        }
        if (scope instanceof ForEachStmt forEach && child != forEach.getIterable()) {
            return named(forEach.getVariable().getVariables(), name);
        }
        if (scope instanceof TryStmt tryStmt) {
            return tryResource(tryStmt, child, name);
        }
        if (scope instanceof CatchClause catchClause && catchClause.getParameter().getNameAsString().equals(name)) {
            return Optional.of(catchClause.getParameter());
        }
        if (scope instanceof LambdaExpr lambda) {
            return parameterNamed(lambda.getParameters(), name);
        }
        if (scope instanceof CallableDeclaration<?> callable) {
            return parameterNamed(callable.getParameters(), name);
        }
        if (scope instanceof CompactConstructorDeclaration compact) {
            return compact.getParentNode()
                    .filter(RecordDeclaration.class::isInstance)
                    .map(RecordDeclaration.class::cast)
                    .flatMap(rec -> parameterNamed(rec.getParameters(), name));
        }
        return Optional.empty();
    }

    /**
     * Whether the scope is a class body with a field of the given name, entered from one of
     * its members.
     */
    static boolean declaresField(Node scope, Node child, String name) {
        if (scope instanceof RecordDeclaration rec
                && rec.getParameters().stream().anyMatch(p -> p.getNameAsString().equals(name))) {
            return true;
        }
        if (scope instanceof TypeDeclaration<?> type) {
            return hasField(type.getMembers(), name);
        }
        if (scope instanceof ObjectCreationExpr creation && child instanceof BodyDeclaration<?>) {
            return creation.getAnonymousClassBody().map(body -> hasField(body, name)).orElse(false);
        }
        if (scope instanceof EnumConstantDeclaration constant && child instanceof BodyDeclaration<?>) {
            return hasField(constant.getClassBody(), name);
        }
        return false;
    }

    private static boolean hasField(List<BodyDeclaration<?>> members, String name) {
        return members.stream()
                .filter(FieldDeclaration.class::isInstance)
                .map(FieldDeclaration.class::cast)
                .flatMap(field -> field.getVariables().stream())
                .anyMatch(v -> v.getNameAsString().equals(name));
    }

    private Optional<Node> precedingLocal(NodeList<Statement> statements, Node child, String name) {
        for (Statement statement : statements) {
            if (statement == child) {
                break;
            }
            Optional<Node> found = localDeclaredBy(statement, name);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private Optional<Node> localDeclaredBy(Statement statement, String name) {
        if (statement instanceof ExpressionStmt expressionStmt
                && expressionStmt.getExpression() instanceof VariableDeclarationExpr declaration) {
            return named(declaration.getVariables(), name);
        }
        return Optional.empty();
    }

    /**
     * Locals declared in an earlier group of an old style switch are in scope in later groups.
     */
    private Optional<Node> earlierSwitchGroups(SwitchStmt switchStmt, Node child, String name) {
        for (SwitchEntry entry : switchStmt.getEntries()) {
            if (entry == child) {
                break;
            }
            if (entry.getType() != SwitchEntry.Type.STATEMENT_GROUP) {
                continue;
            }
            for (Statement statement : entry.getStatements()) {
                Optional<Node> found = localDeclaredBy(statement, name);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Node> precedingDeclarator(NodeList<VariableDeclarator> variables, Node child, String name) {
        for (VariableDeclarator variable : variables) {
            if (variable == child) {
                break;
            }
            if (variable.getNameAsString().equals(name)) {
                return Optional.of(variable);
            }
        }
        return Optional.empty();
    }

    private Optional<Node> forInitializer(ForStmt forStmt, Node child, String name) {
        NodeList<Expression> initialization = forStmt.getInitialization();
        for (Expression init : initialization) {
            if (init == child) {
                // the declaration expression itself handles earlier declarators
                return Optional.empty();
            }
        }
        for (Expression init : initialization) {
            if (init instanceof VariableDeclarationExpr declaration) {
                Optional<Node> found = named(declaration.getVariables(), name);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Resources are in scope in later resources and in the try block, not in catch or finally.
     */
    private Optional<Node> tryResource(TryStmt tryStmt, Node child, String name) {
        NodeList<Expression> resources = tryStmt.getResources();
        boolean inResources = resources.stream().anyMatch(r -> r == child);
        if (!inResources && child != tryStmt.getTryBlock()) {
            return Optional.empty();
        }
        for (Expression resource : resources) {
            if (resource == child) {
                break;
            }
            if (resource instanceof VariableDeclarationExpr declaration) {
                Optional<Node> found = named(declaration.getVariables(), name);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Node> named(NodeList<VariableDeclarator> variables, String name) {
        return variables.stream()
                .filter(v -> v.getNameAsString().equals(name))
                .<Node>map(v -> v)
                .findFirst();
    }

    private static Optional<Node> parameterNamed(NodeList<Parameter> parameters, String name) {
        return parameters.stream()
                .filter(p -> p.getNameAsString().equals(name))
                .<Node>map(p -> p)
                .findFirst();
    }
}
