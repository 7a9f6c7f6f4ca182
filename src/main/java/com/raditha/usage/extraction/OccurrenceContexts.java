package com.raditha.usage.extraction;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.raditha.usage.model.AccessContext;

import java.util.List;

/**
 * Derives the {@link AccessContext} of an identifier occurrence from its place in the AST.
 */
public final class OccurrenceContexts {

    private OccurrenceContexts() {
        /* this is only a utility class */
    }

    /**
     * Context of a single occurrence. Parentheses around the occurrence are ignored.
     */
    public static AccessContext contextOf(Expression occurrence) {
        Expression outer = outermostParentheses(occurrence);
        Node parent = outer.getParentNode().orElse(null);

        if (parent instanceof AssignExpr assign) {
            if (assign.getTarget() == outer) {
                return assign.getOperator() == AssignExpr.Operator.ASSIGN
                        ? AccessContext.ASSIGNMENT_TARGET_SIMPLE
                        : AccessContext.ASSIGNMENT_TARGET_COMPOUND;
            }
            return AccessContext.ASSIGNMENT_VALUE;
        }
        if (parent instanceof UnaryExpr unary && isIncrementOrDecrement(unary.getOperator())) {
            return AccessContext.INCREMENT_DECREMENT;
        }
        return AccessContext.OTHER;
    }

    /**
     * Contexts to record for an occurrence.
     * A compound assignment or increment whose own value is used, as in {@code y = x++},
     * also reads the variable, so {@link AccessContext#OTHER} is added for it.
     */
    public static List<AccessContext> contextsOf(Expression occurrence) {
        AccessContext context = contextOf(occurrence);
        if (context == AccessContext.ASSIGNMENT_TARGET_COMPOUND || context == AccessContext.INCREMENT_DECREMENT) {
            Expression outer = outermostParentheses(occurrence);
            Node write = outer.getParentNode().orElse(null);
            if (write instanceof Expression writeExpression && isValueConsumed(writeExpression)) {
                return List.of(context, AccessContext.OTHER);
            }
        }
        return List.of(context);
    }

    /**
     * False when the value of the expression is thrown away: an expression statement or
     * a {@code for} initializer or update. An expression lambda body may return its value,
     * so it counts as consumed.
     */
    static boolean isValueConsumed(Expression expression) {
        Expression outer = outermostParentheses(expression);
        Node parent = outer.getParentNode().orElse(null);
        if (parent instanceof ExpressionStmt statement) {
            return statement.getParentNode().filter(LambdaExpr.class::isInstance).isPresent();
        }
        if (parent instanceof ForStmt forStmt) {
            boolean discarded = forStmt.getUpdate().stream().anyMatch(e -> e == outer)
                    || forStmt.getInitialization().stream().anyMatch(e -> e == outer);
            return !discarded;
        }
        return true;
    }

    static Expression outermostParentheses(Expression expression) {
        Expression current = expression;
        while (current.getParentNode().filter(EnclosedExpr.class::isInstance).isPresent()) {
            current = (Expression) current.getParentNode().get();
        }
        return current;
    }

    private static boolean isIncrementOrDecrement(UnaryExpr.Operator operator) {
        return operator == UnaryExpr.Operator.PREFIX_INCREMENT
                || operator == UnaryExpr.Operator.PREFIX_DECREMENT
                || operator == UnaryExpr.Operator.POSTFIX_INCREMENT
                || operator == UnaryExpr.Operator.POSTFIX_DECREMENT;
    }
}
