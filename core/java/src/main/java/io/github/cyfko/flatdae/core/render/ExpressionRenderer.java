package io.github.cyfko.flatdae.core.render;

import io.github.cyfko.flatdae.core.ast.*;
import io.github.cyfko.flatdae.core.config.Parenthesization;
import io.github.cyfko.flatdae.core.config.RenderPolicy;
import io.github.cyfko.flatdae.core.dae.Builtins;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Precedence-aware expression printer, specialized per target syntax.
 * <p>
 * The traversal, parenthesization and placeholder handling live here; subclasses only
 * spell operators, literals, references and calls, and declare the precedence and
 * associativity of their operators when they differ from the source language.
 * </p>
 *
 * <h2>Parenthesization</h2>
 * <ul>
 *   <li>{@link Parenthesization#MINIMAL}: a child is wrapped only when it binds looser than its
 *       parent, or equally on the side the target associates away from</li>
 *   <li>{@link Parenthesization#MAXIMAL}: every binary and unary node is wrapped</li>
 * </ul>
 *
 * <p>
 * Nodes the target cannot express are rendered as {@code <prefix>(<detail>)} and a warning is
 * logged; rendering never fails. Instances hold no mutable state.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public abstract class ExpressionRenderer implements ExpressionVisitor<String> {

    private static final Logger log = Logger.getLogger(ExpressionRenderer.class.getName());

    /** Precedence given to literals, references and calls. */
    protected static final int ATOM_PRECEDENCE = Integer.MAX_VALUE;

    protected final RenderPolicy policy;

    protected ExpressionRenderer(RenderPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
    }

    /**
     * @param expression expression to print
     * @return target text
     */
    public String render(Expression expression) {
        return Objects.requireNonNull(expression, "expression cannot be null").accept(this);
    }

    public RenderPolicy getPolicy() {
        return policy;
    }

    // ------------------------------------------------------------------
    // Target hooks

    protected abstract String binaryOperator(BinaryOperator op);

    protected abstract String unaryOperator(UnaryOperator op);

    /** Numeric or boolean literal. */
    protected abstract String literal(Terminal terminal);

    protected abstract String reference(String name);

    protected abstract String call(String function, List<String> args);

    protected int precedence(BinaryOperator op) {
        return op.getPrecedence();
    }

    protected int precedence(UnaryOperator op) {
        return op.getPrecedence();
    }

    protected Associativity associativity(BinaryOperator op) {
        return op.isRelational() ? Associativity.NONE : Associativity.LEFT;
    }

    /**
     * String literals have no counterpart in numeric targets.
     */
    protected String stringLiteral(Terminal terminal) {
        return placeholder("string literal " + terminal.text());
    }

    /**
     * Emits the placeholder for an unsupported node and logs it.
     *
     * @param detail what could not be rendered
     * @return {@code <prefix>(<detail>)}
     */
    protected String placeholder(String detail) {
        String text = policy.placeholderPrefix() + "(" + detail + ")";
        log.warning(() -> "Unsupported node rendered as placeholder: " + text);
        return text;
    }

    // ------------------------------------------------------------------
    // Traversal

    @Override
    public String visitTerminal(Terminal terminal) {
        return terminal.type() == TerminalType.STRING ? stringLiteral(terminal) : literal(terminal);
    }

    @Override
    public String visitComponentReference(ComponentReference reference) {
        return reference(reference.name().toString());
    }

    @Override
    public String visitBinary(Binary binary) {
        BinaryOperator op = binary.op();
        String lhs = operand(binary.lhs(), needsParens(binary.lhs(), op, true));
        String rhs = operand(binary.rhs(), needsParens(binary.rhs(), op, false));
        return wrapIfMaximal(lhs + " " + binaryOperator(op) + " " + rhs);
    }

    @Override
    public String visitUnary(Unary unary) {
        UnaryOperator op = unary.op();
        Expression operand = unary.operand();
        int operandPrecedence = precedenceOf(operand);
        boolean parens = operand instanceof Unary || operandPrecedence <= precedence(op);
        String symbol = unaryOperator(op);
        String separator = Character.isLetter(symbol.charAt(symbol.length() - 1)) ? " " : "";
        return wrapIfMaximal(symbol + separator + operand(operand, parens));
    }

    @Override
    public String visitFunctionCall(FunctionCall functionCall) {
        String function = functionCall.functionName();
        if (function.equals(Builtins.REINIT)) {
            return placeholder("reinit in expression position");
        }
        List<String> args = new ArrayList<>();
        for (Expression arg : functionCall.args()) {
            args.add(arg.accept(this));
        }
        return call(function, args);
    }

    // ------------------------------------------------------------------
    // Parenthesization

    protected int precedenceOf(Expression expression) {
        if (expression instanceof Binary binary) return precedence(binary.op());
        if (expression instanceof Unary unary) return precedence(unary.op());
        return ATOM_PRECEDENCE;
    }

    private boolean needsParens(Expression child, BinaryOperator parent, boolean leftSide) {
        if (policy.parenthesization() == Parenthesization.MAXIMAL) {
            return false;
        }
        int childPrecedence = precedenceOf(child);
        int parentPrecedence = precedence(parent);
        if (childPrecedence != parentPrecedence) {
            return childPrecedence < parentPrecedence;
        }
        if (child instanceof Unary) {
            return !leftSide;
        }
        return switch (associativity(parent)) {
            case LEFT -> !leftSide;
            case RIGHT -> leftSide;
            case NONE -> true;
        };
    }

    private String operand(Expression child, boolean parens) {
        String text = child.accept(this);
        if (policy.parenthesization() == Parenthesization.MAXIMAL) {
            return text;
        }
        return parens ? "(" + text + ")" : text;
    }

    private String wrapIfMaximal(String text) {
        return policy.parenthesization() == Parenthesization.MAXIMAL ? "(" + text + ")" : text;
    }
}
