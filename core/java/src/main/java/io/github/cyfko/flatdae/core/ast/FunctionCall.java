package io.github.cyfko.flatdae.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Function call {@code name(args...)} with positional arguments.
 * <p>
 * The grammar does not distinguish built-ins: {@code der(x)}, {@code pre(x)} and
 * {@code sin(x)} all parse to this node. Their meaning is assigned by the flattener
 * from {@link #function()}.
 * </p>
 *
 * @param function callee name
 * @param args     positional arguments
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionCall(Name function, List<Expression> args) implements Expression {

    public FunctionCall {
        Objects.requireNonNull(function, "function cannot be null");
        Objects.requireNonNull(args, "args cannot be null");
        args = List.copyOf(args);
    }

    public static FunctionCall of(String function, Expression... args) {
        return new FunctionCall(Name.of(function), List.of(args));
    }

    /** @return the callee as a dotted string */
    public String functionName() {
        return function.toString();
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
