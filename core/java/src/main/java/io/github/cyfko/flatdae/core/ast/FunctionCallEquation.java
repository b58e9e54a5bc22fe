package io.github.cyfko.flatdae.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Equation consisting of a bare function call, such as {@code reinit(v, -e * pre(v))}.
 *
 * @param call        the call
 * @param description description string, empty when absent
 * @param position    position of the callee
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FunctionCallEquation(FunctionCall call, String description, SourcePosition position)
        implements Equation {

    public FunctionCallEquation {
        Objects.requireNonNull(call, "call cannot be null");
        description = description == null ? "" : description;
        position = position == null ? SourcePosition.SYNTHETIC : position;
    }

    public String functionName() {
        return call.functionName();
    }

    public List<Expression> args() {
        return call.args();
    }

    @Override
    public <R> R accept(EquationVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }
}
