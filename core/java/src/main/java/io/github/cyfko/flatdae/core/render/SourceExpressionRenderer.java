package io.github.cyfko.flatdae.core.render;

import io.github.cyfko.flatdae.core.ast.BinaryOperator;
import io.github.cyfko.flatdae.core.ast.Terminal;
import io.github.cyfko.flatdae.core.ast.UnaryOperator;
import io.github.cyfko.flatdae.core.config.RenderPolicy;

import java.util.List;

/**
 * Prints expressions back in modeling-language syntax.
 * <p>
 * With {@link io.github.cyfko.flatdae.core.config.Parenthesization#MINIMAL} the output parses
 * back to the same tree, including left-nested power chains ({@code a ^ b ^ c}).
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SourceExpressionRenderer extends ExpressionRenderer {

    public SourceExpressionRenderer() {
        this(RenderPolicy.defaults());
    }

    public SourceExpressionRenderer(RenderPolicy policy) {
        super(policy);
    }

    @Override
    protected String binaryOperator(BinaryOperator op) {
        return op.getSymbol();
    }

    @Override
    protected String unaryOperator(UnaryOperator op) {
        return op.getSymbol();
    }

    @Override
    protected String literal(Terminal terminal) {
        return terminal.text();
    }

    @Override
    protected String stringLiteral(Terminal terminal) {
        String escaped = terminal.text()
                .replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\t", "\\t");
        return "\"" + escaped + "\"";
    }

    @Override
    protected String reference(String name) {
        return name;
    }

    @Override
    protected String call(String function, List<String> args) {
        return function + "(" + String.join(", ", args) + ")";
    }
}
