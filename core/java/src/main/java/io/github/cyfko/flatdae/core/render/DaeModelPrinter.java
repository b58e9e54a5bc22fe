package io.github.cyfko.flatdae.core.render;

import io.github.cyfko.flatdae.core.ast.Expression;
import io.github.cyfko.flatdae.core.config.RenderPolicy;
import io.github.cyfko.flatdae.core.dae.DaeModel;
import io.github.cyfko.flatdae.core.dae.ResetAssignment;
import io.github.cyfko.flatdae.core.dae.Residual;
import io.github.cyfko.flatdae.core.dae.Symbol;
import io.github.cyfko.flatdae.core.dae.SymbolRole;
import io.github.cyfko.flatdae.core.spi.ModelRenderer;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Human-readable listing of a flat model, one section per vector.
 *
 * <pre>
 * model BouncingBall
 *     p: e = 0.8, h0 = 1.0
 *     x: h = h0, v
 *     x_dot: der_h, der_v
 *     fx:
 *         [0] der_h - v
 *     c:
 *         __c0: h &lt; 0
 *     fr:
 *         __c0: v := -e * pre(v)
 *     pre: v
 * end BouncingBall
 * </pre>
 *
 * Empty sections are omitted.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DaeModelPrinter implements ModelRenderer {

    public static final String TARGET = "text";

    private final SourceExpressionRenderer expressions;
    private final String indent;

    public DaeModelPrinter() {
        this(RenderPolicy.defaults());
    }

    public DaeModelPrinter(RenderPolicy policy) {
        Objects.requireNonNull(policy, "policy cannot be null");
        this.expressions = new SourceExpressionRenderer(policy);
        this.indent = policy.indent();
    }

    @Override
    public String target() {
        return TARGET;
    }

    @Override
    public String render(DaeModel model) {
        Objects.requireNonNull(model, "model cannot be null");
        StringBuilder out = new StringBuilder();
        out.append("model ").append(model.name()).append('\n');

        for (SymbolRole role : SymbolRole.values()) {
            List<Symbol> vector = model.vector(role);
            if (vector.isEmpty()) continue;
            out.append(indent).append(role.getVectorName()).append(": ");
            for (int i = 0; i < vector.size(); i++) {
                if (i > 0) out.append(", ");
                Symbol symbol = vector.get(i);
                out.append(symbol.name());
                symbol.startOpt().ifPresent(start -> out.append(" = ").append(expressions.render(start)));
            }
            out.append('\n');
        }

        if (!model.fx().isEmpty()) {
            out.append(indent).append("fx:\n");
            List<Residual> fx = model.fx();
            for (int i = 0; i < fx.size(); i++) {
                out.append(indent).append(indent).append('[').append(i).append("] ")
                        .append(expressions.render(fx.get(i).expression())).append('\n');
            }
        }
        if (!model.c().isEmpty()) {
            out.append(indent).append("c:\n");
            for (Map.Entry<String, Expression> condition : model.c().entrySet()) {
                out.append(indent).append(indent).append(condition.getKey()).append(": ")
                        .append(expressions.render(condition.getValue())).append('\n');
            }
        }
        if (!model.fr().isEmpty()) {
            out.append(indent).append("fr:\n");
            model.fr().forEach((name, block) -> {
                for (ResetAssignment assignment : block.assignments()) {
                    out.append(indent).append(indent).append(name).append(": ").append(assignment.target())
                            .append(" := ").append(expressions.render(assignment.value())).append('\n');
                }
            });
        }
        if (!model.preReferences().isEmpty()) {
            out.append(indent).append("pre: ").append(String.join(", ", model.preReferences())).append('\n');
        }

        out.append("end ").append(model.name()).append('\n');
        return out.toString();
    }
}
