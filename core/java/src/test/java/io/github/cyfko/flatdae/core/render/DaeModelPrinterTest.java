package io.github.cyfko.flatdae.core.render;

import io.github.cyfko.flatdae.core.ast.ComponentReference;
import io.github.cyfko.flatdae.core.ast.Terminal;
import io.github.cyfko.flatdae.core.config.FlattenPolicy;
import io.github.cyfko.flatdae.core.config.Parenthesization;
import io.github.cyfko.flatdae.core.config.RenderPolicy;
import io.github.cyfko.flatdae.core.dae.DaeModel;
import io.github.cyfko.flatdae.core.dae.Residual;
import io.github.cyfko.flatdae.core.dae.Symbol;
import io.github.cyfko.flatdae.core.dae.SymbolRole;
import io.github.cyfko.flatdae.core.flatten.BasicFlattener;
import io.github.cyfko.flatdae.core.parsing.RecursiveDescentParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DaeModelPrinter}.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@DisplayName("DaeModelPrinter Tests")
class DaeModelPrinterTest {

    @Test
    @DisplayName("Should list every non-empty section of the bouncing ball")
    void testBouncingBallListing() {
        String source = String.join("\n",
                "model BouncingBall",
                "  parameter Real e = 0.8;",
                "  parameter Real h0 = 1.0;",
                "  Real h(start = h0);",
                "  Real v;",
                "equation",
                "  v = der(h);",
                "  der(v) = -9.81;",
                "  reinit(v, -e*pre(v));",
                "end BouncingBall;");
        DaeModel model = new BasicFlattener(FlattenPolicy.builder().resetCondition("__c0", "h < 0").build())
                .flatten(new RecursiveDescentParser().parse(source), "BouncingBall");

        String expected = String.join("\n",
                "model BouncingBall",
                "    p: e = 0.8, h0 = 1.0",
                "    x: h = h0, v",
                "    x_dot: der_h, der_v",
                "    fx:",
                "        [0] v - der_h",
                "        [1] der_v - (-9.81)",
                "    c:",
                "        __c0: h < 0",
                "    fr:",
                "        __c0: v := -e * pre(v)",
                "    pre: v",
                "end BouncingBall",
                "");
        assertEquals(expected, new DaeModelPrinter().render(model));
    }

    @Test
    @DisplayName("Should honor indent and parenthesization")
    void testPolicy() {
        DaeModel model = DaeModel.builder("Tiny")
                .symbol(new Symbol("a", SymbolRole.ALGEBRAIC, Symbol.REAL, null))
                .symbol(new Symbol("k", SymbolRole.CONSTANT, Symbol.REAL, Terminal.integer(2)))
                .residual(new Residual(ComponentReference.of("a"), ComponentReference.of("k")))
                .build();

        DaeModelPrinter printer = new DaeModelPrinter(RenderPolicy.builder()
                .indent("  ")
                .parenthesization(Parenthesization.MAXIMAL)
                .build());

        assertEquals("model Tiny\n  cp: k = 2\n  z: a\n  fx:\n    [0] (a - k)\nend Tiny\n", printer.render(model));
        assertEquals(DaeModelPrinter.TARGET, printer.target());
    }
}
