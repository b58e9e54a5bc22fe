package io.github.cyfko.flatdae.core.simulation;

import io.github.cyfko.flatdae.core.ast.Binary;
import io.github.cyfko.flatdae.core.ast.ComponentReference;
import io.github.cyfko.flatdae.core.ast.Expression;
import io.github.cyfko.flatdae.core.ast.ExpressionVisitor;
import io.github.cyfko.flatdae.core.ast.FunctionCall;
import io.github.cyfko.flatdae.core.ast.Terminal;
import io.github.cyfko.flatdae.core.ast.Unary;
import io.github.cyfko.flatdae.core.exception.SimulationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates a group of start expressions that may refer to each other, in dependency order.
 * <p>
 * Declaration order does not matter: {@code parameter Real a = b; parameter Real b = 1;}
 * resolves {@code b} first. A reference cycle raises {@link SimulationException} naming the
 * cycle; a reference to a symbol that is neither in the group nor already known raises the
 * evaluator's missing-value error.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class StartValueResolver {

    private final Map<String, Expression> starts;
    private final Map<String, Double> values;
    private final Set<String> inProgress = new LinkedHashSet<>();

    private StartValueResolver(Map<String, Expression> starts, Map<String, Double> known) {
        this.starts = starts;
        this.values = new HashMap<>(known);
    }

    /**
     * @param starts start expression per symbol, in the order results are wanted
     * @param known  values already fixed, e.g. parameters and {@code time}
     * @return the value of every symbol of {@code starts}, in the same order
     */
    static Map<String, Double> resolve(Map<String, Expression> starts, Map<String, Double> known) {
        StartValueResolver resolver = new StartValueResolver(starts, known);
        Map<String, Double> resolved = new LinkedHashMap<>();
        for (String name : starts.keySet()) {
            resolved.put(name, resolver.valueOf(name));
        }
        return resolved;
    }

    private double valueOf(String name) {
        Double value = values.get(name);
        if (value != null) {
            return value;
        }
        if (!inProgress.add(name)) {
            List<String> cycle = new ArrayList<>(inProgress);
            cycle = cycle.subList(cycle.indexOf(name), cycle.size());
            throw new SimulationException("Cyclic start values: " + String.join(" -> ", cycle) + " -> " + name);
        }
        Expression start = starts.get(name);
        for (String dependency : start.accept(new References())) {
            if (starts.containsKey(dependency)) {
                valueOf(dependency);
            }
        }
        double result = new ExpressionEvaluator(values).evaluate(start);
        inProgress.remove(name);
        values.put(name, result);
        return result;
    }

    /** Names read by an expression, in reading order. */
    private static final class References implements ExpressionVisitor<Set<String>> {
        private final Set<String> names = new LinkedHashSet<>();

        @Override
        public Set<String> visitTerminal(Terminal terminal) {
            return names;
        }

        @Override
        public Set<String> visitComponentReference(ComponentReference reference) {
            names.add(reference.name().toString());
            return names;
        }

        @Override
        public Set<String> visitBinary(Binary binary) {
            binary.lhs().accept(this);
            return binary.rhs().accept(this);
        }

        @Override
        public Set<String> visitUnary(Unary unary) {
            return unary.operand().accept(this);
        }

        @Override
        public Set<String> visitFunctionCall(FunctionCall call) {
            call.args().forEach(arg -> arg.accept(this));
            return names;
        }
    }
}
