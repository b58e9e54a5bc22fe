package io.github.cyfko.flatdae.core.simulation;

import io.github.cyfko.flatdae.core.ast.*;
import io.github.cyfko.flatdae.core.dae.Builtins;
import io.github.cyfko.flatdae.core.exception.SimulationException;

import java.util.Map;
import java.util.Objects;

/**
 * Numeric interpretation of flat expressions.
 * <p>
 * Booleans are carried as {@code 1.0} and {@code 0.0}; any non-zero value is true.
 * {@code pre(x)} reads {@code preValues} and falls back to the current value of {@code x}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionEvaluator implements ExpressionVisitor<Double> {

    private final Map<String, Double> values;
    private final Map<String, Double> preValues;

    /**
     * @param values    current value of every symbol, plus {@code time}
     * @param preValues pre-event values; may be empty
     */
    public ExpressionEvaluator(Map<String, Double> values, Map<String, Double> preValues) {
        this.values = Objects.requireNonNull(values, "values cannot be null");
        this.preValues = Objects.requireNonNull(preValues, "preValues cannot be null");
    }

    public ExpressionEvaluator(Map<String, Double> values) {
        this(values, Map.of());
    }

    public double evaluate(Expression expression) {
        return expression.accept(this);
    }

    public boolean test(Expression condition) {
        return evaluate(condition) != 0.0;
    }

    @Override
    public Double visitTerminal(Terminal terminal) {
        return switch (terminal.type()) {
            case UNSIGNED_INTEGER, UNSIGNED_REAL -> Double.parseDouble(terminal.text());
            case BOOLEAN -> Boolean.parseBoolean(terminal.text()) ? 1.0 : 0.0;
            case STRING -> throw new SimulationException("String literal cannot be evaluated: \"" + terminal.text() + "\"");
        };
    }

    @Override
    public Double visitComponentReference(ComponentReference reference) {
        return lookup(values, reference.name().toString());
    }

    @Override
    public Double visitBinary(Binary binary) {
        BinaryOperator op = binary.op().scalar();
        if (op == BinaryOperator.AND) {
            return truth(binary.lhs().accept(this) != 0 && binary.rhs().accept(this) != 0);
        }
        if (op == BinaryOperator.OR) {
            return truth(binary.lhs().accept(this) != 0 || binary.rhs().accept(this) != 0);
        }
        double lhs = binary.lhs().accept(this);
        double rhs = binary.rhs().accept(this);
        return switch (op) {
            case ADD -> lhs + rhs;
            case SUB -> lhs - rhs;
            case MUL -> lhs * rhs;
            case DIV -> lhs / rhs;
            case EXP -> Math.pow(lhs, rhs);
            case LT -> truth(lhs < rhs);
            case LE -> truth(lhs <= rhs);
            case GT -> truth(lhs > rhs);
            case GE -> truth(lhs >= rhs);
            case EQ -> truth(lhs == rhs);
            case NE -> truth(lhs != rhs);
            default -> throw new SimulationException("Unsupported operator: " + binary.op().getSymbol());
        };
    }

    @Override
    public Double visitUnary(Unary unary) {
        double operand = unary.operand().accept(this);
        return switch (unary.op().scalar()) {
            case NOT -> truth(operand == 0);
            case MINUS -> -operand;
            default -> operand;
        };
    }

    @Override
    public Double visitFunctionCall(FunctionCall call) {
        String function = call.functionName();
        if (function.equals(Builtins.PRE)) {
            String variable = ((ComponentReference) call.args().get(0)).name().toString();
            Double pre = preValues.get(variable);
            return pre != null ? pre : lookup(values, variable);
        }

        double a = call.args().isEmpty() ? Double.NaN : call.args().get(0).accept(this);
        return switch (function) {
            case "sin" -> Math.sin(a);
            case "cos" -> Math.cos(a);
            case "tan" -> Math.tan(a);
            case "asin" -> Math.asin(a);
            case "acos" -> Math.acos(a);
            case "atan" -> Math.atan(a);
            case "sinh" -> Math.sinh(a);
            case "cosh" -> Math.cosh(a);
            case "tanh" -> Math.tanh(a);
            case "exp" -> Math.exp(a);
            case "log" -> Math.log(a);
            case "log10" -> Math.log10(a);
            case "sqrt" -> Math.sqrt(a);
            case "abs" -> Math.abs(a);
            case "sign" -> Math.signum(a);
            case "atan2" -> Math.atan2(a, call.args().get(1).accept(this));
            case "min" -> Math.min(a, call.args().get(1).accept(this));
            case "max" -> Math.max(a, call.args().get(1).accept(this));
            default -> throw new SimulationException("Function cannot be evaluated: " + function);
        };
    }

    private static double lookup(Map<String, Double> source, String name) {
        Double value = source.get(name);
        if (value == null) {
            throw new SimulationException("No value for symbol '" + name + "'");
        }
        return value;
    }

    private static double truth(boolean value) {
        return value ? 1.0 : 0.0;
    }
}
