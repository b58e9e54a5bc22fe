package io.github.cyfko.flatdae.sympy;

import io.github.cyfko.flatdae.core.ast.*;
import io.github.cyfko.flatdae.core.config.RenderPolicy;
import io.github.cyfko.flatdae.core.dae.Builtins;
import io.github.cyfko.flatdae.core.render.Associativity;
import io.github.cyfko.flatdae.core.render.ExpressionRenderer;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders flat expressions as Python source over SymPy symbols.
 * <p>
 * Arithmetic and ordering comparisons use Python operators. Equality, inequality and the
 * logical operators become {@code sympy.Eq}, {@code sympy.Ne}, {@code sympy.And},
 * {@code sympy.Or} and {@code sympy.Not} calls, because their Python spelling does not
 * build symbolic expressions. {@code pre(x)} becomes the symbol {@code pre_x}.
 * </p>
 *
 * <h2>Python precedence</h2>
 * <p>
 * Unary minus binds tighter than {@code *} but looser than {@code **}, and {@code **}
 * associates to the right, so a left-nested power chain is printed as {@code (a ** b) ** c}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SympyExpressionRenderer extends ExpressionRenderer {

    static final Set<String> PYTHON_KEYWORDS = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield",
            "self", "sympy", "np", "scipy", "pre_x_vec", "x_vec");

    private static final Map<String, String> FUNCTIONS = Map.ofEntries(
            Map.entry("sin", "sympy.sin"), Map.entry("cos", "sympy.cos"), Map.entry("tan", "sympy.tan"),
            Map.entry("asin", "sympy.asin"), Map.entry("acos", "sympy.acos"), Map.entry("atan", "sympy.atan"),
            Map.entry("atan2", "sympy.atan2"), Map.entry("sinh", "sympy.sinh"), Map.entry("cosh", "sympy.cosh"),
            Map.entry("tanh", "sympy.tanh"), Map.entry("exp", "sympy.exp"), Map.entry("log", "sympy.log"),
            Map.entry("sqrt", "sympy.sqrt"), Map.entry("abs", "sympy.Abs"), Map.entry("sign", "sympy.sign"),
            Map.entry("min", "sympy.Min"), Map.entry("max", "sympy.Max"));

    public SympyExpressionRenderer() {
        this(RenderPolicy.defaults());
    }

    public SympyExpressionRenderer(RenderPolicy policy) {
        super(policy);
    }

    /**
     * Python identifier for a flat symbol name; keywords and generator-reserved names get a
     * trailing underscore.
     */
    public static String pythonName(String name) {
        return PYTHON_KEYWORDS.contains(name) ? name + "_" : name;
    }

    /**
     * Placeholder for a construct the generated module cannot express.
     */
    public String unsupported(String detail) {
        return placeholder(detail);
    }

    @Override
    public String visitBinary(Binary binary) {
        String function = symbolicFunction(binary.op());
        if (function == null) {
            return super.visitBinary(binary);
        }
        return function + "(" + binary.lhs().accept(this) + ", " + binary.rhs().accept(this) + ")";
    }

    @Override
    public String visitUnary(Unary unary) {
        if (unary.op() == UnaryOperator.NOT) {
            return "sympy.Not(" + unary.operand().accept(this) + ")";
        }
        return super.visitUnary(unary);
    }

    @Override
    protected int precedenceOf(Expression expression) {
        if (expression instanceof Binary binary && symbolicFunction(binary.op()) != null) {
            return ATOM_PRECEDENCE;
        }
        if (expression instanceof Unary unary && unary.op() == UnaryOperator.NOT) {
            return ATOM_PRECEDENCE;
        }
        return super.precedenceOf(expression);
    }

    @Override
    protected int precedence(BinaryOperator op) {
        return switch (op.scalar()) {
            case EXP -> 8;
            case MUL, DIV -> 6;
            case ADD, SUB -> 5;
            default -> op.getPrecedence();
        };
    }

    @Override
    protected int precedence(UnaryOperator op) {
        return op.scalar() == UnaryOperator.NOT ? 3 : 7;
    }

    @Override
    protected Associativity associativity(BinaryOperator op) {
        if (op.scalar() == BinaryOperator.EXP) return Associativity.RIGHT;
        return super.associativity(op);
    }

    @Override
    protected String binaryOperator(BinaryOperator op) {
        return op.scalar() == BinaryOperator.EXP ? "**" : op.scalar().getSymbol();
    }

    @Override
    protected String unaryOperator(UnaryOperator op) {
        return op.scalar().getSymbol();
    }

    @Override
    protected String literal(Terminal terminal) {
        if (terminal.type() == TerminalType.BOOLEAN) {
            return Boolean.parseBoolean(terminal.text()) ? "sympy.true" : "sympy.false";
        }
        return terminal.text();
    }

    @Override
    protected String reference(String name) {
        return pythonName(name);
    }

    @Override
    protected String call(String function, List<String> args) {
        if (function.equals(Builtins.PRE)) {
            return "pre_" + args.get(0);
        }
        if (function.equals("log10")) {
            return "sympy.log(" + args.get(0) + ", 10)";
        }
        String target = FUNCTIONS.get(function);
        if (target == null) {
            return placeholder("function " + function);
        }
        return target + "(" + String.join(", ", args) + ")";
    }

    private static String symbolicFunction(BinaryOperator op) {
        return switch (op) {
            case EQ -> "sympy.Eq";
            case NE -> "sympy.Ne";
            case AND -> "sympy.And";
            case OR -> "sympy.Or";
            default -> null;
        };
    }
}
