package io.github.cyfko.flatdae.core.dae;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Names with a fixed meaning in every model: the hybrid operators, the
 * independent variable and the scalar math functions with their arity.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Builtins {

    public static final String DER = "der";
    public static final String PRE = "pre";
    public static final String REINIT = "reinit";
    public static final String TIME = "time";

    private static final Map<String, Integer> MATH_FUNCTIONS;

    static {
        Map<String, Integer> functions = new LinkedHashMap<>();
        for (String unary : new String[]{"sin", "cos", "tan", "asin", "acos", "atan", "sinh", "cosh", "tanh",
                "exp", "log", "log10", "sqrt", "abs", "sign"}) {
            functions.put(unary, 1);
        }
        functions.put("atan2", 2);
        functions.put("min", 2);
        functions.put("max", 2);
        MATH_FUNCTIONS = Collections.unmodifiableMap(functions);
    }

    private Builtins() {}

    /**
     * @param name function name
     * @return the arity when {@code name} is a builtin math function
     */
    public static Optional<Integer> mathArity(String name) {
        return Optional.ofNullable(MATH_FUNCTIONS.get(name));
    }

    public static boolean isMathFunction(String name) {
        return MATH_FUNCTIONS.containsKey(name);
    }

    public static Map<String, Integer> mathFunctions() {
        return MATH_FUNCTIONS;
    }
}
