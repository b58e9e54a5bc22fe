package io.github.cyfko.flatdae.core.dae;

/**
 * Semantic role of a flat symbol, each mapped to one vector of the hybrid DAE.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum SymbolRole {

    INPUT("u"),
    PARAMETER("p"),
    CONSTANT("cp"),
    STATE("x"),
    STATE_DERIVATIVE("x_dot"),
    DISCRETE_MODE("m"),
    OUTPUT("y"),
    ALGEBRAIC("z");

    private final String vectorName;

    SymbolRole(String vectorName) {
        this.vectorName = vectorName;
    }

    /**
     * @return short vector name used by generated artifacts ({@code u}, {@code p}, ...)
     */
    public String getVectorName() {
        return vectorName;
    }

    /**
     * @return true for the roles solved by the residual system ({@code x_dot}, {@code y}, {@code z})
     */
    public boolean isUnknown() {
        return this == STATE_DERIVATIVE || this == OUTPUT || this == ALGEBRAIC;
    }
}
