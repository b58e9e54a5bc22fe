package io.github.cyfko.flatdae.core.ast;

/**
 * Prefix operators. {@code not} sits between {@code and} and the relational
 * operators; the signs bind at the additive level and only lead an arithmetic
 * expression.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum UnaryOperator {

    NOT("not", 3),
    MINUS("-", 5),
    PLUS("+", 5),
    MINUS_ELEM(".-", 5),
    PLUS_ELEM(".+", 5);

    private final String symbol;
    private final int precedence;

    UnaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String getSymbol() {
        return symbol;
    }

    public int getPrecedence() {
        return precedence;
    }

    /** @return the scalar sign for element-wise signs, otherwise {@code this} */
    public UnaryOperator scalar() {
        return switch (this) {
            case MINUS_ELEM -> MINUS;
            case PLUS_ELEM -> PLUS;
            default -> this;
        };
    }
}
