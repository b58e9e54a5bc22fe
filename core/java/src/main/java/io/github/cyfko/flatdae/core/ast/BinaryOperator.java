package io.github.cyfko.flatdae.core.ast;

/**
 * Binary operators with their source symbol and grammar binding strength.
 * <p>
 * Precedence levels, lowest to highest:
 * </p>
 * <ol>
 *   <li>{@code or}</li>
 *   <li>{@code and}</li>
 *   <li>{@code not} (unary, see {@link UnaryOperator})</li>
 *   <li>relational {@code < <= > >= == <>} (non-chaining)</li>
 *   <li>additive {@code + - .+ .-}</li>
 *   <li>multiplicative {@code * / .* ./}</li>
 *   <li>power {@code ^ .^} (left-iterating chain)</li>
 * </ol>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum BinaryOperator {

    OR("or", 1, Category.LOGICAL),
    AND("and", 2, Category.LOGICAL),

    LT("<", 4, Category.RELATIONAL),
    LE("<=", 4, Category.RELATIONAL),
    GT(">", 4, Category.RELATIONAL),
    GE(">=", 4, Category.RELATIONAL),
    EQ("==", 4, Category.RELATIONAL),
    NE("<>", 4, Category.RELATIONAL),

    ADD("+", 5, Category.ARITHMETIC),
    SUB("-", 5, Category.ARITHMETIC),
    ADD_ELEM(".+", 5, Category.ARITHMETIC),
    SUB_ELEM(".-", 5, Category.ARITHMETIC),

    MUL("*", 6, Category.ARITHMETIC),
    DIV("/", 6, Category.ARITHMETIC),
    MUL_ELEM(".*", 6, Category.ARITHMETIC),
    DIV_ELEM("./", 6, Category.ARITHMETIC),

    EXP("^", 7, Category.ARITHMETIC),
    EXP_ELEM(".^", 7, Category.ARITHMETIC);

    /** Operator families. */
    public enum Category { LOGICAL, RELATIONAL, ARITHMETIC }

    private final String symbol;
    private final int precedence;
    private final Category category;

    BinaryOperator(String symbol, int precedence, Category category) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.category = category;
    }

    /** @return the operator as written in model source */
    public String getSymbol() {
        return symbol;
    }

    /** @return the grammar binding strength, higher binds tighter */
    public int getPrecedence() {
        return precedence;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isRelational() {
        return category == Category.RELATIONAL;
    }

    /**
     * Element-wise operators behave like their scalar counterpart on scalar operands,
     * which is all the supported subset has.
     *
     * @return the scalar operator for element-wise ones, otherwise {@code this}
     */
    public BinaryOperator scalar() {
        return switch (this) {
            case ADD_ELEM -> ADD;
            case SUB_ELEM -> SUB;
            case MUL_ELEM -> MUL;
            case DIV_ELEM -> DIV;
            case EXP_ELEM -> EXP;
            default -> this;
        };
    }

    /**
     * Finds the operator written as {@code symbol}.
     *
     * @param symbol source symbol
     * @return the operator, or {@code null} if none matches
     */
    public static BinaryOperator fromSymbol(String symbol) {
        for (BinaryOperator op : values()) {
            if (op.symbol.equals(symbol)) return op;
        }
        return null;
    }
}
