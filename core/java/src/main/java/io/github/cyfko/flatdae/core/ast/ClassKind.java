package io.github.cyfko.flatdae.core.ast;

/**
 * Class restriction selected by the class prefixes.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum ClassKind {
    CLASS("class"),
    MODEL("model"),
    RECORD("record"),
    OPERATOR_RECORD("operator record"),
    BLOCK("block"),
    CONNECTOR("connector"),
    EXPANDABLE_CONNECTOR("expandable connector"),
    TYPE("type"),
    PACKAGE("package"),
    FUNCTION("function"),
    OPERATOR_FUNCTION("operator function"),
    OPERATOR("operator");

    private final String keyword;

    ClassKind(String keyword) {
        this.keyword = keyword;
    }

    /** @return the prefix keywords as written in source */
    public String getKeyword() {
        return keyword;
    }

    /**
     * Kinds that may hold the variables and equations of a simulated system.
     *
     * @return {@code true} for {@code model}, {@code block} and {@code class}
     */
    public boolean isSimulatable() {
        return this == MODEL || this == BLOCK || this == CLASS;
    }
}
