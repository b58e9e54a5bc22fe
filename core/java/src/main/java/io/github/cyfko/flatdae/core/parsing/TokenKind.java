package io.github.cyfko.flatdae.core.parsing;

import java.util.HashMap;
import java.util.Map;

/**
 * Token kinds produced by {@link Lexer}.
 * <p>
 * Keyword and symbol kinds carry their fixed spelling; {@link #IDENT},
 * {@link #UNSIGNED_INTEGER}, {@link #UNSIGNED_REAL} and {@link #STRING} take their
 * text from the source.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenKind {

    IDENT(null),
    UNSIGNED_INTEGER(null),
    UNSIGNED_REAL(null),
    STRING(null),

    // keywords
    WITHIN("within"), FINAL("final"), ENCAPSULATED("encapsulated"), PARTIAL("partial"),
    CLASS("class"), MODEL("model"), RECORD("record"), BLOCK("block"), EXPANDABLE("expandable"),
    CONNECTOR("connector"), TYPE("type"), PACKAGE("package"), PURE("pure"), IMPURE("impure"),
    OPERATOR("operator"), FUNCTION("function"), END("end"), EQUATION("equation"),
    INITIAL("initial"), ALGORITHM("algorithm"), EXTENDS("extends"), IMPORT("import"),
    PUBLIC("public"), PROTECTED("protected"), PARAMETER("parameter"), CONSTANT("constant"),
    DISCRETE("discrete"), INPUT("input"), OUTPUT("output"), FLOW("flow"), STREAM("stream"),
    AND("and"), OR("or"), NOT("not"), TRUE("true"), FALSE("false"), IF("if"), THEN("then"),
    ELSE("else"), ELSEIF("elseif"), WHEN("when"), ELSEWHEN("elsewhen"), FOR("for"), IN("in"),
    LOOP("loop"), WHILE("while"), CONNECT("connect"), ANNOTATION("annotation"), EACH("each"),
    REDECLARE("redeclare"), REPLACEABLE("replaceable"), INNER("inner"), OUTER("outer"),
    EXTERNAL("external"), BREAK("break"), RETURN("return"),

    // punctuation
    LPAREN("("), RPAREN(")"), LBRACKET("["), RBRACKET("]"), LBRACE("{"), RBRACE("}"),
    COMMA(","), SEMICOLON(";"), COLON(":"), DOT("."), ASSIGN("="), COLON_ASSIGN(":="),

    // relational
    EQ_EQ("=="), NOT_EQ("<>"), LT("<"), LE("<="), GT(">"), GE(">="),

    // arithmetic
    PLUS("+"), MINUS("-"), STAR("*"), SLASH("/"), CARET("^"),
    DOT_PLUS(".+"), DOT_MINUS(".-"), DOT_STAR(".*"), DOT_SLASH("./"), DOT_CARET(".^"),

    EOF(null);

    private static final Map<String, TokenKind> KEYWORDS = new HashMap<>();

    static {
        for (TokenKind kind : values()) {
            if (kind.spelling != null && Character.isLetter(kind.spelling.charAt(0))) {
                KEYWORDS.put(kind.spelling, kind);
            }
        }
    }

    private final String spelling;

    TokenKind(String spelling) {
        this.spelling = spelling;
    }

    /** @return the fixed spelling, or {@code null} for kinds whose text varies */
    public String getSpelling() {
        return spelling;
    }

    public boolean isKeyword() {
        return spelling != null && Character.isLetter(spelling.charAt(0));
    }

    /**
     * Returns the keyword spelled {@code word}.
     *
     * @param word identifier-shaped text
     * @return the keyword kind, or {@link #IDENT} if {@code word} is not reserved
     */
    public static TokenKind keywordOrIdent(String word) {
        return KEYWORDS.getOrDefault(word, IDENT);
    }

    /** @return a human-readable form used in diagnostics */
    public String describe() {
        return switch (this) {
            case IDENT -> "identifier";
            case UNSIGNED_INTEGER -> "integer literal";
            case UNSIGNED_REAL -> "real literal";
            case STRING -> "string literal";
            case EOF -> "end of input";
            default -> "'" + spelling + "'";
        };
    }
}
