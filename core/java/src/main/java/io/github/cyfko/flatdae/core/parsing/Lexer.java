package io.github.cyfko.flatdae.core.parsing;

import io.github.cyfko.flatdae.core.ast.SourcePosition;
import io.github.cyfko.flatdae.core.config.ParserPolicy;
import io.github.cyfko.flatdae.core.exception.LexException;
import io.github.cyfko.flatdae.core.exception.ParseException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;

/**
 * Tokenizer for model source text.
 * <p>
 * The lexer is a finite, restartable sequence: every call to {@link #iterator()} scans
 * the source from the start and ends with exactly one {@link TokenKind#EOF} token.
 * Whitespace, {@code //} line comments and {@code /* *}{@code /} block comments are skipped.
 * </p>
 *
 * <h2>Lexical rules</h2>
 * <ul>
 *   <li>Identifier: {@code [_a-zA-Z][_a-zA-Z0-9]*}, keywords are reserved</li>
 *   <li>Unsigned integer: {@code [0-9]+}</li>
 *   <li>Unsigned real: {@code [0-9]+ ['.' [0-9]*] [(e|E) [+|-] [0-9]+]} with a fraction or an exponent</li>
 *   <li>String: double-quoted, escapes {@code \" \\ \n \t \r \'}</li>
 *   <li>Operators: the longest match among {@code == <> <= >= := .+ .- .* ./ .^} and single characters</li>
 * </ul>
 *
 * <p>The first unrecognized character raises {@link LexException} with its UTF-8 byte offset.</p>
 *
 * <pre>{@code
 * List<Token> tokens = new Lexer("der(v) = -9.81;").tokenize();
 * // IDENT(der) ( IDENT(v) ) = - UNSIGNED_REAL(9.81) ; EOF
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class Lexer implements Iterable<Token> {

    private static final Set<Character> DOT_OPERATOR_CHARS = Set.of('+', '-', '*', '/', '^');

    private final String source;

    /**
     * @param source source text
     * @throws NullPointerException if source is null
     */
    public Lexer(String source) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
    }

    /**
     * @param source source text
     * @param policy limits to enforce
     * @throws ParseException if the source exceeds {@link ParserPolicy#maxSourceLength()}
     */
    public Lexer(String source, ParserPolicy policy) {
        this(source);
        if (source.length() > policy.maxSourceLength()) {
            throw new ParseException(String.format(
                    "Source too long (%d characters, max: %d). Policy applied: %s",
                    source.length(), policy.maxSourceLength(), policy.policyName()),
                    new SourcePosition(0, 1, 1), "", Set.of());
        }
    }

    /**
     * Scans the whole source.
     *
     * @return all tokens, the last one being {@link TokenKind#EOF}
     * @throws LexException on the first unrecognized character
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        for (Token token : this) {
            tokens.add(token);
        }
        return tokens;
    }

    @Override
    public Iterator<Token> iterator() {
        return new Scanner();
    }

    private final class Scanner implements Iterator<Token> {
        private int pos = 0;
        private int line = 1;
        private int lineStart = 0;
        private boolean done = false;

        @Override
        public boolean hasNext() {
            return !done;
        }

        @Override
        public Token next() {
            if (done) throw new NoSuchElementException();
            skipTrivia();
            if (pos >= source.length()) {
                done = true;
                return new Token(TokenKind.EOF, "", position(pos));
            }

            char c = source.charAt(pos);
            if (isIdentStart(c)) return identifier();
            if (isDigit(c)) return number();
            if (c == '"') return string();
            return operator();
        }

        private void skipTrivia() {
            while (pos < source.length()) {
                char c = source.charAt(pos);
                if (c == '\n') {
                    pos++;
                    line++;
                    lineStart = pos;
                } else if (Character.isWhitespace(c)) {
                    pos++;
                } else if (c == '/' && peek(1) == '/') {
                    while (pos < source.length() && source.charAt(pos) != '\n') pos++;
                } else if (c == '/' && peek(1) == '*') {
                    int start = pos;
                    pos += 2;
                    while (pos < source.length() && !(source.charAt(pos) == '*' && peek(1) == '/')) {
                        if (source.charAt(pos) == '\n') {
                            line++;
                            lineStart = pos + 1;
                        }
                        pos++;
                    }
                    if (pos >= source.length()) {
                        throw lexError("Unterminated block comment", start);
                    }
                    pos += 2;
                } else {
                    return;
                }
            }
        }

        private Token identifier() {
            int start = pos;
            while (pos < source.length() && isIdentPart(source.charAt(pos))) pos++;
            String word = source.substring(start, pos);
            return new Token(TokenKind.keywordOrIdent(word), word, position(start));
        }

        private Token number() {
            int start = pos;
            boolean real = false;
            while (pos < source.length() && isDigit(source.charAt(pos))) pos++;

            // "2.*x" keeps ".*" as an operator
            if (peek(0) == '.' && !DOT_OPERATOR_CHARS.contains(peek(1))) {
                real = true;
                pos++;
                while (pos < source.length() && isDigit(source.charAt(pos))) pos++;
            }

            if (peek(0) == 'e' || peek(0) == 'E') {
                int mark = pos;
                pos++;
                if (peek(0) == '+' || peek(0) == '-') pos++;
                if (!isDigit(peek(0))) {
                    throw lexError("Malformed exponent in number '" + source.substring(start, pos) + "'", mark);
                }
                while (pos < source.length() && isDigit(source.charAt(pos))) pos++;
                real = true;
            }

            return new Token(real ? TokenKind.UNSIGNED_REAL : TokenKind.UNSIGNED_INTEGER,
                    source.substring(start, pos), position(start));
        }

        private Token string() {
            int start = pos;
            pos++;
            StringBuilder sb = new StringBuilder();
            while (pos < source.length()) {
                char c = source.charAt(pos++);
                if (c == '"') {
                    return new Token(TokenKind.STRING, sb.toString(), position(start));
                }
                if (c == '\\') {
                    if (pos >= source.length()) break;
                    char e = source.charAt(pos++);
                    switch (e) {
                        case '"', '\\', '\'' -> sb.append(e);
                        case 'n' -> sb.append('\n');
                        case 't' -> sb.append('\t');
                        case 'r' -> sb.append('\r');
                        default -> throw lexError("Invalid escape sequence '\\" + e + "'", pos - 2);
                    }
                } else {
                    if (c == '\n') {
                        line++;
                        lineStart = pos;
                    }
                    sb.append(c);
                }
            }
            throw lexError("Unterminated string literal", start);
        }

        private Token operator() {
            int start = pos;
            char c = source.charAt(pos);
            String two = pos + 1 < source.length() ? source.substring(pos, pos + 2) : "";

            TokenKind kind = switch (two) {
                case "==" -> TokenKind.EQ_EQ;
                case "<>" -> TokenKind.NOT_EQ;
                case "<=" -> TokenKind.LE;
                case ">=" -> TokenKind.GE;
                case ":=" -> TokenKind.COLON_ASSIGN;
                case ".+" -> TokenKind.DOT_PLUS;
                case ".-" -> TokenKind.DOT_MINUS;
                case ".*" -> TokenKind.DOT_STAR;
                case "./" -> TokenKind.DOT_SLASH;
                case ".^" -> TokenKind.DOT_CARET;
                default -> null;
            };
            if (kind != null) {
                pos += 2;
                return new Token(kind, two, position(start));
            }

            kind = switch (c) {
                case '(' -> TokenKind.LPAREN;
                case ')' -> TokenKind.RPAREN;
                case '[' -> TokenKind.LBRACKET;
                case ']' -> TokenKind.RBRACKET;
                case '{' -> TokenKind.LBRACE;
                case '}' -> TokenKind.RBRACE;
                case ',' -> TokenKind.COMMA;
                case ';' -> TokenKind.SEMICOLON;
                case ':' -> TokenKind.COLON;
                case '.' -> TokenKind.DOT;
                case '=' -> TokenKind.ASSIGN;
                case '<' -> TokenKind.LT;
                case '>' -> TokenKind.GT;
                case '+' -> TokenKind.PLUS;
                case '-' -> TokenKind.MINUS;
                case '*' -> TokenKind.STAR;
                case '/' -> TokenKind.SLASH;
                case '^' -> TokenKind.CARET;
                default -> null;
            };
            if (kind == null) {
                throw lexError(String.format("Unrecognized character '%s'", printable(source.codePointAt(pos))), pos);
            }
            pos++;
            return new Token(kind, String.valueOf(c), position(start));
        }

        private char peek(int ahead) {
            int i = pos + ahead;
            return i < source.length() ? source.charAt(i) : '\0';
        }

        private SourcePosition position(int offset) {
            return new SourcePosition(offset, line, offset - lineStart + 1);
        }

        private LexException lexError(String message, int offset) {
            String prefix = source.substring(0, offset);
            int byteOffset = prefix.getBytes(StandardCharsets.UTF_8).length;
            int errorLine = 1 + (int) prefix.chars().filter(ch -> ch == '\n').count();
            int column = offset - (prefix.lastIndexOf('\n') + 1) + 1;
            return new LexException(
                    String.format("%s at %d:%d (byte offset %d)", message, errorLine, column, byteOffset),
                    byteOffset, errorLine, column);
        }
    }

    private static String printable(int codePoint) {
        return Character.isISOControl(codePoint)
                ? String.format("\\u%04x", codePoint)
                : new String(Character.toChars(codePoint));
    }

    private static boolean isIdentStart(char c) {
        return c == '_' || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static boolean isIdentPart(char c) {
        return isIdentStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
