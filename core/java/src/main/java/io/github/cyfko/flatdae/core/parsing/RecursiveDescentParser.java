package io.github.cyfko.flatdae.core.parsing;

import io.github.cyfko.flatdae.core.api.ModelParser;
import io.github.cyfko.flatdae.core.ast.*;
import io.github.cyfko.flatdae.core.config.ParserPolicy;
import io.github.cyfko.flatdae.core.exception.ParseException;
import io.github.cyfko.flatdae.core.exception.UnsupportedConstructException;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Hand-written recursive-descent parser for the supported modeling-language subset.
 * <p>
 * Each precedence level is one method; every binary level except relational loops
 * over its operator, which makes it left-associative. The power level follows the
 * grammar {@code factor = primary { ('^' | '.^') primary }} literally, so
 * {@code a ^ b ^ c} parses as {@code (a ^ b) ^ c}.
 * </p>
 *
 * <h2>Precedence (lowest to highest)</h2>
 * <ol>
 *   <li>{@code or}</li>
 *   <li>{@code and}</li>
 *   <li>{@code not} (prefix)</li>
 *   <li>{@code < <= > >= == <>} (at most one per relation)</li>
 *   <li>{@code + - .+ .-} (optional leading sign)</li>
 *   <li>{@code * / .* ./}</li>
 *   <li>{@code ^ .^}</li>
 *   <li>primary: literal, parenthesized expression, component reference, function call</li>
 * </ol>
 *
 * <p>
 * The parser object holds no per-parse state and can be shared. Nesting depth and source
 * length are bounded by the {@link ParserPolicy}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class RecursiveDescentParser implements ModelParser {

    private static final Set<TokenKind> CLASS_START = EnumSet.of(
            TokenKind.ENCAPSULATED, TokenKind.PARTIAL, TokenKind.CLASS, TokenKind.MODEL, TokenKind.RECORD,
            TokenKind.BLOCK, TokenKind.EXPANDABLE, TokenKind.CONNECTOR, TokenKind.TYPE, TokenKind.PACKAGE,
            TokenKind.PURE, TokenKind.IMPURE, TokenKind.OPERATOR, TokenKind.FUNCTION);

    private static final Set<TokenKind> SECTION_END = EnumSet.of(
            TokenKind.END, TokenKind.EQUATION, TokenKind.ALGORITHM, TokenKind.PUBLIC, TokenKind.PROTECTED,
            TokenKind.EXTERNAL, TokenKind.ANNOTATION, TokenKind.EOF);

    private final ParserPolicy policy;

    /**
     * Parser with {@link ParserPolicy#defaults()}.
     */
    public RecursiveDescentParser() {
        this(ParserPolicy.defaults());
    }

    /**
     * @param policy limits to enforce
     * @throws IllegalArgumentException if policy is null
     */
    public RecursiveDescentParser(ParserPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        this.policy = policy;
    }

    @Override
    public StoredDefinition parse(String source) {
        Objects.requireNonNull(source, "source cannot be null");
        return new Descent(new Lexer(source, policy).tokenize()).storedDefinition();
    }

    @Override
    public Expression parseExpression(String source) {
        Objects.requireNonNull(source, "source cannot be null");
        Descent descent = new Descent(new Lexer(source, policy).tokenize());
        Expression expression = descent.expression();
        descent.expect(TokenKind.EOF);
        return expression;
    }

    /**
     * State of one parse: the token list and a cursor into it.
     */
    private final class Descent {
        private final List<Token> tokens;
        private int index = 0;
        private int depth = 0;

        Descent(List<Token> tokens) {
            this.tokens = tokens;
        }

        // ------------------------------------------------------------------
        // Structure

        StoredDefinition storedDefinition() {
            Name within = null;
            if (accept(TokenKind.WITHIN)) {
                if (!check(TokenKind.SEMICOLON)) {
                    within = name();
                }
                expect(TokenKind.SEMICOLON);
            }

            List<ClassDefinition> classes = new ArrayList<>();
            while (!check(TokenKind.EOF)) {
                boolean isFinal = accept(TokenKind.FINAL);
                classes.add(classDefinition(isFinal));
                expect(TokenKind.SEMICOLON);
            }
            return new StoredDefinition(within, classes);
        }

        private ClassDefinition classDefinition(boolean isFinal) {
            enter();
            boolean encapsulated = accept(TokenKind.ENCAPSULATED);
            boolean partial = accept(TokenKind.PARTIAL);

            Purity purity = Purity.UNSPECIFIED;
            if (accept(TokenKind.PURE)) purity = Purity.PURE;
            else if (accept(TokenKind.IMPURE)) purity = Purity.IMPURE;
            ClassKind kind = classKind(purity != Purity.UNSPECIFIED);

            if (check(TokenKind.EXTENDS)) {
                throw unsupported("class extends specifier");
            }
            Token nameToken = expect(TokenKind.IDENT);
            if (check(TokenKind.ASSIGN)) {
                throw unsupported("short class specifier");
            }

            String description = description();
            Composition composition = composition();
            expect(TokenKind.END);
            Token endToken = expect(TokenKind.IDENT);
            leave();

            return new ClassDefinition(nameToken.text(), kind, encapsulated, partial, isFinal, purity,
                    description, composition, endToken.text(), nameToken.position());
        }

        private ClassKind classKind(boolean afterPurity) {
            Token token = current();
            if (afterPurity) {
                boolean operator = accept(TokenKind.OPERATOR);
                expect(TokenKind.FUNCTION);
                return operator ? ClassKind.OPERATOR_FUNCTION : ClassKind.FUNCTION;
            }
            switch (token.kind()) {
                case CLASS: advance(); return ClassKind.CLASS;
                case MODEL: advance(); return ClassKind.MODEL;
                case RECORD: advance(); return ClassKind.RECORD;
                case BLOCK: advance(); return ClassKind.BLOCK;
                case CONNECTOR: advance(); return ClassKind.CONNECTOR;
                case TYPE: advance(); return ClassKind.TYPE;
                case PACKAGE: advance(); return ClassKind.PACKAGE;
                case FUNCTION: advance(); return ClassKind.FUNCTION;
                case EXPANDABLE:
                    advance();
                    expect(TokenKind.CONNECTOR);
                    return ClassKind.EXPANDABLE_CONNECTOR;
                case OPERATOR:
                    advance();
                    if (accept(TokenKind.RECORD)) return ClassKind.OPERATOR_RECORD;
                    if (accept(TokenKind.FUNCTION)) return ClassKind.OPERATOR_FUNCTION;
                    return ClassKind.OPERATOR;
                default:
                    throw error("class prefix", Set.of("class", "model", "record", "block", "connector",
                            "type", "package", "function", "operator"));
            }
        }

        private Composition composition() {
            List<Element> elements = elementList();
            List<EquationSection> sections = new ArrayList<>();

            while (true) {
                if (check(TokenKind.EQUATION)) {
                    advance();
                    sections.add(equationSection(false));
                } else if (check(TokenKind.INITIAL) && peek(1).is(TokenKind.EQUATION)) {
                    advance();
                    advance();
                    sections.add(equationSection(true));
                } else if (check(TokenKind.ALGORITHM)
                        || (check(TokenKind.INITIAL) && peek(1).is(TokenKind.ALGORITHM))) {
                    throw unsupported("algorithm section");
                } else if (check(TokenKind.PUBLIC) || check(TokenKind.PROTECTED)) {
                    throw unsupported(current().text() + " element section");
                } else if (check(TokenKind.EXTERNAL)) {
                    throw unsupported("external function clause");
                } else if (check(TokenKind.ANNOTATION)) {
                    throw unsupported("annotation");
                } else {
                    return new Composition(elements, sections);
                }
            }
        }

        private List<Element> elementList() {
            List<Element> elements = new ArrayList<>();
            while (!SECTION_END.contains(current().kind()) && !check(TokenKind.INITIAL)) {
                elements.add(element());
                expect(TokenKind.SEMICOLON);
            }
            return elements;
        }

        private Element element() {
            switch (current().kind()) {
                case IMPORT: throw unsupported("import clause");
                case EXTENDS: throw unsupported("extends clause");
                default: break;
            }
            boolean isFinal = accept(TokenKind.FINAL);
            switch (current().kind()) {
                case REDECLARE: throw unsupported("redeclare element");
                case REPLACEABLE: throw unsupported("replaceable element");
                case INNER: throw unsupported("inner element");
                case OUTER: throw unsupported("outer element");
                default: break;
            }
            if (CLASS_START.contains(current().kind())) {
                return classDefinition(isFinal);
            }
            return componentClause();
        }

        private ComponentClause componentClause() {
            TypePrefix prefix = typePrefix();
            Name typeName = name();
            if (check(TokenKind.LBRACKET)) {
                throw unsupported("array type specifier");
            }

            List<ComponentDeclaration> components = new ArrayList<>();
            components.add(componentDeclaration());
            while (accept(TokenKind.COMMA)) {
                components.add(componentDeclaration());
            }
            return new ComponentClause(prefix, typeName, components);
        }

        private TypePrefix typePrefix() {
            TypePrefix.Connection connection = TypePrefix.Connection.NONE;
            if (accept(TokenKind.FLOW)) connection = TypePrefix.Connection.FLOW;
            else if (accept(TokenKind.STREAM)) connection = TypePrefix.Connection.STREAM;

            TypePrefix.Variability variability = TypePrefix.Variability.NONE;
            if (accept(TokenKind.DISCRETE)) variability = TypePrefix.Variability.DISCRETE;
            else if (accept(TokenKind.PARAMETER)) variability = TypePrefix.Variability.PARAMETER;
            else if (accept(TokenKind.CONSTANT)) variability = TypePrefix.Variability.CONSTANT;

            TypePrefix.Causality causality = TypePrefix.Causality.NONE;
            if (accept(TokenKind.INPUT)) causality = TypePrefix.Causality.INPUT;
            else if (accept(TokenKind.OUTPUT)) causality = TypePrefix.Causality.OUTPUT;

            return new TypePrefix(connection, variability, causality);
        }

        private ComponentDeclaration componentDeclaration() {
            Token ident = expect(TokenKind.IDENT);
            if (check(TokenKind.LBRACKET)) {
                throw unsupported("array dimensions");
            }
            Modification modification = null;
            if (check(TokenKind.LPAREN) || check(TokenKind.ASSIGN) || check(TokenKind.COLON_ASSIGN)) {
                modification = modification();
            }
            if (check(TokenKind.IF)) {
                throw unsupported("conditional component");
            }
            String description = description();
            return new ComponentDeclaration(new Declaration(ident.text(), modification, ident.position()), description);
        }

        private Modification modification() {
            if (check(TokenKind.COLON_ASSIGN)) {
                throw unsupported("':=' modification");
            }
            List<ElementModification> arguments = List.of();
            if (check(TokenKind.LPAREN)) {
                arguments = classModification();
            }
            Expression binding = null;
            if (accept(TokenKind.ASSIGN)) {
                binding = expression();
            } else if (check(TokenKind.COLON_ASSIGN)) {
                throw unsupported("':=' modification");
            }
            return new Modification(arguments, binding);
        }

        private List<ElementModification> classModification() {
            expect(TokenKind.LPAREN);
            List<ElementModification> arguments = new ArrayList<>();
            if (!check(TokenKind.RPAREN)) {
                arguments.add(argument());
                while (accept(TokenKind.COMMA)) {
                    arguments.add(argument());
                }
            }
            expect(TokenKind.RPAREN);
            return arguments;
        }

        private ElementModification argument() {
            if (check(TokenKind.REDECLARE) || check(TokenKind.REPLACEABLE)) {
                throw unsupported("element redeclaration");
            }
            boolean each = accept(TokenKind.EACH);
            boolean isFinal = accept(TokenKind.FINAL);
            Name name = name();
            Modification modification = null;
            if (check(TokenKind.LPAREN) || check(TokenKind.ASSIGN) || check(TokenKind.COLON_ASSIGN)) {
                modification = modification();
            }
            descriptionString();
            return new ElementModification(name, each, isFinal, modification);
        }

        private String description() {
            String description = descriptionString();
            if (check(TokenKind.ANNOTATION)) {
                throw unsupported("annotation");
            }
            return description;
        }

        private String descriptionString() {
            if (!check(TokenKind.STRING)) {
                return "";
            }
            StringBuilder sb = new StringBuilder(advance().text());
            while (check(TokenKind.PLUS) && peek(1).is(TokenKind.STRING)) {
                advance();
                sb.append(advance().text());
            }
            return sb.toString();
        }

        // ------------------------------------------------------------------
        // Equations

        private EquationSection equationSection(boolean initial) {
            List<Equation> equations = new ArrayList<>();
            while (!SECTION_END.contains(current().kind()) && !check(TokenKind.INITIAL)) {
                equations.add(equation());
                expect(TokenKind.SEMICOLON);
            }
            return new EquationSection(initial, equations);
        }

        private Equation equation() {
            switch (current().kind()) {
                case IF: throw unsupported("if-equation");
                case FOR: throw unsupported("for-equation");
                case WHEN: throw unsupported("when-equation");
                case CONNECT: throw unsupported("connect-equation");
                case WHILE: throw unsupported("while-statement");
                default: break;
            }

            Token start = current();
            Expression lhs = simpleExpression();
            if (accept(TokenKind.ASSIGN)) {
                Expression rhs = expression();
                return new SimpleEquation(lhs, rhs, description(), start.position());
            }
            if (lhs instanceof FunctionCall call) {
                return new FunctionCallEquation(call, description(), start.position());
            }
            throw error("'=' after the left-hand side of an equation", Set.of("'='"));
        }

        // ------------------------------------------------------------------
        // Expressions

        Expression expression() {
            if (check(TokenKind.IF)) {
                throw unsupported("if-expression");
            }
            enter();
            Expression expression = simpleExpression();
            leave();
            return expression;
        }

        private Expression simpleExpression() {
            Expression expression = logicalExpression();
            if (check(TokenKind.COLON)) {
                throw unsupported("range expression");
            }
            return expression;
        }

        private Expression logicalExpression() {
            Expression left = logicalTerm();
            while (accept(TokenKind.OR)) {
                left = new Binary(BinaryOperator.OR, left, logicalTerm());
            }
            return left;
        }

        private Expression logicalTerm() {
            Expression left = logicalFactor();
            while (accept(TokenKind.AND)) {
                left = new Binary(BinaryOperator.AND, left, logicalFactor());
            }
            return left;
        }

        private Expression logicalFactor() {
            if (accept(TokenKind.NOT)) {
                return new Unary(UnaryOperator.NOT, relation());
            }
            return relation();
        }

        private Expression relation() {
            Expression left = arithmeticExpression();
            BinaryOperator op = relationalOperator(current().kind());
            if (op == null) {
                return left;
            }
            advance();
            Expression right = arithmeticExpression();
            if (relationalOperator(current().kind()) != null) {
                Token token = current();
                throw new ParseException(String.format("Relational operators do not chain: found '%s' at %s",
                        token, token.position()), token.position(), token.text(), Set.of());
            }
            return new Binary(op, left, right);
        }

        private Expression arithmeticExpression() {
            Expression left;
            UnaryOperator sign = signOperator(current().kind());
            if (sign != null) {
                advance();
                left = new Unary(sign, term());
            } else {
                left = term();
            }

            BinaryOperator op;
            while ((op = additiveOperator(current().kind())) != null) {
                advance();
                left = new Binary(op, left, term());
            }
            return left;
        }

        private Expression term() {
            Expression left = factor();
            BinaryOperator op;
            while ((op = multiplicativeOperator(current().kind())) != null) {
                advance();
                left = new Binary(op, left, factor());
            }
            return left;
        }

        private Expression factor() {
            Expression left = primary();
            while (check(TokenKind.CARET) || check(TokenKind.DOT_CARET)) {
                BinaryOperator op = advance().is(TokenKind.CARET) ? BinaryOperator.EXP : BinaryOperator.EXP_ELEM;
                left = new Binary(op, left, primary());
            }
            return left;
        }

        private Expression primary() {
            Token token = current();
            switch (token.kind()) {
                case UNSIGNED_INTEGER:
                    advance();
                    return new Terminal(TerminalType.UNSIGNED_INTEGER, token.text());
                case UNSIGNED_REAL:
                    advance();
                    return new Terminal(TerminalType.UNSIGNED_REAL, token.text());
                case STRING:
                    advance();
                    return new Terminal(TerminalType.STRING, token.text());
                case TRUE:
                case FALSE:
                    advance();
                    return new Terminal(TerminalType.BOOLEAN, token.text());
                case LPAREN: {
                    advance();
                    Expression inner = expression();
                    if (check(TokenKind.COMMA)) {
                        throw unsupported("output expression list");
                    }
                    expect(TokenKind.RPAREN);
                    return inner;
                }
                case LBRACKET: throw unsupported("array concatenation");
                case LBRACE: throw unsupported("array constructor");
                case END: throw unsupported("'end' in subscript");
                case INITIAL:
                case PURE:
                    if (peek(1).is(TokenKind.LPAREN)) {
                        advance();
                        return new FunctionCall(Name.of(token.text()), functionCallArgs());
                    }
                    break;
                case DOT:
                case IDENT: {
                    Name name = componentReferenceName();
                    if (check(TokenKind.LPAREN)) {
                        return new FunctionCall(name, functionCallArgs());
                    }
                    return new ComponentReference(name);
                }
                default:
                    break;
            }
            throw error("expression", Set.of("number", "string", "true", "false", "'('", "identifier"));
        }

        private Name componentReferenceName() {
            boolean absolute = accept(TokenKind.DOT);
            List<String> parts = new ArrayList<>();
            parts.add(expect(TokenKind.IDENT).text());
            if (check(TokenKind.LBRACKET)) throw unsupported("array subscripts");
            while (check(TokenKind.DOT) && peek(1).is(TokenKind.IDENT)) {
                advance();
                parts.add(advance().text());
                if (check(TokenKind.LBRACKET)) throw unsupported("array subscripts");
            }
            return new Name(absolute, parts);
        }

        private List<Expression> functionCallArgs() {
            expect(TokenKind.LPAREN);
            List<Expression> args = new ArrayList<>();
            if (!check(TokenKind.RPAREN)) {
                args.add(functionArgument());
                while (accept(TokenKind.COMMA)) {
                    args.add(functionArgument());
                }
            }
            expect(TokenKind.RPAREN);
            return args;
        }

        private Expression functionArgument() {
            if (check(TokenKind.IDENT) && peek(1).is(TokenKind.ASSIGN)) {
                throw unsupported("named function argument");
            }
            if (check(TokenKind.FUNCTION)) {
                throw unsupported("function partial application");
            }
            Expression argument = expression();
            if (check(TokenKind.FOR)) {
                throw unsupported("reduction expression");
            }
            return argument;
        }

        /** Type specifier or modification name: {@code ['.'] IDENT {'.' IDENT}}. */
        private Name name() {
            boolean absolute = accept(TokenKind.DOT);
            List<String> parts = new ArrayList<>();
            parts.add(expect(TokenKind.IDENT).text());
            while (check(TokenKind.DOT) && peek(1).is(TokenKind.IDENT)) {
                advance();
                parts.add(advance().text());
            }
            return new Name(absolute, parts);
        }

        // ------------------------------------------------------------------
        // Operators

        private BinaryOperator relationalOperator(TokenKind kind) {
            return switch (kind) {
                case LT -> BinaryOperator.LT;
                case LE -> BinaryOperator.LE;
                case GT -> BinaryOperator.GT;
                case GE -> BinaryOperator.GE;
                case EQ_EQ -> BinaryOperator.EQ;
                case NOT_EQ -> BinaryOperator.NE;
                default -> null;
            };
        }

        private BinaryOperator additiveOperator(TokenKind kind) {
            return switch (kind) {
                case PLUS -> BinaryOperator.ADD;
                case MINUS -> BinaryOperator.SUB;
                case DOT_PLUS -> BinaryOperator.ADD_ELEM;
                case DOT_MINUS -> BinaryOperator.SUB_ELEM;
                default -> null;
            };
        }

        private UnaryOperator signOperator(TokenKind kind) {
            return switch (kind) {
                case PLUS -> UnaryOperator.PLUS;
                case MINUS -> UnaryOperator.MINUS;
                case DOT_PLUS -> UnaryOperator.PLUS_ELEM;
                case DOT_MINUS -> UnaryOperator.MINUS_ELEM;
                default -> null;
            };
        }

        private BinaryOperator multiplicativeOperator(TokenKind kind) {
            return switch (kind) {
                case STAR -> BinaryOperator.MUL;
                case SLASH -> BinaryOperator.DIV;
                case DOT_STAR -> BinaryOperator.MUL_ELEM;
                case DOT_SLASH -> BinaryOperator.DIV_ELEM;
                default -> null;
            };
        }

        // ------------------------------------------------------------------
        // Cursor

        private Token current() {
            return tokens.get(index);
        }

        private Token peek(int ahead) {
            int i = Math.min(index + ahead, tokens.size() - 1);
            return tokens.get(i);
        }

        private Token advance() {
            Token token = current();
            if (!token.is(TokenKind.EOF)) index++;
            return token;
        }

        private boolean check(TokenKind kind) {
            return current().is(kind);
        }

        private boolean accept(TokenKind kind) {
            if (check(kind)) {
                advance();
                return true;
            }
            return false;
        }

        Token expect(TokenKind kind) {
            if (check(kind)) {
                return advance();
            }
            throw error(kind.describe(), Set.of(kind.describe()));
        }

        private void enter() {
            if (++depth > policy.maxNestingDepth()) {
                Token token = current();
                throw new ParseException(String.format(
                        "Nesting too deep (max: %d) at %s. Policy applied: %s",
                        policy.maxNestingDepth(), token.position(), policy.policyName()),
                        token.position(), token.text(), Set.of());
            }
        }

        private void leave() {
            depth--;
        }

        private ParseException error(String what, Set<String> expected) {
            Token token = current();
            return new ParseException(
                    String.format("Expected %s but found '%s' at %s", what, token, token.position()),
                    token.position(), token.toString(), new LinkedHashSet<>(expected));
        }

        private UnsupportedConstructException unsupported(String construct) {
            Token token = current();
            return new UnsupportedConstructException(construct, token.position(), token.toString());
        }
    }
}
