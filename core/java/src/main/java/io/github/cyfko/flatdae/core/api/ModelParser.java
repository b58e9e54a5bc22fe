package io.github.cyfko.flatdae.core.api;

import io.github.cyfko.flatdae.core.ast.Expression;
import io.github.cyfko.flatdae.core.ast.StoredDefinition;
import io.github.cyfko.flatdae.core.exception.LexException;
import io.github.cyfko.flatdae.core.exception.ParseException;

/**
 * Interface for parsing model source text into an abstract syntax tree.
 * <p>
 * Implementations turn one compilation unit into a {@link StoredDefinition}. Parsing is
 * fail-fast: the first lexical or syntactic error aborts the unit, no partial tree is
 * returned.
 * </p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Must respect the operator precedence chain, lowest to highest:
 *       {@code or}, {@code and}, {@code not}, relational, additive, multiplicative, power</li>
 *   <li>Must reject constructs outside the supported subset with
 *       {@link io.github.cyfko.flatdae.core.exception.UnsupportedConstructException}</li>
 *   <li>Must produce identical trees for identical input</li>
 * </ul>
 *
 * <pre>{@code
 * ModelParser parser = new RecursiveDescentParser();
 * StoredDefinition unit = parser.parse("model M Real a; equation a = 1; end M;");
 * Expression condition = parser.parseExpression("h < 0");
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface ModelParser {

    /**
     * Parses a compilation unit.
     *
     * @param source UTF-8 source text: optional {@code within} clause and class definitions
     * @return the stored definition
     * @throws LexException   on an unrecognized character
     * @throws ParseException on a grammar violation or an unsupported construct
     */
    StoredDefinition parse(String source);

    /**
     * Parses a standalone expression, such as an externally supplied event condition.
     *
     * @param source expression text
     * @return the expression
     * @throws LexException   on an unrecognized character
     * @throws ParseException if the text is not exactly one expression
     */
    Expression parseExpression(String source);
}
