package io.github.cyfko.flatdae.core.ast;

import java.util.Objects;

/**
 * {@code [flow|stream] [discrete|parameter|constant] [input|output]} prefix of a
 * component clause. Each group is independent and optional.
 *
 * @param connection  connector prefix
 * @param variability variability prefix
 * @param causality   causality prefix
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record TypePrefix(Connection connection, Variability variability, Causality causality) {

    public static final TypePrefix NONE = new TypePrefix(Connection.NONE, Variability.NONE, Causality.NONE);

    public TypePrefix {
        Objects.requireNonNull(connection, "connection cannot be null");
        Objects.requireNonNull(variability, "variability cannot be null");
        Objects.requireNonNull(causality, "causality cannot be null");
    }

    public boolean isEmpty() {
        return connection == Connection.NONE && variability == Variability.NONE && causality == Causality.NONE;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (connection != Connection.NONE) sb.append(connection.name().toLowerCase()).append(' ');
        if (variability != Variability.NONE) sb.append(variability.name().toLowerCase()).append(' ');
        if (causality != Causality.NONE) sb.append(causality.name().toLowerCase()).append(' ');
        return sb.toString().trim();
    }

    public enum Connection { NONE, FLOW, STREAM }

    public enum Variability { NONE, DISCRETE, PARAMETER, CONSTANT }

    public enum Causality { NONE, INPUT, OUTPUT }
}
