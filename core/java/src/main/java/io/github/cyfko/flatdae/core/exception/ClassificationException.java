package io.github.cyfko.flatdae.core.exception;

/**
 * Exception thrown when the flattener cannot assign a role to a declaration or cannot
 * accept a class or built-in usage.
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li>{@code discrete}, {@code flow} or {@code stream} prefixes</li>
 *   <li>{@code parameter output} and similar variability/causality mixes</li>
 *   <li>unknown component type or unknown modifier</li>
 *   <li>{@code der(p)} where {@code p} is a parameter, constant or input</li>
 *   <li>{@code end} identifier not matching the class name</li>
 *   <li>two declarations flattening to the same name</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ClassificationException extends FlatteningException {

    public ClassificationException(String message) {
        super(message);
    }
}
