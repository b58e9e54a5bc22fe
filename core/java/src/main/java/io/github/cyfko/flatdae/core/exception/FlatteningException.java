package io.github.cyfko.flatdae.core.exception;

/**
 * Base class of the failures raised while flattening a class into a DAE model.
 * <p>
 * Flattening fails closed: a construct that cannot be classified or resolved raises
 * one of the subclasses below and no partial model is produced.
 * </p>
 * <ul>
 *   <li>{@link ClassificationException}: a component, class or built-in usage has no valid role</li>
 *   <li>{@link UnresolvedReferenceException}: an expression names an undeclared symbol or function</li>
 *   <li>{@link ResetWithoutConditionException}: a {@code reinit} has no triggering condition</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FlatteningException extends RuntimeException {

    public FlatteningException(String message) {
        super(message);
    }

    public FlatteningException(String message, Throwable cause) {
        super(message, cause);
    }
}
