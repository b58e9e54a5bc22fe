package io.github.cyfko.flatdae.core.exception;

/**
 * Exception thrown when an equation, binding or condition references a component or
 * function that is not declared in the flattened scope.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class UnresolvedReferenceException extends FlatteningException {

    private final String reference;

    /**
     * @param reference the unresolved name as written
     * @param context   where it was met, e.g. {@code "equation 2 of model M"}
     */
    public UnresolvedReferenceException(String reference, String context) {
        super(String.format("Unresolved reference '%s' in %s", reference, context));
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
