package io.github.cyfko.flatdae.core.api;

import io.github.cyfko.flatdae.core.ast.StoredDefinition;
import io.github.cyfko.flatdae.core.dae.DaeModel;
import io.github.cyfko.flatdae.core.exception.ClassificationException;
import io.github.cyfko.flatdae.core.exception.ResetWithoutConditionException;
import io.github.cyfko.flatdae.core.exception.UnresolvedReferenceException;

/**
 * Interface for turning one parsed model into a flat hybrid DAE.
 * <p>
 * Flattening fails closed: a declaration or equation that cannot be classified aborts the
 * whole model, nothing is dropped silently.
 * </p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Every symbol receives exactly one role</li>
 *   <li>Every {@code der(x)} makes {@code x} a state with one derivative entry, however many times it occurs</li>
 *   <li>Every reset has a condition of the same name</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface Flattener {

    /**
     * Flattens the class named {@code modelName}.
     *
     * @param unit      parsed compilation unit
     * @param modelName dotted class name inside the unit, such as {@code "BouncingBall"} or {@code "Pkg.M"}
     * @return the immutable DAE model
     * @throws UnresolvedReferenceException   if the model, a referenced symbol or a called function is unknown
     * @throws ClassificationException        if a declaration, modifier or equation cannot be classified
     * @throws ResetWithoutConditionException if a {@code reinit} statement has no configured condition
     */
    DaeModel flatten(StoredDefinition unit, String modelName);
}
