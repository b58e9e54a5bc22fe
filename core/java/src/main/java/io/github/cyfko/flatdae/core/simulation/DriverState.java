package io.github.cyfko.flatdae.core.simulation;

/**
 * Phases of the hybrid simulation loop.
 *
 * <pre>
 * INTEGRATING --condition false→true--> EVENT_DETECTED --localized--> RESETTING --reset applied--> INTEGRATING
 * </pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum DriverState {
    /** Advancing the continuous state by fixed steps. */
    INTEGRATING,
    /** A condition fired inside the last step; the crossing is being localized. */
    EVENT_DETECTED,
    /** Evaluating the reset blocks of the fired conditions against the pre-event state. */
    RESETTING
}
