package io.github.cyfko.flatdae.core.exception;

/**
 * Exception thrown when the hybrid simulator cannot evaluate the model, for instance
 * when the residual system is singular or Newton iterations do not converge.
 * <p>
 * Reaching the event bound is not an error; it is reported on the result.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class SimulationException extends RuntimeException {

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
