package io.github.cyfko.flatdae.core.config;

/**
 * Numeric settings of the hybrid simulator.
 *
 * <h2>Settings</h2>
 * <ul>
 *   <li><strong>maxEvents</strong>: event bound; reaching it stops the run without error (default: 100)</li>
 *   <li><strong>eventTolerance</strong>: width of the bisection interval that localizes an event, as a
 *       fraction of the step {@code dt} (default: 1e-6)</li>
 *   <li><strong>residualTolerance</strong>: Newton convergence threshold on the residual norm (default: 1e-10)</li>
 *   <li><strong>maxNewtonIterations</strong>: Newton iteration cap per residual solve (default: 50)</li>
 * </ul>
 *
 * <pre>{@code
 * SimulationPolicy policy = SimulationPolicy.builder()
 *     .maxEvents(20)
 *     .build();
 * }</pre>
 *
 * @param maxEvents           maximum number of events handled in one run
 * @param eventTolerance      relative event localization tolerance
 * @param residualTolerance   absolute residual tolerance
 * @param maxNewtonIterations Newton iteration cap
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SimulationPolicy(
        int maxEvents,
        double eventTolerance,
        double residualTolerance,
        int maxNewtonIterations
) {

    public SimulationPolicy {
        if (maxEvents < 0) {
            throw new IllegalArgumentException("maxEvents must not be negative, got: " + maxEvents);
        }
        if (!(eventTolerance > 0 && eventTolerance < 1)) {
            throw new IllegalArgumentException("eventTolerance must be in (0, 1), got: " + eventTolerance);
        }
        if (!(residualTolerance > 0)) {
            throw new IllegalArgumentException("residualTolerance must be positive, got: " + residualTolerance);
        }
        if (maxNewtonIterations <= 0) {
            throw new IllegalArgumentException("maxNewtonIterations must be positive, got: " + maxNewtonIterations);
        }
    }

    public static SimulationPolicy defaults() {
        return new SimulationPolicy(100, 1e-6, 1e-10, 50);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int _maxEvents = 100;
        private double _eventTolerance = 1e-6;
        private double _residualTolerance = 1e-10;
        private int _maxNewtonIterations = 50;

        private Builder() {}

        public SimulationPolicy build() {
            return new SimulationPolicy(_maxEvents, _eventTolerance, _residualTolerance, _maxNewtonIterations);
        }

        public Builder maxEvents(int maxEvents) { this._maxEvents = maxEvents; return this; }
        public Builder eventTolerance(double eventTolerance) { this._eventTolerance = eventTolerance; return this; }
        public Builder residualTolerance(double residualTolerance) { this._residualTolerance = residualTolerance; return this; }
        public Builder maxNewtonIterations(int maxNewtonIterations) { this._maxNewtonIterations = maxNewtonIterations; return this; }
    }
}
