package io.github.cyfko.flatdae.core.simulation;

import io.github.cyfko.flatdae.core.ast.Expression;
import io.github.cyfko.flatdae.core.config.SimulationPolicy;
import io.github.cyfko.flatdae.core.dae.DaeModel;
import io.github.cyfko.flatdae.core.dae.ResetAssignment;
import io.github.cyfko.flatdae.core.dae.Residual;
import io.github.cyfko.flatdae.core.dae.Symbol;
import io.github.cyfko.flatdae.core.dae.SymbolRole;
import io.github.cyfko.flatdae.core.dae.Builtins;
import io.github.cyfko.flatdae.core.exception.SimulationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Runs a flat hybrid model on the JVM.
 * <p>
 * Between events the state is advanced with fixed-step classical Runge-Kutta. At every
 * evaluation the residual system {@code fx = 0} is solved by Newton iteration for the
 * unknowns {@code [x_dot; y; z]}. Every condition in {@code c} is an edge-triggered event:
 * it fires when it goes from false to true inside a step, the crossing is localized by
 * bisection, the reset blocks of the fired conditions are evaluated against the pre-event
 * state, and integration resumes from the reset state.
 * </p>
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Sample times are strictly increasing; the event time is recorded once, with the pre-reset state</li>
 *   <li>After {@link SimulationPolicy#maxEvents()} events the next detection stops the run, without error</li>
 *   <li>Inputs default to their start values, held constant</li>
 * </ul>
 *
 * <pre>{@code
 * SimulationResult result = new HybridSimulator().simulate(model, 0.0, 3.0, 0.01);
 * double[] h = result.series("h");
 * }</pre>
 *
 * <p>The simulator holds no per-run state and can be shared.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class HybridSimulator {

    private static final Logger log = Logger.getLogger(HybridSimulator.class.getName());

    private final SimulationPolicy policy;
    private final NewtonSolver newton;

    public HybridSimulator() {
        this(SimulationPolicy.defaults());
    }

    public HybridSimulator(SimulationPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.newton = new NewtonSolver(policy);
    }

    public SimulationPolicy getPolicy() {
        return policy;
    }

    public SimulationResult simulate(DaeModel model, double t0, double tf, double dt) {
        return simulate(model, t0, tf, dt, null);
    }

    /**
     * @param model flat model
     * @param t0    start time
     * @param tf    end time, greater than {@code t0}
     * @param dt    fixed step, positive
     * @param input input signal, or null for constant start values
     * @return sampled trajectory
     * @throws IllegalArgumentException if the time grid is invalid
     * @throws SimulationException      if the residual system cannot be solved
     */
    public SimulationResult simulate(DaeModel model, double t0, double tf, double dt, InputSignal input) {
        Objects.requireNonNull(model, "model cannot be null");
        if (!(dt > 0) || !(tf > t0)) {
            throw new IllegalArgumentException(String.format("Invalid time grid: t0=%s tf=%s dt=%s", t0, tf, dt));
        }
        int unknowns = model.xDot().size() + model.y().size() + model.z().size();
        if (unknowns != model.fx().size()) {
            throw new SimulationException(String.format(
                    "Model '%s' has %d residual equations for %d unknowns", model.name(), model.fx().size(), unknowns));
        }

        Run run = new Run(model, input, t0, tf, dt);
        SimulationResult result = run.execute();
        log.info(() -> String.format("Simulated '%s' on [%s, %s]: %d samples, %d events%s",
                model.name(), t0, tf, result.sampleCount(), result.events().size(),
                result.eventLimitReached() ? " (event limit reached)" : ""));
        return result;
    }

    /**
     * State of one simulation run.
     */
    private final class Run {
        final DaeModel model;
        final InputSignal input;
        final double tf;
        final double dt;
        final Map<String, Double> fixedValues = new LinkedHashMap<>();
        final List<Symbol> states;
        final List<Symbol> unknowns = new ArrayList<>();
        final List<String> conditionNames;
        final SimulationResult result;

        double time;
        double[] x;
        double[] lastSolution;
        boolean[] previousConditions;
        double eventTime;
        double[] eventState;
        List<String> fired = List.of();

        Run(DaeModel model, InputSignal input, double t0, double tf, double dt) {
            this.model = model;
            this.tf = tf;
            this.dt = dt;
            this.states = model.x();
            this.conditionNames = new ArrayList<>(model.c().keySet());
            unknowns.addAll(model.xDot());
            unknowns.addAll(model.y());
            unknowns.addAll(model.z());

            Map<String, Expression> fixedStarts = new LinkedHashMap<>();
            for (SymbolRole role : List.of(SymbolRole.CONSTANT, SymbolRole.PARAMETER)) {
                model.vector(role).forEach(symbol -> fixedStarts.put(symbol.name(), symbol.startOrDefault()));
            }
            fixedValues.putAll(StartValueResolver.resolve(fixedStarts, Map.of()));
            if (input == null) {
                Map<String, Expression> inputStarts = new LinkedHashMap<>();
                model.u().forEach(symbol -> inputStarts.put(symbol.name(), symbol.startOrDefault()));
                input = InputSignal.constant(StartValueResolver.resolve(inputStarts, fixedValues).values().stream()
                        .mapToDouble(Double::doubleValue)
                        .toArray());
            }
            this.input = input;

            List<String> recorded = new ArrayList<>();
            states.forEach(s -> recorded.add(s.name()));
            model.y().forEach(s -> recorded.add(s.name()));
            model.z().forEach(s -> recorded.add(s.name()));
            model.u().forEach(s -> recorded.add(s.name()));
            this.result = new SimulationResult(recorded);

            this.time = t0;
            Map<String, Expression> initialStarts = new LinkedHashMap<>();
            states.forEach(state -> initialStarts.put(state.name(), state.startOrDefault()));
            for (int i = model.xDot().size(); i < unknowns.size(); i++) {
                Symbol unknown = unknowns.get(i);
                unknown.startOpt().ifPresent(start -> initialStarts.put(unknown.name(), start));
            }
            Map<String, Double> initial = StartValueResolver.resolve(initialStarts, baseValues(t0));

            this.x = new double[states.size()];
            for (int i = 0; i < x.length; i++) {
                x[i] = initial.get(states.get(i).name());
            }
            this.lastSolution = new double[unknowns.size()];
            for (int i = model.xDot().size(); i < unknowns.size(); i++) {
                lastSolution[i] = initial.getOrDefault(unknowns.get(i).name(), 0.0);
            }
        }

        SimulationResult execute() {
            recordSample(time, x);
            previousConditions = conditions(time, x);

            DriverState state = DriverState.INTEGRATING;
            boolean running = true;
            while (running) {
                switch (state) {
                    case INTEGRATING -> {
                        if (time >= tf - 1e-12 * Math.max(1.0, Math.abs(tf))) {
                            running = false;
                        } else if (integrateStep()) {
                            state = DriverState.EVENT_DETECTED;
                        }
                    }
                    case EVENT_DETECTED -> {
                        recordSample(eventTime, eventState);
                        if (result.events().size() >= policy.maxEvents()) {
                            result.markEventLimitReached();
                            log.warning(() -> String.format("Event limit %d reached at t=%s in model '%s'",
                                    policy.maxEvents(), eventTime, model.name()));
                            running = false;
                        } else {
                            state = DriverState.RESETTING;
                        }
                    }
                    case RESETTING -> {
                        applyResets();
                        state = DriverState.INTEGRATING;
                    }
                }
            }
            return result;
        }

        /**
         * Takes one step; on a false→true transition, localizes it instead.
         *
         * @return true when an event was detected
         */
        private boolean integrateStep() {
            double h = Math.min(dt, tf - time);
            double[] next = rk4(time, x, h);
            boolean[] nextConditions = conditions(time + h, next);
            if (!rising(nextConditions)) {
                time += h;
                x = next;
                previousConditions = nextConditions;
                recordSample(time, x);
                return false;
            }

            double lo = 0;
            double hi = h;
            while (hi - lo > policy.eventTolerance() * dt) {
                double mid = 0.5 * (lo + hi);
                if (rising(conditions(time + mid, rk4(time, x, mid)))) {
                    hi = mid;
                } else {
                    lo = mid;
                }
            }

            eventTime = time + hi;
            eventState = rk4(time, x, hi);
            boolean[] atEvent = conditions(eventTime, eventState);
            List<String> names = new ArrayList<>();
            for (int i = 0; i < atEvent.length; i++) {
                if (atEvent[i] && !previousConditions[i]) names.add(conditionNames.get(i));
            }
            fired = names;
            log.fine(() -> String.format("Event %s at t=%s", fired, eventTime));
            return true;
        }

        private void applyResets() {
            Map<String, Double> preValues = fullValues(eventTime, eventState);
            ExpressionEvaluator evaluator = new ExpressionEvaluator(preValues, preValues);
            double[] reset = eventState.clone();
            for (String name : fired) {
                for (ResetAssignment assignment : model.fr().get(name).assignments()) {
                    reset[stateIndex(assignment.target())] = evaluator.evaluate(assignment.value());
                }
            }

            result.addEvent(new EventRecord(eventTime, fired, stateMap(eventState), stateMap(reset)));
            time = eventTime;
            x = reset;
            previousConditions = conditions(time, x);
        }

        private boolean rising(boolean[] candidate) {
            for (int i = 0; i < candidate.length; i++) {
                if (candidate[i] && !previousConditions[i]) return true;
            }
            return false;
        }

        private double[] rk4(double t, double[] state, double h) {
            int n = state.length;
            double[] k1 = derivatives(t, state);
            double[] k2 = derivatives(t + h / 2, axpy(state, k1, h / 2));
            double[] k3 = derivatives(t + h / 2, axpy(state, k2, h / 2));
            double[] k4 = derivatives(t + h, axpy(state, k3, h));
            double[] next = new double[n];
            for (int i = 0; i < n; i++) {
                next[i] = state[i] + h / 6 * (k1[i] + 2 * k2[i] + 2 * k3[i] + k4[i]);
            }
            return next;
        }

        private double[] axpy(double[] base, double[] direction, double factor) {
            double[] out = new double[base.length];
            for (int i = 0; i < base.length; i++) out[i] = base[i] + factor * direction[i];
            return out;
        }

        private double[] derivatives(double t, double[] state) {
            double[] solution = solve(t, state);
            double[] xDot = new double[state.length];
            System.arraycopy(solution, 0, xDot, 0, state.length);
            return xDot;
        }

        private double[] solve(double t, double[] state) {
            Map<String, Double> values = baseValues(t);
            for (int i = 0; i < states.size(); i++) {
                values.put(states.get(i).name(), state[i]);
            }
            List<Residual> fx = model.fx();
            double[] solution = newton.solve(v -> {
                for (int i = 0; i < v.length; i++) {
                    values.put(unknowns.get(i).name(), v[i]);
                }
                ExpressionEvaluator evaluator = new ExpressionEvaluator(values);
                double[] residuals = new double[fx.size()];
                for (int i = 0; i < residuals.length; i++) {
                    residuals[i] = evaluator.evaluate(fx.get(i).expression());
                }
                return residuals;
            }, lastSolution);
            lastSolution = solution;
            return solution;
        }

        private Map<String, Double> baseValues(double t) {
            Map<String, Double> values = new HashMap<>(fixedValues);
            values.put(Builtins.TIME, t);
            double[] u = input.valuesAt(t);
            if (u.length != model.u().size()) {
                throw new SimulationException(String.format(
                        "Input signal returned %d values for %d inputs", u.length, model.u().size()));
            }
            for (int i = 0; i < u.length; i++) {
                values.put(model.u().get(i).name(), u[i]);
            }
            return values;
        }

        private Map<String, Double> fullValues(double t, double[] state) {
            double[] solution = solve(t, state);
            Map<String, Double> values = baseValues(t);
            for (int i = 0; i < states.size(); i++) values.put(states.get(i).name(), state[i]);
            for (int i = 0; i < unknowns.size(); i++) values.put(unknowns.get(i).name(), solution[i]);
            return values;
        }

        private boolean[] conditions(double t, double[] state) {
            boolean[] out = new boolean[conditionNames.size()];
            if (out.length == 0) return out;
            ExpressionEvaluator evaluator = new ExpressionEvaluator(fullValues(t, state));
            for (int i = 0; i < out.length; i++) {
                out[i] = evaluator.test(model.c().get(conditionNames.get(i)));
            }
            return out;
        }

        private void recordSample(double t, double[] state) {
            Map<String, Double> values = fullValues(t, state);
            List<String> variables = result.variables();
            double[] row = new double[variables.size()];
            for (int i = 0; i < row.length; i++) {
                row[i] = values.get(variables.get(i));
            }
            result.addSample(t, row);
        }

        private Map<String, Double> stateMap(double[] state) {
            Map<String, Double> map = new LinkedHashMap<>();
            for (int i = 0; i < states.size(); i++) map.put(states.get(i).name(), state[i]);
            return map;
        }

        private int stateIndex(String name) {
            for (int i = 0; i < states.size(); i++) {
                if (states.get(i).name().equals(name)) return i;
            }
            throw new SimulationException("Reset target is not a state: " + name);
        }
    }
}
