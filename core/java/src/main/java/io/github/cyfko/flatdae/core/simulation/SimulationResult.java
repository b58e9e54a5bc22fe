package io.github.cyfko.flatdae.core.simulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sampled trajectory of one simulation run.
 * <p>
 * Sample times are strictly increasing. An event contributes one sample at the event time,
 * holding the state before the reset; the run then continues from the reset state without
 * repeating that timestamp. When the run stopped on the event bound,
 * {@link #eventLimitReached()} is true and the trajectory ends at the last event.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class SimulationResult {

    private final List<String> variables;
    private final Map<String, Integer> columns = new LinkedHashMap<>();
    private final List<Double> times = new ArrayList<>();
    private final List<double[]> rows = new ArrayList<>();
    private final List<EventRecord> events = new ArrayList<>();
    private boolean eventLimitReached;

    SimulationResult(List<String> variables) {
        this.variables = List.copyOf(variables);
        for (int i = 0; i < this.variables.size(); i++) {
            columns.put(this.variables.get(i), i);
        }
    }

    void addSample(double time, double[] row) {
        if (!times.isEmpty() && time <= times.get(times.size() - 1)) {
            throw new IllegalStateException("Sample times must increase: " + time + " after " + times.get(times.size() - 1));
        }
        times.add(time);
        rows.add(row.clone());
    }

    void addEvent(EventRecord event) {
        events.add(event);
    }

    void markEventLimitReached() {
        this.eventLimitReached = true;
    }

    /** @return recorded variable names: states, outputs, algebraics, then inputs */
    public List<String> variables() {
        return variables;
    }

    public int sampleCount() {
        return times.size();
    }

    public double[] times() {
        return times.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * @param variable flat symbol name
     * @return the value of {@code variable} at every sample
     * @throws IllegalArgumentException if the variable was not recorded
     */
    public double[] series(String variable) {
        int column = column(variable);
        return rows.stream().mapToDouble(row -> row[column]).toArray();
    }

    public double value(String variable, int sample) {
        return rows.get(sample)[column(variable)];
    }

    /** @return values of the last sample keyed by variable name */
    public Map<String, Double> lastSample() {
        Map<String, Double> last = new LinkedHashMap<>();
        if (rows.isEmpty()) return last;
        double[] row = rows.get(rows.size() - 1);
        columns.forEach((name, column) -> last.put(name, row[column]));
        return last;
    }

    public List<EventRecord> events() {
        return Collections.unmodifiableList(events);
    }

    public boolean eventLimitReached() {
        return eventLimitReached;
    }

    public Set<String> recordedVariables() {
        return Collections.unmodifiableSet(columns.keySet());
    }

    private int column(String variable) {
        Integer column = columns.get(variable);
        if (column == null) {
            throw new IllegalArgumentException("Variable not recorded: " + variable);
        }
        return column;
    }
}
