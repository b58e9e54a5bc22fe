package io.github.cyfko.flatdae.core.simulation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One handled event.
 *
 * @param time   localized event time
 * @param fired  names of the conditions that fired, in {@code c} order
 * @param before state just before the reset
 * @param after  state just after the reset
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record EventRecord(double time, List<String> fired, Map<String, Double> before, Map<String, Double> after) {

    public EventRecord {
        fired = List.copyOf(Objects.requireNonNull(fired, "fired cannot be null"));
        before = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(before, "before cannot be null")));
        after = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(after, "after cannot be null")));
    }
}
