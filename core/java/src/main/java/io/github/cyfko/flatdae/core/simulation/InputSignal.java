package io.github.cyfko.flatdae.core.simulation;

/**
 * Values of the model inputs {@code u} as a function of time, in {@code u} order.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface InputSignal {

    double[] valuesAt(double time);

    static InputSignal constant(double... values) {
        double[] copy = values.clone();
        return time -> copy.clone();
    }
}
