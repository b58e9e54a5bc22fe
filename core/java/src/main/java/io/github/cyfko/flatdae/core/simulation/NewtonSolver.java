package io.github.cyfko.flatdae.core.simulation;

import io.github.cyfko.flatdae.core.config.SimulationPolicy;
import io.github.cyfko.flatdae.core.exception.SimulationException;

import java.util.function.UnaryOperator;

/**
 * Newton iteration on a square residual system with a forward-difference Jacobian.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class NewtonSolver {

    private static final double DIFFERENCE_STEP = 1e-7;

    private final SimulationPolicy policy;

    NewtonSolver(SimulationPolicy policy) {
        this.policy = policy;
    }

    /**
     * @param residuals maps unknowns to residual values, same length
     * @param guess     starting point, not modified
     * @return unknowns with every residual below the tolerance
     * @throws SimulationException if the iteration does not converge or the Jacobian is singular
     */
    double[] solve(UnaryOperator<double[]> residuals, double[] guess) {
        int n = guess.length;
        double[] v = guess.clone();
        if (n == 0) {
            return v;
        }

        double[] f = residuals.apply(v);
        for (int iteration = 0; iteration < policy.maxNewtonIterations(); iteration++) {
            if (norm(f) < policy.residualTolerance()) {
                return v;
            }

            double[][] jacobian = new double[n][n];
            for (int j = 0; j < n; j++) {
                double h = DIFFERENCE_STEP * Math.max(1.0, Math.abs(v[j]));
                double saved = v[j];
                v[j] = saved + h;
                double[] shifted = residuals.apply(v);
                v[j] = saved;
                for (int i = 0; i < n; i++) {
                    jacobian[i][j] = (shifted[i] - f[i]) / h;
                }
            }

            double[] negated = new double[n];
            for (int i = 0; i < n; i++) negated[i] = -f[i];
            double[] delta = DenseLinearSolver.solve(jacobian, negated);
            for (int i = 0; i < n; i++) v[i] += delta[i];
            f = residuals.apply(v);
        }

        if (norm(f) < policy.residualTolerance()) {
            return v;
        }
        throw new SimulationException(String.format(
                "Residual system did not converge after %d Newton iterations (residual norm %.3e)",
                policy.maxNewtonIterations(), norm(f)));
    }

    private static double norm(double[] values) {
        double max = 0;
        for (double value : values) {
            if (Double.isNaN(value)) return Double.POSITIVE_INFINITY;
            max = Math.max(max, Math.abs(value));
        }
        return max;
    }
}
