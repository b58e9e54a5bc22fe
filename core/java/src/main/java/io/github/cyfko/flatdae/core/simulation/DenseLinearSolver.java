package io.github.cyfko.flatdae.core.simulation;

import io.github.cyfko.flatdae.core.exception.SimulationException;

/**
 * Gaussian elimination with partial pivoting on small dense systems.
 * <p>
 * A pivot counts as zero when it is below {@code 1e-12} times the infinity norm of the
 * matrix, so the singularity test does not depend on the scale of the entries.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
final class DenseLinearSolver {

    private static final double RELATIVE_PIVOT_THRESHOLD = 1e-12;

    private DenseLinearSolver() {}

    /**
     * Solves {@code a · x = b}. Inputs are not modified.
     *
     * @throws SimulationException if the matrix is singular
     */
    static double[] solve(double[][] a, double[] b) {
        int n = b.length;
        double norm = 0;
        for (int i = 0; i < n; i++) {
            double rowSum = 0;
            for (int j = 0; j < n; j++) rowSum += Math.abs(a[i][j]);
            norm = Math.max(norm, rowSum);
        }
        double threshold = RELATIVE_PIVOT_THRESHOLD * norm;

        double[][] m = new double[n][];
        for (int i = 0; i < n; i++) {
            m[i] = new double[n + 1];
            System.arraycopy(a[i], 0, m[i], 0, n);
            m[i][n] = b[i];
        }

        for (int col = 0; col < n; col++) {
            int pivot = col;
            for (int row = col + 1; row < n; row++) {
                if (Math.abs(m[row][col]) > Math.abs(m[pivot][col])) pivot = row;
            }
            if (Math.abs(m[pivot][col]) <= threshold) {
                throw new SimulationException("Singular Jacobian: unknown #" + col + " is not determined by the residuals");
            }
            double[] swap = m[col];
            m[col] = m[pivot];
            m[pivot] = swap;

            for (int row = col + 1; row < n; row++) {
                double factor = m[row][col] / m[col][col];
                if (factor == 0) continue;
                for (int k = col; k <= n; k++) {
                    m[row][k] -= factor * m[col][k];
                }
            }
        }

        double[] x = new double[n];
        for (int row = n - 1; row >= 0; row--) {
            double sum = m[row][n];
            for (int k = row + 1; k < n; k++) {
                sum -= m[row][k] * x[k];
            }
            x[row] = sum / m[row][row];
        }
        return x;
    }
}
