package com.spectral.rtm.jacobian;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Forward finite differences for functions without a closed-form gradient.
 *
 * <p>
 * Formula: {@code d_i f(x) = (f(x + p_i) - f(x)) / eps}, where {@code p_i}
 * displaces element {@code i} only, as chosen by the {@link Perturbation}.
 */
public final class FiniteDifference {

    private FiniteDifference() {
        // Utility class
    }

    /**
     * Directional derivative of {@code f} at {@code x} along basis vector
     * {@code i}.
     *
     * @param f    function to differentiate; must not modify its argument
     * @param x    evaluation point (not modified)
     * @param fx   {@code f(x)}, computed once by the caller and shared by all
     *             columns
     * @param i    element to perturb
     * @param mode absolute or relative displacement
     * @param eps  step
     * @return one Jacobian column
     */
    public static double[] directionalDerivative(UnaryOperator<double[]> f, double[] x, double[] fx, int i,
            Perturbation mode, double eps) {
        double[] xp = x.clone();
        xp[i] = mode.apply(x[i], eps);
        double[] fp = f.apply(xp);
        if (fp.length != fx.length) {
            throw new IllegalStateException("Perturbed evaluation returned " + fp.length + " values, expected "
                    + fx.length);
        }
        double[] column = new double[fx.length];
        for (int k = 0; k < column.length; k++)
            column[k] = (fp[k] - fx[k]) / eps;
        return column;
    }

    /**
     * Assembles columns into a {@code [rows][columns.size()]} matrix.
     */
    public static double[][] fromColumns(List<double[]> columns, int rows) {
        double[][] m = new double[rows][columns.size()];
        for (int j = 0; j < columns.size(); j++) {
            double[] col = columns.get(j);
            for (int r = 0; r < rows; r++)
                m[r][j] = col[r];
        }
        return m;
    }
}
