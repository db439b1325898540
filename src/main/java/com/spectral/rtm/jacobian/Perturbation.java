package com.spectral.rtm.jacobian;

/**
 * How a state element is displaced for a one-sided finite difference.
 * Both variants divide the response by the bare epsilon.
 */
public enum Perturbation {
    /** {@code x + eps}. */
    ABSOLUTE {
        @Override
        public double apply(double x, double eps) {
            return x + eps;
        }
    },
    /** {@code x * (1 + eps)}. */
    RELATIVE {
        @Override
        public double apply(double x, double eps) {
            return x * (1.0 + eps);
        }
    };

    public abstract double apply(double x, double eps);
}
