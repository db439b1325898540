package com.spectral.rtm.jacobian;

/**
 * Radiance sensitivities, {@code [channel][element]}.
 *
 * @param kRt      with respect to the radiative transfer state
 * @param kSurface with respect to the surface state
 */
public record RtJacobians(double[][] kRt, double[][] kSurface) {
}
