package com.spectral.rtm.engine;

/**
 * Downward radiance at the surface, scaled by the top-of-atmosphere zenith.
 * For emissive segments the thermal downwelling is reported as direct.
 */
public record DownwardRadiance(double[] total, double[] direct, double[] diffuse) {
}
