package com.spectral.rtm.engine;

/**
 * Closed-form optical relations used around the forward model.
 */
public final class OpticalRelations {
    /** Refractive index of water. */
    public static final double WATER_REFRACTIVE_INDEX = 1.33;

    /** Sky reflectance factor of a water surface seen at nadir. */
    public static final double NADIR_SKY_REFLECTANCE = 0.02;

    /** Surface Rayleigh scattering coefficient at 550 nm, km-1. */
    private static final double RAYLEIGH_550 = 0.01159;

    private OpticalRelations() {
        // Utility class
    }

    /**
     * Reflectance factor of sky radiance on a water surface from the Fresnel
     * equations for unpolarised light.
     *
     * @param viewZenith to-sensor zenith in degrees
     */
    public static double fresnelSkyReflectance(double viewZenith) {
        if (viewZenith <= 0.0)
            return NADIR_SKY_REFLECTANCE;

        double theta = Math.toRadians(viewZenith);
        // Snell's law
        double thetaT = Math.asin(Math.sin(theta) / WATER_REFRACTIVE_INDEX);

        double rs = Math.pow(Math.sin(theta - thetaT), 2) / Math.pow(Math.sin(theta + thetaT), 2);
        double rp = Math.pow(Math.tan(theta - thetaT), 2) / Math.pow(Math.tan(theta + thetaT), 2);
        return 0.5 * Math.abs(rs + rp);
    }

    /**
     * Horizontal visibility in km from the surface aerosol extinction at
     * 550 nm (km-1): {@code VIS = ln(50) / (EXT550 + 0.01159)}.
     */
    public static double ext550ToVisibility(double ext550) {
        return Math.log(50.0) / (ext550 + RAYLEIGH_550);
    }
}
