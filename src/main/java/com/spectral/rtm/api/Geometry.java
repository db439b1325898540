package com.spectral.rtm.api;

/**
 * Read-only observation geometry for one forward model evaluation.
 *
 * @param solarZenith           top-of-atmosphere solar zenith in degrees
 * @param observerZenith        to-sensor zenith in degrees (0 for nadir)
 * @param cosI                  local solar incidence cosine from slope and
 *                              aspect, or {@code null} for flat terrain
 * @param backgroundReflectance adjacency background reflectance, or
 *                              {@code null} to use the target reflectance
 */
public record Geometry(double solarZenith, double observerZenith, Double cosI, double[] backgroundReflectance) {

    /** Flat, nadir-viewing geometry without adjacency background. */
    public static Geometry ofSolarZenith(double solarZenith) {
        return new Geometry(solarZenith, 0.0, null, null);
    }

    public Geometry withCosI(double cosI) {
        return new Geometry(solarZenith, observerZenith, cosI, backgroundReflectance);
    }

    public Geometry withBackgroundReflectance(double[] bg) {
        return new Geometry(solarZenith, observerZenith, cosI, bg);
    }

    public Geometry withObserverZenith(double zenith) {
        return new Geometry(solarZenith, zenith, cosI, backgroundReflectance);
    }

    public boolean hasCosI() {
        return cosI != null;
    }

    public boolean hasBackgroundReflectance() {
        return backgroundReflectance != null;
    }

    /** Cosine of the top-of-atmosphere solar zenith. */
    public double cosSolarZenith() {
        return Math.cos(Math.toRadians(solarZenith));
    }
}
