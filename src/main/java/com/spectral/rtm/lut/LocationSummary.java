package com.spectral.rtm.lut;

/**
 * Scene location reduced to means and the elevation grid (the mean elevation
 * alone when no grid is warranted). Longitude is positive west.
 */
public record LocationSummary(double meanLatitude, double meanLongitude, double meanElevationKm,
        double[] elevationGrid) {
}
