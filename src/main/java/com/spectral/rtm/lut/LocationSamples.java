package com.spectral.rtm.lut;

/**
 * Per-pixel location of one scene, flattened line by line.
 *
 * @param longitude degrees east
 * @param latitude  degrees north
 * @param elevation m above sea level
 */
public record LocationSamples(int lines, int samples, double[] longitude, double[] latitude, double[] elevation) {

    public LocationSamples {
        int n = lines * samples;
        if (longitude == null || longitude.length != n || latitude == null || latitude.length != n
                || elevation == null || elevation.length != n)
            throw new IllegalArgumentException("Location band length mismatch: expected " + n);
    }
}
