package com.spectral.rtm.lut;

/**
 * Per-pixel observation geometry of one scene, each band flattened line by
 * line ({@code index = line * samples + sample}).
 *
 * @param pathLength      sensor-to-ground path length, m
 * @param toSensorAzimuth degrees
 * @param toSensorZenith  degrees
 * @param toSunAzimuth    degrees
 * @param toSunZenith     degrees
 * @param utcTime         acquisition time, decimal hours UTC
 */
public record ObservationSamples(int lines, int samples, double[] pathLength, double[] toSensorAzimuth,
        double[] toSensorZenith, double[] toSunAzimuth, double[] toSunZenith, double[] utcTime) {

    public ObservationSamples {
        int n = lines * samples;
        for (double[] band : new double[][] { pathLength, toSensorAzimuth, toSensorZenith, toSunAzimuth,
                toSunZenith, utcTime }) {
            if (band == null || band.length != n)
                throw new IllegalArgumentException("Observation band length mismatch: expected " + n);
        }
    }
}
