package com.spectral.rtm.lut;

/**
 * Scene geometry reduced to means and table coordinates. Each grid holds at
 * least one value: when the data do not justify a grid it carries the mean.
 */
public record ObservationSummary(
        AcquisitionTime acquisitionTime,
        double meanPathKm,
        double meanToSensorZenith,
        double meanToSunZenith,
        double meanToSunAzimuth,
        double meanRelativeAzimuth,
        double[] toSensorZenithGrid,
        double[] toSunZenithGrid,
        double[] relativeAzimuthGrid,
        int validCount) {
}
