package com.spectral.rtm.lut;

/**
 * Mean acquisition time of a scene, truncated to whole seconds.
 *
 * @param incrementDay most of the scene was acquired on the UTC day after the
 *                     one its earliest lines started on
 */
public record AcquisitionTime(int hour, int minute, int second, boolean incrementDay) {

    /** Splits decimal hours into hour, minute and second. */
    static AcquisitionTime ofDecimalHours(double hours, boolean incrementDay) {
        double h = Math.floor(hours);
        double m = Math.floor((hours - h) * 60);
        double s = Math.floor((hours - h - m / 60.0) * 3600);
        return new AcquisitionTime((int) h, (int) m, (int) s, incrementDay);
    }
}
