package com.spectral.rtm.lut;

/** Units of angular input data. */
public enum AngleUnits {
    DEGREES("d"),
    RADIANS("r");

    private final String code;

    AngleUnits(String code) {
        this.code = code;
    }

    public double toDegrees(double value) {
        return this == RADIANS ? Math.toDegrees(value) : value;
    }

    public static AngleUnits fromString(String text) {
        for (AngleUnits u : values()) {
            if (u.code.equalsIgnoreCase(text) || u.name().equalsIgnoreCase(text))
                return u;
        }
        throw new IllegalArgumentException("Unknown angle units: " + text + "; expected d or r");
    }
}
