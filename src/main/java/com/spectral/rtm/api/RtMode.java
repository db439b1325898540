package com.spectral.rtm.api;

/**
 * Radiometric mode of the quantities an engine returns.
 *
 * <p>
 * {@link #TRANSMITTANCE} engines report path terms in the reflectance domain;
 * they are brought to radiance with {@code E0 * cos(theta_s) / pi}.
 * {@link #RADIANCE} engines already report radiance and pass through.
 */
public enum RtMode {
    RADIANCE("rdn"),
    TRANSMITTANCE("transm");

    private final String code;

    RtMode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static RtMode fromString(String text) {
        for (RtMode m : values()) {
            if (m.code.equalsIgnoreCase(text) || m.name().equalsIgnoreCase(text)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown RtMode: " + text);
    }
}
