package com.spectral.rtm.io;

import java.util.Arrays;
import java.util.List;

/**
 * The fixed set of radiative transfer backends the compositor accepts.
 */
public enum EngineType {
    MODTRAN("modtran"),
    SIX_S("6s"),
    SRTMNET("sRTMnet"),
    KERNEL_FLOWS("KernelFlowsGP"),
    LIBRADTRAN("libradtran");

    private final String configName;

    EngineType(String configName) {
        this.configName = configName;
    }

    /** Name as written in configuration files. */
    public String configName() {
        return configName;
    }

    public static List<String> validNames() {
        return Arrays.stream(values()).map(EngineType::configName).toList();
    }

    public static EngineType fromString(String text) {
        for (EngineType t : values()) {
            if (t.configName.equalsIgnoreCase(text) || t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException(
                "Invalid radiative transfer engine choice. Got: " + text + "; Must be one of: " + validNames());
    }
}
