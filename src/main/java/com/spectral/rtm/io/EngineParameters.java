package com.spectral.rtm.io;

import java.util.List;
import java.util.Map;

/**
 * Construction parameters of one engine after the configuration layers have
 * been merged.
 */
public record EngineParameters(
        EngineType type,
        String interpolatorStyle,
        Boolean overwriteInterpolator,
        Map<String, List<Double>> lutGrid,
        String lutPath,
        String wavelengthFile,
        ForwardModelDefinition.EngineDef engineConfig) {

    /** Engine-specific property, or the fallback when unset. */
    public Object property(String key, Object fallback) {
        Map<String, Object> props = engineConfig.getProperties();
        if (props == null)
            return fallback;
        return props.getOrDefault(key, fallback);
    }
}
