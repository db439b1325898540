package com.spectral.rtm.io;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import com.spectral.rtm.io.ForwardModelDefinition.LayerDef;

/**
 * Resolves engine parameters from an ordered list of configuration layers.
 *
 * <p>
 * Layers are consulted first to last; the first non-null value wins. The
 * forward model uses the order engine, instrument, global.
 */
public final class LayeredConfig {
    private final List<LayerDef> layers;

    public LayeredConfig(List<LayerDef> layers) {
        this.layers = List.copyOf(layers);
    }

    /** Engine, then instrument, then global; null layers are skipped. */
    public static LayeredConfig forEngine(ForwardModelDefinition.EngineDef engine,
            ForwardModelDefinition.InstrumentDef instrument,
            ForwardModelDefinition.RadiativeTransferDef global) {
        List<LayerDef> ordered = new ArrayList<>(3);
        if (engine != null)
            ordered.add(engine);
        if (instrument != null)
            ordered.add(instrument);
        if (global != null)
            ordered.add(global);
        return new LayeredConfig(ordered);
    }

    public <T> T resolve(Function<LayerDef, T> getter) {
        for (LayerDef layer : layers) {
            T value = getter.apply(layer);
            if (value != null)
                return value;
        }
        return null;
    }

    public EngineParameters toEngineParameters(EngineType type, ForwardModelDefinition.EngineDef engine) {
        return new EngineParameters(type,
                resolve(LayerDef::getInterpolatorStyle),
                resolve(LayerDef::getOverwriteInterpolator),
                resolve(LayerDef::getLutGrid),
                resolve(LayerDef::getLutPath),
                resolve(LayerDef::getWavelengthFile),
                engine);
    }
}
