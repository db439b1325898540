package com.spectral.rtm.io;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import com.spectral.rtm.api.RtmEngine;

import lombok.extern.log4j.Log4j2;

/**
 * Registry mapping {@link EngineType}s to their instantiation factories.
 *
 * <p>
 * Concrete table-backed engines live outside this library; the embedding
 * application registers one factory per backend it ships.
 */
@Log4j2
public final class EngineRegistry {
    private final Map<EngineType, EngineFactory> registry = new EnumMap<>(EngineType.class);

    public EngineRegistry registerFactory(EngineType type, EngineFactory factory) {
        EngineFactory previous = registry.put(type, factory);
        if (previous != null)
            log.debug("Replaced engine factory for {}", type.configName());
        return this;
    }

    public EngineRegistry registerFactory(String engineName, EngineFactory factory) {
        return registerFactory(EngineType.fromString(engineName), factory);
    }

    public boolean isRegistered(EngineType type) {
        return registry.containsKey(type);
    }

    public Set<EngineType> registeredTypes() {
        return registry.keySet();
    }

    /**
     * Instantiates the engine described by the parameters.
     *
     * @throws IllegalStateException if no factory is registered for the type.
     */
    public RtmEngine create(EngineParameters params) {
        EngineFactory factory = registry.get(params.type());
        if (factory == null) {
            String msg = "No engine factory registered for " + params.type().configName()
                    + "; registered: " + registry.keySet().stream().map(EngineType::configName).toList();
            log.error(msg);
            throw new IllegalStateException(msg);
        }
        return factory.create(params);
    }
}
