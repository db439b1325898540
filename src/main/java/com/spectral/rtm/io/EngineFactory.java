package com.spectral.rtm.io;

import com.spectral.rtm.api.RtmEngine;

/** Creates an engine from its merged parameters. */
@FunctionalInterface
public interface EngineFactory {
    RtmEngine create(EngineParameters params);
}
