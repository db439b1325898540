package com.spectral.rtm.engine;

import com.spectral.rtm.api.RtMode;

/**
 * Slice of the composite spectrum owned by one engine.
 */
public record SpectralSegment(int offset, int length, RtMode mode, boolean emissive) {

    public int end() {
        return offset + length;
    }
}
