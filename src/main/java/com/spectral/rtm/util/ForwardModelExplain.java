package com.spectral.rtm.util;

import com.spectral.rtm.api.Geometry;
import com.spectral.rtm.api.RtmEngine;
import com.spectral.rtm.api.RtmQuantities;
import com.spectral.rtm.api.StateElement;
import com.spectral.rtm.engine.RadiativeTransfer;
import com.spectral.rtm.engine.SpectralSegment;

/**
 * Diagnostic utility for inspecting a composed forward model.
 *
 * <p>
 * Generates human-readable descriptions of the engine layout, the state
 * vector and the quantities returned at a given state.
 *
 * <p>
 * <b>Usage:</b> Intended for debugging sessions and logging errors.
 * Do <b>not</b> use per pixel (queries every engine, allocates strings).
 */
public final class ForwardModelExplain {
    private final RadiativeTransfer rt;

    public ForwardModelExplain(RadiativeTransfer rt) {
        this.rt = rt;
    }

    /**
     * Dumps the engines in wavelength order with their channel ranges.
     */
    public String dumpEngines() {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Radiative transfer (").append(rt.engines().size()).append(" engines, ")
                .append(rt.channelCount()).append(" channels):\n");
        for (int i = 0; i < rt.engines().size(); i++) {
            RtmEngine e = rt.engines().get(i);
            SpectralSegment seg = rt.segments().get(i);
            double[] wl = e.wavelengths();
            sb.append("  [").append(i).append("] ").append(e.name())
                    .append(" channels ").append(seg.offset()).append("..").append(seg.end() - 1)
                    .append(String.format(" (%.2f..%.2f nm)", wl[0], wl[wl.length - 1]))
                    .append(" mode=").append(e.rtMode().code());
            if (e.isEmissive())
                sb.append(" (EMISSIVE)");
            if (e.isTopographyModel())
                sb.append(" (TOPO)");
            if (e.isGlintModel())
                sb.append(" (GLINT)");
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps the state vector with bounds and priors, followed by the unknowns.
     */
    public String dumpStateVector() {
        StringBuilder sb = new StringBuilder(512);
        sb.append("Statevector (").append(rt.stateVector().size()).append(" elements):\n");
        for (StateElement e : rt.stateVector().elements()) {
            sb.append(String.format("  %s bounds=[%g, %g] scale=%g init=%g prior=%g+-%g%n", e.name(),
                    e.lowerBound(), e.upperBound(), e.scale(), e.init(), e.priorMean(), e.priorSigma()));
        }
        double[] values = rt.unknownValues();
        if (values.length > 0) {
            sb.append("Unknowns:\n");
            for (int i = 0; i < values.length; i++)
                sb.append(String.format("  %s=%g%n", rt.unknownNames().get(i), values[i]));
        }
        return sb.toString();
    }

    /**
     * Lists the merged quantities at the given state; placeholders are marked.
     */
    public String explainQuantities(double[] xRt, Geometry geom) {
        RtmQuantities r = rt.getSharedRtmQuantities(xRt, geom);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Shared quantities (").append(r.size()).append("):\n");
        for (String name : r.names()) {
            sb.append("  ").append(name);
            if (r.isPlaceholder(name))
                sb.append(" (PLACEHOLDER)");
            else
                sb.append(" [").append(r.get(name).length).append(']');
            sb.append('\n');
        }
        sb.append(rt.summarize(xRt, geom)).append('\n');
        return sb.toString();
    }
}
