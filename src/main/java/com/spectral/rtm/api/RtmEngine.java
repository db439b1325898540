package com.spectral.rtm.api;

import java.util.List;
import java.util.OptionalDouble;

/**
 * A table-backed radiative transfer provider bound to one contiguous
 * wavelength sub-range.
 *
 * <p>
 * Implementations wrap precomputed look-up tables or trained emulators and
 * interpolate them at the requested state. They must be safe to query from
 * several threads at once: the compositor and the Jacobian engine call
 * {@link #query} concurrently, one call per pixel or per perturbed state.
 * A query may be expensive and blocking.
 */
public interface RtmEngine {

    /** Coupling-term names in bi-directional, hemispherical-directional,
     * directional-hemispherical, bi-hemispherical order. */
    List<String> DEFAULT_COUPLING_TERMS = List.of("dir-dir", "dif-dir", "dir-dif", "dif-dif");

    /** Short name used in diagnostics. */
    String name();

    /** Wavelength centers covered by this engine, ascending. */
    double[] wavelengths();

    /** Solar irradiance on the engine's wavelength grid. */
    double[] solarIrradiance();

    RtMode rtMode();

    /** True for thermal-range engines whose path radiance is emission. */
    boolean isEmissive();

    boolean isTopographyModel();

    boolean isGlintModel();

    default List<String> couplingTerms() {
        return DEFAULT_COUPLING_TERMS;
    }

    /**
     * Positions of the radiative transfer state elements this engine consumes.
     * The length must match the configured state vector.
     */
    int[] rtStateIndices();

    /**
     * Cosine of the solar zenith the tables were generated for, if the engine
     * carries one. Overrides the geometry's value when present.
     */
    default OptionalDouble cachedCosZenith() {
        return OptionalDouble.empty();
    }

    /**
     * Interpolates all quantities at the given radiative transfer state.
     *
     * @param xRt      radiative transfer portion of the state vector
     * @param geometry observation geometry
     * @return named quantities on this engine's wavelength grid
     */
    RtmQuantities query(double[] xRt, Geometry geometry);

    /** One-line human readable description of the engine at a state. */
    default String summarize(double[] xRt, Geometry geometry) {
        double[] wl = wavelengths();
        return String.format("%s: %d channels [%.2f..%.2f] mode=%s", name(), wl.length,
                wl[0], wl[wl.length - 1], rtMode().code());
    }
}
