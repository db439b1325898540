package com.spectral.rtm.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import com.spectral.rtm.api.Geometry;
import com.spectral.rtm.api.RtMode;
import com.spectral.rtm.api.RtmEngine;
import com.spectral.rtm.api.RtmQuantities;
import com.spectral.rtm.io.EngineParameters;
import com.spectral.rtm.io.EngineRegistry;
import com.spectral.rtm.io.EngineType;
import com.spectral.rtm.io.ForwardModelDefinition;
import com.spectral.rtm.io.LayeredConfig;

import lombok.extern.log4j.Log4j2;

/**
 * The radiative transfer component of the forward model.
 *
 * This class owns the ordered list of engines, each covering one wavelength
 * interval, and concatenates their results into one composite spectrum. The
 * state vector is shared by all engines (water vapour, for example, acts on
 * both the VSWIR and the thermal range), so this class keeps the master copy
 * of bounds, scaling, initial values and priors.
 *
 * Forward model:
 *
 * <pre>
 * L = L_atm + (T_bd * r_dir + T_hd * r_dif + T_dh * bg_dir + T_bh * bg_dif) / (1 - S * bg_dif) + L_up
 * </pre>
 *
 * where T_* are the coupled path radiances from {@link CoupledRadiance}, S the
 * spherical albedo and {@code L_up = Ls * (t_up_dir + t_up_dif)} the thermal
 * surface emission reaching the sensor. The spherical albedo denominator
 * applies to the coupled surface term only. It is not guarded: engines are
 * expected to keep {@code S * bg} well below one.
 *
 * Thread Safety:
 * After construction the instance is immutable. Every evaluation queries the
 * engines and allocates its own result arrays, so {@link #calcRdn} may be
 * called from many threads at once as long as the engines themselves are
 * thread-safe.
 */
@Log4j2
public final class RadiativeTransfer {
    private final List<RtmEngine> engines;
    private final List<SpectralSegment> segments;
    private final StateVector stateVector;
    private final List<String> unknownNames;
    private final double[] unknownValues;

    private final double[] wavelengths;
    private final double[] solarIrradiance;
    private final boolean topographyModel;
    private final boolean glintModel;

    private final QuantityMerger merger = new QuantityMerger();

    /**
     * Builds the compositor from configuration, instantiating every engine
     * through the registry.
     *
     * @throws IllegalArgumentException on an unknown engine name.
     * @throws IllegalStateException    on a state vector / engine mismatch or a
     *                                  missing factory.
     */
    public static RadiativeTransfer fromDefinition(ForwardModelDefinition def, EngineRegistry registry) {
        ForwardModelDefinition.RadiativeTransferDef global = def.getRadiativeTransfer();
        if (global == null)
            throw new IllegalStateException("Missing radiative transfer configuration");
        List<ForwardModelDefinition.EngineDef> engineDefs = global.getRadiativeTransferEngines();
        if (engineDefs == null || engineDefs.isEmpty())
            throw new IllegalStateException("No radiative transfer engines configured");

        StateVector sv = StateVector.fromDefinition(global.getStatevector());
        List<RtmEngine> created = new ArrayList<>(engineDefs.size());
        for (ForwardModelDefinition.EngineDef engineDef : engineDefs) {
            EngineType type;
            try {
                type = EngineType.fromString(engineDef.getEngineName());
            } catch (IllegalArgumentException e) {
                log.error(e.getMessage());
                throw e;
            }
            EngineParameters params = LayeredConfig.forEngine(engineDef, def.getInstrument(), global)
                    .toEngineParameters(type, engineDef);
            RtmEngine engine = registry.create(params);
            checkStateLength(engine, sv);
            created.add(engine);
        }
        Map<String, Double> unknowns = global.getUnknowns() != null ? global.getUnknowns() : Map.of();
        return new RadiativeTransfer(created, sv, unknowns);
    }

    /**
     * Builds the compositor from already constructed engines.
     *
     * @param engines     engines in any order; they are sorted by first
     *                    wavelength
     * @param stateVector radiative transfer state vector
     * @param unknowns    nuisance parameters and their values, in order
     */
    public RadiativeTransfer(List<RtmEngine> engines, StateVector stateVector, Map<String, Double> unknowns) {
        if (engines.isEmpty())
            throw new IllegalStateException("No radiative transfer engines configured");

        for (RtmEngine e : engines) {
            checkStateLength(e, stateVector);
            if (e.wavelengths().length != e.solarIrradiance().length) {
                throw new IllegalStateException("Engine " + e.name() + " has " + e.wavelengths().length
                        + " wavelengths but " + e.solarIrradiance().length + " irradiance values");
            }
        }

        // Configuration order is not reliable; the concatenation relies on ascending wavelength
        List<RtmEngine> sorted = new ArrayList<>(engines);
        sorted.sort(Comparator.comparingDouble(e -> e.wavelengths()[0]));
        this.engines = Collections.unmodifiableList(sorted);
        this.stateVector = stateVector;

        var unknownCopy = new LinkedHashMap<>(unknowns);
        this.unknownNames = List.copyOf(unknownCopy.keySet());
        this.unknownValues = unknownCopy.values().stream().mapToDouble(Double::doubleValue).toArray();

        int total = 0;
        List<SpectralSegment> segs = new ArrayList<>(sorted.size());
        double previousLast = Double.NEGATIVE_INFINITY;
        for (RtmEngine e : sorted) {
            double[] wl = e.wavelengths();
            if (wl[0] <= previousLast) {
                throw new IllegalStateException("Engine " + e.name() + " starts at " + wl[0]
                        + " which overlaps the previous engine ending at " + previousLast);
            }
            previousLast = wl[wl.length - 1];
            segs.add(new SpectralSegment(total, wl.length, e.rtMode(), e.isEmissive()));
            total += wl.length;
        }
        this.segments = Collections.unmodifiableList(segs);

        this.wavelengths = new double[total];
        this.solarIrradiance = new double[total];
        for (int i = 0; i < sorted.size(); i++) {
            SpectralSegment seg = segs.get(i);
            System.arraycopy(sorted.get(i).wavelengths(), 0, wavelengths, seg.offset(), seg.length());
            System.arraycopy(sorted.get(i).solarIrradiance(), 0, solarIrradiance, seg.offset(), seg.length());
        }

        this.topographyModel = sorted.stream().anyMatch(RtmEngine::isTopographyModel);
        this.glintModel = sorted.stream().anyMatch(RtmEngine::isGlintModel);

        log.info("Radiative transfer built: engines={}, channels={}, statevector={}, topography={}, glint={}",
                sorted.stream().map(RtmEngine::name).toList(), total, stateVector.names(),
                topographyModel, glintModel);
    }

    private static void checkStateLength(RtmEngine engine, StateVector sv) {
        int expected = sv.size();
        int got = engine.rtStateIndices().length;
        if (expected != got) {
            String error = "Mismatch between the number of elements for the config statevector and the RT state"
                    + " indices of engine " + engine.name() + ": expected=" + expected + ", got=" + got;
            log.error(error);
            throw new IllegalStateException(error);
        }
    }

    // ── Aggregates ──────────────────────────────────────────────────

    /** Prior mean of the radiative transfer state. */
    public double[] xa() {
        return stateVector.priorMean();
    }

    /** Diagonal prior covariance built from squared prior sigmas. */
    public double[][] sa() {
        double[] sigma = stateVector.priorSigma();
        double[][] cov = new double[sigma.length][sigma.length];
        for (int i = 0; i < sigma.length; i++)
            cov[i][i] = sigma[i] * sigma[i];
        return cov;
    }

    public double[][] bounds() {
        return stateVector.bounds();
    }

    public double[] scale() {
        return stateVector.scale();
    }

    public double[] init() {
        return stateVector.init();
    }

    public StateVector stateVector() {
        return stateVector;
    }

    public List<String> unknownNames() {
        return unknownNames;
    }

    public double[] unknownValues() {
        return unknownValues.clone();
    }

    public double[] wavelengths() {
        return wavelengths.clone();
    }

    public double[] solarIrradiance() {
        return solarIrradiance.clone();
    }

    public int channelCount() {
        return wavelengths.length;
    }

    public List<RtmEngine> engines() {
        return engines;
    }

    public List<SpectralSegment> segments() {
        return segments;
    }

    public boolean isTopographyModel() {
        return topographyModel;
    }

    public boolean isGlintModel() {
        return glintModel;
    }

    // ── Geometry ────────────────────────────────────────────────────

    /**
     * Solar zenith cosine stored by an engine's tables. The first engine
     * carrying one wins.
     */
    public OptionalDouble cachedCosZenith() {
        for (RtmEngine e : engines) {
            OptionalDouble c = e.cachedCosZenith();
            if (c.isPresent() && !Double.isNaN(c.getAsDouble()))
                return c;
        }
        return OptionalDouble.empty();
    }

    /** Cosine of the TOA solar zenith: engine override, else the geometry. */
    public double cosZenith(Geometry geom) {
        OptionalDouble cached = cachedCosZenith();
        return cached.isPresent() ? cached.getAsDouble() : geom.cosSolarZenith();
    }

    // ── Queries ─────────────────────────────────────────────────────

    private List<RtmQuantities> queryEngines(double[] xRt, Geometry geom) {
        List<RtmQuantities> results = new ArrayList<>(engines.size());
        for (RtmEngine e : engines)
            results.add(e.query(xRt, geom));
        return results;
    }

    /**
     * Queries every engine and keeps the quantities they all provide,
     * concatenated in wavelength order.
     */
    public RtmQuantities getSharedRtmQuantities(double[] xRt, Geometry geom) {
        return merger.merge(queryEngines(xRt, geom));
    }

    /** Atmospheric path radiance. */
    public double[] getLAtm(double[] xRt, Geometry geom) {
        return pathRadiance(queryEngines(xRt, geom), cosZenith(geom));
    }

    /** Total, direct and diffuse downward radiance on the sun-to-surface path. */
    public DownwardRadiance getLDownTransmitted(double[] xRt, Geometry geom) {
        return downwardRadiance(queryEngines(xRt, geom), cosZenith(geom));
    }

    /**
     * Runs one query of all engines and derives the merged quantities, path
     * radiance and downward radiance from it.
     */
    public AtmosphericState evaluate(double[] xRt, Geometry geom) {
        List<RtmQuantities> perEngine = queryEngines(xRt, geom);
        double coszen = cosZenith(geom);
        double cosI = geom.hasCosI() ? geom.cosI() : coszen;
        return new AtmosphericState(merger.merge(perEngine), pathRadiance(perEngine, coszen),
                downwardRadiance(perEngine, coszen), coszen, cosI);
    }

    private double[] pathRadiance(List<RtmQuantities> perEngine, double coszen) {
        double[] out = new double[wavelengths.length];
        for (int i = 0; i < engines.size(); i++) {
            RtmEngine e = engines.get(i);
            SpectralSegment seg = segments.get(i);
            RtmQuantities r = perEngine.get(i);
            if (e.isEmissive()) {
                copyInto(r.get(RtmQuantities.THERMAL_UPWELLING), out, seg);
            } else if (e.rtMode() == RtMode.RADIANCE) {
                copyInto(r.get(RtmQuantities.RHOATM), out, seg);
            } else {
                copyInto(rhoToRdn(r.get(RtmQuantities.RHOATM), e.solarIrradiance(), coszen), out, seg);
            }
        }
        return out;
    }

    private DownwardRadiance downwardRadiance(List<RtmQuantities> perEngine, double coszen) {
        int n = wavelengths.length;
        double[] total = new double[n];
        double[] direct = new double[n];
        double[] diffuse = new double[n];
        for (int i = 0; i < engines.size(); i++) {
            RtmEngine e = engines.get(i);
            SpectralSegment seg = segments.get(i);
            RtmQuantities r = perEngine.get(i);
            if (e.isEmissive()) {
                // Thermal downwelling already includes transmission; no multiple scattering in the TIR
                double[] thermal = r.get(RtmQuantities.THERMAL_DOWNWELLING);
                copyInto(thermal, total, seg);
                copyInto(thermal, direct, seg);
                continue;
            }
            double[] dir = r.get(RtmQuantities.TRANSM_DOWN_DIR);
            double[] dif = r.get(RtmQuantities.TRANSM_DOWN_DIF);
            if (e.rtMode() == RtMode.TRANSMITTANCE) {
                dir = rhoToRdn(dir, e.solarIrradiance(), coszen);
                dif = rhoToRdn(dif, e.solarIrradiance(), coszen);
            }
            copyInto(dir, direct, seg);
            copyInto(dif, diffuse, seg);
            for (int k = 0; k < seg.length(); k++)
                total[seg.offset() + k] = dir[k] + dif[k];
        }
        return new DownwardRadiance(total, direct, diffuse);
    }

    private static void copyInto(double[] part, double[] out, SpectralSegment seg) {
        if (part.length != seg.length()) {
            throw new IllegalStateException("Engine returned " + part.length + " values for a segment of "
                    + seg.length() + " channels");
        }
        System.arraycopy(part, 0, out, seg.offset(), seg.length());
    }

    // ── Forward model ───────────────────────────────────────────────

    /**
     * Physics-based forward model of at-sensor radiance, including topography,
     * adjacency background and thermal emission.
     *
     * @param xRt    radiative transfer state
     * @param rflDir directional surface reflectance
     * @param rflDif hemispherical surface reflectance
     * @param ls     surface emitted radiance
     * @param geom   observation geometry
     * @return modelled radiance on the composite wavelength grid
     */
    public double[] calcRdn(double[] xRt, double[] rflDir, double[] rflDif, double[] ls, Geometry geom) {
        int n = wavelengths.length;
        requireLength("rflDir", rflDir, n);
        requireLength("rflDif", rflDif, n);
        requireLength("Ls", ls, n);

        AtmosphericState state = evaluate(xRt, geom);
        RtmQuantities r = state.shared();
        double[] sAlb = r.get(RtmQuantities.SPHALB);
        double[] tUpDir = r.get(RtmQuantities.TRANSM_UP_DIR);
        double[] tUpDif = r.get(RtmQuantities.TRANSM_UP_DIF);
        double[] lAtm = state.pathRadiance();

        CoupledTerms coupled = CoupledRadiance.compute(r, engines.get(0).couplingTerms(), segments,
                solarIrradiance, state.cosZenith(), state.cosI());

        double[] bgDir = rflDir;
        double[] bgDif = rflDif;
        if (geom.hasBackgroundReflectance()) {
            requireLength("background reflectance", geom.backgroundReflectance(), n);
            bgDir = geom.backgroundReflectance();
            bgDif = geom.backgroundReflectance();
        }

        double[] rdn = new double[n];
        for (int i = 0; i < n; i++) {
            double surface = coupled.biDirect()[i] * rflDir[i]
                    + coupled.hemiDirect()[i] * rflDif[i]
                    + coupled.directHemi()[i] * bgDir[i]
                    + coupled.biHemi()[i] * bgDif[i];
            double lUp = ls[i] * (tUpDir[i] + tUpDif[i]);
            rdn[i] = lAtm[i] + surface / (1.0 - sAlb[i] * bgDif[i]) + lUp;
        }
        return rdn;
    }

    static void requireLength(String what, double[] values, int expected) {
        if (values == null || values.length != expected) {
            throw new IllegalArgumentException(what + " length mismatch: expected " + expected + ", got "
                    + (values == null ? "null" : values.length));
        }
    }

    // ── Unit conversions ────────────────────────────────────────────

    /** Radiance to reflectance with the composite solar irradiance. */
    public double[] rdnToRho(double[] rdn, double coszen) {
        return rdnToRho(rdn, solarIrradiance, coszen);
    }

    /** {@code rho = L * pi / (E0 * cos(theta_s))}. */
    public static double[] rdnToRho(double[] rdn, double[] solarIrr, double coszen) {
        requireLength("solar irradiance", solarIrr, rdn.length);
        double[] rho = new double[rdn.length];
        for (int i = 0; i < rdn.length; i++)
            rho[i] = rdn[i] * Math.PI / (solarIrr[i] * coszen);
        return rho;
    }

    /** Reflectance to radiance with the composite solar irradiance. */
    public double[] rhoToRdn(double[] rho, double coszen) {
        return rhoToRdn(rho, solarIrradiance, coszen);
    }

    /** {@code L = E0 * cos(theta_s) / pi * rho}. */
    public static double[] rhoToRdn(double[] rho, double[] solarIrr, double coszen) {
        requireLength("solar irradiance", solarIrr, rho.length);
        double[] rdn = new double[rho.length];
        for (int i = 0; i < rho.length; i++)
            rdn[i] = (solarIrr[i] * coszen) / Math.PI * rho[i];
        return rdn;
    }

    // ── Diagnostics ─────────────────────────────────────────────────

    /** Per-engine summaries, one per line. */
    public String summarize(double[] xRt, Geometry geom) {
        List<String> lines = new ArrayList<>(engines.size());
        for (RtmEngine e : engines)
            lines.add(e.summarize(xRt, geom));
        return String.join("\n", lines);
    }
}
