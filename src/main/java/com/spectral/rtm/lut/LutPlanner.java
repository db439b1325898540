package com.spectral.rtm.lut;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import com.spectral.rtm.api.StateElement;

import lombok.extern.log4j.Log4j2;

/**
 * Derives the look-up table coordinates of a scene from its per-pixel
 * geometry, location and first-guess water vapour.
 *
 * <p>
 * Nodata pixels are excluded, and the first and last {@code trimLines} lines
 * are ignored when the scene is long enough, since edge lines often carry
 * values that are erroneous without being flagged.
 */
@Log4j2
public final class LutPlanner {
    public static final double DEFAULT_NODATA = -9999;
    public static final int DEFAULT_TRIM_LINES = 5;
    public static final double DEFAULT_MAX_FLIGHT_HOURS = 8;

    /** Prior sigma given to generated aerosol state elements. */
    static final double AEROSOL_PRIOR_SIGMA = 10.0;

    private final LutParameters params;
    private final double nodata;
    private final int trimLines;
    private final double maxFlightHours;

    public LutPlanner(LutParameters params) {
        this(params, DEFAULT_NODATA, DEFAULT_TRIM_LINES);
    }

    public LutPlanner(LutParameters params, double nodata, int trimLines) {
        this(params, nodata, trimLines, DEFAULT_MAX_FLIGHT_HOURS);
    }

    /**
     * @param maxFlightHours longest acquisition expected, used to detect a
     *                       scene that crosses midnight UTC
     */
    public LutPlanner(LutParameters params, double nodata, int trimLines, double maxFlightHours) {
        this.params = params;
        this.nodata = nodata;
        this.trimLines = trimLines;
        this.maxFlightHours = maxFlightHours;
    }

    public LutParameters parameters() {
        return params;
    }

    // ── Observation geometry ────────────────────────────────────────

    /**
     * Mean acquisition time, and means and grids of sensor and solar angles.
     *
     * <p>
     * The to-sensor zenith is reported in the 180-minus convention the
     * atmosphere tables use. Relative azimuth is
     * {@code |((sunAz - sensorAz) mod 360) - 180|}.
     */
    public ObservationSummary fromObservations(ObservationSamples obs) {
        int n = obs.lines() * obs.samples();
        boolean[] valid = new boolean[n];
        for (int i = 0; i < n; i++) {
            valid[i] = !isNodataClose(obs.pathLength()[i]) && !isNodataClose(obs.toSensorAzimuth()[i])
                    && !isNodataClose(obs.toSensorZenith()[i]) && !isNodataClose(obs.toSunAzimuth()[i])
                    && !isNodataClose(obs.toSunZenith()[i]) && !isNodataClose(obs.utcTime()[i]);
        }
        trim(valid, obs.lines(), obs.samples());

        double[] pathKm = select(obs.pathLength(), valid);
        if (pathKm.length == 0)
            throw new IllegalArgumentException("No valid observation pixels");
        for (int i = 0; i < pathKm.length; i++)
            pathKm[i] /= 1000.0;

        double[] sensorZen = select(obs.toSensorZenith(), valid);
        double[] sunZen = select(obs.toSunZenith(), valid);
        double[] sunAz = select(obs.toSunAzimuth(), valid);
        double[] sensorAz = select(obs.toSensorAzimuth(), valid);
        double[] relAz = new double[sunAz.length];
        for (int i = 0; i < relAz.length; i++)
            relAz[i] = Math.abs(LutGrids.wrap360(sunAz[i] - sensorAz[i]) - 180);

        double meanSensorZen = 180 - LutGrids.centerAngle(sensorZen, AngleUnits.DEGREES);
        double meanSunZen = LutGrids.centerAngle(sunZen, AngleUnits.DEGREES);
        double meanSunAz = LutGrids.wrap360(LutGrids.centerAngle(sunAz, AngleUnits.DEGREES));
        double meanRelAz = LutGrids.wrap360(LutGrids.centerAngle(relAz, AngleUnits.DEGREES));

        double[] sensorZenGrid = LutGrids.getAngularGrid(sensorZen, params.getToSensorZenithSpacing(),
                params.getToSensorZenithSpacingMin(), AngleUnits.DEGREES)
                .map(g -> sorted(Arrays.stream(g).map(v -> 180 - v).toArray()))
                .orElse(new double[] { meanSensorZen });
        double[] sunZenGrid = LutGrids.getAngularGrid(sunZen, params.getToSunZenithSpacing(),
                params.getToSunZenithSpacingMin(), AngleUnits.DEGREES)
                .map(LutPlanner::sorted)
                .orElse(new double[] { meanSunZen });
        double[] relAzGrid = LutGrids.getAngularGrid(relAz, params.getRelativeAzimuthSpacing(),
                params.getRelativeAzimuthSpacingMin(), AngleUnits.DEGREES)
                .map(g -> sorted(Arrays.stream(g).map(LutGrids::wrap360).toArray()))
                .orElse(new double[] { meanRelAz });

        log.info("To-sensor zenith: {}", Arrays.toString(sensorZenGrid));
        log.info("To-sun zenith: {}", Arrays.toString(sunZenGrid));
        log.info("Relative to-sun azimuth: {}", Arrays.toString(relAzGrid));

        AcquisitionTime time = acquisitionTime(select(obs.utcTime(), valid));
        return new ObservationSummary(time, mean(pathKm), meanSensorZen, meanSunZen, meanSunAz, meanRelAz,
                sensorZenGrid, sunZenGrid, relAzGrid, pathKm.length);
    }

    /**
     * Mean of the decimal UTC hours. A scene with times both near the end of
     * the day and within {@code maxFlightHours} of its start is taken to cross
     * midnight: its early times are moved to the next day before averaging.
     */
    private AcquisitionTime acquisitionTime(double[] hours) {
        double minTime = Arrays.stream(hours).min().orElseThrow();
        double maxTime = Arrays.stream(hours).max().orElseThrow();
        double meanTime = mean(hours);
        boolean incrementDay = false;
        if (maxTime > 24 - maxFlightHours && minTime < maxFlightHours) {
            double[] shifted = Arrays.stream(hours).map(t -> t < maxFlightHours ? t + 24 : t).toArray();
            meanTime = mean(shifted);
            if (meanTime > 24) {
                meanTime -= 24;
                incrementDay = true;
            }
        }
        AcquisitionTime time = AcquisitionTime.ofDecimalHours(meanTime, incrementDay);
        log.info("Mean acquisition time: {}:{}:{} UTC{}", time.hour(), time.minute(), time.second(),
                incrementDay ? " (next day)" : "");
        return time;
    }

    // ── Location ────────────────────────────────────────────────────

    /**
     * Mean position and elevation grid.
     *
     * @param pressureElevation widen the elevation range by 2 km each way
     *                          (lower end at least 0.25 km) so the elevation
     *                          dimension can absorb surface pressure
     * @param emulator          the tables come from an emulator that does not
     *                          support targets below sea level
     */
    public LocationSummary fromLocations(LocationSamples loc, boolean pressureElevation, boolean emulator) {
        int n = loc.lines() * loc.samples();
        boolean[] valid = new boolean[n];
        for (int i = 0; i < n; i++) {
            valid[i] = loc.longitude()[i] != nodata && loc.latitude()[i] != nodata && loc.elevation()[i] != nodata;
        }
        trim(valid, loc.lines(), loc.samples());

        double[] lat = select(loc.latitude(), valid);
        if (lat.length == 0)
            throw new IllegalArgumentException("No valid location pixels");
        double[] westLon = select(loc.longitude(), valid);
        for (int i = 0; i < westLon.length; i++)
            westLon[i] = -westLon[i];
        double[] elevKm = select(loc.elevation(), valid);
        for (int i = 0; i < elevKm.length; i++)
            elevKm[i] /= 1000.0;

        double meanLat = LutGrids.centerAngle(lat, AngleUnits.DEGREES);
        double meanLon = LutGrids.centerAngle(westLon, AngleUnits.DEGREES);
        double meanElev = mean(elevKm);

        double minElev = Arrays.stream(elevKm).min().orElseThrow();
        double maxElev = Arrays.stream(elevKm).max().orElseThrow();
        if (pressureElevation) {
            minElev = Math.max(minElev - 2, 0.25);
            maxElev += 2;
        }
        Optional<double[]> grid = LutGrids.getGrid(minElev, maxElev, params.getElevationSpacing(),
                params.getElevationSpacingMin());

        if (params.isFlagOceanElevation()) {
            grid = Optional.empty();
            meanElev = 0.0;
        }

        if (emulator) {
            if (grid.isPresent() && Arrays.stream(grid.get()).anyMatch(v -> v < 0)) {
                double[] clamped = Arrays.stream(grid.get()).map(v -> Math.max(v, 0)).distinct().sorted().toArray();
                log.info("Scene contains target elevation grid points below 0 km, which the emulator does not"
                        + " support. Setting those points to 0.");
                grid = clamped.length == 1 ? Optional.empty() : Optional.of(clamped);
            }
            if (meanElev < 0) {
                log.info("Scene mean target elevation is below 0 km; setting it to 0.");
                meanElev = 0;
            }
        }

        double[] elevationGrid = grid.orElse(new double[] { meanElev });
        log.info("Elevation: {}", Arrays.toString(elevationGrid));
        return new LocationSummary(meanLat, meanLon, meanElev, elevationGrid);
    }

    // ── Water vapour ────────────────────────────────────────────────

    /**
     * Water vapour grid bracketing a first-guess retrieval.
     *
     * <p>
     * Uses the 2nd and 98th percentiles of the estimates above
     * {@code h2oMin}, widened by half their spread and clipped to
     * {@code [h2oMin, maxWater]}. The resolved range is written back to the
     * parameters.
     *
     * @param estimates per-pixel water vapour, g cm-2
     * @param maxWater  largest water vapour the tables accept
     */
    public Optional<double[]> waterVaporGrid(double[] estimates, double maxWater) {
        double h2oMin = params.getH2oMin();
        double[] usable = Arrays.stream(estimates).filter(v -> v > h2oMin).toArray();
        if (usable.length == 0) {
            log.warn("No water vapour estimates above {}; keeping configured range {}", h2oMin,
                    Arrays.toString(params.getH2oRange()));
        } else {
            Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
            percentile.setData(usable);
            double p02 = percentile.evaluate(2);
            double p98 = percentile.evaluate(98);
            double margin = (p98 - p02) * 0.5;
            double lo = Math.max(h2oMin, p02 - margin);
            double hi = Math.min(maxWater, Math.max(h2oMin, p98 + margin));
            params.setH2oRange(new double[] { lo, hi });
        }
        Optional<double[]> grid = LutGrids.getGrid(params.getH2oRange()[0], params.getH2oRange()[1],
                params.getH2oSpacing(), params.getH2oSpacingMin());
        log.info("H2O Vapor: {}", grid.map(Arrays::toString).orElse("none"));
        return grid;
    }

    // ── Aerosol ─────────────────────────────────────────────────────

    /**
     * Grids for the three aerosol fractions and AOT550, with a state vector
     * element for each dimension that produced a grid: bounds span the grid
     * range, init and prior mean sit a tenth of the way in.
     */
    public AerosolPlan aerosolPlan() {
        Map<String, double[]> grids = new LinkedHashMap<>();
        Map<String, StateElement> elements = new LinkedHashMap<>();

        for (int i = 0; i < 3; i++) {
            double[] range = params.aerosolRange(i);
            Optional<double[]> grid = LutGrids.getGrid(range[0], range[1], params.aerosolSpacing(i),
                    params.aerosolSpacingMin(i));
            if (grid.isPresent()) {
                String name = "AERFRAC_" + i;
                grids.put(name, grid.get());
                elements.put(name, aerosolElement(name, range[0], range[1]));
            }
        }

        double[] aotRange = params.getAot550Range();
        Optional<double[]> aot = LutGrids.getGrid(aotRange[0], aotRange[1], params.getAot550Spacing(),
                params.getAot550SpacingMin());
        if (aot.isPresent()) {
            grids.put("AOT550", aot.get());
            elements.put("AOT550", aerosolElement("AOT550", aotRange[0], aotRange[1]));
        }
        return new AerosolPlan(grids, elements);
    }

    private static StateElement aerosolElement(String name, double lo, double hi) {
        double start = (hi - lo) / 10.0 + lo;
        return new StateElement(name, lo, hi, 1.0, start, start, AEROSOL_PRIOR_SIGMA);
    }

    // ── Helpers ─────────────────────────────────────────────────────

    private boolean isNodataClose(double v) {
        // Absolute 1e-8 plus relative 1e-5
        return Math.abs(v - nodata) <= 1e-8 + 1e-5 * Math.abs(nodata);
    }

    private void trim(boolean[] valid, int lines, int samples) {
        if (trimLines == 0 || lines <= trimLines * 2)
            return;
        Arrays.fill(valid, 0, trimLines * samples, false);
        Arrays.fill(valid, (lines - trimLines) * samples, lines * samples, false);
    }

    private static double[] select(double[] data, boolean[] mask) {
        int count = 0;
        for (boolean b : mask)
            if (b)
                count++;
        double[] out = new double[count];
        int j = 0;
        for (int i = 0; i < data.length; i++) {
            if (mask[i])
                out[j++] = data[i];
        }
        return out;
    }

    private static double mean(double[] v) {
        return Arrays.stream(v).average().orElse(Double.NaN);
    }

    private static double[] sorted(double[] v) {
        double[] copy = v.clone();
        Arrays.sort(copy);
        return copy;
    }
}
