package com.spectral.rtm.lut;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.junit.Before;
import org.junit.Test;

import com.spectral.rtm.api.StateElement;

import static org.junit.Assert.*;

public class LutPlannerTest {
    private static final double ND = LutPlanner.DEFAULT_NODATA;

    private LutParameters params;
    private LutPlanner planner;

    @Before
    public void setUp() {
        params = new LutParameters();
        planner = new LutPlanner(params, ND, 0);
    }

    // ── Observations ────────────────────────────────────────────────

    @Test
    public void testObservationMeansAndCollapsedGrids() {
        ObservationSamples obs = new ObservationSamples(1, 4,
                new double[] { 1000, 2000, 3000, ND },
                new double[] { 90, 90, 90, 90 },
                new double[] { 5, 5, 5, 5 },
                new double[] { 100, 100, 100, 100 },
                new double[] { 30, 40, 50, 60 },
                new double[] { 18.0, 18.5, 19.0, 19.5 });

        ObservationSummary s = planner.fromObservations(obs);
        assertEquals(3, s.validCount());
        assertEquals(2.0, s.meanPathKm(), 1e-12);
        assertEquals(175.0, s.meanToSensorZenith(), 1e-9);
        assertEquals(40.0, s.meanToSunZenith(), 1e-9);
        assertEquals(100.0, s.meanToSunAzimuth(), 1e-9);
        // |((100 - 90) mod 360) - 180|
        assertEquals(170.0, s.meanRelativeAzimuth(), 1e-9);

        assertArrayEquals(new double[] { 30, 40, 50 }, s.toSunZenithGrid(), 1e-9);
        // No spread: the mean stands in for the grid
        assertArrayEquals(new double[] { 175.0 }, s.toSensorZenithGrid(), 1e-9);
        assertArrayEquals(new double[] { 170.0 }, s.relativeAzimuthGrid(), 1e-9);
    }

    @Test
    public void testMeanAcquisitionTime() {
        ObservationSummary s = planner.fromObservations(timed(new double[] { 10.0, 11.0, 12.0, 13.0 }));
        // 11.5 h
        assertEquals(new AcquisitionTime(11, 30, 0, false), s.acquisitionTime());
    }

    @Test
    public void testSceneEndingAfterMidnight() {
        // 23:30, then 00:30 and 01:00 twice on the next day: mean 24.5 h
        ObservationSummary s = planner.fromObservations(timed(new double[] { 23.5, 0.5, 1.0, 1.0 }));
        assertEquals(new AcquisitionTime(0, 30, 0, true), s.acquisitionTime());
    }

    @Test
    public void testSceneStartingBeforeMidnight() {
        // Mean 23.75 h stays on the first day
        ObservationSummary s = planner.fromObservations(timed(new double[] { 23.0, 23.5, 23.5, 1.0 }));
        assertEquals(new AcquisitionTime(23, 45, 0, false), s.acquisitionTime());
    }

    @Test
    public void testShortFlightLimitSkipsCrossoverCheck() {
        LutPlanner shortFlights = new LutPlanner(params, ND, 0, 0.25);
        ObservationSummary s = shortFlights.fromObservations(timed(new double[] { 23.0, 23.5, 0.5, 1.0 }));
        // Plain mean of 48 / 4
        assertEquals(new AcquisitionTime(12, 0, 0, false), s.acquisitionTime());
    }

    private static ObservationSamples timed(double[] hours) {
        int n = hours.length;
        double[] path = new double[n];
        Arrays.fill(path, 1000);
        double[] zen = new double[n];
        Arrays.fill(zen, 30);
        return new ObservationSamples(1, n, path, new double[n], new double[n], new double[n], zen, hours);
    }

    @Test
    public void testTimeBandNodataInvalidatesPixel() {
        ObservationSummary s = planner.fromObservations(timed(new double[] { 10.0, ND, 12.0 }));
        assertEquals(2, s.validCount());
        assertEquals(new AcquisitionTime(11, 0, 0, false), s.acquisitionTime());
    }

    @Test
    public void testSensorZenithGridIsReflectedAndSorted() {
        ObservationSamples obs = new ObservationSamples(1, 3,
                new double[] { 1000, 1000, 1000 },
                new double[] { 0, 0, 0 },
                new double[] { 0.5, 10.5, 20.5 },
                new double[] { 0, 0, 0 },
                new double[] { 30, 30, 30 },
                new double[] { 12, 12, 12 });

        ObservationSummary s = planner.fromObservations(obs);
        assertArrayEquals(new double[] { 159.5, 169.5, 179.5 }, s.toSensorZenithGrid(), 1e-9);
    }

    @Test
    public void testNodataToleratesRounding() {
        ObservationSamples obs = new ObservationSamples(1, 2,
                new double[] { 1000, 1000 },
                new double[] { 0, -9999.0001 },
                new double[] { 5, 5 },
                new double[] { 0, 0 },
                new double[] { 30, 30 },
                new double[] { 12, 12 });
        assertEquals(1, planner.fromObservations(obs).validCount());
    }

    @Test
    public void testEdgeLinesAreTrimmed() {
        int lines = 12;
        double[] path = new double[lines];
        Arrays.fill(path, 100_000);
        path[5] = 1000;
        path[6] = 3000;
        double[] flat = new double[lines];
        double[] zen = new double[lines];
        Arrays.fill(zen, 30);

        ObservationSummary s = new LutPlanner(params).fromObservations(
                new ObservationSamples(lines, 1, path, flat, flat, flat, zen, flat));
        assertEquals(2, s.validCount());
        assertEquals(2.0, s.meanPathKm(), 1e-12);
    }

    @Test
    public void testShortScenesAreNotTrimmed() {
        double[] path = { 1000, 1000, 1000, 1000 };
        double[] flat = new double[4];
        double[] zen = { 30, 30, 30, 30 };
        ObservationSummary s = new LutPlanner(params).fromObservations(
                new ObservationSamples(4, 1, path, flat, flat, flat, zen, flat));
        assertEquals(4, s.validCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoValidObservations() {
        double[] nd = { ND };
        planner.fromObservations(new ObservationSamples(1, 1, nd, nd, nd, nd, nd, nd));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBandLengthMismatch() {
        new ObservationSamples(2, 2, new double[4], new double[4], new double[3], new double[4], new double[4],
                new double[4]);
    }

    // ── Locations ───────────────────────────────────────────────────

    @Test
    public void testLocationGrid() {
        LocationSamples loc = new LocationSamples(1, 3,
                new double[] { -120, -120, -120 },
                new double[] { 34, 35, 36 },
                new double[] { 0, 500, 1000 });

        LocationSummary s = planner.fromLocations(loc, false, false);
        assertEquals(35.0, s.meanLatitude(), 1e-9);
        assertEquals(120.0, s.meanLongitude(), 1e-9);
        assertEquals(0.5, s.meanElevationKm(), 1e-12);
        assertArrayEquals(new double[] { 0, 0.25, 0.5, 0.75, 1.0 }, s.elevationGrid(), 1e-12);
    }

    @Test
    public void testPressureElevationWidensRange() {
        LocationSamples loc = new LocationSamples(1, 3, new double[3], new double[3],
                new double[] { 0, 500, 1000 });

        double[] grid = planner.fromLocations(loc, true, false).elevationGrid();
        assertEquals(12, grid.length);
        assertEquals(0.25, grid[0], 1e-12);
        assertEquals(3.0, grid[grid.length - 1], 1e-12);
    }

    @Test
    public void testEmulatorClampsBelowSeaLevel() {
        LocationSamples loc = new LocationSamples(1, 3, new double[3], new double[3],
                new double[] { -600, -300, 100 });

        LocationSummary s = planner.fromLocations(loc, false, true);
        assertArrayEquals(new double[] { 0, 0.1 }, s.elevationGrid(), 1e-12);
        assertEquals(0.0, s.meanElevationKm(), 0.0);
    }

    @Test
    public void testFlatSceneUsesMeanElevation() {
        LocationSamples loc = new LocationSamples(1, 2, new double[2], new double[2], new double[] { 1200, 1200 });
        assertArrayEquals(new double[] { 1.2 }, planner.fromLocations(loc, false, false).elevationGrid(), 1e-12);
    }

    @Test
    public void testOceanFlagForcesSeaLevel() {
        params.setFlagOceanElevation(true);
        LocationSamples loc = new LocationSamples(1, 3, new double[3], new double[3],
                new double[] { 0, 500, 1000 });
        LocationSummary s = planner.fromLocations(loc, false, false);
        assertArrayEquals(new double[] { 0.0 }, s.elevationGrid(), 0.0);
        assertEquals(0.0, s.meanElevationKm(), 0.0);
    }

    // ── Water vapour ────────────────────────────────────────────────

    @Test
    public void testWaterVaporRangeFromPercentiles() {
        double[] estimates = new double[102];
        estimates[0] = 0.0; // below h2o_min, ignored
        for (int i = 0; i <= 100; i++)
            estimates[i + 1] = 1.0 + i * 0.01;

        double[] grid = planner.waterVaporGrid(estimates, 5.0).orElseThrow();
        double[] range = params.getH2oRange();
        // p02 = 1.02, p98 = 1.98, margin 0.48
        assertEquals(0.54, range[0], 1e-9);
        assertEquals(2.46, range[1], 1e-9);
        assertEquals(9, grid.length);
        assertEquals(0.54, grid[0], 1e-9);
        assertEquals(2.46, grid[8], 1e-9);
    }

    @Test
    public void testWaterVaporClippedAtMaximum() {
        planner.waterVaporGrid(new double[] { 4.0, 5.0 }, 4.5);
        assertEquals(3.54, params.getH2oRange()[0], 1e-9);
        assertEquals(4.5, params.getH2oRange()[1], 0.0);
    }

    @Test
    public void testWaterVaporWithoutUsableEstimatesKeepsRange() {
        Optional<double[]> grid = planner.waterVaporGrid(new double[] { 0.0, 0.01 }, 5.0);
        assertArrayEquals(new double[] { 0.05, 5 }, params.getH2oRange(), 0.0);
        assertEquals(21, grid.orElseThrow().length);
    }

    // ── Aerosol ─────────────────────────────────────────────────────

    @Test
    public void testDefaultAerosolPlan() {
        AerosolPlan plan = planner.aerosolPlan();
        assertEquals(List.of("AERFRAC_2"), List.copyOf(plan.grids().keySet()));
        assertEquals(5, plan.grids().get("AERFRAC_2").length);

        StateElement e = plan.stateElements().get("AERFRAC_2");
        assertEquals(0.001, e.lowerBound(), 0.0);
        assertEquals(1.0, e.upperBound(), 0.0);
        assertEquals(1.0, e.scale(), 0.0);
        assertEquals(0.999 / 10 + 0.001, e.init(), 1e-12);
        assertEquals(e.init(), e.priorMean(), 0.0);
        assertEquals(10.0, e.priorSigma(), 0.0);
    }

    @Test
    public void testAotGridAddsStateElement() {
        params.setAot550Spacing(0.1);
        params.setAerosol2Spacing(0);
        AerosolPlan plan = planner.aerosolPlan();
        assertEquals(List.of("AOT550"), List.copyOf(plan.stateElements().keySet()));
        assertEquals(11, plan.grids().get("AOT550").length);
    }
}
