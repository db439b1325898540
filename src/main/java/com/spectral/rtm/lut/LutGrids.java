package com.spectral.rtm.lut;

import java.util.Arrays;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Builds look-up table sampling grids from the spread of observed data.
 *
 * <p>
 * An empty result means "no grid": the dimension is represented by a single
 * value the caller supplies, usually the data mean. Collapsing is the expected
 * outcome for scenes with little variability, not an error.
 */
@Log4j2
public final class LutGrids {
    /** Spacing value requesting the single circular center of the data. */
    public static final double CENTERPOINT = -1;

    private LutGrids() {
        // Utility class
    }

    /**
     * Evenly spaced grid from {@code min} to {@code max}.
     *
     * <p>
     * The point count is {@code ceil((max - min) / spacing) + 1}. Values are
     * rounded to 4 decimals when {@code minSpacing > 1e-4}. The grid collapses
     * when spacing is 0, when it would hold a single point, or when adjacent
     * points are closer than {@code minSpacing}.
     */
    public static Optional<double[]> getGrid(double min, double max, double spacing, double minSpacing) {
        if (spacing == 0) {
            log.debug("Grid spacing set at 0, using no grid.");
            return Optional.empty();
        }
        int num = (int) Math.ceil((max - min) / spacing) + 1;
        if (num < 2) {
            log.debug("Grid spacing is 0, which is less than {}. No grid used", minSpacing);
            return Optional.empty();
        }

        double[] grid = linspace(min, max, num);
        if (minSpacing > 0.0001) {
            for (int i = 0; i < grid.length; i++)
                grid[i] = Math.rint(grid[i] * 1e4) / 1e4;
        }

        double step = Math.abs(grid[1] - grid[0]);
        if (step < minSpacing) {
            log.debug("Grid spacing is {}, which is less than {}. No grid used", step, minSpacing);
            return Optional.empty();
        }
        return Optional.of(grid);
    }

    /**
     * Grid over circular data, or its single center point when
     * {@code spacing == }{@link #CENTERPOINT}.
     *
     * <p>
     * Data occupying at most two unit-circle quadrants get a linear grid. When
     * those quadrants sit either side of 0 degrees the angles are rotated by
     * 180 degrees, gridded, and rotated back; either side of 180 degrees they
     * are gridded in [0, 360). The grid never spans the long way round. Wider data, or a centerpoint request, are summarised by
     * {@link CircularClustering} with {@code ceil(360 / spacing)} centers.
     *
     * @return grid in degrees; a one-element array in centerpoint mode; empty
     *         for no grid
     */
    public static Optional<double[]> getAngularGrid(double[] angles, double spacing, double minSpacing,
            AngleUnits units) {
        if (spacing == 0) {
            log.debug("Grid spacing set at 0, using no grid.");
            return Optional.empty();
        }
        if (angles.length == 0)
            throw new IllegalArgumentException("No angular data");

        double[] deg = new double[angles.length];
        for (int i = 0; i < angles.length; i++)
            deg[i] = units.toDegrees(angles[i]);

        Quadrants data = Quadrants.of(deg);
        boolean centerpoint = spacing == CENTERPOINT;

        if (data.count() < 3 && !centerpoint) {
            if (data.posCosPosSin && data.posCosNegSin) {
                // Data cross the 0-degree line
                double[] rotated = new double[deg.length];
                for (int i = 0; i < deg.length; i++)
                    rotated[i] = wrap360(deg[i] + 180);
                return getGrid(min(rotated), max(rotated), spacing, minSpacing)
                        .map(g -> Arrays.stream(g).map(v -> v - 180).toArray());
            }
            if (data.negCosPosSin && data.negCosNegSin) {
                // Data cross the 180-degree line
                double[] wrapped = Arrays.stream(deg).map(LutGrids::wrap360).toArray();
                return getGrid(min(wrapped), max(wrapped), spacing, minSpacing);
            }
            return getGrid(min(deg), max(deg), spacing, minSpacing);
        }

        if (spacing >= 180) {
            log.warn("Requested angle spacing is {}, but obs angle divergence is > 180. Tighter spacing recommended",
                    spacing);
        }

        int numPoints = centerpoint ? 1 : (int) Math.ceil(360 / spacing);
        double[] centers = CircularClustering.centers(deg, numPoints);
        if (centerpoint)
            return Optional.of(new double[] { centers[0] });

        Quadrants centerQuadrants = Quadrants.of(centers);
        if (centerQuadrants.count() < data.count()) {
            log.warn("Cluster angles {} span {} quadrants, while data spans {} quadrants",
                    Arrays.toString(centers), centerQuadrants.count(), data.count());
        }
        return Optional.of(centers);
    }

    /** Circular center of the data in degrees, within (-180, 180]. */
    public static double centerAngle(double[] angles, AngleUnits units) {
        return getAngularGrid(angles, CENTERPOINT, 0, units).orElseThrow()[0];
    }

    /** Maps an angle in degrees into [0, 360). */
    public static double wrap360(double deg) {
        double w = deg % 360.0;
        return w < 0 ? w + 360.0 : w;
    }

    static double[] linspace(double start, double stop, int num) {
        double[] out = new double[num];
        if (num == 1) {
            out[0] = start;
            return out;
        }
        double step = (stop - start) / (num - 1);
        for (int i = 0; i < num; i++)
            out[i] = start + i * step;
        out[num - 1] = stop;
        return out;
    }

    private static double min(double[] v) {
        return Arrays.stream(v).min().orElseThrow();
    }

    private static double max(double[] v) {
        return Arrays.stream(v).max().orElseThrow();
    }

    /** Which sign combinations of (cos, sin) the data populate; axes count for none. */
    private record Quadrants(boolean posCosPosSin, boolean posCosNegSin, boolean negCosPosSin,
            boolean negCosNegSin) {

        static Quadrants of(double[] deg) {
            boolean pp = false, pn = false, np = false, nn = false;
            for (double a : deg) {
                double r = Math.toRadians(a);
                double c = Math.cos(r);
                double s = Math.sin(r);
                pp |= c > 0 && s > 0;
                pn |= c > 0 && s < 0;
                np |= c < 0 && s > 0;
                nn |= c < 0 && s < 0;
            }
            return new Quadrants(pp, pn, np, nn);
        }

        int count() {
            return (posCosPosSin ? 1 : 0) + (posCosNegSin ? 1 : 0) + (negCosPosSin ? 1 : 0)
                    + (negCosNegSin ? 1 : 0);
        }
    }
}
