package com.spectral.rtm.lut;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.math3.ml.clustering.CentroidCluster;
import org.apache.commons.math3.ml.clustering.DoublePoint;
import org.apache.commons.math3.ml.clustering.KMeansPlusPlusClusterer;
import org.apache.commons.math3.ml.distance.EuclideanDistance;
import org.apache.commons.math3.random.JDKRandomGenerator;

/**
 * Finds representative angles of circular data by clustering the angles'
 * unit-circle coordinates.
 *
 * <p>
 * Clustering is seeded with a fixed value so repeated runs over the same scene
 * yield the same table coordinates. Inputs larger than
 * {@link #MAX_SAMPLES} are subsampled with an even stride.
 */
public final class CircularClustering {
    public static final int MAX_SAMPLES = 1_000_000;
    static final int SEED = 1;
    private static final int MAX_ITERATIONS = 300;

    private CircularClustering() {
        // Utility class
    }

    /**
     * Cluster-center angles in degrees within (-180, 180], ascending.
     *
     * @param anglesDeg  angular samples in degrees
     * @param numCenters requested number of centers; reduced to the number of
     *                   distinct samples when there are fewer
     */
    public static double[] centers(double[] anglesDeg, int numCenters) {
        if (anglesDeg.length == 0)
            throw new IllegalArgumentException("No angular samples to cluster");
        if (numCenters < 1)
            throw new IllegalArgumentException("Need at least one center, got " + numCenters);

        List<DoublePoint> points = toUnitCircle(subsample(anglesDeg, MAX_SAMPLES));
        int k = Math.min(numCenters, distinctCount(points));

        var clusterer = new KMeansPlusPlusClusterer<DoublePoint>(k, MAX_ITERATIONS, new EuclideanDistance(),
                new JDKRandomGenerator(SEED));
        List<CentroidCluster<DoublePoint>> clusters = clusterer.cluster(points);

        double[] out = new double[clusters.size()];
        for (int i = 0; i < out.length; i++) {
            double[] c = clusters.get(i).getCenter().getPoint();
            out[i] = Math.toDegrees(Math.atan2(c[1], c[0]));
        }
        Arrays.sort(out);
        return out;
    }

    /** Evenly strided subset of at most {@code limit} samples, endpoints kept. */
    static double[] subsample(double[] data, int limit) {
        if (data.length <= limit)
            return data;
        double[] out = new double[limit];
        double step = (double) (data.length - 1) / (limit - 1);
        for (int i = 0; i < limit; i++)
            out[i] = data[(int) (i * step)];
        return out;
    }

    private static List<DoublePoint> toUnitCircle(double[] anglesDeg) {
        List<DoublePoint> points = new ArrayList<>(anglesDeg.length);
        for (double a : anglesDeg) {
            double r = Math.toRadians(a);
            points.add(new DoublePoint(new double[] { Math.cos(r), Math.sin(r) }));
        }
        return points;
    }

    private static int distinctCount(List<DoublePoint> points) {
        Set<DoublePoint> distinct = new HashSet<>(points);
        return distinct.size();
    }
}
