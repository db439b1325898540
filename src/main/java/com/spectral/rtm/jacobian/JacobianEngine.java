package com.spectral.rtm.jacobian;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.UnaryOperator;

import com.spectral.rtm.api.Geometry;
import com.spectral.rtm.api.RtmQuantities;
import com.spectral.rtm.engine.AtmosphericState;
import com.spectral.rtm.engine.OpticalRelations;
import com.spectral.rtm.engine.RadiativeTransfer;

import lombok.extern.log4j.Log4j2;

/**
 * Sensitivity of modelled radiance to the retrieval state.
 *
 * <ul>
 * <li>K_RT: forward finite differences over the radiative transfer state, one
 * extra forward model run per element. The runs are independent and are
 * spread over the executor when one is supplied.</li>
 * <li>K_surface: analytic chain rule through the caller's
 * {@code d rfl / d surface} and {@code d Ls / d surface}; with an active glint
 * model the last two columns are the glint derivatives.</li>
 * <li>Kb_RT: nuisance parameters. Only {@value #H2O_ABSCO} is modelled, as a
 * relative perturbation of {@value #H2OSTR}; any other unknown gets a zero
 * column.</li>
 * </ul>
 */
@Log4j2
public final class JacobianEngine {
    /** Relative to radiance magnitudes of order one; above double round-off. */
    public static final double DEFAULT_EPSILON = 1e-6;

    public static final String H2O_ABSCO = "H2O_ABSCO";
    public static final String H2OSTR = "H2OSTR";

    private final RadiativeTransfer rt;
    private final ExecutorService executor;
    private final double eps;

    public JacobianEngine(RadiativeTransfer rt) {
        this(rt, null, DEFAULT_EPSILON);
    }

    /**
     * @param rt       forward model
     * @param executor pool for the K_RT columns, or {@code null} to run them on
     *                 the calling thread
     * @param eps      finite difference step
     */
    public JacobianEngine(RadiativeTransfer rt, ExecutorService executor, double eps) {
        if (!(eps > 0))
            throw new IllegalArgumentException("Finite difference step must be positive: " + eps);
        this.rt = rt;
        this.executor = executor;
        this.eps = eps;
    }

    public double epsilon() {
        return eps;
    }

    /**
     * Jacobians with respect to the radiative transfer and surface states.
     *
     * @param xRt          radiative transfer state
     * @param xSurface     surface state
     * @param rflDir       directional surface reflectance
     * @param rflDif       hemispherical surface reflectance
     * @param drflDsurface {@code [channel][surface element]}
     * @param ls           surface emitted radiance
     * @param dLsDsurface  {@code [channel][surface element]}
     * @param geom         observation geometry
     */
    public RtJacobians drdnDRT(double[] xRt, double[] xSurface, double[] rflDir, double[] rflDif,
            double[][] drflDsurface, double[] ls, double[][] dLsDsurface, Geometry geom) {
        UnaryOperator<double[]> f = x -> rt.calcRdn(x, rflDir, rflDif, ls, geom);
        double[] rdn = f.apply(xRt);

        List<Callable<double[]>> tasks = new ArrayList<>(xRt.length);
        for (int i = 0; i < xRt.length; i++) {
            final int index = i;
            tasks.add(() -> FiniteDifference.directionalDerivative(f, xRt, rdn, index, Perturbation.ABSOLUTE, eps));
        }
        double[][] kRt = FiniteDifference.fromColumns(run(tasks), rdn.length);
        double[][] kSurface = surfaceJacobian(xRt, xSurface, rflDir, drflDsurface, dLsDsurface, geom);
        return new RtJacobians(kRt, kSurface);
    }

    private double[][] surfaceJacobian(double[] xRt, double[] xSurface, double[] rflDir, double[][] drflDsurface,
            double[][] dLsDsurface, Geometry geom) {
        int n = rt.channelCount();
        if (drflDsurface.length != n || dLsDsurface.length != n) {
            throw new IllegalArgumentException("Surface derivative rows must match " + n + " channels");
        }
        AtmosphericState state = rt.evaluate(xRt, geom);
        RtmQuantities r = state.shared();
        double[] sAlb = r.get(RtmQuantities.SPHALB);
        double[] tUpDir = r.get(RtmQuantities.TRANSM_UP_DIR);
        double[] tUpDif = r.get(RtmQuantities.TRANSM_UP_DIF);

        double[] lDownTot = state.downward().total();
        double[] lDownDif = state.downward().diffuse();
        // Direct downward radiance comes scaled by the TOA zenith; rescale for slope and aspect
        double[] lDownDir = state.downward().direct().clone();
        double slope = state.cosI() / state.cosZenith();
        for (int i = 0; i < n; i++)
            lDownDir[i] *= slope;

        boolean glint = rt.isGlintModel();
        int ns = xSurface.length;
        if (glint && ns < 2)
            throw new IllegalArgumentException("Glint model needs at least two surface state elements");

        double[] bg;
        if (geom.hasBackgroundReflectance()) {
            bg = geom.backgroundReflectance();
        } else if (glint) {
            // Nadir sky reflectance at every view angle
            bg = new double[n];
            for (int i = 0; i < n; i++) {
                double lSky = xSurface[ns - 2] * lDownDir[i] + xSurface[ns - 1] * lDownDif[i];
                bg[i] = rflDir[i] + OpticalRelations.NADIR_SKY_REFLECTANCE * (lSky / lDownTot[i]);
            }
        } else {
            bg = rflDir;
        }

        int cols = drflDsurface[0].length;
        if (glint && cols < 2)
            throw new IllegalArgumentException("Glint model needs at least two surface Jacobian columns");
        double[][] k = new double[n][cols];
        for (int i = 0; i < n; i++) {
            double denom = 1.0 - sAlb[i] * bg[i];
            double drdnDrfl = (lDownDir[i] + lDownDif[i]) / denom * tUpDir[i];
            double drdnDLs = tUpDir[i] + tUpDif[i];
            for (int j = 0; j < cols; j++)
                k[i][j] = drdnDrfl * drflDsurface[i][j] + drdnDLs * dLsDsurface[i][j];
            if (glint) {
                k[i][cols - 2] = lDownDir[i] * drdnDLs / denom;
                k[i][cols - 1] = lDownDif[i] * drdnDLs / denom;
            }
        }
        return k;
    }

    /**
     * Jacobian with respect to the unknown (nuisance) parameters,
     * {@code [channel][unknown]}. Empty when no unknowns are declared.
     */
    public double[][] drdnDRTb(double[] xRt, double[] rflDir, double[] rflDif, double[] ls, Geometry geom) {
        List<String> unknowns = rt.unknownNames();
        int n = rt.channelCount();
        if (unknowns.isEmpty())
            return new double[n][0];

        int h2oIndex = rt.stateVector().indexOf(H2OSTR);
        UnaryOperator<double[]> f = x -> rt.calcRdn(x, rflDir, rflDif, ls, geom);
        double[] rdn = null;

        List<double[]> columns = new ArrayList<>(unknowns.size());
        for (String unknown : unknowns) {
            if (H2O_ABSCO.equals(unknown) && h2oIndex >= 0) {
                if (rdn == null)
                    rdn = f.apply(xRt);
                columns.add(FiniteDifference.directionalDerivative(f, xRt, rdn, h2oIndex, Perturbation.RELATIVE,
                        eps));
            } else {
                log.debug("No forward model derivative for unknown {}; using zeros", unknown);
                columns.add(new double[n]);
            }
        }
        return FiniteDifference.fromColumns(columns, n);
    }

    private List<double[]> run(List<Callable<double[]>> tasks) {
        List<double[]> out = new ArrayList<>(tasks.size());
        if (executor == null) {
            for (Callable<double[]> t : tasks) {
                try {
                    out.add(t.call());
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new IllegalStateException("Jacobian column failed", e);
                }
            }
            return out;
        }

        List<Future<double[]>> futures = new ArrayList<>(tasks.size());
        for (Callable<double[]> t : tasks)
            futures.add(executor.submit(t));
        try {
            for (Future<double[]> fut : futures)
                out.add(fut.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(fut -> fut.cancel(true));
            throw new IllegalStateException("Interrupted while computing Jacobian columns", e);
        } catch (ExecutionException e) {
            futures.forEach(fut -> fut.cancel(true));
            throw new IllegalStateException("Jacobian column failed", e.getCause());
        }
        return out;
    }
}
