package com.spectral.rtm.engine;

import java.util.List;

import com.spectral.rtm.api.RtMode;
import com.spectral.rtm.api.RtmQuantities;

/**
 * Coupled radiance model.
 *
 * <p>
 * Pure function: every call allocates and returns fresh arrays and keeps no
 * state, so the forward model may be evaluated for many pixels at once.
 *
 * <p>
 * If any coupling term is a placeholder the degenerate two-term model is used:
 * {@code [t_down_dir, t_down_dir + t_down_dif, 0, 0]}. Otherwise each term is
 * taken from the quantities, brought to radiance with
 * {@code E0 * cos(theta_s) / pi} on transmittance-mode segments. In both cases
 * the two direct-illumination terms are then rescaled by
 * {@code cos_i / cos(theta_s)} for the local surface slope.
 */
public final class CoupledRadiance {

    private CoupledRadiance() {
        // Utility class
    }

    public static CoupledTerms compute(RtmQuantities r, List<String> couplingTerms, List<SpectralSegment> segments,
            double[] solarIrradiance, double cosZenith, double cosI) {
        if (couplingTerms.size() != 4)
            throw new IllegalArgumentException("Expected 4 coupling terms, got " + couplingTerms);

        int n = solarIrradiance.length;
        double[][] terms = new double[4][];
        boolean degenerate = couplingTerms.stream().anyMatch(k -> !r.isArray(k));

        if (degenerate) {
            double[] dir = r.get(RtmQuantities.TRANSM_DOWN_DIR);
            double[] dif = r.get(RtmQuantities.TRANSM_DOWN_DIF);
            terms[0] = dir.clone();
            terms[1] = new double[n];
            for (int i = 0; i < n; i++)
                terms[1][i] = dir[i] + dif[i];
            terms[2] = new double[n];
            terms[3] = new double[n];
        } else {
            for (int t = 0; t < 4; t++) {
                double[] src = r.get(couplingTerms.get(t));
                double[] out = new double[n];
                for (SpectralSegment seg : segments) {
                    if (seg.mode() == RtMode.TRANSMITTANCE) {
                        for (int i = seg.offset(); i < seg.end(); i++)
                            out[i] = solarIrradiance[i] * cosZenith / Math.PI * src[i];
                    } else {
                        System.arraycopy(src, seg.offset(), out, seg.offset(), seg.length());
                    }
                }
                terms[t] = out;
            }
        }

        // Direct terms come scaled by the TOA zenith; move them to the local slope
        double slope = cosI / cosZenith;
        for (int i = 0; i < n; i++) {
            terms[0][i] *= slope;
            terms[2][i] *= slope;
        }
        return new CoupledTerms(terms[0], terms[1], terms[2], terms[3]);
    }
}
