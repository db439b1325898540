package com.spectral.rtm.engine;

import com.spectral.rtm.api.RtmQuantities;

/**
 * Everything the forward model and its analytic derivatives need from one
 * query of all engines.
 *
 * @param shared        quantities common to all engines, concatenated
 * @param pathRadiance  atmospheric path radiance {@code L_atm}
 * @param downward      downward radiance on the sun-to-surface path
 * @param cosZenith     cosine of the top-of-atmosphere solar zenith in use
 * @param cosI          cosine of the local solar incidence angle
 */
public record AtmosphericState(RtmQuantities shared, double[] pathRadiance, DownwardRadiance downward,
        double cosZenith, double cosI) {
}
