package com.spectral.rtm.engine;

/**
 * Radiances along the four sun-surface-sensor paths, following the
 * Schaepman-Strub et al. (2006) nomenclature.
 *
 * @param biDirect   downward direct times upward direct
 * @param hemiDirect downward direct plus diffuse times upward direct
 * @param directHemi downward direct times upward diffuse
 * @param biHemi     downward direct plus diffuse times upward diffuse
 */
public record CoupledTerms(double[] biDirect, double[] hemiDirect, double[] directHemi, double[] biHemi) {
}
