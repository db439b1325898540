package com.spectral.rtm.lut;

import java.util.Map;

import com.spectral.rtm.api.StateElement;

/**
 * Aerosol table dimensions and the matching state vector elements, keyed by
 * element name in declaration order.
 */
public record AerosolPlan(Map<String, double[]> grids, Map<String, StateElement> stateElements) {
}
