package com.spectral.rtm.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.spectral.rtm.api.StateElement;
import com.spectral.rtm.io.ForwardModelDefinition.StateElementDef;

/**
 * Ordered radiative transfer state vector with bounds, scaling and priors.
 * Immutable once built.
 */
public final class StateVector {
    private final List<StateElement> elements;

    public StateVector(List<StateElement> elements) {
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    /** Builds the state vector in the configuration's declaration order. */
    public static StateVector fromDefinition(Map<String, StateElementDef> defs) {
        List<StateElement> list = new ArrayList<>(defs.size());
        for (Map.Entry<String, StateElementDef> e : defs.entrySet()) {
            StateElementDef d = e.getValue();
            double[] b = d.getBounds();
            if (b == null || b.length != 2) {
                throw new IllegalArgumentException("State element " + e.getKey() + " needs bounds [lo, hi]");
            }
            list.add(new StateElement(e.getKey(), b[0], b[1], d.getScale(), d.getInit(),
                    d.getPriorMean(), d.getPriorSigma()));
        }
        return new StateVector(list);
    }

    public int size() {
        return elements.size();
    }

    public StateElement element(int i) {
        return elements.get(i);
    }

    public List<StateElement> elements() {
        return elements;
    }

    public List<String> names() {
        return elements.stream().map(StateElement::name).toList();
    }

    /** Position of the named element, or -1. */
    public int indexOf(String name) {
        for (int i = 0; i < elements.size(); i++) {
            if (elements.get(i).name().equals(name))
                return i;
        }
        return -1;
    }

    /** Bounds as {@code [n][2]}. */
    public double[][] bounds() {
        double[][] b = new double[size()][];
        for (int i = 0; i < b.length; i++) {
            StateElement e = elements.get(i);
            b[i] = new double[] { e.lowerBound(), e.upperBound() };
        }
        return b;
    }

    public double[] scale() {
        return elements.stream().mapToDouble(StateElement::scale).toArray();
    }

    public double[] init() {
        return elements.stream().mapToDouble(StateElement::init).toArray();
    }

    public double[] priorMean() {
        return elements.stream().mapToDouble(StateElement::priorMean).toArray();
    }

    public double[] priorSigma() {
        return elements.stream().mapToDouble(StateElement::priorSigma).toArray();
    }
}
