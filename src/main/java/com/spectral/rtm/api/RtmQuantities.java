package com.spectral.rtm.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Named per-wavelength quantities returned by an engine query, or the merged
 * result over all engines.
 *
 * <p>
 * A name may be present as a <i>placeholder</i>: the engine declares the
 * quantity but has no spectral values for it. Placeholders switch the coupled
 * radiance model into its degenerate two-term form.
 *
 * <p>
 * Arrays are stored by reference. Callers must not mutate an array after
 * handing it over.
 */
public final class RtmQuantities {
    public static final String RHOATM = "rhoatm";
    public static final String SPHALB = "sphalb";
    public static final String TRANSM_DOWN_DIR = "transm_down_dir";
    public static final String TRANSM_DOWN_DIF = "transm_down_dif";
    public static final String TRANSM_UP_DIR = "transm_up_dir";
    public static final String TRANSM_UP_DIF = "transm_up_dif";
    public static final String THERMAL_UPWELLING = "thermal_upwelling";
    public static final String THERMAL_DOWNWELLING = "thermal_downwelling";

    private final Map<String, double[]> arrays = new LinkedHashMap<>();
    private final Set<String> placeholders = new LinkedHashSet<>();

    public RtmQuantities put(String name, double[] values) {
        if (values == null)
            throw new IllegalArgumentException("Null array for quantity " + name + "; use putPlaceholder");
        placeholders.remove(name);
        arrays.put(name, values);
        return this;
    }

    public RtmQuantities putPlaceholder(String name) {
        arrays.remove(name);
        placeholders.add(name);
        return this;
    }

    public boolean contains(String name) {
        return arrays.containsKey(name) || placeholders.contains(name);
    }

    /** True when the name is present with real spectral values. */
    public boolean isArray(String name) {
        return arrays.containsKey(name);
    }

    public boolean isPlaceholder(String name) {
        return placeholders.contains(name);
    }

    /**
     * Returns the spectral values for the given quantity.
     *
     * @throws IllegalArgumentException if the quantity is absent or only a
     *                                  placeholder.
     */
    public double[] get(String name) {
        double[] v = arrays.get(name);
        if (v == null) {
            if (placeholders.contains(name))
                throw new IllegalArgumentException("Quantity '" + name + "' is a placeholder without values");
            throw new IllegalArgumentException("Missing quantity '" + name + "', available: " + names());
        }
        return v;
    }

    /** All names, array-valued first, in insertion order. */
    public Set<String> names() {
        Set<String> all = new LinkedHashSet<>(arrays.keySet());
        all.addAll(placeholders);
        return Collections.unmodifiableSet(all);
    }

    public int size() {
        return arrays.size() + placeholders.size();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RtmQuantities{");
        boolean first = true;
        for (var e : arrays.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(e.getKey()).append("[").append(e.getValue().length).append("]");
            first = false;
        }
        for (String p : placeholders) {
            if (!first)
                sb.append(", ");
            sb.append(p).append("[-]");
            first = false;
        }
        return sb.append('}').toString();
    }
}
