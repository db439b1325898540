package com.spectral.rtm.engine;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.spectral.rtm.api.RtmQuantities;

import lombok.extern.log4j.Log4j2;

/**
 * Stacks per-engine query results into one spectrum per quantity.
 *
 * <p>
 * Only names present in every engine's result survive; arrays are
 * concatenated in engine order. A placeholder in any engine makes the merged
 * quantity a placeholder. Whenever the merge drops names an engine did
 * provide, a warning is logged once per distinct set of dropped names.
 *
 * <p>
 * Thread-safe.
 */
@Log4j2
public final class QuantityMerger {
    private final Set<Set<String>> reportedDrops = ConcurrentHashMap.newKeySet();

    public RtmQuantities merge(List<RtmQuantities> perEngine) {
        if (perEngine.isEmpty())
            return new RtmQuantities();

        Set<String> shared = new LinkedHashSet<>(perEngine.get(0).names());
        for (int i = 1; i < perEngine.size(); i++) {
            shared.retainAll(perEngine.get(i).names());
        }
        reportDropped(perEngine, shared);

        RtmQuantities merged = new RtmQuantities();
        for (String key : shared) {
            boolean placeholder = false;
            int total = 0;
            for (RtmQuantities q : perEngine) {
                if (!q.isArray(key)) {
                    placeholder = true;
                    break;
                }
                total += q.get(key).length;
            }
            if (placeholder) {
                merged.putPlaceholder(key);
                continue;
            }
            double[] out = new double[total];
            int offset = 0;
            for (RtmQuantities q : perEngine) {
                double[] part = q.get(key);
                System.arraycopy(part, 0, out, offset, part.length);
                offset += part.length;
            }
            merged.put(key, out);
        }
        return merged;
    }

    private void reportDropped(List<RtmQuantities> perEngine, Set<String> shared) {
        Set<String> dropped = new LinkedHashSet<>();
        for (RtmQuantities q : perEngine) {
            for (String name : q.names()) {
                if (!shared.contains(name))
                    dropped.add(name);
            }
        }
        if (!dropped.isEmpty() && reportedDrops.add(dropped)) {
            log.warn("Quantities {} are not provided by every engine and are dropped from the merged result",
                    dropped);
        }
    }
}
