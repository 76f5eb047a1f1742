package org.codesonify.composition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One effect in a track's effect chain.
 *
 * @param type The effect.
 * @param params Named numeric parameters, in declaration order.
 */
public record TrackEffect(EffectType type, Map<String, Double> params) {

    public TrackEffect {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    static TrackEffect of(EffectType type, String key, double value) {
        return new TrackEffect(type, Map.of(key, value));
    }

    static TrackEffect of(EffectType type, String firstKey, double firstValue, String secondKey, double secondValue) {
        Map<String, Double> params = new LinkedHashMap<>();
        params.put(firstKey, firstValue);
        params.put(secondKey, secondValue);
        return new TrackEffect(type, params);
    }
}
