package com.hearth.actionparser;

import com.hearth.actionmodel.error.InvalidActionException;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Collects entity ids for a service call from {@code target.entity_id}, a step-level {@code entity_id}
 * and {@code data.entity_id}. Other target keys ({@code area_id}, {@code device_id}, ...) stay in the data.
 */
final class TargetExtractor {

    private static final String ENTITY_ID = "entity_id";

    /** Entity ids plus the service data left after removing them. */
    record ServiceTarget(Set<String> entityIds, Map<String, Object> data) {
    }

    private TargetExtractor() {
    }

    static ServiceTarget extract(Map<?, ?> step, Map<String, Object> rawData, String fragment) {
        Set<String> ids = new LinkedHashSet<>();
        Map<String, Object> data = new LinkedHashMap<>(rawData);

        Object target = step.get("target");
        if (target instanceof Map<?, ?> targetMap) {
            for (Map.Entry<?, ?> e : targetMap.entrySet()) {
                String key = String.valueOf(e.getKey());
                if (ENTITY_ID.equals(key)) {
                    addIds(ids, e.getValue(), fragment);
                } else {
                    data.putIfAbsent(key, e.getValue());
                }
            }
        } else if (target != null) {
            addIds(ids, target, fragment);
        }

        addIds(ids, step.get(ENTITY_ID), fragment);
        addIds(ids, data.remove(ENTITY_ID), fragment);
        return new ServiceTarget(ids, data);
    }

    private static void addIds(Set<String> ids, Object value, String fragment) {
        if (value == null) {
            return;
        }
        if (value instanceof Collection<?> c) {
            for (Object item : c) {
                addIds(ids, item, fragment);
            }
            return;
        }
        if (value instanceof Map<?, ?>) {
            throw new InvalidActionException(fragment, "entity_id must be a string or a list of strings");
        }
        for (String part : String.valueOf(value).split(",")) {
            String id = part.trim();
            if (!id.isEmpty()) ids.add(id);
        }
    }
}
