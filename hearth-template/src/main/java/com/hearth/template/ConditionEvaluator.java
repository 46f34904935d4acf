package com.hearth.template;

import com.hearth.actionmodel.error.InvalidActionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Evaluates the opaque conditions of {@code choose} branches and {@code repeat} loops.
 * <p>
 * Supported forms: a boolean; a template string judged by {@link Truthiness}; a list (all must hold);
 * a mapping with {@code condition: template} ({@code value_template}), {@code and}, {@code or} or {@code not}
 * over nested {@code conditions}, also accepted in the shorthand {@code {and: [...]}}.
 * Conditions that need live platform state (e.g. {@code condition: state}) are rejected.
 */
public final class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final TemplateRenderer renderer;

    public ConditionEvaluator(TemplateRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    /**
     * @throws InvalidActionException when the condition is malformed, unsupported or fails to render
     */
    public boolean evaluate(Object condition, Map<String, Object> context) {
        boolean result = evaluateValue(condition, context);
        if (log.isDebugEnabled()) {
            log.debug("Condition evaluated | condition={} | result={}", condition, result);
        }
        return result;
    }

    private boolean evaluateValue(Object condition, Map<String, Object> context) {
        if (condition == null) {
            throw new InvalidActionException("Missing condition");
        }
        if (condition instanceof Boolean b) {
            return b;
        }
        if (condition instanceof Number || condition instanceof String) {
            return Truthiness.isTruthy(renderer.render(condition, context));
        }
        if (condition instanceof List<?> list) {
            for (Object item : list) {
                if (!evaluateValue(item, context)) return false;
            }
            return true;
        }
        if (condition instanceof Map<?, ?> map) {
            return evaluateMap(map, context);
        }
        throw new InvalidActionException(String.valueOf(condition),
                "Unsupported condition type: " + condition.getClass().getSimpleName());
    }

    private boolean evaluateMap(Map<?, ?> map, Map<String, Object> context) {
        Object type = map.get("condition");
        if (type == null) {
            for (String shorthand : List.of("and", "or", "not")) {
                if (map.containsKey(shorthand)) {
                    return combine(shorthand, map.get(shorthand), map, context);
                }
            }
            if (map.containsKey("value_template")) {
                return evaluateTemplate(map.get("value_template"), map, context);
            }
            throw new InvalidActionException(String.valueOf(map), "Condition mapping has no 'condition' key");
        }
        String kind = String.valueOf(type).trim();
        switch (kind) {
            case "template":
                return evaluateTemplate(map.get("value_template"), map, context);
            case "and":
            case "or":
            case "not":
                return combine(kind, map.get("conditions"), map, context);
            default:
                throw new InvalidActionException(String.valueOf(map),
                        "Condition '" + kind + "' needs live platform state and is not supported here");
        }
    }

    private boolean evaluateTemplate(Object template, Map<?, ?> map, Map<String, Object> context) {
        if (template == null) {
            throw new InvalidActionException(String.valueOf(map), "Template condition has no value_template");
        }
        return Truthiness.isTruthy(renderer.render(template, context));
    }

    private boolean combine(String op, Object nested, Map<?, ?> map, Map<String, Object> context) {
        if (nested == null) {
            throw new InvalidActionException(String.valueOf(map), "'" + op + "' condition has no nested conditions");
        }
        List<?> items = nested instanceof List<?> l ? l : List.of(nested);
        switch (op) {
            case "and":
                for (Object item : items) {
                    if (!evaluateValue(item, context)) return false;
                }
                return true;
            case "or":
                for (Object item : items) {
                    if (evaluateValue(item, context)) return true;
                }
                return false;
            default:
                for (Object item : items) {
                    if (evaluateValue(item, context)) return false;
                }
                return true;
        }
    }
}
