package com.hearth.template;

import com.hearth.actionmodel.error.InvalidActionException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConditionEvaluatorTest {

    private static final Map<String, Object> CONTEXT = Map.of("home", true, "mode", "off", "count", 0);

    private final ConditionEvaluator evaluator = new ConditionEvaluator(PlaceholderTemplateRenderer.strict());

    @Test
    void literalsAndTemplates() {
        assertTrue(evaluator.evaluate(true, CONTEXT));
        assertTrue(evaluator.evaluate("{{ home }}", CONTEXT));
        assertFalse(evaluator.evaluate("{{ mode }}", CONTEXT));
        assertFalse(evaluator.evaluate("{{ count }}", CONTEXT));
    }

    @Test
    void listMeansAll() {
        assertTrue(evaluator.evaluate(List.of(true, "{{ home }}"), CONTEXT));
        assertFalse(evaluator.evaluate(List.of(true, "{{ mode }}"), CONTEXT));
    }

    @Test
    void templateAndLogicalMappings() {
        assertTrue(evaluator.evaluate(Map.of("condition", "template", "value_template", "{{ home }}"), CONTEXT));
        assertTrue(evaluator.evaluate(Map.of("condition", "or", "conditions", List.of(false, "{{ home }}")), CONTEXT));
        assertFalse(evaluator.evaluate(Map.of("condition", "and", "conditions", List.of(true, false)), CONTEXT));
        assertTrue(evaluator.evaluate(Map.of("condition", "not", "conditions", List.of("{{ mode }}")), CONTEXT));
        assertTrue(evaluator.evaluate(Map.of("or", List.of("{{ count }}", "yes")), CONTEXT));
    }

    @Test
    void liveStateConditionsAreRejected() {
        assertThrows(InvalidActionException.class, () -> evaluator.evaluate(
                Map.of("condition", "state", "entity_id", "light.kitchen", "state", "on"), CONTEXT));
    }

    @Test
    void renderFailurePropagates() {
        assertThrows(InvalidActionException.class, () -> evaluator.evaluate("{{ unknown }}", CONTEXT));
    }

    @Test
    void truthinessWords() {
        assertFalse(Truthiness.isTruthy("No"));
        assertFalse(Truthiness.isTruthy(" off "));
        assertFalse(Truthiness.isTruthy(null));
        assertTrue(Truthiness.isTruthy("on"));
        assertTrue(Truthiness.isTruthy(0.5));
        assertFalse(Truthiness.isTruthy(List.of()));
    }
}
