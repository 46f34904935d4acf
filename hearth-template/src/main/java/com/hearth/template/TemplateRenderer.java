package com.hearth.template;

import java.util.Map;

/**
 * Resolves template expressions in a raw value against a variable context.
 * Implementations must be idempotent and free of side effects.
 */
public interface TemplateRenderer {

    /**
     * Renders {@code rawValue}. Maps and lists are rendered element by element; other non-string values
     * are returned unchanged.
     *
     * @param rawValue value as written in the automation document
     * @param context  variables visible to the expression; may be empty
     * @return rendered value
     * @throws com.hearth.actionmodel.error.InvalidActionException if an expression cannot be resolved
     */
    Object render(Object rawValue, Map<String, Object> context);
}
