package com.hearth.template;

import com.hearth.actionmodel.error.InvalidActionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default renderer for {@code {{ name }}} placeholders.
 * <ul>
 *   <li>{@code {{ a.b.c }}} walks nested maps (and list indexes) in the context.</li>
 *   <li>A string that is exactly one placeholder renders to the resolved value itself, keeping its type.</li>
 *   <li>{@code {{ name | default(x) }}} falls back to {@code x} when {@code name} is missing.</li>
 *   <li>Unknown names fail in strict mode; a {@link #lenient()} renderer leaves the placeholder as written.</li>
 * </ul>
 */
public final class PlaceholderTemplateRenderer implements TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(.*?)\\s*}}");
    private static final Pattern SINGLE_PLACEHOLDER = Pattern.compile("^\\s*\\{\\{\\s*(.*?)\\s*}}\\s*$");
    private static final Pattern PATH = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z0-9_]+)*");
    private static final Pattern INTEGER = Pattern.compile("-?\\d{1,18}");
    private static final Pattern DEFAULT_FILTER = Pattern.compile("default\\((.*)\\)");

    private static final Object MISSING = new Object();

    private final boolean strict;

    private PlaceholderTemplateRenderer(boolean strict) {
        this.strict = strict;
    }

    /** Renderer that fails on unknown variables. */
    public static PlaceholderTemplateRenderer strict() {
        return new PlaceholderTemplateRenderer(true);
    }

    /** Renderer that leaves unresolvable placeholders untouched. */
    public static PlaceholderTemplateRenderer lenient() {
        return new PlaceholderTemplateRenderer(false);
    }

    public boolean isStrict() {
        return strict;
    }

    @Override
    public Object render(Object rawValue, Map<String, Object> context) {
        Map<String, Object> ctx = context != null ? context : Collections.emptyMap();
        return renderValue(rawValue, ctx);
    }

    private Object renderValue(Object value, Map<String, Object> ctx) {
        if (value instanceof String s) {
            return renderString(s, ctx);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.put(e.getKey(), renderValue(e.getValue(), ctx));
            }
            return out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(renderValue(item, ctx));
            }
            return out;
        }
        return value;
    }

    private Object renderString(String template, Map<String, Object> ctx) {
        if (!template.contains("{{")) {
            return template;
        }
        Matcher single = SINGLE_PLACEHOLDER.matcher(template);
        if (single.matches() && !single.group(1).contains("{{")) {
            Object resolved = evaluate(single.group(1), template, ctx);
            return resolved == MISSING ? template : resolved;
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            Object resolved = evaluate(matcher.group(1), template, ctx);
            String replacement = resolved == MISSING ? matcher.group(0) : String.valueOf(resolved);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /** Resolves one expression; returns {@link #MISSING} when lenient and unresolvable. */
    private Object evaluate(String expression, String template, Map<String, Object> ctx) {
        String[] parts = expression.split("\\|", 2);
        String path = parts[0].trim();
        Object fallback = MISSING;
        if (parts.length == 2) {
            Matcher filter = DEFAULT_FILTER.matcher(parts[1].trim());
            if (!filter.matches()) {
                return unresolved(template, "Unsupported template filter: " + parts[1].trim());
            }
            fallback = parseLiteral(filter.group(1).trim());
        }
        if (!PATH.matcher(path).matches()) {
            return unresolved(template, "Unsupported template expression: " + expression);
        }
        Object value = lookup(path, ctx);
        if (value != MISSING && value != null) {
            return value;
        }
        if (fallback != MISSING) {
            return fallback;
        }
        if (value == null) {
            return null;
        }
        return unresolved(template, "Unknown template variable: " + path);
    }

    private Object unresolved(String template, String reason) {
        if (strict) {
            throw new InvalidActionException(template, reason);
        }
        return MISSING;
    }

    private static Object lookup(String path, Map<String, Object> ctx) {
        Object current = ctx;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                if (!map.containsKey(segment)) return MISSING;
                current = map.get(segment);
            } else if (current instanceof List<?> list && segment.chars().allMatch(Character::isDigit)) {
                int index = Integer.parseInt(segment);
                if (index >= list.size()) return MISSING;
                current = list.get(index);
            } else {
                return MISSING;
            }
        }
        return current;
    }

    private static Object parseLiteral(String literal) {
        if (literal.length() >= 2
                && ((literal.startsWith("'") && literal.endsWith("'"))
                || (literal.startsWith("\"") && literal.endsWith("\"")))) {
            return literal.substring(1, literal.length() - 1);
        }
        if ("true".equalsIgnoreCase(literal)) return Boolean.TRUE;
        if ("false".equalsIgnoreCase(literal)) return Boolean.FALSE;
        if ("none".equalsIgnoreCase(literal) || "null".equalsIgnoreCase(literal)) return null;
        if (INTEGER.matcher(literal).matches()) {
            return Long.parseLong(literal);
        }
        try {
            return Double.parseDouble(literal);
        } catch (NumberFormatException e) {
            return literal;
        }
    }
}
