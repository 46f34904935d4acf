package com.hearth.template;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Truth value of rendered template output. */
public final class Truthiness {

    private static final Set<String> FALSE_WORDS = Set.of("", "false", "off", "no", "0", "none", "null");

    private Truthiness() {
    }

    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) return n.doubleValue() != 0.0;
        if (value instanceof String s) return !FALSE_WORDS.contains(s.trim().toLowerCase(Locale.ROOT));
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }
}
