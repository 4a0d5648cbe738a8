package io.github.drompincen.scriptops.runtime.execution;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Turns an execution's parameter map into command-line flags, in map order.
 * {@code true} becomes a bare {@code --key}; null, false, empty strings, zero and empty
 * collections are left out; anything else becomes {@code --key value}.
 */
public final class ScriptArguments {

    private ScriptArguments() {}

    public static List<String> toCliArgs(Map<String, Object> parameters) {
        List<String> args = new ArrayList<>();
        if (parameters == null) return args;
        for (Map.Entry<String, Object> entry : parameters.entrySet()) {
            Object value = entry.getValue();
            if (isFalsy(value)) continue;
            args.add("--" + entry.getKey());
            if (!Boolean.TRUE.equals(value)) {
                args.add(String.valueOf(value));
            }
        }
        return args;
    }

    static boolean isFalsy(Object value) {
        if (value == null) return true;
        if (value instanceof Boolean b) return !b;
        if (value instanceof CharSequence s) return s.length() == 0;
        if (value instanceof Number n) return n.doubleValue() == 0;
        if (value instanceof Collection<?> c) return c.isEmpty();
        if (value instanceof Map<?, ?> m) return m.isEmpty();
        return false;
    }
}
