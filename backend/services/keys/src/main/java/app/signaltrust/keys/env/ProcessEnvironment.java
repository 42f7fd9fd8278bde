package app.signaltrust.keys.env;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Environment variables of this process plus values exported at runtime. A running JVM cannot
 * change its own OS environment, so exported values live in an overlay that is applied to child
 * processes through {@link #applyTo(ProcessBuilder)}.
 */
public class ProcessEnvironment {

    private final Map<String, String> base;
    private final Map<String, String> exported = new ConcurrentHashMap<>();

    public ProcessEnvironment() {
        this(System.getenv());
    }

    public ProcessEnvironment(Map<String, String> base) {
        this.base = Map.copyOf(base);
    }

    public Optional<String> get(String name) {
        String value = exported.get(name);
        if (value == null) {
            value = base.get(name);
        }
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public Set<String> names() {
        Set<String> names = new TreeSet<>(base.keySet());
        names.addAll(exported.keySet());
        return names;
    }

    public void export(String name, String value) {
        if (name == null || name.isBlank() || value == null) {
            throw new IllegalArgumentException("Environment name and value are required");
        }
        exported.put(name, value);
    }

    public Map<String, String> exported() {
        return Map.copyOf(exported);
    }

    public ProcessBuilder applyTo(ProcessBuilder builder) {
        builder.environment().putAll(exported);
        return builder;
    }
}
