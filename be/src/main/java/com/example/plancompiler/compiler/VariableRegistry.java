package com.example.plancompiler.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Variables referenced by the compiled program, keyed by flattened name, each with a demo value
 * range used to simulate executions. One instance per compilation run.
 * <p>
 * Names produced inside the program are removed during assembly; what remains must be supplied
 * as external input.
 * </p>
 */
public final class VariableRegistry {

    private static final Logger log = LoggerFactory.getLogger(VariableRegistry.class);

    private final Map<String, List<Object>> ranges = new LinkedHashMap<>();
    private final Map<String, String> dottedNames = new HashMap<>();
    private final Set<String> collisions = new LinkedHashSet<>();

    /**
     * Registers {@code dottedName}. A known range is never replaced, an unknown ({@code null}) one is.
     */
    public void register(String dottedName, List<Object> range) {
        String flat = dottedName.replace('.', '_');
        String previous = dottedNames.putIfAbsent(flat, dottedName);
        if (previous != null && !previous.equals(dottedName) && collisions.add(flat)) {
            log.warn("Variables '{}' and '{}' both flatten to '{}'", previous, dottedName, flat);
        }
        if (ranges.get(flat) == null) {
            ranges.put(flat, range);
        }
    }

    public boolean contains(String flatName) {
        return ranges.containsKey(flatName);
    }

    public List<Object> range(String flatName) {
        return ranges.get(flatName);
    }

    /**
     * Registered names equal to {@code flatName} or nested under it ({@code flatName_...}).
     */
    public List<String> namesUnder(String flatName) {
        String nested = flatName + "_";
        return ranges.keySet().stream()
                .filter(name -> name.equals(flatName) || name.startsWith(nested))
                .toList();
    }

    public void removeAll(Collection<String> flatNames) {
        flatNames.forEach(ranges::remove);
    }

    /** Flattened names claimed by more than one distinct dotted name. */
    public Set<String> collisions() {
        return Collections.unmodifiableSet(collisions);
    }

    /** Remaining names and their ranges, in registration order. */
    public Map<String, List<Object>> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(ranges));
    }
}
