package org.dxworks.mdtree.walk;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Key/value scope threaded through a contextual walk.
 * <p>
 * Each visited node gets its own copy of its parent's scope. Writes therefore reach the node's
 * descendants but never its siblings or ancestors. A context lives for a single walk.
 */
public final class WalkContext {

    private final Map<String, Object> values;

    public WalkContext() {
        this.values = new HashMap<>();
    }

    private WalkContext(Map<String, Object> values) {
        this.values = new HashMap<>(values);
    }

    WalkContext copy() {
        return new WalkContext(values);
    }

    public WalkContext put(String key, Object value) {
        values.put(Objects.requireNonNull(key, "key"), value);
        return this;
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = values.get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public <T> T getOrDefault(String key, Class<T> type, T defaultValue) {
        return get(key, type).orElse(defaultValue);
    }

    @Override
    public String toString() {
        return "WalkContext" + values;
    }
}
