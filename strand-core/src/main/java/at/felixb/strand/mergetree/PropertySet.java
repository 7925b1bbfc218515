package at.felixb.strand.mergetree;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;

/**
 * Ordered key/value bag attached to segments and intervals.
 * <p>
 * Used both as a property bag and as a patch: in a patch a {@code null} value deletes the key.
 * {@link ObjectHandle} values are written to JSON as {@code {"type":"__fluid_handle__","url":path}}.
 */
public final class PropertySet {

    static final String HANDLE_TYPE = "__fluid_handle__";

    private final Map<String, Object> values = new LinkedHashMap<>();

    public PropertySet() {
    }

    public static PropertySet of(Map<String, ?> map) {
        PropertySet set = new PropertySet();
        if (map != null) {
            set.values.putAll(map);
        }
        return set;
    }

    public static PropertySet of(String key, Object value) {
        return new PropertySet().put(key, value);
    }

    public PropertySet put(String key, Object value) {
        values.put(Objects.requireNonNull(key, "key"), value);
        return this;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public Set<String> keySet() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public PropertySet copy() {
        return of(values);
    }

    /**
     * Applies a patch in place: non-null values are written, null values delete their key.
     */
    public PropertySet merge(PropertySet patch) {
        if (patch == null) {
            return this;
        }
        patch.values.forEach(this::set);
        return this;
    }

    void set(String key, Object value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    /** Handles stored directly as property values. */
    public List<ObjectHandle> handles() {
        List<ObjectHandle> handles = new ArrayList<>();
        for (Object value : values.values()) {
            if (value instanceof ObjectHandle handle) {
                handles.add(handle);
            }
        }
        return handles;
    }

    // -------------------------------------------------
    //  JSON
    // -------------------------------------------------

    @JsonValue
    public Map<String, Object> toJson() {
        Map<String, Object> json = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (value instanceof ObjectHandle handle) {
                Map<String, Object> encoded = new LinkedHashMap<>();
                encoded.put("type", HANDLE_TYPE);
                encoded.put("url", handle.absolutePath());
                json.put(key, encoded);
            } else {
                json.put(key, value);
            }
        });
        return json;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PropertySet fromJson(Map<String, Object> json) {
        PropertySet set = new PropertySet();
        if (json == null) {
            return set;
        }
        json.forEach((key, value) -> {
            if (value instanceof Map<?, ?> map && HANDLE_TYPE.equals(map.get("type")) && map.get("url") instanceof String url) {
                set.values.put(key, new ObjectHandle(url));
            } else {
                set.values.put(key, value);
            }
        });
        return set;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertySet other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
