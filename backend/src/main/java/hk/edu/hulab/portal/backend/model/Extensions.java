package hk.edu.hulab.portal.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Extension map of a statement context or result.
 * <p>
 * On the wire this is a flat object keyed by IRI. In memory the well-known keys of {@link ExtensionKey}
 * are held apart from the remaining IRIs so that callers get typed access to what they rely on and
 * still round-trip whatever other producers put on a statement.
 */
public final class Extensions {

    private static final Extensions EMPTY = new Extensions(Map.of());

    private final Map<ExtensionKey, Object> known = new EnumMap<>(ExtensionKey.class);
    private final Map<String, Object> extra = new LinkedHashMap<>();

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Extensions(Map<String, Object> values) {
        if (values == null) {
            return;
        }
        values.forEach((iri, value) -> {
            ExtensionKey key = ExtensionKey.fromIri(iri);
            if (key != null) {
                known.put(key, value);
            } else {
                extra.put(iri, value);
            }
        });
    }

    public static Extensions empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonValue
    public Map<String, Object> asMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        known.forEach((key, value) -> out.put(key.iri(), value));
        out.putAll(extra);
        return out;
    }

    public boolean has(ExtensionKey key) {
        return known.get(key) != null;
    }

    public String getString(ExtensionKey key) {
        Object value = known.get(key);
        return value != null ? value.toString() : null;
    }

    public long getLong(ExtensionKey key, long defaultValue) {
        Object value = known.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public List<String> getStringList(ExtensionKey key) {
        Object value = known.get(key);
        if (value instanceof List<?> list) {
            return list.stream().filter(Objects::nonNull).map(Object::toString).toList();
        }
        if (value != null) {
            return List.of(value.toString());
        }
        return List.of();
    }

    /**
     * Values under IRIs outside the well-known set.
     */
    public Map<String, Object> extra() {
        return Collections.unmodifiableMap(extra);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Extensions other)) {
            return false;
        }
        return known.equals(other.known) && extra.equals(other.extra);
    }

    @Override
    public int hashCode() {
        return Objects.hash(known, extra);
    }

    @Override
    public String toString() {
        return asMap().toString();
    }

    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        public Builder put(ExtensionKey key, Object value) {
            if (value != null) {
                values.put(key.iri(), value);
            }
            return this;
        }

        public Builder putExtra(String iri, Object value) {
            if (value != null) {
                values.put(iri, value);
            }
            return this;
        }

        public Extensions build() {
            return new Extensions(values);
        }
    }
}
