package org.olympiac.compiler.frontend.semantics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Side-table metadata the verifier attaches to a node: the inferred type plus kind-specific
 * fields such as resolved argument types or a completeness flag.
 *
 * @param type The inferred type.
 * @param fields Insertion-ordered extra fields. Values are plain strings, numbers, booleans,
 *               lists and maps, so a decoration serializes without adapters.
 */
public record Decoration(TypeTag type, Map<String, Object> fields) {

    public Decoration {
        // LinkedHashMap because fields may hold null, e.g. an unresolved reference.
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static Decoration of(TypeTag type) {
        return new Decoration(type, Map.of());
    }

    /**
     * Starts a decoration with extra fields.
     * @param type The inferred type.
     * @return A builder.
     */
    public static Builder builder(TypeTag type) {
        return new Builder(type);
    }

    public Object field(String key) {
        return fields.get(key);
    }

    /**
     * @return {@code {type, ...fields}} as an insertion-ordered map.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type.toString());
        map.putAll(fields);
        return map;
    }

    public static final class Builder {
        private final TypeTag type;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Builder(TypeTag type) {
            this.type = type;
        }

        public Builder with(String key, Object value) {
            fields.put(key, value);
            return this;
        }

        public Decoration build() {
            return new Decoration(type, fields);
        }
    }
}
