package org.quarry.formula.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A resolved reference to an external entity such as a place or a person.
 *
 * @param id The stable entity identifier, may be empty.
 * @param type The entity type, e.g. {@code "place"} or {@code "person"}.
 * @param label The display label the mention is written with (without {@code @}).
 * @param resolved Whether the entity was resolved against an external source.
 * @param properties Custom entity properties, e.g. {@code latitude}/{@code longitude} for places.
 */
public record MentionEntity(
        String id,
        String type,
        String label,
        boolean resolved,
        Map<String, Object> properties
) {
    public MentionEntity {
        id = id == null ? "" : id;
        type = type == null ? "" : type;
        label = label == null ? "" : label;
        properties = properties == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * Creates a resolved entity with the given properties and an id derived from type and label.
     */
    public static MentionEntity of(String type, String label, Map<String, Object> properties) {
        return new MentionEntity(type + ":" + label, type, label, true, properties);
    }

    /**
     * Checks whether this entity is of the given type, ignoring case.
     */
    public boolean isType(String expectedType) {
        return type.equalsIgnoreCase(expectedType);
    }

    /**
     * Exposes the entity as a formula object value. Custom properties stay nested under
     * {@code properties}, which member access probes as a fallback.
     * @return An unmodifiable map view of this entity.
     */
    public Map<String, Object> toValue() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("id", id);
        value.put("type", type);
        value.put("label", label);
        value.put("resolved", resolved);
        value.put("properties", properties);
        return Collections.unmodifiableMap(value);
    }
}
