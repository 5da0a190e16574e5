package org.quarry.formula.api;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The read-only snapshot a formula is evaluated against. A context is built fresh for each
 * evaluation and never mutated by the engine; all collections are unmodifiable copies.
 */
public final class FormulaContext {

    private final Map<String, Object> fields;
    private final List<MentionEntity> mentions;
    private final List<Map<String, Object>> siblings;
    private final Map<String, Object> settings;
    private final String currentStrandPath;
    private final String currentBlockId;
    private final Instant now;

    private FormulaContext(Builder builder) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.mentions = Collections.unmodifiableList(new ArrayList<>(builder.mentions));
        List<Map<String, Object>> siblingCopies = new ArrayList<>();
        for (Map<String, Object> sibling : builder.siblings) {
            siblingCopies.add(Collections.unmodifiableMap(new LinkedHashMap<>(sibling)));
        }
        this.siblings = Collections.unmodifiableList(siblingCopies);
        this.settings = Collections.unmodifiableMap(new LinkedHashMap<>(builder.settings));
        this.currentStrandPath = builder.currentStrandPath;
        this.currentBlockId = builder.currentBlockId;
        this.now = builder.now != null ? builder.now : Instant.now();
    }

    /**
     * Creates a context where every property has its default value.
     * @return A context with empty collections, empty path and block id, and the current time.
     */
    public static FormulaContext create() {
        return builder().build();
    }

    /**
     * Starts building a context. Properties that are not set keep their defaults.
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder pre-populated with the properties of this context.
     * @return A new builder.
     */
    public Builder toBuilder() {
        return new Builder()
                .fields(fields)
                .mentions(mentions)
                .siblings(siblings)
                .settings(settings)
                .currentStrandPath(currentStrandPath)
                .currentBlockId(currentBlockId)
                .now(now);
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public List<MentionEntity> mentions() {
        return mentions;
    }

    public List<Map<String, Object>> siblings() {
        return siblings;
    }

    public Map<String, Object> settings() {
        return settings;
    }

    public String currentStrandPath() {
        return currentStrandPath;
    }

    public String currentBlockId() {
        return currentBlockId;
    }

    public Instant now() {
        return now;
    }

    /**
     * Builder for {@link FormulaContext}.
     */
    public static final class Builder {
        private Map<String, Object> fields = Collections.emptyMap();
        private List<MentionEntity> mentions = Collections.emptyList();
        private List<Map<String, Object>> siblings = Collections.emptyList();
        private Map<String, Object> settings = Collections.emptyMap();
        private String currentStrandPath = "";
        private String currentBlockId = "";
        private Instant now;

        private Builder() {
        }

        public Builder fields(Map<String, Object> fields) {
            this.fields = Objects.requireNonNull(fields, "fields");
            return this;
        }

        /**
         * Adds or replaces a single field on top of the fields set so far.
         */
        public Builder field(String name, Object value) {
            Map<String, Object> merged = new LinkedHashMap<>(this.fields);
            merged.put(name, value);
            this.fields = merged;
            return this;
        }

        public Builder mentions(List<MentionEntity> mentions) {
            this.mentions = Objects.requireNonNull(mentions, "mentions");
            return this;
        }

        public Builder siblings(List<Map<String, Object>> siblings) {
            this.siblings = Objects.requireNonNull(siblings, "siblings");
            return this;
        }

        public Builder settings(Map<String, Object> settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
            return this;
        }

        public Builder currentStrandPath(String currentStrandPath) {
            this.currentStrandPath = Objects.requireNonNull(currentStrandPath, "currentStrandPath");
            return this;
        }

        public Builder currentBlockId(String currentBlockId) {
            this.currentBlockId = Objects.requireNonNull(currentBlockId, "currentBlockId");
            return this;
        }

        public Builder now(Instant now) {
            this.now = now;
            return this;
        }

        public FormulaContext build() {
            return new FormulaContext(this);
        }
    }
}
