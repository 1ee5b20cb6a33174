package com.bulwark.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fields shared by findings and vulnerabilities. Immutable.
 * Missing values are filled with defaults and a random id is generated when none is given.
 * Extra validator-specific attributes live in {@link #getDetails()} and are
 * written as top-level JSON fields.
 */
public abstract class SecurityIssue {

    private final String id;
    private final String validator;
    private final String type;
    private final String title;
    private final String description;
    private final String location;
    private final Instant timestamp;
    private final Map<String, String> details;

    protected SecurityIssue(AbstractBuilder<?> builder, String idPrefix, String defaultTitle) {
        this.id = isBlank(builder.id) ? Identifiers.withPrefix(idPrefix) : builder.id;
        this.validator = isBlank(builder.validator) ? "manual" : builder.validator;
        this.type = isBlank(builder.type) ? "unknown" : builder.type;
        this.title = isBlank(builder.title) ? defaultTitle : builder.title;
        this.description = builder.description != null ? builder.description : "";
        this.location = isBlank(builder.location) ? "unknown" : builder.location;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.details = builder.details.isEmpty() ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.details));
    }

    public String getId() {
        return id;
    }

    /** Name of the validator that reported this issue. */
    public String getValidator() {
        return validator;
    }

    public String getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getLocation() {
        return location;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @JsonAnyGetter
    public Map<String, String> getDetails() {
        return details;
    }

    @JsonIgnore
    public String getDetail(String key) {
        return details.get(key);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @SuppressWarnings("unchecked")
    public abstract static class AbstractBuilder<B extends AbstractBuilder<B>> {
        private String id;
        private String validator;
        private String type;
        private String title;
        private String description;
        private String location;
        private Instant timestamp;
        private final Map<String, String> details = new LinkedHashMap<>();

        public B id(String id) {
            this.id = id;
            return (B) this;
        }

        public B validator(String validator) {
            this.validator = validator;
            return (B) this;
        }

        public B type(String type) {
            this.type = type;
            return (B) this;
        }

        public B title(String title) {
            this.title = title;
            return (B) this;
        }

        public B description(String description) {
            this.description = description;
            return (B) this;
        }

        public B location(String location) {
            this.location = location;
            return (B) this;
        }

        public B timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return (B) this;
        }

        public B detail(String key, String value) {
            this.details.put(key, value);
            return (B) this;
        }
    }
}
