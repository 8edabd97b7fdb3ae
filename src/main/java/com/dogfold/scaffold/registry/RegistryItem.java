package com.dogfold.scaffold.registry;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A named entry of a {@link ClassRegistry}.
 *
 * <p>{@code createdAt} never changes. {@code updatedAt} only moves forward: modifications set it
 * to the clock's time unless that would move it backwards. Extra caller-supplied fields live in
 * an ordered attribute map and are written next to the fixed fields.
 */
@JsonPropertyOrder({"name", "version", "createdAt", "updatedAt"})
public class RegistryItem {

    private final String name;
    private String version;
    private final Instant createdAt;
    private Instant updatedAt;
    private final Map<String, Object> attributes = new LinkedHashMap<>();

    @JsonCreator
    public RegistryItem(@JsonProperty("name") String name,
                        @JsonProperty("version") String version,
                        @JsonProperty("createdAt") Instant createdAt,
                        @JsonProperty("updatedAt") Instant updatedAt) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Registry item requires a name");
        }
        this.name = name;
        this.version = version;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = updatedAt != null && updatedAt.isAfter(createdAt) ? updatedAt : createdAt;
    }

    public static RegistryItem create(String name, String version, Clock clock) {
        Instant now = clock.instant();
        return new RegistryItem(name, version, now, now);
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setVersion(String version, Clock clock) {
        this.version = version;
        touch(clock);
    }

    public void setAttribute(String key, Object value, Clock clock) {
        attributes.put(key, value);
        touch(clock);
    }

    @JsonAnyGetter
    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @JsonAnySetter
    void readAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    void touch(Clock clock) {
        Instant now = clock.instant();
        if (now.isAfter(updatedAt)) {
            updatedAt = now;
        }
    }
}
