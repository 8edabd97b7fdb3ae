package com.dogfold.scaffold.registry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Versioned, named collection of generated class instances, persisted as one YAML document.
 *
 * Not thread-safe. Concurrent {@link #save()} calls on the same document are last-writer-wins.
 */
public class ClassRegistry {

    private static final Logger log = LoggerFactory.getLogger(ClassRegistry.class);

    private final Path storagePath;
    private final Clock clock;

    private String registryVersion;
    private String registryType;
    private Instant createdAt;
    private Instant updatedAt;
    private final Map<String, RegistryItem> items = new LinkedHashMap<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    public ClassRegistry(Path storagePath, String registryVersion, String registryType, Clock clock) {
        this.storagePath = storagePath;
        this.clock = clock;
        this.registryVersion = registryVersion;
        this.registryType = registryType;
        this.createdAt = clock.instant();
        this.updatedAt = createdAt;
    }

    /**
     * Adds an item. An item whose name is already present is not added.
     *
     * @return {@code false} if the name was already present
     */
    public boolean add(RegistryItem item) {
        if (items.containsKey(item.getName())) {
            log.warn("{} already exists in registry {}", item.getName(), storagePath.getFileName());
            return false;
        }
        items.put(item.getName(), item);
        return true;
    }

    public Optional<RegistryItem> get(String name) {
        return Optional.ofNullable(items.get(name));
    }

    public List<String> list() {
        return new ArrayList<>(items.keySet());
    }

    public boolean remove(String name) {
        return items.remove(name) != null;
    }

    /**
     * Writes the whole registry to its document, replacing any previous content.
     */
    public void save() throws IOException {
        updatedAt = clock.instant();
        RegistryDocument document = new RegistryDocument(registryVersion, registryType, createdAt, updatedAt,
                items, metadata);
        Path parent = storagePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        RegistryYaml.mapper().writeValue(storagePath.toFile(), document);
        log.debug("Saved registry {} with {} item(s)", storagePath, items.size());
    }

    /**
     * Replaces the in-memory state with the document's content.
     *
     * @return {@code false} if the document does not exist yet, leaving the registry unchanged
     */
    public boolean load() throws IOException {
        if (!Files.exists(storagePath)) {
            log.debug("Registry {} not created yet", storagePath);
            return false;
        }
        RegistryDocument document = RegistryYaml.mapper().readValue(storagePath.toFile(), RegistryDocument.class);

        items.clear();
        metadata.clear();
        if (document == null) {
            return true;
        }
        if (document.registryVersion() != null) {
            registryVersion = document.registryVersion();
        }
        if (document.registryType() != null) {
            registryType = document.registryType();
        }
        if (document.createdAt() != null) {
            createdAt = document.createdAt();
        }
        updatedAt = document.updatedAt() != null ? document.updatedAt() : createdAt;
        if (document.items() != null) {
            document.items().values().forEach(item -> items.put(item.getName(), item));
        }
        if (document.metadata() != null) {
            metadata.putAll(document.metadata());
        }
        return true;
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public Path getStoragePath() {
        return storagePath;
    }

    public String getRegistryVersion() {
        return registryVersion;
    }

    public String getRegistryType() {
        return registryType;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
