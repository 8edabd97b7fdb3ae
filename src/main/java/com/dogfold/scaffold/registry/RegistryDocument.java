package com.dogfold.scaffold.registry;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * On-disk form of a registry.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * registryVersion: "1.0.0"
 * registryType: invoice
 * createdAt: "2026-10-19T10:15:30Z"
 * updatedAt: "2026-10-19T10:15:30Z"
 * items: {}
 * metadata:
 *   description: Registry for Invoice instances
 *   className: Invoice
 * }</pre>
 *
 * @param registryVersion version of the registry
 * @param registryType lowercase class name the registry holds
 * @param createdAt creation time of the registry
 * @param updatedAt time of the last save
 * @param items entries by name
 * @param metadata free-form metadata
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"registryVersion", "registryType", "createdAt", "updatedAt", "items", "metadata"})
public record RegistryDocument(
    @JsonProperty("registryVersion") String registryVersion,
    @JsonProperty("registryType") String registryType,
    @JsonProperty("createdAt") Instant createdAt,
    @JsonProperty("updatedAt") Instant updatedAt,
    @JsonProperty("items") Map<String, RegistryItem> items,
    @JsonProperty("metadata") Map<String, Object> metadata
) {
}
