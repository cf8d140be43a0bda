package com.luacomposer.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An external dependency as written in configuration, before validation.
 *
 * @param name unique name
 * @param type {@code github_release}, {@code url} or {@code local}
 * @param source path, URL or {@code owner/repo@tag}
 * @param file release asset name, required for {@code github_release}
 * @param license optional license path, URL or asset name
 * @param description optional description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DependencyConfig(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type,
    @JsonProperty("source") String source,
    @JsonProperty("file") String file,
    @JsonProperty("license") String license,
    @JsonProperty("description") String description
) {}
