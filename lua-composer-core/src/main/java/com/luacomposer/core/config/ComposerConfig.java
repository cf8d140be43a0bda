package com.luacomposer.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Set;

/**
 * Build settings from {@code .composerrc}, the command line or built-in defaults.
 *
 * <p>Every field is nullable; {@code null} means "not set at this level" so
 * that levels can be layered with {@link #overriddenBy(ComposerConfig)}.
 *
 * <p><b>Example YAML (JSON works too):</b>
 * <pre>{@code
 * source_directory: src
 * output_file: dist/mission_script.lua
 * namespace_file: namespace.lua
 * entrypoint_file: main.lua
 * scope: local
 * dependencies:
 *   - name: mist
 *     type: github_release
 *     source: mrSkortch/MissionScriptingTools@latest
 *     file: mist.lua
 * }</pre>
 *
 * @param sourceDirectory source root
 * @param outputFile output script path
 * @param headerFile optional header, relative to the source root
 * @param namespaceFile namespace file, relative to the source root
 * @param entrypointFile entrypoint file, relative to the source root
 * @param footerFile optional footer, relative to the source root
 * @param strictSanitize strict DCS sanitization
 * @param dcsStrictSanitize alias of {@code strictSanitize}
 * @param scope {@code global} or {@code local}
 * @param dependencies external dependencies in injection order
 * @param cacheDirectory download cache directory
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComposerConfig(
    @JsonProperty("source_directory") String sourceDirectory,
    @JsonProperty("output_file") String outputFile,
    @JsonProperty("header_file") String headerFile,
    @JsonProperty("namespace_file") String namespaceFile,
    @JsonProperty("entrypoint_file") String entrypointFile,
    @JsonProperty("footer_file") String footerFile,
    @JsonProperty("strict_sanitize") Boolean strictSanitize,
    @JsonProperty("dcs_strict_sanitize") Boolean dcsStrictSanitize,
    @JsonProperty("scope") String scope,
    @JsonProperty("dependencies") List<DependencyConfig> dependencies,
    @JsonProperty("cache_directory") String cacheDirectory
) {
    public static final String DEFAULT_SOURCE_DIRECTORY = "src";
    public static final String DEFAULT_OUTPUT_FILE = "dist/mission_script.lua";

    static final Set<String> KNOWN_KEYS = Set.of(
        "source_directory", "output_file", "header_file", "namespace_file", "entrypoint_file", "footer_file",
        "strict_sanitize", "dcs_strict_sanitize", "scope", "dependencies", "cache_directory");

    public ComposerConfig {
        dependencies = dependencies != null ? List.copyOf(dependencies) : null;
    }

    /**
     * Built-in defaults: {@code src}, {@code dist/mission_script.lua}, strict on, global scope.
     *
     * @return default configuration
     */
    public static ComposerConfig defaults() {
        return new ComposerConfig(DEFAULT_SOURCE_DIRECTORY, DEFAULT_OUTPUT_FILE, null, null, null, null,
            true, null, "global", List.of(), null);
    }

    /**
     * @return configuration with nothing set
     */
    public static ComposerConfig empty() {
        return new ComposerConfig(null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Strict flag of this level; {@code strict_sanitize} wins over its alias.
     *
     * @return strict flag, or {@code null} if unset
     */
    public Boolean effectiveStrict() {
        return strictSanitize != null ? strictSanitize : dcsStrictSanitize;
    }

    /**
     * Layers {@code overrides} on top of this configuration; every value set in
     * {@code overrides} wins.
     *
     * @param overrides higher-precedence level
     * @return merged configuration
     */
    public ComposerConfig overriddenBy(ComposerConfig overrides) {
        return new ComposerConfig(
            pick(overrides.sourceDirectory, sourceDirectory),
            pick(overrides.outputFile, outputFile),
            pick(overrides.headerFile, headerFile),
            pick(overrides.namespaceFile, namespaceFile),
            pick(overrides.entrypointFile, entrypointFile),
            pick(overrides.footerFile, footerFile),
            pick(overrides.effectiveStrict(), effectiveStrict()),
            null,
            pick(overrides.scope, scope),
            pick(overrides.dependencies, dependencies),
            pick(overrides.cacheDirectory, cacheDirectory)
        );
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
