package com.luacomposer.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.luacomposer.core.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Loads {@code .composerrc} files.
 *
 * <p>The file is read with Jackson's YAML mapper, which also accepts the JSON
 * format of earlier releases. Unknown keys are logged and ignored.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ComposerConfig config = ComposerConfig.defaults()
 *     .overriddenBy(ConfigLoader.load(Path.of(".composerrc")))
 *     .overriddenBy(commandLine);
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = ".composerrc";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads a configuration file.
     *
     * <p>A missing file is not an error and yields {@link ComposerConfig#empty()}.
     *
     * @param configPath path to the file
     * @return loaded configuration
     * @throws ConfigurationException if the file exists but cannot be read or parsed
     */
    public static ComposerConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.info("No configuration file at {}, using defaults and command line options", configPath);
            return ComposerConfig.empty();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new ConfigurationException("Configuration file is not readable: " + configPath);
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            JsonNode tree = YAML_MAPPER.readTree(configPath.toFile());
            if (tree == null || tree.isMissingNode() || tree.isNull()) {
                log.info("Configuration file {} is empty", configPath);
                return ComposerConfig.empty();
            }
            if (!tree.isObject()) {
                throw new ConfigurationException("Invalid configuration file " + configPath
                    + ": expected a mapping of keys to values");
            }
            warnUnknownKeys(configPath, tree);
            ComposerConfig config = YAML_MAPPER.treeToValue(tree, ComposerConfig.class);
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException("Invalid configuration file " + configPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a JSON list of dependency declarations, as passed on the command line.
     *
     * @param json JSON array
     * @return parsed declarations
     * @throws ConfigurationException if the text is not a list of objects
     */
    public static List<DependencyConfig> parseDependencies(String json) {
        try {
            List<DependencyConfig> dependencies =
                YAML_MAPPER.readValue(json, new TypeReference<List<DependencyConfig>>() {});
            return dependencies != null ? dependencies : List.of();
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid dependencies JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static void warnUnknownKeys(Path configPath, JsonNode tree) {
        List<String> unknown = new ArrayList<>();
        Iterator<String> names = tree.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!ComposerConfig.KNOWN_KEYS.contains(name)) {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            log.warn("Unknown keys in {} will be ignored: {}", configPath, String.join(", ", unknown));
        }
    }
}
