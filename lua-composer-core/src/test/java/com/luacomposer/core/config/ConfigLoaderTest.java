package com.luacomposer.core.config;

import com.luacomposer.core.error.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(".composerrc");
        Files.writeString(configFile, """
            source_directory: lua
            output_file: build/out.lua
            namespace_file: ns.lua
            entrypoint_file: main.lua
            scope: local
            strict_sanitize: false
            dependencies:
              - name: mist
                type: github_release
                source: mrSkortch/MissionScriptingTools@latest
                file: mist.lua
                license: LICENSE
            """);

        ComposerConfig config = ConfigLoader.load(configFile);

        assertThat(config.sourceDirectory()).isEqualTo("lua");
        assertThat(config.outputFile()).isEqualTo("build/out.lua");
        assertThat(config.scope()).isEqualTo("local");
        assertThat(config.effectiveStrict()).isFalse();
        assertThat(config.headerFile()).isNull();
        assertThat(config.dependencies()).singleElement().satisfies(dependency -> {
            assertThat(dependency.name()).isEqualTo("mist");
            assertThat(dependency.type()).isEqualTo("github_release");
            assertThat(dependency.file()).isEqualTo("mist.lua");
        });
    }

    @Test
    void load_legacyJson_isAccepted() throws IOException {
        Path configFile = tempDir.resolve(".composerrc");
        Files.writeString(configFile, """
            {
              "source_directory": "src",
              "namespace_file": "namespace.lua",
              "entrypoint_file": "main.lua",
              "dcs_strict_sanitize": false,
              "dependencies": [
                {"name": "utils", "type": "local", "source": "deps/utils.lua"}
              ]
            }
            """);

        ComposerConfig config = ConfigLoader.load(configFile);

        assertThat(config.dcsStrictSanitize()).isFalse();
        assertThat(config.effectiveStrict()).isFalse();
        assertThat(config.dependencies()).extracting(DependencyConfig::source).containsExactly("deps/utils.lua");
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve(".composerrc");
        Files.writeString(configFile, """
            namespace_file: ns.lua
            minify: true
            """);

        ComposerConfig config = ConfigLoader.load(configFile);

        assertThat(config.namespaceFile()).isEqualTo("ns.lua");
    }

    @Test
    void load_fileDoesNotExist_returnsEmpty() {
        ComposerConfig config = ConfigLoader.load(tempDir.resolve("nonexistent"));

        assertThat(config).isEqualTo(ComposerConfig.empty());
    }

    @Test
    void load_emptyFile_returnsEmpty() throws IOException {
        Path configFile = Files.writeString(tempDir.resolve(".composerrc"), "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ComposerConfig.empty());
    }

    @Test
    void load_invalidSyntax_throws() throws IOException {
        Path configFile = Files.writeString(tempDir.resolve(".composerrc"), "{ \"scope\": ");

        assertThatThrownBy(() -> ConfigLoader.load(configFile))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Invalid configuration file");
    }

    @Test
    void load_topLevelList_throws() throws IOException {
        Path configFile = Files.writeString(tempDir.resolve(".composerrc"), "- a\n- b\n");

        assertThatThrownBy(() -> ConfigLoader.load(configFile))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("expected a mapping");
    }

    @Test
    void load_wrongValueType_throws() throws IOException {
        Path configFile = Files.writeString(tempDir.resolve(".composerrc"), "dependencies: 5\n");

        assertThatThrownBy(() -> ConfigLoader.load(configFile))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void parseDependencies_jsonList_returnsDeclarations() {
        List<DependencyConfig> dependencies = ConfigLoader.parseDependencies(
            "[{\"name\":\"a\",\"type\":\"url\",\"source\":\"https://x/a.lua\",\"description\":\"A\"}]");

        assertThat(dependencies).containsExactly(
            new DependencyConfig("a", "url", "https://x/a.lua", null, null, "A"));
    }

    @Test
    void parseDependencies_notAList_throws() {
        assertThatThrownBy(() -> ConfigLoader.parseDependencies("{\"name\": \"a\"}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Invalid dependencies JSON");
    }

    @Test
    void overriddenBy_commandLineWinsOverFileOverDefaults() {
        ComposerConfig file = new ComposerConfig("lua", null, null, "ns.lua", "main.lua", null,
            null, false, "local", null, null);
        ComposerConfig commandLine = new ComposerConfig(null, "out.lua", null, null, "entry.lua", null,
            true, null, null, null, null);

        ComposerConfig merged = ComposerConfig.defaults().overriddenBy(file).overriddenBy(commandLine);

        assertThat(merged.sourceDirectory()).isEqualTo("lua");
        assertThat(merged.outputFile()).isEqualTo("out.lua");
        assertThat(merged.namespaceFile()).isEqualTo("ns.lua");
        assertThat(merged.entrypointFile()).isEqualTo("entry.lua");
        assertThat(merged.effectiveStrict()).isTrue();
        assertThat(merged.scope()).isEqualTo("local");
        assertThat(merged.dependencies()).isEmpty();
    }
}
