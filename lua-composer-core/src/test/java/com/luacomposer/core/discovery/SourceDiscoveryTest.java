package com.luacomposer.core.discovery;

import com.luacomposer.core.error.ConfigurationException;
import com.luacomposer.core.model.ModuleRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SourceDiscovery}.
 */
class SourceDiscoveryTest {

    @TempDir
    Path tempDir;

    private Path src;
    private final SourceDiscovery discovery = new SourceDiscovery();

    private void write(String relative, String content) throws IOException {
        Path file = src.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @BeforeEach
    void setUp() throws IOException {
        src = Files.createDirectories(tempDir.resolve("src"));
        write("namespace.lua", "NS = {}");
        write("main.lua", "main()");
    }

    @Test
    void discover_projectWithRoles_separatesCoreModules() throws IOException {
        write("header.txt", "-- header");
        write("footer.lua", "-- footer");
        write("util/strings.lua", "");
        write("app.lua", "");
        write("notes.md", "ignored");

        ProjectLayout layout = discovery.discover(src, "header.txt", "namespace.lua", "main.lua", "footer.lua");

        assertThat(layout.header().role()).isEqualTo(ModuleRole.HEADER);
        assertThat(layout.footer().identity()).isEqualTo("footer");
        assertThat(layout.coreFiles()).extracting(SourceFile::relativePath)
            .containsExactly("app.lua", "util/strings.lua");
        SourceFile strings = layout.coreFiles().get(1);
        assertThat(strings.identity()).isEqualTo("util.strings");
        assertThat(strings.directoryKey()).isEqualTo("util");
        assertThat(layout.coreFiles().get(0).directoryKey()).isEmpty();
    }

    @Test
    void discover_withoutOptionalRoles_leavesThemNull() {
        ProjectLayout layout = discovery.discover(src, null, "namespace.lua", "main.lua", null);

        assertThat(layout.header()).isNull();
        assertThat(layout.footer()).isNull();
        assertThat(layout.coreFiles()).isEmpty();
        assertThat(layout.allFiles()).hasSize(2);
    }

    @Test
    void discover_missingEntrypoint_throws() {
        assertThatThrownBy(() -> discovery.discover(src, null, "namespace.lua", "missing.lua", null))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("entrypoint file was not found");
    }

    @Test
    void discover_roleFileOutsideSource_throws() throws IOException {
        Files.writeString(tempDir.resolve("outside.lua"), "");

        assertThatThrownBy(() -> discovery.discover(src, "../outside.lua", "namespace.lua", "main.lua", null))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("outside the source directory");
    }

    @Test
    void discover_duplicateIdentity_throws() throws IOException {
        write("a/b.lua", "");
        write("a.b.lua", "");

        assertThatThrownBy(() -> discovery.discover(src, null, "namespace.lua", "main.lua", null))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Duplicate module identity 'a.b'");
    }

    @Test
    void discover_sameFileForTwoRoles_throws() {
        assertThatThrownBy(() -> discovery.discover(src, null, "main.lua", "main.lua", null))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("more than one role");
    }

    @Test
    void discover_missingSourceDirectory_throws() {
        assertThatThrownBy(() -> discovery.discover(tempDir.resolve("nope"), null, "namespace.lua", "main.lua", null))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Source directory not found");
    }
}
