package com.luacomposer.core.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link OutputWriter}.
 */
class OutputWriterTest {

    @TempDir
    Path tempDir;

    private final OutputWriter writer = new OutputWriter();

    @Test
    void write_missingParentDirectories_areCreated() throws IOException {
        Path written = writer.write(tempDir.resolve("dist/nested/out.lua"), "local ä = 1\n");

        assertThat(written).isAbsolute().exists();
        assertThat(Files.readString(written)).isEqualTo("local ä = 1\n");
    }

    @Test
    void write_existingFile_isOverwritten() throws IOException {
        Path target = Files.writeString(tempDir.resolve("out.lua"), "old content that is longer");

        writer.write(target, "new");

        assertThat(Files.readString(target)).isEqualTo("new");
    }

    @Test
    void write_parentIsAFile_throws() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("dist"), "x");

        assertThatThrownBy(() -> writer.write(blocker.resolve("out.lua"), "x"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to write output file");
    }
}
