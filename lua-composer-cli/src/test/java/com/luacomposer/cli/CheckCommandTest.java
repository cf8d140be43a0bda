package com.luacomposer.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.luacomposer.cli.CommandTestSupport.run;
import static com.luacomposer.cli.CommandTestSupport.writeProject;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CheckCommand}.
 */
class CheckCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void check_validProject_passesWithoutWriting() throws IOException {
        Path src = writeProject(tempDir);

        CommandTestSupport.Run result = run("-q", "check", src.toString(),
            "--namespace", "namespace.lua", "--entrypoint", "main.lua",
            "--config", tempDir.resolve("missing.composerrc").toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("2 core modules").contains("✓ Check passed");
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(src);
        }
    }

    @Test
    void check_requireOfDeclaredDependency_resolvesWithoutFetching() throws IOException {
        Path src = writeProject(tempDir);
        Files.writeString(src.resolve("core.lua"), "require('mist')\nMyMod.core = {}\n");
        String dependencies = "[{\"name\":\"mist\",\"type\":\"url\",\"source\":\"http://127.0.0.1:1/mist.lua\"}]";

        CommandTestSupport.Run result = run("-q", "check", src.toString(),
            "--namespace", "namespace.lua", "--entrypoint", "main.lua", "--dependencies", dependencies,
            "--config", tempDir.resolve("missing.composerrc").toString());

        assertThat(result.exitCode()).isZero();
    }

    @Test
    void check_goto_fails() throws IOException {
        Path src = writeProject(tempDir);
        Files.writeString(src.resolve("util/log.lua"), "::top::\ngoto top\n");

        CommandTestSupport.Run result = run("-q", "check", src.toString(),
            "--namespace", "namespace.lua", "--entrypoint", "main.lua",
            "--config", tempDir.resolve("missing.composerrc").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("✗ Check failed").contains("goto").contains("util/log.lua");
    }

    @Test
    void check_missingSourceDirectory_fails() {
        CommandTestSupport.Run result = run("-q", "check", tempDir.resolve("nope").toString(),
            "--namespace", "namespace.lua", "--entrypoint", "main.lua",
            "--config", tempDir.resolve("missing.composerrc").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("Source directory not found");
    }
}
