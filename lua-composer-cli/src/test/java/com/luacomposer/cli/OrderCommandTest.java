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
 * Tests for {@link OrderCommand}.
 */
class OrderCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void order_printsModulesWithRequires() throws IOException {
        Path src = writeProject(tempDir);

        CommandTestSupport.Run result = run("-q", "order", src.toString(),
            "--namespace", "namespace.lua", "--entrypoint", "main.lua",
            "--config", tempDir.resolve("missing.composerrc").toString());

        assertThat(result.exitCode()).isZero();
        String out = result.out();
        assertThat(out).contains("  1. util.log").contains("  2. core").contains("requires: util.log");
        assertThat(out.indexOf("util.log")).isLessThan(out.indexOf("2. core"));
    }

    @Test
    void order_noCoreModules_saysSo() throws IOException {
        Path src = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(src.resolve("namespace.lua"), "MyMod = {}\n");
        Files.writeString(src.resolve("main.lua"), "MyMod.ready = true\n");

        CommandTestSupport.Run result = run("-q", "order", src.toString(),
            "--namespace", "namespace.lua", "--entrypoint", "main.lua",
            "--config", tempDir.resolve("missing.composerrc").toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("No core modules");
    }

    @Test
    void order_cycle_fails() throws IOException {
        Path src = writeProject(tempDir);
        Files.writeString(src.resolve("util/log.lua"), "require('core')\n");

        CommandTestSupport.Run result = run("-q", "order", src.toString(),
            "--namespace", "namespace.lua", "--entrypoint", "main.lua",
            "--config", tempDir.resolve("missing.composerrc").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("✗ Order failed").contains("Circular dependency");
    }
}
