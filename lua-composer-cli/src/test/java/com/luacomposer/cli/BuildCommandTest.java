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
 * Tests for {@link BuildCommand}.
 */
class BuildCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void build_validProject_writesOutput() throws IOException {
        Path src = writeProject(tempDir);
        Path output = tempDir.resolve("dist/out.lua");

        CommandTestSupport.Run result = run("-q", "build", src.toString(), output.toString(),
            "--namespace", "namespace.lua", "--entrypoint", "main.lua",
            "--config", tempDir.resolve("missing.composerrc").toString());

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("✓ Module order: util.log, core").contains("✓ Build complete");
        String text = Files.readString(output);
        assertThat(text).contains("-- Core Module Content from: util/log.lua");
        assertThat(text).contains("MyMod.log = function(m) env.info(m) end");
        assertThat(text).doesNotContain("require(");
    }

    @Test
    void build_settingsFromConfigFile_areUsed() throws IOException {
        Path src = writeProject(tempDir);
        Path output = tempDir.resolve("configured.lua");
        Path config = Files.writeString(tempDir.resolve(".composerrc"), String.format("""
            source_directory: %s
            output_file: %s
            namespace_file: namespace.lua
            entrypoint_file: main.lua
            scope: local
            """, src.toString().replace('\\', '/'), output.toString().replace('\\', '/')));

        CommandTestSupport.Run result = run("-q", "build", "--config", config.toString());

        assertThat(result.exitCode()).isZero();
        assertThat(Files.readString(output)).contains("-- Beginning of local scope\ndo\n");
    }

    @Test
    void build_strictViolation_failsWithoutWriting() throws IOException {
        Path src = writeProject(tempDir);
        Files.writeString(src.resolve("core.lua"), "MyMod.core = { t = os.time() }\n");
        Path output = tempDir.resolve("out.lua");

        CommandTestSupport.Run result = run("-q", "build", src.toString(), output.toString(),
            "--namespace", "namespace.lua", "--entrypoint", "main.lua",
            "--config", tempDir.resolve("missing.composerrc").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("✗ Build failed").contains("os.time");
        assertThat(output).doesNotExist();
    }

    @Test
    void build_strictDisabled_keepsHostApiUsage() throws IOException {
        Path src = writeProject(tempDir);
        Files.writeString(src.resolve("core.lua"), "MyMod.core = { t = os.time() }\n");
        Path output = tempDir.resolve("out.lua");

        CommandTestSupport.Run result = run("-q", "build", src.toString(), output.toString(),
            "--namespace", "namespace.lua", "--entrypoint", "main.lua", "--dcs-strict-sanitize", "false",
            "--config", tempDir.resolve("missing.composerrc").toString());

        assertThat(result.exitCode()).isZero();
        assertThat(Files.readString(output)).contains("os.time()");
    }

    @Test
    void build_missingEntrypointSetting_reportsConfigurationProblem() throws IOException {
        Path src = writeProject(tempDir);

        CommandTestSupport.Run result = run("-q", "build", src.toString(), tempDir.resolve("out.lua").toString(),
            "--namespace", "namespace.lua",
            "--config", tempDir.resolve("missing.composerrc").toString());

        assertThat(result.exitCode()).isEqualTo(1);
        assertThat(result.err()).contains("entrypoint_file is required");
    }
}
