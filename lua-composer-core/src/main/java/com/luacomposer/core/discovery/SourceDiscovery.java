package com.luacomposer.core.discovery;

import com.luacomposer.core.error.ConfigurationException;
import com.luacomposer.core.model.ModuleRole;
import com.luacomposer.core.util.FileUtils;
import com.luacomposer.core.util.ModuleIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the role files and core modules of a project.
 *
 * <p>Role files are given relative to the source directory and must resolve
 * inside it. Every other {@code *.lua} file below the source directory is a
 * core module. Two files mapping to the same identity, such as
 * {@code a/b.lua} and {@code a.b.lua}, are rejected.
 */
public class SourceDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SourceDiscovery.class);
    private static final String LUA_EXTENSION = ".lua";

    /**
     * Discovers a project.
     *
     * @param sourceDirectory source root
     * @param header header path, or {@code null}
     * @param namespace namespace path
     * @param entrypoint entrypoint path
     * @param footer footer path, or {@code null}
     * @return discovered layout
     * @throws ConfigurationException if a role file is missing, outside the source
     *         directory, or an identity is claimed twice
     */
    public ProjectLayout discover(Path sourceDirectory, String header, String namespace,
                                  String entrypoint, String footer) {
        Path root = sourceDirectory.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new ConfigurationException("Source directory not found: " + root);
        }
        if (namespace == null || namespace.isBlank()) {
            throw new ConfigurationException("A namespace file is required");
        }
        if (entrypoint == null || entrypoint.isBlank()) {
            throw new ConfigurationException("An entrypoint file is required");
        }

        SourceFile headerFile = header != null ? roleFile(root, header, ModuleRole.HEADER) : null;
        SourceFile namespaceFile = roleFile(root, namespace, ModuleRole.NAMESPACE);
        SourceFile entrypointFile = roleFile(root, entrypoint, ModuleRole.ENTRYPOINT);
        SourceFile footerFile = footer != null ? roleFile(root, footer, ModuleRole.FOOTER) : null;

        Set<Path> roleFiles = new HashSet<>();
        for (SourceFile file : new SourceFile[] {headerFile, namespaceFile, entrypointFile, footerFile}) {
            if (file != null && !roleFiles.add(file.path())) {
                throw new ConfigurationException("File " + file.relativePath() + " is assigned more than one role");
            }
        }

        List<SourceFile> coreFiles = new ArrayList<>();
        try {
            for (Path path : FileUtils.findFiles(root, LUA_EXTENSION)) {
                Path normalized = path.toAbsolutePath().normalize();
                if (!roleFiles.contains(normalized)) {
                    coreFiles.add(sourceFile(root, normalized, ModuleRole.CORE));
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to scan source directory " + root + ": " + e.getMessage(), e);
        }

        ProjectLayout layout = new ProjectLayout(root, headerFile, namespaceFile, entrypointFile, footerFile, coreFiles);
        checkIdentities(layout);
        log.info("Discovered {} core modules in {}", coreFiles.size(), root);
        return layout;
    }

    private static SourceFile roleFile(Path root, String relative, ModuleRole role) {
        Path path = root.resolve(relative).normalize();
        String label = role.name().toLowerCase();
        if (!FileUtils.isInside(root, path)) {
            throw new ConfigurationException("The " + label + " file '" + relative
                + "' resolves outside the source directory " + root);
        }
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("The " + label + " file was not found: " + path);
        }
        SourceFile file = sourceFile(root, path, role);
        if ((role == ModuleRole.NAMESPACE || role == ModuleRole.ENTRYPOINT) && !file.isLua()) {
            throw new ConfigurationException("The " + label + " file must be a .lua file: " + relative);
        }
        return file;
    }

    private static SourceFile sourceFile(Path root, Path path, ModuleRole role) {
        Path relative = root.relativize(path);
        return new SourceFile(path, ModuleIdentity.toPortable(relative), ModuleIdentity.of(relative),
            ModuleIdentity.directoryKey(relative), role);
    }

    private static void checkIdentities(ProjectLayout layout) {
        Map<String, SourceFile> seen = new HashMap<>();
        for (SourceFile file : layout.allFiles()) {
            if (!file.isLua()) {
                continue;
            }
            SourceFile previous = seen.putIfAbsent(file.identity(), file);
            if (previous != null) {
                throw new ConfigurationException("Duplicate module identity '" + file.identity() + "' for "
                    + previous.relativePath() + " and " + file.relativePath());
            }
        }
    }
}
