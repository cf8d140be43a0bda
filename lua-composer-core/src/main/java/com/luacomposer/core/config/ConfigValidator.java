package com.luacomposer.core.config;

import com.luacomposer.core.dependency.DependencyDeclaration;
import com.luacomposer.core.dependency.DownloadCache;
import com.luacomposer.core.dependency.GitHubReleaseFetcher;
import com.luacomposer.core.error.ConfigurationException;
import com.luacomposer.core.model.ScopeMode;
import com.luacomposer.core.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a merged configuration and resolves it into {@link BuildSettings}.
 *
 * <p>All problems are collected and reported together in one
 * {@link ConfigurationException}.
 */
public class ConfigValidator {

    private static final Logger log = LoggerFactory.getLogger(ConfigValidator.class);

    private static final String KINDS = Arrays.stream(SourceKind.values())
        .map(SourceKind::id)
        .collect(Collectors.joining(", "));

    /**
     * Validates and resolves a configuration.
     *
     * @param config merged configuration
     * @param baseDirectory directory relative paths are resolved against
     * @return resolved settings
     * @throws ConfigurationException listing every problem found
     */
    public BuildSettings validate(ComposerConfig config, Path baseDirectory) {
        List<String> problems = new ArrayList<>();

        if (isBlank(config.sourceDirectory())) {
            problems.add("source_directory is required");
        }
        if (isBlank(config.outputFile())) {
            problems.add("output_file is required");
        }
        if (isBlank(config.namespaceFile())) {
            problems.add("namespace_file is required");
        }
        if (isBlank(config.entrypointFile())) {
            problems.add("entrypoint_file is required");
        }
        if (config.strictSanitize() != null && config.dcsStrictSanitize() != null
            && !config.strictSanitize().equals(config.dcsStrictSanitize())) {
            problems.add("strict_sanitize and dcs_strict_sanitize disagree");
        }

        Optional<ScopeMode> scope = config.scope() == null
            ? Optional.of(ScopeMode.GLOBAL)
            : ScopeMode.fromId(config.scope());
        if (scope.isEmpty()) {
            problems.add("scope must be 'global' or 'local', got '" + config.scope() + "'");
        }

        List<DependencyDeclaration> dependencies = validateDependencies(
            config.dependencies() != null ? config.dependencies() : List.of(), problems);

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }

        Path base = baseDirectory.toAbsolutePath().normalize();
        Path cacheDirectory = isBlank(config.cacheDirectory())
            ? DownloadCache.defaultDirectory()
            : base.resolve(config.cacheDirectory()).normalize();
        Boolean strict = config.effectiveStrict();

        BuildSettings settings = new BuildSettings(
            base.resolve(config.sourceDirectory()).normalize(),
            base.resolve(config.outputFile()).normalize(),
            blankToNull(config.headerFile()),
            config.namespaceFile(),
            config.entrypointFile(),
            blankToNull(config.footerFile()),
            strict == null || strict,
            scope.get(),
            dependencies,
            cacheDirectory
        );
        log.debug("Resolved build settings: {}", settings);
        return settings;
    }

    private static List<DependencyDeclaration> validateDependencies(List<DependencyConfig> configs,
                                                                    List<String> problems) {
        List<DependencyDeclaration> declarations = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < configs.size(); i++) {
            DependencyConfig dependency = configs.get(i);
            String label = "dependencies[" + i + "]";
            if (dependency == null) {
                problems.add(label + " must be an object");
                continue;
            }
            int before = problems.size();

            if (isBlank(dependency.name())) {
                problems.add(label + ": 'name' is required");
            } else {
                label = label + " '" + dependency.name() + "'";
                if (!names.add(dependency.name())) {
                    problems.add(label + ": duplicate dependency name");
                }
            }

            Optional<SourceKind> kind = isBlank(dependency.type())
                ? Optional.empty()
                : SourceKind.fromId(dependency.type());
            if (isBlank(dependency.type())) {
                problems.add(label + ": 'type' is required (" + KINDS + ")");
            } else if (kind.isEmpty()) {
                problems.add(label + ": unknown type '" + dependency.type() + "', expected one of " + KINDS);
            }

            if (isBlank(dependency.source())) {
                problems.add(label + ": 'source' is required");
            } else if (kind.isPresent() && kind.get() == SourceKind.GITHUB_RELEASE
                && !GitHubReleaseFetcher.isValidSource(dependency.source())) {
                problems.add(label + ": source must look like owner/repo@tag, got '" + dependency.source() + "'");
            }
            if (kind.isPresent() && kind.get() == SourceKind.GITHUB_RELEASE && isBlank(dependency.file())) {
                problems.add(label + ": 'file' is required for github_release dependencies");
            }

            if (problems.size() == before) {
                declarations.add(new DependencyDeclaration(dependency.name(), kind.get(), dependency.source(),
                    blankToNull(dependency.file()), blankToNull(dependency.license()),
                    blankToNull(dependency.description())));
            }
        }
        return declarations;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }
}
