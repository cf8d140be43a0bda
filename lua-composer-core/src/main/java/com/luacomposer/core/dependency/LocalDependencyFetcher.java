package com.luacomposer.core.dependency;

import com.luacomposer.core.error.DependencyFetchException;
import com.luacomposer.core.model.BuildWarning;
import com.luacomposer.core.model.SourceKind;
import com.luacomposer.core.model.WarningCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads dependencies from files relative to the project base directory.
 *
 * <p>Both the script and its license must resolve inside the base directory.
 * An escaping or missing script is fatal; an escaping or missing license is a
 * {@link WarningCode#LICENSE_UNAVAILABLE} warning.
 */
public class LocalDependencyFetcher implements DependencyFetcher {

    private static final Logger log = LoggerFactory.getLogger(LocalDependencyFetcher.class);

    private final Path baseDirectory;

    public LocalDependencyFetcher(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    @Override
    public SourceKind kind() {
        return SourceKind.LOCAL;
    }

    @Override
    public FetchResult fetch(DependencyDeclaration dependency) {
        Path file = baseDirectory.resolve(dependency.source()).normalize();
        if (!file.startsWith(baseDirectory)) {
            throw new DependencyFetchException(dependency.name(),
                "path resolves outside the project: " + file);
        }
        if (!Files.isRegularFile(file)) {
            throw new DependencyFetchException(dependency.name(), "file not found: " + file);
        }

        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DependencyFetchException(dependency.name(), "cannot read " + file, e);
        }
        log.debug("Read local dependency {} from {}", dependency.name(), file);

        List<BuildWarning> warnings = new ArrayList<>();
        String license = dependency.hasLicense() ? readLicense(dependency, warnings) : null;
        return new FetchResult(content, license, warnings);
    }

    private String readLicense(DependencyDeclaration dependency, List<BuildWarning> warnings) {
        Path licenseFile = baseDirectory.resolve(dependency.license()).normalize();
        if (!licenseFile.startsWith(baseDirectory)) {
            warnings.add(unavailable(dependency, "license path is outside the project: " + licenseFile));
            return null;
        }
        if (!Files.isRegularFile(licenseFile)) {
            warnings.add(unavailable(dependency, "license file not found: " + licenseFile));
            return null;
        }
        try {
            return Files.readString(licenseFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            warnings.add(unavailable(dependency, "cannot read license " + licenseFile + ": " + e.getMessage()));
            return null;
        }
    }

    static BuildWarning unavailable(DependencyDeclaration dependency, String message) {
        return new BuildWarning(WarningCode.LICENSE_UNAVAILABLE, dependency.name(), 0, message);
    }
}
