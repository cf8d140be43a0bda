package com.luacomposer.core.dependency;

import com.luacomposer.core.error.DependencyFetchException;
import com.luacomposer.core.model.BuildWarning;
import com.luacomposer.core.model.SourceKind;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Downloads dependencies from plain URLs through the {@link DownloadCache}.
 */
public class UrlDependencyFetcher implements DependencyFetcher {

    private final DownloadCache cache;

    public UrlDependencyFetcher(DownloadCache cache) {
        this.cache = cache;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.URL;
    }

    @Override
    public FetchResult fetch(DependencyDeclaration dependency) {
        String content;
        try {
            content = cache.fetch(dependency.source(), dependency.name() + "_main");
        } catch (IOException e) {
            throw new DependencyFetchException(dependency.name(), e.getMessage(), e);
        }

        List<BuildWarning> warnings = new ArrayList<>();
        String license = null;
        if (dependency.hasLicense()) {
            try {
                license = cache.fetch(dependency.license(), dependency.name() + "_license");
            } catch (IOException e) {
                warnings.add(LocalDependencyFetcher.unavailable(dependency,
                    "failed to fetch license: " + e.getMessage()));
            }
        }
        return new FetchResult(content, license, warnings);
    }
}
