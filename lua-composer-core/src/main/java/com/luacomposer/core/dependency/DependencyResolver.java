package com.luacomposer.core.dependency;

import com.luacomposer.core.error.ComposerException;
import com.luacomposer.core.error.DependencyFetchException;
import com.luacomposer.core.model.BuildWarning;
import com.luacomposer.core.model.ExternalDependency;
import com.luacomposer.core.model.SourceKind;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Fetches all declared dependencies concurrently and returns them in declaration order.
 *
 * <p>The first failure in declaration order wins: pending fetches are cancelled
 * and the failure is rethrown. A {@link ComposerException} is rethrown as is; any
 * other exception is wrapped in a {@link DependencyFetchException}.
 */
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    public static final int DEFAULT_PARALLELISM = 4;

    private final Map<SourceKind, DependencyFetcher> fetchers = new EnumMap<>(SourceKind.class);
    private final int parallelism;

    public DependencyResolver(Collection<DependencyFetcher> fetchers, int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
        }
        for (DependencyFetcher fetcher : fetchers) {
            this.fetchers.put(fetcher.kind(), fetcher);
        }
        this.parallelism = parallelism;
    }

    /**
     * Creates a resolver with the local, URL and GitHub release fetchers.
     *
     * @param baseDirectory directory local sources are resolved against
     * @param cacheDirectory download cache directory
     * @return new resolver
     */
    public static DependencyResolver createDefault(Path baseDirectory, Path cacheDirectory) {
        OkHttpClient client = DownloadCache.defaultClient();
        DownloadCache cache = new DownloadCache(cacheDirectory, client);
        return new DependencyResolver(List.of(
            new LocalDependencyFetcher(baseDirectory),
            new UrlDependencyFetcher(cache),
            new GitHubReleaseFetcher(cache, client)
        ), DEFAULT_PARALLELISM);
    }

    /**
     * Fetches every declaration.
     *
     * @param declarations validated declarations
     * @return fetched dependencies, in the order declared
     * @throws DependencyFetchException if a dependency cannot be fetched
     */
    public ResolvedDependencies resolve(List<DependencyDeclaration> declarations) {
        if (declarations.isEmpty()) {
            return ResolvedDependencies.empty();
        }
        log.info("Fetching {} external dependencies", declarations.size());

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, declarations.size()));
        try {
            List<Future<FetchResult>> futures = new ArrayList<>();
            for (DependencyDeclaration declaration : declarations) {
                DependencyFetcher fetcher = fetcherFor(declaration);
                futures.add(executor.submit(() -> fetcher.fetch(declaration)));
            }

            List<ExternalDependency> dependencies = new ArrayList<>();
            List<BuildWarning> warnings = new ArrayList<>();
            for (int i = 0; i < declarations.size(); i++) {
                DependencyDeclaration declaration = declarations.get(i);
                FetchResult result = await(declaration, futures.get(i), futures);
                dependencies.add(new ExternalDependency(declaration.name(), declaration.kind(), declaration.source(),
                    declaration.file(), result.content(), result.license(), declaration.description()));
                warnings.addAll(result.warnings());
                log.debug("Fetched dependency {} ({} chars)", declaration.name(), result.content().length());
            }
            return new ResolvedDependencies(dependencies, warnings);
        } finally {
            executor.shutdownNow();
        }
    }

    private DependencyFetcher fetcherFor(DependencyDeclaration declaration) {
        DependencyFetcher fetcher = fetchers.get(declaration.kind());
        if (fetcher == null) {
            throw new DependencyFetchException(declaration.name(),
                "no fetcher registered for type '" + declaration.kind().id() + "'");
        }
        return fetcher;
    }

    private static FetchResult await(DependencyDeclaration declaration, Future<FetchResult> future,
                                     List<Future<FetchResult>> all) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            all.forEach(f -> f.cancel(true));
            throw new DependencyFetchException(declaration.name(), "interrupted", e);
        } catch (ExecutionException e) {
            all.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof ComposerException composerException) {
                throw composerException;
            }
            throw new DependencyFetchException(declaration.name(), String.valueOf(cause.getMessage()), cause);
        }
    }
}
