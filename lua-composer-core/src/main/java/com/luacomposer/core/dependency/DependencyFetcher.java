package com.luacomposer.core.dependency;

import com.luacomposer.core.model.SourceKind;

/**
 * Fetches dependencies of one {@link SourceKind}.
 *
 * <p>Implementations must be safe to call from several threads at once.
 */
public interface DependencyFetcher {

    /**
     * @return the source kind this fetcher handles
     */
    SourceKind kind();

    /**
     * Fetches a dependency and its license.
     *
     * @param dependency declaration to fetch
     * @return fetched content
     * @throws com.luacomposer.core.error.DependencyFetchException if the script itself cannot be fetched
     */
    FetchResult fetch(DependencyDeclaration dependency);
}
