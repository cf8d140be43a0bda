package com.luacomposer.core.dependency;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.luacomposer.core.error.DependencyFetchException;
import com.luacomposer.core.model.BuildWarning;
import com.luacomposer.core.model.SourceKind;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Downloads release assets from GitHub.
 *
 * <p>The source is written {@code owner/repo@tag}. The tag {@code latest} is
 * resolved to a concrete tag through the releases API before downloading, so
 * the cache key always names the real tag. Assets, including the license, are
 * fetched from {@code <download base>/<owner>/<repo>/releases/download/<tag>/<asset>}.
 */
public class GitHubReleaseFetcher implements DependencyFetcher {

    private static final Logger log = LoggerFactory.getLogger(GitHubReleaseFetcher.class);

    public static final String DEFAULT_API_BASE_URL = "https://api.github.com";
    public static final String DEFAULT_DOWNLOAD_BASE_URL = "https://github.com";
    static final Pattern SOURCE_PATTERN = Pattern.compile("^([^/]+)/([^@]+)@(.+)$");
    private static final String LATEST = "latest";

    private final DownloadCache cache;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String apiBaseUrl;
    private final String downloadBaseUrl;

    public GitHubReleaseFetcher(DownloadCache cache, OkHttpClient client) {
        this(cache, client, DEFAULT_API_BASE_URL, DEFAULT_DOWNLOAD_BASE_URL);
    }

    public GitHubReleaseFetcher(DownloadCache cache, OkHttpClient client, String apiBaseUrl, String downloadBaseUrl) {
        this.cache = cache;
        this.client = client;
        this.mapper = new ObjectMapper();
        this.apiBaseUrl = stripTrailingSlash(apiBaseUrl);
        this.downloadBaseUrl = stripTrailingSlash(downloadBaseUrl);
    }

    /**
     * Checks the {@code owner/repo@tag} format.
     *
     * @param source declared source
     * @return true if the source can be parsed
     */
    public static boolean isValidSource(String source) {
        return source != null && SOURCE_PATTERN.matcher(source).matches();
    }

    @Override
    public SourceKind kind() {
        return SourceKind.GITHUB_RELEASE;
    }

    @Override
    public FetchResult fetch(DependencyDeclaration dependency) {
        Matcher matcher = SOURCE_PATTERN.matcher(dependency.source());
        if (!matcher.matches()) {
            throw new DependencyFetchException(dependency.name(),
                "invalid GitHub release source '" + dependency.source() + "', expected owner/repo@tag");
        }
        String owner = matcher.group(1);
        String repo = matcher.group(2);
        String tag = matcher.group(3);
        if (LATEST.equals(tag)) {
            tag = resolveLatestTag(dependency, owner, repo);
        }

        String content;
        try {
            content = cache.fetch(assetUrl(owner, repo, tag, dependency.file()),
                dependency.name() + "_" + tag + "_" + dependency.file());
        } catch (IOException e) {
            throw new DependencyFetchException(dependency.name(), e.getMessage(), e);
        }

        List<BuildWarning> warnings = new ArrayList<>();
        String license = null;
        if (dependency.hasLicense()) {
            try {
                license = cache.fetch(assetUrl(owner, repo, tag, dependency.license()),
                    dependency.name() + "_" + tag + "_" + dependency.license());
            } catch (IOException e) {
                warnings.add(LocalDependencyFetcher.unavailable(dependency,
                    "failed to fetch license: " + e.getMessage()));
            }
        }
        return new FetchResult(content, license, warnings);
    }

    private String resolveLatestTag(DependencyDeclaration dependency, String owner, String repo) {
        String url = apiBaseUrl + "/repos/" + owner + "/" + repo + "/releases/latest";
        Request request = new Request.Builder()
            .url(url)
            .header("Accept", "application/vnd.github+json")
            .get()
            .build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new DependencyFetchException(dependency.name(),
                    "failed to fetch latest release for " + owner + "/" + repo + ": HTTP " + response.code());
            }
            ResponseBody body = response.body();
            JsonNode release = mapper.readTree(body != null ? body.string() : "{}");
            JsonNode tagName = release.get("tag_name");
            if (tagName == null || !tagName.isTextual()) {
                throw new DependencyFetchException(dependency.name(),
                    "latest release of " + owner + "/" + repo + " has no tag_name");
            }
            log.info("Resolved {}/{}@latest to {}", owner, repo, tagName.asText());
            return tagName.asText();
        } catch (IOException e) {
            throw new DependencyFetchException(dependency.name(),
                "failed to fetch latest release for " + owner + "/" + repo + ": " + e.getMessage(), e);
        }
    }

    private String assetUrl(String owner, String repo, String tag, String asset) {
        return downloadBaseUrl + "/" + owner + "/" + repo + "/releases/download/" + tag + "/" + asset;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
