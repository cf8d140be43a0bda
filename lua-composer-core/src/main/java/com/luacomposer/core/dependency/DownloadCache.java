package com.luacomposer.core.dependency;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;

/**
 * Downloads text over HTTP and keeps a copy on disk.
 *
 * <p>Each body is stored as {@code <key>_<hash>.cached}, where {@code hash} is the
 * first 16 hex digits of the SHA-256 of the URL. A cached file is returned
 * without touching the network. Cache entries never expire; delete the
 * directory to refresh them.
 */
public class DownloadCache {

    private static final Logger log = LoggerFactory.getLogger(DownloadCache.class);

    public static final String DEFAULT_DIRECTORY_NAME = "dcs-lua-composer-cache";
    private static final int URL_HASH_LENGTH = 16;

    private final Path directory;
    private final OkHttpClient client;

    public DownloadCache(Path directory, OkHttpClient client) {
        this.directory = directory;
        this.client = client;
    }

    /**
     * Returns {@code ${java.io.tmpdir}/dcs-lua-composer-cache}.
     *
     * @return default cache directory
     */
    public static Path defaultDirectory() {
        return Path.of(System.getProperty("java.io.tmpdir"), DEFAULT_DIRECTORY_NAME);
    }

    /**
     * Creates an HTTP client with the connect and read timeouts used for downloads.
     *
     * @return new client
     */
    public static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(15))
            .readTimeout(Duration.ofSeconds(60))
            .build();
    }

    public Path directory() {
        return directory;
    }

    /**
     * Returns the body at {@code url}, from the cache when present.
     *
     * @param url URL to download
     * @param cacheKey readable prefix of the cache file name
     * @return response body as UTF-8 text
     * @throws IOException if the download fails or the server answers with an error status
     */
    public String fetch(String url, String cacheKey) throws IOException {
        Path cacheFile = directory.resolve(cacheFileName(cacheKey, url));
        if (Files.isRegularFile(cacheFile)) {
            log.info("Using cached version of {}", url);
            return Files.readString(cacheFile, StandardCharsets.UTF_8);
        }

        log.info("Downloading {}", url);
        String body = download(url);

        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, "download", ".tmp");
        try {
            Files.writeString(temp, body, StandardCharsets.UTF_8);
            Files.move(temp, cacheFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        return body;
    }

    /**
     * Performs a GET without caching.
     *
     * @param url URL to fetch
     * @return response body as text
     * @throws IOException on network failure or a non-2xx status
     */
    String download(String url) throws IOException {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " for " + url);
            }
            ResponseBody body = response.body();
            return body != null ? body.string() : "";
        }
    }

    static String cacheFileName(String cacheKey, String url) {
        String safeKey = cacheKey.replaceAll("[^A-Za-z0-9._-]", "_");
        return safeKey + "_" + sha256(url).substring(0, URL_HASH_LENGTH) + ".cached";
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
