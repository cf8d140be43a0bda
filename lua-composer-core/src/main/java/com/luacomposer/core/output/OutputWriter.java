package com.luacomposer.core.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the composed script to the filesystem.
 *
 * <p>Parent directories are created as needed and an existing file is
 * overwritten. Content is written as UTF-8.
 */
public class OutputWriter {

    private static final Logger logger = LoggerFactory.getLogger(OutputWriter.class);

    /**
     * Writes {@code content} to {@code target}.
     *
     * @param target output file
     * @param content composed script
     * @return absolute path of the written file
     * @throws IllegalStateException if the file or its directories cannot be written
     */
    public Path write(Path target, String content) {
        Path file = target.toAbsolutePath().normalize();
        logger.debug("Writing output file: {}", file);

        try {
            Path parentDir = file.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
            logger.info("Wrote output file: {} ({} chars)", file, content.length());
            return file;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write output file: " + file, e);
        }
    }
}
