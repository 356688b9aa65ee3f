package org.envkit.parser.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Centralizes source loading for the parser: supports local filesystem paths,
 * classpath resources and arbitrary readers. Content is read as UTF-8 and passed
 * on unchanged; the scanner handles {@code \r\n} line endings itself.
 */
public final class EnvSourceLoader {

    /**
     * Result of loading a dotenv source.
     *
     * @param content     The raw document text.
     * @param logicalName The name used in diagnostics.
     */
    public record LoadResult(String content, String logicalName) {}

    private EnvSourceLoader() {}

    /**
     * Loads content from a local filesystem path.
     *
     * @param path The path to the file.
     * @return The loaded content and the normalized path as logical name.
     * @throws IOException If the file cannot be read.
     */
    public static LoadResult loadFile(Path path) throws IOException {
        String logicalName = path.toString().replace('\\', '/');
        return new LoadResult(Files.readString(path, StandardCharsets.UTF_8), logicalName);
    }

    /**
     * Loads content from a classpath resource.
     *
     * @param resourcePath The classpath resource path.
     * @return The loaded content and the resource path as logical name.
     * @throws IOException If the resource is not found or cannot be read.
     */
    public static LoadResult loadClasspath(String resourcePath) throws IOException {
        try (InputStream is = Thread.currentThread().getContextClassLoader().getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new IOException("Resource not found in classpath: " + resourcePath);
            }
            return new LoadResult(new String(is.readAllBytes(), StandardCharsets.UTF_8), resourcePath);
        }
    }

    /**
     * Reads a reader to its end. The reader is not closed.
     *
     * @param reader The reader to drain.
     * @param logicalName The name to use in diagnostics.
     * @return The loaded content.
     * @throws IOException If reading fails.
     */
    public static LoadResult loadReader(Reader reader, String logicalName) throws IOException {
        StringWriter content = new StringWriter();
        reader.transferTo(content);
        return new LoadResult(content.toString(), logicalName);
    }
}
