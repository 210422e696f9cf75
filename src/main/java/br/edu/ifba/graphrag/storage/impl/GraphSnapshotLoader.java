package br.edu.ifba.graphrag.storage.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a {@link GraphSnapshot} from the classpath or, failing that, from the file system.
 */
public final class GraphSnapshotLoader {

    private static final Logger logger = LoggerFactory.getLogger(GraphSnapshotLoader.class);

    private final ObjectMapper objectMapper;

    public GraphSnapshotLoader(@NotNull ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @NotNull
    public GraphSnapshot load(@NotNull String location) {
        try (InputStream classpath = Thread.currentThread().getContextClassLoader().getResourceAsStream(location)) {
            if (classpath != null) {
                logger.info("Loading graph snapshot from classpath resource {}", location);
                return objectMapper.readValue(classpath, GraphSnapshot.class);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read graph snapshot " + location, e);
        }

        Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            throw new IllegalStateException("Graph snapshot not found: " + location);
        }
        try (InputStream file = Files.newInputStream(path)) {
            logger.info("Loading graph snapshot from file {}", path.toAbsolutePath());
            return objectMapper.readValue(file, GraphSnapshot.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read graph snapshot " + location, e);
        }
    }
}
