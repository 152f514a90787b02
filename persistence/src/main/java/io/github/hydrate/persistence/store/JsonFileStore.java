package io.github.hydrate.persistence.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.hydrate.persistence.document.DatabaseDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Whole-file JSON persistence. Writes go to a sibling {@code .tmp} file which is then
 * renamed over the target, so readers never see a half-written database.
 */
public class JsonFileStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileStore.class);

    private final Path path;
    private final Path tmpPath;
    private final ObjectMapper mapper;

    public JsonFileStore(Path path) {
        this.path = path;
        this.tmpPath = path.resolveSibling(path.getFileName() + ".tmp");
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Path getPath() {
        return path;
    }

    /**
     * Reads the database. A missing, unreadable or corrupt file yields an empty database;
     * anything already on disk is left as is until the next write replaces it.
     */
    public DatabaseDocument read() {
        try {
            DatabaseDocument db = mapper.readValue(Files.readAllBytes(path), DatabaseDocument.class);
            return db != null ? db : new DatabaseDocument();
        } catch (NoSuchFileException e) {
            log.info("No database at {}, starting empty", path);
            return new DatabaseDocument();
        } catch (IOException e) {
            log.warn("Could not read database at {}, starting empty: {}", path, e.getMessage());
            return new DatabaseDocument();
        }
    }

    public void write(DatabaseDocument db) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(tmpPath, mapper.writeValueAsBytes(db));
            try {
                Files.move(tmpPath, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmpPath, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to write database to " + path, e);
        }
    }
}
