package com.replication.binlogsync.commons.checkpoint;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * Stores every path as a file below a base directory. Writes go to a temporary
 * file first and are moved into place so a crash never leaves a torn value.
 */
public class FilePositionStorage implements PositionStorage {
    private static final Logger LOG = LogManager.getLogger(FilePositionStorage.class);

    public interface Configuration {
        String DIRECTORY = "position.storage.file.directory";
    }

    private final Path directory;

    public FilePositionStorage(Map<String, Object> configuration) {
        this(Paths.get(configuration.getOrDefault(Configuration.DIRECTORY, "/tmp/binlogsync").toString()));
    }

    public FilePositionStorage(Path directory) {
        this.directory = directory;
    }

    public Path getDirectory() {
        return this.directory;
    }

    @Override
    public void set(String path, byte[] value) throws IOException {
        Path target = this.resolve(path);
        Files.createDirectories(target.getParent());

        Path temporary = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(temporary, value);

        try {
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException exception) {
            FilePositionStorage.LOG.debug("atomic move not supported for {}, falling back to replace", target);
            Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public byte[] get(String path) throws IOException {
        try {
            byte[] bytes = Files.readAllBytes(this.resolve(path));
            return (bytes.length > 0) ? (bytes) : (null);
        } catch (NoSuchFileException exception) {
            return null;
        }
    }

    private Path resolve(String path) {
        Path resolved = this.directory.resolve(path).normalize();

        if (!resolved.startsWith(this.directory.normalize())) {
            throw new IllegalArgumentException(String.format("storage path escapes the base directory: %s", path));
        }

        return resolved;
    }
}
