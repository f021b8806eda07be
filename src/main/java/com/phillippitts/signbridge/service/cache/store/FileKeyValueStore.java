package com.phillippitts.signbridge.service.cache.store;

import com.phillippitts.signbridge.exception.PersistenceException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * File-per-namespace store ({@code <directory>/<namespace>.json}).
 *
 * <p>Writes go to a temporary file in the same directory which is then moved over the
 * target, atomically where the file system supports it. A crash mid-write therefore
 * leaves the previous blob intact.
 */
public final class FileKeyValueStore implements KeyValueStore {

    private static final Logger LOG = LogManager.getLogger(FileKeyValueStore.class);
    private static final Pattern NAMESPACE = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final String SUFFIX = ".json";

    private final Path directory;

    public FileKeyValueStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath();
        try {
            Files.createDirectories(this.directory);
        } catch (IOException e) {
            throw new PersistenceException("*", "Cannot create store directory " + this.directory, e);
        }
        LOG.info("File cache store at {}", this.directory);
    }

    @Override
    public Optional<String> get(String namespace) {
        Path file = fileFor(namespace);
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new PersistenceException(namespace, "Failed to read " + file.getFileName(), e);
        }
    }

    @Override
    public void set(String namespace, String blob) {
        Objects.requireNonNull(blob, "blob");
        Path target = fileFor(namespace);
        Path tmp = null;
        try {
            tmp = Files.createTempFile(directory, namespace + "-", ".tmp");
            Files.writeString(tmp, blob, StandardCharsets.UTF_8);
            move(tmp, target);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException(namespace, "Failed to write " + target.getFileName(), e);
        }
    }

    @Override
    public void remove(String namespace) {
        Path file = fileFor(namespace);
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new PersistenceException(namespace, "Failed to delete " + file.getFileName(), e);
        }
    }

    public Path getDirectory() {
        return directory;
    }

    Path fileFor(String namespace) {
        if (namespace == null || !NAMESPACE.matcher(namespace).matches()) {
            throw new IllegalArgumentException("Invalid namespace: " + namespace);
        }
        return directory.resolve(namespace + SUFFIX);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move not supported, falling back to replace: {}", e.getMessage());
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
        }
    }
}
