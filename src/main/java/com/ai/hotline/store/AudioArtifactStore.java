package com.ai.hotline.store;

import com.ai.hotline.config.HotlineProperties;
import com.ai.hotline.exception.ArtifactNotFoundException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Directory-backed cache of synthesized speech, one {@code <id>.wav} file per artifact.
 *
 * <p>Files are written to a temporary name and moved into place, so a reader only
 * ever sees complete artifacts. Ids are random, concurrent writers never share a file
 * and no locking is needed.
 */
@Component
public class AudioArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(AudioArtifactStore.class);

    private static final String EXTENSION = ".wav";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final Pattern ID_PATTERN = Pattern.compile("[0-9a-fA-F-]{36}");

    private final Path directory;

    @Autowired
    public AudioArtifactStore(HotlineProperties properties) {
        this(Paths.get(properties.getAudio().getDir()));
    }

    AudioArtifactStore(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    @PostConstruct
    void init() {
        try {
            Files.createDirectories(directory);
            log.info("Audio cache directory: {}", directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create audio cache directory " + directory, e);
        }
    }

    /**
     * Stores the bytes under a fresh random id.
     *
     * @throws UncheckedIOException when the file cannot be written
     */
    public String put(byte[] bytes) {
        String id = UUID.randomUUID().toString();
        Path target = pathFor(id);
        Path temp = directory.resolve(id + EXTENSION + TEMP_SUFFIX);
        try {
            Files.createDirectories(directory);
            Files.write(temp, bytes);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Failed to store audio artifact " + id, e);
        }
        log.debug("Stored audio artifact {} ({} bytes)", id, bytes.length);
        return id;
    }

    /**
     * Byte-exact read of a stored artifact. Accepts the id with or without its {@code .wav} suffix.
     *
     * @throws ArtifactNotFoundException when no artifact exists for the id
     */
    public AudioArtifact get(String id) {
        String bareId = stripExtension(id);
        if (bareId == null || !ID_PATTERN.matcher(bareId).matches()) {
            throw new ArtifactNotFoundException(id);
        }
        Path path = pathFor(bareId);
        try {
            byte[] bytes = Files.readAllBytes(path);
            Instant createdAt = Files.getLastModifiedTime(path).toInstant();
            return AudioArtifact.builder().id(bareId).bytes(bytes).createdAt(createdAt).build();
        } catch (NoSuchFileException e) {
            throw new ArtifactNotFoundException(id);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audio artifact " + bareId, e);
        }
    }

    /**
     * Deletes artifacts last written more than {@code ttl} ago, along with temporary files
     * an interrupted write left behind.
     *
     * @return number of files removed
     */
    public int evictOlderThan(Duration ttl) {
        Instant cutoff = Instant.now().minus(ttl);
        int removed = 0;
        String glob = "*{" + EXTENSION + "," + TEMP_SUFFIX + "}";
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, glob)) {
            for (Path file : files) {
                try {
                    if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff) && Files.deleteIfExists(file)) {
                        removed++;
                    }
                } catch (IOException e) {
                    log.warn("Could not evict {}: {}", file.getFileName(), e.getMessage());
                }
            }
        } catch (NoSuchFileException e) {
            return 0;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan audio cache " + directory, e);
        }
        return removed;
    }

    public Path getDirectory() {
        return directory;
    }

    private Path pathFor(String id) {
        return directory.resolve(id + EXTENSION);
    }

    private static String stripExtension(String id) {
        if (id == null) return null;
        return id.endsWith(EXTENSION) ? id.substring(0, id.length() - EXTENSION.length()) : id;
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", path, e.getMessage());
        }
    }
}
