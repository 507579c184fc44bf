package com.whereq.modelhub.storage;

import com.whereq.modelhub.config.ModelHubProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;

/**
 * Artifact store backed by a local directory
 */
@Slf4j
@Component
public class FileSystemArtifactStore implements ArtifactStore {

    @Autowired
    private ModelHubProperties properties;

    private Path root;

    public FileSystemArtifactStore() {
    }

    public FileSystemArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @PostConstruct
    public void initialize() {
        if (root == null) {
            root = Paths.get(properties.getStorage().getPath()).toAbsolutePath().normalize();
        }
        log.info("Artifact store rooted at {}", root);
    }

    @Override
    public byte[] load(String path) throws IOException {
        Path file = resolve(path);
        log.debug("Loading artifact {}", file);
        return Files.readAllBytes(file);
    }

    @Override
    public void save(String path, byte[] data) throws IOException {
        Path file = resolve(path);
        Path dir = file.getParent();
        Files.createDirectories(dir);

        // Write to a temp file of this call only and move it over the target
        Path tmp = Files.createTempFile(dir, file.getFileName().toString() + ".", ".tmp");
        try {
            Files.write(tmp, data);
            move(tmp, file);
        } finally {
            Files.deleteIfExists(tmp);
        }

        log.info("Saved artifact {} ({} bytes)", file, data.length);
    }

    @Override
    public boolean exists(String path) {
        return Files.exists(resolve(path));
    }

    @Override
    public boolean delete(String path) throws IOException {
        return Files.deleteIfExists(resolve(path));
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, replacing in place", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private Path resolve(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Artifact path must not be empty");
        }

        Path resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Artifact path escapes the store root: " + path);
        }
        return resolved;
    }
}
