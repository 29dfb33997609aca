package com.stepwright.orchestrator.checkpoint;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * {@link ArtifactStorage} on the local filesystem under
 * {@code stepwright.artifacts.root}.
 *
 * Writes go to a temp file and are moved into place, so a reader never sees
 * a half-written patch.
 */
@Component
public class FilesystemArtifactStorage implements ArtifactStorage {

    private final Path root;

    @Autowired
    public FilesystemArtifactStorage(@Value("${stepwright.artifacts.root}") String root) {
        this(Path.of(root));
    }

    public FilesystemArtifactStorage(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public void write(String relativePath, byte[] content) {
        Path target = resolve(relativePath);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), ".tmp-", ".part");
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ArtifactStorageException("Could not write artifact " + relativePath, e);
        }
    }

    @Override
    public byte[] read(String relativePath) {
        Path source = resolve(relativePath);
        try {
            return Files.readAllBytes(source);
        } catch (NoSuchFileException e) {
            throw new ArtifactStorageException("Artifact not found: " + relativePath, e);
        } catch (IOException e) {
            throw new ArtifactStorageException("Could not read artifact " + relativePath, e);
        }
    }

    @Override
    public boolean exists(String relativePath) {
        return Files.isRegularFile(resolve(relativePath));
    }

    Path resolve(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new ArtifactStorageException("Artifact path is empty");
        }
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new ArtifactStorageException("Artifact path escapes the storage root: " + relativePath);
        }
        return resolved;
    }
}
