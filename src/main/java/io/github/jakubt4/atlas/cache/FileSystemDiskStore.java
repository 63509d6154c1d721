package io.github.jakubt4.atlas.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * {@link DiskStore} rooted at a local directory. Writes go to a sibling temp file that is then
 * moved over the target, so a reader never sees a half-written entry.
 */
@Slf4j
public class FileSystemDiskStore implements DiskStore {

    private final Path root;

    public FileSystemDiskStore(final Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public Optional<byte[]> readBytes(final String path) throws IOException {
        try {
            return Optional.of(Files.readAllBytes(resolve(path)));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    @Override
    @Retryable(retryFor = IOException.class, maxAttempts = 2, backoff = @Backoff(delay = 100))
    public void writeBytes(final String path, final byte[] bytes) throws IOException {
        final var target = resolve(path);
        Files.createDirectories(target.getParent());
        final var temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, bytes);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Wrote {} bytes to {}", bytes.length, target);
    }

    @Override
    public void delete(final String path) throws IOException {
        Files.deleteIfExists(resolve(path));
    }

    private Path resolve(final String path) throws IOException {
        final var resolved = root.resolve(path).normalize();
        if (!resolved.startsWith(root)) {
            throw new IOException("Path escapes cache directory: " + path);
        }
        return resolved;
    }
}
