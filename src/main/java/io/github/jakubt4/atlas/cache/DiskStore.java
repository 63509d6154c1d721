package io.github.jakubt4.atlas.cache;

import java.io.IOException;
import java.util.Optional;

/**
 * Byte-level key/value storage backing the persistent cache mirror. Paths are relative
 * and use {@code /} as separator.
 */
public interface DiskStore {

    /**
     * @return the stored bytes, or empty if nothing was ever written at {@code path}
     */
    Optional<byte[]> readBytes(String path) throws IOException;

    void writeBytes(String path, byte[] bytes) throws IOException;

    void delete(String path) throws IOException;
}
