package io.github.yok.hirelink.storage;

import java.io.IOException;
import java.util.Optional;

/**
 * Keeps one binary backup artifact per table.
 *
 * @author Yasuharu.Okawauchi
 */
public interface ArtifactStore {

    /**
     * Stores the artifact of a table, replacing any previous one.
     *
     * @param table table name
     * @param bytes artifact content
     * @throws IOException if writing fails
     */
    void write(String table, byte[] bytes) throws IOException;

    /**
     * Reads the artifact of a table.
     *
     * @param table table name
     * @return artifact content, or empty if none has been written
     * @throws IOException if reading fails
     */
    Optional<byte[]> read(String table) throws IOException;
}
