package io.github.yok.hirelink.storage;

import java.io.IOException;
import java.util.Optional;

/**
 * Read-only access to externally hosted text objects.
 *
 * @author Yasuharu.Okawauchi
 */
public interface ObjectStorage {

    /**
     * Fetches an object as UTF-8 text.
     *
     * @param key object key (e.g., {@code raw_data/jobs.csv})
     * @return text, or empty if no object exists under {@code key}
     * @throws IOException if the store cannot be reached or the read fails
     */
    Optional<String> fetchText(String key) throws IOException;
}
