package io.github.yok.hirelink.storage;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;

/**
 * {@link ObjectStorage} that resolves keys as relative paths under a local directory.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LocalObjectStorage implements ObjectStorage {

    private final File root;

    /**
     * Creates a storage rooted at a directory.
     *
     * @param root root directory
     */
    public LocalObjectStorage(File root) {
        this.root = root;
    }

    @Override
    public Optional<String> fetchText(String key) throws IOException {
        String relative = FilenameUtils.normalize(key, true);
        if (relative == null) {
            throw new IOException("Key escapes the storage root: " + key);
        }
        File file = new File(root, relative);
        if (!file.isFile()) {
            log.debug("No object at {}", file.getAbsolutePath());
            return Optional.empty();
        }
        return Optional.of(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
    }
}
