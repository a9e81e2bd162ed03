package io.github.yok.hirelink.storage;

import java.io.File;
import java.io.IOException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;

/**
 * {@link ArtifactStore} that keeps {@code <table>.avro} files in a directory.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class FileArtifactStore implements ArtifactStore {

    // File extension of backup artifacts
    static final String EXTENSION = ".avro";

    private final File dir;

    /**
     * Creates a store over a directory; the directory is created on first write.
     *
     * @param dir backup directory
     */
    public FileArtifactStore(File dir) {
        this.dir = dir;
    }

    @Override
    public void write(String table, byte[] bytes) throws IOException {
        FileUtils.forceMkdir(dir);
        File file = fileOf(table);
        FileUtils.writeByteArrayToFile(file, bytes);
        log.info("[{}] Backup written: {} ({} bytes)", table, file.getAbsolutePath(),
                bytes.length);
    }

    @Override
    public Optional<byte[]> read(String table) throws IOException {
        File file = fileOf(table);
        if (!file.isFile()) {
            return Optional.empty();
        }
        return Optional.of(FileUtils.readFileToByteArray(file));
    }

    /**
     * Returns the file of a table's artifact.
     *
     * @param table table name
     * @return artifact file (may not exist)
     */
    public File fileOf(String table) {
        return new File(dir, table + EXTENSION);
    }
}
