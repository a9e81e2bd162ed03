package io.github.yok.hirelink.config;

import java.nio.file.Paths;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Root-level path settings ({@code data-path}, {@code backup-dir}).
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties
@Data
public class PathsConfig {

    // Base data directory
    private String dataPath;

    // Overrides <data-path>/backups when set
    private String backupDir;

    /**
     * Returns the directory holding one {@code <table>.avro} snapshot per table.
     *
     * @return {@code backup-dir} if set, otherwise {@code <data-path>/backups}
     * @throws IllegalStateException if neither property is set
     */
    public String getBackup() {
        if (StringUtils.isNotBlank(backupDir)) {
            return backupDir.trim();
        }
        if (StringUtils.isBlank(dataPath)) {
            throw new IllegalStateException(
                    "Neither backup-dir nor data-path is configured in application.yml.");
        }
        return Paths.get(dataPath.trim(), "backups").toString();
    }
}
