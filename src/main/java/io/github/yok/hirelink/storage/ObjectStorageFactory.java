package io.github.yok.hirelink.storage;

import io.github.yok.hirelink.config.ObjectStorageConfig;
import java.io.File;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Creates the {@link ObjectStorage} selected by {@code object-storage.*}.
 *
 * <p>
 * {@code local-root} takes precedence; otherwise an S3 client is built for {@code bucket-name}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ObjectStorageFactory {

    // object-storage.* settings
    private final ObjectStorageConfig objectStorageConfig;

    /**
     * Creates the configured storage.
     *
     * @return object storage
     * @throws IllegalStateException if neither a local root nor a bucket is configured
     */
    public ObjectStorage create() {
        if (StringUtils.isNotBlank(objectStorageConfig.getLocalRoot())) {
            log.info("Object storage: local directory {}", objectStorageConfig.getLocalRoot());
            return new LocalObjectStorage(new File(objectStorageConfig.getLocalRoot()));
        }
        log.info("Object storage: s3://{} ({})", objectStorageConfig.getBucketName(),
                objectStorageConfig.getRegion());
        return S3ObjectStorage.create(objectStorageConfig);
    }
}
