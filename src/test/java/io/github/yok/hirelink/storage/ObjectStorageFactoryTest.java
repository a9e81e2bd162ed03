package io.github.yok.hirelink.storage;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockStatic;
import io.github.yok.hirelink.config.ObjectStorageConfig;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.MockedStatic;

class ObjectStorageFactoryTest {

    @TempDir
    Path tempDir;

    @Test
    void create_正常ケース_localRootを指定する_LocalObjectStorageが返ること() {
        ObjectStorageConfig config = new ObjectStorageConfig();
        config.setLocalRoot(tempDir.toString());
        config.setBucketName("ignored");

        assertInstanceOf(LocalObjectStorage.class, new ObjectStorageFactory(config).create());
    }

    @Test
    void create_正常ケース_localRoot未指定である_S3ObjectStorageが返ること() {
        ObjectStorageConfig config = new ObjectStorageConfig();
        config.setBucketName("hirelink-bucket");
        S3ObjectStorage s3Storage = mock(S3ObjectStorage.class);

        try (MockedStatic<S3ObjectStorage> mocked = mockStatic(S3ObjectStorage.class)) {
            mocked.when(() -> S3ObjectStorage.create(config)).thenReturn(s3Storage);
            assertSame(s3Storage, new ObjectStorageFactory(config).create());
        }
    }
}
