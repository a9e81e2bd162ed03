package io.github.yok.hirelink.storage;

import io.github.yok.hirelink.config.ObjectStorageConfig;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

/**
 * {@link ObjectStorage} backed by one Amazon S3 bucket.
 *
 * <p>
 * Static credentials are used when both access keys are configured; otherwise the SDK's default
 * credential chain applies (environment, profile, instance role).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class S3ObjectStorage implements ObjectStorage, AutoCloseable {

    private final S3Client s3;
    private final String bucket;

    /**
     * Creates a storage over an existing client.
     *
     * @param s3 S3 client
     * @param bucket bucket name
     */
    public S3ObjectStorage(S3Client s3, String bucket) {
        this.s3 = Objects.requireNonNull(s3, "s3");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
    }

    /**
     * Builds a client from {@code object-storage.*} settings.
     *
     * @param config object-storage settings
     * @return storage
     * @throws IllegalStateException if no bucket is configured
     */
    public static S3ObjectStorage create(ObjectStorageConfig config) {
        if (StringUtils.isBlank(config.getBucketName())) {
            throw new IllegalStateException("object-storage.bucket-name is not configured.");
        }
        S3Client client = S3Client.builder().region(Region.of(config.getRegion()))
                .credentialsProvider(credentials(config))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(config.getApiCallTimeout()).build())
                .build();
        return new S3ObjectStorage(client, config.getBucketName());
    }

    private static AwsCredentialsProvider credentials(ObjectStorageConfig config) {
        if (StringUtils.isNoneBlank(config.getAccessKeyId(), config.getSecretAccessKey())) {
            return StaticCredentialsProvider.create(AwsBasicCredentials
                    .create(config.getAccessKeyId(), config.getSecretAccessKey()));
        }
        return DefaultCredentialsProvider.create();
    }

    @Override
    public Optional<String> fetchText(String key) throws IOException {
        GetObjectRequest req = GetObjectRequest.builder().bucket(bucket).key(key).build();
        try {
            ResponseBytes<GetObjectResponse> bytes = s3.getObjectAsBytes(req);
            log.debug("Fetched s3://{}/{} ({} bytes)", bucket, key, bytes.asByteArray().length);
            return Optional.of(bytes.asString(StandardCharsets.UTF_8));
        } catch (NoSuchKeyException e) {
            log.debug("No object at s3://{}/{}", bucket, key);
            return Optional.empty();
        } catch (SdkException e) {
            throw new IOException("Failed to fetch s3://" + bucket + "/" + key, e);
        }
    }

    @Override
    public void close() {
        s3.close();
    }
}
