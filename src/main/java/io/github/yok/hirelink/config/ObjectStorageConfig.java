package io.github.yok.hirelink.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration class that binds the {@code object-storage} section in {@code application.yml}.
 *
 * <p>
 * When {@code local-root} is set, historical CSV files are read from that directory instead of
 * Amazon S3. Access keys are optional; without them the default AWS credential chain is used.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "object-storage")
@Data
public class ObjectStorageConfig {

    // S3 bucket that holds the raw_data/ folder
    private String bucketName;
    // AWS region (e.g., us-east-1)
    private String region = "us-east-1";
    // Static access key id (optional)
    private String accessKeyId;
    // Static secret access key (optional)
    private String secretAccessKey;
    // Overall timeout of one S3 API call
    private Duration apiCallTimeout = Duration.ofSeconds(30);
    // Local directory used instead of S3 (optional)
    private String localRoot;
}
