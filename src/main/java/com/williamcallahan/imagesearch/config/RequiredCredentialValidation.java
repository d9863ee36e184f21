package com.williamcallahan.imagesearch.config;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Configuration;

/**
 * Validates that required credentials are present at startup.
 *
 * <p>Fails fast with a clear error message instead of letting the first pipeline item discover
 * the problem. Validates:
 * <ul>
 *   <li>The S3 endpoint, bucket, access key id and secret access key are configured.</li>
 *   <li>When Qdrant TLS is enabled, a Qdrant API key is present.</li>
 * </ul>
 */
@Configuration
public class RequiredCredentialValidation {
    private static final Logger log = LoggerFactory.getLogger(RequiredCredentialValidation.class);
    private static final String MISSING_S3_SETTINGS_MESSAGE =
            "S3 blob store is not configured. Missing: %s. Set ENDPOINT, BUCKET_NAME, ACCESS_KEY_ID and "
                    + "SECRET_ACCESS_KEY environment variables.";
    private static final String MISSING_QDRANT_API_KEY_MESSAGE = "Qdrant TLS is enabled but "
            + "app.qdrant.api-key is not set. Set QDRANT_API_KEY for authenticated access.";
    private static final String REQUIRED_CREDENTIAL_VALIDATION_PASSED_MESSAGE = "Required credential validation passed";

    private final AppProperties appProperties;

    RequiredCredentialValidation(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    /**
     * Validates required credentials and halts startup if critical settings are missing.
     *
     * @throws IllegalStateException if S3 settings are incomplete, or if Qdrant TLS is enabled
     *     without an API key
     */
    @PostConstruct
    public void validateRequiredCredentials() {
        AppProperties.S3 s3 = appProperties.getS3();
        List<String> missing = new ArrayList<>();
        addIfBlank(missing, s3.getEndpoint(), "app.s3.endpoint");
        addIfBlank(missing, s3.getBucket(), "app.s3.bucket");
        addIfBlank(missing, s3.getAccessKeyId(), "app.s3.access-key-id");
        addIfBlank(missing, s3.getSecretAccessKey(), "app.s3.secret-access-key");
        if (!missing.isEmpty()) {
            throw new IllegalStateException(String.format(MISSING_S3_SETTINGS_MESSAGE, String.join(", ", missing)));
        }

        AppProperties.Qdrant qdrant = appProperties.getQdrant();
        boolean qdrantIndex = "qdrant".equals(appProperties.getVectorIndex().getType());
        if (qdrantIndex && qdrant.isUseTls() && (qdrant.getApiKey() == null || qdrant.getApiKey().isBlank())) {
            throw new IllegalStateException(MISSING_QDRANT_API_KEY_MESSAGE);
        }

        log.info(REQUIRED_CREDENTIAL_VALIDATION_PASSED_MESSAGE);
    }

    private static void addIfBlank(List<String> missing, String value, String propertyName) {
        if (value == null || value.isBlank()) {
            missing.add(propertyName);
        }
    }
}
