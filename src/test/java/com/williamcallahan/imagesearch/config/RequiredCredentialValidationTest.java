package com.williamcallahan.imagesearch.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

/**
 * Verifies fail-fast validation of blob store settings and the Qdrant API key.
 */
class RequiredCredentialValidationTest {
    private static final String EMPTY_CREDENTIAL = "";
    private static final String QDRANT_TEST_API_KEY = "qdrant-key-123";
    private static final String MISSING_QDRANT_MESSAGE_FRAGMENT = "QDRANT_API_KEY";

    @Test
    void completeS3Settings_passes() {
        RequiredCredentialValidation validation = createValidation(completeS3Properties());
        assertDoesNotThrow(validation::validateRequiredCredentials);
    }

    @Test
    void missingS3Settings_listsEveryMissingProperty() {
        AppProperties appProperties = completeS3Properties();
        appProperties.getS3().setBucket(EMPTY_CREDENTIAL);
        appProperties.getS3().setSecretAccessKey(EMPTY_CREDENTIAL);

        RequiredCredentialValidation validation = createValidation(appProperties);
        IllegalStateException thrown =
                assertThrows(IllegalStateException.class, validation::validateRequiredCredentials);
        assertTrue(thrown.getMessage().contains("app.s3.bucket"));
        assertTrue(thrown.getMessage().contains("app.s3.secret-access-key"));
        assertFalse(thrown.getMessage().contains("app.s3.endpoint"));
    }

    @Test
    void tlsEnabledWithoutQdrantApiKey_throwsIllegalStateException() {
        AppProperties appProperties = completeS3Properties();
        appProperties.getQdrant().setUseTls(true);

        RequiredCredentialValidation validation = createValidation(appProperties);
        IllegalStateException thrown =
                assertThrows(IllegalStateException.class, validation::validateRequiredCredentials);
        assertTrue(thrown.getMessage().contains(MISSING_QDRANT_MESSAGE_FRAGMENT));
    }

    @Test
    void tlsEnabledWithQdrantApiKey_passes() {
        AppProperties appProperties = completeS3Properties();
        appProperties.getQdrant().setUseTls(true);
        appProperties.getQdrant().setApiKey(QDRANT_TEST_API_KEY);

        RequiredCredentialValidation validation = createValidation(appProperties);
        assertDoesNotThrow(validation::validateRequiredCredentials);
    }

    @Test
    void tlsWithoutApiKeyIsIgnoredForInMemoryIndex() {
        AppProperties appProperties = completeS3Properties();
        appProperties.getQdrant().setUseTls(true);
        appProperties.getVectorIndex().setType("memory");

        RequiredCredentialValidation validation = createValidation(appProperties);
        assertDoesNotThrow(validation::validateRequiredCredentials);
    }

    private static AppProperties completeS3Properties() {
        AppProperties appProperties = new AppProperties();
        appProperties.getS3().setEndpoint("http://localhost:9000");
        appProperties.getS3().setBucket("images");
        appProperties.getS3().setAccessKeyId("minio");
        appProperties.getS3().setSecretAccessKey("minio-secret");
        return appProperties;
    }

    private RequiredCredentialValidation createValidation(AppProperties appProperties) {
        return new RequiredCredentialValidation(appProperties);
    }
}
