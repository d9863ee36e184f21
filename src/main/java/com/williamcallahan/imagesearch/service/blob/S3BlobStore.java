package com.williamcallahan.imagesearch.service.blob;

import com.williamcallahan.imagesearch.domain.StoredObjectKey;
import com.williamcallahan.imagesearch.support.RetryPolicy;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

/**
 * S3-backed {@link BlobStore} for any S3-compatible endpoint.
 *
 * <p>{@link S3Client} is thread-safe, so a single instance serves all pipeline workers.
 */
public class S3BlobStore implements BlobStore {

    private static final Logger log = LoggerFactory.getLogger(S3BlobStore.class);

    private static final int HTTP_NOT_FOUND = 404;
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";
    private static final Map<String, String> CONTENT_TYPES = Map.of(
            "png", "image/png",
            "jpg", "image/jpeg",
            "jpeg", "image/jpeg",
            "gif", "image/gif",
            "bmp", "image/bmp",
            "wbmp", "image/vnd.wap.wbmp",
            "tif", "image/tiff",
            "tiff", "image/tiff");

    private final S3Client s3Client;
    private final String bucket;
    private final String publicBaseUrl;
    private final RetryPolicy retryPolicy;

    /**
     * Creates a store bound to one bucket.
     *
     * @param s3Client shared S3 client
     * @param bucket bucket holding the images
     * @param publicBaseUrl base URL prepended to keys in point payloads
     * @param retryPolicy retry applied to each call
     */
    public S3BlobStore(S3Client s3Client, String bucket, String publicBaseUrl, RetryPolicy retryPolicy) {
        this.s3Client = Objects.requireNonNull(s3Client, "s3Client");
        this.bucket = Objects.requireNonNull(bucket, "bucket");
        this.publicBaseUrl = Objects.requireNonNull(publicBaseUrl, "publicBaseUrl");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    }

    @Override
    public boolean exists(StoredObjectKey key) {
        Objects.requireNonNull(key, "key");
        return retryPolicy.execute(() -> headExists(key), "S3 head " + key);
    }

    private boolean headExists(StoredObjectKey key) {
        try {
            s3Client.headObject(HeadObjectRequest.builder().bucket(bucket).key(key.value()).build());
            return true;
        } catch (NoSuchKeyException missing) {
            return false;
        } catch (S3Exception s3Failure) {
            if (s3Failure.statusCode() == HTTP_NOT_FOUND) {
                return false;
            }
            throw new BlobStoreException("Failed to check S3 object " + key, s3Failure);
        } catch (RuntimeException clientFailure) {
            throw new BlobStoreException("Failed to check S3 object " + key, clientFailure);
        }
    }

    @Override
    public void put(StoredObjectKey key, byte[] bytes) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(bytes, "bytes");
        retryPolicy.run(() -> {
            try {
                s3Client.putObject(
                        PutObjectRequest.builder()
                                .bucket(bucket)
                                .key(key.value())
                                .contentLength((long) bytes.length)
                                .contentType(contentTypeOf(key))
                                .build(),
                        RequestBody.fromBytes(bytes));
            } catch (RuntimeException e) {
                throw new BlobStoreException("Failed to store S3 object " + key, e);
            }
        }, "S3 put " + key);
        log.debug("[S3] Stored {} ({} bytes)", key, bytes.length);
    }

    @Override
    public byte[] get(StoredObjectKey key) {
        Objects.requireNonNull(key, "key");
        return retryPolicy.execute(() -> {
            try {
                return s3Client.getObjectAsBytes(
                                GetObjectRequest.builder().bucket(bucket).key(key.value()).build())
                        .asByteArray();
            } catch (RuntimeException e) {
                throw new BlobStoreException("Failed to retrieve S3 object " + key, e);
            }
        }, "S3 get " + key);
    }

    @Override
    public List<String> list(String prefix) {
        ListObjectsV2Request.Builder request = ListObjectsV2Request.builder().bucket(bucket);
        if (prefix != null && !prefix.isBlank()) {
            request.prefix(prefix);
        }
        ListObjectsV2Request listRequest = request.build();
        return retryPolicy.execute(() -> {
            try {
                return s3Client.listObjectsV2Paginator(listRequest).contents().stream()
                        .map(S3Object::key)
                        .toList();
            } catch (RuntimeException e) {
                throw new BlobStoreException("Failed to list S3 bucket " + bucket, e);
            }
        }, "S3 list " + bucket);
    }

    @Override
    public String urlFor(StoredObjectKey key) {
        Objects.requireNonNull(key, "key");
        return publicBaseUrl + "/" + key.value();
    }

    static String contentTypeOf(StoredObjectKey key) {
        String value = key.value();
        int dot = value.lastIndexOf('.');
        if (dot < 0) {
            return DEFAULT_CONTENT_TYPE;
        }
        return CONTENT_TYPES.getOrDefault(value.substring(dot + 1).toLowerCase(Locale.ROOT), DEFAULT_CONTENT_TYPE);
    }
}
