package com.williamcallahan.imagesearch.config;

import com.williamcallahan.imagesearch.domain.DedupPolicy;
import com.williamcallahan.imagesearch.domain.DownloadMode;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private static final String VECTOR_INDEX_QDRANT = "qdrant";
    private static final String VECTOR_INDEX_MEMORY = "memory";
    /** Most positive examples a Qdrant recommend request accepts. */
    private static final int RECOMMEND_EXAMPLE_LIMIT = 32;

    private Qdrant qdrant = new Qdrant();
    private VectorIndex vectorIndex = new VectorIndex();
    private S3 s3 = new S3();
    private Model model = new Model();
    private Ingest ingest = new Ingest();
    private Query query = new Query();
    private Retry retry = new Retry();

    public Qdrant getQdrant() {
        return qdrant;
    }

    public void setQdrant(Qdrant qdrant) {
        this.qdrant = qdrant;
    }

    public VectorIndex getVectorIndex() {
        return vectorIndex;
    }

    public void setVectorIndex(VectorIndex vectorIndex) {
        this.vectorIndex = vectorIndex;
    }

    public S3 getS3() {
        return s3;
    }

    public void setS3(S3 s3) {
        this.s3 = s3;
    }

    public Model getModel() {
        return model;
    }

    public void setModel(Model model) {
        this.model = model;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public void setIngest(Ingest ingest) {
        this.ingest = ingest;
    }

    public Query getQuery() {
        return query;
    }

    public void setQuery(Query query) {
        this.query = query;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    /**
     * Rejects settings that would make either pipeline misbehave before any item is processed.
     *
     * @throws IllegalArgumentException when a size, threshold, or name is out of range
     */
    @PostConstruct
    public void validateConfiguration() {
        requireText(qdrant.getCollection(), "app.qdrant.collection");
        requirePositive(qdrant.getUpsertChunkSize(), "app.qdrant.upsert-chunk-size");
        if (qdrant.getTimeout() == null || qdrant.getTimeout().isNegative() || qdrant.getTimeout().isZero()) {
            throw new IllegalArgumentException("app.qdrant.timeout must be positive");
        }
        String indexType = vectorIndex.getType();
        if (!VECTOR_INDEX_QDRANT.equals(indexType) && !VECTOR_INDEX_MEMORY.equals(indexType)) {
            throw new IllegalArgumentException("app.vector-index.type must be 'qdrant' or 'memory' but was " + indexType);
        }

        requireNonNegative(ingest.getHashConcurrency(), "app.ingest.hash-concurrency");
        requireNonNegative(ingest.getEmbedConcurrency(), "app.ingest.embed-concurrency");
        requireNonNegative(ingest.getUploadConcurrency(), "app.ingest.upload-concurrency");
        requirePositive(ingest.getEmbedBatchSize(), "app.ingest.embed-batch-size");
        if (ingest.getDedupPolicy() == null) {
            throw new IllegalArgumentException("app.ingest.dedup-policy is required");
        }

        requirePositive(query.getLimit(), "app.query.limit");
        requirePositive(query.getEmbedBatchSize(), "app.query.embed-batch-size");
        requirePositive(query.getDownloadConcurrency(), "app.query.download-concurrency");
        requirePositive(query.getMaxPositiveVectors(), "app.query.max-positive-vectors");
        if (query.getMaxPositiveVectors() > RECOMMEND_EXAMPLE_LIMIT) {
            throw new IllegalArgumentException(
                    "app.query.max-positive-vectors must not exceed " + RECOMMEND_EXAMPLE_LIMIT);
        }
        requirePositive(query.getHnswEf(), "app.query.hnsw-ef");
        if (query.getScoreThreshold() < -1.0f || query.getScoreThreshold() > 1.0f) {
            throw new IllegalArgumentException("app.query.score-threshold must be within [-1, 1]");
        }
        if (query.getDownloadMode() == null) {
            throw new IllegalArgumentException("app.query.download-mode is required");
        }

        requirePositive(retry.getMaxAttempts(), "app.retry.max-attempts");
    }

    private static void requirePositive(long value, String propertyName) {
        if (value <= 0) {
            throw new IllegalArgumentException(propertyName + " must be positive but was " + value);
        }
    }

    private static void requireNonNegative(int value, String propertyName) {
        if (value < 0) {
            throw new IllegalArgumentException(propertyName + " must not be negative but was " + value);
        }
    }

    private static void requireText(String value, String propertyName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(propertyName + " is required");
        }
    }

    private static int availableProcessors() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public static class Qdrant {
        private String host = "localhost";
        private int port = 6334;
        private boolean useTls = false;
        private String apiKey = "";
        private String collection = "images";
        private Duration timeout = Duration.ofSeconds(60);
        private int upsertChunkSize = 32;
        private boolean onDisk = true;
        private boolean scalarQuantization = true;

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public boolean isUseTls() { return useTls; }
        public void setUseTls(boolean useTls) { this.useTls = useTls; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public String getCollection() { return collection; }
        public void setCollection(String collection) { this.collection = collection; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public int getUpsertChunkSize() { return upsertChunkSize; }
        public void setUpsertChunkSize(int upsertChunkSize) { this.upsertChunkSize = upsertChunkSize; }

        public boolean isOnDisk() { return onDisk; }
        public void setOnDisk(boolean onDisk) { this.onDisk = onDisk; }

        public boolean isScalarQuantization() { return scalarQuantization; }
        public void setScalarQuantization(boolean scalarQuantization) { this.scalarQuantization = scalarQuantization; }
    }

    public static class VectorIndex {
        private String type = VECTOR_INDEX_QDRANT;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    public static class S3 {
        private String endpoint = "";
        private String region = "us-east-1";
        private String bucket = "";
        private String accessKeyId = "";
        private String secretAccessKey = "";
        private boolean pathStyle = true;
        private String publicBaseUrl = "";

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }

        public String getBucket() { return bucket; }
        public void setBucket(String bucket) { this.bucket = bucket; }

        public String getAccessKeyId() { return accessKeyId; }
        public void setAccessKeyId(String accessKeyId) { this.accessKeyId = accessKeyId; }

        public String getSecretAccessKey() { return secretAccessKey; }
        public void setSecretAccessKey(String secretAccessKey) { this.secretAccessKey = secretAccessKey; }

        public boolean isPathStyle() { return pathStyle; }
        public void setPathStyle(boolean pathStyle) { this.pathStyle = pathStyle; }

        public String getPublicBaseUrl() { return publicBaseUrl; }
        public void setPublicBaseUrl(String publicBaseUrl) { this.publicBaseUrl = publicBaseUrl; }

        /**
         * Returns the base URL stored in point payloads, falling back to {@code endpoint/bucket}.
         */
        public String resolvePublicBaseUrl() {
            if (publicBaseUrl != null && !publicBaseUrl.isBlank()) {
                return trimTrailingSlash(publicBaseUrl);
            }
            return trimTrailingSlash(endpoint) + "/" + bucket;
        }

        private static String trimTrailingSlash(String url) {
            String safeUrl = url == null ? "" : url.trim();
            return safeUrl.endsWith("/") ? safeUrl.substring(0, safeUrl.length() - 1) : safeUrl;
        }
    }

    public static class Model {
        private String path = "";
        private boolean useCuda = false;
        private int deviceId = 0;
        private int intraOpThreads = 16;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public boolean isUseCuda() { return useCuda; }
        public void setUseCuda(boolean useCuda) { this.useCuda = useCuda; }

        public int getDeviceId() { return deviceId; }
        public void setDeviceId(int deviceId) { this.deviceId = deviceId; }

        public int getIntraOpThreads() { return intraOpThreads; }
        public void setIntraOpThreads(int intraOpThreads) { this.intraOpThreads = intraOpThreads; }
    }

    public static class Ingest {
        private int hashConcurrency = 0;
        private int embedConcurrency = 0;
        private int uploadConcurrency = 0;
        private int embedBatchSize = 16;
        private DedupPolicy dedupPolicy = DedupPolicy.SKIP;

        public int getHashConcurrency() { return hashConcurrency; }
        public void setHashConcurrency(int hashConcurrency) { this.hashConcurrency = hashConcurrency; }

        public int getEmbedConcurrency() { return embedConcurrency; }
        public void setEmbedConcurrency(int embedConcurrency) { this.embedConcurrency = embedConcurrency; }

        public int getUploadConcurrency() { return uploadConcurrency; }
        public void setUploadConcurrency(int uploadConcurrency) { this.uploadConcurrency = uploadConcurrency; }

        public int getEmbedBatchSize() { return embedBatchSize; }
        public void setEmbedBatchSize(int embedBatchSize) { this.embedBatchSize = embedBatchSize; }

        public DedupPolicy getDedupPolicy() { return dedupPolicy; }
        public void setDedupPolicy(DedupPolicy dedupPolicy) { this.dedupPolicy = dedupPolicy; }

        /** IO-bound hashing and decoding: twice the processor count unless configured. */
        public int resolveHashConcurrency() {
            return hashConcurrency > 0 ? hashConcurrency : availableProcessors() * 2;
        }

        public int resolveEmbedConcurrency() {
            return embedConcurrency > 0 ? embedConcurrency : availableProcessors();
        }

        public int resolveUploadConcurrency() {
            return uploadConcurrency > 0 ? uploadConcurrency : availableProcessors();
        }
    }

    public static class Query {
        private int limit = 100;
        private float scoreThreshold = 0.5f;
        private boolean exact = false;
        private long hnswEf = 32;
        private int embedBatchSize = 128;
        private int downloadConcurrency = 4;
        private DownloadMode downloadMode = DownloadMode.BLOB_STORE;
        private int maxPositiveVectors = 32;

        public int getLimit() { return limit; }
        public void setLimit(int limit) { this.limit = limit; }

        public float getScoreThreshold() { return scoreThreshold; }
        public void setScoreThreshold(float scoreThreshold) { this.scoreThreshold = scoreThreshold; }

        public boolean isExact() { return exact; }
        public void setExact(boolean exact) { this.exact = exact; }

        public long getHnswEf() { return hnswEf; }
        public void setHnswEf(long hnswEf) { this.hnswEf = hnswEf; }

        public int getEmbedBatchSize() { return embedBatchSize; }
        public void setEmbedBatchSize(int embedBatchSize) { this.embedBatchSize = embedBatchSize; }

        public int getDownloadConcurrency() { return downloadConcurrency; }
        public void setDownloadConcurrency(int downloadConcurrency) { this.downloadConcurrency = downloadConcurrency; }

        public DownloadMode getDownloadMode() { return downloadMode; }
        public void setDownloadMode(DownloadMode downloadMode) { this.downloadMode = downloadMode; }

        public int getMaxPositiveVectors() { return maxPositiveVectors; }
        public void setMaxPositiveVectors(int maxPositiveVectors) { this.maxPositiveVectors = maxPositiveVectors; }
    }

    public static class Retry {
        private int maxAttempts = 1;
        private Duration initialBackoff = Duration.ofMillis(500);

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getInitialBackoff() { return initialBackoff; }
        public void setInitialBackoff(Duration initialBackoff) { this.initialBackoff = initialBackoff; }
    }
}
