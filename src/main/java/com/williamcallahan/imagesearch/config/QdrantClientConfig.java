package com.williamcallahan.imagesearch.config;

import com.williamcallahan.imagesearch.service.vector.InMemoryVectorIndex;
import com.williamcallahan.imagesearch.service.vector.QdrantVectorIndex;
import com.williamcallahan.imagesearch.service.vector.VectorIndex;
import com.williamcallahan.imagesearch.support.RetryPolicy;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Vector index wiring. {@code app.vector-index.type=qdrant} (the default) talks to a Qdrant
 * server over gRPC; {@code memory} keeps points in process.
 */
@Configuration
public class QdrantClientConfig {

    private static final Logger log = LoggerFactory.getLogger(QdrantClientConfig.class);

    private static final String VECTOR_INDEX_TYPE_PROPERTY = "app.vector-index.type";

    private static final long PING_INTERVAL_SECONDS = 30;
    private static final long PING_ACK_TIMEOUT_SECONDS = 10;
    private static final long CHANNEL_IDLE_MINUTES = 5;

    /**
     * Qdrant client bound to the configured endpoint, closed with the context.
     */
    @Bean
    @ConditionalOnProperty(name = VECTOR_INDEX_TYPE_PROPERTY, havingValue = "qdrant", matchIfMissing = true)
    public QdrantClient qdrantClient(AppProperties appProperties) {
        AppProperties.Qdrant qdrant = appProperties.getQdrant();
        log.info("[QDRANT] Connecting to {}:{} (tls={}, timeout={})",
                qdrant.getHost(), qdrant.getPort(), qdrant.isUseTls(), qdrant.getTimeout());

        QdrantGrpcClient.Builder grpc = QdrantGrpcClient.newBuilder(openChannel(qdrant), true)
                .withTimeout(qdrant.getTimeout());
        if (qdrant.getApiKey() != null && !qdrant.getApiKey().isBlank()) {
            grpc.withApiKey(qdrant.getApiKey());
        }
        return new QdrantClient(grpc.build());
    }

    private static ManagedChannel openChannel(AppProperties.Qdrant qdrant) {
        ManagedChannelBuilder<?> builder = ManagedChannelBuilder.forAddress(qdrant.getHost(), qdrant.getPort());
        if (qdrant.isUseTls()) {
            builder.useTransportSecurity();
        } else {
            builder.usePlaintext();
        }
        // Pings keep idle channels alive behind load balancers between ingest batches.
        builder.keepAliveTime(PING_INTERVAL_SECONDS, TimeUnit.SECONDS)
                .keepAliveTimeout(PING_ACK_TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .keepAliveWithoutCalls(true)
                .idleTimeout(CHANNEL_IDLE_MINUTES, TimeUnit.MINUTES);
        return builder.build();
    }

    @Bean
    @ConditionalOnProperty(name = VECTOR_INDEX_TYPE_PROPERTY, havingValue = "qdrant", matchIfMissing = true)
    public VectorIndex qdrantVectorIndex(
            QdrantClient qdrantClient, AppProperties appProperties, RetryPolicy retryPolicy) {
        return new QdrantVectorIndex(qdrantClient, appProperties.getQdrant().getTimeout(), retryPolicy);
    }

    @Bean
    @ConditionalOnProperty(name = VECTOR_INDEX_TYPE_PROPERTY, havingValue = "memory")
    public VectorIndex inMemoryVectorIndex() {
        return new InMemoryVectorIndex();
    }
}
