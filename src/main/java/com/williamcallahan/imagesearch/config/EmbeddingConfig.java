package com.williamcallahan.imagesearch.config;

import ai.onnxruntime.OrtException;
import com.williamcallahan.imagesearch.service.embedding.OnnxImageEmbeddingService;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the ONNX image embedding model once per process.
 *
 * <p>A model that cannot be loaded is a startup failure; there is no fallback provider.</p>
 */
@Configuration
public class EmbeddingConfig {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);

    /**
     * Opens the configured model file.
     *
     * @param appProperties application configuration
     * @return embedding service shared by every pipeline worker
     * @throws IllegalStateException when the model is missing or rejected by ONNX Runtime
     */
    @Bean(destroyMethod = "close")
    public OnnxImageEmbeddingService imageEmbeddingService(AppProperties appProperties) {
        AppProperties.Model model = appProperties.getModel();
        if (model.getPath() == null || model.getPath().isBlank()) {
            throw new IllegalStateException("app.model.path is not set. Set MODEL_PATH to an ONNX image model.");
        }
        log.info("[EMBEDDING] Loading model {}", model.getPath());
        try {
            return OnnxImageEmbeddingService.open(
                    Path.of(model.getPath()), model.isUseCuda(), model.getDeviceId(), model.getIntraOpThreads());
        } catch (OrtException ortFailure) {
            throw new IllegalStateException("Failed to load embedding model " + model.getPath(), ortFailure);
        }
    }
}
