package com.williamcallahan.imagesearch.service.embedding;

import ai.onnxruntime.NodeInfo;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import ai.onnxruntime.TensorInfo;
import java.awt.image.BufferedImage;
import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Image embedding service backed by a local ONNX Runtime session.
 *
 * <p>The session is created once and shared by all pipeline workers; ONNX Runtime allows concurrent
 * {@code run} calls on one session. Input resolution and output dimensionality are read from the
 * model's tensor shapes at load time.</p>
 */
public class OnnxImageEmbeddingService implements ImageEmbeddingService, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OnnxImageEmbeddingService.class);

    private final OrtEnvironment environment;
    private final OrtSession session;
    private final String inputName;
    private final String outputName;
    private final int targetSize;
    private final int outputSize;

    private OnnxImageEmbeddingService(OrtEnvironment environment, OrtSession session) throws OrtException {
        this.environment = environment;
        this.session = session;
        this.inputName = session.getInputNames().iterator().next();
        this.outputName = session.getOutputNames().iterator().next();

        long[] inputShape = tensorShape(session.getInputInfo().get(inputName), "input");
        long[] outputShape = tensorShape(session.getOutputInfo().get(outputName), "output");
        if (inputShape.length != 4 || inputShape[3] != ImagePreprocessor.CHANNELS || inputShape[1] != inputShape[2]) {
            throw new IllegalStateException("Unsupported model input shape " + Arrays.toString(inputShape)
                    + "; expected [batch, size, size, 3]");
        }
        if (outputShape.length != 2 || outputShape[1] <= 0) {
            throw new IllegalStateException("Unsupported model output shape " + Arrays.toString(outputShape)
                    + "; expected [batch, dimensions]");
        }
        this.targetSize = Math.toIntExact(inputShape[1]);
        this.outputSize = Math.toIntExact(outputShape[1]);
    }

    /**
     * Loads the model file into a new session.
     *
     * @param modelPath ONNX model file
     * @param useCuda register the CUDA execution provider
     * @param deviceId CUDA device ordinal
     * @param intraOpThreads threads used inside a single inference call
     * @return ready embedding service
     * @throws OrtException when the runtime rejects the model or options
     */
    public static OnnxImageEmbeddingService open(Path modelPath, boolean useCuda, int deviceId, int intraOpThreads)
            throws OrtException {
        Objects.requireNonNull(modelPath, "modelPath");
        if (!Files.isRegularFile(modelPath)) {
            throw new IllegalStateException("Embedding model file does not exist: " + modelPath);
        }
        OrtEnvironment environment = OrtEnvironment.getEnvironment();
        try (OrtSession.SessionOptions options = new OrtSession.SessionOptions()) {
            if (intraOpThreads > 0) {
                options.setIntraOpNumThreads(intraOpThreads);
            }
            if (useCuda) {
                options.addCUDA(deviceId);
            }
            OrtSession session = environment.createSession(modelPath.toString(), options);
            OnnxImageEmbeddingService service;
            try {
                service = new OnnxImageEmbeddingService(environment, session);
            } catch (OrtException | RuntimeException shapeFailure) {
                session.close();
                throw shapeFailure;
            }
            log.info("[EMBEDDING] Loaded {} (input={}px, output={} dims, cuda={})",
                    modelPath.getFileName(), service.targetSize, service.outputSize, useCuda);
            return service;
        }
    }

    @Override
    public List<float[]> predictBatch(List<BufferedImage> images) {
        Objects.requireNonNull(images, "images");
        if (images.isEmpty()) {
            return List.of();
        }
        int pixelsPerImage = targetSize * targetSize * ImagePreprocessor.CHANNELS;
        FloatBuffer batch = FloatBuffer.allocate(images.size() * pixelsPerImage);
        for (BufferedImage image : images) {
            batch.put(ImagePreprocessor.toModelInput(image, targetSize));
        }
        batch.rewind();
        long[] shape = {images.size(), targetSize, targetSize, ImagePreprocessor.CHANNELS};

        try (OnnxTensor input = OnnxTensor.createTensor(environment, batch, shape);
                OrtSession.Result result = session.run(Map.of(inputName, input))) {
            OnnxValue output = result.get(outputName)
                    .orElseThrow(() -> new EmbeddingServiceUnavailableException("Model output missing: " + outputName));
            float[][] rows = (float[][]) output.getValue();
            if (rows.length != images.size()) {
                throw new EmbeddingServiceUnavailableException(
                        "Embedding response count mismatch: expected " + images.size() + " but received " + rows.length);
            }
            List<float[]> vectors = new ArrayList<>(rows.length);
            for (float[] row : rows) {
                vectors.add(row);
            }
            log.debug("[EMBEDDING] Embedded batch of {} images", vectors.size());
            return List.copyOf(vectors);
        } catch (OrtException ortFailure) {
            throw new EmbeddingServiceUnavailableException(
                    "ONNX inference failed for batch of " + images.size() + " images", ortFailure);
        }
    }

    @Override
    public int outputSize() {
        return outputSize;
    }

    @Override
    public int targetSize() {
        return targetSize;
    }

    @Override
    public void close() throws OrtException {
        session.close();
    }

    private static long[] tensorShape(NodeInfo nodeInfo, String role) {
        if (nodeInfo == null || !(nodeInfo.getInfo() instanceof TensorInfo tensorInfo)) {
            throw new IllegalStateException("Model " + role + " is not a tensor");
        }
        return tensorInfo.getShape();
    }
}
