package com.williamcallahan.imagesearch.service.ingestion;

import com.williamcallahan.imagesearch.domain.ingestion.IngestionFailure;
import com.williamcallahan.imagesearch.pipeline.ItemProcessingException;
import com.williamcallahan.imagesearch.service.ImageDecodeException;
import com.williamcallahan.imagesearch.support.TransientErrorClassifier;
import java.io.FileNotFoundException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.imageio.IIOException;
import org.springframework.stereotype.Service;

/**
 * Turns stage exceptions into {@link IngestionFailure} records with a short diagnostic hint.
 */
@Service
public class IngestionFailureFactory {

    private static final String UNREADABLE_IMAGE = "corrupt or unsupported image data";

    /** Checked in order; the first type the exception is an instance of supplies the hint. */
    private static final Map<Class<? extends Exception>, String> HINTS = new LinkedHashMap<>();

    static {
        HINTS.put(NoSuchFileException.class, "file does not exist");
        HINTS.put(AccessDeniedException.class, "permission denied");
        HINTS.put(FileNotFoundException.class, "file not found or inaccessible");
        HINTS.put(IIOException.class, UNREADABLE_IMAGE);
        HINTS.put(ImageDecodeException.class, UNREADABLE_IMAGE);
    }

    /**
     * Creates a failure record from a phase-tagged pipeline failure.
     *
     * @param file the item that failed
     * @param failure stage failure, phase-tagged when raised by a pipeline task
     * @param defaultPhase phase reported when the failure carries none
     * @return failure record with detailed diagnostics
     */
    public IngestionFailure failure(Path file, Exception failure, String defaultPhase) {
        return failure(file.toString(), failure, defaultPhase);
    }

    /**
     * Same as {@link #failure(Path, Exception, String)} for subjects that may not form a valid path.
     */
    public IngestionFailure failure(String subject, Exception failure, String defaultPhase) {
        if (failure instanceof ItemProcessingException itemFailure) {
            return failure(subject, itemFailure.getPhase(), itemFailure.rootFailure());
        }
        return failure(subject, defaultPhase, failure);
    }

    /**
     * Creates a failure record with exception-specific diagnostic context.
     *
     * @param subject file path or tag name that failed processing
     * @param phase the processing phase where failure occurred
     * @param exception the exception that caused the failure
     * @return failure record with detailed diagnostics
     */
    public IngestionFailure failure(String subject, String phase, Exception exception) {
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(exception, "exception");

        StringBuilder details = new StringBuilder(exception.getClass().getSimpleName());
        if (exception.getMessage() != null && !exception.getMessage().isBlank()) {
            details.append(": ").append(exception.getMessage());
        }
        String hint = hintFor(exception);
        if (hint != null) {
            details.append(" [").append(hint).append(']');
        } else if (exception.getCause() != null) {
            details.append(" [caused by: ").append(exception.getCause().getClass().getSimpleName())
                    .append(", ").append(TransientErrorClassifier.determineErrorType(exception)).append(']');
        }

        return new IngestionFailure(subject, phase, details.toString());
    }

    private static String hintFor(Exception exception) {
        for (Map.Entry<Class<? extends Exception>, String> entry : HINTS.entrySet()) {
            if (entry.getKey().isInstance(exception)) {
                return entry.getValue();
            }
        }
        return null;
    }
}
