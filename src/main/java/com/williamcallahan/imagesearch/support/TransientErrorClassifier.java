package com.williamcallahan.imagesearch.support;

import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import java.net.SocketTimeoutException;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkServiceException;

/**
 * Sorts blob store and vector index failures into retryable and permanent ones.
 */
public final class TransientErrorClassifier {

    private static final Set<Status.Code> RETRYABLE_GRPC_CODES =
            EnumSet.of(Status.Code.UNAVAILABLE, Status.Code.DEADLINE_EXCEEDED, Status.Code.RESOURCE_EXHAUSTED);

    private TransientErrorClassifier() {}

    /** Coarse failure categories used in failure details and retry decisions. */
    enum Category {
        NOT_FOUND("404 Not Found", false, 404, "404", "not found", "nosuchkey"),
        UNAUTHORIZED("401 Unauthorized", false, 401, "401", "unauthorized"),
        FORBIDDEN("403 Forbidden", false, 403, "403", "forbidden", "access denied"),
        THROTTLED("429 Rate Limited", true, 429, "429", "too many requests", "slow down"),
        CONNECTION("Connection Error", true, 0, "connection", "timeout", "timed out"),
        UNKNOWN("Unknown Error", false, 0);

        private final String label;
        private final boolean retryable;
        private final int statusCode;
        private final Pattern markers;

        Category(String label, boolean retryable, int statusCode, String... markers) {
            this.label = label;
            this.retryable = retryable;
            this.statusCode = statusCode;
            this.markers = markers.length == 0 ? null : markerPattern(markers);
        }

        /**
         * Prefers the HTTP status of an SDK service error; otherwise matches markers in the
         * joined messages. Numeric markers only match as whole words so that hex object keys
         * containing "404" do not count.
         */
        static Category of(Throwable error) {
            for (Throwable current = error; current != null; current = current.getCause()) {
                if (current instanceof SdkServiceException serviceFailure) {
                    for (Category category : values()) {
                        if (category.statusCode != 0 && category.statusCode == serviceFailure.statusCode()) {
                            return category;
                        }
                    }
                }
            }
            String loweredMessages = joinedMessages(error);
            for (Category category : values()) {
                if (category.markers != null && category.markers.matcher(loweredMessages).find()) {
                    return category;
                }
            }
            return UNKNOWN;
        }

        private static Pattern markerPattern(String... markers) {
            StringJoiner alternatives = new StringJoiner("|");
            for (String marker : markers) {
                boolean numeric = marker.chars().allMatch(Character::isDigit);
                alternatives.add(numeric ? "\\b" + marker + "\\b" : Pattern.quote(marker));
            }
            return Pattern.compile(alternatives.toString());
        }
    }

    /**
     * Label for the failure, derived from the messages along its cause chain.
     *
     * @param error failure raised by a collaborator
     * @return a label such as {@code "429 Rate Limited"} or {@code "Unknown Error"}
     */
    public static String determineErrorType(Throwable error) {
        return Category.of(error).label;
    }

    /**
     * Whether another attempt of the same call may succeed.
     *
     * <p>Timeouts, dropped connections, throttling, SDK client-side failures and the gRPC codes
     * UNAVAILABLE, DEADLINE_EXCEEDED and RESOURCE_EXHAUSTED are retryable. An
     * {@link IllegalArgumentException} anywhere in the chain never is.</p>
     *
     * @param error the exception to classify
     * @return true if retrying the call may succeed
     */
    public static boolean isTransient(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof IllegalArgumentException) {
                return false;
            }
        }
        if (Category.of(error).retryable) {
            return true;
        }
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof TimeoutException
                    || current instanceof SocketTimeoutException
                    || current instanceof SdkClientException) {
                return true;
            }
            Status status = grpcStatus(current);
            if (status != null && RETRYABLE_GRPC_CODES.contains(status.getCode())) {
                return true;
            }
        }
        return false;
    }

    private static Status grpcStatus(Throwable error) {
        if (error instanceof StatusRuntimeException runtimeStatus) {
            return runtimeStatus.getStatus();
        }
        if (error instanceof StatusException checkedStatus) {
            return checkedStatus.getStatus();
        }
        return null;
    }

    private static String joinedMessages(Throwable error) {
        StringBuilder joined = new StringBuilder();
        for (Throwable current = error; current != null; current = current.getCause()) {
            String message = current.getMessage();
            if (message != null && !message.isBlank()) {
                joined.append(message).append(' ');
            }
        }
        return joined.toString().toLowerCase(Locale.ROOT);
    }
}
