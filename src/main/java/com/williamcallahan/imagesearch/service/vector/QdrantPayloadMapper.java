package com.williamcallahan.imagesearch.service.vector;

import static io.qdrant.client.ValueFactory.value;

import com.williamcallahan.imagesearch.domain.IndexedPoint;
import com.williamcallahan.imagesearch.domain.SearchMatch;
import com.williamcallahan.imagesearch.domain.SearchPayload;
import io.qdrant.client.grpc.Common.PointId;
import io.qdrant.client.grpc.JsonWithInt.Value;
import io.qdrant.client.grpc.Points.ScoredPoint;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Maps between typed search payloads and Qdrant payload values.
 *
 * <p>Only the known fields are written and read back; a returned point missing one of them is
 * rejected rather than mapped to a partial result.</p>
 */
final class QdrantPayloadMapper {
    static final String PAYLOAD_PATH = "path";
    static final String PAYLOAD_HASH = "hash";
    static final String PAYLOAD_URL = "url";
    static final String PAYLOAD_KEY = "key";

    private QdrantPayloadMapper() {}

    static Map<String, Value> toPayload(IndexedPoint point) {
        SearchPayload payload = point.payload();
        Map<String, Value> payloadValues = new LinkedHashMap<>(4);
        payloadValues.put(PAYLOAD_PATH, value(payload.path()));
        payloadValues.put(PAYLOAD_HASH, value(payload.hash()));
        payloadValues.put(PAYLOAD_URL, value(payload.url()));
        payloadValues.put(PAYLOAD_KEY, value(point.key().value()));
        return payloadValues;
    }

    /**
     * Converts one scored point into a typed match.
     *
     * @param scoredPoint Qdrant recommend result point
     * @return match carrying id, score and payload
     * @throws PayloadFieldMissingException when a required field is absent or not a string
     */
    static SearchMatch toMatch(ScoredPoint scoredPoint) {
        UUID pointId = toUuid(scoredPoint.getId());
        Map<String, Value> payload = scoredPoint.getPayloadMap();
        SearchPayload searchPayload = new SearchPayload(
                requireString(payload, PAYLOAD_PATH, pointId),
                requireString(payload, PAYLOAD_HASH, pointId),
                requireString(payload, PAYLOAD_URL, pointId));
        return new SearchMatch(pointId, scoredPoint.getScore(), searchPayload);
    }

    static UUID toUuid(PointId pointId) {
        if (pointId.getPointIdOptionsCase() == PointId.PointIdOptionsCase.UUID) {
            return UUID.fromString(pointId.getUuid());
        }
        return new UUID(0L, pointId.getNum());
    }

    private static String requireString(Map<String, Value> payload, String key, UUID pointId) {
        Value payloadValue = payload == null ? null : payload.get(key);
        if (payloadValue == null || payloadValue.getKindCase() != Value.KindCase.STRING_VALUE) {
            throw new PayloadFieldMissingException(key, pointId.toString());
        }
        String stringValue = payloadValue.getStringValue();
        if (stringValue.isBlank() && !PAYLOAD_URL.equals(key)) {
            throw new PayloadFieldMissingException(key, pointId.toString());
        }
        return stringValue;
    }
}
