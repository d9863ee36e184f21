package com.williamcallahan.imagesearch.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * One scored result of a recommend query.
 *
 * @param id matched point id
 * @param score similarity score
 * @param payload typed payload of the matched point
 */
public record SearchMatch(UUID id, float score, SearchPayload payload) {

    public SearchMatch {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(payload, "payload");
    }
}
