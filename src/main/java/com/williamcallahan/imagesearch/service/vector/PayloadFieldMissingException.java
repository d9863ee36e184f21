package com.williamcallahan.imagesearch.service.vector;

/**
 * Raised when a returned point lacks a payload field required to build a typed search result.
 */
public class PayloadFieldMissingException extends VectorIndexException {

    private final String fieldName;
    private final String pointId;

    public PayloadFieldMissingException(String fieldName, String pointId) {
        super("Point " + pointId + " is missing required payload field '" + fieldName + "'");
        this.fieldName = fieldName;
        this.pointId = pointId;
    }

    public String getFieldName() {
        return fieldName;
    }

    public String getPointId() {
        return pointId;
    }
}
