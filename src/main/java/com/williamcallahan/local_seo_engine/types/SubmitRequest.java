package com.williamcallahan.local_seo_engine.types;

/**
 * Parameters for a single task submission.
 */
public record SubmitRequest(String placeId,
                            String locationName,
                            Integer reviewDepth,
                            SubmitPayloadShape shape) {

    public SubmitRequest withShape(SubmitPayloadShape newShape) {
        return new SubmitRequest(placeId, locationName, reviewDepth, newShape);
    }

    public boolean hasLocation() {
        return locationName != null && !locationName.isBlank();
    }
}
