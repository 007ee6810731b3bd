package com.williamcallahan.local_seo_engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Narrow slice of a place that enrichment reads. The full entity is owned by the ingestion pipeline.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Place {

    private String placeId;
    private String displayName;
    private String searchLocationName;
    private Integer reviewCount;
    private String logoUrl;
    private String logoLocalPath;
    private String mainPhotoUrl;
    private String mainPhotoLocalPath;
}
