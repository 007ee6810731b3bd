package com.williamcallahan.local_seo_engine.dto;

import java.util.List;

/**
 * Body of {@code POST /admin/enrichment/places/enrich}. Kinds accept codes or aliases; empty means all.
 */
public record EnrichPlacesRequest(List<String> placeIds, List<String> kinds) {
}
