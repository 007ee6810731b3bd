package com.williamcallahan.local_seo_engine.types;

/**
 * Alternative request bodies accepted by the my_business_info task_post endpoint
 */
public enum SubmitPayloadShape {
    /** {@code place_id} plus language */
    PLACE_ID,
    /** {@code keyword = "place_id:..."} plus language */
    KEYWORD,
    /** keyword, language and {@code location_name} */
    KEYWORD_WITH_LOCATION
}
