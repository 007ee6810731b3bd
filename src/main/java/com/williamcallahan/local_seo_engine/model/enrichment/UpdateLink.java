package com.williamcallahan.local_seo_engine.model.enrichment;

/**
 * Call-to-action link attached to a business update post
 */
public record UpdateLink(String type, String title, String url) {
}
