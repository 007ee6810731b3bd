package com.williamcallahan.local_seo_engine.types;

/**
 * Totals for a populate-ready batch
 */
public record BulkPopulateSummary(int attempted, int succeeded, int failed, int itemCount) {
}
