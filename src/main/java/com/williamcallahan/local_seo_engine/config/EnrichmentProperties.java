package com.williamcallahan.local_seo_engine.config;

import com.williamcallahan.local_seo_engine.model.TaskKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Orchestration settings: staleness thresholds, reconciliation schedule and asset cache.
 */
@Component
@ConfigurationProperties(prefix = "enrichment")
public class EnrichmentProperties {

    /**
     * Whether the reconciliation scheduler runs.
     */
    private boolean schedulerEnabled = true;

    private long reconcileIntervalMs = 300_000L;

    private long reconcileInitialDelayMs = 60_000L;

    /**
     * Populate every Ready task after each scheduled reconciliation pass.
     */
    private boolean populateReadyOnSchedule = true;

    /**
     * Upper bound for the latest-tasks listing.
     */
    private int latestTasksMax = 2000;

    private int descriptionMaxLength = 750;

    private String assetCacheDir = "/tmp/local-seo-assets";

    private Duration assetDownloadTimeout = Duration.ofSeconds(10);

    private RefreshHours refreshHours = new RefreshHours();

    /**
     * Minimum age of the latest task for a (place, kind) before another submission is due.
     * {@link Duration#ZERO} means always due.
     */
    public Duration thresholdFor(TaskKind kind) {
        int hours;
        switch (kind) {
            case REVIEWS -> hours = refreshHours.getReviews();
            case BUSINESS_INFO -> hours = refreshHours.getBusinessInfo();
            case UPDATES -> hours = refreshHours.getUpdates();
            case QUESTIONS_AND_ANSWERS -> hours = refreshHours.getQuestionsAndAnswers();
            case SOCIAL_PROFILES -> hours = refreshHours.getSocialProfiles();
            default -> hours = 0;
        }
        return Duration.ofHours(Math.max(0, hours));
    }

    public boolean isSchedulerEnabled() {
        return schedulerEnabled;
    }

    public void setSchedulerEnabled(boolean schedulerEnabled) {
        this.schedulerEnabled = schedulerEnabled;
    }

    public long getReconcileIntervalMs() {
        return reconcileIntervalMs;
    }

    public void setReconcileIntervalMs(long reconcileIntervalMs) {
        this.reconcileIntervalMs = reconcileIntervalMs;
    }

    public long getReconcileInitialDelayMs() {
        return reconcileInitialDelayMs;
    }

    public void setReconcileInitialDelayMs(long reconcileInitialDelayMs) {
        this.reconcileInitialDelayMs = reconcileInitialDelayMs;
    }

    public boolean isPopulateReadyOnSchedule() {
        return populateReadyOnSchedule;
    }

    public void setPopulateReadyOnSchedule(boolean populateReadyOnSchedule) {
        this.populateReadyOnSchedule = populateReadyOnSchedule;
    }

    public int getLatestTasksMax() {
        return latestTasksMax;
    }

    public void setLatestTasksMax(int latestTasksMax) {
        this.latestTasksMax = latestTasksMax;
    }

    public int getDescriptionMaxLength() {
        return descriptionMaxLength;
    }

    public void setDescriptionMaxLength(int descriptionMaxLength) {
        this.descriptionMaxLength = descriptionMaxLength;
    }

    public String getAssetCacheDir() {
        return assetCacheDir;
    }

    public void setAssetCacheDir(String assetCacheDir) {
        this.assetCacheDir = assetCacheDir;
    }

    public Duration getAssetDownloadTimeout() {
        return assetDownloadTimeout;
    }

    public void setAssetDownloadTimeout(Duration assetDownloadTimeout) {
        this.assetDownloadTimeout = assetDownloadTimeout;
    }

    public RefreshHours getRefreshHours() {
        return refreshHours;
    }

    public void setRefreshHours(RefreshHours refreshHours) {
        this.refreshHours = refreshHours;
    }

    /**
     * Per-kind refresh thresholds in hours.
     */
    public static class RefreshHours {
        private int reviews = 24;
        private int businessInfo = 24;
        private int updates = 24;
        private int questionsAndAnswers = 24;
        private int socialProfiles = 24;

        public int getReviews() {
            return reviews;
        }

        public void setReviews(int reviews) {
            this.reviews = reviews;
        }

        public int getBusinessInfo() {
            return businessInfo;
        }

        public void setBusinessInfo(int businessInfo) {
            this.businessInfo = businessInfo;
        }

        public int getUpdates() {
            return updates;
        }

        public void setUpdates(int updates) {
            this.updates = updates;
        }

        public int getQuestionsAndAnswers() {
            return questionsAndAnswers;
        }

        public void setQuestionsAndAnswers(int questionsAndAnswers) {
            this.questionsAndAnswers = questionsAndAnswers;
        }

        public int getSocialProfiles() {
            return socialProfiles;
        }

        public void setSocialProfiles(int socialProfiles) {
            this.socialProfiles = socialProfiles;
        }
    }
}
