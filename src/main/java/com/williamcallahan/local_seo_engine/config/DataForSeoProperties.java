package com.williamcallahan.local_seo_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Strongly typed configuration for the DataForSEO business data API.
 */
@Component
@ConfigurationProperties(prefix = "dataforseo")
public class DataForSeoProperties {

    /**
     * API root, without trailing slash.
     */
    private String baseUrl = "https://api.dataforseo.com";

    private String login;

    private String password;

    /**
     * Public URL of the postback endpoint. The provider substitutes {@code $id} and {@code $tag}.
     */
    private String postbackUrl;

    private String languageCode = "en";

    /**
     * Default review depth when the place has no known review count.
     */
    private int reviewDepth = 100;

    private int priority = 2;

    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * How long the encoded Basic credential is reused before it is rebuilt from configuration.
     */
    private Duration credentialTtl = Duration.ofMinutes(55);

    /**
     * Status codes in the failure range that the provider uses for jobs still queued or handed off.
     */
    private Set<Integer> inProgressStatusCodes = new LinkedHashSet<>(Set.of(40601, 40602));

    /**
     * Live endpoint used for the synchronous social profile lookup.
     */
    private String socialProfilesLivePath = "/v3/business_data/google/my_business_info/live";

    public boolean hasCredentials() {
        return login != null && !login.isBlank() && password != null && !password.isBlank();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getLogin() {
        return login;
    }

    public void setLogin(String login) {
        this.login = login;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getPostbackUrl() {
        return postbackUrl;
    }

    public void setPostbackUrl(String postbackUrl) {
        this.postbackUrl = postbackUrl;
    }

    public String getLanguageCode() {
        return languageCode;
    }

    public void setLanguageCode(String languageCode) {
        this.languageCode = languageCode;
    }

    public int getReviewDepth() {
        return reviewDepth;
    }

    public void setReviewDepth(int reviewDepth) {
        this.reviewDepth = reviewDepth;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getCredentialTtl() {
        return credentialTtl;
    }

    public void setCredentialTtl(Duration credentialTtl) {
        this.credentialTtl = credentialTtl;
    }

    public Set<Integer> getInProgressStatusCodes() {
        return inProgressStatusCodes;
    }

    public void setInProgressStatusCodes(Set<Integer> inProgressStatusCodes) {
        this.inProgressStatusCodes = inProgressStatusCodes;
    }

    public String getSocialProfilesLivePath() {
        return socialProfilesLivePath;
    }

    public void setSocialProfilesLivePath(String socialProfilesLivePath) {
        this.socialProfilesLivePath = socialProfilesLivePath;
    }
}
