/**
 * Main application class for the local SEO enrichment engine
 *
 * @author William Callahan
 *
 * Features:
 * - Submits DataForSEO enrichment jobs for places and tracks them in a Postgres ledger
 * - Reconciles job state through scheduled polling and provider postbacks
 * - Materializes reviews, profile data, updates, Q&A and social links idempotently
 */

package com.williamcallahan.local_seo_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LocalSeoEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(LocalSeoEngineApplication.class, args);
    }
}
