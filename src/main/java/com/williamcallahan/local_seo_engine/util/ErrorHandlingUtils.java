/**
 * Utility class for standardized error handling across the enrichment pipeline
 * Provides retry specs for read-only provider calls and cooperative cancellation checks
 *
 * @author William Callahan
 */

package com.williamcallahan.local_seo_engine.util;

import org.slf4j.Logger;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

public final class ErrorHandlingUtils {

    private ErrorHandlingUtils() {
    }

    /**
     * Whether a failure is worth retrying on the next pass (network, timeout, 5xx, 429, 408)
     */
    public static boolean isTransient(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof WebClientResponseException wcre) {
                int status = wcre.getStatusCode().value();
                return wcre.getStatusCode().is5xxServerError() || status == 429 || status == 408;
            }
            if (current instanceof IOException
                    || current instanceof WebClientRequestException
                    || current instanceof TimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Retry policy for idempotent GET calls against the provider.
     * Never applied to task submission, which would create duplicate remote jobs.
     */
    public static Retry createWebClientRetry(Logger logger, String operation) {
        return createWebClientRetry(logger, operation, 2, Duration.ofSeconds(1));
    }

    public static Retry createWebClientRetry(Logger logger, String operation, int maxAttempts, Duration firstBackoff) {
        return Retry.backoff(maxAttempts, firstBackoff)
                .maxBackoff(Duration.ofSeconds(10))
                .jitter(0.5)
                .filter(ErrorHandlingUtils::isTransient)
                .doBeforeRetry(retrySignal -> logger.warn("Retrying {} after error. Attempt #{}/{}. Error: {}",
                        operation, retrySignal.totalRetries() + 1, maxAttempts, retrySignal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, retrySignal) -> {
                    logger.warn("All {} retries failed for {}. Final error: {}",
                            maxAttempts, operation, retrySignal.failure().getMessage());
                    return retrySignal.failure();
                });
    }

    /**
     * Cooperative cancellation checkpoint for batch loops.
     *
     * @throws CancellationException when the current thread has been interrupted
     */
    public static void throwIfCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Enrichment operation cancelled");
        }
    }

    /**
     * Detects cancellation anywhere in a cause chain, including a blocking Reactor call
     * that was interrupted.
     */
    public static boolean isCancellation(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof CancellationException || current instanceof InterruptedException) {
                return true;
            }
            current = current.getCause();
        }
        return Thread.currentThread().isInterrupted();
    }

    /**
     * Rethrows the failure as a {@link CancellationException} when it represents cancellation,
     * so batch boundaries can catch everything else.
     */
    public static void rethrowIfCancelled(Throwable throwable) {
        if (isCancellation(throwable)) {
            if (throwable instanceof CancellationException ce) {
                throw ce;
            }
            CancellationException cancellation = new CancellationException("Enrichment operation cancelled");
            cancellation.initCause(throwable);
            Thread.currentThread().interrupt();
            throw cancellation;
        }
    }

    /**
     * Short description of a failure suitable for the ledger's last_error column
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return null;
        }
        String message = throwable.getMessage();
        return throwable.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }
}
