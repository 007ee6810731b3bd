/**
 * Receives DataForSEO postbacks
 *
 * @author William Callahan
 *
 * Features:
 * - Accepts plain or gzip-encoded JSON bodies
 * - Passes the id and tag query parameters through as resolution hints
 * - Answers 200 when the callback was applied and 400 when it was rejected
 */

package com.williamcallahan.local_seo_engine.controller;

import com.williamcallahan.local_seo_engine.controller.support.ErrorResponseUtils;
import com.williamcallahan.local_seo_engine.service.enrichment.EnrichmentOrchestrator;
import com.williamcallahan.local_seo_engine.types.CallbackResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.zip.GZIPInputStream;

@RestController
@RequestMapping("/api/dataforseo")
public class DataForSeoCallbackController {

    private static final Logger logger = LoggerFactory.getLogger(DataForSeoCallbackController.class);

    private final EnrichmentOrchestrator orchestrator;

    public DataForSeoCallbackController(EnrichmentOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/postback")
    public ResponseEntity<Map<String, Object>> postback(
            @RequestParam(name = "id", required = false) String id,
            @RequestParam(name = "tag", required = false) String tag,
            @RequestHeader(name = HttpHeaders.CONTENT_ENCODING, required = false) String contentEncoding,
            @RequestBody(required = false) byte[] body) {

        String payload;
        try {
            payload = decodeBody(body, contentEncoding);
        } catch (IOException e) {
            logger.warn("Unreadable postback body (id={}, tag={}): {}", id, tag, e.getMessage());
            return ResponseEntity.badRequest().body(ErrorResponseUtils.callbackBody(false, "Unreadable payload: " + e.getMessage()));
        }

        CallbackResult result = orchestrator.handleCallback(id, tag, payload);
        logger.info("Postback (id={}, tag={}) {}: {}", id, tag, result.accepted() ? "accepted" : "rejected", result.message());
        Map<String, Object> responseBody = ErrorResponseUtils.callbackBody(result.accepted(), result.message());
        return result.accepted() ? ResponseEntity.ok(responseBody) : ResponseEntity.badRequest().body(responseBody);
    }

    static String decodeBody(byte[] body, String contentEncoding) throws IOException {
        if (body == null || body.length == 0) {
            return "";
        }
        if (contentEncoding != null && contentEncoding.toLowerCase(Locale.ROOT).contains("gzip")) {
            try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        return new String(body, StandardCharsets.UTF_8);
    }
}
