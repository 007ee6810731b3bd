package com.williamcallahan.local_seo_engine.model.enrichment;

import lombok.Builder;

import java.time.Instant;

/**
 * One question/answer pair. Unanswered questions carry null answer fields.
 * {@code qaKey} hashes the question and answer text, timestamps and profile names.
 */
@Builder(toBuilder = true)
public record QuestionAnswerItem(
        String qaKey,
        String questionText,
        Instant questionTimestamp,
        String questionProfileName,
        String answerText,
        Instant answerTimestamp,
        String answerProfileName,
        String rawJson
) {
}
