package com.williamcallahan.local_seo_engine.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.local_seo_engine.model.enrichment.QuestionAnswerItem;
import com.williamcallahan.local_seo_engine.util.JsonNodeUtils;
import com.williamcallahan.local_seo_engine.util.NaturalKeyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a questions_and_answers result to one row per (question, answer) pair.
 * Questions come from {@code items} and {@code items_without_answers}; answers from the
 * question's nested {@code items} or {@code answers}.
 */
@Component
public class QuestionAnswerResultMapper extends AbstractResultMapper {

    private static final Logger logger = LoggerFactory.getLogger(QuestionAnswerResultMapper.class);

    public List<QuestionAnswerItem> map(JsonNode task) {
        Map<String, QuestionAnswerItem> byKey = new LinkedHashMap<>();
        List<JsonNode> questions = new ArrayList<>(resultItems(task, "items"));
        questions.addAll(resultItems(task, "items_without_answers"));
        for (JsonNode question : questions) {
            try {
                for (QuestionAnswerItem pair : toPairs(question)) {
                    byKey.putIfAbsent(pair.qaKey(), pair);
                }
            } catch (RuntimeException e) {
                logger.warn("Skipping malformed question item: {}", e.getMessage());
            }
        }
        return new ArrayList<>(byKey.values());
    }

    private List<QuestionAnswerItem> toPairs(JsonNode question) {
        String questionText = JsonNodeUtils.text(question, "question_text", "text");
        if (questionText == null) {
            return List.of();
        }
        Instant questionTimestamp = JsonNodeUtils.instant(question, "timestamp", "question_timestamp");
        String questionProfile = JsonNodeUtils.text(question, "profile_name", "question_profile_name");

        List<JsonNode> answers = JsonNodeUtils.elements(question, "items");
        if (answers.isEmpty()) {
            answers = JsonNodeUtils.elements(question, "answers");
        }
        List<QuestionAnswerItem> pairs = new ArrayList<>();
        if (answers.isEmpty()) {
            pairs.add(pair(questionText, questionTimestamp, questionProfile, null, null, null, question));
            return pairs;
        }
        for (JsonNode answer : answers) {
            pairs.add(pair(questionText, questionTimestamp, questionProfile,
                JsonNodeUtils.text(answer, "answer_text", "text"),
                JsonNodeUtils.instant(answer, "timestamp", "answer_timestamp"),
                JsonNodeUtils.text(answer, "profile_name", "answer_profile_name"),
                question));
        }
        return pairs;
    }

    private QuestionAnswerItem pair(String questionText, Instant questionTimestamp, String questionProfile,
                                    String answerText, Instant answerTimestamp, String answerProfile,
                                    JsonNode raw) {
        return QuestionAnswerItem.builder()
            .qaKey(NaturalKeyUtils.hashKey(questionText, questionTimestamp, questionProfile,
                answerText, answerTimestamp, answerProfile))
            .questionText(questionText)
            .questionTimestamp(questionTimestamp)
            .questionProfileName(questionProfile)
            .answerText(answerText)
            .answerTimestamp(answerTimestamp)
            .answerProfileName(answerProfile)
            .rawJson(raw.toString())
            .build();
    }
}
