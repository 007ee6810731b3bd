package com.williamcallahan.local_seo_engine.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.local_seo_engine.model.enrichment.QuestionAnswerItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QuestionAnswerResultMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final QuestionAnswerResultMapper mapper = new QuestionAnswerResultMapper();

    @Test
    void map_emitsOneRowPerQuestionAnswerPair() throws Exception {
        JsonNode task = objectMapper.readTree("""
            {"result": [{
              "items": [{
                "question_text": "Do you have parking?",
                "timestamp": "2024-01-10 10:00:00 +00:00",
                "profile_name": "Sam",
                "items": [
                  {"answer_text": "Yes, behind the building.", "timestamp": "2024-01-11 10:00:00 +00:00", "profile_name": "Owner"},
                  {"answer_text": "Street parking too.", "timestamp": "2024-01-12 10:00:00 +00:00", "profile_name": "Alex"}
                ]
              }],
              "items_without_answers": [{"question_text": "Open on holidays?", "profile_name": "Kim"}]
            }]}
            """);

        List<QuestionAnswerItem> pairs = mapper.map(task);

        assertThat(pairs).hasSize(3);
        assertThat(pairs).extracting(QuestionAnswerItem::answerText)
            .containsExactly("Yes, behind the building.", "Street parking too.", null);
        assertThat(pairs.get(0).questionProfileName()).isEqualTo("Sam");
        assertThat(pairs.get(1).answerProfileName()).isEqualTo("Alex");
        assertThat(pairs).extracting(QuestionAnswerItem::qaKey).doesNotHaveDuplicates();
    }

    @Test
    void map_sameLogicalPairYieldsSameKeyAcrossPayloadShapes() throws Exception {
        JsonNode older = objectMapper.readTree("""
            {"result": [{"items": [{"question_text": "Is it wheelchair accessible?", "timestamp": "2024-02-01 10:00:00 +00:00",
              "profile_name": "Lee", "answers": [{"text": "Yes", "timestamp": "2024-02-02 10:00:00 +00:00", "profile_name": "Owner"}]}]}]}
            """);
        JsonNode newer = objectMapper.readTree("""
            {"result": [{"items": [{"question_text": "Is it wheelchair accessible?", "timestamp": "2024-02-01T10:00:00Z",
              "profile_name": "Lee", "question_id": "q-77", "items": [{"answer_text": "Yes", "timestamp": "2024-02-02T10:00:00Z",
              "profile_name": "Owner", "answer_id": "a-1"}]}]}]}
            """);

        assertThat(mapper.map(older).get(0).qaKey()).isEqualTo(mapper.map(newer).get(0).qaKey());
    }
}
