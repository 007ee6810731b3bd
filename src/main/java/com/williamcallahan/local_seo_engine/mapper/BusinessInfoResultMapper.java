package com.williamcallahan.local_seo_engine.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.local_seo_engine.config.EnrichmentProperties;
import com.williamcallahan.local_seo_engine.model.enrichment.BusinessInfoSnapshot;
import com.williamcallahan.local_seo_engine.util.JsonNodeUtils;
import com.williamcallahan.local_seo_engine.util.ValidationUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a my_business_info result to a single {@link BusinessInfoSnapshot}.
 *
 * <p>{@code result[].items} may be an object or an array; the first item carrying any profile
 * field wins. {@code place_topics} may be a map keyed by topic or a list of strings/objects.
 */
@Component
public class BusinessInfoResultMapper extends AbstractResultMapper {

    private static final Logger logger = LoggerFactory.getLogger(BusinessInfoResultMapper.class);
    private static final String[] TOPIC_FIELDS = {"title", "name", "topic", "keyword", "value"};

    private final EnrichmentProperties enrichmentProperties;

    public BusinessInfoResultMapper(EnrichmentProperties enrichmentProperties) {
        this.enrichmentProperties = enrichmentProperties;
    }

    public Optional<BusinessInfoSnapshot> map(JsonNode task) {
        try {
            for (JsonNode item : resultItems(task, "items")) {
                BusinessInfoSnapshot snapshot = toSnapshot(item);
                if (!snapshot.isEmpty()) {
                    return Optional.of(snapshot);
                }
            }
        } catch (RuntimeException e) {
            logger.warn("Malformed business info payload treated as empty: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private BusinessInfoSnapshot toSnapshot(JsonNode item) {
        String description = ValidationUtils.truncate(
            JsonNodeUtils.text(item, "description", "about"),
            enrichmentProperties.getDescriptionMaxLength());
        return BusinessInfoSnapshot.builder()
            .description(description)
            .photoCount(JsonNodeUtils.integer(item, "total_photos"))
            .primaryCategory(JsonNodeUtils.text(item, "category"))
            .additionalCategories(distinctIgnoreCase(JsonNodeUtils.textList(item, "additional_categories")))
            .placeTopics(distinctIgnoreCase(topics(item.path("place_topics"))))
            .logoUrl(JsonNodeUtils.text(item, "logo"))
            .mainPhotoUrl(JsonNodeUtils.text(item, "main_image"))
            .build();
    }

    private List<String> topics(JsonNode node) {
        List<String> topics = new ArrayList<>();
        if (node.isObject()) {
            Iterator<String> names = node.fieldNames();
            while (names.hasNext()) {
                topics.add(names.next());
            }
        } else if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isValueNode()) {
                    topics.add(element.asText());
                } else if (element.isObject()) {
                    String text = JsonNodeUtils.text(element, TOPIC_FIELDS);
                    if (text != null) {
                        topics.add(text);
                    }
                }
            }
        }
        return topics;
    }

    private static List<String> distinctIgnoreCase(List<String> values) {
        Map<String, String> seen = new LinkedHashMap<>();
        for (String value : values) {
            if (ValidationUtils.hasText(value)) {
                seen.putIfAbsent(value.trim().toLowerCase(Locale.ROOT), value.trim());
            }
        }
        return new ArrayList<>(seen.values());
    }
}
