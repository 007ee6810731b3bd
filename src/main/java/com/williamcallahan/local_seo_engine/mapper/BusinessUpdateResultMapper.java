package com.williamcallahan.local_seo_engine.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.local_seo_engine.model.enrichment.BusinessUpdateItem;
import com.williamcallahan.local_seo_engine.model.enrichment.UpdateLink;
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
 * Maps a my_business_updates result to posts keyed by a hash of text, date and url.
 * Provider post ids are ignored for identity since older payloads don't carry them.
 */
@Component
public class BusinessUpdateResultMapper extends AbstractResultMapper {

    private static final Logger logger = LoggerFactory.getLogger(BusinessUpdateResultMapper.class);

    public List<BusinessUpdateItem> map(JsonNode task) {
        Map<String, BusinessUpdateItem> byKey = new LinkedHashMap<>();
        for (JsonNode node : resultItems(task, "items")) {
            try {
                BusinessUpdateItem update = toUpdate(node);
                if (update != null) {
                    byKey.putIfAbsent(update.updateKey(), update);
                }
            } catch (RuntimeException e) {
                logger.warn("Skipping malformed update item: {}", e.getMessage());
            }
        }
        return new ArrayList<>(byKey.values());
    }

    private BusinessUpdateItem toUpdate(JsonNode node) {
        String text = JsonNodeUtils.text(node, "post_text", "snippet");
        String url = JsonNodeUtils.text(node, "url", "post_url");
        Instant postDate = JsonNodeUtils.instant(node, "post_date", "timestamp");
        List<String> images = JsonNodeUtils.textList(node, "images_url");
        if (images.isEmpty()) {
            images = JsonNodeUtils.textList(node, "images");
        }
        if (text == null && url == null && postDate == null && images.isEmpty()) {
            return null;
        }
        List<UpdateLink> links = new ArrayList<>();
        for (JsonNode link : JsonNodeUtils.elements(node, "links")) {
            String linkUrl = JsonNodeUtils.text(link, "url");
            if (linkUrl != null) {
                links.add(new UpdateLink(JsonNodeUtils.text(link, "type"), JsonNodeUtils.text(link, "title"), linkUrl));
            }
        }
        return BusinessUpdateItem.builder()
            .updateKey(NaturalKeyUtils.hashKey(text, postDate, url))
            .postText(text)
            .url(url)
            .imageUrls(images)
            .links(links)
            .postDate(postDate)
            .rawJson(node.toString())
            .build();
    }
}
