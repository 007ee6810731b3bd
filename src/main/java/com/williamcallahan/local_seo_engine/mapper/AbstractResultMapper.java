package com.williamcallahan.local_seo_engine.mapper;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.local_seo_engine.util.JsonNodeUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared traversal for task results shaped as {@code task.result[].<itemField>[]}.
 */
abstract class AbstractResultMapper {

    /**
     * Collects item nodes from every result element, taking the first item field that is present
     * on each element.
     */
    protected List<JsonNode> resultItems(JsonNode task, String... itemFields) {
        List<JsonNode> items = new ArrayList<>();
        for (JsonNode result : JsonNodeUtils.elements(task, "result")) {
            for (String field : itemFields) {
                List<JsonNode> found = JsonNodeUtils.elements(result, field);
                if (!found.isEmpty()) {
                    items.addAll(found);
                    break;
                }
            }
        }
        return items;
    }
}
