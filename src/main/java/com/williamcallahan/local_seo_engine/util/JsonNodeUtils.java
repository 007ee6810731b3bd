package com.williamcallahan.local_seo_engine.util;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Null-safe accessors over Jackson trees. Missing, null or mistyped values come back as null
 * (or an empty list) and never throw.
 */
public final class JsonNodeUtils {

    private static final DateTimeFormatter PROVIDER_OFFSET_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss xxx");
    private static final DateTimeFormatter PROVIDER_LOCAL_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            value -> OffsetDateTime.parse(value).toInstant(),
            Instant::parse,
            value -> OffsetDateTime.parse(value, PROVIDER_OFFSET_FORMAT).toInstant(),
            value -> LocalDateTime.parse(value, PROVIDER_LOCAL_FORMAT).toInstant(ZoneOffset.UTC)
    );

    private JsonNodeUtils() {
    }

    public static boolean isPresent(JsonNode node) {
        return node != null && !node.isMissingNode() && !node.isNull();
    }

    /**
     * @return the first field that holds a non-blank scalar, as trimmed text
     */
    public static String text(JsonNode node, String... fields) {
        if (!isPresent(node)) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (isPresent(value) && value.isValueNode()) {
                String text = value.asText();
                if (ValidationUtils.hasText(text)) {
                    return text.trim();
                }
            }
        }
        return null;
    }

    public static Integer integer(JsonNode node, String... fields) {
        if (!isPresent(node)) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (!isPresent(value)) {
                continue;
            }
            if (value.isNumber()) {
                return value.intValue();
            }
            if (value.isTextual() && value.asText().trim().matches("-?\\d{1,9}")) {
                return Integer.parseInt(value.asText().trim());
            }
        }
        return null;
    }

    public static BigDecimal decimal(JsonNode value) {
        if (!isPresent(value)) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            try {
                return new BigDecimal(value.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static Boolean bool(JsonNode node, String field) {
        if (!isPresent(node)) {
            return null;
        }
        JsonNode value = node.get(field);
        if (!isPresent(value)) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            return Boolean.parseBoolean(value.asText().trim());
        }
        return null;
    }

    /**
     * Reads the first parseable timestamp among the given fields
     */
    public static Instant instant(JsonNode node, String... fields) {
        if (!isPresent(node)) {
            return null;
        }
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (!isPresent(value)) {
                continue;
            }
            Instant parsed = value.isNumber() ? fromEpoch(value.longValue()) : parseInstant(value.asText());
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    /**
     * Parses ISO-8601, the provider's {@code yyyy-MM-dd HH:mm:ss +00:00} form, or epoch seconds/millis
     */
    public static Instant parseInstant(String raw) {
        if (!ValidationUtils.hasText(raw)) {
            return null;
        }
        String value = raw.trim();
        if (value.chars().allMatch(Character::isDigit)) {
            try {
                return fromEpoch(Long.parseLong(value));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            Instant parsed = tryParse(parser, value);
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static Instant tryParse(Function<String, Instant> parser, String value) {
        try {
            return parser.apply(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static Instant fromEpoch(long value) {
        if (value <= 0) {
            return null;
        }
        // values past year 2286 in seconds are millis
        return value > 9_999_999_999L ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
    }

    /**
     * Child elements of an array or object field; a single object is returned as a one-element list
     */
    public static List<JsonNode> elements(JsonNode node, String field) {
        if (!isPresent(node)) {
            return Collections.emptyList();
        }
        JsonNode value = node.get(field);
        if (!isPresent(value)) {
            return Collections.emptyList();
        }
        List<JsonNode> out = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(element -> {
                if (isPresent(element)) {
                    out.add(element);
                }
            });
        } else if (value.isObject()) {
            out.add(value);
        }
        return out;
    }

    /**
     * String values of an array field, skipping blanks and non-scalars
     */
    public static List<String> textList(JsonNode node, String field) {
        List<String> out = new ArrayList<>();
        if (!isPresent(node)) {
            return out;
        }
        JsonNode value = node.get(field);
        if (isPresent(value) && value.isArray()) {
            value.forEach(element -> {
                if (isPresent(element) && element.isValueNode() && ValidationUtils.hasText(element.asText())) {
                    out.add(element.asText().trim());
                }
            });
        } else if (isPresent(value) && value.isTextual() && ValidationUtils.hasText(value.asText())) {
            out.add(value.asText().trim());
        }
        return out;
    }
}
