package com.enterprise.sheetconvert.store;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Attribute conversions shared by the DynamoDB stores.
 */
final class DynamoDbAttributes {

    // fixed width so that string order equals time order in range conditions
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private DynamoDbAttributes() {
    }

    static AttributeValue attr(String value) {
        return AttributeValue.builder().s(value).build();
    }

    static AttributeValue num(long value) {
        return AttributeValue.builder().n(Long.toString(value)).build();
    }

    static AttributeValue bool(boolean value) {
        return AttributeValue.builder().bool(value).build();
    }

    static AttributeValue instant(Instant value) {
        return attr(TIMESTAMP.format(value));
    }

    static void putIfPresent(Map<String, AttributeValue> item, String key, AttributeValue value) {
        if (value != null) {
            item.put(key, value);
        }
    }

    static String str(Map<String, AttributeValue> item, String key) {
        AttributeValue v = item.get(key);
        return (v != null && v.s() != null) ? v.s() : null;
    }

    static long readLong(Map<String, AttributeValue> item, String key) {
        AttributeValue v = item.get(key);
        return (v != null && v.n() != null) ? Long.parseLong(v.n()) : 0L;
    }

    static boolean readBool(Map<String, AttributeValue> item, String key) {
        AttributeValue v = item.get(key);
        return v != null && Boolean.TRUE.equals(v.bool());
    }

    static Instant readInstant(Map<String, AttributeValue> item, String key) {
        String value = str(item, key);
        return value != null ? Instant.parse(value) : null;
    }
}
