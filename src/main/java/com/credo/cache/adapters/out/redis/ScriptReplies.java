package com.credo.cache.adapters.out.redis;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a raw Lettuce {@code OBJECT} script reply into plain Java values:
 * bulk and status replies become strings, arrays become lists, numbers and
 * booleans pass through.
 */
final class ScriptReplies {

    private ScriptReplies() {
    }

    static Object toValue(Object reply) {
        if (reply instanceof ByteBuffer) {
            ByteBuffer buffer = ((ByteBuffer) reply).duplicate();
            byte[] bytes = new byte[buffer.remaining()];
            buffer.get(bytes);
            return new String(bytes, StandardCharsets.UTF_8);
        }
        if (reply instanceof byte[]) {
            return new String((byte[]) reply, StandardCharsets.UTF_8);
        }
        if (reply instanceof List) {
            List<?> elements = (List<?>) reply;
            List<Object> values = new ArrayList<>(elements.size());
            for (Object element : elements) {
                values.add(toValue(element));
            }
            return values;
        }
        if (reply instanceof Map) {
            Map<Object, Object> values = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) reply).entrySet()) {
                values.put(toValue(entry.getKey()), toValue(entry.getValue()));
            }
            return values;
        }
        return reply;
    }
}
