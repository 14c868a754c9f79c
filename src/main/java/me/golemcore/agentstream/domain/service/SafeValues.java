package me.golemcore.agentstream.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Total coercion of arbitrary values into JSON-safe trees.
 *
 * <p>
 * Exactly four cases are handled:
 * <ol>
 * <li>primitive - null, strings, booleans, finite numbers, characters and enum
 * constants are kept (non-finite numbers become strings)</li>
 * <li>mapping - keys become strings, values are coerced recursively, key order
 * is preserved</li>
 * <li>sequence - collections and arrays become lists, element order is
 * preserved</li>
 * <li>opaque - anything else is offered to an {@link OpaqueHandler} and
 * otherwise replaced by a bounded summary of its type and string form</li>
 * </ol>
 *
 * <p>
 * Recursion stops at {@link #MAX_DEPTH}, so cyclic structures terminate.
 * Coercion never throws.
 */
public final class SafeValues {

    public static final int MAX_DEPTH = 32;
    public static final int SUMMARY_LIMIT = 50;

    private static final OpaqueHandler NO_HANDLER = (value, depth) -> null;

    private SafeValues() {
    }

    /**
     * Hook for domain types that have a richer JSON form than the summary.
     * Returns null for values it does not recognize.
     */
    @FunctionalInterface
    public interface OpaqueHandler {
        Object handle(Object value, int depth);
    }

    public static Object coerce(Object value) {
        return coerce(value, NO_HANDLER, 0);
    }

    public static Object coerce(Object value, OpaqueHandler handler, int depth) {
        try {
            if (isPrimitive(value)) {
                return primitive(value);
            }
            if (depth >= MAX_DEPTH) {
                return summarize(value);
            }
            if (value instanceof Map<?, ?> map) {
                Map<String, Object> result = new LinkedHashMap<>();
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    result.put(keyOf(entry.getKey()), coerce(entry.getValue(), handler, depth + 1));
                }
                return result;
            }
            if (value instanceof Collection<?> collection) {
                List<Object> result = new ArrayList<>(collection.size());
                for (Object item : collection) {
                    result.add(coerce(item, handler, depth + 1));
                }
                return result;
            }
            if (value.getClass().isArray()) {
                int length = Array.getLength(value);
                List<Object> result = new ArrayList<>(length);
                for (int i = 0; i < length; i++) {
                    result.add(coerce(Array.get(value, i), handler, depth + 1));
                }
                return result;
            }
            Object handled = handler.handle(value, depth);
            return handled != null ? handled : summarize(value);
        } catch (RuntimeException | StackOverflowError e) { // NOSONAR - coercion must stay total
            return summarize(value);
        }
    }

    /**
     * Bounded summary: type name plus at most {@link #SUMMARY_LIMIT} characters
     * of the string form.
     */
    public static String summarize(Object value) {
        if (value == null) {
            return "<null>";
        }
        String typeName = value.getClass().getSimpleName();
        if (typeName.isEmpty()) {
            typeName = value.getClass().getName();
        }
        return "<" + typeName + ": " + truncate(safeToString(value), SUMMARY_LIMIT) + ">";
    }

    public static String truncate(String text, int limit) {
        if (text == null || text.length() <= limit) {
            return text;
        }
        return text.substring(0, limit);
    }

    private static boolean isPrimitive(Object value) {
        return value == null
                || value instanceof String
                || value instanceof Boolean
                || value instanceof Number
                || value instanceof Character
                || value instanceof Enum<?>;
    }

    private static Object primitive(Object value) {
        if (value instanceof Double number && !Double.isFinite(number)) {
            return number.toString();
        }
        if (value instanceof Float number && !Float.isFinite(number)) {
            return number.toString();
        }
        if (value instanceof Character character) {
            return character.toString();
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        return value;
    }

    private static String keyOf(Object key) {
        if (key instanceof String text) {
            return text;
        }
        return key == null ? "null" : safeToString(key);
    }

    private static String safeToString(Object value) {
        try {
            String text = String.valueOf(value);
            return text != null ? text : "null";
        } catch (RuntimeException | StackOverflowError e) { // NOSONAR - toString of foreign objects may fail
            return "unprintable";
        }
    }
}
