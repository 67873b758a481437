package id.go.kemenkeu.djpbn.sakti.wf.core.field;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure transformations on decoded structured fields. Callers are expected to
 * hold the resource's critical section; nothing here locks.
 */
public final class StructuredFields {

    private StructuredFields() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Merge {@code updates} into a copy of {@code current}. Nested maps merge
     * key by key; any other value (lists included) replaces what was there.
     */
    public static Map<String, Object> deepMerge(Map<String, Object> current, Map<String, Object> updates) {
        Map<String, Object> merged = deepCopy(current);
        if (updates == null) {
            return merged;
        }
        for (Map.Entry<String, Object> e : updates.entrySet()) {
            Object existing = merged.get(e.getKey());
            Object incoming = e.getValue();
            if (existing instanceof Map && incoming instanceof Map) {
                merged.put(e.getKey(), deepMerge(asStringMap(existing), asStringMap(incoming)));
            } else {
                merged.put(e.getKey(), deepCopyValue(incoming));
            }
        }
        return merged;
    }

    /**
     * Append {@code item} to the list under {@code arrayKey} in a copy of
     * {@code current}. With a {@code maxLength}, the oldest entries are dropped
     * until at most that many remain.
     */
    public static Map<String, Object> appendBounded(Map<String, Object> current, String arrayKey,
                                                    Object item, Integer maxLength) {
        if (arrayKey == null || arrayKey.isEmpty()) {
            throw new ValidationException("Array key cannot be empty");
        }
        if (maxLength != null && maxLength < 1) {
            throw new ValidationException("maxLength must be at least 1");
        }
        Map<String, Object> copy = deepCopy(current);
        Object existing = copy.get(arrayKey);
        List<Object> array;
        if (existing == null) {
            array = new ArrayList<>();
        } else if (existing instanceof List) {
            array = new ArrayList<>((List<?>) existing);
        } else {
            throw new ValidationException("Field '" + arrayKey + "' is not an array");
        }
        array.add(deepCopyValue(item));
        if (maxLength != null && array.size() > maxLength) {
            array = new ArrayList<>(array.subList(array.size() - maxLength, array.size()));
        }
        copy.put(arrayKey, array);
        return copy;
    }

    public static Map<String, Object> deepCopy(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            for (Map.Entry<String, Object> e : source.entrySet()) {
                copy.put(e.getKey(), deepCopyValue(e.getValue()));
            }
        }
        return copy;
    }

    private static Object deepCopyValue(Object value) {
        if (value instanceof Map) {
            return deepCopy(asStringMap(value));
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>();
            for (Object o : (Collection<?>) value) {
                copy.add(deepCopyValue(o));
            }
            return copy;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asStringMap(Object value) {
        return (Map<String, Object>) value;
    }
}
