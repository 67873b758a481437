package id.go.kemenkeu.djpbn.sakti.wf.core.field;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ValidationException;
import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceDescriptor;

import java.util.Collection;
import java.util.Map;

/**
 * Rejects values that cannot round-trip through a JSON column, and field
 * names the descriptor does not declare as structured.
 */
public class FieldShapeValidator {

    private static final int MAX_DEPTH = 32;

    public void validateField(ResourceDescriptor descriptor, String field) {
        if (!descriptor.isStructured(field)) {
            throw new ValidationException(
                "Unknown structured field '" + field + "' on " + descriptor.getResourceType());
        }
    }

    public void validateValue(Object value) {
        validate(value, "$", 0);
    }

    private void validate(Object value, String path, int depth) {
        if (depth > MAX_DEPTH) {
            throw new ValidationException("Structured value nested too deeply at " + path);
        }
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return;
        }
        if (value instanceof Map) {
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                if (!(e.getKey() instanceof String)) {
                    throw new ValidationException("Non-string key at " + path + ": " + e.getKey());
                }
                validate(e.getValue(), path + "." + e.getKey(), depth + 1);
            }
            return;
        }
        if (value instanceof Collection) {
            int i = 0;
            for (Object item : (Collection<?>) value) {
                validate(item, path + "[" + i++ + "]", depth + 1);
            }
            return;
        }
        throw new ValidationException(
            "Unsupported value type at " + path + ": " + value.getClass().getSimpleName());
    }
}
