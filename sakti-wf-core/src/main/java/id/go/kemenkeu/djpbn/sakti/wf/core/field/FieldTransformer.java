package id.go.kemenkeu.djpbn.sakti.wf.core.field;

import java.util.Map;

/**
 * Multi-step edit of a structured field. Receives a private deep copy that it
 * may mutate freely; the copy is written back only if this returns normally.
 */
@FunctionalInterface
public interface FieldTransformer {

    void transform(Map<String, Object> value) throws Exception;
}
