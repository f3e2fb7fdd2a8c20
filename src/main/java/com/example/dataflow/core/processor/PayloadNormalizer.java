package com.example.dataflow.core.processor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens decoded records one level deep: a field holding an object becomes one field per
 * inner key, named {@code "<outer>.<inner>"}. Deeper objects stay as values. Field order
 * follows the source document; on a name clash the later field wins.
 * <p>
 * Pure and total: it never fails and never looks at the destination schema.
 */
public class PayloadNormalizer {

    private static final String KEY_SEPARATOR = ".";

    public List<Map<String, Object>> normalize(List<Map<String, Object>> records) {
        List<Map<String, Object>> normalized = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            normalized.add(flatten(record));
        }
        return normalized;
    }

    private Map<String, Object> flatten(Map<String, Object> record) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> field : record.entrySet()) {
            if (field.getValue() instanceof Map) {
                Map<?, ?> inner = (Map<?, ?>) field.getValue();
                for (Map.Entry<?, ?> innerField : inner.entrySet()) {
                    out.put(field.getKey() + KEY_SEPARATOR + innerField.getKey(), innerField.getValue());
                }
            } else {
                out.put(field.getKey(), field.getValue());
            }
        }
        return out;
    }
}
