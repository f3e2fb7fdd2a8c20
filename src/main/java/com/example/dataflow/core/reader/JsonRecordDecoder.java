package com.example.dataflow.core.reader;

import com.example.dataflow.core.exception.SourceShapeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a JSON document into records. An array of objects yields one record per element and a
 * single object yields a one-record list. Integers decode to {@link java.math.BigInteger} and
 * fractions to {@link java.math.BigDecimal}; key order follows the document.
 */
public class JsonRecordDecoder {

    private final ObjectReader jsonReader;

    public JsonRecordDecoder(ObjectMapper objectMapper) {
        this.jsonReader = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null")
                .readerFor(Object.class)
                .with(DeserializationFeature.USE_BIG_INTEGER_FOR_INTS, DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    /**
     * @throws SourceShapeException if the body is not JSON or not an object or an array of objects.
     * @throws IOException          if the stream cannot be read.
     */
    public List<Map<String, Object>> decode(InputStream body) throws IOException {
        try {
            return toRecords(jsonReader.readValue(body));
        } catch (JsonProcessingException e) {
            throw new SourceShapeException("json decode failed: " + e.getOriginalMessage(), e);
        }
    }

    public List<Map<String, Object>> decode(String body) {
        try {
            return toRecords(jsonReader.readValue(body));
        } catch (JsonProcessingException e) {
            throw new SourceShapeException("json decode failed: " + e.getOriginalMessage(), e);
        }
    }

    private static List<Map<String, Object>> toRecords(Object decoded) {
        if (decoded instanceof List) {
            List<?> items = (List<?>) decoded;
            List<Map<String, Object>> records = new ArrayList<>(items.size());
            for (Object item : items) {
                if (!(item instanceof Map)) {
                    throw new SourceShapeException("array items are not objects");
                }
                records.add(toRecord((Map<?, ?>) item));
            }
            return records;
        }
        if (decoded instanceof Map) {
            List<Map<String, Object>> records = new ArrayList<>(1);
            records.add(toRecord((Map<?, ?>) decoded));
            return records;
        }
        throw new SourceShapeException("unexpected JSON type: expected object or array of objects");
    }

    private static Map<String, Object> toRecord(Map<?, ?> object) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (Map.Entry<?, ?> field : object.entrySet()) {
            record.put(String.valueOf(field.getKey()), field.getValue());
        }
        return record;
    }
}
