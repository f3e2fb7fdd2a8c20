package com.example.dataflow.core;

import com.example.dataflow.core.exception.InvalidInputException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SourcePreviewerTest {

    private List<Map<String, Object>> served = List.of();
    private String requestedUrl;

    private final SourcePreviewer previewer = new SourcePreviewer(url -> {
        requestedUrl = url;
        return served;
    });

    private static Map<String, Object> wide(int keys) {
        Map<String, Object> record = new LinkedHashMap<>();
        for (int i = 0; i < keys; i++) {
            record.put("k" + i, i);
        }
        return record;
    }

    @Test
    public void testSmallPayloadUnchanged() {
        served = List.of(Map.of("id", 1), Map.of("id", 2));

        assertEquals(served, previewer.preview(" http://source/items "));
        assertEquals("http://source/items", requestedUrl);
    }

    @Test
    public void testRecordsCappedAtTen() {
        List<Map<String, Object>> records = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            records.add(Map.of("id", i));
        }
        served = records;

        List<Map<String, Object>> preview = previewer.preview("http://source/items");

        assertEquals(10, preview.size());
        assertEquals(Map.of("id", 9), preview.get(9));
    }

    @Test
    public void testExactlyTwentyKeysHasNoMarker() {
        served = List.of(wide(20));

        Map<String, Object> record = previewer.preview("http://source/items").get(0);

        assertEquals(20, record.size());
        assertFalse(record.containsKey(SourcePreviewer.TRUNCATED_KEY));
    }

    @Test
    public void testTruncationAppliesAtEveryDepth() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("inner", wide(30));
        List<Object> readings = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            readings.add(i);
        }
        record.put("readings", readings);
        served = List.of(record);

        Map<String, Object> preview = previewer.preview("https://source/items").get(0);

        Map<?, ?> inner = (Map<?, ?>) preview.get("inner");
        assertEquals(21, inner.size());
        assertEquals("(more keys omitted)", inner.get(SourcePreviewer.TRUNCATED_KEY));
        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), preview.get("readings"));
    }

    @Test
    public void testOnlyHttpUrlsAccepted() {
        assertThrows(InvalidInputException.class, () -> previewer.preview(null));
        assertThrows(InvalidInputException.class, () -> previewer.preview("  "));
        assertThrows(InvalidInputException.class, () -> previewer.preview("file:///etc/passwd"));
        assertThrows(InvalidInputException.class, () -> previewer.preview("source/items"));
        assertNull(requestedUrl);
    }
}
