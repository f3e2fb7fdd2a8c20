package com.example.dataflow.core;

import com.example.dataflow.core.exception.InvalidInputException;
import com.example.dataflow.core.reader.SourceFetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Fetches a candidate source and returns a bounded sample of it, so that an operator can check
 * the shape of a URL before registering it. Nothing is written.
 * <p>
 * At most {@value #MAX_ITEMS} records are returned. Every object, at any depth, keeps its first
 * {@value #MAX_KEYS} keys and gains a {@value #TRUNCATED_KEY} marker when keys were dropped;
 * every nested array keeps its first {@value #MAX_ITEMS} items.
 */
public class SourcePreviewer {

    private static final Logger log = LoggerFactory.getLogger(SourcePreviewer.class);

    public static final int MAX_ITEMS = 10;
    public static final int MAX_KEYS = 20;
    public static final String TRUNCATED_KEY = "__truncated";
    static final String TRUNCATED_VALUE = "(more keys omitted)";

    private final SourceFetcher sourceFetcher;

    public SourcePreviewer(SourceFetcher sourceFetcher) {
        this.sourceFetcher = Objects.requireNonNull(sourceFetcher, "SourceFetcher cannot be null");
    }

    /**
     * @param url An absolute http or https URL.
     * @return The truncated records, in document order.
     * @throws InvalidInputException if the URL is blank or not http(s).
     */
    public List<Map<String, Object>> preview(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidInputException("url is required");
        }
        requireHttpScheme(url.trim());

        List<Map<String, Object>> records = sourceFetcher.fetch(url.trim());
        log.debug("Previewing {} of {} records from {}", Math.min(records.size(), MAX_ITEMS), records.size(), url);

        List<Map<String, Object>> sample = new ArrayList<>(Math.min(records.size(), MAX_ITEMS));
        for (Map<String, Object> record : records.subList(0, Math.min(records.size(), MAX_ITEMS))) {
            sample.add(truncateObject(record));
        }
        return sample;
    }

    private static void requireHttpScheme(String url) {
        String scheme;
        try {
            scheme = URI.create(url).getScheme();
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("invalid url '" + url + "': " + e.getMessage());
        }
        if (scheme == null) {
            throw new InvalidInputException("url must be http or https: " + url);
        }
        String normalized = scheme.toLowerCase(Locale.ROOT);
        if (!normalized.equals("http") && !normalized.equals("https")) {
            throw new InvalidInputException("url must be http or https: " + url);
        }
    }

    private static Map<String, Object> truncateObject(Map<?, ?> object) {
        Map<String, Object> out = new LinkedHashMap<>();
        int kept = 0;
        for (Map.Entry<?, ?> field : object.entrySet()) {
            if (kept == MAX_KEYS) {
                out.put(TRUNCATED_KEY, TRUNCATED_VALUE);
                break;
            }
            out.put(String.valueOf(field.getKey()), truncateValue(field.getValue()));
            kept++;
        }
        return out;
    }

    private static Object truncateValue(Object value) {
        if (value instanceof Map) {
            return truncateObject((Map<?, ?>) value);
        }
        if (value instanceof List) {
            List<?> items = (List<?>) value;
            List<Object> out = new ArrayList<>(Math.min(items.size(), MAX_ITEMS));
            for (Object item : items.subList(0, Math.min(items.size(), MAX_ITEMS))) {
                out.add(truncateValue(item));
            }
            return out;
        }
        return value;
    }
}
