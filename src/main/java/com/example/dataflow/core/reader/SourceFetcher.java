package com.example.dataflow.core.reader;

import java.util.List;
import java.util.Map;

/**
 * Retrieves the raw records of a remote JSON source.
 */
public interface SourceFetcher {

    /**
     * Fetches and decodes the source. A JSON array of objects yields one record per element;
     * a single JSON object yields a one-record list. Numbers are decoded as
     * {@link java.math.BigInteger} / {@link java.math.BigDecimal} so that their literal value is kept.
     *
     * @param url The source URL.
     * @return The decoded records, in document order.
     * @throws com.example.dataflow.core.exception.InvalidInputException     if the URL is empty or malformed.
     * @throws com.example.dataflow.core.exception.SourceUnreachableException on transport failure.
     * @throws com.example.dataflow.core.exception.SourceHttpException       on a non-2xx status.
     * @throws com.example.dataflow.core.exception.SourceShapeException      if the body is not an object or an array of objects.
     */
    List<Map<String, Object>> fetch(String url);
}
