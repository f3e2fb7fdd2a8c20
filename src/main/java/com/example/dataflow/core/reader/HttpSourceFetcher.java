package com.example.dataflow.core.reader;

import com.example.dataflow.core.exception.InvalidInputException;
import com.example.dataflow.core.exception.SourceHttpException;
import com.example.dataflow.core.exception.SourceUnreachableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link SourceFetcher} that performs a plain HTTP GET with {@link HttpClient}.
 * The request timeout bounds how long one fetch may block a refresh cycle.
 */
public class HttpSourceFetcher implements SourceFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpSourceFetcher.class);

    private final HttpClient httpClient;
    private final JsonRecordDecoder decoder;
    private final Duration requestTimeout;
    private final int maxErrorBodyBytes;

    public HttpSourceFetcher(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout, int maxErrorBodyBytes) {
        this.httpClient = Objects.requireNonNull(httpClient, "HttpClient cannot be null");
        this.decoder = new JsonRecordDecoder(objectMapper);
        this.requestTimeout = requestTimeout;
        this.maxErrorBodyBytes = maxErrorBodyBytes;
    }

    @Override
    public List<Map<String, Object>> fetch(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidInputException("empty data source url");
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url.trim()))
                    .timeout(requestTimeout)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("invalid data source url '" + url + "': " + e.getMessage());
        }

        log.debug("Fetching source {}", url);
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException e) {
            throw new SourceUnreachableException("http get failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceUnreachableException("http get interrupted", e);
        }

        try (InputStream body = response.body()) {
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                byte[] snippet = body.readNBytes(maxErrorBodyBytes);
                throw new SourceHttpException(status, new String(snippet, StandardCharsets.UTF_8));
            }
            return decoder.decode(body);
        } catch (IOException e) {
            throw new SourceUnreachableException("reading response body failed: " + e.getMessage(), e);
        }
    }
}
