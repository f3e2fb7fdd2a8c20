package com.example.dataflow.core.exception;

/**
 * The source answered with a status outside 200-299.
 * Only the first few KB of the response body are kept.
 */
public class SourceHttpException extends SourceFetchException {

    private final int status;
    private final String bodySnippet;

    public SourceHttpException(int status, String bodySnippet) {
        super(String.format("http status %d: %s", status, bodySnippet));
        this.status = status;
        this.bodySnippet = bodySnippet;
    }

    public int getStatus() {
        return status;
    }

    public String getBodySnippet() {
        return bodySnippet;
    }
}
