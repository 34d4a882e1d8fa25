package com.grantlens.search.opensearch;

public class OpenSearchTimeoutException extends OpenSearchRequestException {
    public OpenSearchTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
