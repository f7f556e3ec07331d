package com.trialwatch.client;

public class LiteratureApiException extends ExternalApiException {

    public LiteratureApiException(String endpoint, int statusCode, String body) {
        super("PubMed " + endpoint + " error " + statusCode + ": " + snippet(body), statusCode);
    }

    public LiteratureApiException(String message, Throwable cause) {
        super(message, 0, cause);
    }
}
