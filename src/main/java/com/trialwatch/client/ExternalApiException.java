package com.trialwatch.client;

/**
 * A call to an external API returned a non-success status or an unreadable body.
 * Never retried.
 */
public class ExternalApiException extends RuntimeException {

    private static final int MAX_BODY_CHARS = 500;

    private final int statusCode;

    public ExternalApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ExternalApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    static String snippet(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_BODY_CHARS ? body.substring(0, MAX_BODY_CHARS) : body;
    }
}
