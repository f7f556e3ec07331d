package com.trialwatch.client;

public class RegistryApiException extends ExternalApiException {

    public RegistryApiException(int statusCode, String body) {
        super("ClinicalTrials.gov API error " + statusCode + ": " + snippet(body), statusCode);
    }

    public RegistryApiException(String message, Throwable cause) {
        super(message, 0, cause);
    }
}
