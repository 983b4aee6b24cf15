package com.example.ConfluenceAgent.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw outcome of a Confluence REST call.
 *
 * @param statusCode HTTP status code
 * @param body       parsed JSON body for successful calls, null otherwise
 * @param rawBody    response text, kept for error details
 */
public record ConfluenceResponse(
        int statusCode,
        JsonNode body,
        String rawBody
) {
    public static final int HTTP_OK = 200;

    public boolean isOk() {
        return statusCode == HTTP_OK && body != null;
    }
}
