package com.sessiongate.webhook;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Performs one webhook POST and returns the HTTP status code.
 */
@FunctionalInterface
public interface WebhookTransport {
    int post(String url, Map<String, String> headers, String body, Duration timeout)
            throws IOException, InterruptedException;
}
