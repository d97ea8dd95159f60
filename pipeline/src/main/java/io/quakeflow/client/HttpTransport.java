package io.quakeflow.client;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * One blocking HTTP GET. Implementations do no retrying of their own.
 */
public interface HttpTransport {

    Response get(URI uri, Map<String, String> headers, Duration timeout)
            throws IOException, InterruptedException;

    /**
     * Status, body and the single header the retry logic cares about.
     */
    final class Response {
        private final int statusCode;
        private final String body;
        private final String retryAfter;

        public Response(int statusCode, String body, String retryAfter) {
            this.statusCode = statusCode;
            this.body = body;
            this.retryAfter = retryAfter;
        }

        public int statusCode() { return statusCode; }
        public String body() { return body; }
        public String retryAfter() { return retryAfter; }

        public boolean isSuccess() {
            return statusCode >= 200 && statusCode < 300;
        }
    }
}
