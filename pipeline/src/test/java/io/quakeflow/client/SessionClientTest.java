package io.quakeflow.client;

import io.quakeflow.exceptions.PermanentError;
import io.quakeflow.exceptions.TransientError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionClientTest {

    private static final String URL = "https://example.test/query?format=geojson";

    private ScriptedTransport transport;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        sleeps = new ArrayList<>();
    }

    @Test
    void testSuccessOnFirstAttempt() throws Exception {
        transport.respond(200, "{\"ok\":true}", null);

        String body = client(RetryPolicy.defaults()).request(URL);

        assertThat(body).isEqualTo("{\"ok\":true}");
        assertThat(transport.calls).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void testRetryableStatusThenSuccess() throws Exception {
        transport.respond(503, "busy", null);
        transport.respond(200, "done", null);

        String body = client(RetryPolicy.defaults()).request(URL);

        assertThat(body).isEqualTo("done");
        assertThat(transport.calls).isEqualTo(2);
        assertThat(sleeps).containsExactly(Duration.ofMillis(1500));
    }

    @Test
    void testRetryAfterHeaderIsHonoured() throws Exception {
        transport.respond(503, "busy", "4");
        transport.respond(200, "done", null);

        client(RetryPolicy.defaults()).request(URL);

        assertThat(sleeps).containsExactly(Duration.ofSeconds(4));
    }

    @Test
    void testExhaustedRetriesRaiseTransientError() {
        RetryPolicy policy = new RetryPolicy(2, 1.0, Set.of(503));
        for (int i = 0; i < 3; i++) {
            transport.respond(503, "busy", null);
        }

        assertThatThrownBy(() -> client(policy).request(URL))
                .isInstanceOf(TransientError.class)
                .hasMessageContaining("HTTP 503 after 3 attempt(s)");
        assertThat(transport.calls).isEqualTo(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
    }

    @Test
    void testClientErrorIsPermanentAndNotRetried() {
        transport.respond(404, "not found", null);

        assertThatThrownBy(() -> client(RetryPolicy.defaults()).request(URL))
                .isInstanceOf(PermanentError.class)
                .satisfies(e -> assertThat(((PermanentError) e).getStatusCode()).isEqualTo(404));
        assertThat(transport.calls).isEqualTo(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void testNonRetryableServerErrorIsTransientWithoutRetry() {
        transport.respond(501, "not implemented", null);

        assertThatThrownBy(() -> client(RetryPolicy.defaults()).request(URL))
                .isInstanceOf(TransientError.class);
        assertThat(transport.calls).isEqualTo(1);
    }

    @Test
    void testTimeoutsAreRetriedUntilExhausted() {
        RetryPolicy policy = new RetryPolicy(1, 1.0, Set.of(503));
        transport.fail(new HttpTimeoutException("timed out"));
        transport.fail(new HttpTimeoutException("timed out"));

        assertThatThrownBy(() -> client(policy).request(URL))
                .isInstanceOf(TransientError.class)
                .hasMessageContaining("HttpTimeoutException");
        assertThat(transport.calls).isEqualTo(2);
    }

    @Test
    void testUserAgentSentOnEveryRequest() throws Exception {
        transport.respond(503, "busy", null);
        transport.respond(200, "done", null);

        client(RetryPolicy.defaults()).request(URL);

        assertThat(transport.seenHeaders).hasSize(2);
        for (Map<String, String> headers : transport.seenHeaders) {
            assertThat(headers).containsEntry("User-Agent", "test-agent/1.0");
            assertThat(headers).containsEntry("Accept", "application/json");
        }
    }

    @Test
    void testBlankUserAgentRejected() {
        assertThatThrownBy(() -> new SessionClient(transport, RetryPolicy.defaults(),
                Duration.ofSeconds(5), " ", sleeps::add))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testMalformedUrlIsPermanent() {
        assertThatThrownBy(() -> client(RetryPolicy.defaults()).request("not a url"))
                .isInstanceOf(PermanentError.class);
        assertThat(transport.calls).isZero();
    }

    @Test
    void testParseRetryAfter() {
        assertThat(SessionClient.parseRetryAfter("12")).isEqualTo(Duration.ofSeconds(12));
        assertThat(SessionClient.parseRetryAfter(null)).isNull();
        assertThat(SessionClient.parseRetryAfter("soon")).isNull();
        assertThat(SessionClient.parseRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT")).isEqualTo(Duration.ZERO);
    }

    // Helper

    private SessionClient client(RetryPolicy policy) {
        return new SessionClient(transport, policy, Duration.ofSeconds(5), "test-agent/1.0", sleeps::add);
    }

    private static class ScriptedTransport implements HttpTransport {
        private final Deque<Object> script = new ArrayDeque<>();
        private final List<Map<String, String>> seenHeaders = new ArrayList<>();
        private int calls;

        void respond(int status, String body, String retryAfter) {
            script.add(new Response(status, body, retryAfter));
        }

        void fail(IOException e) {
            script.add(e);
        }

        @Override
        public Response get(URI uri, Map<String, String> headers, Duration timeout) throws IOException {
            calls++;
            seenHeaders.add(headers);
            Object next = script.poll();
            if (next instanceof IOException) {
                throw (IOException) next;
            }
            if (next == null) {
                throw new IllegalStateException("No scripted response left");
            }
            return (Response) next;
        }
    }
}
