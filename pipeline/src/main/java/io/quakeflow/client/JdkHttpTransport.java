package io.quakeflow.client;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * {@link HttpTransport} over the JDK {@link HttpClient}. One client instance
 * is kept for the life of the transport so connections are reused.
 */
public class JdkHttpTransport implements HttpTransport {

    private final HttpClient httpClient;

    public JdkHttpTransport(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(connectTimeout)
                .build();
    }

    @Override
    public Response get(URI uri, Map<String, String> headers, Duration timeout)
            throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET();
        headers.forEach(builder::header);

        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        String retryAfter = response.headers().firstValue("Retry-After").orElse(null);
        return new Response(response.statusCode(), response.body(), retryAfter);
    }
}
