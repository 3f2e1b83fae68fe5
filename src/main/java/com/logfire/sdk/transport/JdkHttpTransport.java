package com.logfire.sdk.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * {@link HttpTransport} backed by {@link HttpClient}.
 */
public class JdkHttpTransport implements HttpTransport {
    private static final Logger log = LoggerFactory.getLogger(JdkHttpTransport.class);

    private final HttpClient httpClient;
    private final Duration timeout;

    public JdkHttpTransport(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), timeout);
    }

    public JdkHttpTransport(HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    @Override
    public TransportResponse post(URI uri, Map<String, String> headers, RequestBody body) {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .POST(publisher(body));
        headers.forEach(request::header);

        try {
            HttpResponse<String> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
            log.debug("transport.response uri={} status={}", uri, response.statusCode());
            return new TransportResponse(response.statusCode(), response.body());
        } catch (IOException e) {
            throw new ExportTransportException("POST " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExportTransportException("POST " + uri + " interrupted", e);
        }
    }

    private static HttpRequest.BodyPublisher publisher(RequestBody body) {
        if (body.isBuffered()) {
            return HttpRequest.BodyPublishers.ofByteArray(body.bytes());
        }
        return HttpRequest.BodyPublishers.ofByteArrays(body.chunks());
    }
}
