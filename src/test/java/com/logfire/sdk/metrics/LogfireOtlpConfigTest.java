package com.logfire.sdk.metrics;

import com.sun.net.httpserver.HttpServer;
import io.micrometer.core.instrument.Clock;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import io.opentelemetry.proto.collector.metrics.v1.ExportMetricsServiceRequest;
import io.opentelemetry.proto.common.v1.KeyValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogfireOtlpConfig Tests")
class LogfireOtlpConfigTest {

    private HttpServer server;
    private final CountDownLatch received = new CountDownLatch(1);
    private final AtomicReference<byte[]> body = new AtomicReference<>();
    private final AtomicReference<String> authorization = new AtomicReference<>();
    private final AtomicReference<String> contentType = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/metrics", exchange -> {
            body.set(exchange.getRequestBody().readAllBytes());
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
            received.countDown();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private URI endpoint() {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/v1/metrics");
    }

    @Test
    @DisplayName("Should expose endpoint, headers, step and service name without reading the environment")
    void settings() {
        LogfireOtlpConfig config = new LogfireOtlpConfig(URI.create("https://collector.example/v1/metrics"),
                Map.of("Authorization", "token"), Duration.ofSeconds(15), "svc");

        assertEquals("https://collector.example/v1/metrics", config.url());
        assertEquals(Map.of("Authorization", "token"), config.headers());
        assertEquals(Duration.ofSeconds(15), config.step());
        assertEquals(Map.of("service.name", "svc"), config.resourceAttributes());
        assertNull(config.get("otlp.url"));
        assertTrue(config.validate().isValid());
    }

    @Test
    @DisplayName("Should publish registry meters to the metrics endpoint on close")
    void publishesOnClose() throws Exception {
        OtlpMeterRegistry registry = new OtlpMeterRegistry(new LogfireOtlpConfig(endpoint(),
                Map.of("Authorization", "token"), Duration.ofMinutes(1), "svc"), Clock.SYSTEM);
        registry.counter("orders.placed").increment(3);

        registry.close();

        assertTrue(received.await(10, TimeUnit.SECONDS));
        assertEquals("token", authorization.get());
        assertEquals("application/x-protobuf", contentType.get());
        ExportMetricsServiceRequest request = ExportMetricsServiceRequest.parseFrom(body.get());
        KeyValue serviceName = request.getResourceMetrics(0).getResource().getAttributesList().stream()
                .filter(kv -> kv.getKey().equals("service.name"))
                .findFirst().orElseThrow();
        assertEquals("svc", serviceName.getValue().getStringValue());
        assertTrue(request.getResourceMetrics(0).getScopeMetrics(0).getMetricsCount() > 0);
    }
}
