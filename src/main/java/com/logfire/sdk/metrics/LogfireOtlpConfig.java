package com.logfire.sdk.metrics;

import io.micrometer.registry.otlp.OtlpConfig;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Settings of the metrics path: the collector's {@code /v1/metrics} endpoint, the export
 * headers, the publication step and the {@code service.name} resource attribute.
 * Nothing is read from system properties or the environment.
 */
public class LogfireOtlpConfig implements OtlpConfig {

    private final URI endpoint;
    private final Map<String, String> headers;
    private final Duration step;
    private final Map<String, String> resourceAttributes;

    public LogfireOtlpConfig(URI endpoint, Map<String, String> headers, Duration step, String serviceName) {
        this.endpoint = endpoint;
        this.headers = Map.copyOf(headers);
        this.step = step;
        this.resourceAttributes = Map.of("service.name", serviceName);
    }

    @Override
    public String get(String key) {
        return null;
    }

    @Override
    public String url() {
        return endpoint.toString();
    }

    @Override
    public Map<String, String> headers() {
        return headers;
    }

    @Override
    public Duration step() {
        return step;
    }

    @Override
    public Map<String, String> resourceAttributes() {
        return resourceAttributes;
    }
}
