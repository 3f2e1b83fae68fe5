package com.logfire.sdk.export;

import com.logfire.sdk.transport.ExportTransportException;
import com.logfire.sdk.transport.HttpTransport;
import com.logfire.sdk.transport.RequestBody;
import com.logfire.sdk.transport.TransportResponse;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Posts span batches as OTLP/HTTP protobuf to the collector's traces endpoint through an
 * {@link HttpTransport}, so that the transport's size limit applies before anything is sent.
 *
 * <p>Does not retry. Transport errors, oversized bodies and non-2xx responses complete the
 * export as failed so that a {@link FallbackSpanExporter} can take over.</p>
 */
public class OtlpTransportSpanExporter implements SpanExporter {
    private static final Logger log = LoggerFactory.getLogger(OtlpTransportSpanExporter.class);

    private final HttpTransport transport;
    private final URI endpoint;
    private final Map<String, String> headers;
    private final AtomicBoolean shutdown = new AtomicBoolean();

    public OtlpTransportSpanExporter(HttpTransport transport, URI endpoint, Map<String, String> headers) {
        this.transport = transport;
        this.endpoint = endpoint;
        Map<String, String> allHeaders = new LinkedHashMap<>(headers);
        allHeaders.put("Content-Type", OtlpTraceEncoder.CONTENT_TYPE);
        this.headers = Map.copyOf(allHeaders);
    }

    @Override
    public CompletableResultCode export(Collection<SpanData> spans) {
        if (shutdown.get()) {
            log.debug("export.after_shutdown batchSize={}", spans.size());
            return CompletableResultCode.ofFailure();
        }
        try {
            byte[] body = OtlpTraceEncoder.encode(spans);
            TransportResponse response = transport.post(endpoint, headers, RequestBody.ofBytes(body));
            if (!response.isSuccessful()) {
                log.warn("export.rejected endpoint={} status={} body={}", endpoint, response.statusCode(),
                        response.body());
                return CompletableResultCode.ofFailure();
            }
            log.debug("export.sent endpoint={} batchSize={} bytes={}", endpoint, spans.size(), body.length);
            return CompletableResultCode.ofSuccess();
        } catch (ExportTransportException e) {
            log.warn("export.transport_failed endpoint={} batchSize={} error={}", endpoint, spans.size(),
                    e.getMessage());
            return CompletableResultCode.ofFailure();
        } catch (IOException e) {
            log.error("export.encode_failed batchSize={}", spans.size(), e);
            return CompletableResultCode.ofFailure();
        }
    }

    @Override
    public CompletableResultCode flush() {
        return CompletableResultCode.ofSuccess();
    }

    @Override
    public CompletableResultCode shutdown() {
        shutdown.set(true);
        return CompletableResultCode.ofSuccess();
    }
}
