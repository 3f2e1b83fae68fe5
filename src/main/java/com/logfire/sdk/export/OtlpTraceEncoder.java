package com.logfire.sdk.export;

import io.opentelemetry.exporter.internal.otlp.traces.TraceRequestMarshaler;
import io.opentelemetry.sdk.trace.data.SpanData;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Collection;

/**
 * Serializes a batch as an OTLP {@code ExportTraceServiceRequest} in protobuf form, the body
 * sent to the collector and the payload stored in the fallback file.
 */
final class OtlpTraceEncoder {

    static final String CONTENT_TYPE = "application/x-protobuf";

    private OtlpTraceEncoder() {
    }

    static byte[] encode(Collection<SpanData> spans) throws IOException {
        TraceRequestMarshaler marshaler = TraceRequestMarshaler.create(spans);
        ByteArrayOutputStream out = new ByteArrayOutputStream(marshaler.getBinarySerializedSize());
        marshaler.writeBinaryTo(out);
        return out.toByteArray();
    }
}
