package com.logfire.sdk.transport;

import java.net.URI;
import java.util.Map;

/**
 * Posts request bodies to the collector. Implementations do not retry.
 */
public interface HttpTransport {

    /**
     * Sends {@code body} to {@code uri}.
     *
     * @return the response, whatever its status code
     * @throws ExportTransportException if the exchange fails before a response is read
     */
    TransportResponse post(URI uri, Map<String, String> headers, RequestBody body);
}
