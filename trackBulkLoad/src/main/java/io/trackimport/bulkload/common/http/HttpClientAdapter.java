package io.trackimport.bulkload.common.http;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Interface for HTTP client adapters. This abstraction allows the transport to be swapped,
 * including for test doubles that script responses.
 */
public interface HttpClientAdapter {
    /**
     * Performs an HTTP request.
     *
     * @param method The HTTP method (GET, POST, PUT, etc.)
     * @param path The request path, relative to the connection's base URI
     * @param body The request body, or null if no body
     * @param headers The request headers
     * @return A cold Mono that performs the request on each subscription and emits the response
     */
    Mono<HttpResponse> request(String method, String path, String body, Map<String, List<String>> headers);
}
