package io.trackimport.bulkload.common.http;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import reactor.core.publisher.Mono;

/**
 * Base class for RestClient implementations. Adds the headers every call to the track API carries.
 */
public abstract class AbstractRestClient {
    @Getter
    protected final ConnectionContext connectionContext;
    protected final HttpClientAdapter httpClientAdapter;

    public static final String USER_AGENT_HEADER_NAME = "User-Agent";
    public static final String CONTENT_TYPE_HEADER_NAME = "Content-Type";
    public static final String HOST_HEADER_NAME = "Host";
    public static final String AUTHORIZATION_HEADER_NAME = "Authorization";

    private static final String USER_AGENT = "TrackObjectImporter-1.0";
    private static final String JSON_CONTENT_TYPE = "application/json";

    protected AbstractRestClient(ConnectionContext connectionContext, HttpClientAdapter httpClientAdapter) {
        this.connectionContext = connectionContext;
        this.httpClientAdapter = httpClientAdapter;
    }

    public static String getHostHeaderValue(ConnectionContext connectionContext) {
        String host = connectionContext.getUri().getHost();
        int port = connectionContext.getUri().getPort();
        ConnectionContext.Protocol protocol = connectionContext.getProtocol();

        if (ConnectionContext.Protocol.HTTP.equals(protocol)) {
            if (port == -1 || port == 80) {
                return host;
            }
        } else if (ConnectionContext.Protocol.HTTPS.equals(protocol)) {
            if (port == -1 || port == 443) {
                return host;
            }
        } else {
            throw new IllegalArgumentException("Unexpected protocol" + protocol);
        }
        return host + ":" + port;
    }

    public Mono<HttpResponse> asyncRequest(String method, String path, String body,
                                           Map<String, List<String>> additionalHeaders) {
        Map<String, List<String>> headers = prepareHeaders(body, additionalHeaders);
        return httpClientAdapter.request(method, path, body, headers);
    }

    protected Map<String, List<String>> prepareHeaders(String body, Map<String, List<String>> additionalHeaders) {
        Map<String, List<String>> headers = new HashMap<>();
        headers.put(USER_AGENT_HEADER_NAME, List.of(USER_AGENT));
        headers.put(HOST_HEADER_NAME, List.of(getHostHeaderValue(connectionContext)));
        headers.put(AUTHORIZATION_HEADER_NAME, List.of("Bearer " + connectionContext.getApiKey()));
        if (body != null) {
            headers.put(CONTENT_TYPE_HEADER_NAME, List.of(JSON_CONTENT_TYPE));
        }
        if (additionalHeaders != null) {
            headers.putAll(additionalHeaders);
        }
        return headers;
    }

    public Mono<HttpResponse> postAsync(String path, String body, Map<String, List<String>> additionalHeaders) {
        return asyncRequest("POST", path, body, additionalHeaders);
    }
}
