package io.trackimport.bulkload.common.http;

import java.net.URI;
import java.net.URISyntaxException;

import lombok.Getter;
import lombok.ToString;

/**
 * Where to reach the remote track API: base URL and API key.
 * Passed explicitly into each client so that several configurations can coexist.
 */
@Getter
@ToString(exclude = "apiKey")
public class ConnectionContext {
    public enum Protocol {
        HTTP,
        HTTPS
    }

    private final URI uri;
    private final Protocol protocol;
    private final String apiKey;

    public ConnectionContext(String url, String apiKey) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("API URL must be provided");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("API key must be provided");
        }
        try {
            this.uri = new URI(url.endsWith("/") ? url.substring(0, url.length() - 1) : url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid API URL: " + url, e);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("API URL has no host: " + url);
        }

        String scheme = uri.getScheme();
        if ("http".equalsIgnoreCase(scheme)) {
            this.protocol = Protocol.HTTP;
        } else if ("https".equalsIgnoreCase(scheme)) {
            this.protocol = Protocol.HTTPS;
        } else {
            throw new IllegalArgumentException("API URL must use http or https: " + url);
        }
        this.apiKey = apiKey;
    }
}
