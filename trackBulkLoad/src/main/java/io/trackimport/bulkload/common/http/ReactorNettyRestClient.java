package io.trackimport.bulkload.common.http;

import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.netty.tcp.SslProvider;

/**
 * Implementation of RestClient using Reactor Netty.
 */
public class ReactorNettyRestClient extends AbstractRestClient {

    public ReactorNettyRestClient(ConnectionContext connectionContext) {
        this(connectionContext, 0);
    }

    /**
     * @param maxConnections If &gt; 0, the connection pool is capped at this many connections.
     *                       Otherwise the Reactor Netty defaults apply.
     */
    public ReactorNettyRestClient(ConnectionContext connectionContext, int maxConnections) {
        super(connectionContext, createAdapter(connectionContext, maxConnections));
    }

    private static ReactorNettyAdapter createAdapter(ConnectionContext connectionContext, int maxConnections) {
        HttpClient httpClient = maxConnections <= 0
            ? HttpClient.create()
            : HttpClient.create(ConnectionProvider.create("TrackRestClient", maxConnections));

        if (ConnectionContext.Protocol.HTTPS.equals(connectionContext.getProtocol())) {
            httpClient = httpClient.secure(SslProvider.defaultClientProvider());
        }

        httpClient = httpClient
            .baseUrl(connectionContext.getUri().toString())
            .keepAlive(true);

        return new ReactorNettyAdapter(httpClient);
    }
}
