package io.trackimport.lambda;

import io.trackimport.bulkload.common.BulkDispatcher;
import io.trackimport.bulkload.common.TrackClient;
import io.trackimport.bulkload.common.http.ConnectionContext;
import io.trackimport.bulkload.common.http.ReactorNettyRestClient;
import io.trackimport.pipeline.sink.BulkDispatchSink;
import io.trackimport.pipeline.sink.ObjectSink;

/**
 * Builds the sink that sends rounds to the track API, with a connection pool as wide as a round.
 */
public final class TrackSinkFactory {
    private TrackSinkFactory() {}

    public static ObjectSink create(ImportConfig config) {
        var connectionContext = new ConnectionContext(config.getApiUrl(), config.getApiKey());
        var restClient = new ReactorNettyRestClient(connectionContext, config.getThreads());
        var trackClient = new TrackClient(restClient, config.getMaxAttempts(), config.getInitialBackoff());
        return new BulkDispatchSink(new BulkDispatcher(trackClient, config.getThreads()));
    }
}
