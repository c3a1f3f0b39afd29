package io.trackimport.bulkload.common.http;

import java.util.Map;

public record HttpResponse(
    int statusCode,
    String statusText,
    Map<String, String> headers,
    String body
) {
    @Override
    public String toString() {
        return "HttpResponse{statusCode=" + statusCode + ", statusText='" + statusText + "', body='" + body + "'}";
    }
}
