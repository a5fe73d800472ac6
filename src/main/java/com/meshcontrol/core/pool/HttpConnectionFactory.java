package com.meshcontrol.core.pool;

import com.meshcontrol.core.model.ServiceEndpoint;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Opens {@link HttpMeshConnection}s backed by a shared JDK {@link HttpClient}. The client
 * keeps its own keep-alive connections; a pooled connection bounds how many calls to one
 * endpoint run at the same time.
 */
public class HttpConnectionFactory implements ConnectionFactory {

    private final HttpClient httpClient;

    public HttpConnectionFactory(Duration connectTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build());
    }

    public HttpConnectionFactory(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public MeshConnection open(ServiceEndpoint endpoint) {
        return new HttpMeshConnection(endpoint, httpClient);
    }
}
