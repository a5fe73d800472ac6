package com.meshcontrol.core.pool;

import com.meshcontrol.core.model.ServiceEndpoint;

import java.net.http.HttpClient;

public class HttpMeshConnection implements MeshConnection {

    private final ServiceEndpoint endpoint;
    private final HttpClient httpClient;
    private volatile boolean open = true;

    HttpMeshConnection(ServiceEndpoint endpoint, HttpClient httpClient) {
        this.endpoint = endpoint;
        this.httpClient = httpClient;
    }

    @Override
    public ServiceEndpoint endpoint() {
        return endpoint;
    }

    public HttpClient httpClient() {
        return httpClient;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        open = false;
    }
}
