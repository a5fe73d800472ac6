package com.meshcontrol.core.pool;

import com.meshcontrol.core.model.ServiceEndpoint;
import com.meshcontrol.core.model.ServiceRequest;
import com.meshcontrol.core.model.ServiceResponse;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Sends a {@link ServiceRequest} as an HTTP call over an {@link HttpMeshConnection}.
 */
public class HttpTransport implements MeshTransport {

    /** Headers the JDK client sets itself and refuses from callers. */
    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("connection", "content-length", "expect", "host", "upgrade");

    @Override
    public ServiceResponse execute(MeshConnection connection, ServiceRequest request) throws IOException {
        if (!(connection instanceof HttpMeshConnection http)) {
            throw new IllegalArgumentException("HttpTransport needs an HttpMeshConnection, got "
                    + connection.getClass().getSimpleName());
        }
        ServiceEndpoint endpoint = connection.endpoint();
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(endpoint.url() + request.path()))
                .timeout(request.timeout())
                .method(request.method(), request.body() == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(request.body()));
        request.headers().forEach((name, value) -> {
            if (!RESTRICTED_HEADERS.contains(name.toLowerCase())) {
                builder.header(name, value);
            }
        });

        long start = System.currentTimeMillis();
        HttpResponse<String> response;
        try {
            response = http.httpClient().send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Call to " + endpoint.endpointId() + " interrupted");
        }
        long elapsed = System.currentTimeMillis() - start;

        Map<String, String> headers = new LinkedHashMap<>();
        response.headers().map().forEach((name, values) -> headers.put(name, String.join(",", values)));
        String error = response.statusCode() >= 400 ? "HTTP " + response.statusCode() : null;
        return new ServiceResponse(request.requestId(), endpoint.serviceId(), endpoint.endpointId(),
                response.statusCode(), headers, response.body(), elapsed, error);
    }
}
