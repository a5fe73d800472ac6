package com.meshcontrol.core.health;

import com.meshcontrol.core.error.HealthCheckException;
import com.meshcontrol.core.model.ServiceEndpoint;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * Probes an endpoint with an HTTP GET on its health-check path. Any 2xx answer is healthy.
 */
public class HttpHealthProbe implements HealthProbe {

    private final HttpClient httpClient;

    public HttpHealthProbe(Duration connectTimeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build());
    }

    public HttpHealthProbe(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public boolean probe(ServiceEndpoint endpoint, Duration timeout) {
        String url = endpoint.healthCheckUrl();
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new HealthCheckException(endpoint.endpointId(), "Invalid health-check URL " + url, e);
        }
        try {
            HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() >= 200 && response.statusCode() < 300;
        } catch (HttpTimeoutException e) {
            throw new HealthCheckException(endpoint.endpointId(), "Timed out after " + timeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new HealthCheckException(endpoint.endpointId(), e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HealthCheckException(endpoint.endpointId(), "Interrupted", e);
        }
    }
}
