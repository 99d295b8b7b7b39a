package io.typedhttp.client;

import io.typedhttp.client.http.HttpClient;
import io.typedhttp.client.http.HttpClientBuilder;
import io.typedhttp.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Builds an {@link EndpointClient}.
 * <p>
 * The transport is chosen in this order: the client set with {@link #httpClient(HttpClient)}, a
 * client created by the builder set with {@link #httpClientBuilder(HttpClientBuilder)}, the
 * service's own {@link WebService#httpClient()}, and finally {@link HttpClientBuilder#DEFAULT_FACTORY}.
 */
public class EndpointClientBuilder {

    private final WebService service;
    private @Nullable HttpClient httpClient;
    private @Nullable HttpClientBuilder httpClientBuilder;

    EndpointClientBuilder(WebService service) {
        this.service = Assert.checkNotNullParam("service", service);
    }

    public EndpointClientBuilder httpClient(HttpClient httpClient) {
        Assert.checkNotNullParam("httpClient", httpClient);
        this.httpClient = httpClient;
        return this;
    }

    public EndpointClientBuilder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
        Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        this.httpClientBuilder = httpClientBuilder;
        return this;
    }

    public EndpointClient build() {
        return new EndpointClient(service, selectHttpClient());
    }

    private HttpClient selectHttpClient() {
        if (httpClient != null) {
            return httpClient;
        }
        if (httpClientBuilder != null) {
            return httpClientBuilder.create();
        }
        HttpClient serviceClient = service.httpClient();
        if (serviceClient != null) {
            return serviceClient;
        }
        return HttpClientBuilder.DEFAULT_FACTORY.create();
    }
}
