package io.typedhttp.client.http.vertx;

import io.typedhttp.client.http.HttpClient;
import io.typedhttp.client.http.HttpClientBuilder;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpClientOptions;
import org.jspecify.annotations.Nullable;

public class VertxHttpClientBuilder implements HttpClientBuilder {

    private @Nullable Vertx vertx;

    private @Nullable HttpClientOptions options;

    public VertxHttpClientBuilder vertx(Vertx vertx) {
        this.vertx = vertx;
        return this;
    }

    public VertxHttpClientBuilder options(HttpClientOptions options) {
        this.options = options;
        return this;
    }

    @Override
    public HttpClient create() {
        return new VertxHttpClient(
                vertx != null ? vertx : Vertx.vertx(),
                options != null ? new HttpClientOptions(options) : new HttpClientOptions());
    }
}
