package io.typedhttp.client.http.jdk;

import io.typedhttp.client.http.HttpClient;
import io.typedhttp.client.http.HttpClientBuilder;

import java.time.Duration;
import java.util.concurrent.Executor;

import org.jspecify.annotations.Nullable;

/**
 * Creates transports backed by the JDK {@link java.net.http.HttpClient}.
 * <p>
 * Defaults to HTTP/2 with normal redirect handling, the JDK's default executor and no connect timeout.
 */
public class JdkHttpClientBuilder implements HttpClientBuilder {

    private java.net.http.HttpClient.Version version = java.net.http.HttpClient.Version.HTTP_2;
    private java.net.http.HttpClient.Redirect redirect = java.net.http.HttpClient.Redirect.NORMAL;
    private @Nullable Duration connectTimeout;
    private @Nullable Executor executor;

    public JdkHttpClientBuilder version(java.net.http.HttpClient.Version version) {
        this.version = version;
        return this;
    }

    public JdkHttpClientBuilder followRedirects(java.net.http.HttpClient.Redirect redirect) {
        this.redirect = redirect;
        return this;
    }

    public JdkHttpClientBuilder connectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
        return this;
    }

    public JdkHttpClientBuilder executor(Executor executor) {
        this.executor = executor;
        return this;
    }

    @Override
    public HttpClient create() {
        java.net.http.HttpClient.Builder builder = java.net.http.HttpClient.newBuilder()
                .version(version)
                .followRedirects(redirect);
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        if (executor != null) {
            builder.executor(executor);
        }
        return new JdkHttpClient(builder.build());
    }
}
