package io.typedhttp.client.http.jdk;

import io.typedhttp.client.http.HttpClient;
import io.typedhttp.client.http.HttpRequest;
import io.typedhttp.client.http.HttpResponse;
import io.typedhttp.client.http.SimpleHttpResponse;
import io.typedhttp.client.http.TransferListener;

import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse.BodyHandler;
import java.net.http.HttpResponse.BodyHandlers;
import java.net.http.HttpResponse.BodySubscriber;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class JdkHttpClient implements HttpClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpClient.class);

    private final java.net.http.HttpClient httpClient;

    JdkHttpClient(java.net.http.HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public CompletableFuture<HttpResponse> send(HttpRequest request, @Nullable TransferListener listener) {
        final java.net.http.HttpRequest jdkRequest;
        try {
            jdkRequest = toJdkRequest(request);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        LOGGER.debug("Sending {}", request);
        return httpClient
                .sendAsync(jdkRequest, withProgress(BodyHandlers.ofByteArray(), listener))
                .thenApply(response -> SimpleHttpResponse.of(response.statusCode(), response.headers().map(), response.body()));
    }

    @Override
    public CompletableFuture<HttpResponse> download(HttpRequest request, Path target, @Nullable TransferListener listener) {
        final java.net.http.HttpRequest jdkRequest;
        try {
            jdkRequest = toJdkRequest(request);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        LOGGER.debug("Downloading {} to {}", request, target);
        BodyHandler<Path> bodyHandler = BodyHandlers.ofFile(target,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
        return httpClient
                .sendAsync(jdkRequest, withProgress(bodyHandler, listener))
                .thenApply(response -> SimpleHttpResponse.ofFile(response.statusCode(), response.headers().map(), response.body()));
    }

    private static java.net.http.HttpRequest toJdkRequest(HttpRequest request) {
        byte[] body = request.body();
        BodyPublisher publisher = body == null ? BodyPublishers.noBody() : BodyPublishers.ofByteArray(body);

        java.net.http.HttpRequest.Builder builder = java.net.http.HttpRequest.newBuilder()
                .uri(request.uri())
                .method(request.method(), publisher);
        for (Map.Entry<String, String> headerEntry : request.headers().entrySet()) {
            builder.header(headerEntry.getKey(), headerEntry.getValue());
        }
        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }
        return builder.build();
    }

    private static <T> BodyHandler<T> withProgress(BodyHandler<T> bodyHandler, @Nullable TransferListener listener) {
        if (listener == null) {
            return bodyHandler;
        }

        return responseInfo -> {
            long total = responseInfo.headers()
                    .firstValueAsLong("Content-Length")
                    .orElse(TransferListener.UNKNOWN_LENGTH);
            return new CountingBodySubscriber<>(bodyHandler.apply(responseInfo), total, listener);
        };
    }

    private static class CountingBodySubscriber<T> implements BodySubscriber<T> {
        private final BodySubscriber<T> delegate;
        private final long total;
        private final TransferListener listener;
        private long transferred;

        CountingBodySubscriber(BodySubscriber<T> delegate, long total, TransferListener listener) {
            this.delegate = delegate;
            this.total = total;
            this.listener = listener;
        }

        @Override
        public CompletionStage<T> getBody() {
            return delegate.getBody();
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            delegate.onSubscribe(subscription);
        }

        @Override
        public void onNext(List<ByteBuffer> item) {
            long received = 0;
            for (ByteBuffer buffer : item) {
                received += buffer.remaining();
            }
            delegate.onNext(item);

            transferred += received;
            listener.onTransfer(transferred, total);
        }

        @Override
        public void onError(Throwable throwable) {
            delegate.onError(throwable);
        }

        @Override
        public void onComplete() {
            delegate.onComplete();
        }
    }
}
