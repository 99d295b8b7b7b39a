package io.typedhttp.client.http.vertx;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import io.typedhttp.client.http.HttpClient;
import io.typedhttp.client.http.HttpRequest;
import io.typedhttp.client.http.HttpResponse;
import io.typedhttp.client.http.SimpleHttpResponse;
import io.typedhttp.client.http.TransferListener;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.AsyncFile;
import io.vertx.core.file.OpenOptions;
import io.vertx.core.http.HttpClientOptions;
import io.vertx.core.http.HttpClientRequest;
import io.vertx.core.http.HttpClientResponse;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport backed by a Vert.x {@link io.vertx.core.http.HttpClient}. Response handling runs on
 * the Vert.x event loop, so transfer listeners and the returned futures complete there.
 */
public class VertxHttpClient implements HttpClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(VertxHttpClient.class);

    private static final String CONTENT_LENGTH = "Content-Length";

    private final io.vertx.core.http.HttpClient client;

    private final Vertx vertx;

    VertxHttpClient(Vertx vertx, HttpClientOptions options) {
        this.vertx = vertx;
        this.client = vertx.createHttpClient(options);
    }

    @Override
    public CompletableFuture<HttpResponse> send(HttpRequest request, @Nullable TransferListener listener) {
        LOGGER.debug("Sending {}", request.uri());
        Promise<HttpResponse> promise = Promise.promise();
        sendRequest(request)
                .onSuccess(response -> {
                    Buffer body = Buffer.buffer();
                    long total = contentLength(response);
                    response.handler(chunk -> {
                        body.appendBuffer(chunk);
                        notifyListener(listener, body.length(), total);
                    });
                    response.exceptionHandler(t -> promise.tryFail(asIOException(t)));
                    response.endHandler(v -> promise.tryComplete(
                            SimpleHttpResponse.of(response.statusCode(), headers(response), body.getBytes())));
                })
                .onFailure(t -> promise.tryFail(asIOException(t)));
        return promise.future().toCompletionStage().toCompletableFuture();
    }

    @Override
    public CompletableFuture<HttpResponse> download(HttpRequest request, Path target, @Nullable TransferListener listener) {
        LOGGER.debug("Downloading {} to {}", request.uri(), target);
        Promise<HttpResponse> promise = Promise.promise();
        OpenOptions openOptions = new OpenOptions().setWrite(true).setCreate(true).setTruncateExisting(true);
        vertx.fileSystem().open(target.toString(), openOptions)
                .onFailure(t -> promise.tryFail(asIOException(t)))
                .onSuccess(file -> sendRequest(request)
                        .onSuccess(response -> streamToFile(response, file, target, listener, promise))
                        .onFailure(t -> {
                            file.close();
                            promise.tryFail(asIOException(t));
                        }));
        return promise.future().toCompletionStage().toCompletableFuture();
    }

    /**
     * Copies the response body into {@code file}. The promise fails on the first failed write and
     * later chunks are dropped.
     */
    static void streamToFile(HttpClientResponse response, AsyncFile file, Path target,
                             @Nullable TransferListener listener, Promise<HttpResponse> promise) {
        long total = contentLength(response);
        long[] received = {0};
        file.exceptionHandler(t -> failDownload(file, target, promise, t));
        response.handler(chunk -> {
            if (promise.future().isComplete()) {
                return;
            }
            file.write(chunk).onFailure(t -> failDownload(file, target, promise, t));
            received[0] += chunk.length();
            notifyListener(listener, received[0], total);
            if (file.writeQueueFull()) {
                response.pause();
                file.drainHandler(v -> response.resume());
            }
        });
        response.exceptionHandler(t -> file.close().onComplete(ignored -> promise.tryFail(asIOException(t))));
        response.endHandler(v -> {
            if (promise.future().isComplete()) {
                return;
            }
            file.close()
                    .onSuccess(ignored -> promise.tryComplete(
                            SimpleHttpResponse.ofFile(response.statusCode(), headers(response), target)))
                    .onFailure(t -> promise.tryFail(asIOException(t)));
        });
    }

    private static void failDownload(AsyncFile file, Path target, Promise<HttpResponse> promise, Throwable t) {
        if (promise.tryFail(asIOException(t))) {
            LOGGER.debug("Writing {} failed", target, t);
            file.close();
        }
    }

    private Future<HttpClientResponse> sendRequest(HttpRequest request) {
        RequestOptions options = new RequestOptions()
                .setMethod(HttpMethod.valueOf(request.method()))
                .setAbsoluteURI(request.uri().toString());
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            options.putHeader(header.getKey(), header.getValue());
        }
        if (request.timeout() != null) {
            options.setIdleTimeout(request.timeout().toMillis());
        }
        byte[] body = request.body();
        return client.request(options)
                .compose((HttpClientRequest clientRequest) -> body == null
                        ? clientRequest.send()
                        : clientRequest.send(Buffer.buffer(body)));
    }

    private static void notifyListener(@Nullable TransferListener listener, long transferred, long total) {
        if (listener != null) {
            listener.onTransfer(transferred, total);
        }
    }

    private static long contentLength(HttpClientResponse response) {
        String value = response.getHeader(CONTENT_LENGTH);
        if (value == null) {
            return TransferListener.UNKNOWN_LENGTH;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            return TransferListener.UNKNOWN_LENGTH;
        }
    }

    private static Map<String, List<String>> headers(HttpClientResponse response) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : response.headers().names()) {
            headers.put(name, new ArrayList<>(response.headers().getAll(name)));
        }
        return headers;
    }

    private static IOException asIOException(Throwable t) {
        return t instanceof IOException io ? io : new IOException(t.getMessage(), t);
    }
}
