package io.typedhttp.client.http;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

/**
 * Transport that executes fully formed {@link HttpRequest}s.
 * <p>
 * The returned futures complete normally for every response that was received, whatever its
 * status code. They complete exceptionally, typically with an {@link java.io.IOException}, only
 * when no response could be obtained.
 */
public interface HttpClient {

    static HttpClient createHttpClient() {
        return HttpClientBuilder.DEFAULT_FACTORY.create();
    }

    /**
     * Sends the request and buffers the response body in memory.
     *
     * @param request the request to send
     * @param listener optional receiver of body progress events
     * @return the response
     */
    CompletableFuture<HttpResponse> send(HttpRequest request, @Nullable TransferListener listener);

    /**
     * Sends the request and streams the response body to {@code target} as it arrives.
     *
     * @param request the request to send
     * @param target the file to write the body to, created or truncated
     * @param listener optional receiver of body progress events
     * @return the response, with {@link HttpResponse#bodyFile()} set to {@code target}
     */
    CompletableFuture<HttpResponse> download(HttpRequest request, Path target, @Nullable TransferListener listener);

    default CompletableFuture<HttpResponse> send(HttpRequest request) {
        return send(request, null);
    }
}
