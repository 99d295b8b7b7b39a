package io.typedhttp.client.http;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * The status, headers and body of an HTTP response.
 * <p>
 * A response produced by {@link HttpClient#download} has its body in {@link #bodyFile()} and an
 * empty {@link #body()}.
 */
public interface HttpResponse {

    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    Map<String, List<String>> headers();

    default Optional<String> firstHeader(String name) {
        for (Map.Entry<String, List<String>> entry : headers().entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name) && !entry.getValue().isEmpty()) {
                return Optional.of(entry.getValue().get(0));
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the buffered response body.
     *
     * @return the body bytes, empty when there was no body or the body was written to a file
     */
    byte[] body();

    /**
     * Returns the file the body was streamed to.
     *
     * @return the file, or {@code null} if the body was buffered in memory
     */
    @Nullable Path bodyFile();
}
