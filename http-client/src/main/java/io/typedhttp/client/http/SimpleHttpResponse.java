package io.typedhttp.client.http;

import static io.typedhttp.util.Assert.checkNotNullParam;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * Immutable {@link HttpResponse} used by the bundled transports.
 *
 * @param statusCode the HTTP status code
 * @param headers the response headers
 * @param body the buffered body, empty for file-backed responses
 * @param bodyFile the file holding the body, or {@code null} for buffered responses
 */
public record SimpleHttpResponse(int statusCode, Map<String, List<String>> headers, byte[] body,
                                 @Nullable Path bodyFile) implements HttpResponse {

    private static final byte[] EMPTY = new byte[0];

    public SimpleHttpResponse {
        headers = Map.copyOf(checkNotNullParam("headers", headers));
        checkNotNullParam("body", body);
    }

    public static SimpleHttpResponse of(int statusCode, Map<String, List<String>> headers, byte @Nullable [] body) {
        return new SimpleHttpResponse(statusCode, headers, body == null ? EMPTY : body, null);
    }

    public static SimpleHttpResponse ofFile(int statusCode, Map<String, List<String>> headers, Path bodyFile) {
        return new SimpleHttpResponse(statusCode, headers, EMPTY, checkNotNullParam("bodyFile", bodyFile));
    }

    @Override
    public String toString() {
        return "SimpleHttpResponse[statusCode=" + statusCode
                + (bodyFile != null ? ", bodyFile=" + bodyFile : ", bodyLength=" + body.length) + "]";
    }
}
