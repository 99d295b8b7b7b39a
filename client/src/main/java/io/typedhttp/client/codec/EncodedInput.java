package io.typedhttp.client.codec;

import org.jspecify.annotations.Nullable;

/**
 * The wire form of an endpoint input: a request body with its content type, or a query string.
 *
 * @param body the request body, {@code null} for query-encoded input
 * @param contentType the body's media type, {@code null} when there is no body
 * @param query the raw (already escaped) query string without {@code '?'}, {@code null} for body-encoded input
 */
public record EncodedInput(byte @Nullable [] body, @Nullable String contentType, @Nullable String query) {

    public static EncodedInput body(byte[] body, String contentType) {
        return new EncodedInput(body, contentType, null);
    }

    public static EncodedInput query(String query) {
        return new EncodedInput(null, null, query);
    }
}
