package io.typedhttp.client.http;

import static io.typedhttp.util.Assert.checkNotNullParam;

import java.net.URI;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * A fully formed, transport-ready HTTP request.
 * <p>
 * Instances are immutable. Use {@link #builder()} or {@link #toBuilder()} to create or adjust one.
 * Header names are matched case-insensitively; the insertion order of headers is preserved.
 */
public final class HttpRequest {

    private final String method;
    private final URI uri;
    private final Map<String, String> headers;
    private final byte @Nullable [] body;
    private final @Nullable Duration timeout;

    private HttpRequest(Builder builder) {
        this.method = checkNotNullParam("method", builder.method);
        this.uri = checkNotNullParam("uri", builder.uri);
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.body = builder.body == null ? null : builder.body.clone();
        this.timeout = builder.timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    /**
     * Returns the request headers in insertion order.
     *
     * @return an unmodifiable map of header names to values
     */
    public Map<String, String> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    /**
     * Returns a copy of the request body.
     *
     * @return the body bytes, or {@code null} if the request has no body
     */
    public byte @Nullable [] body() {
        return body == null ? null : body.clone();
    }

    public @Nullable Duration timeout() {
        return timeout;
    }

    public Builder toBuilder() {
        return new Builder()
                .method(method)
                .uri(uri)
                .headers(headers)
                .body(body)
                .timeout(timeout);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HttpRequest that = (HttpRequest) o;
        return method.equals(that.method)
                && uri.equals(that.uri)
                && headers.equals(that.headers)
                && Arrays.equals(body, that.body)
                && Objects.equals(timeout, that.timeout);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(method, uri, headers, timeout);
        return 31 * result + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }

    public static class Builder {
        private String method = "GET";
        private @Nullable URI uri;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private byte @Nullable [] body;
        private @Nullable Duration timeout;

        public Builder method(String method) {
            this.method = checkNotNullParam("method", method);
            return this;
        }

        public Builder uri(URI uri) {
            this.uri = checkNotNullParam("uri", uri);
            return this;
        }

        public @Nullable URI uri() {
            return uri;
        }

        /**
         * Sets a header, replacing any existing header with the same name regardless of case.
         *
         * @param name the header name
         * @param value the header value
         * @return this builder for chaining
         */
        public Builder header(String name, String value) {
            checkNotNullParam("name", name);
            checkNotNullParam("value", value);
            removeHeader(name);
            headers.put(name, value);
            return this;
        }

        public Builder headers(@Nullable Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    header(entry.getKey(), entry.getValue());
                }
            }
            return this;
        }

        public Builder removeHeader(String name) {
            Iterator<String> names = headers.keySet().iterator();
            while (names.hasNext()) {
                if (names.next().equalsIgnoreCase(name)) {
                    names.remove();
                }
            }
            return this;
        }

        public Map<String, String> headers() {
            return Collections.unmodifiableMap(headers);
        }

        public Builder body(byte @Nullable [] body) {
            this.body = body;
            return this;
        }

        public Builder timeout(@Nullable Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public HttpRequest build() {
            return new HttpRequest(this);
        }
    }
}
