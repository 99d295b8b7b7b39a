package io.typedhttp.spec;

import static io.typedhttp.util.Assert.checkNotBlankParam;
import static io.typedhttp.util.Assert.checkNotNullParam;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.jspecify.annotations.Nullable;

/**
 * Credentials a service attaches to outgoing requests.
 * <p>
 * <ul>
 *   <li>{@link None} - nothing is sent</li>
 *   <li>{@link Basic} - {@code Authorization: Basic base64(username:password)}</li>
 *   <li>{@link Bearer} - {@code Authorization: Bearer token}</li>
 *   <li>{@link Custom} - a caller-named header with a caller-supplied value</li>
 * </ul>
 */
public sealed interface Authorization permits Authorization.None, Authorization.Basic,
        Authorization.Bearer, Authorization.Custom {

    /** Standard authorization header name. */
    String AUTHORIZATION = "Authorization";

    static Authorization none() {
        return None.INSTANCE;
    }

    static Authorization basic(String username, String password) {
        return new Basic(username, password);
    }

    static Authorization bearer(String token) {
        return new Bearer(token);
    }

    static Authorization custom(String headerName, String value) {
        return new Custom(headerName, value);
    }

    /**
     * Returns the name of the header carrying these credentials.
     *
     * @return the header name, or {@code null} for {@link None}
     */
    @Nullable String headerName();

    /**
     * Returns the value of the header carrying these credentials.
     *
     * @return the header value, or {@code null} for {@link None}
     */
    @Nullable String headerValue();

    default boolean isNone() {
        return this instanceof None;
    }

    final class None implements Authorization {
        private static final None INSTANCE = new None();

        private None() {
        }

        @Override
        public @Nullable String headerName() {
            return null;
        }

        @Override
        public @Nullable String headerValue() {
            return null;
        }

        @Override
        public String toString() {
            return "None";
        }
    }

    record Basic(String username, String password) implements Authorization {

        public Basic {
            checkNotNullParam("username", username);
            checkNotNullParam("password", password);
        }

        @Override
        public String headerName() {
            return AUTHORIZATION;
        }

        @Override
        public String headerValue() {
            String credentials = username + ":" + password;
            return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public String toString() {
            return "Basic[username=" + username + "]";
        }
    }

    record Bearer(String token) implements Authorization {

        public Bearer {
            checkNotBlankParam("token", token);
        }

        @Override
        public String headerName() {
            return AUTHORIZATION;
        }

        @Override
        public String headerValue() {
            return "Bearer " + token;
        }

        @Override
        public String toString() {
            return "Bearer[***]";
        }
    }

    record Custom(String headerName, String value) implements Authorization {

        public Custom {
            checkNotBlankParam("headerName", headerName);
            checkNotNullParam("value", value);
        }

        @Override
        public String headerValue() {
            return value;
        }

        @Override
        public String toString() {
            return "Custom[headerName=" + headerName + "]";
        }
    }
}
