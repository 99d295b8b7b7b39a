package io.typedhttp.spec;

import org.jspecify.annotations.Nullable;

/**
 * The transport never produced a response.
 */
public class ConnectivityException extends RequestException {

    public ConnectivityException(@Nullable String endpoint, Throwable cause) {
        super(endpoint, "Request failed before a response was received: " + cause, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONNECTIVITY;
    }
}
