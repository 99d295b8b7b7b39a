package io.typedhttp.client;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.typedhttp.client.codec.EncodedInput;
import io.typedhttp.client.codec.InputEncoder;
import io.typedhttp.client.codec.ObjectMappers;
import io.typedhttp.client.http.HttpRequest;
import io.typedhttp.spec.Authorization;
import io.typedhttp.spec.AuthorizationRequirement;
import io.typedhttp.spec.ConfigurationException;
import io.typedhttp.spec.EncodingException;
import io.typedhttp.spec.Endpoint;
import io.typedhttp.spec.InputFormat;
import io.typedhttp.spec.OutputFormat;
import io.typedhttp.spec.RequestException;
import org.jspecify.annotations.Nullable;

/**
 * Combines a {@link WebService} and an {@link Endpoint} with its input into a transport-ready
 * {@link HttpRequest}.
 * <p>
 * The factory holds no state; building the same endpoint twice with the same input and the same
 * service state yields equal requests, except for the boundary of multipart bodies.
 */
public final class EndpointRequestFactory {

    static final String ACCEPT = "Accept";
    static final String CONTENT_TYPE = "Content-Type";

    /**
     * Builds the request for one invocation.
     *
     * @param service the service configuration
     * @param endpoint the endpoint to invoke
     * @param input the input, required exactly when the endpoint declares one
     * @return the request
     * @throws ConfigurationException if the URL cannot be formed, a required authorization is
     *                                missing, or the request hook or encoder hook fails
     * @throws EncodingException if the input cannot be encoded
     * @throws RequestException if a hook throws one
     */
    public HttpRequest create(WebService service, Endpoint<?, ?> endpoint, @Nullable Object input) throws RequestException {
        String description = endpoint.describe();

        URI baseUrl = service.baseUrl();
        if (baseUrl == null || !baseUrl.isAbsolute() || baseUrl.getRawAuthority() == null) {
            throw new ConfigurationException(description, "Base URL must be absolute: " + baseUrl);
        }

        EncodedInput encoded = null;
        InputFormat inputFormat = endpoint.inputFormat();
        if (inputFormat != null) {
            if (input == null) {
                throw new ConfigurationException(description, "Endpoint requires an input");
            }
            encoded = encode(service, description, inputFormat, input);
        }

        HttpRequest.Builder builder = HttpRequest.builder()
                .method(endpoint.method().asString())
                .uri(resolve(baseUrl, endpoint.path(), encoded == null ? null : encoded.query(), description));

        OutputFormat outputFormat = endpoint.outputFormat();
        if (outputFormat != null) {
            builder.header(ACCEPT, outputFormat.mediaType());
        }
        if (encoded != null && encoded.body() != null) {
            builder.body(encoded.body());
            if (encoded.contentType() != null) {
                builder.header(CONTENT_TYPE, encoded.contentType());
            }
        }

        applyAuthorization(service, endpoint.authorizationRequirement(), builder, description);

        try {
            service.configure(builder);
        } catch (RequestException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigurationException(description, "Request hook failed: " + e.getMessage(), e);
        }
        return builder.build();
    }

    private static EncodedInput encode(WebService service, String description, InputFormat format, Object input)
            throws RequestException {
        ObjectMapper mapper = ObjectMappers.forInput(format);
        try {
            service.configureEncoder(mapper);
        } catch (RequestException e) {
            throw e;
        } catch (Exception e) {
            throw new ConfigurationException(description, "Encoder hook failed: " + e.getMessage(), e);
        }
        try {
            return InputEncoder.forFormat(format).encode(input, mapper);
        } catch (IOException | IllegalArgumentException e) {
            throw new EncodingException(description, format, e);
        }
    }

    private static void applyAuthorization(WebService service, AuthorizationRequirement requirement,
                                           HttpRequest.Builder builder, String description) throws ConfigurationException {
        if (requirement == AuthorizationRequirement.NONE) {
            return;
        }
        Authorization authorization = service.authorization();
        if (authorization == null || authorization.isNone()) {
            if (requirement == AuthorizationRequirement.REQUIRED) {
                throw new ConfigurationException(description, "Endpoint requires authorization but the service has none");
            }
            return;
        }
        builder.header(authorization.headerName(), authorization.headerValue());
    }

    /**
     * Appends {@code path} to the path of {@code baseUrl} with exactly one {@code '/'} between
     * them. Queries of the base URL, the path and the encoded input are joined in that order.
     */
    static URI resolve(URI baseUrl, String path, @Nullable String inputQuery, String description)
            throws ConfigurationException {
        URI relative;
        try {
            relative = new URI(path);
        } catch (URISyntaxException e) {
            throw new ConfigurationException(description, "Invalid endpoint path: " + path, e);
        }
        if (relative.isAbsolute() || relative.getRawAuthority() != null) {
            throw new ConfigurationException(description, "Endpoint path must be relative: " + path);
        }

        String basePath = baseUrl.getRawPath() == null ? "" : baseUrl.getRawPath();
        String endpointPath = relative.getRawPath() == null ? "" : relative.getRawPath();
        while (basePath.endsWith("/")) {
            basePath = basePath.substring(0, basePath.length() - 1);
        }
        while (endpointPath.startsWith("/")) {
            endpointPath = endpointPath.substring(1);
        }

        StringBuilder url = new StringBuilder()
                .append(baseUrl.getScheme()).append("://").append(baseUrl.getRawAuthority())
                .append(basePath);
        if (!endpointPath.isEmpty()) {
            url.append('/').append(endpointPath);
        }

        String query = joinQueries(baseUrl.getRawQuery(), relative.getRawQuery(), inputQuery);
        if (query != null) {
            url.append('?').append(query);
        }
        try {
            return new URI(url.toString());
        } catch (URISyntaxException e) {
            throw new ConfigurationException(description, "Invalid request URL: " + url, e);
        }
    }

    private static @Nullable String joinQueries(@Nullable String... queries) {
        StringBuilder joined = null;
        for (String query : queries) {
            if (query == null || query.isEmpty()) {
                continue;
            }
            if (joined == null) {
                joined = new StringBuilder(query);
            } else {
                joined.append('&').append(query);
            }
        }
        return joined == null ? null : joined.toString();
    }
}
