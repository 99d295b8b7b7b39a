package io.typedhttp.client;

import java.lang.reflect.Type;
import java.net.URI;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.typedhttp.client.http.HttpClient;
import io.typedhttp.client.http.HttpRequest;
import io.typedhttp.client.http.HttpResponse;
import io.typedhttp.spec.Authorization;
import io.typedhttp.spec.Endpoint;
import org.jspecify.annotations.Nullable;

/**
 * Shared configuration of a remote service: where it lives, how it authenticates, which
 * envelope and error shapes its responses use, and hooks to adjust each invocation.
 * <p>
 * Only {@link #baseUrl()} must be implemented. Hooks are invoked once per request and may throw;
 * a hook that throws a {@link io.typedhttp.spec.RequestException} fails the invocation with
 * that exception unchanged.
 *
 * @see io.typedhttp.client.config.WebServiceConfigBuilder
 */
public interface WebService {

    /**
     * Returns the absolute URL every endpoint path is resolved against.
     *
     * @return the base URL
     */
    URI baseUrl();

    /**
     * Returns the shape every response body must decode into before the status is examined,
     * or {@code null} when the service has no such envelope.
     *
     * @return the basic response type
     */
    default @Nullable Type basicResponseType() {
        return null;
    }

    /**
     * Returns the shape failure responses are decoded into, or {@code null} when the service
     * has no structured error body.
     *
     * @return the error response type
     */
    default @Nullable Type errorResponseType() {
        return null;
    }

    /**
     * Returns the credentials applied to endpoints that require or accept authorization.
     * Called once per request.
     *
     * @return the current authorization
     */
    default Authorization authorization() {
        return Authorization.none();
    }

    /**
     * Returns a transport dedicated to this service, or {@code null} to use the client's default.
     *
     * @return the transport override
     */
    default @Nullable HttpClient httpClient() {
        return null;
    }

    /**
     * Adjusts the fully built request just before it is sent.
     *
     * @param request the request builder
     * @throws Exception to abort the invocation
     */
    default void configure(HttpRequest.Builder request) throws Exception {
    }

    /**
     * Adjusts the mapper used to encode the input of one request.
     *
     * @param mapper a per-request copy of the input mapper
     * @throws Exception to abort the invocation
     */
    default void configureEncoder(ObjectMapper mapper) throws Exception {
    }

    /**
     * Adjusts the mapper used to decode the responses of one request.
     *
     * @param mapper a per-request copy of the output mapper
     * @throws Exception to abort the invocation
     */
    default void configureDecoder(ObjectMapper mapper) throws Exception {
    }

    /**
     * Examines the raw response before anything is decoded.
     *
     * @param response the received response
     * @param endpoint the endpoint that was invoked
     * @throws Exception to reject the response
     */
    default void validate(HttpResponse response, Endpoint<?, ?> endpoint) throws Exception {
    }

    /**
     * Examines the decoded basic response. Only called when {@link #basicResponseType()} is set.
     *
     * @param basicResponse the decoded envelope
     * @param endpoint the endpoint that was invoked
     * @throws Exception to reject the response
     */
    default void validateBasicResponse(Object basicResponse, Endpoint<?, ?> endpoint) throws Exception {
    }
}
