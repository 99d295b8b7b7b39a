package io.typedhttp.client.config;

import java.lang.reflect.Type;
import java.net.URI;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.typedhttp.client.WebService;
import io.typedhttp.client.http.HttpClient;
import io.typedhttp.client.http.HttpRequest;
import io.typedhttp.client.http.HttpResponse;
import io.typedhttp.spec.Authorization;
import io.typedhttp.spec.Endpoint;
import io.typedhttp.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * A {@link WebService} assembled from values and lambdas. Create one with
 * {@link WebServiceConfigBuilder}.
 */
public class WebServiceConfig implements WebService {

    /**
     * A hook that adjusts a per-request object.
     *
     * @param <T> the adjusted type
     */
    @FunctionalInterface
    public interface Hook<T> {
        void apply(T value) throws Exception;
    }

    /**
     * A hook that examines a response on behalf of an endpoint.
     *
     * @param <T> the examined type
     */
    @FunctionalInterface
    public interface Validator<T> {
        void validate(T value, Endpoint<?, ?> endpoint) throws Exception;
    }

    private final URI baseUrl;
    private final @Nullable Type basicResponseType;
    private final @Nullable Type errorResponseType;
    private final Supplier<Authorization> authorization;
    private final @Nullable HttpClient httpClient;
    private final @Nullable Hook<HttpRequest.Builder> requestHook;
    private final @Nullable Hook<ObjectMapper> encoderHook;
    private final @Nullable Hook<ObjectMapper> decoderHook;
    private final @Nullable Validator<HttpResponse> responseValidator;
    private final @Nullable Validator<Object> basicResponseValidator;

    WebServiceConfig(URI baseUrl, @Nullable Type basicResponseType, @Nullable Type errorResponseType,
                     Supplier<Authorization> authorization, @Nullable HttpClient httpClient,
                     @Nullable Hook<HttpRequest.Builder> requestHook, @Nullable Hook<ObjectMapper> encoderHook,
                     @Nullable Hook<ObjectMapper> decoderHook, @Nullable Validator<HttpResponse> responseValidator,
                     @Nullable Validator<Object> basicResponseValidator) {
        this.baseUrl = Assert.checkNotNullParam("baseUrl", baseUrl);
        this.basicResponseType = basicResponseType;
        this.errorResponseType = errorResponseType;
        this.authorization = Assert.checkNotNullParam("authorization", authorization);
        this.httpClient = httpClient;
        this.requestHook = requestHook;
        this.encoderHook = encoderHook;
        this.decoderHook = decoderHook;
        this.responseValidator = responseValidator;
        this.basicResponseValidator = basicResponseValidator;
    }

    @Override
    public URI baseUrl() {
        return baseUrl;
    }

    @Override
    public @Nullable Type basicResponseType() {
        return basicResponseType;
    }

    @Override
    public @Nullable Type errorResponseType() {
        return errorResponseType;
    }

    @Override
    public Authorization authorization() {
        Authorization current = authorization.get();
        return current == null ? Authorization.none() : current;
    }

    @Override
    public @Nullable HttpClient httpClient() {
        return httpClient;
    }

    @Override
    public void configure(HttpRequest.Builder request) throws Exception {
        if (requestHook != null) {
            requestHook.apply(request);
        }
    }

    @Override
    public void configureEncoder(ObjectMapper mapper) throws Exception {
        if (encoderHook != null) {
            encoderHook.apply(mapper);
        }
    }

    @Override
    public void configureDecoder(ObjectMapper mapper) throws Exception {
        if (decoderHook != null) {
            decoderHook.apply(mapper);
        }
    }

    @Override
    public void validate(HttpResponse response, Endpoint<?, ?> endpoint) throws Exception {
        if (responseValidator != null) {
            responseValidator.validate(response, endpoint);
        }
    }

    @Override
    public void validateBasicResponse(Object basicResponse, Endpoint<?, ?> endpoint) throws Exception {
        if (basicResponseValidator != null) {
            basicResponseValidator.validate(basicResponse, endpoint);
        }
    }

    @Override
    public String toString() {
        return "WebServiceConfig{baseUrl=" + baseUrl + ", authorization=" + authorization() + "}";
    }
}
