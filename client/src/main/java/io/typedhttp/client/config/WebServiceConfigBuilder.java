package io.typedhttp.client.config;

import java.lang.reflect.Type;
import java.net.URI;
import java.util.function.Supplier;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.typedhttp.client.http.HttpClient;
import io.typedhttp.client.http.HttpRequest;
import io.typedhttp.client.http.HttpResponse;
import io.typedhttp.spec.Authorization;
import io.typedhttp.util.Assert;
import org.jspecify.annotations.Nullable;

public class WebServiceConfigBuilder {

    private @Nullable URI baseUrl;
    private @Nullable Type basicResponseType;
    private @Nullable Type errorResponseType;
    private Supplier<Authorization> authorization = Authorization::none;
    private @Nullable HttpClient httpClient;
    private WebServiceConfig.@Nullable Hook<HttpRequest.Builder> requestHook;
    private WebServiceConfig.@Nullable Hook<ObjectMapper> encoderHook;
    private WebServiceConfig.@Nullable Hook<ObjectMapper> decoderHook;
    private WebServiceConfig.@Nullable Validator<HttpResponse> responseValidator;
    private WebServiceConfig.@Nullable Validator<Object> basicResponseValidator;

    public WebServiceConfigBuilder baseUrl(URI baseUrl) {
        this.baseUrl = baseUrl;
        return this;
    }

    public WebServiceConfigBuilder baseUrl(String baseUrl) {
        Assert.checkNotNullParam("baseUrl", baseUrl);
        this.baseUrl = URI.create(baseUrl);
        return this;
    }

    public WebServiceConfigBuilder basicResponseType(Type basicResponseType) {
        this.basicResponseType = basicResponseType;
        return this;
    }

    public WebServiceConfigBuilder basicResponseType(TypeReference<?> basicResponseType) {
        this.basicResponseType = basicResponseType.getType();
        return this;
    }

    public WebServiceConfigBuilder errorResponseType(Type errorResponseType) {
        this.errorResponseType = errorResponseType;
        return this;
    }

    public WebServiceConfigBuilder errorResponseType(TypeReference<?> errorResponseType) {
        this.errorResponseType = errorResponseType.getType();
        return this;
    }

    public WebServiceConfigBuilder authorization(Authorization authorization) {
        Assert.checkNotNullParam("authorization", authorization);
        this.authorization = () -> authorization;
        return this;
    }

    /**
     * Supplies the authorization at request time, for credentials that change during the
     * lifetime of the service (a token obtained by logging in, for instance).
     *
     * @param authorization called once per request
     * @return this builder
     */
    public WebServiceConfigBuilder authorization(Supplier<Authorization> authorization) {
        Assert.checkNotNullParam("authorization", authorization);
        this.authorization = authorization;
        return this;
    }

    public WebServiceConfigBuilder httpClient(HttpClient httpClient) {
        this.httpClient = httpClient;
        return this;
    }

    public WebServiceConfigBuilder configureRequest(WebServiceConfig.Hook<HttpRequest.Builder> requestHook) {
        this.requestHook = requestHook;
        return this;
    }

    public WebServiceConfigBuilder configureEncoder(WebServiceConfig.Hook<ObjectMapper> encoderHook) {
        this.encoderHook = encoderHook;
        return this;
    }

    public WebServiceConfigBuilder configureDecoder(WebServiceConfig.Hook<ObjectMapper> decoderHook) {
        this.decoderHook = decoderHook;
        return this;
    }

    public WebServiceConfigBuilder validateResponse(WebServiceConfig.Validator<HttpResponse> responseValidator) {
        this.responseValidator = responseValidator;
        return this;
    }

    public WebServiceConfigBuilder validateBasicResponse(WebServiceConfig.Validator<Object> basicResponseValidator) {
        this.basicResponseValidator = basicResponseValidator;
        return this;
    }

    public WebServiceConfig build() {
        return new WebServiceConfig(Assert.checkNotNullParam("baseUrl", baseUrl), basicResponseType,
                errorResponseType, authorization, httpClient, requestHook, encoderHook, decoderHook,
                responseValidator, basicResponseValidator);
    }
}
