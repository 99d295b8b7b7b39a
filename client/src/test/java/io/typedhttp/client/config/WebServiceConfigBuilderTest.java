package io.typedhttp.client.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.net.URI;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import io.typedhttp.client.http.HttpClient;
import io.typedhttp.client.http.HttpRequest;
import io.typedhttp.client.http.SimpleHttpResponse;
import io.typedhttp.spec.Authorization;
import io.typedhttp.spec.EmptyEndpoint;
import org.junit.jupiter.api.Test;

public class WebServiceConfigBuilderTest {

    record ApiError(String message) {
    }

    @Test
    public void testDefaults() throws Exception {
        WebServiceConfig config = new WebServiceConfigBuilder().baseUrl("https://api.example.com").build();

        assertEquals(URI.create("https://api.example.com"), config.baseUrl());
        assertNull(config.basicResponseType());
        assertNull(config.errorResponseType());
        assertTrue(config.authorization().isNone());
        assertNull(config.httpClient());

        HttpRequest.Builder request = HttpRequest.builder().uri(URI.create("https://api.example.com"));
        config.configure(request);
        config.validate(SimpleHttpResponse.of(500, Map.of(), null), EmptyEndpoint.builder().path("a").build());
        assertTrue(request.headers().isEmpty());
    }

    @Test
    public void testBaseUrlIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new WebServiceConfigBuilder().build());
    }

    @Test
    public void testValuesAreExposed() {
        HttpClient httpClient = mock(HttpClient.class);
        TypeReference<List<ApiError>> errors = new TypeReference<>() { };

        WebServiceConfig config = new WebServiceConfigBuilder()
                .baseUrl(URI.create("https://api.example.com/v2"))
                .errorResponseType(errors)
                .authorization(Authorization.basic("u", "p"))
                .httpClient(httpClient)
                .build();

        assertEquals(errors.getType(), config.errorResponseType());
        assertEquals(Authorization.basic("u", "p"), config.authorization());
        assertSame(httpClient, config.httpClient());
    }

    @Test
    public void testNullSuppliedAuthorizationMeansNone() {
        WebServiceConfig config = new WebServiceConfigBuilder()
                .baseUrl("https://api.example.com")
                .authorization(() -> null)
                .build();

        assertTrue(config.authorization().isNone());
    }

    @Test
    public void testToStringHidesSecrets() {
        WebServiceConfig config = new WebServiceConfigBuilder()
                .baseUrl("https://api.example.com")
                .authorization(Authorization.bearer("s3cret"))
                .build();

        assertTrue(!config.toString().contains("s3cret"), config.toString());
    }
}
