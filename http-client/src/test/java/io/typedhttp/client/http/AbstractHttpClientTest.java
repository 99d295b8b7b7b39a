package io.typedhttp.client.http;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.HttpURLConnection;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every {@link HttpClient} implementation must show. Implementations run it by extending
 * this class and providing their {@link HttpClientBuilder}.
 */
public abstract class AbstractHttpClientTest {

    private static final String STATUS_BODY = "{\"status\":\"ok\"}";

    private WireMockServer server;

    @TempDir
    Path tempDir;

    @BeforeEach
    public void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();

        configureFor("localhost", server.port());
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    protected abstract HttpClientBuilder getHttpClientBuilder();

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.port() + path);
    }

    private HttpResponse send(HttpRequest request) throws Exception {
        return getHttpClientBuilder()
                .create()
                .send(request)
                .get(5, TimeUnit.SECONDS);
    }

    @Test
    public void testGetWithBodyResponse() throws Exception {
        givenThat(get(urlPathEqualTo("/status"))
                .willReturn(okForContentType("application/json", STATUS_BODY)));

        HttpResponse response = send(HttpRequest.builder()
                .uri(uri("/status"))
                .header("Accept", "application/json")
                .build());

        assertEquals(200, response.statusCode());
        assertTrue(response.success());
        assertEquals(STATUS_BODY, new String(response.body(), StandardCharsets.UTF_8));
        assertEquals("application/json", response.firstHeader("content-type").orElseThrow());
        assertNull(response.bodyFile());

        verify(getRequestedFor(urlEqualTo("/status"))
                .withHeader("Accept", equalTo("application/json")));
    }

    @Test
    public void testPostSendsHeadersAndBody() throws Exception {
        givenThat(post(urlPathEqualTo("/login"))
                .willReturn(okForContentType("application/json", "{\"token\":\"abc\"}")));

        HttpResponse response = send(HttpRequest.builder()
                .method("POST")
                .uri(uri("/login"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer xyz")
                .body("{\"username\":\"u\",\"password\":\"p\"}".getBytes(StandardCharsets.UTF_8))
                .build());

        assertEquals(200, response.statusCode());
        assertEquals("{\"token\":\"abc\"}", new String(response.body(), StandardCharsets.UTF_8));

        verify(postRequestedFor(urlEqualTo("/login"))
                .withHeader("Content-Type", equalTo("application/json"))
                .withHeader("Authorization", equalTo("Bearer xyz"))
                .withRequestBody(equalToJson("{\"username\":\"u\",\"password\":\"p\"}")));
    }

    @Test
    public void testPatchAndDeleteMethods() throws Exception {
        givenThat(patch(urlPathEqualTo("/items/1")).willReturn(aResponse().withStatus(204)));
        givenThat(delete(urlPathEqualTo("/items/1")).willReturn(aResponse().withStatus(204)));

        HttpResponse patched = send(HttpRequest.builder()
                .method("PATCH")
                .uri(uri("/items/1"))
                .body("{\"name\":\"n\"}".getBytes(StandardCharsets.UTF_8))
                .build());
        HttpResponse deleted = send(HttpRequest.builder()
                .method("DELETE")
                .uri(uri("/items/1"))
                .build());

        assertEquals(204, patched.statusCode());
        assertEquals(204, deleted.statusCode());
        assertEquals(0, deleted.body().length);

        verify(patchRequestedFor(urlEqualTo("/items/1")).withRequestBody(equalTo("{\"name\":\"n\"}")));
        verify(deleteRequestedFor(urlEqualTo("/items/1")));
    }

    @Test
    public void testFailureStatusIsAResponse() throws Exception {
        givenThat(post(urlPathEqualTo("/login"))
                .willReturn(aResponse()
                        .withStatus(HttpURLConnection.HTTP_UNAUTHORIZED)
                        .withBody("{\"message\":\"bad credentials\"}")));

        HttpResponse response = send(HttpRequest.builder()
                .method("POST")
                .uri(uri("/login"))
                .body(new byte[0])
                .build());

        assertEquals(401, response.statusCode());
        assertFalse(response.success());
        assertEquals("{\"message\":\"bad credentials\"}", new String(response.body(), StandardCharsets.UTF_8));
    }

    @Test
    public void testConnectionFailureCompletesExceptionally() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        HttpRequest request = HttpRequest.builder()
                .uri(URI.create("http://localhost:" + closedPort + "/status"))
                .build();

        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> getHttpClientBuilder().create().send(request).get(5, TimeUnit.SECONDS));
        assertIOFailure(thrown);
    }

    @Test
    public void testDownloadStreamsBodyToFile() throws Exception {
        byte[] payload = new byte[512 * 1024];
        new Random(42).nextBytes(payload);
        givenThat(get(urlPathEqualTo("/file"))
                .willReturn(aResponse()
                        .withStatus(200)
                        .withHeader("Content-Type", "application/octet-stream")
                        .withBody(payload)));

        List<long[]> events = Collections.synchronizedList(new ArrayList<>());
        Path target = tempDir.resolve("download.bin");

        HttpResponse response = getHttpClientBuilder()
                .create()
                .download(HttpRequest.builder().uri(uri("/file")).build(), target,
                        (transferred, total) -> events.add(new long[]{transferred, total}))
                .get(10, TimeUnit.SECONDS);

        assertEquals(200, response.statusCode());
        assertEquals(target, response.bodyFile());
        assertEquals(0, response.body().length);
        assertArrayEquals(payload, Files.readAllBytes(target));

        assertFalse(events.isEmpty());
        long previous = 0;
        for (long[] event : events) {
            assertTrue(event[0] >= previous);
            assertTrue(event[1] == payload.length || event[1] == TransferListener.UNKNOWN_LENGTH);
            previous = event[0];
        }
        assertEquals(payload.length, previous);
    }

    @Test
    public void testSendReportsProgress() throws Exception {
        givenThat(get(urlPathEqualTo("/status"))
                .willReturn(okForContentType("application/json", STATUS_BODY)));

        List<Long> transferred = Collections.synchronizedList(new ArrayList<>());
        HttpResponse response = getHttpClientBuilder()
                .create()
                .send(HttpRequest.builder().uri(uri("/status")).build(),
                        (bytes, total) -> transferred.add(bytes))
                .get(5, TimeUnit.SECONDS);

        assertEquals(200, response.statusCode());
        assertFalse(transferred.isEmpty());
        assertEquals(STATUS_BODY.length(), transferred.get(transferred.size() - 1));
    }

    @Test
    public void testDownloadOfFailureStatusStillWritesBody() throws Exception {
        givenThat(get(urlPathEqualTo("/file"))
                .willReturn(aResponse().withStatus(404).withBody("missing")));

        Path target = tempDir.resolve("missing.bin");
        HttpResponse response = getHttpClientBuilder()
                .create()
                .download(HttpRequest.builder().uri(uri("/file")).build(), target, null)
                .get(5, TimeUnit.SECONDS);

        assertEquals(404, response.statusCode());
        assertEquals("missing", Files.readString(target));
    }

    @Test
    public void testDownloadToUnwritableTargetFails() throws Exception {
        givenThat(get(urlPathEqualTo("/file"))
                .willReturn(aResponse().withStatus(200).withBody("content")));

        Path target = tempDir.resolve("no-such-directory").resolve("download.bin");

        ExecutionException thrown = assertThrows(ExecutionException.class, () -> getHttpClientBuilder()
                .create()
                .download(HttpRequest.builder().uri(uri("/file")).build(), target, null)
                .get(5, TimeUnit.SECONDS));

        assertIOFailure(thrown);
        assertFalse(Files.exists(target));
    }

    protected static void assertIOFailure(Throwable throwable) {
        Throwable cause = throwable;
        while (cause instanceof CompletionException || cause instanceof ExecutionException
                || cause instanceof UncheckedIOException) {
            cause = cause.getCause();
        }
        assertInstanceOf(IOException.class, cause);
    }
}
