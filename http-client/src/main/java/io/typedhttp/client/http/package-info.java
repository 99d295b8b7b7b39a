/**
 * Transport abstraction used to execute typed endpoints.
 *
 * <p>This package provides a pluggable HTTP client abstraction. The endpoint pipeline builds a
 * complete {@link io.typedhttp.client.http.HttpRequest} and hands it to an
 * {@link io.typedhttp.client.http.HttpClient}, either to buffer the response body in memory or to
 * stream it to a file.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.typedhttp.client.http.HttpClient} - the transport interface</li>
 *   <li>{@link io.typedhttp.client.http.HttpClientBuilder} - factory for transport instances</li>
 *   <li>{@link io.typedhttp.client.http.HttpRequest} - immutable request with a mutable builder</li>
 *   <li>{@link io.typedhttp.client.http.HttpResponse} - status, headers and body</li>
 *   <li>{@link io.typedhttp.client.http.TransferListener} - byte-level body progress</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link io.typedhttp.client.http.jdk.JdkHttpClientBuilder} - default, based on the JDK 11+ HttpClient</li>
 *   <li>VertxHttpClientBuilder - Vert.x based implementation from the http-client-vertx module</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClient client = HttpClient.createHttpClient();
 * HttpResponse response = client.send(HttpRequest.builder()
 *         .method("GET")
 *         .uri(URI.create("http://localhost:9999/status"))
 *         .header("Accept", "application/json")
 *         .build())
 *     .get();
 * }</pre>
 */
@NullMarked
package io.typedhttp.client.http;

import org.jspecify.annotations.NullMarked;
