/**
 * Execution of typed endpoints against a {@link io.typedhttp.client.WebService}.
 * <p>
 * {@link io.typedhttp.client.EndpointClient} is the entry point. It builds each request with
 * {@link io.typedhttp.client.EndpointRequestFactory}, sends it through an
 * {@link io.typedhttp.client.http.HttpClient} and turns the response into an
 * {@link io.typedhttp.spec.Outcome} with {@link io.typedhttp.client.ResponseInterpreter}.
 */
@NullMarked
package io.typedhttp.client;

import org.jspecify.annotations.NullMarked;
