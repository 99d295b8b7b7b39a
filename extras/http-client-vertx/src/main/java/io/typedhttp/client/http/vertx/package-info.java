/**
 * {@link io.typedhttp.client.http.HttpClient} implementation on top of the Vert.x HTTP client.
 */
@NullMarked
package io.typedhttp.client.http.vertx;

import org.jspecify.annotations.NullMarked;
