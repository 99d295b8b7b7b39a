/**
 * Typed description of remote HTTP operations.
 *
 * <p>An {@link io.typedhttp.spec.Endpoint} declares the method, path, input and output shapes
 * and authorization requirement of one remote operation. It comes in four variants, depending
 * on whether the operation takes input and/or produces output:
 * <ul>
 *   <li>{@link io.typedhttp.spec.EmptyEndpoint} - no input, no output</li>
 *   <li>{@link io.typedhttp.spec.InEndpoint} - input only</li>
 *   <li>{@link io.typedhttp.spec.OutEndpoint} - output only</li>
 *   <li>{@link io.typedhttp.spec.InOutEndpoint} - input and output</li>
 * </ul>
 *
 * <p>Executing an endpoint produces an {@link io.typedhttp.spec.Outcome}, either the decoded value
 * or a {@link io.typedhttp.spec.RequestException} of one of the {@link io.typedhttp.spec.ErrorKind}s.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * InOutEndpoint<Login, Token> login = InOutEndpoint.builder(Login.class, Token.class)
 *     .method(HttpMethod.POST)
 *     .path("/login")
 *     .build();
 * }</pre>
 */
@NullMarked
package io.typedhttp.spec;

import org.jspecify.annotations.NullMarked;
