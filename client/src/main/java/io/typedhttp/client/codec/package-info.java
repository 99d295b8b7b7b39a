/**
 * Encoding of endpoint inputs and decoding of response bodies.
 */
@NullMarked
package io.typedhttp.client.codec;

import org.jspecify.annotations.NullMarked;
