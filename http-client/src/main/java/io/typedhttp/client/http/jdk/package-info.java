@NullMarked
package io.typedhttp.client.http.jdk;

import org.jspecify.annotations.NullMarked;
