@NullMarked
package io.typedhttp.client.config;

import org.jspecify.annotations.NullMarked;
