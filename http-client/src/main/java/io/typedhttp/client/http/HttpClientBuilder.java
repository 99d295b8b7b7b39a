package io.typedhttp.client.http;

import io.typedhttp.client.http.jdk.JdkHttpClientBuilder;

public interface HttpClientBuilder {

    HttpClientBuilder DEFAULT_FACTORY = new JdkHttpClientBuilder();

    HttpClient create();
}
