package com.sgr.runtime.common.http;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Connect and read timeouts for every outbound call: registry, prompt and
 * secret stores, builtin HTTP tools and tool servers. A store that accepts the
 * connection and never answers fails after the read timeout instead of
 * holding the caller.
 */
@Configuration
public class HttpClientConfig {

    private static final Logger log = LoggerFactory.getLogger(HttpClientConfig.class);

    private final Duration connectTimeout;
    private final Duration readTimeout;

    public HttpClientConfig(@Value("${runtime.http.connect-timeout-ms:2000}") long connectTimeoutMs,
            @Value("${runtime.http.read-timeout-ms:10000}") long readTimeoutMs) {
        this.connectTimeout = Duration.ofMillis(connectTimeoutMs);
        this.readTimeout = Duration.ofMillis(readTimeoutMs);
    }

    @Bean
    public RestClientCustomizer timeoutRestClientCustomizer() {
        log.info("Outbound HTTP timeouts: connect {} ms, read {} ms", connectTimeout.toMillis(), readTimeout.toMillis());
        return builder -> builder.requestFactory(requestFactory());
    }

    public JdkClientHttpRequestFactory requestFactory() {
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient());
        factory.setReadTimeout(readTimeout);
        return factory;
    }

    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }
}
