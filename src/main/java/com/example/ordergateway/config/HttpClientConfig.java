package com.example.ordergateway.config;

import com.example.ordergateway.adapter.upstream.client.ProxyClient;
import com.example.ordergateway.properties.ApplicationProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * OkHttp client and retry policy for the upstream order service.
 *
 * The pool keeps no idle connections, so every attempt opens its own connection.
 * OkHttp's built-in connection retry is off; retries are owned by the {@link Retry} below.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class HttpClientConfig {

  public static final String UPSTREAM_RETRY_NAME = "orderService";

  @Bean(name = "upstreamOkHttpClient")
  public OkHttpClient upstreamOkHttpClient(ApplicationProperties properties) {
    Duration timeout = properties.upstream().timeout();
    log.info("Configuring order service client for {} with {} per-attempt timeout",
             properties.upstream().baseUrl(), timeout);
    return new OkHttpClient.Builder()
        .connectionPool(new ConnectionPool(0, 1, TimeUnit.MILLISECONDS))
        .protocols(List.of(Protocol.HTTP_1_1))
        .connectTimeout(timeout)
        .readTimeout(timeout)
        .writeTimeout(timeout)
        .retryOnConnectionFailure(false)
        .followRedirects(false)
        .followSslRedirects(false)
        .build();
  }

  @Bean(name = "upstreamRetry")
  @DependsOn("configurationValidator")
  public Retry upstreamRetry(ApplicationProperties properties) {
    ApplicationProperties.UpstreamProperties.RetryProperties retry = properties.upstream().retry();
    return Retry.of(UPSTREAM_RETRY_NAME, linearConnectRetry(retry.maxAttempts(), retry.baseDelay()));
  }

  /**
   * Retries connection-establishment failures only, waiting {@code baseDelay * n} after the
   * n-th failed attempt.
   */
  public static RetryConfig linearConnectRetry(int maxAttempts, Duration baseDelay) {
    long stepMillis = baseDelay.toMillis();
    return RetryConfig.custom()
        .maxAttempts(maxAttempts)
        .intervalFunction(IntervalFunction.of(baseDelay, interval -> interval + stepMillis))
        .retryOnException(ProxyClient::isConnectFailure)
        .build();
  }
}
