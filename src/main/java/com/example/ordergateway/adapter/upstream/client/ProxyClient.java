package com.example.ordergateway.adapter.upstream.client;

import com.example.ordergateway.adapter.upstream.dto.ForwardResult;
import com.example.ordergateway.adapter.upstream.dto.UpstreamResponse;
import com.example.ordergateway.adapter.upstream.dto.UpstreamUnavailable;
import com.example.ordergateway.properties.ApplicationProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Forwards calls to the order service.
 *
 * Only failures to establish a connection are retried. Any reply that arrives, 4xx and 5xx
 * included, ends the call and is handed back untouched for the caller to interpret.
 */
@Slf4j
@Component
public class ProxyClient {

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final String CONTENT_TYPE = "Content-Type";

  private final OkHttpClient httpClient;
  private final Retry retry;
  private final ObjectMapper objectMapper;
  private final HttpUrl baseUrl;

  @Autowired
  public ProxyClient(
      @Qualifier("upstreamOkHttpClient") OkHttpClient httpClient,
      @Qualifier("upstreamRetry") Retry retry,
      ObjectMapper objectMapper,
      ApplicationProperties properties) {
    this(httpClient, retry, objectMapper, properties.upstream().baseUrl());
  }

  public ProxyClient(OkHttpClient httpClient, Retry retry, ObjectMapper objectMapper, String baseUrl) {
    this.httpClient = httpClient;
    this.retry = retry;
    this.objectMapper = objectMapper;
    this.baseUrl = HttpUrl.get(baseUrl);

    retry.getEventPublisher().onRetry(event -> log.warn(
        "Order service connection failed (attempt {}), retrying in {} ms: {}",
        event.getNumberOfRetryAttempts(),
        event.getWaitInterval().toMillis(),
        describe(event.getLastThrowable())));
  }

  /**
   * @param method      HTTP method
   * @param encodedPath path relative to the base URL, already percent-encoded
   * @param body        object serialized as the JSON request body, or null for none
   */
  public ForwardResult forward(HttpMethod method, String encodedPath, Object body) {
    Request request = buildRequest(method, encodedPath, body);
    AtomicInteger attempts = new AtomicInteger();

    try {
      return retry.executeCheckedSupplier(() -> {
        attempts.incrementAndGet();
        return execute(request);
      });
    } catch (IOException e) {
      String reason = describe(e);
      log.warn("Order service unavailable for {} {} after {} attempt(s): {}",
               method.name(), request.url().encodedPath(), attempts.get(), reason);
      return new UpstreamUnavailable(reason, attempts.get());
    } catch (RuntimeException | Error e) {
      throw e;
    } catch (Throwable t) {
      throw new IllegalStateException("Unexpected failure forwarding to order service", t);
    }
  }

  /**
   * Connection refused, unreachable or unresolvable host, and connect timeouts.
   * Failures after the connection is up (e.g. read timeouts) are not included.
   */
  public static boolean isConnectFailure(Throwable throwable) {
    if (throwable instanceof ConnectException
        || throwable instanceof NoRouteToHostException
        || throwable instanceof UnknownHostException) {
      return true;
    }
    if (throwable instanceof SocketTimeoutException) {
      String message = throwable.getMessage();
      return message != null && message.toLowerCase(Locale.ROOT).contains("connect");
    }
    return false;
  }

  private UpstreamResponse execute(Request request) throws IOException {
    try (Response response = httpClient.newCall(request).execute()) {
      ResponseBody responseBody = response.body();
      String payload = responseBody != null ? responseBody.string() : "";
      return new UpstreamResponse(response.code(), payload, response.header(CONTENT_TYPE));
    }
  }

  private Request buildRequest(HttpMethod method, String encodedPath, Object body) {
    HttpUrl url = baseUrl.newBuilder()
        .addEncodedPathSegments(stripLeadingSlash(encodedPath))
        .build();

    RequestBody requestBody = null;
    if (body != null) {
      requestBody = RequestBody.create(toJson(body), JSON);
    } else if (HttpMethod.POST.equals(method) || HttpMethod.PUT.equals(method) || HttpMethod.PATCH.equals(method)) {
      requestBody = RequestBody.create(new byte[0]);
    }

    return new Request.Builder()
        .url(url)
        .header("Connection", "close")
        .header("Accept", "application/json")
        .method(method.name(), requestBody)
        .build();
  }

  private String toJson(Object body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Request body is not serializable", e);
    }
  }

  private static String stripLeadingSlash(String path) {
    return path.startsWith("/") ? path.substring(1) : path;
  }

  private static String describe(Throwable throwable) {
    if (throwable == null) {
      return "unknown error";
    }
    String message = throwable.getMessage();
    return message == null || message.isBlank()
        ? throwable.getClass().getSimpleName()
        : throwable.getClass().getSimpleName() + ": " + message;
  }
}
