package com.example.ordergateway.adapter.orders.client;

import com.example.ordergateway.adapter.orders.dto.OrderCreateRequest;
import com.example.ordergateway.adapter.orders.dto.OrderOutcome;
import com.example.ordergateway.adapter.orders.dto.OrderStatus;
import com.example.ordergateway.adapter.upstream.client.ProxyClient;
import com.example.ordergateway.adapter.upstream.dto.ForwardResult;
import com.example.ordergateway.adapter.upstream.dto.UpstreamResponse;
import com.example.ordergateway.adapter.upstream.dto.UpstreamUnavailable;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;

/**
 * Order service operations on top of {@link ProxyClient}, mapped to {@link OrderOutcome}s.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderServiceClient {

  private static final String ORDERS_PATH = "/orders";

  private final ProxyClient proxyClient;
  private final ObjectMapper objectMapper;

  /**
   * {@code POST /orders}. A 404 here is an ordinary upstream error, not a missing order.
   */
  public OrderOutcome createOrder(OrderCreateRequest request) {
    ForwardResult result = proxyClient.forward(HttpMethod.POST, ORDERS_PATH, request);
    return toOutcome(result, null);
  }

  /**
   * {@code GET /orders/{id}}, with the id sent as a single encoded path segment.
   */
  public OrderOutcome fetchOrder(String orderId) {
    String path = ORDERS_PATH + "/" + UriUtils.encodePathSegment(orderId, StandardCharsets.UTF_8);
    ForwardResult result = proxyClient.forward(HttpMethod.GET, path, null);
    return toOutcome(result, orderId);
  }

  private OrderOutcome toOutcome(ForwardResult result, String lookupId) {
    if (result instanceof UpstreamUnavailable unavailable) {
      return new OrderOutcome.Unavailable(unavailable.reason());
    }

    UpstreamResponse response = (UpstreamResponse) result;
    if (lookupId != null && response.status() == HttpStatus.NOT_FOUND.value()) {
      return new OrderOutcome.NotFound(lookupId);
    }
    if (!response.isSuccessful()) {
      log.info("Order service answered {} for {}", response.status(),
               lookupId != null ? "order " + lookupId : "order creation");
      return new OrderOutcome.UpstreamError(response.status(), response.body(), response.contentType());
    }
    return parseOrder(response);
  }

  private OrderOutcome parseOrder(UpstreamResponse response) {
    try {
      OrderStatus order = objectMapper.readValue(response.body(), OrderStatus.class);
      if (order == null || order.id() == null || order.id().isBlank()) {
        log.error("Order service returned {} without an order id", response.status());
        return new OrderOutcome.InvalidResponse(response.status(), "missing order id");
      }
      return new OrderOutcome.Found(order);
    } catch (JsonProcessingException e) {
      log.error("Order service returned an unreadable order body ({}): {}", response.status(), e.getOriginalMessage());
      return new OrderOutcome.InvalidResponse(response.status(), e.getOriginalMessage());
    }
  }
}
