package com.example.ordergateway.adapter.orders.dto;

/**
 * What an order operation against the order service produced.
 */
public sealed interface OrderOutcome {

  /** The order service returned an order. */
  record Found(OrderStatus order) implements OrderOutcome {}

  /** The order service confirmed the order does not exist. */
  record NotFound(String orderId) implements OrderOutcome {}

  /** Any other non-2xx reply, to be passed through verbatim. */
  record UpstreamError(int status, String body, String contentType) implements OrderOutcome {}

  /** No connection could be made within the retry budget. */
  record Unavailable(String reason) implements OrderOutcome {}

  /** A 2xx reply whose body is not an order. */
  record InvalidResponse(int status, String reason) implements OrderOutcome {}
}
