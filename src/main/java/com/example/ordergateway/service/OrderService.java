package com.example.ordergateway.service;

import com.example.ordergateway.adapter.orders.client.OrderServiceClient;
import com.example.ordergateway.adapter.orders.dto.OrderCreateRequest;
import com.example.ordergateway.adapter.orders.dto.OrderOutcome;
import com.example.ordergateway.cache.ResponseCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Order operations: write-through on create, read-through on fetch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

  private final OrderServiceClient orderServiceClient;
  private final ResponseCache responseCache;

  public OrderOutcome createOrder(OrderCreateRequest request) {
    OrderOutcome outcome = orderServiceClient.createOrder(request);
    if (outcome instanceof OrderOutcome.Found found) {
      responseCache.put(found.order().id(), found.order());
      log.info("Order {} created for user {}", found.order().id(), request.userId());
    }
    return outcome;
  }

  public OrderOutcome getOrder(String orderId) {
    return responseCache.getOrFetch(orderId, orderServiceClient::fetchOrder);
  }
}
