package com.example.ordergateway.web.rest.controller;

import com.example.ordergateway.adapter.orders.dto.OrderCreateRequest;
import com.example.ordergateway.adapter.orders.dto.OrderOutcome;
import com.example.ordergateway.service.OrderService;
import com.example.ordergateway.web.rest.errors.ErrorResponses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for order endpoints. Translates {@link OrderOutcome}s into responses.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class OrderController implements OrderAPI {

  private final OrderService orderService;

  @Override
  public ResponseEntity<?> createOrder(OrderCreateRequest request) {
    return toResponse(orderService.createOrder(request));
  }

  @Override
  public ResponseEntity<?> getOrder(String orderId) {
    return toResponse(orderService.getOrder(orderId));
  }

  private ResponseEntity<?> toResponse(OrderOutcome outcome) {
    if (outcome instanceof OrderOutcome.Found found) {
      return ResponseEntity.ok()
          .contentType(MediaType.APPLICATION_JSON)
          .body(found.order());
    }
    if (outcome instanceof OrderOutcome.NotFound) {
      return ErrorResponses.of(HttpStatus.NOT_FOUND, ErrorResponses.ORDER_NOT_FOUND);
    }
    if (outcome instanceof OrderOutcome.UpstreamError error) {
      return ResponseEntity.status(HttpStatusCode.valueOf(error.status()))
          .contentType(passThroughContentType(error.contentType()))
          .body(error.body());
    }
    if (outcome instanceof OrderOutcome.Unavailable unavailable) {
      return ErrorResponses.of(HttpStatus.SERVICE_UNAVAILABLE,
                               ErrorResponses.SERVICE_UNAVAILABLE.formatted(unavailable.reason()));
    }
    if (outcome instanceof OrderOutcome.InvalidResponse) {
      return ErrorResponses.of(HttpStatus.BAD_GATEWAY, ErrorResponses.INVALID_UPSTREAM_RESPONSE);
    }
    throw new IllegalStateException("Unhandled order outcome: " + outcome);
  }

  private static MediaType passThroughContentType(String contentType) {
    if (contentType == null || contentType.isBlank()) {
      return MediaType.APPLICATION_JSON;
    }
    try {
      return MediaType.parseMediaType(contentType);
    } catch (InvalidMediaTypeException e) {
      log.debug("Upstream sent an unparsable content type {}, using JSON", contentType);
      return MediaType.APPLICATION_JSON;
    }
  }
}
