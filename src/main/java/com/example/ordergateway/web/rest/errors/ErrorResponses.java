package com.example.ordergateway.web.rest.errors;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Wire-level error bodies. Every gateway-generated error is {@code {"detail": "..."}}.
 */
public final class ErrorResponses {

  public static final String DETAIL = "detail";
  public static final String BEARER_CHALLENGE = "Bearer";

  public static final String INVALID_CREDENTIALS = "Could not validate credentials";
  public static final String INACTIVE_USER = "Inactive user";
  public static final String INCORRECT_LOGIN = "Incorrect username or password";
  public static final String ORDER_NOT_FOUND = "Order not found";
  public static final String NOT_FOUND = "Not Found";
  public static final String SERVICE_UNAVAILABLE = "Service unavailable: %s";
  public static final String INVALID_UPSTREAM_RESPONSE = "Invalid response from order service";
  public static final String INTERNAL_ERROR = "Internal server error";

  public static Map<String, Object> body(String detail) {
    return Map.of(DETAIL, detail);
  }

  public static ResponseEntity<Object> of(HttpStatus status, String detail) {
    return ResponseEntity.status(status).body(body(detail));
  }

  /**
   * 401 carrying the bearer re-authentication hint.
   */
  public static ResponseEntity<Object> unauthorized(String detail) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .header(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE)
        .body(body(detail));
  }

  private ErrorResponses() {}
}
