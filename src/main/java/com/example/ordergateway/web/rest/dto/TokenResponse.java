package com.example.ordergateway.web.rest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Login response
 */
public record TokenResponse(
    @JsonProperty("access_token")
    String accessToken,
    @JsonProperty("token_type")
    String tokenType
) {

  public static final String BEARER = "bearer";

  public static TokenResponse bearer(String accessToken) {
    return new TokenResponse(accessToken, BEARER);
  }
}
