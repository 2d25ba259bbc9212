package com.example.ordergateway.web.rest.dto;

import com.example.ordergateway.domain.entity.UserAccount;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public view of a user; never carries the password hash.
 */
public record UserResponse(
    @JsonProperty("user_id")
    String userId,
    @JsonProperty("username")
    String username,
    @JsonProperty("disabled")
    boolean disabled
) {

  public static UserResponse from(UserAccount user) {
    return new UserResponse(user.userId(), user.username(), user.disabled());
  }
}
