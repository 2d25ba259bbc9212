package com.example.ordergateway.security;

import com.example.ordergateway.domain.entity.UserAccount;

/**
 * Either the authenticated user or the reason the request was rejected.
 */
public record GuardResult(UserAccount user, GuardFailure failure) {

  public static GuardResult authenticated(UserAccount user) {
    return new GuardResult(user, null);
  }

  public static GuardResult rejected(GuardFailure failure) {
    return new GuardResult(null, failure);
  }

  public boolean isAuthenticated() {
    return failure == null;
  }
}
