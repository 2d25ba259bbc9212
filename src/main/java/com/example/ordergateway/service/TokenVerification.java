package com.example.ordergateway.service;

/**
 * Outcome of verifying a bearer token: the subject on success, the error otherwise.
 */
public record TokenVerification(String username, TokenError error) {

  public static TokenVerification valid(String username) {
    return new TokenVerification(username, null);
  }

  public static TokenVerification rejected(TokenError error) {
    return new TokenVerification(null, error);
  }

  public boolean isValid() {
    return error == null;
  }
}
