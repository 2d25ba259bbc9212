package com.example.ordergateway.security;

/**
 * Why a request was turned away at the guard.
 */
public enum GuardFailure {
  /** Missing, malformed, expired or forged token, or a token for an unknown user. */
  UNAUTHENTICATED,
  /** Valid token for a disabled account. */
  FORBIDDEN
}
