package com.example.ordergateway.service;

/**
 * Why a presented token was not accepted.
 */
public enum TokenError {
  /** Not a parsable HS256 JWT, or required claims are missing. */
  MALFORMED,
  /** Signature does not match the configured secret. */
  INVALID_SIGNATURE,
  /** Current time is at or after the expiry claim. */
  EXPIRED
}
