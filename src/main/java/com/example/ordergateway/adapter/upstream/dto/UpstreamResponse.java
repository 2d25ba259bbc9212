package com.example.ordergateway.adapter.upstream.dto;

/**
 * A reply received from the order service, returned as-is.
 *
 * @param contentType the upstream {@code Content-Type}, or null when absent
 */
public record UpstreamResponse(
    int status,
    String body,
    String contentType
) implements ForwardResult {

  public boolean isSuccessful() {
    return status >= 200 && status < 300;
  }
}
