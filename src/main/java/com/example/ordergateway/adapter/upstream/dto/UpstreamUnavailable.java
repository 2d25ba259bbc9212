package com.example.ordergateway.adapter.upstream.dto;

/**
 * No reply could be obtained from the order service.
 *
 * @param reason   description of the last failure observed
 * @param attempts number of attempts made before giving up
 */
public record UpstreamUnavailable(
    String reason,
    int attempts
) implements ForwardResult {
}
