package com.example.ordergateway.adapter.upstream.dto;

/**
 * Result of forwarding one call to the order service: either a reply was received
 * (whatever its status) or no connection could be established.
 */
public sealed interface ForwardResult permits UpstreamResponse, UpstreamUnavailable {
}
