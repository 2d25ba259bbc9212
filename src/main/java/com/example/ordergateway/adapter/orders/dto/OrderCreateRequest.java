package com.example.ordergateway.adapter.orders.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Order creation payload, forwarded to the order service unchanged.
 */
public record OrderCreateRequest(
    @JsonProperty("user_id")
    @NotBlank(message = "user_id is required")
    String userId,
    @JsonProperty("item")
    @NotBlank(message = "item is required")
    String item,
    @JsonProperty("amount")
    @NotNull(message = "amount is required")
    Integer amount
) {}
