package com.example.ordergateway.adapter.orders.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Order state as owned by the order service. The gateway only keys on {@code id}.
 * Fields the order service left out stay out of the response.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderStatus(
    @JsonProperty("id")
    String id,
    @JsonProperty("status")
    String status,
    @JsonProperty("item")
    String item,
    @JsonProperty("amount")
    Integer amount,
    @JsonProperty("user_id")
    String userId,
    @JsonProperty("updated_at")
    String updatedAt
) {}
