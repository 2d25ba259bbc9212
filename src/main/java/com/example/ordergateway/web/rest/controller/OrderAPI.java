package com.example.ordergateway.web.rest.controller;

import static com.example.ordergateway.web.rest.ApiConstants.ApiPath.*;

import com.example.ordergateway.adapter.orders.dto.OrderCreateRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Upstream replies are passed through with their own content type, so no {@code produces}
 * restriction is declared here.
 */
@Tag(
    name = "Orders",
    description = "Order creation and lookup, forwarded to the order service"
)
@RequestMapping(value = ORDERS_BASE)
public interface OrderAPI {

  @Operation(
      summary = "Create order",
      description = "Forwards the order to the order service and caches the created order"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Order created"),
      @ApiResponse(responseCode = "400", description = "Inactive user"),
      @ApiResponse(responseCode = "401", description = "Missing or invalid token"),
      @ApiResponse(responseCode = "422", description = "Invalid order payload"),
      @ApiResponse(responseCode = "503", description = "Order service unreachable")
  })
  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  ResponseEntity<?> createOrder(@Valid @RequestBody OrderCreateRequest request);

  @Operation(
      summary = "Get order",
      description = "Returns the cached order or fetches it from the order service"
  )
  @ApiResponses(value = {
      @ApiResponse(responseCode = "200", description = "Order found"),
      @ApiResponse(responseCode = "400", description = "Inactive user"),
      @ApiResponse(responseCode = "401", description = "Missing or invalid token"),
      @ApiResponse(responseCode = "404", description = "Order not found"),
      @ApiResponse(responseCode = "503", description = "Order service unreachable")
  })
  @GetMapping(value = ORDER_ID)
  ResponseEntity<?> getOrder(
      @Parameter(description = "Order id", required = true)
      @PathVariable String orderId
                            );
}
