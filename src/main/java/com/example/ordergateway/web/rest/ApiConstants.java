package com.example.ordergateway.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String AUTH_BASE = "/auth";
    public static final String ORDERS_BASE = "/orders";
    public static final String HEALTH_BASE = "/health";

    // Auth paths
    public static final String LOGIN = "/login";
    public static final String ME = "/me";

    // Order paths
    public static final String ORDER_ID = "/{orderId}";

    private ApiPath() {}
  }

  private ApiConstants() {}
}
