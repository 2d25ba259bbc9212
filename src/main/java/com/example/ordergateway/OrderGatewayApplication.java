package com.example.ordergateway;

import com.example.ordergateway.properties.ApplicationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Order Gateway Application
 *
 * Bearer-token gateway in front of the order service with:
 * - HS256 access tokens issued against an in-memory credential store
 * - Connection-level retries towards the upstream order service
 * - Local read/write-through cache of order status
 */
@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@EnableConfigurationProperties(ApplicationProperties.class)
public class OrderGatewayApplication {
  public static void main(String[] args) {
    SpringApplication app = new SpringApplication(OrderGatewayApplication.class);
    app.setRegisterShutdownHook(true);
    app.run(args);
  }
}
