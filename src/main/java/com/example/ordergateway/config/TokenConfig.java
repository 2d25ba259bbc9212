package com.example.ordergateway.config;

import com.example.ordergateway.properties.ApplicationProperties;
import com.example.ordergateway.service.TokenService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;

import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Token signing configuration.
 *
 * The signing secret is mandatory. The built-in development secret is only
 * accepted when {@code app.auth.dev-mode} is on (the {@code dev} profile).
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class TokenConfig {

  static final String DEVELOPMENT_SECRET = "order-gateway-development-only-signing-secret";

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  @DependsOn("configurationValidator")
  public TokenService tokenService(ApplicationProperties properties, Clock clock) {
    ApplicationProperties.AuthProperties auth = properties.auth();
    return new TokenService(resolveSecret(auth), auth.defaultTokenTtl(), clock);
  }

  static byte[] resolveSecret(ApplicationProperties.AuthProperties auth) {
    if (auth.hasJwtSecret()) {
      return auth.jwtSecret().getBytes(StandardCharsets.UTF_8);
    }
    if (!auth.devMode()) {
      throw new IllegalStateException("app.auth.jwt-secret is required outside development mode");
    }
    log.warn("No JWT secret configured; using the INSECURE development secret. Never run this outside development.");
    return DEVELOPMENT_SECRET.getBytes(StandardCharsets.UTF_8);
  }
}
