package com.example.ordergateway.config;

import com.example.ordergateway.properties.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration validator that enforces business rules and constraints
 * beyond basic JSR-303 validation. Fails fast with every violation listed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConfigurationValidator implements InitializingBean {

  static final int MIN_SECRET_BYTES = 32;

  private static final String ERROR_INVALID_URL = "%s is invalid: %s";
  private static final String ERROR_MUST_BE_POSITIVE = "%s must be positive.";
  private static final String PROTOCOL_HTTP = "http";
  private static final String PROTOCOL_HTTPS = "https";

  private final ApplicationProperties properties;

  @Override
  public void afterPropertiesSet() {
    log.info("Validating application configuration business rules...");
    List<String> errors = validate();

    if (!errors.isEmpty()) {
      String errorMessage = String.format("Configuration validation failed with %d error(s):\n- %s",
                                          errors.size(), String.join("\n- ", errors));
      log.error(errorMessage);
      throw new IllegalStateException(errorMessage);
    }
    log.info("Configuration validated successfully.");
  }

  List<String> validate() {
    List<String> errors = new ArrayList<>();
    validateAuthConfig(errors);
    validateUpstreamConfig(errors);
    return errors;
  }

  private void validateAuthConfig(List<String> errors) {
    ApplicationProperties.AuthProperties auth = properties.auth();

    if (!auth.hasJwtSecret()) {
      if (!auth.devMode()) {
        errors.add("app.auth.jwt-secret must be configured unless app.auth.dev-mode is enabled.");
      }
    } else if (auth.jwtSecret().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
      errors.add("app.auth.jwt-secret must be at least %d bytes for HS256.".formatted(MIN_SECRET_BYTES));
    }

    requirePositive(auth.accessTokenTtl(), "Access token TTL", errors);
    requirePositive(auth.defaultTokenTtl(), "Default token TTL", errors);

    Set<String> usernames = new HashSet<>();
    for (ApplicationProperties.AuthProperties.SeedUser seed : auth.seedUsers()) {
      if (seed.username() == null || seed.username().isBlank()) {
        errors.add("Seed user %s has a blank username.".formatted(seed.userId()));
      } else if (!usernames.add(seed.username())) {
        errors.add("Seed username is not unique: " + seed.username());
      }
    }
  }

  private void validateUpstreamConfig(List<String> errors) {
    ApplicationProperties.UpstreamProperties upstream = properties.upstream();

    if (!isValidHttpUrl(upstream.baseUrl())) {
      errors.add(ERROR_INVALID_URL.formatted("Order service URL", upstream.baseUrl()));
    }
    requirePositive(upstream.timeout(), "Upstream timeout", errors);

    if (upstream.retry().maxAttempts() < 1) {
      errors.add("Upstream retry max attempts must be at least 1.");
    }
    if (upstream.retry().baseDelay() == null || upstream.retry().baseDelay().toMillis() < 1) {
      errors.add("Upstream retry base delay must be at least 1ms.");
    }
  }

  private void requirePositive(Duration duration, String fieldName, List<String> errors) {
    if (duration == null || duration.isZero() || duration.isNegative()) {
      errors.add(ERROR_MUST_BE_POSITIVE.formatted(fieldName));
    }
  }

  private boolean isValidHttpUrl(String url) {
    if (url == null) {
      return false;
    }
    try {
      String protocol = new URL(url).getProtocol();
      return PROTOCOL_HTTP.equals(protocol) || PROTOCOL_HTTPS.equals(protocol);
    } catch (MalformedURLException e) {
      return false;
    }
  }
}
