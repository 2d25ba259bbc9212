package com.example.ordergateway.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * Centralized configuration properties for the Order Gateway.
 * Uses records for immutability and type safety.
 */
@Validated
@ConfigurationProperties(prefix = "app")
public record ApplicationProperties(
    @NotNull @Valid AuthProperties auth,
    @NotNull @Valid UpstreamProperties upstream
) {

  /**
   * Token signing and credential seeding
   */
  public record AuthProperties(
      String jwtSecret,
      @DefaultValue("false") boolean devMode,
      @DefaultValue("30m") Duration accessTokenTtl,
      @DefaultValue("15m") Duration defaultTokenTtl,
      @NotNull List<@Valid SeedUser> seedUsers
  ) {
    public record SeedUser(
        @NotBlank String userId,
        @NotBlank String username,
        @NotBlank String password,
        @DefaultValue("false") boolean disabled
    ) {}

    public boolean hasJwtSecret() {
      return jwtSecret != null && !jwtSecret.isBlank();
    }
  }

  /**
   * Order service connection and retry policy
   */
  public record UpstreamProperties(
      @NotBlank String baseUrl,
      @DefaultValue("30s") Duration timeout,
      @NotNull @Valid RetryProperties retry
  ) {
    public record RetryProperties(
        @DefaultValue("3") @Positive int maxAttempts,
        @DefaultValue("1s") Duration baseDelay
    ) {}
  }
}
