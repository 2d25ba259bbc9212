package com.example.ordergateway.security;

import com.example.ordergateway.domain.entity.UserAccount;
import com.example.ordergateway.repository.CredentialStore;
import com.example.ordergateway.service.TokenService;
import com.example.ordergateway.service.TokenVerification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves the caller of a protected route from its bearer credentials.
 * Reads the credential store only; never mutates it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuthGuard {

  private static final String BEARER_PREFIX = "bearer ";

  private final TokenService tokenService;
  private final CredentialStore credentialStore;

  /**
   * @param authorizationHeader raw {@code Authorization} header value, may be null
   */
  public GuardResult authenticate(String authorizationHeader) {
    String token = extractBearerToken(authorizationHeader);
    if (token == null) {
      return GuardResult.rejected(GuardFailure.UNAUTHENTICATED);
    }

    TokenVerification verification = tokenService.verifyToken(token);
    if (!verification.isValid()) {
      log.warn("Rejected bearer token: {}", verification.error());
      return GuardResult.rejected(GuardFailure.UNAUTHENTICATED);
    }

    Optional<UserAccount> user = credentialStore.findByUsername(verification.username());
    if (user.isEmpty()) {
      log.warn("Token subject {} is not a known user", verification.username());
      return GuardResult.rejected(GuardFailure.UNAUTHENTICATED);
    }
    if (user.get().disabled()) {
      log.warn("Token subject {} is disabled", verification.username());
      return GuardResult.rejected(GuardFailure.FORBIDDEN);
    }
    return GuardResult.authenticated(user.get());
  }

  static String extractBearerToken(String authorizationHeader) {
    if (authorizationHeader == null || authorizationHeader.length() <= BEARER_PREFIX.length()) {
      return null;
    }
    if (!authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      return null;
    }
    String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
    return token.isEmpty() ? null : token;
  }
}
