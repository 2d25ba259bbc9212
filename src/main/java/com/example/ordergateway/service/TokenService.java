package com.example.ordergateway.service;

import com.example.ordergateway.exception.TokenException;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JOSEObjectType;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import lombok.extern.slf4j.Slf4j;

import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

/**
 * Issues and verifies stateless HS256 access tokens bound to a username.
 *
 * Tokens carry {@code sub}, {@code iat} and {@code exp} and nothing else. There is no
 * server-side record of issued tokens, so a token stays valid until it expires.
 */
@Slf4j
public class TokenService {

  private static final JWSAlgorithm ALGORITHM = JWSAlgorithm.HS256;

  private final JWSSigner signer;
  private final JWSVerifier verifier;
  private final Duration defaultTtl;
  private final Clock clock;

  public TokenService(byte[] secret, Duration defaultTtl, Clock clock) {
    try {
      this.signer = new MACSigner(secret);
      this.verifier = new MACVerifier(secret);
    } catch (JOSEException e) {
      throw new TokenException("Signing secret is not usable for " + ALGORITHM, e);
    }
    this.defaultTtl = defaultTtl;
    this.clock = clock;
  }

  /**
   * Issues a token with the default lifetime.
   */
  public String issueToken(String username) {
    return issueToken(username, defaultTtl);
  }

  /**
   * Issues a token for {@code username} valid for {@code ttl}, truncated to whole seconds.
   *
   * @throws IllegalArgumentException if the ttl is shorter than one second
   * @throws TokenException if signing fails
   */
  public String issueToken(String username, Duration ttl) {
    if (ttl == null || ttl.getSeconds() < 1) {
      throw new IllegalArgumentException("Token ttl must be at least one second: " + ttl);
    }

    Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = issuedAt.plusSeconds(ttl.getSeconds());

    JWTClaimsSet claims = new JWTClaimsSet.Builder()
        .subject(username)
        .issueTime(Date.from(issuedAt))
        .expirationTime(Date.from(expiresAt))
        .build();
    SignedJWT jwt = new SignedJWT(new JWSHeader.Builder(ALGORITHM).type(JOSEObjectType.JWT).build(), claims);

    try {
      jwt.sign(signer);
    } catch (JOSEException e) {
      throw new TokenException("Failed to sign access token", e);
    }
    return jwt.serialize();
  }

  /**
   * Verifies structure, then signature, then expiry, in that order.
   */
  public TokenVerification verifyToken(String token) {
    if (token == null || token.isBlank()) {
      return TokenVerification.rejected(TokenError.MALFORMED);
    }

    SignedJWT jwt;
    JWTClaimsSet claims;
    try {
      jwt = SignedJWT.parse(token);
      claims = jwt.getJWTClaimsSet();
    } catch (ParseException e) {
      log.debug("Token could not be parsed: {}", e.getMessage());
      return TokenVerification.rejected(TokenError.MALFORMED);
    }

    if (!ALGORITHM.equals(jwt.getHeader().getAlgorithm())) {
      return TokenVerification.rejected(TokenError.MALFORMED);
    }

    try {
      if (!jwt.verify(verifier)) {
        return TokenVerification.rejected(TokenError.INVALID_SIGNATURE);
      }
    } catch (JOSEException e) {
      log.debug("Token signature could not be checked: {}", e.getMessage());
      return TokenVerification.rejected(TokenError.MALFORMED);
    }

    String subject = claims.getSubject();
    Date expiration = claims.getExpirationTime();
    if (subject == null || subject.isBlank() || expiration == null) {
      return TokenVerification.rejected(TokenError.MALFORMED);
    }

    if (!clock.instant().isBefore(expiration.toInstant())) {
      return TokenVerification.rejected(TokenError.EXPIRED);
    }
    return TokenVerification.valid(subject);
  }
}
