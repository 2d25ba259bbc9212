package com.example.ordergateway.web.rest.controller;

import com.example.ordergateway.domain.entity.UserAccount;
import com.example.ordergateway.properties.ApplicationProperties;
import com.example.ordergateway.service.AuthenticationService;
import com.example.ordergateway.service.TokenService;
import com.example.ordergateway.web.rest.dto.TokenResponse;
import com.example.ordergateway.web.rest.dto.UserResponse;
import com.example.ordergateway.web.rest.errors.ErrorResponses;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * REST controller for login and current-user endpoints.
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class AuthController implements AuthAPI {

  private final AuthenticationService authenticationService;
  private final TokenService tokenService;
  private final ApplicationProperties properties;

  @Override
  public ResponseEntity<?> login(String username, String password) {
    Optional<UserAccount> user = authenticationService.authenticate(username, password);
    if (user.isEmpty()) {
      log.info("Login rejected for {}", username);
      return ErrorResponses.unauthorized(ErrorResponses.INCORRECT_LOGIN);
    }

    String accessToken = tokenService.issueToken(user.get().username(), properties.auth().accessTokenTtl());
    log.info("User {} logged in", user.get().username());
    return ResponseEntity.ok(TokenResponse.bearer(accessToken));
  }

  @Override
  public ResponseEntity<UserResponse> me(UserAccount user) {
    return ResponseEntity.ok(UserResponse.from(user));
  }
}
