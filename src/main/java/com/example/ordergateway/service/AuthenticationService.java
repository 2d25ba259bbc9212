package com.example.ordergateway.service;

import com.example.ordergateway.domain.entity.UserAccount;
import com.example.ordergateway.repository.CredentialStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Username/password authentication against the credential store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthenticationService {

  private final CredentialStore credentialStore;
  private final PasswordEncoder passwordEncoder;

  /**
   * Returns the user when the password matches. Unknown users and wrong passwords both
   * come back empty; an unknown username returns without hashing, so the two cases still
   * differ in timing.
   */
  public Optional<UserAccount> authenticate(String username, String password) {
    Optional<UserAccount> user = credentialStore.findByUsername(username);
    if (user.isEmpty()) {
      return Optional.empty();
    }
    if (password == null || !passwordEncoder.matches(password, user.get().hashedPassword())) {
      return Optional.empty();
    }
    return user;
  }
}
