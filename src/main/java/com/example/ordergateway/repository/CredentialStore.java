package com.example.ordergateway.repository;

import com.example.ordergateway.domain.entity.UserAccount;

import java.util.Optional;

/**
 * Lookup of gateway users by their unique username.
 * Implementations must be safe for concurrent reads and writes.
 */
public interface CredentialStore {

  Optional<UserAccount> findByUsername(String username);

  /**
   * Atomically replaces the user's disabled flag.
   *
   * @return the updated user, or empty if no such user exists
   */
  Optional<UserAccount> setDisabled(String username, boolean disabled);
}
