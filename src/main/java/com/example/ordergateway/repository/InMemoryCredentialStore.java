package com.example.ordergateway.repository;

import com.example.ordergateway.domain.entity.UserAccount;
import com.example.ordergateway.properties.ApplicationProperties;
import com.example.ordergateway.properties.ApplicationProperties.AuthProperties.SeedUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local credential store seeded from configuration.
 *
 * Seed passwords are hashed on the first lookup rather than at startup. After that the
 * user map only sees per-key replacements of the disabled flag.
 */
@Slf4j
@Repository
public class InMemoryCredentialStore implements CredentialStore {

  private final List<SeedUser> seedUsers;
  private final PasswordEncoder passwordEncoder;

  private volatile Map<String, UserAccount> users;

  @Autowired
  public InMemoryCredentialStore(ApplicationProperties properties, PasswordEncoder passwordEncoder) {
    this(properties.auth().seedUsers(), passwordEncoder);
  }

  public InMemoryCredentialStore(List<SeedUser> seedUsers, PasswordEncoder passwordEncoder) {
    this.seedUsers = List.copyOf(seedUsers);
    this.passwordEncoder = passwordEncoder;
  }

  @Override
  public Optional<UserAccount> findByUsername(String username) {
    if (username == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(getUsers().get(username));
  }

  @Override
  public Optional<UserAccount> setDisabled(String username, boolean disabled) {
    UserAccount updated = getUsers().computeIfPresent(username, (name, user) -> user.withDisabled(disabled));
    if (updated != null) {
      log.info("User {} is now {}", username, disabled ? "disabled" : "enabled");
    }
    return Optional.ofNullable(updated);
  }

  private Map<String, UserAccount> getUsers() {
    if (users == null) {
      synchronized (this) {
        if (users == null) {
          users = loadSeedUsers();
        }
      }
    }
    return users;
  }

  private Map<String, UserAccount> loadSeedUsers() {
    Map<String, UserAccount> loaded = new ConcurrentHashMap<>();
    for (SeedUser seed : seedUsers) {
      UserAccount user = new UserAccount(
          seed.userId(),
          seed.username(),
          passwordEncoder.encode(seed.password()),
          seed.disabled());
      if (loaded.putIfAbsent(seed.username(), user) != null) {
        throw new IllegalArgumentException("Duplicate seed username: " + seed.username());
      }
    }
    log.info("Credential store initialized with {} user(s)", loaded.size());
    return loaded;
  }
}
