package com.example.ordergateway.repository;

import com.example.ordergateway.domain.entity.UserAccount;
import com.example.ordergateway.properties.ApplicationProperties.AuthProperties.SeedUser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InMemoryCredentialStoreTest {

  private static final List<SeedUser> SEEDS = List.of(
      new SeedUser("u1", "testuser", "secret", false),
      new SeedUser("u2", "admin", "admin123", false));

  @Mock
  private PasswordEncoder passwordEncoder;

  @BeforeEach
  void setUp() {
    lenient().when(passwordEncoder.encode(anyString())).thenAnswer(inv -> "hashed:" + inv.getArgument(0));
  }

  @Test
  void seedsAreHashedOnFirstLookupOnly() {
    InMemoryCredentialStore store = new InMemoryCredentialStore(SEEDS, passwordEncoder);
    verifyNoInteractions(passwordEncoder);

    store.findByUsername("testuser");
    store.findByUsername("admin");
    store.findByUsername("nobody");

    verify(passwordEncoder, times(2)).encode(anyString());
  }

  @Test
  void findsSeededUserWithHashedPassword() {
    InMemoryCredentialStore store = new InMemoryCredentialStore(SEEDS, passwordEncoder);

    Optional<UserAccount> user = store.findByUsername("testuser");

    assertTrue(user.isPresent());
    assertEquals("u1", user.get().userId());
    assertEquals("hashed:secret", user.get().hashedPassword());
    assertFalse(user.get().disabled());
  }

  @Test
  void unknownOrNullUsernameIsEmpty() {
    InMemoryCredentialStore store = new InMemoryCredentialStore(SEEDS, passwordEncoder);

    assertTrue(store.findByUsername("nobody").isEmpty());
    assertTrue(store.findByUsername(null).isEmpty());
  }

  @Test
  void setDisabledReplacesOnlyTheFlag() {
    InMemoryCredentialStore store = new InMemoryCredentialStore(SEEDS, passwordEncoder);

    Optional<UserAccount> updated = store.setDisabled("admin", true);

    assertTrue(updated.isPresent());
    assertTrue(updated.get().disabled());
    assertEquals("u2", updated.get().userId());
    assertEquals("hashed:admin123", updated.get().hashedPassword());
    assertTrue(store.findByUsername("admin").orElseThrow().disabled());
    assertFalse(store.findByUsername("testuser").orElseThrow().disabled());
  }

  @Test
  void setDisabledOnUnknownUserIsEmpty() {
    InMemoryCredentialStore store = new InMemoryCredentialStore(SEEDS, passwordEncoder);

    assertTrue(store.setDisabled("nobody", true).isEmpty());
  }

  @Test
  void seededDisabledFlagIsKept() {
    InMemoryCredentialStore store = new InMemoryCredentialStore(
        List.of(new SeedUser("u9", "ghost", "boo", true)), passwordEncoder);

    assertTrue(store.findByUsername("ghost").orElseThrow().disabled());
  }

  @Test
  void duplicateSeedUsernamesAreRejected() {
    InMemoryCredentialStore store = new InMemoryCredentialStore(
        List.of(new SeedUser("u1", "testuser", "a", false), new SeedUser("u7", "testuser", "b", false)),
        passwordEncoder);

    assertThrows(IllegalArgumentException.class, () -> store.findByUsername("testuser"));
  }
}
