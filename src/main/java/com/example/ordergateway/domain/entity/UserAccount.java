package com.example.ordergateway.domain.entity;

/**
 * A gateway user as held by the credential store.
 * Only {@code disabled} changes after creation, by replacing the record.
 */
public record UserAccount(
    String userId,
    String username,
    String hashedPassword,
    boolean disabled
) {

  public UserAccount withDisabled(boolean disabled) {
    return new UserAccount(userId, username, hashedPassword, disabled);
  }

  @Override
  public String toString() {
    return "UserAccount[userId=" + userId + ", username=" + username + ", disabled=" + disabled + "]";
  }
}
