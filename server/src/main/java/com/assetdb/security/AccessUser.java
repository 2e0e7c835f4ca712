package com.assetdb.security;

import java.util.List;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * The authenticated user on whose behalf folder access is decided.
 *
 * <p>The concrete implementation holds a {@code db.User} record and delegates to it.
 */
public interface AccessUser {

  /**
   * Gets the user's login name, which is also the value stored in task assignee lists.
   *
   * @return The login name
   */
  String getName();

  /**
   * Gets the role the user acts in.
   *
   * @return The role derived from the user record
   */
  UserRole getRole();

  /**
   * Whether the user bypasses folder-level restrictions.
   *
   * @return true for administrators, managers and services
   */
  default boolean isElevated() {
    return getRole().isElevated();
  }

  /**
   * Gets the access groups assigned to the user on a project. Project names are matched
   * case-insensitively.
   *
   * @param projectName the project, or null for the user's default access groups
   * @return the group names, or empty if the user has no assignment on the project
   */
  Optional<List<String>> accessGroupNames(@Nullable String projectName);
}
