package com.assetdb.security;

import com.assetdb.db.User;
import com.google.common.base.MoreObjects;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nullable;

/**
 * Default implementation of {@link AccessUser} wrapping a database user record.
 *
 * <p>The role is derived once, at construction, from the record's flags (see {@link
 * UserRole#of}).
 */
public class DefaultAccessUser implements AccessUser {

  private final User dbUser;
  private final UserRole role;

  public DefaultAccessUser(User dbUser) {
    this.dbUser = Objects.requireNonNull(dbUser);
    this.role = UserRole.of(dbUser.admin(), dbUser.manager(), dbUser.service(), dbUser.guest());
  }

  @Override
  public String getName() {
    return dbUser.name();
  }

  @Override
  public UserRole getRole() {
    return role;
  }

  @Override
  public Optional<List<String>> accessGroupNames(@Nullable String projectName) {
    if (projectName == null) {
      return Optional.of(dbUser.defaultAccessGroups());
    }
    for (Map.Entry<String, List<String>> entry : dbUser.accessGroups().entrySet()) {
      if (entry.getKey().equalsIgnoreCase(projectName)) {
        return Optional.of(entry.getValue());
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", dbUser.name())
        .add("role", role)
        .add("projects", dbUser.accessGroups().keySet())
        .toString();
  }
}
