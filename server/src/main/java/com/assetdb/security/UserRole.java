package com.assetdb.security;

/**
 * The role a user acts in, derived from the flags on the user record.
 *
 * <p>Elevated roles bypass folder-level restrictions:
 *
 * <ul>
 *   <li>{@link #ADMIN}: server administrator
 *   <li>{@link #SERVICE}: API key of an integration
 *   <li>{@link #MANAGER}: project manager
 * </ul>
 *
 * <p>{@link #USER} and {@link #GUEST} are restricted to what their access groups grant.
 */
public enum UserRole {
  ADMIN(true),
  SERVICE(true),
  MANAGER(true),
  USER(false),
  GUEST(false);

  private final boolean elevated;

  UserRole(boolean elevated) {
    this.elevated = elevated;
  }

  public boolean isElevated() {
    return elevated;
  }

  /**
   * Derives the role from user flags. A guest is never elevated, even when flagged as admin.
   */
  public static UserRole of(boolean admin, boolean manager, boolean service, boolean guest) {
    if (guest) {
      return GUEST;
    }
    if (service) {
      return SERVICE;
    }
    if (admin) {
      return ADMIN;
    }
    if (manager) {
      return MANAGER;
    }
    return USER;
  }
}
