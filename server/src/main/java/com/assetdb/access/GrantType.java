package com.assetdb.access;

import java.util.Locale;

/** How a single {@link FolderAccessGrant} selects folders. */
public enum GrantType {
  /** The folder at the grant's path and everything below it. */
  HIERARCHY("hierarchy"),
  /** Everything below the folder at the grant's path, but not the folder itself. */
  CHILDREN("children"),
  /** Folders containing a task the user is assigned to, and everything below them. */
  ASSIGNED("assigned");

  private final String key;

  GrantType(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  /** Whether grants of this type carry a folder path. */
  public boolean requiresPath() {
    return this != ASSIGNED;
  }

  /**
   * Converts a stored key to a GrantType.
   *
   * @return the matching GrantType or null if not recognized
   */
  public static GrantType fromKey(String key) {
    if (key == null) {
      return null;
    }
    return switch (key.trim().toLowerCase(Locale.ROOT)) {
      case "hierarchy" -> HIERARCHY;
      case "children" -> CHILDREN;
      case "assigned" -> ASSIGNED;
      default -> null;
    };
  }
}
