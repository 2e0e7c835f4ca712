package com.assetdb.access;

/**
 * The folder-level operations a permission set restricts.
 *
 * <p>Each constant is one permission dimension of a {@link PermissionSet}. Only {@link #READ}
 * implies access to the ancestors of granted folders, so that breadcrumbs above a readable
 * subtree can still be displayed.
 */
public enum AccessType {
  CREATE("create"),
  READ("read"),
  UPDATE("update"),
  DELETE("delete"),
  PUBLISH("publish");

  private final String key;

  AccessType(String key) {
    this.key = key;
  }

  /** Returns the key used for this dimension in stored access group documents. */
  public String key() {
    return key;
  }

  /** Whether granting this access to a folder also grants it to the folder's ancestors. */
  public boolean includesAncestors() {
    return this == READ;
  }
}
