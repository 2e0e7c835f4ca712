package com.assetdb.access;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A single whitelist rule within a folder permission dimension.
 *
 * <p>HIERARCHY and CHILDREN grants carry a normalized folder path. ASSIGNED grants never carry a
 * path; a path supplied for them is dropped. Instances are immutable and compare by value, so
 * duplicate grants collapse when permission sets are combined.
 */
public final class FolderAccessGrant {

  private final GrantType type;
  private final String path;

  private FolderAccessGrant(GrantType type, String path) {
    this.type = type;
    this.path = path;
  }

  /**
   * Creates a grant, validating that a path is present exactly when the type needs one.
   *
   * @throws IllegalArgumentException if a HIERARCHY or CHILDREN grant has no usable path
   */
  @Nonnull
  public static FolderAccessGrant of(@Nonnull GrantType type, @Nullable String path) {
    Objects.requireNonNull(type, "type");
    if (!type.requiresPath()) {
      return new FolderAccessGrant(type, null);
    }
    String normalized = PathSet.normalize(path);
    if (Strings.isNullOrEmpty(normalized)) {
      throw new IllegalArgumentException(
          "Folder access of type '" + type.key() + "' requires a path");
    }
    return new FolderAccessGrant(type, normalized);
  }

  @Nonnull
  public static FolderAccessGrant hierarchy(String path) {
    return of(GrantType.HIERARCHY, path);
  }

  @Nonnull
  public static FolderAccessGrant children(String path) {
    return of(GrantType.CHILDREN, path);
  }

  @Nonnull
  public static FolderAccessGrant assigned() {
    return of(GrantType.ASSIGNED, null);
  }

  @Nonnull
  public GrantType type() {
    return type;
  }

  /** The normalized folder path; empty for ASSIGNED grants. */
  @Nonnull
  public Optional<String> path() {
    return Optional.ofNullable(path);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FolderAccessGrant)) {
      return false;
    }
    FolderAccessGrant other = (FolderAccessGrant) obj;
    return type == other.type && Objects.equals(path, other.path);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, path);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .omitNullValues()
        .add("type", type.key())
        .add("path", path)
        .toString();
  }
}
