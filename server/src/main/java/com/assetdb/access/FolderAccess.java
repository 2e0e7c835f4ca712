package com.assetdb.access;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * The resolved folder access of one user on one project for one {@link AccessType}: either
 * unrestricted, or limited to a non-empty {@link PathSet}.
 *
 * <p>Consumers must check {@link #isUnrestricted()} before building a trie or an SQL predicate;
 * unrestricted access produces neither.
 */
public final class FolderAccess {

  private static final FolderAccess UNRESTRICTED = new FolderAccess(null);

  private final PathSet pathSet;

  private FolderAccess(PathSet pathSet) {
    this.pathSet = pathSet;
  }

  @Nonnull
  public static FolderAccess unrestricted() {
    return UNRESTRICTED;
  }

  @Nonnull
  public static FolderAccess restrictedTo(@Nonnull PathSet pathSet) {
    return new FolderAccess(Objects.requireNonNull(pathSet));
  }

  public boolean isUnrestricted() {
    return pathSet == null;
  }

  /** The granted paths; empty when access is unrestricted. */
  @Nonnull
  public Optional<PathSet> pathSet() {
    return Optional.ofNullable(pathSet);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof FolderAccess)) {
      return false;
    }
    return Objects.equals(pathSet, ((FolderAccess) obj).pathSet);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(pathSet);
  }

  @Override
  public String toString() {
    if (pathSet == null) {
      return "FolderAccess{unrestricted}";
    }
    return MoreObjects.toStringHelper(this).add("pathSet", pathSet).toString();
  }
}
