package com.assetdb.access;

import com.assetdb.common.status.StatusOr;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Memoizes resolved folder access for the lifetime of one request.
 *
 * <p>Access groups and assignments change between requests, so a cache must never outlive the
 * request that created it. A denial is remembered like a grant and returned again without
 * re-resolving; failures to decide (database unavailable, cancelled query) are not remembered.
 *
 * <p>Not thread-safe; a request resolves its access sequentially.
 */
public final class RequestAccessCache {

  private record Key(String projectName, AccessType accessType) {}

  private final Map<Key, StatusOr<FolderAccess>> resolved = new HashMap<>();

  /**
   * Returns the cached outcome for a project and access type, or runs the resolver and caches
   * its outcome.
   */
  @Nonnull
  public StatusOr<FolderAccess> getOrResolve(
      @Nonnull String projectName,
      @Nonnull AccessType accessType,
      @Nonnull Supplier<StatusOr<FolderAccess>> resolver) {
    Key key = new Key(projectName.toLowerCase(Locale.ROOT), Objects.requireNonNull(accessType));
    StatusOr<FolderAccess> cached = resolved.get(key);
    if (cached != null) {
      Logger.debug("Using cached {} access for project {}", accessType.key(), projectName);
      return cached;
    }
    StatusOr<FolderAccess> outcome = resolver.get();
    if (outcome.isOk() || outcome.getStatus().isPermissionDenied()) {
      resolved.put(key, outcome);
    }
    return outcome;
  }

  /** Drops everything cached so far. */
  public void clear() {
    resolved.clear();
  }

  public int size() {
    return resolved.size();
  }
}
