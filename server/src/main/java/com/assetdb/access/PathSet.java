package com.assetdb.access;

import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A concrete set of folder paths a user may access.
 *
 * <p>A path belongs to the set when it equals one of the exact paths, or when it lies strictly
 * below one of the subtree prefixes (starts with {@code prefix + "/"}). A HIERARCHY grant on
 * {@code a/b} is therefore stored as the exact path {@code a/b} plus the subtree prefix
 * {@code a/b}; a CHILDREN grant only as the subtree prefix. {@link AccessTrie} and
 * {@link SqlPredicateBuilder} both evaluate exactly this membership rule.
 *
 * <p>An empty set denies everything.
 */
public final class PathSet {

  private static final PathSet EMPTY = new PathSet(ImmutableSet.of(), ImmutableSet.of());
  private static final CharMatcher SLASH = CharMatcher.is('/');
  static final Splitter SEGMENTS = Splitter.on('/');

  private final ImmutableSet<String> exactPaths;
  private final ImmutableSet<String> subtreePrefixes;

  private PathSet(ImmutableSet<String> exactPaths, ImmutableSet<String> subtreePrefixes) {
    this.exactPaths = exactPaths;
    this.subtreePrefixes = subtreePrefixes;
  }

  @Nonnull
  public static PathSet empty() {
    return EMPTY;
  }

  @Nonnull
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Normalizes a folder path: surrounding whitespace and leading or trailing slashes are removed.
   *
   * @return the normalized path, or an empty string for null input
   */
  @Nonnull
  public static String normalize(@Nullable String path) {
    if (path == null) {
      return "";
    }
    return SLASH.trimFrom(path.trim());
  }

  @Nonnull
  public ImmutableSet<String> exactPaths() {
    return exactPaths;
  }

  @Nonnull
  public ImmutableSet<String> subtreePrefixes() {
    return subtreePrefixes;
  }

  public boolean isEmpty() {
    return exactPaths.isEmpty() && subtreePrefixes.isEmpty();
  }

  /**
   * Returns a copy that also contains every ancestor needed to display the granted folders:
   * the proper ancestors of each exact path, and each subtree prefix together with its own
   * ancestors (a prefix is the parent of everything its subtree grants).
   */
  @Nonnull
  public PathSet withAncestors() {
    Builder builder = builder().addAll(this);
    for (String path : exactPaths) {
      builder.addAncestors(path, false);
    }
    for (String prefix : subtreePrefixes) {
      builder.addAncestors(prefix, true);
    }
    return builder.build();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof PathSet)) {
      return false;
    }
    PathSet other = (PathSet) obj;
    return exactPaths.equals(other.exactPaths) && subtreePrefixes.equals(other.subtreePrefixes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(exactPaths, subtreePrefixes);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("exactPaths", exactPaths)
        .add("subtreePrefixes", subtreePrefixes)
        .toString();
  }

  /** Accumulates paths; blank paths are ignored. */
  public static final class Builder {
    private final ImmutableSet.Builder<String> exactPaths = ImmutableSet.builder();
    private final ImmutableSet.Builder<String> subtreePrefixes = ImmutableSet.builder();

    private Builder() {}

    public Builder addExact(String path) {
      String normalized = normalize(path);
      if (!normalized.isEmpty()) {
        exactPaths.add(normalized);
      }
      return this;
    }

    public Builder addSubtree(String prefix) {
      String normalized = normalize(prefix);
      if (!normalized.isEmpty()) {
        subtreePrefixes.add(normalized);
      }
      return this;
    }

    /** Adds a folder and everything below it. */
    public Builder addHierarchy(String path) {
      return addExact(path).addSubtree(path);
    }

    public Builder addAll(PathSet other) {
      exactPaths.addAll(other.exactPaths);
      subtreePrefixes.addAll(other.subtreePrefixes);
      return this;
    }

    /** Adds the ancestors of a path as exact paths, optionally including the path itself. */
    Builder addAncestors(String path, boolean includeSelf) {
      List<String> segments = SEGMENTS.splitToList(normalize(path));
      int last = includeSelf ? segments.size() : segments.size() - 1;
      StringBuilder current = new StringBuilder();
      for (int i = 0; i < last; i++) {
        if (i > 0) {
          current.append('/');
        }
        current.append(segments.get(i));
        addExact(current.toString());
      }
      return this;
    }

    public PathSet build() {
      ImmutableSet<String> exact = exactPaths.build();
      ImmutableSet<String> subtree = subtreePrefixes.build();
      if (exact.isEmpty() && subtree.isEmpty()) {
        return EMPTY;
      }
      return new PathSet(exact, subtree);
    }
  }
}
