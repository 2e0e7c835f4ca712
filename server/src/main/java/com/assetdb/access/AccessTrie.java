package com.assetdb.access;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import javax.annotation.Nonnull;

/**
 * Prefix tree over folder path segments, used to test many paths against one resolved
 * {@link FolderAccess} without going back to the database (hierarchy listings, rows fetched by
 * another query, streamed trees).
 *
 * <p>Membership follows {@link PathSet}: a path is granted when it is one of the exact paths, or
 * when walking its segments passes through a terminal node before the path ends. Reaching a
 * terminal node with no segments left does not grant anything by itself; the folder at a
 * subtree prefix is only granted when it is also an exact path. This matches the SQL rendered by
 * {@link SqlPredicateBuilder} for the same access.
 *
 * <p>Tries are read-only after {@link #build} and may be shared between threads.
 */
public final class AccessTrie {

  private static final AccessTrie ALLOW_ALL = new AccessTrie(true, ImmutableSet.of(), new Node());

  private final boolean allowAll;
  private final ImmutableSet<String> exactPaths;
  private final Node root;

  private AccessTrie(boolean allowAll, ImmutableSet<String> exactPaths, Node root) {
    this.allowAll = allowAll;
    this.exactPaths = exactPaths;
    this.root = root;
  }

  /** Builds a trie for resolved access; unrestricted access yields a trie that allows all. */
  @Nonnull
  public static AccessTrie build(@Nonnull FolderAccess access) {
    if (access.isUnrestricted()) {
      return ALLOW_ALL;
    }
    return build(access.pathSet().orElseThrow());
  }

  @Nonnull
  public static AccessTrie build(@Nonnull PathSet pathSet) {
    Node root = new Node();
    for (String prefix : pathSet.subtreePrefixes()) {
      Node node = root;
      for (String segment : PathSet.SEGMENTS.split(prefix)) {
        node = node.children.computeIfAbsent(segment, s -> new Node());
      }
      node.terminal = true;
    }
    return new AccessTrie(false, pathSet.exactPaths(), root);
  }

  public boolean allowsAll() {
    return allowAll;
  }

  /**
   * Tests whether a folder path is granted.
   *
   * @param path a folder path; leading and trailing slashes are ignored
   */
  public boolean contains(String path) {
    if (allowAll) {
      return true;
    }
    String normalized = PathSet.normalize(path);
    if (exactPaths.contains(normalized)) {
      return true;
    }
    List<String> segments = PathSet.SEGMENTS.splitToList(normalized);
    Node node = root;
    for (int i = 0; i < segments.size(); i++) {
      node = node.children.get(segments.get(i));
      if (node == null) {
        return false;
      }
      if (node.terminal && i < segments.size() - 1) {
        return true;
      }
    }
    return false;
  }

  /**
   * Keeps the items whose folder path is granted, preserving their order.
   *
   * @param items rows or tree nodes
   * @param pathOf extracts the folder path of an item
   */
  @Nonnull
  public <T> List<T> filter(@Nonnull Collection<T> items, @Nonnull Function<T, String> pathOf) {
    if (allowAll) {
      return ImmutableList.copyOf(items);
    }
    ImmutableList.Builder<T> result = ImmutableList.builder();
    for (T item : items) {
      if (contains(pathOf.apply(item))) {
        result.add(item);
      }
    }
    return result.build();
  }

  private static final class Node {
    private final Map<String, Node> children = new HashMap<>();
    private boolean terminal;
  }
}
