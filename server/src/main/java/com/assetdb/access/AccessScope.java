package com.assetdb.access;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.Objects;
import javax.annotation.Nonnull;

/**
 * One permission dimension: either unrestricted, or restricted to an ordered set of allowed
 * items (folder grants, attribute names or endpoint names).
 *
 * <p>The two variants are not interchangeable with an empty list. A restricted scope with no
 * items allows nothing, while an unrestricted scope allows everything.
 *
 * @param <T> the type of the whitelisted items
 */
public final class AccessScope<T> {

  private static final AccessScope<?> UNRESTRICTED = new AccessScope<>(null);

  // null means unrestricted
  private final ImmutableSet<T> items;

  private AccessScope(ImmutableSet<T> items) {
    this.items = items;
  }

  /** Returns the scope that places no restriction on the dimension. */
  @SuppressWarnings("unchecked")
  @Nonnull
  public static <T> AccessScope<T> unrestricted() {
    return (AccessScope<T>) UNRESTRICTED;
  }

  /** Returns a scope allowing only the given items, in iteration order, without duplicates. */
  @Nonnull
  public static <T> AccessScope<T> restricted(@Nonnull Collection<? extends T> items) {
    return new AccessScope<>(ImmutableSet.copyOf(items));
  }

  @SafeVarargs
  @Nonnull
  public static <T> AccessScope<T> restricted(T... items) {
    return new AccessScope<>(ImmutableSet.copyOf(items));
  }

  /** Returns a restricted scope that allows nothing. */
  @Nonnull
  public static <T> AccessScope<T> denyAll() {
    return new AccessScope<>(ImmutableSet.of());
  }

  public boolean isUnrestricted() {
    return items == null;
  }

  /**
   * Returns the whitelisted items.
   *
   * @throws IllegalStateException if the scope is unrestricted
   */
  @Nonnull
  public ImmutableSet<T> items() {
    if (items == null) {
      throw new IllegalStateException("Unrestricted scope has no item list");
    }
    return items;
  }

  /** Whether the given item is allowed by this scope. */
  public boolean permits(T item) {
    return items == null || items.contains(item);
  }

  /**
   * Unions two scopes. If either side is unrestricted the result is unrestricted; otherwise the
   * result holds this scope's items followed by the other's items not already present.
   */
  @Nonnull
  public AccessScope<T> union(@Nonnull AccessScope<T> other) {
    if (isUnrestricted() || other.isUnrestricted()) {
      return unrestricted();
    }
    return new AccessScope<>(
        ImmutableSet.<T>builder().addAll(items).addAll(other.items).build());
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof AccessScope)) {
      return false;
    }
    return Objects.equals(items, ((AccessScope<?>) obj).items);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(items);
  }

  @Override
  public String toString() {
    if (items == null) {
      return "AccessScope{unrestricted}";
    }
    return MoreObjects.toStringHelper(this).add("items", items).toString();
  }
}
