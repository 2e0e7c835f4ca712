package com.assetdb.access;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;

/**
 * What a query over one entity type needs to honor folder access: the joins that reach the
 * {@code hierarchy} view from the entity's table, and the path predicate. The predicate is empty
 * when access is unrestricted.
 *
 * @param entityType the entity type being queried
 * @param joins join clauses, outermost first
 * @param predicate the path predicate over {@code hierarchy.path}
 */
public record EntityAccessFilter(
    EntityType entityType, List<String> joins, Optional<SqlPredicate> predicate) {

  public EntityAccessFilter {
    joins = ImmutableList.copyOf(joins);
  }

  /** The joins as one clause, ready to follow {@code FROM <schema>.hierarchy AS hierarchy}. */
  public String joinClause() {
    return String.join("\n", joins);
  }
}
