package com.assetdb.access;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Renders resolved folder access as SQL.
 *
 * <p>The predicate for a {@link PathSet} reads
 *
 * <pre>
 * (hierarchy.path = ANY(?) OR hierarchy.path LIKE ANY(?))
 * </pre>
 *
 * where the first array holds the exact paths and the second the subtree prefixes as LIKE
 * patterns ({@code prefix/%}, with {@code \}, {@code %} and {@code _} in the prefix escaped). Path
 * values are always bound, never written into the query text.
 *
 * <p>Join chains come from {@link EntityType#parent()}, so every entity type reaches
 * {@code hierarchy} the same way, e.g. representation to version to product to folder.
 */
public final class SqlPredicateBuilder {

  /** Alias under which queries select the project's hierarchy view. */
  public static final String HIERARCHY_ALIAS = "hierarchy";

  /** The folder path column of the hierarchy view. */
  public static final String PATH_COLUMN = HIERARCHY_ALIAS + ".path";

  private static final Pattern COLUMN =
      Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
  private static final Pattern PROJECT_NAME = Pattern.compile("[A-Za-z0-9_]+");

  private SqlPredicateBuilder() {
    // Utility class
  }

  /**
   * Builds the path predicate for resolved access.
   *
   * @param pathColumn a column reference such as {@code hierarchy.path}
   * @param access the resolved access
   * @return the predicate, or empty when access is unrestricted
   * @throws IllegalArgumentException if pathColumn is not a plain column reference
   */
  @Nonnull
  public static Optional<SqlPredicate> buildPredicate(
      @Nonnull String pathColumn, @Nonnull FolderAccess access) {
    checkColumn(pathColumn);
    if (access.isUnrestricted()) {
      return Optional.empty();
    }
    return Optional.of(buildPredicate(pathColumn, access.pathSet().orElseThrow()));
  }

  /** Builds the path predicate for a concrete path set; an empty set renders {@code FALSE}. */
  @Nonnull
  public static SqlPredicate buildPredicate(@Nonnull String pathColumn, @Nonnull PathSet pathSet) {
    checkColumn(pathColumn);
    List<String> terms = new ArrayList<>();
    List<List<String>> params = new ArrayList<>();

    if (!pathSet.exactPaths().isEmpty()) {
      terms.add(pathColumn + " = ANY(?)");
      params.add(pathSet.exactPaths().asList());
    }
    if (!pathSet.subtreePrefixes().isEmpty()) {
      terms.add(pathColumn + " LIKE ANY(?)");
      params.add(
          pathSet.subtreePrefixes().stream()
              .map(SqlPredicateBuilder::subtreePattern)
              .collect(ImmutableList.toImmutableList()));
    }
    if (terms.isEmpty()) {
      return new SqlPredicate("FALSE", ImmutableList.of());
    }
    return new SqlPredicate("(" + String.join(" OR ", terms) + ")", params);
  }

  /**
   * Returns the joins needed to reach {@code hierarchy} from an entity's table. The query is
   * expected to select {@code FROM <schema>.hierarchy AS hierarchy}; folders need no join.
   *
   * @throws IllegalArgumentException if the entity type has no place in the folder hierarchy, or
   *     the project name is not a valid identifier
   */
  @Nonnull
  public static List<String> joinsFor(@Nonnull EntityType entityType, @Nonnull String projectName) {
    String schema = projectSchema(projectName);
    checkHierarchyPath(entityType);
    List<String> joins = new ArrayList<>();
    for (EntityType type = entityType; type.parent() != null; type = type.parent()) {
      joins.add(
          "INNER JOIN "
              + schema
              + "."
              + type.table()
              + " AS "
              + type.table()
              + " ON "
              + type.table()
              + "."
              + type.parentColumn()
              + " = "
              + idColumn(type.parent()));
    }
    return ImmutableList.copyOf(Lists.reverse(joins));
  }

  /** Returns the joins and path predicate for querying one entity type under resolved access. */
  @Nonnull
  public static EntityAccessFilter predicateFor(
      @Nonnull EntityType entityType, @Nonnull String projectName, @Nonnull FolderAccess access) {
    return new EntityAccessFilter(
        entityType, joinsFor(entityType, projectName), buildPredicate(PATH_COLUMN, access));
  }

  /** The qualified id column of an entity type within a joined hierarchy query. */
  @Nonnull
  public static String idColumn(@Nonnull EntityType entityType) {
    checkHierarchyPath(entityType);
    if (entityType == EntityType.FOLDER) {
      return HIERARCHY_ALIAS + ".id";
    }
    return entityType.table() + ".id";
  }

  /**
   * Returns the schema holding a project's tables.
   *
   * @throws IllegalArgumentException if the name contains anything but letters, digits and '_'
   */
  @Nonnull
  public static String projectSchema(@Nonnull String projectName) {
    Preconditions.checkArgument(
        PROJECT_NAME.matcher(projectName).matches(), "Invalid project name: %s", projectName);
    return "project_" + projectName.toLowerCase(Locale.ROOT);
  }

  /** Escapes a subtree prefix for LIKE and appends the descendant wildcard. */
  static String subtreePattern(String prefix) {
    StringBuilder sb = new StringBuilder(prefix.length() + 4);
    for (int i = 0; i < prefix.length(); i++) {
      char c = prefix.charAt(i);
      switch (c) {
        case '\\': sb.append("\\\\"); break;
        case '%':  sb.append("\\%"); break;
        case '_':  sb.append("\\_"); break;
        default:   sb.append(c);
      }
    }
    return sb.append("/%").toString();
  }

  private static void checkColumn(String pathColumn) {
    Preconditions.checkArgument(
        COLUMN.matcher(pathColumn).matches(), "Invalid path column: %s", pathColumn);
  }

  private static void checkHierarchyPath(EntityType entityType) {
    if (!entityType.hasHierarchyPath()) {
      Logger.error("No join chain to the folder hierarchy for entity type {}", entityType.key());
      throw new IllegalArgumentException(
          "Entity type " + entityType.key() + " has no folder hierarchy path");
    }
  }
}
