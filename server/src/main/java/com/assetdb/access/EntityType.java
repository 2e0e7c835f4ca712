package com.assetdb.access;

import javax.annotation.Nullable;

/**
 * Entity types the server stores, with the parent chain that connects each project-level type
 * to the folder hierarchy. {@link SqlPredicateBuilder} walks this chain to join an entity's table
 * to the {@code hierarchy} view that holds folder paths.
 */
public enum EntityType {
  FOLDER("folder", "folders", null, null),
  TASK("task", "tasks", FOLDER, "folder_id"),
  WORKFILE("workfile", "workfiles", TASK, "task_id"),
  PRODUCT("product", "products", FOLDER, "folder_id"),
  VERSION("version", "versions", PRODUCT, "product_id"),
  REPRESENTATION("representation", "representations", VERSION, "version_id"),
  // top-level entities live outside any project hierarchy
  PROJECT("project", "projects", null, null),
  USER("user", "users", null, null);

  private final String key;
  private final String table;
  private final EntityType parent;
  private final String parentColumn;

  EntityType(String key, String table, EntityType parent, String parentColumn) {
    this.key = key;
    this.table = table;
    this.parent = parent;
    this.parentColumn = parentColumn;
  }

  public String key() {
    return key;
  }

  public String table() {
    return table;
  }

  /** The entity type this one belongs to, or null for folders and top-level types. */
  @Nullable
  public EntityType parent() {
    return parent;
  }

  /** The column of this type's table referencing the parent's id. */
  @Nullable
  public String parentColumn() {
    return parentColumn;
  }

  /** Whether entities of this type can be located in the folder hierarchy. */
  public boolean hasHierarchyPath() {
    return this == FOLDER || parent != null;
  }
}
