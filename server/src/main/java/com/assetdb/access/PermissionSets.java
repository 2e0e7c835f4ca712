package com.assetdb.access;

import com.assetdb.common.status.Status;
import com.assetdb.common.status.StatusOr;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * Reads and writes the JSON documents stored in {@code access_groups.data}.
 *
 * <p>Document shape:
 *
 * <pre>
 * {
 *   "read": {"enabled": true, "access_list": [{"access_type": "hierarchy", "path": "assets"}]},
 *   "update": {"enabled": false},
 *   "attrib_write": {"enabled": true, "attributes": ["fps", "frameStart"]},
 *   "endpoints": {"enabled": true, "endpoints": ["all"]}
 * }
 * </pre>
 *
 * <p>Keys may be snake_case or camelCase. A missing dimension, {@code "enabled": false}, the bare
 * string {@code "all"} and any list containing {@code "all"} all mean unrestricted. A bare JSON
 * list of grants is read as an enabled dimension.
 */
public final class PermissionSets {

  static final String ALL = "all";

  private static final Gson GSON = new Gson();

  private PermissionSets() {
    // Utility class
  }

  /**
   * Parses a stored access group document.
   *
   * @return the permission set, or FAILED_PRECONDITION describing the malformed part
   */
  @Nonnull
  public static StatusOr<PermissionSet> fromJson(String json) {
    if (Strings.isNullOrEmpty(json)) {
      return StatusOr.ofValue(PermissionSet.unrestricted());
    }
    try {
      JsonElement root = JsonParser.parseString(json);
      if (root.isJsonNull()) {
        return StatusOr.ofValue(PermissionSet.unrestricted());
      }
      if (!root.isJsonObject()) {
        return StatusOr.ofStatus(Status.failedPrecondition("Permissions must be a JSON object"));
      }
      return StatusOr.ofValue(fromJsonObject(root.getAsJsonObject()));
    } catch (JsonParseException | IllegalArgumentException | IllegalStateException e) {
      return StatusOr.ofStatus(
          Status.failedPrecondition("Malformed permissions: " + e.getMessage()));
    }
  }

  private static PermissionSet fromJsonObject(JsonObject root) {
    PermissionSet.Builder builder = PermissionSet.builder();
    for (AccessType accessType : AccessType.values()) {
      builder.folderAccess(
          accessType, folderScope(accessType.key(), member(root, accessType.key(), null)));
    }
    builder.attribRead(
        nameScope("attrib_read", member(root, "attrib_read", "attribRead"), "attributes"));
    builder.attribWrite(
        nameScope("attrib_write", member(root, "attrib_write", "attribWrite"), "attributes"));
    builder.endpoints(nameScope("endpoints", member(root, "endpoints", null), "endpoints"));
    return builder.build();
  }

  private static AccessScope<FolderAccessGrant> folderScope(String name, JsonElement element) {
    if (element == null || element.isJsonNull() || isAll(element)) {
      return AccessScope.unrestricted();
    }
    if (element.isJsonArray()) {
      return AccessScope.restricted(grants(name, element.getAsJsonArray()));
    }
    if (!element.isJsonObject()) {
      throw new IllegalArgumentException("'" + name + "' must be an object");
    }
    JsonObject dimension = element.getAsJsonObject();
    if (!enabled(name, dimension)) {
      return AccessScope.unrestricted();
    }
    JsonElement list = member(dimension, "access_list", "accessList");
    if (list == null || list.isJsonNull()) {
      return AccessScope.denyAll();
    }
    if (!list.isJsonArray()) {
      throw new IllegalArgumentException("'" + name + ".access_list' must be a list");
    }
    return AccessScope.restricted(grants(name, list.getAsJsonArray()));
  }

  private static List<FolderAccessGrant> grants(String name, JsonArray array) {
    ImmutableList.Builder<FolderAccessGrant> grants = ImmutableList.builder();
    for (JsonElement item : array) {
      if (!item.isJsonObject()) {
        throw new IllegalArgumentException("'" + name + "' contains a non-object grant");
      }
      JsonObject grant = item.getAsJsonObject();
      JsonElement typeElement = member(grant, "access_type", "accessType");
      String typeKey =
          typeElement == null || typeElement.isJsonNull()
              ? GrantType.ASSIGNED.key()
              : string(name + ".access_type", typeElement);
      GrantType type = GrantType.fromKey(typeKey);
      if (type == null) {
        throw new IllegalArgumentException(
            "'" + name + "' contains unknown access type '" + typeKey + "'");
      }
      JsonElement path = grant.get("path");
      try {
        grants.add(
            FolderAccessGrant.of(
                type, path == null || path.isJsonNull() ? null : string(name + ".path", path)));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("'" + name + "': " + e.getMessage(), e);
      }
    }
    return grants.build();
  }

  private static AccessScope<String> nameScope(String name, JsonElement element, String listKey) {
    if (element == null || element.isJsonNull() || isAll(element)) {
      return AccessScope.unrestricted();
    }
    JsonElement list;
    if (element.isJsonArray()) {
      list = element;
    } else if (element.isJsonObject()) {
      if (!enabled(name, element.getAsJsonObject())) {
        return AccessScope.unrestricted();
      }
      list = element.getAsJsonObject().get(listKey);
    } else {
      throw new IllegalArgumentException("'" + name + "' must be an object");
    }
    if (list == null || list.isJsonNull()) {
      return AccessScope.denyAll();
    }
    if (!list.isJsonArray()) {
      throw new IllegalArgumentException("'" + name + "." + listKey + "' must be a list");
    }
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (JsonElement item : list.getAsJsonArray()) {
      String value = string(name + "." + listKey, item);
      if (ALL.equals(value)) {
        return AccessScope.unrestricted();
      }
      names.add(value);
    }
    return AccessScope.restricted(names.build());
  }

  private static boolean enabled(String name, JsonObject dimension) {
    JsonElement enabled = dimension.get("enabled");
    if (enabled == null || enabled.isJsonNull()) {
      return false;
    }
    if (!enabled.isJsonPrimitive() || !enabled.getAsJsonPrimitive().isBoolean()) {
      throw new IllegalArgumentException("'" + name + ".enabled' must be true or false");
    }
    return enabled.getAsBoolean();
  }

  private static String string(String name, JsonElement element) {
    if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
      throw new IllegalArgumentException("'" + name + "' must contain strings only");
    }
    return element.getAsString();
  }

  private static boolean isAll(JsonElement element) {
    return element.isJsonPrimitive()
        && element.getAsJsonPrimitive().isString()
        && ALL.equals(element.getAsString());
  }

  private static JsonElement member(JsonObject object, String key, String alternateKey) {
    JsonElement element = object.get(key);
    if (element == null && alternateKey != null) {
      element = object.get(alternateKey);
    }
    return element;
  }

  /** Serializes a permission set in the stored document shape (snake_case keys). */
  @Nonnull
  public static String toJson(@Nonnull PermissionSet permissions) {
    JsonObject root = new JsonObject();
    for (AccessType accessType : AccessType.values()) {
      AccessScope<FolderAccessGrant> scope = permissions.folderAccess(accessType);
      JsonObject dimension = new JsonObject();
      dimension.addProperty("enabled", !scope.isUnrestricted());
      if (!scope.isUnrestricted()) {
        JsonArray list = new JsonArray();
        for (FolderAccessGrant grant : scope.items()) {
          JsonObject item = new JsonObject();
          item.addProperty("access_type", grant.type().key());
          grant.path().ifPresent(path -> item.addProperty("path", path));
          list.add(item);
        }
        dimension.add("access_list", list);
      }
      root.add(accessType.key(), dimension);
    }
    root.add("attrib_read", nameScopeToJson(permissions.attribRead(), "attributes"));
    root.add("attrib_write", nameScopeToJson(permissions.attribWrite(), "attributes"));
    root.add("endpoints", nameScopeToJson(permissions.endpoints(), "endpoints"));
    return GSON.toJson(root);
  }

  private static JsonObject nameScopeToJson(AccessScope<String> scope, String listKey) {
    JsonObject dimension = new JsonObject();
    dimension.addProperty("enabled", !scope.isUnrestricted());
    if (!scope.isUnrestricted()) {
      JsonArray list = new JsonArray();
      scope.items().forEach(name -> list.add(new JsonPrimitive(name)));
      dimension.add(listKey, list);
    }
    return dimension;
  }
}
