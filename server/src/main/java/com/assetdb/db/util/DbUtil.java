package com.assetdb.db.util;

import com.assetdb.common.status.Status;
import com.assetdb.common.status.StatusOr;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientException;
import java.sql.Types;
import java.util.List;
import java.util.Map;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/** Utility methods for database operations. */
public final class DbUtil {

  /** SQLSTATE raised by PostgreSQL when a statement is cancelled or times out. */
  public static final String QUERY_CANCELED = "57014";

  private static final Gson GSON = new Gson();

  private DbUtil() {
    // Utility class, no instances
  }

  /**
   * Classifies a failed statement.
   *
   * <ul>
   *   <li>CANCELLED when the statement was cancelled on purpose;
   *   <li>UNAVAILABLE for connection failures (08xxx), insufficient resources (53xxx), server
   *       shutdown (57P0x), statement timeouts and transient driver errors;
   *   <li>INTERNAL for everything else, which is logged with the exception.
   * </ul>
   *
   * @param e the exception thrown by the driver
   * @param cancelled whether the caller cancelled the statement
   * @param context short description of the operation, used in the message
   */
  @Nonnull
  public static Status statusForSqlException(
      @Nonnull SQLException e, boolean cancelled, @Nonnull String context) {
    if (cancelled) {
      return Status.cancelled(context + " cancelled");
    }
    String state = Strings.nullToEmpty(e.getSQLState());
    if (e instanceof SQLTransientException
        || state.startsWith("08")
        || state.startsWith("53")
        || state.startsWith("57P0")) {
      return Status.unavailable(context + " failed: " + e.getMessage(), e);
    }
    if (QUERY_CANCELED.equals(state)) {
      return Status.unavailable(context + " timed out", e);
    }
    Logger.error(e, "{} failed with SQLSTATE {}", context, state);
    return Status.internal(context + " failed: " + e.getMessage(), e);
  }

  /**
   * Reads a JSONB column as a JSON object. A null or empty column reads as an empty object.
   *
   * @return the object, or FAILED_PRECONDITION when the stored value is not a JSON object
   */
  @Nonnull
  public static StatusOr<JsonObject> parseJsonbObject(ResultSet rs, String columnName) {
    try {
      String jsonbStr = rs.getString(columnName);
      if (rs.wasNull() || Strings.isNullOrEmpty(jsonbStr)) {
        return StatusOr.ofValue(new JsonObject());
      }
      try {
        JsonElement element = JsonParser.parseString(jsonbStr);
        if (!element.isJsonObject()) {
          return StatusOr.ofStatus(
              Status.failedPrecondition("Column " + columnName + " is not a JSON object"));
        }
        return StatusOr.ofValue(element.getAsJsonObject());
      } catch (JsonParseException e) {
        return StatusOr.ofStatus(
            Status.failedPrecondition("Failed to parse JSON: " + e.getMessage()));
      }
    } catch (SQLException e) {
      return StatusOr.ofStatus(Status.internal("Failed to retrieve JSONB: " + e.getMessage(), e));
    }
  }

  /**
   * Reads a JSON object whose values are string lists, such as {@code {"demo": ["artist"]}}.
   * Members that are not lists are skipped.
   */
  @Nonnull
  public static Map<String, List<String>> toStringListMap(JsonElement element) {
    if (element == null || !element.isJsonObject()) {
      return ImmutableMap.of();
    }
    ImmutableMap.Builder<String, List<String>> result = ImmutableMap.builder();
    for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
      if (entry.getValue().isJsonArray()) {
        result.put(entry.getKey(), toStringList(entry.getValue()));
      }
    }
    return result.buildKeepingLast();
  }

  /** Reads a JSON list of strings; anything else reads as an empty list. */
  @Nonnull
  public static List<String> toStringList(JsonElement element) {
    if (element == null || !element.isJsonArray()) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<String> result = ImmutableList.builder();
    for (JsonElement item : element.getAsJsonArray()) {
      if (item.isJsonPrimitive()) {
        result.add(item.getAsString());
      }
    }
    return result.build();
  }

  /** Serializes a value with Gson for storage in a JSONB column. */
  @Nonnull
  public static String toJson(Object value) {
    return value == null ? "{}" : GSON.toJson(value);
  }

  /**
   * Sets a JSON document as a JSONB value in a PreparedStatement.
   *
   * @param stmt The PreparedStatement to set the parameter in
   * @param parameterIndex The index of the parameter to set (1-based)
   * @param json The JSON text; null or empty stores an empty object
   */
  @Nonnull
  public static Status setJsonbParameter(PreparedStatement stmt, int parameterIndex, String json) {
    try {
      stmt.setObject(parameterIndex, Strings.isNullOrEmpty(json) ? "{}" : json, Types.OTHER);
      return Status.ok();
    } catch (SQLException e) {
      return Status.internal("Failed to set JSONB parameter: " + e.getMessage(), e);
    }
  }
}
