package com.assetdb.db;

import com.assetdb.common.status.Status;
import com.assetdb.common.status.StatusOr;
import com.assetdb.db.util.DbUtil;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import javax.annotation.Nonnull;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DAO helper class for the 'users' table.
 */
public final class Users {

    private Users() {
        // Utility class
    }

    /**
     * Loads a single user by name.
     *
     * @param conn an open JDBC connection
     * @param name the login name
     * @return StatusOr containing an Optional User or an error
     */
    @Nonnull
    public static StatusOr<Optional<User>> loadByName(Connection conn, String name) {
        String sql = """
                SELECT name, active, data
                  FROM public.users
                 WHERE name = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, name);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    StatusOr<User> userOr = extractUser(rs);
                    if (userOr.isNotOk()) {
                        return StatusOr.ofStatus(userOr.getStatus());
                    }
                    return StatusOr.ofValue(Optional.of(userOr.getValue()));
                }
                return StatusOr.ofValue(Optional.empty());
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.statusForSqlException(e, false, "User load"));
        }
    }

    /**
     * Inserts or updates a user row (upsert).
     *
     * @param conn an open JDBC connection
     * @param user the User object to save
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> save(Connection conn, User user) {
        String sql = """
                INSERT INTO public.users (name, active, data)
                VALUES (?, ?, ?)
                ON CONFLICT(name)
                DO UPDATE SET active = excluded.active,
                              data   = excluded.data
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, user.name());
            stmt.setBoolean(2, user.active());
            Status jsonStatus = DbUtil.setJsonbParameter(stmt, 3, toJson(user));
            if (jsonStatus.isError()) {
                return StatusOr.ofStatus(jsonStatus);
            }

            int rowsAffected = stmt.executeUpdate();
            return StatusOr.ofValue(rowsAffected);
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.statusForSqlException(e, false, "User save"));
        }
    }

    /**
     * Deletes a user by name.
     *
     * @param conn an open JDBC connection
     * @param name the login name
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> delete(Connection conn, String name) {
        String sql = """
                DELETE FROM public.users
                 WHERE name = ?
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, name);
            int rowsAffected = stmt.executeUpdate();
            return StatusOr.ofValue(rowsAffected);
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.statusForSqlException(e, false, "User delete"));
        }
    }

    /**
     * Extracts a User from the current row of a ResultSet.
     */
    @Nonnull
    private static StatusOr<User> extractUser(ResultSet rs) throws SQLException {
        String name = rs.getString("name");
        boolean active = rs.getBoolean("active");

        StatusOr<JsonObject> dataOr = DbUtil.parseJsonbObject(rs, "data");
        if (dataOr.isNotOk()) {
            return StatusOr.ofStatus(dataOr.getStatus());
        }
        JsonObject data = dataOr.getValue();

        return StatusOr.ofValue(new User(
                name,
                active,
                flag(data, "isAdmin"),
                flag(data, "isManager"),
                flag(data, "isService"),
                flag(data, "isGuest"),
                DbUtil.toStringListMap(data.get("accessGroups")),
                DbUtil.toStringList(data.get("defaultAccessGroups"))
        ));
    }

    private static boolean flag(JsonObject data, String key) {
        JsonElement value = data.get(key);
        return value != null && value.isJsonPrimitive() && value.getAsBoolean();
    }

    private static String toJson(User user) {
        JsonObject data = new JsonObject();
        data.addProperty("isAdmin", user.admin());
        data.addProperty("isManager", user.manager());
        data.addProperty("isService", user.service());
        data.addProperty("isGuest", user.guest());
        JsonObject accessGroups = new JsonObject();
        for (Map.Entry<String, List<String>> entry : user.accessGroups().entrySet()) {
            accessGroups.add(entry.getKey(), toJsonArray(entry.getValue()));
        }
        data.add("accessGroups", accessGroups);
        data.add("defaultAccessGroups", toJsonArray(user.defaultAccessGroups()));
        return DbUtil.toJson(data);
    }

    private static JsonArray toJsonArray(List<String> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }
}
