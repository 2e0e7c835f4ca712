package com.assetdb.db;

import com.assetdb.access.SqlPredicateBuilder;
import com.assetdb.common.status.Status;
import com.assetdb.common.status.StatusOr;
import com.assetdb.db.util.DbUtil;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * DAO helper class for the global and per-project 'access_groups' tables.
 */
public final class AccessGroups {

    private AccessGroups() {
        // Utility class
    }

    /**
     * Loads all global access groups.
     *
     * @param conn an open JDBC connection
     * @return StatusOr containing the groups, each with project name {@code "_"}
     */
    @Nonnull
    public static StatusOr<List<AccessGroupRecord>> loadGlobal(Connection conn) {
        return load(conn, "public", AccessGroupRecord.GLOBAL);
    }

    /**
     * Loads the access group overrides of one project.
     *
     * @param conn an open JDBC connection
     * @param projectName the project name
     * @return StatusOr containing the project's groups or an error
     */
    @Nonnull
    public static StatusOr<List<AccessGroupRecord>> loadForProject(Connection conn, String projectName) {
        return load(conn, SqlPredicateBuilder.projectSchema(projectName), projectName);
    }

    /**
     * Lists the names of all projects.
     *
     * @param conn an open JDBC connection
     * @return StatusOr containing the project names in name order
     */
    @Nonnull
    public static StatusOr<List<String>> listProjectNames(Connection conn) {
        String sql = """
                SELECT name
                  FROM public.projects
                 ORDER BY name
                """;
        try (PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            List<String> result = new ArrayList<>();
            while (rs.next()) {
                result.add(rs.getString("name"));
            }
            return StatusOr.ofValue(ImmutableList.copyOf(result));
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.statusForSqlException(e, false, "Project listing"));
        }
    }

    /**
     * Inserts or updates an access group (upsert) in the table its project name selects.
     *
     * @param conn an open JDBC connection
     * @param group the access group to save
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> save(Connection conn, AccessGroupRecord group) {
        String sql = """
                INSERT INTO %s.access_groups (name, data)
                VALUES (?, ?)
                ON CONFLICT(name)
                DO UPDATE SET data = excluded.data
                """.formatted(schemaOf(group.projectName()));
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, group.name());
            Status jsonStatus = DbUtil.setJsonbParameter(stmt, 2, group.data());
            if (jsonStatus.isError()) {
                return StatusOr.ofStatus(jsonStatus);
            }
            int rowsAffected = stmt.executeUpdate();
            return StatusOr.ofValue(rowsAffected);
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.statusForSqlException(e, false, "Access group save"));
        }
    }

    /**
     * Deletes an access group.
     *
     * @param conn an open JDBC connection
     * @param name the access group name
     * @param projectName the owning project, or {@code "_"} for a global group
     * @return StatusOr containing the number of affected rows or an error
     */
    @Nonnull
    public static StatusOr<Integer> delete(Connection conn, String name, String projectName) {
        String sql = """
                DELETE FROM %s.access_groups
                 WHERE name = ?
                """.formatted(schemaOf(projectName));
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, name);
            int rowsAffected = stmt.executeUpdate();
            return StatusOr.ofValue(rowsAffected);
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.statusForSqlException(e, false, "Access group delete"));
        }
    }

    private static StatusOr<List<AccessGroupRecord>> load(
            Connection conn, String schema, String projectName) {
        String sql = """
                SELECT name, data::text AS data
                  FROM %s.access_groups
                 ORDER BY name
                """.formatted(schema);
        try (PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            List<AccessGroupRecord> result = new ArrayList<>();
            while (rs.next()) {
                result.add(new AccessGroupRecord(rs.getString("name"), projectName, rs.getString("data")));
            }
            return StatusOr.ofValue(ImmutableList.copyOf(result));
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.statusForSqlException(e, false, "Access group load"));
        }
    }

    private static String schemaOf(String projectName) {
        return AccessGroupRecord.GLOBAL.equals(projectName)
                ? "public"
                : SqlPredicateBuilder.projectSchema(projectName);
    }
}
