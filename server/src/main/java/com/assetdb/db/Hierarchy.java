package com.assetdb.db;

import com.assetdb.access.EntityAccessFilter;
import com.assetdb.access.SqlPredicate;
import com.assetdb.access.SqlPredicateBuilder;
import com.assetdb.common.status.Status;
import com.assetdb.common.status.StatusOr;
import com.assetdb.db.util.DbUtil;
import com.assetdb.db.util.InFlightQuery;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nonnull;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Queries over a project's folder hierarchy. Every project schema provides a {@code hierarchy}
 * view of {@code (id, path)} rows, one per folder.
 */
public final class Hierarchy {

    private Hierarchy() {
        // Utility class
    }

    /**
     * Loads the paths of the folders holding tasks the user is assigned to.
     *
     * @param conn an open JDBC connection
     * @param projectName the project
     * @param userName the assignee
     * @param timeoutSeconds statement timeout, 0 for none
     * @param inFlight handle through which the statement can be cancelled
     * @return the distinct folder paths, CANCELLED, or UNAVAILABLE when the database cannot answer
     */
    @Nonnull
    public static StatusOr<List<String>> loadAssignedFolderPaths(
            Connection conn,
            String projectName,
            String userName,
            int timeoutSeconds,
            InFlightQuery inFlight) {
        String schema = SqlPredicateBuilder.projectSchema(projectName);
        String sql = """
                SELECT DISTINCT h.path
                  FROM %1$s.hierarchy AS h
                  JOIN %1$s.tasks AS t ON h.id = t.folder_id
                 WHERE ? = ANY(t.assignees)
                 ORDER BY h.path
                """.formatted(schema);
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, userName);
            stmt.setQueryTimeout(timeoutSeconds);
            if (!inFlight.register(stmt)) {
                return StatusOr.ofStatus(Status.cancelled("Assigned folder query cancelled"));
            }
            try (ResultSet rs = stmt.executeQuery()) {
                List<String> result = new ArrayList<>();
                while (rs.next()) {
                    result.add(rs.getString(1));
                }
                return StatusOr.ofValue(ImmutableList.copyOf(result));
            } finally {
                inFlight.clear(stmt);
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(
                    DbUtil.statusForSqlException(e, inFlight.isCancelled(), "Assigned folder query"));
        }
    }

    /**
     * Checks whether one entity exists and lies inside the granted folders.
     *
     * @param conn an open JDBC connection
     * @param projectName the project
     * @param entityId the entity's id
     * @param filter the joins and path predicate for the entity's type
     * @return true if the entity is visible under the filter
     */
    @Nonnull
    public static StatusOr<Boolean> entityInScope(
            Connection conn, String projectName, String entityId, EntityAccessFilter filter) {
        StringBuilder sql = new StringBuilder();
        sql.append("SELECT 1\n  FROM ")
                .append(SqlPredicateBuilder.projectSchema(projectName))
                .append(".hierarchy AS ")
                .append(SqlPredicateBuilder.HIERARCHY_ALIAS)
                .append('\n');
        if (!filter.joins().isEmpty()) {
            sql.append(filter.joinClause()).append('\n');
        }
        sql.append(" WHERE ").append(SqlPredicateBuilder.idColumn(filter.entityType())).append(" = ?");
        filter.predicate().ifPresent(p -> sql.append("\n   AND ").append(p.sql()));
        sql.append("\n LIMIT 1");

        try (PreparedStatement stmt = conn.prepareStatement(sql.toString())) {
            stmt.setString(1, entityId);
            try (SqlPredicate.Bound bound = bindPredicate(filter, stmt);
                 ResultSet rs = stmt.executeQuery()) {
                return StatusOr.ofValue(rs.next());
            }
        } catch (SQLException e) {
            return StatusOr.ofStatus(DbUtil.statusForSqlException(e, false, "Entity access query"));
        }
    }

    private static SqlPredicate.Bound bindPredicate(EntityAccessFilter filter, PreparedStatement stmt)
            throws SQLException {
        if (filter.predicate().isEmpty()) {
            return new SqlPredicate.Bound(2, ImmutableList.of());
        }
        return filter.predicate().get().bind(stmt, 2);
    }
}
