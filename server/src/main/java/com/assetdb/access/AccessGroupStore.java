package com.assetdb.access;

import com.assetdb.common.status.Status;
import com.assetdb.common.status.StatusCode;
import com.assetdb.common.status.StatusOr;
import com.assetdb.db.AccessGroupRecord;
import com.assetdb.db.AccessGroups;
import com.assetdb.db.util.DbUtil;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedSet;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nonnull;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * In-memory snapshot of all stored access group definitions.
 *
 * <p>The snapshot is replaced as a whole: {@link #reload()} reads the global groups and every
 * project's overrides, parses all of them, and only then swaps the snapshot in. If any stored
 * document is malformed the previous snapshot stays in place, so a bad edit never leaves the
 * server with partial permissions. Reads never block and always see one complete snapshot.
 *
 * <p>Project names are matched case-insensitively.
 */
public class AccessGroupStore implements PermissionSetLookup {

  private record Key(String name, String projectName) {}

  private final DataSource dataSource;
  private final AtomicReference<ImmutableMap<Key, PermissionSet>> snapshot =
      new AtomicReference<>(ImmutableMap.of());

  public AccessGroupStore(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource);
  }

  /**
   * Reloads all access groups from the database.
   *
   * @return OK, the database failure, or FAILED_PRECONDITION when a stored group is malformed; on
   *     failure the previous snapshot is kept
   */
  @Nonnull
  public Status reload() {
    List<AccessGroupRecord> records = new ArrayList<>();
    try (Connection connection = dataSource.getConnection()) {
      StatusOr<List<AccessGroupRecord>> globalOr = AccessGroups.loadGlobal(connection);
      if (globalOr.isNotOk()) {
        return reloadFailed(globalOr.getStatus());
      }
      records.addAll(globalOr.getValue());

      StatusOr<List<String>> projectsOr = AccessGroups.listProjectNames(connection);
      if (projectsOr.isNotOk()) {
        return reloadFailed(projectsOr.getStatus());
      }
      for (String projectName : projectsOr.getValue()) {
        StatusOr<List<AccessGroupRecord>> projectOr =
            AccessGroups.loadForProject(connection, projectName);
        if (projectOr.isNotOk()) {
          return reloadFailed(projectOr.getStatus());
        }
        records.addAll(projectOr.getValue());
      }
    } catch (SQLException e) {
      return reloadFailed(DbUtil.statusForSqlException(e, false, "Access group reload"));
    }
    return replaceAll(records);
  }

  /**
   * Parses the given records and makes them the current snapshot.
   *
   * @return OK, or FAILED_PRECONDITION naming the first malformed group; the previous snapshot
   *     is kept in that case
   */
  @Nonnull
  public Status replaceAll(@Nonnull Collection<AccessGroupRecord> records) {
    ImmutableMap.Builder<Key, PermissionSet> parsed = ImmutableMap.builder();
    for (AccessGroupRecord record : records) {
      StatusOr<PermissionSet> permissionsOr = PermissionSets.fromJson(record.data());
      if (permissionsOr.isNotOk()) {
        return reloadFailed(
            Status.failedPrecondition(
                "Access group "
                    + record.name()
                    + " on "
                    + record.projectName()
                    + ": "
                    + permissionsOr.getStatus().getMessage()));
      }
      parsed.put(key(record.name(), record.projectName()), permissionsOr.getValue());
    }
    ImmutableMap<Key, PermissionSet> next = parsed.buildKeepingLast();
    snapshot.set(next);
    Logger.info("Loaded {} access group definitions", next.size());
    return Status.ok();
  }

  @Override
  public Optional<PermissionSet> lookup(String accessGroupName, String projectName) {
    return Optional.ofNullable(snapshot.get().get(key(accessGroupName, projectName)));
  }

  /**
   * Returns the definition stored for a group on a project, without falling back to the
   * project-independent one.
   */
  public Optional<PermissionSet> get(String accessGroupName, String projectName) {
    return lookup(accessGroupName, projectName);
  }

  /** Names of all groups defined anywhere, sorted. */
  public ImmutableSortedSet<String> names() {
    return snapshot.get().keySet().stream()
        .map(Key::name)
        .collect(ImmutableSortedSet.toImmutableSortedSet(String::compareTo));
  }

  /** Names of the groups defined for a project, either globally or as project overrides. */
  public ImmutableList<String> namesFor(String projectName) {
    String project = projectName.toLowerCase(Locale.ROOT);
    return snapshot.get().keySet().stream()
        .filter(k -> k.projectName().equals(project) || k.projectName().equals(DEFAULT_PROJECT))
        .map(Key::name)
        .distinct()
        .sorted()
        .collect(ImmutableList.toImmutableList());
  }

  private static Key key(String name, String projectName) {
    return new Key(name, projectName.toLowerCase(Locale.ROOT));
  }

  private static Status reloadFailed(Status status) {
    if (status.getCode() == StatusCode.FAILED_PRECONDITION) {
      Logger.error("Keeping previous access groups: {}", status.getMessage());
    } else {
      Logger.error(status.getCause(), "Access group reload failed: {}", status.getMessage());
    }
    return status;
  }
}
