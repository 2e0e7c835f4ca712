package com.assetdb.access;

import com.assetdb.common.status.Status;
import com.assetdb.common.status.StatusOr;
import com.assetdb.db.Hierarchy;
import com.assetdb.db.util.DbUtil;
import com.assetdb.db.util.InFlightQuery;
import com.assetdb.security.AccessUser;
import com.google.common.base.Strings;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import org.tinylog.Logger;

/**
 * Access decisions for one request of one user.
 *
 * <p>Resolved folder access is cached per project and access type until the request ends, so a
 * handler may ask repeatedly without repeating the assigned-task query. A request is used by one
 * thread at a time; {@link #cancel()} may be called from any thread.
 */
public class AccessRequest {

  private final AccessEngine.Config config;
  private final PermissionCombiner combiner;
  private final AccessUser user;
  private final FolderAccessResolver resolver;
  private final RequestAccessCache cache = new RequestAccessCache();
  private final InFlightQuery inFlight = new InFlightQuery();

  AccessRequest(AccessEngine.Config config, PermissionCombiner combiner, AccessUser user) {
    this.config = config;
    this.combiner = combiner;
    this.user = user;
    this.resolver = new FolderAccessResolver(this::loadAssignedFolderPaths);
  }

  public AccessUser user() {
    return user;
  }

  /**
   * Returns the user's combined permissions on a project.
   *
   * @param projectName the project, or null for the user's default access groups
   * @return the permissions, or PERMISSION_DENIED if a restricted user has no defined access
   *     group on the project
   */
  @Nonnull
  public StatusOr<PermissionSet> permissions(@Nullable String projectName) {
    if (user.isElevated()) {
      return StatusOr.ofValue(PermissionSet.unrestricted());
    }
    Optional<List<String>> groups = user.accessGroupNames(projectName);
    if (groups.isEmpty() || groups.get().isEmpty()) {
      return StatusOr.ofStatus(
          Status.permissionDenied("No access group assigned on project " + projectName));
    }
    Optional<PermissionSet> combined =
        combiner.combineKnown(
            groups.get(),
            projectName == null ? PermissionSetLookup.DEFAULT_PROJECT : projectName);
    if (combined.isEmpty()) {
      Logger.warn("None of {}'s access groups {} is defined", user.getName(), groups.get());
      return StatusOr.ofStatus(
          Status.permissionDenied("No defined access group on project " + projectName));
    }
    return StatusOr.ofValue(combined.get());
  }

  /** Resolves the folders the user may access on a project, once per request. */
  @Nonnull
  public StatusOr<FolderAccess> resolveAccess(
      @Nonnull String projectName, @Nonnull AccessType accessType) {
    return cache.getOrResolve(
        projectName,
        accessType,
        () ->
            permissions(projectName)
                .flatMap(
                    permissions ->
                        resolver.resolve(
                            permissions,
                            user.isElevated(),
                            projectName,
                            user.getName(),
                            accessType)));
  }

  /** Resolves access as a trie for testing many folder paths in memory. */
  @Nonnull
  public StatusOr<AccessTrie> trieFor(@Nonnull String projectName, @Nonnull AccessType accessType) {
    return resolveAccess(projectName, accessType).map(AccessTrie::build);
  }

  /** Resolves access as the joins and predicate a query over the entity type must apply. */
  @Nonnull
  public StatusOr<EntityAccessFilter> predicateFor(
      @Nonnull String projectName, @Nonnull EntityType entityType, @Nonnull AccessType accessType) {
    return resolveAccess(projectName, accessType)
        .map(access -> SqlPredicateBuilder.predicateFor(entityType, projectName, access));
  }

  /**
   * Checks access to a single entity. Runs one query; do not call it for every row of a listing,
   * use {@link #predicateFor} instead.
   *
   * @param entityId the entity's id; restricted users are denied when it is missing
   * @return OK, PERMISSION_DENIED, or the failure to decide
   */
  @Nonnull
  public Status ensureEntityAccess(
      @Nonnull String projectName,
      @Nonnull EntityType entityType,
      @Nullable String entityId,
      @Nonnull AccessType accessType) {
    StatusOr<FolderAccess> accessOr = resolveAccess(projectName, accessType);
    if (accessOr.isNotOk()) {
      return accessOr.getStatus();
    }
    FolderAccess access = accessOr.getValue();
    if (access.isUnrestricted()) {
      return Status.ok();
    }
    if (Strings.isNullOrEmpty(entityId)) {
      return Status.permissionDenied("Limited access to project " + projectName);
    }

    EntityAccessFilter filter = SqlPredicateBuilder.predicateFor(entityType, projectName, access);
    try (Connection connection = config.dataSource().getConnection()) {
      StatusOr<Boolean> inScopeOr =
          Hierarchy.entityInScope(connection, projectName, entityId, filter);
      if (inScopeOr.isNotOk()) {
        return inScopeOr.getStatus();
      }
      if (!inScopeOr.getValue()) {
        Logger.warn(
            "{} access to {} {} denied for {}",
            accessType.key(),
            entityType.key(),
            entityId,
            user.getName());
        return Status.permissionDenied("Entity access denied");
      }
      return Status.ok();
    } catch (SQLException e) {
      return DbUtil.statusForSqlException(e, false, "Entity access query");
    }
  }

  /** Checks that the user may work on the project at all. */
  @Nonnull
  public Status ensureProjectAccess(@Nonnull String projectName) {
    return permissions(projectName).getStatus();
  }

  @Nonnull
  public Status ensureAttributeRead(@Nonnull String projectName, @Nonnull String attributeName) {
    return permissions(projectName)
        .map(p -> p.canReadAttribute(attributeName))
        .flatMap(allowed -> check(allowed, "read attribute " + attributeName, projectName))
        .getStatus();
  }

  @Nonnull
  public Status ensureAttributeWrite(@Nonnull String projectName, @Nonnull String attributeName) {
    return permissions(projectName)
        .map(p -> p.canWriteAttribute(attributeName))
        .flatMap(allowed -> check(allowed, "modify attribute " + attributeName, projectName))
        .getStatus();
  }

  @Nonnull
  public Status ensureEndpointAccess(@Nonnull String projectName, @Nonnull String endpointName) {
    return permissions(projectName)
        .map(p -> p.canAccessEndpoint(endpointName))
        .flatMap(allowed -> check(allowed, "use " + endpointName, projectName))
        .getStatus();
  }

  /** Aborts the assigned-folder query if one is running; later queries are refused. */
  public void cancel() {
    inFlight.cancel();
  }

  private StatusOr<Boolean> check(boolean allowed, String what, String projectName) {
    if (allowed) {
      return StatusOr.ofValue(true);
    }
    return StatusOr.ofStatus(
        Status.permissionDenied("You are not allowed to " + what + " in " + projectName));
  }

  private StatusOr<List<String>> loadAssignedFolderPaths(String projectName, String userName) {
    try (Connection connection = config.dataSource().getConnection()) {
      return Hierarchy.loadAssignedFolderPaths(
          connection, projectName, userName, config.assignedQueryTimeoutSeconds(), inFlight);
    } catch (SQLException e) {
      return StatusOr.ofStatus(
          DbUtil.statusForSqlException(e, inFlight.isCancelled(), "Assigned folder query"));
    }
  }
}
