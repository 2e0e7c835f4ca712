package com.assetdb.access;

import com.assetdb.common.status.Status;
import com.assetdb.common.status.StatusOr;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Turns a user's combined permissions into the folders they may access on a project.
 *
 * <p>Resolution order:
 *
 * <ol>
 *   <li>Elevated users (managers, administrators, services) get unrestricted access.
 *   <li>An unrestricted dimension gives unrestricted access.
 *   <li>A restricted dimension with no grants is denied with PERMISSION_DENIED.
 *   <li>Each grant is expanded into paths; ASSIGNED grants query the assigned folders once.
 *   <li>READ access additionally includes the ancestors of all granted paths.
 * </ol>
 *
 * <p>A resolution that ends with no paths is denied with PERMISSION_DENIED, never returned as an
 * empty path set.
 */
public class FolderAccessResolver {

  private final AssignedFolderLookup assignedFolders;

  public FolderAccessResolver(AssignedFolderLookup assignedFolders) {
    this.assignedFolders = Objects.requireNonNull(assignedFolders);
  }

  /**
   * Resolves folder access.
   *
   * @param permissions the user's combined permissions on the project
   * @param elevated whether the user bypasses folder-level restrictions
   * @param projectName the project
   * @param userName the user, used to find assigned tasks
   * @param accessType the operation being authorized
   * @return the resolved access, PERMISSION_DENIED, or the assigned-folder query's failure
   */
  @Nonnull
  public StatusOr<FolderAccess> resolve(
      @Nonnull PermissionSet permissions,
      boolean elevated,
      @Nonnull String projectName,
      @Nonnull String userName,
      @Nonnull AccessType accessType) {
    if (elevated) {
      return StatusOr.ofValue(FolderAccess.unrestricted());
    }

    AccessScope<FolderAccessGrant> scope = permissions.folderAccess(accessType);
    if (scope.isUnrestricted()) {
      return StatusOr.ofValue(FolderAccess.unrestricted());
    }
    if (scope.items().isEmpty()) {
      return StatusOr.ofStatus(denied(userName, projectName, accessType));
    }

    PathSet.Builder paths = PathSet.builder();
    boolean assignedExpanded = false;
    for (FolderAccessGrant grant : scope.items()) {
      switch (grant.type()) {
        case HIERARCHY -> paths.addHierarchy(grant.path().orElseThrow());
        case CHILDREN -> paths.addSubtree(grant.path().orElseThrow());
        case ASSIGNED -> {
          if (assignedExpanded) {
            continue;
          }
          StatusOr<List<String>> assignedOr =
              assignedFolders.assignedFolderPaths(projectName, userName);
          if (assignedOr.isNotOk()) {
            Logger.warn(
                "Could not resolve assigned folders of {} in {}: {}",
                userName,
                projectName,
                assignedOr.getStatus());
            return StatusOr.ofStatus(assignedOr.getStatus());
          }
          for (String path : assignedOr.getValue()) {
            paths.addHierarchy(path);
          }
          assignedExpanded = true;
        }
      }
    }

    PathSet pathSet = paths.build();
    if (accessType.includesAncestors()) {
      pathSet = pathSet.withAncestors();
    }
    if (pathSet.isEmpty()) {
      return StatusOr.ofStatus(denied(userName, projectName, accessType));
    }
    Logger.debug(
        "Resolved {} access of {} in {}: {} exact, {} subtree",
        accessType.key(),
        userName,
        projectName,
        pathSet.exactPaths().size(),
        pathSet.subtreePrefixes().size());
    return StatusOr.ofValue(FolderAccess.restrictedTo(pathSet));
  }

  private static Status denied(String userName, String projectName, AccessType accessType) {
    String label =
        accessType.key().substring(0, 1).toUpperCase(Locale.ROOT) + accessType.key().substring(1);
    return Status.permissionDenied(
        label + " access denied for " + userName + " in project " + projectName);
  }
}
