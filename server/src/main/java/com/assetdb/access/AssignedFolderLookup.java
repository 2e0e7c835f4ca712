package com.assetdb.access;

import com.assetdb.common.status.StatusOr;
import java.util.List;

/**
 * Lists the folders in which a user has assigned tasks. This is the only lookup during access
 * resolution that touches the database.
 */
@FunctionalInterface
public interface AssignedFolderLookup {

  /**
   * Returns the hierarchy paths of the folders containing a task assigned to the user.
   *
   * @return the paths, or UNAVAILABLE / CANCELLED / INTERNAL when the query failed
   */
  StatusOr<List<String>> assignedFolderPaths(String projectName, String userName);
}
