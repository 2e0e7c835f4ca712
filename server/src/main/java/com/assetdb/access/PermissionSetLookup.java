package com.assetdb.access;

import java.util.Optional;

/** Source of stored access group definitions, keyed by group name and project. */
@FunctionalInterface
public interface PermissionSetLookup {

  /** Project name under which project-independent group definitions are stored. */
  String DEFAULT_PROJECT = "_";

  /**
   * Looks up the permission set an access group defines for a project.
   *
   * @param accessGroupName the access group name
   * @param projectName a project name, or {@link #DEFAULT_PROJECT}
   * @return the permission set, or empty if the group has no definition under that key
   */
  Optional<PermissionSet> lookup(String accessGroupName, String projectName);
}
