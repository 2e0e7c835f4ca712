package com.assetdb.access;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import org.tinylog.Logger;

/**
 * Combines the permission sets of all access groups a user holds on a project.
 *
 * <p>The most permissive group wins: a dimension left unrestricted by any group is unrestricted
 * in the result, otherwise the whitelists are unioned. Project-level definitions take precedence
 * over the project-independent default of the same group. Group names with no definition at all
 * are skipped, so a stale assignment never prevents a user from working.
 */
public class PermissionCombiner {

  private final PermissionSetLookup lookup;

  public PermissionCombiner(PermissionSetLookup lookup) {
    this.lookup = Objects.requireNonNull(lookup);
  }

  /**
   * Combines the named access groups for a project.
   *
   * @param accessGroupNames group names in assignment order
   * @param projectName the project, or {@link PermissionSetLookup#DEFAULT_PROJECT}
   * @return the combined set; {@link PermissionSet#unrestricted()} when no group was found
   */
  @Nonnull
  public PermissionSet combine(@Nonnull List<String> accessGroupNames, @Nonnull String projectName) {
    return combineKnown(accessGroupNames, projectName).orElse(PermissionSet.unrestricted());
  }

  /** Like {@link #combine}, but empty when none of the named groups has a definition. */
  @Nonnull
  public Optional<PermissionSet> combineKnown(
      @Nonnull List<String> accessGroupNames, @Nonnull String projectName) {
    PermissionSet result = null;
    for (String name : accessGroupNames) {
      Optional<PermissionSet> found = lookup.lookup(name, projectName);
      if (found.isEmpty() && !PermissionSetLookup.DEFAULT_PROJECT.equals(projectName)) {
        found = lookup.lookup(name, PermissionSetLookup.DEFAULT_PROJECT);
      }
      if (found.isEmpty()) {
        Logger.debug("Ignoring unknown access group {} on project {}", name, projectName);
        continue;
      }
      result = result == null ? found.get() : result.union(found.get());
    }
    return Optional.ofNullable(result);
  }
}
