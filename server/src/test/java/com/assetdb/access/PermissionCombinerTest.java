package com.assetdb.access;

import static org.junit.jupiter.api.Assertions.*;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class PermissionCombinerTest {

  private static final PermissionSet ARTIST =
      PermissionSet.builder()
          .folderAccess(AccessType.READ, AccessScope.restricted(FolderAccessGrant.assigned()))
          .attribWrite(AccessScope.restricted("fps"))
          .build();

  private static final PermissionSet VIEWER =
      PermissionSet.builder()
          .folderAccess(
              AccessType.READ, AccessScope.restricted(FolderAccessGrant.children("assets")))
          .attribWrite(AccessScope.restricted("frameStart"))
          .folderAccess(AccessType.UPDATE, AccessScope.denyAll())
          .build();

  private static final PermissionSet DEMO_ARTIST =
      PermissionSet.builder()
          .folderAccess(AccessType.READ, AccessScope.restricted(FolderAccessGrant.hierarchy("shots")))
          .build();

  private static PermissionCombiner combiner(Map<List<String>, PermissionSet> groups) {
    return new PermissionCombiner(
        (name, project) -> Optional.ofNullable(groups.get(ImmutableList.of(name, project))));
  }

  private final PermissionCombiner combiner =
      combiner(
          ImmutableMap.of(
              ImmutableList.of("artist", "_"), ARTIST,
              ImmutableList.of("viewer", "_"), VIEWER,
              ImmutableList.of("artist", "demo"), DEMO_ARTIST,
              ImmutableList.of("supervisor", "_"), PermissionSet.unrestricted()));

  @Test
  void testSingleGroupIsReturnedAsIs() {
    assertEquals(ARTIST, combiner.combine(ImmutableList.of("artist"), "other"));
  }

  @Test
  void testProjectDefinitionTakesPrecedence() {
    assertEquals(DEMO_ARTIST, combiner.combine(ImmutableList.of("artist"), "demo"));
  }

  @Test
  void testListsAreUnioned() {
    PermissionSet combined = combiner.combine(ImmutableList.of("artist", "viewer"), "other");

    assertEquals(
        ImmutableList.of(FolderAccessGrant.assigned(), FolderAccessGrant.children("assets")),
        combined.read().items().asList());
    assertTrue(combined.canWriteAttribute("fps"));
    assertTrue(combined.canWriteAttribute("frameStart"));
  }

  @Test
  void testUnrestrictedDimensionWins() {
    // Given: artist leaves update unrestricted, viewer denies it
    PermissionSet combined = combiner.combine(ImmutableList.of("viewer", "artist"), "other");

    // Then
    assertTrue(combined.update().isUnrestricted());
  }

  @Test
  void testUnrestrictedGroupMakesEverythingUnrestricted() {
    PermissionSet combined = combiner.combine(ImmutableList.of("viewer", "supervisor"), "other");

    assertEquals(PermissionSet.unrestricted(), combined);
  }

  @Test
  void testUnknownGroupsAreSkipped() {
    assertEquals(VIEWER, combiner.combine(ImmutableList.of("ghost", "viewer"), "other"));
  }

  @Test
  void testNoKnownGroupIsUnrestricted() {
    assertEquals(PermissionSet.unrestricted(), combiner.combine(ImmutableList.of(), "demo"));
    assertEquals(
        PermissionSet.unrestricted(), combiner.combine(ImmutableList.of("ghost"), "demo"));
  }

  @Test
  void testCombineKnownIsEmptyWithoutDefinedGroup() {
    assertTrue(combiner.combineKnown(ImmutableList.of(), "demo").isEmpty());
    assertTrue(combiner.combineKnown(ImmutableList.of("ghost"), "demo").isEmpty());
    assertEquals(
        Optional.of(VIEWER), combiner.combineKnown(ImmutableList.of("ghost", "viewer"), "demo"));
  }
}
