package com.assetdb.access;

import static org.junit.jupiter.api.Assertions.*;

import com.assetdb.common.status.StatusCode;
import com.assetdb.common.status.StatusOr;
import com.google.common.collect.ImmutableList;
import java.util.Locale;
import org.junit.jupiter.api.Test;

public class PermissionSetsTest {

  @Test
  void testEmptyDocumentIsUnrestricted() {
    StatusOr<PermissionSet> result = PermissionSets.fromJson("{}");

    assertTrue(result.isOk());
    assertEquals(PermissionSet.unrestricted(), result.getValue());
  }

  @Test
  void testNullOrBlankDocumentIsUnrestricted() {
    assertEquals(PermissionSet.unrestricted(), PermissionSets.fromJson(null).getValue());
    assertEquals(PermissionSet.unrestricted(), PermissionSets.fromJson("").getValue());
  }

  @Test
  void testParsesSnakeCaseDocument() {
    // Given
    String json =
        """
        {
          "read": {"enabled": true, "access_list": [
            {"access_type": "hierarchy", "path": "/assets/characters/"},
            {"access_type": "assigned", "path": "ignored"}
          ]},
          "update": {"enabled": false, "access_list": [{"access_type": "children", "path": "x"}]},
          "attrib_write": {"enabled": true, "attributes": ["fps", "frameStart"]},
          "endpoints": {"enabled": true, "endpoints": ["listFolders"]}
        }
        """;

    // When
    StatusOr<PermissionSet> result = PermissionSets.fromJson(json);

    // Then
    assertTrue(result.isOk(), result.toString());
    PermissionSet permissions = result.getValue();
    assertEquals(
        ImmutableList.of(
            FolderAccessGrant.hierarchy("assets/characters"), FolderAccessGrant.assigned()),
        permissions.read().items().asList());
    assertTrue(permissions.update().isUnrestricted());
    assertTrue(permissions.create().isUnrestricted());
    assertTrue(permissions.canWriteAttribute("fps"));
    assertFalse(permissions.canWriteAttribute("resolutionWidth"));
    assertTrue(permissions.canReadAttribute("resolutionWidth"));
    assertTrue(permissions.canAccessEndpoint("listFolders"));
    assertFalse(permissions.canAccessEndpoint("deleteProject"));
  }

  @Test
  void testParsesCamelCaseKeys() {
    String json =
        """
        {
          "delete": {"enabled": true, "accessList": [{"accessType": "children", "path": "shots"}]},
          "attribRead": {"enabled": true, "attributes": ["fps"]}
        }
        """;

    PermissionSet permissions = PermissionSets.fromJson(json).getValue();

    assertEquals(
        ImmutableList.of(FolderAccessGrant.children("shots")),
        permissions.delete().items().asList());
    assertFalse(permissions.canReadAttribute("frameEnd"));
  }

  @Test
  void testEnabledWithoutListDeniesAll() {
    PermissionSet permissions =
        PermissionSets.fromJson("{\"publish\": {\"enabled\": true}}").getValue();

    assertFalse(permissions.publish().isUnrestricted());
    assertTrue(permissions.publish().items().isEmpty());
  }

  @Test
  void testAllMeansUnrestricted() {
    String json =
        """
        {
          "read": "all",
          "attrib_read": {"enabled": true, "attributes": ["fps", "all"]}
        }
        """;

    PermissionSet permissions = PermissionSets.fromJson(json).getValue();

    assertTrue(permissions.read().isUnrestricted());
    assertTrue(permissions.attribRead().isUnrestricted());
  }

  @Test
  void testBareGrantListIsEnabled() {
    PermissionSet permissions =
        PermissionSets.fromJson("{\"read\": [{\"access_type\": \"children\", \"path\": \"a\"}]}")
            .getValue();

    assertEquals(
        ImmutableList.of(FolderAccessGrant.children("a")), permissions.read().items().asList());
  }

  @Test
  void testMissingAccessTypeDefaultsToAssigned() {
    PermissionSet permissions =
        PermissionSets.fromJson("{\"read\": {\"enabled\": true, \"access_list\": [{}]}}")
            .getValue();

    assertEquals(ImmutableList.of(FolderAccessGrant.assigned()), permissions.read().items().asList());
  }

  @Test
  void testHierarchyGrantWithoutPathIsMalformed() {
    StatusOr<PermissionSet> result =
        PermissionSets.fromJson(
            "{\"read\": {\"enabled\": true, \"access_list\": [{\"access_type\": \"hierarchy\"}]}}");

    assertFalse(result.isOk());
    assertEquals(StatusCode.FAILED_PRECONDITION, result.getStatus().getCode());
    assertTrue(result.getStatus().getMessage().contains("read"));
  }

  @Test
  void testUnknownAccessTypeIsMalformed() {
    StatusOr<PermissionSet> result =
        PermissionSets.fromJson(
            "{\"read\": {\"enabled\": true, \"access_list\": [{\"access_type\": \"sibling\"}]}}");

    assertEquals(StatusCode.FAILED_PRECONDITION, result.getStatus().getCode());
  }

  @Test
  void testNonStringValuesAreMalformed() {
    for (String json :
        new String[] {
          "{\"read\": {\"enabled\": true, \"access_list\": [{\"access_type\": \"hierarchy\", \"path\": {}}]}}",
          "{\"read\": {\"enabled\": true, \"access_list\": [{\"access_type\": [\"hierarchy\"], \"path\": \"a\"}]}}",
          "{\"attrib_read\": {\"enabled\": true, \"attributes\": [null]}}",
          "{\"attrib_write\": {\"enabled\": true, \"attributes\": [\"fps\", {\"name\": \"x\"}]}}",
          "{\"endpoints\": {\"enabled\": true, \"endpoints\": [1]}}"
        }) {
      StatusOr<PermissionSet> result = PermissionSets.fromJson(json);
      assertEquals(StatusCode.FAILED_PRECONDITION, result.getStatus().getCode(), json);
    }
  }

  @Test
  void testNonBooleanEnabledIsMalformed() {
    for (String json :
        new String[] {
          "{\"read\": {\"enabled\": {}}}",
          "{\"read\": {\"enabled\": \"yes\", \"access_list\": []}}",
          "{\"update\": {\"enabled\": 1}}",
          "{\"attrib_write\": {\"enabled\": \"false\"}}"
        }) {
      StatusOr<PermissionSet> result = PermissionSets.fromJson(json);
      assertEquals(StatusCode.FAILED_PRECONDITION, result.getStatus().getCode(), json);
      assertTrue(result.getStatus().getMessage().contains("enabled"), json);
    }
  }

  @Test
  void testAccessTypeKeyIgnoresDefaultLocale() {
    Locale saved = Locale.getDefault();
    Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    try {
      PermissionSet permissions =
          PermissionSets.fromJson(
                  "{\"read\": [{\"access_type\": \"HIERARCHY\", \"path\": \"assets\"}]}")
              .getValue();

      assertEquals(
          ImmutableList.of(FolderAccessGrant.hierarchy("assets")),
          permissions.read().items().asList());
    } finally {
      Locale.setDefault(saved);
    }
  }

  @Test
  void testInvalidJsonIsMalformed() {
    assertEquals(
        StatusCode.FAILED_PRECONDITION,
        PermissionSets.fromJson("{\"read\": ").getStatus().getCode());
    assertEquals(
        StatusCode.FAILED_PRECONDITION, PermissionSets.fromJson("[1, 2]").getStatus().getCode());
  }

  @Test
  void testToJsonIsReadBack() {
    PermissionSet permissions =
        PermissionSet.builder()
            .folderAccess(
                AccessType.UPDATE,
                AccessScope.restricted(
                    FolderAccessGrant.hierarchy("assets"), FolderAccessGrant.assigned()))
            .folderAccess(AccessType.DELETE, AccessScope.denyAll())
            .attribWrite(AccessScope.restricted("fps"))
            .build();

    String json = PermissionSets.toJson(permissions);

    assertTrue(json.contains("\"access_list\""));
    assertEquals(permissions, PermissionSets.fromJson(json).getValue());
  }
}
