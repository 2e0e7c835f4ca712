package com.assetdb.db;

import static org.junit.jupiter.api.Assertions.*;

import com.assetdb.common.status.StatusOr;
import com.assetdb.db.util.PostgresTestHelper;
import com.assetdb.db.util.PostgresTestHelper.PostgresContext;
import com.google.common.collect.ImmutableList;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
public class AccessGroupsTest {

  private static PostgresContext postgresContext;
  private static Connection connection;

  @BeforeAll
  static void setUp() throws SQLException {
    postgresContext =
        PostgresTestHelper.setupPostgres("assetdb_access_groups_test", AccessGroupsTest.class);
    connection = postgresContext.getConnection();
  }

  @AfterAll
  static void tearDown() {
    if (postgresContext != null) {
      postgresContext.close();
    }
  }

  @Test
  void testLoadGlobal() {
    StatusOr<List<AccessGroupRecord>> result = AccessGroups.loadGlobal(connection);

    assertTrue(result.isOk());
    List<String> names = result.getValue().stream().map(AccessGroupRecord::name).toList();
    assertTrue(names.containsAll(ImmutableList.of("artist", "supervisor", "viewer")));
    assertTrue(result.getValue().stream().allMatch(AccessGroupRecord::isGlobal));
  }

  @Test
  void testLoadForProject() {
    List<AccessGroupRecord> groups = AccessGroups.loadForProject(connection, "demo").getValue();

    assertEquals(1, groups.size());
    assertEquals("artist", groups.get(0).name());
    assertEquals("demo", groups.get(0).projectName());
    assertTrue(groups.get(0).data().contains("assets/props"));
  }

  @Test
  void testListProjectNames() {
    assertEquals(ImmutableList.of("demo"), AccessGroups.listProjectNames(connection).getValue());
  }

  @Test
  void testMissingProjectSchemaFails() {
    assertTrue(AccessGroups.loadForProject(connection, "nosuchproject").isNotOk());
  }

  @Test
  void testSaveAndDelete() {
    // Given
    AccessGroupRecord lead =
        new AccessGroupRecord("lead", "demo", "{\"delete\": {\"enabled\": true}}");

    // When
    assertEquals(1, AccessGroups.save(connection, lead).getValue());
    AccessGroups.save(
        connection, new AccessGroupRecord("lead", "demo", "{\"delete\": {\"enabled\": false}}"));

    // Then
    List<AccessGroupRecord> groups = AccessGroups.loadForProject(connection, "demo").getValue();
    AccessGroupRecord stored =
        groups.stream().filter(g -> g.name().equals("lead")).findFirst().orElseThrow();
    assertTrue(stored.data().contains("false"));

    assertEquals(1, AccessGroups.delete(connection, "lead", "demo").getValue());
    assertEquals(0, AccessGroups.delete(connection, "lead", "demo").getValue());
  }
}
