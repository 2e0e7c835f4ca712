package com.assetdb.db;

import static org.junit.jupiter.api.Assertions.*;

import com.assetdb.common.status.StatusOr;
import com.assetdb.db.util.PostgresTestHelper;
import com.assetdb.db.util.PostgresTestHelper.PostgresContext;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Tests for the Users helper class against the fixture users. */
@Testcontainers(disabledWithoutDocker = true)
public class UsersTest {

  private static PostgresContext postgresContext;
  private static Connection connection;

  @BeforeAll
  static void setUp() throws SQLException {
    postgresContext = PostgresTestHelper.setupPostgres("assetdb_users_test", UsersTest.class);
    connection = postgresContext.getConnection();
  }

  @AfterAll
  static void tearDown() {
    if (postgresContext != null) {
      postgresContext.close();
    }
  }

  @Test
  void testLoadByName() {
    StatusOr<Optional<User>> result = Users.loadByName(connection, "bob");

    assertTrue(result.isOk());
    User bob = result.getValue().orElseThrow();
    assertTrue(bob.active());
    assertFalse(bob.manager());
    assertEquals(ImmutableMap.of("Demo", ImmutableList.of("viewer")), bob.accessGroups());
  }

  @Test
  void testLoadByNameMissing() {
    assertTrue(Users.loadByName(connection, "nobody").getValue().isEmpty());
  }

  @Test
  void testManagerFlag() {
    User carol = Users.loadByName(connection, "carol").getValue().orElseThrow();

    assertTrue(carol.manager());
    assertTrue(carol.accessGroups().isEmpty());
  }

  @Test
  void testSaveAndDelete() {
    // Given
    User erin =
        new User(
            "erin",
            true,
            false,
            false,
            true,
            false,
            ImmutableMap.of("demo", ImmutableList.of("artist")),
            ImmutableList.of("viewer"));

    // When
    StatusOr<Integer> saved = Users.save(connection, erin);

    // Then
    assertEquals(1, saved.getValue());
    assertEquals(erin, Users.loadByName(connection, "erin").getValue().orElseThrow());

    User updated = new User("erin", false, false, false, false, false, null, null);
    Users.save(connection, updated);
    assertEquals(updated, Users.loadByName(connection, "erin").getValue().orElseThrow());

    assertEquals(1, Users.delete(connection, "erin").getValue());
    assertTrue(Users.loadByName(connection, "erin").getValue().isEmpty());
  }
}
