package com.assetdb.db.util;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.assetdb.common.status.StatusCode;
import com.assetdb.common.status.StatusOr;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import org.junit.jupiter.api.Test;

public class DbUtilTest {

  @Test
  void testCancelledStatementIsCancelled() {
    SQLException e = new SQLException("canceling statement due to user request", "57014");

    assertEquals(StatusCode.CANCELLED, DbUtil.statusForSqlException(e, true, "Query").getCode());
  }

  @Test
  void testTransientFailuresAreUnavailable() {
    assertEquals(
        StatusCode.UNAVAILABLE,
        DbUtil.statusForSqlException(new SQLException("refused", "08001"), false, "Query")
            .getCode());
    assertEquals(
        StatusCode.UNAVAILABLE,
        DbUtil.statusForSqlException(new SQLException("too many", "53300"), false, "Query")
            .getCode());
    assertEquals(
        StatusCode.UNAVAILABLE,
        DbUtil.statusForSqlException(new SQLException("shutdown", "57P01"), false, "Query")
            .getCode());
    assertEquals(
        StatusCode.UNAVAILABLE,
        DbUtil.statusForSqlException(new SQLTransientConnectionException("timeout"), false, "Query")
            .getCode());
  }

  @Test
  void testStatementTimeoutIsUnavailable() {
    SQLException e = new SQLException("canceling statement due to statement timeout", "57014");

    var status = DbUtil.statusForSqlException(e, false, "Assigned folder query");

    assertEquals(StatusCode.UNAVAILABLE, status.getCode());
    assertEquals("Assigned folder query timed out", status.getMessage());
  }

  @Test
  void testOtherFailuresAreInternal() {
    SQLException e = new SQLException("relation does not exist", "42P01");

    var status = DbUtil.statusForSqlException(e, false, "Query");

    assertEquals(StatusCode.INTERNAL, status.getCode());
    assertSame(e, status.getCause());
  }

  @Test
  void testParseJsonbObject() throws SQLException {
    ResultSet rs = mock(ResultSet.class);
    when(rs.getString("data")).thenReturn("{\"isAdmin\": true}");

    StatusOr<JsonObject> result = DbUtil.parseJsonbObject(rs, "data");

    assertTrue(result.isOk());
    assertTrue(result.getValue().get("isAdmin").getAsBoolean());
  }

  @Test
  void testParseJsonbObjectNullIsEmpty() throws SQLException {
    ResultSet rs = mock(ResultSet.class);
    when(rs.getString("data")).thenReturn(null);
    when(rs.wasNull()).thenReturn(true);

    assertEquals(new JsonObject(), DbUtil.parseJsonbObject(rs, "data").getValue());
  }

  @Test
  void testParseJsonbObjectRejectsNonObjects() throws SQLException {
    ResultSet rs = mock(ResultSet.class);
    when(rs.getString("data")).thenReturn("[1]");

    assertEquals(
        StatusCode.FAILED_PRECONDITION, DbUtil.parseJsonbObject(rs, "data").getStatus().getCode());
  }

  @Test
  void testStringListMap() {
    var element = JsonParser.parseString("{\"demo\": [\"artist\", 1], \"bad\": \"x\"}");

    assertEquals(
        ImmutableMap.of("demo", ImmutableList.of("artist", "1")), DbUtil.toStringListMap(element));
    assertEquals(ImmutableList.of(), DbUtil.toStringList(null));
  }
}
