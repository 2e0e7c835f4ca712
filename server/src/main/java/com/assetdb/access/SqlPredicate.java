package com.assetdb.access;

import com.google.common.collect.ImmutableList;
import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * A parameterized SQL boolean expression. The text contains only {@code ?} placeholders; every
 * parameter is a list of strings bound as a PostgreSQL {@code text[]}.
 *
 * @param sql the expression text
 * @param arrayParameters the array values, in placeholder order
 */
public record SqlPredicate(String sql, List<List<String>> arrayParameters) {

  public SqlPredicate {
    arrayParameters = ImmutableList.copyOf(arrayParameters);
  }

  /**
   * Binds the parameters of this predicate. The returned handle must be closed once the statement
   * has been executed; closing it frees the bound arrays.
   *
   * @param stmt the statement whose text embeds {@link #sql()}
   * @param firstIndex the 1-based index of this predicate's first placeholder
   */
  @Nonnull
  public Bound bind(@Nonnull PreparedStatement stmt, int firstIndex) throws SQLException {
    List<Array> arrays = new ArrayList<>(arrayParameters.size());
    int index = firstIndex;
    try {
      for (List<String> values : arrayParameters) {
        Array array = stmt.getConnection().createArrayOf("text", values.toArray(new String[0]));
        arrays.add(array);
        stmt.setArray(index++, array);
      }
    } catch (SQLException e) {
      try {
        new Bound(index, arrays).close();
      } catch (SQLException freeFailure) {
        e.addSuppressed(freeFailure);
      }
      throw e;
    }
    return new Bound(index, arrays);
  }

  /**
   * The arrays bound to a statement.
   *
   * @param nextIndex the index of the next placeholder after the predicate
   * @param arrays the arrays to free
   */
  public record Bound(int nextIndex, List<Array> arrays) implements AutoCloseable {

    public Bound {
      arrays = ImmutableList.copyOf(arrays);
    }

    /** Frees every array, reporting the first failure with the rest suppressed. */
    @Override
    public void close() throws SQLException {
      SQLException failure = null;
      for (Array array : arrays) {
        try {
          array.free();
        } catch (SQLException e) {
          if (failure == null) {
            failure = e;
          } else {
            failure.addSuppressed(e);
          }
        }
      }
      if (failure != null) {
        throw failure;
      }
    }
  }
}
