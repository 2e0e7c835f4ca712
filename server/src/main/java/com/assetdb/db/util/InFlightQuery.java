package com.assetdb.db.util;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.tinylog.Logger;

/**
 * Handle through which another thread can abort a running statement.
 *
 * <p>The executing thread {@link #register registers} its statement before executing it and
 * {@link #clear clears} it afterwards. {@link #cancel} marks the handle cancelled and calls
 * {@link Statement#cancel()} on whatever statement is registered; once cancelled, further
 * registrations are refused so no new statement starts.
 */
public final class InFlightQuery {

  private final AtomicReference<Statement> statement = new AtomicReference<>();
  private final AtomicBoolean cancelled = new AtomicBoolean();

  /**
   * Registers the statement about to execute.
   *
   * @return false if the handle was already cancelled and the statement must not run
   */
  public boolean register(Statement stmt) {
    if (cancelled.get()) {
      return false;
    }
    statement.set(stmt);
    if (cancelled.get()) {
      statement.compareAndSet(stmt, null);
      return false;
    }
    return true;
  }

  /** Unregisters a statement that finished executing. */
  public void clear(Statement stmt) {
    statement.compareAndSet(stmt, null);
  }

  /** Cancels the registered statement, if any, and refuses later registrations. */
  public void cancel() {
    cancelled.set(true);
    Statement stmt = statement.getAndSet(null);
    if (stmt == null) {
      return;
    }
    try {
      stmt.cancel();
    } catch (SQLException e) {
      Logger.warn(e, "Failed to cancel running statement");
    }
  }

  public boolean isCancelled() {
    return cancelled.get();
  }
}
