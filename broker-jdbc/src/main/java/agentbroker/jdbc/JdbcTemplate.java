package agentbroker.jdbc;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TimeZone;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Small JDBC helper for the message stores. Each call borrows a connection from the
 * {@link ConnectionProvider} and returns it before completing; {@link #inTransaction} keeps
 * one connection for the whole callback.
 *
 * <p>Every {@link SQLException} surfaces as a {@link MessageStoreException}. {@link Instant}
 * parameters are written as UTC wall-clock timestamps; read them back with
 * {@link #getInstant}.
 */
public final class JdbcTemplate {
  private static final Logger logger = Logger.getLogger(JdbcTemplate.class.getName());

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  @FunctionalInterface
  public interface ConnectionCallback<T> {
    T doInConnection(Connection conn) throws SQLException;
  }

  private final ConnectionProvider connectionProvider;

  public JdbcTemplate(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  /** Executes an INSERT/UPDATE/DELETE and returns the affected row count. */
  public int update(String sql, Object... params) {
    try (Connection conn = connectionProvider.getConnection()) {
      return update(conn, sql, params);
    } catch (SQLException e) {
      throw new MessageStoreException("Failed to execute update", e);
    }
  }

  /** Executes a SELECT and maps every row. */
  public <T> List<T> query(String sql, RowMapper<T> mapper, Object... params) {
    try (Connection conn = connectionProvider.getConnection()) {
      return query(conn, sql, mapper, params);
    } catch (SQLException e) {
      throw new MessageStoreException("Failed to execute query", e);
    }
  }

  /** Executes a SELECT expected to return at most one row. */
  public <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Executes a single-column integer SELECT such as {@code COUNT(*)}. */
  public int queryForInt(String sql, Object... params) {
    return queryOne(sql, rs -> rs.getInt(1), params).orElse(0);
  }

  /**
   * Runs {@code callback} on one connection with auto-commit disabled, committing on normal
   * return and rolling back on any exception.
   */
  public <T> T inTransaction(ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        T result = callback.doInConnection(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn, e);
        throw e;
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw new MessageStoreException("Transaction failed", e);
    }
  }

  /** Executes an update on a caller-managed connection. */
  public static int update(Connection conn, String sql, Object... params) throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    }
  }

  /**
   * Executes a query, or an {@code UPDATE ... RETURNING} statement, on a caller-managed
   * connection and maps every row.
   */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params)
      throws SQLException {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    }
  }

  /**
   * Reads a timestamp column written from an {@link Instant} parameter.
   *
   * @return the instant, or {@code null} for SQL NULL
   */
  public static Instant getInstant(ResultSet rs, String column) throws SQLException {
    Timestamp value = rs.getTimestamp(column, utcCalendar());
    return value == null ? null : value.toInstant();
  }

  // Calendar is mutable and drivers may modify it, so each call gets its own.
  private static Calendar utcCalendar() {
    return Calendar.getInstance(TimeZone.getTimeZone(ZoneOffset.UTC));
  }

  private static void rollbackQuietly(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException rollbackFailure) {
      cause.addSuppressed(rollbackFailure);
      logger.log(Level.WARNING, "Rollback failed", rollbackFailure);
    }
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Instant instant) {
        ps.setTimestamp(i + 1, Timestamp.from(instant), utcCalendar());
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }
}
