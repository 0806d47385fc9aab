package org.hypertrace.core.metrics.etl.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import org.junit.jupiter.api.Test;

class JdbcConnectionProviderTest {

  /** Hands out the queued connections, or throws when the queued item is an exception. */
  private static class QueuedConnectionProvider extends JdbcConnectionProvider {
    private final Deque<Object> outcomes = new ArrayDeque<>();
    private int opened;

    QueuedConnectionProvider(int maxConnectionAttempts, Duration backoff, Object... outcomes) {
      super("jdbc:postgresql://db:5432/metrics", "etl", "secret", maxConnectionAttempts, backoff);
      for (Object outcome : outcomes) {
        this.outcomes.add(outcome);
      }
    }

    @Override
    protected Connection openConnection(String url, String user, String password)
        throws SQLException {
      opened++;
      Object outcome = outcomes.removeFirst();
      if (outcome instanceof SQLException) {
        throw (SQLException) outcome;
      }
      return (Connection) outcome;
    }
  }

  private static Connection validConnection(boolean valid) throws SQLException {
    Connection connection = mock(Connection.class);
    when(connection.isValid(5)).thenReturn(valid);
    return connection;
  }

  @Test
  void retriesUntilAConnectionOpens() throws SQLException {
    Connection connection = mock(Connection.class);
    QueuedConnectionProvider provider =
        new QueuedConnectionProvider(3, Duration.ZERO, new SQLException("refused"), connection);

    assertSame(connection, provider.getConnection());
    assertEquals(2, provider.opened);
  }

  @Test
  void givesUpAfterMaxAttempts() {
    SQLException last = new SQLException("still refused");
    QueuedConnectionProvider provider =
        new QueuedConnectionProvider(2, Duration.ZERO, new SQLException("refused"), last);

    SQLException thrown = assertThrows(SQLException.class, provider::getConnection);

    assertSame(last, thrown);
    assertEquals(2, provider.opened);
  }

  @Test
  void reusesAValidConnection() throws SQLException {
    Connection connection = validConnection(true);
    QueuedConnectionProvider provider =
        new QueuedConnectionProvider(1, Duration.ZERO, connection);

    provider.getConnection();
    assertSame(connection, provider.getConnection());
    assertTrue(provider.isValid());
    assertEquals(1, provider.opened);
  }

  @Test
  void reconnectsWhenTheConnectionWentStale() throws SQLException {
    Connection stale = validConnection(false);
    Connection fresh = mock(Connection.class);
    QueuedConnectionProvider provider =
        new QueuedConnectionProvider(1, Duration.ZERO, stale, fresh);

    provider.getConnection();
    assertSame(fresh, provider.getConnection());
    verify(stale).close();
  }

  @Test
  void validationErrorCountsAsStale() throws SQLException {
    Connection broken = mock(Connection.class);
    when(broken.isValid(5)).thenThrow(new SQLException("socket closed"));
    Connection fresh = mock(Connection.class);
    QueuedConnectionProvider provider =
        new QueuedConnectionProvider(1, Duration.ZERO, broken, fresh);

    provider.getConnection();
    assertSame(fresh, provider.getConnection());
    assertEquals(2, provider.opened);
  }

  @Test
  void closeReleasesTheConnection() throws SQLException {
    Connection first = mock(Connection.class);
    Connection second = mock(Connection.class);
    QueuedConnectionProvider provider =
        new QueuedConnectionProvider(1, Duration.ZERO, first, second);

    provider.getConnection();
    provider.close();
    provider.close();

    verify(first).close();
    assertSame(second, provider.getConnection());
  }

  @Test
  void interruptDuringBackoffStopsRetrying() {
    QueuedConnectionProvider provider =
        new QueuedConnectionProvider(
            3, Duration.ofMinutes(1), new SQLException("refused"), mock(Connection.class));
    Thread.currentThread().interrupt();
    try {
      assertThrows(SQLException.class, provider::getConnection);
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }
}
