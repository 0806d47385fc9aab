package org.hypertrace.core.metrics.etl.store;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.hypertrace.core.metrics.etl.config.MetricsEtlConfig.DatabaseConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shares one JDBC connection between the stores. The connection is checked with {@link
 * Connection#isValid} on every checkout and replaced when the check fails. Opening a connection is
 * attempted up to {@code maxConnectionAttempts} times, sleeping {@code connectionRetryBackoff}
 * between attempts.
 */
public class JdbcConnectionProvider implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcConnectionProvider.class);

  private static final int VALIDATION_TIMEOUT_SECONDS = 5;

  private final String url;
  private final String user;
  private final String password;
  private final int maxConnectionAttempts;
  private final Duration connectionRetryBackoff;

  private Connection connection;

  public JdbcConnectionProvider(DatabaseConfig databaseConfig) {
    this(
        databaseConfig.getUrl(),
        databaseConfig.getUser(),
        databaseConfig.getPassword(),
        databaseConfig.getMaxConnectionAttempts(),
        databaseConfig.getConnectionRetryBackoff());
  }

  public JdbcConnectionProvider(
      String url,
      String user,
      String password,
      int maxConnectionAttempts,
      Duration connectionRetryBackoff) {
    this.url = url;
    this.user = user;
    this.password = password;
    this.maxConnectionAttempts = maxConnectionAttempts;
    this.connectionRetryBackoff = connectionRetryBackoff;
  }

  public synchronized Connection getConnection() throws SQLException {
    if (connection != null && !validate(connection)) {
      LOGGER.warn("Metrics database connection to {} failed validation, replacing it", url);
      close();
    }
    if (connection == null) {
      connection = connectWithRetry();
    }
    return connection;
  }

  public synchronized boolean isValid() throws SQLException {
    return validate(getConnection());
  }

  private static boolean validate(Connection candidate) {
    try {
      return candidate.isValid(VALIDATION_TIMEOUT_SECONDS);
    } catch (SQLException e) {
      LOGGER.debug("Connection validation raised an error", e);
      return false;
    }
  }

  private Connection connectWithRetry() throws SQLException {
    for (int attempt = 1; ; attempt++) {
      try {
        Connection opened = openConnection(url, user, password);
        LOGGER.info("Connected to metrics database {} (attempt {})", url, attempt);
        return opened;
      } catch (SQLException e) {
        if (attempt >= maxConnectionAttempts) {
          LOGGER.error("Giving up on metrics database {} after {} attempts", url, attempt);
          throw e;
        }
        LOGGER.warn(
            "Connecting to metrics database {} failed ({}/{}), next attempt in {}: {}",
            url,
            attempt,
            maxConnectionAttempts,
            connectionRetryBackoff,
            e.getMessage());
        backOff();
      }
    }
  }

  private void backOff() throws SQLException {
    try {
      TimeUnit.MILLISECONDS.sleep(connectionRetryBackoff.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SQLException("Interrupted before reconnecting to " + url, e);
    }
  }

  protected Connection openConnection(String url, String user, String password)
      throws SQLException {
    return DriverManager.getConnection(url, user, password);
  }

  @Override
  public synchronized void close() {
    if (connection == null) {
      return;
    }
    Connection closing = connection;
    connection = null;
    try {
      closing.close();
    } catch (SQLException e) {
      LOGGER.warn("Error while closing metrics database connection to {}", url, e);
    }
  }
}
