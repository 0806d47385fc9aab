package org.hypertrace.core.metrics.etl.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.metrics.etl.executor.ExecutionRecord;
import org.hypertrace.core.metrics.etl.normalize.NormalizedRecord;

/**
 * {@link RecordStore} writing to the {@code metric_records} and {@code query_executions} tables
 * (see {@code schema.sql}). Calls are serialized on the shared connection.
 */
@Slf4j
public class JdbcRecordStore implements RecordStore {

  static final String INSERT_METRIC_RECORD_SQL =
      "INSERT INTO metric_records"
          + " (query_id, metric_name, labels, value, timestamp, result_type, collected_at)"
          + " VALUES (?, ?, CAST(? AS JSONB), ?, ?, ?, ?)";

  static final String INSERT_EXECUTION_RECORD_SQL =
      "INSERT INTO query_executions"
          + " (query_id, query_name, status, start_time, end_time, duration_ms, records_count,"
          + " attempts, error_message, created_at)"
          + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final JdbcConnectionProvider connectionProvider;

  @Inject
  public JdbcRecordStore(JdbcConnectionProvider connectionProvider) {
    this.connectionProvider = connectionProvider;
  }

  @Override
  public synchronized void insertExecutionRecord(ExecutionRecord record) throws StoreException {
    Connection connection = connect();
    try (PreparedStatement statement = connection.prepareStatement(INSERT_EXECUTION_RECORD_SQL)) {
      statement.setString(1, record.getQueryId());
      statement.setString(2, record.getQueryName());
      statement.setString(3, record.getStatus().getValue());
      statement.setTimestamp(4, Timestamp.from(record.getStartTime()));
      if (record.getEndTime().isPresent()) {
        statement.setTimestamp(5, Timestamp.from(record.getEndTime().get()));
        statement.setLong(6, record.getDuration().orElseThrow().toMillis());
      } else {
        statement.setNull(5, Types.TIMESTAMP);
        statement.setNull(6, Types.BIGINT);
      }
      statement.setInt(7, record.getRecordsCount());
      statement.setInt(8, record.getAttempts());
      statement.setString(9, record.getErrorMessage().orElse(null));
      statement.setTimestamp(10, Timestamp.from(record.getStartTime()));
      statement.executeUpdate();
    } catch (SQLException e) {
      throw StoreException.write(
          "failed to store execution record for query " + record.getQueryId(), e);
    }
  }

  @Override
  public synchronized void insertNormalizedRecords(List<NormalizedRecord> records)
      throws StoreException {
    if (records.isEmpty()) {
      return;
    }
    Connection connection = connect();
    try {
      connection.setAutoCommit(false);
      try (PreparedStatement statement = connection.prepareStatement(INSERT_METRIC_RECORD_SQL)) {
        for (NormalizedRecord record : records) {
          statement.setString(1, record.getQueryId());
          statement.setString(2, record.getMetricName());
          statement.setString(3, toJson(record));
          statement.setDouble(4, record.getValue());
          statement.setTimestamp(5, Timestamp.from(record.getTimestamp()));
          statement.setString(6, record.getResultType());
          statement.setTimestamp(7, Timestamp.from(record.getCollectedAt()));
          statement.addBatch();
        }
        statement.executeBatch();
      }
      connection.commit();
      log.debug("Stored {} metric records", records.size());
    } catch (SQLException | JsonProcessingException e) {
      rollback(connection);
      throw StoreException.write("failed to store " + records.size() + " metric records", e);
    } finally {
      resetAutoCommit(connection);
    }
  }

  @Override
  public synchronized void ping() throws StoreException {
    boolean valid;
    try {
      valid = connectionProvider.isValid();
    } catch (SQLException e) {
      throw StoreException.connection("unable to connect to the record store", e);
    }
    if (!valid) {
      throw StoreException.connection("record store connection is not valid", null);
    }
  }

  private Connection connect() throws StoreException {
    try {
      return connectionProvider.getConnection();
    } catch (SQLException e) {
      throw StoreException.connection("unable to connect to the record store", e);
    }
  }

  private String toJson(NormalizedRecord record) throws JsonProcessingException {
    return OBJECT_MAPPER.writeValueAsString(record.getLabels());
  }

  private void rollback(Connection connection) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      log.warn("Unable to roll back metric record batch", e);
    }
  }

  private void resetAutoCommit(Connection connection) {
    try {
      connection.setAutoCommit(true);
    } catch (SQLException e) {
      log.warn("Unable to restore auto-commit on the record store connection", e);
    }
  }
}
