package org.hypertrace.core.metrics.etl.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.metrics.etl.config.QueryDefinition;
import org.hypertrace.core.metrics.etl.config.QueryDefinitionProvider;
import org.hypertrace.core.metrics.etl.plan.TimeRangeSpec;
import org.hypertrace.core.metrics.etl.plan.TimeRangeSpec.InstantSpec;
import org.hypertrace.core.metrics.etl.plan.TimeRangeSpec.RangeSpec;

/**
 * Query definitions kept in the {@code query_configs} table. Besides serving the enabled
 * definitions to the runner, it supports the management operations used to maintain them.
 */
@Slf4j
public class JdbcQueryDefinitionRepository implements QueryDefinitionProvider {

  static final String SELECT_ENABLED_SQL =
      "SELECT id, name, description, query, time_range_type, time_range_time, time_range_start,"
          + " time_range_end, time_range_step, enabled, retry_count, retry_interval, timeout,"
          + " tags FROM query_configs WHERE enabled = TRUE ORDER BY created_at";

  static final String UPSERT_SQL =
      "INSERT INTO query_configs (id, name, description, query, time_range_type,"
          + " time_range_time, time_range_start, time_range_end, time_range_step, enabled,"
          + " retry_count, retry_interval, timeout, tags, created_at, updated_at)"
          + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS JSONB), NOW(), NOW())"
          + " ON CONFLICT (id) DO UPDATE SET name = EXCLUDED.name,"
          + " description = EXCLUDED.description, query = EXCLUDED.query,"
          + " time_range_type = EXCLUDED.time_range_type,"
          + " time_range_time = EXCLUDED.time_range_time,"
          + " time_range_start = EXCLUDED.time_range_start,"
          + " time_range_end = EXCLUDED.time_range_end,"
          + " time_range_step = EXCLUDED.time_range_step, enabled = EXCLUDED.enabled,"
          + " retry_count = EXCLUDED.retry_count, retry_interval = EXCLUDED.retry_interval,"
          + " timeout = EXCLUDED.timeout, tags = EXCLUDED.tags, updated_at = NOW()";

  static final String DELETE_SQL = "DELETE FROM query_configs WHERE id = ?";

  static final String SET_ENABLED_SQL =
      "UPDATE query_configs SET enabled = ?, updated_at = NOW() WHERE id = ?";

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final TypeReference<List<String>> TAGS_TYPE = new TypeReference<>() {};

  private final JdbcConnectionProvider connectionProvider;

  @Inject
  public JdbcQueryDefinitionRepository(JdbcConnectionProvider connectionProvider) {
    this.connectionProvider = connectionProvider;
  }

  @Override
  public synchronized List<QueryDefinition> listEnabledQueryDefinitions() throws StoreException {
    Connection connection = connect();
    try (PreparedStatement statement = connection.prepareStatement(SELECT_ENABLED_SQL);
        ResultSet resultSet = statement.executeQuery()) {
      List<QueryDefinition> definitions = new ArrayList<>();
      while (resultSet.next()) {
        definitions.add(readDefinition(resultSet));
      }
      log.debug("Loaded {} enabled query definitions", definitions.size());
      return definitions;
    } catch (SQLException | JsonProcessingException e) {
      throw StoreException.connection("failed to load query definitions", e);
    }
  }

  /** Inserts the definition, or replaces the stored one with the same id. */
  public synchronized void save(QueryDefinition definition) throws StoreException {
    Connection connection = connect();
    try (PreparedStatement statement = connection.prepareStatement(UPSERT_SQL)) {
      statement.setString(1, definition.getId());
      statement.setString(2, definition.getName());
      statement.setString(3, definition.getDescription());
      statement.setString(4, definition.getQuery());
      TimeRangeSpec timeRange = definition.getTimeRange().orElse(null);
      statement.setString(5, timeRange == null ? null : timeRange.getType());
      statement.setString(
          6, timeRange instanceof InstantSpec ? ((InstantSpec) timeRange).getTime() : null);
      RangeSpec range = timeRange instanceof RangeSpec ? (RangeSpec) timeRange : null;
      statement.setString(7, range == null ? null : range.getStart());
      statement.setString(8, range == null ? null : range.getEnd());
      statement.setString(9, range == null ? null : range.getStep());
      statement.setBoolean(10, definition.isEnabled());
      statement.setInt(11, definition.getRetryCount());
      statement.setString(12, definition.getRetryInterval());
      statement.setString(13, definition.getTimeout());
      statement.setString(14, OBJECT_MAPPER.writeValueAsString(definition.getTags()));
      statement.executeUpdate();
      log.info("Saved query definition {}", definition.getId());
    } catch (SQLException | JsonProcessingException e) {
      throw StoreException.write("failed to save query definition " + definition.getId(), e);
    }
  }

  public synchronized void delete(String id) throws StoreException {
    Connection connection = connect();
    try (PreparedStatement statement = connection.prepareStatement(DELETE_SQL)) {
      statement.setString(1, id);
      requireUpdated(statement.executeUpdate(), id);
      log.info("Deleted query definition {}", id);
    } catch (SQLException e) {
      throw StoreException.write("failed to delete query definition " + id, e);
    }
  }

  public synchronized void setEnabled(String id, boolean enabled) throws StoreException {
    Connection connection = connect();
    try (PreparedStatement statement = connection.prepareStatement(SET_ENABLED_SQL)) {
      statement.setBoolean(1, enabled);
      statement.setString(2, id);
      requireUpdated(statement.executeUpdate(), id);
      log.info("Query definition {} enabled={}", id, enabled);
    } catch (SQLException e) {
      throw StoreException.write("failed to update query definition " + id, e);
    }
  }

  private QueryDefinition readDefinition(ResultSet resultSet)
      throws SQLException, JsonProcessingException {
    QueryDefinition.QueryDefinitionBuilder builder =
        QueryDefinition.builder()
            .id(resultSet.getString("id"))
            .name(resultSet.getString("name"))
            .description(resultSet.getString("description"))
            .query(resultSet.getString("query"))
            .enabled(resultSet.getBoolean("enabled"))
            .retryCount(resultSet.getInt("retry_count"))
            .retryInterval(resultSet.getString("retry_interval"))
            .timeout(resultSet.getString("timeout"));
    String tags = resultSet.getString("tags");
    if (tags != null) {
      builder.tags(OBJECT_MAPPER.readValue(tags, TAGS_TYPE));
    }
    String timeRangeType = resultSet.getString("time_range_type");
    if (timeRangeType != null) {
      builder.timeRange(
          TimeRangeSpec.of(
              timeRangeType,
              resultSet.getString("time_range_time"),
              resultSet.getString("time_range_start"),
              resultSet.getString("time_range_end"),
              resultSet.getString("time_range_step")));
    }
    return builder.build();
  }

  private void requireUpdated(int rows, String id) throws StoreException {
    if (rows == 0) {
      throw StoreException.write("no query definition with id " + id, null);
    }
  }

  private Connection connect() throws StoreException {
    try {
      return connectionProvider.getConnection();
    } catch (SQLException e) {
      throw StoreException.connection("unable to connect to the record store", e);
    }
  }
}
