package org.hypertrace.core.metrics.etl.config;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import org.apache.commons.lang3.StringUtils;
import org.hypertrace.core.metrics.etl.plan.TimeRangeSpec;

/** Reads one entry of the {@code queries} list. */
class QueryDefinitionConfigParser {
  private static final String CONFIG_PATH_ID = "id";
  private static final String CONFIG_PATH_NAME = "name";
  private static final String CONFIG_PATH_DESCRIPTION = "description";
  private static final String CONFIG_PATH_QUERY = "query";
  private static final String CONFIG_PATH_ENABLED = "enabled";
  private static final String CONFIG_PATH_RETRY_COUNT = "retryCount";
  private static final String CONFIG_PATH_RETRY_INTERVAL = "retryInterval";
  private static final String CONFIG_PATH_TIMEOUT = "timeout";
  private static final String CONFIG_PATH_TAGS = "tags";
  private static final String CONFIG_PATH_TIME_RANGE = "timeRange";

  private static final String CONFIG_PATH_RANGE_TYPE = "type";
  private static final String CONFIG_PATH_RANGE_TIME = "time";
  private static final String CONFIG_PATH_RANGE_START = "start";
  private static final String CONFIG_PATH_RANGE_END = "end";
  private static final String CONFIG_PATH_RANGE_STEP = "step";

  private QueryDefinitionConfigParser() {}

  static QueryDefinition parse(Config config) {
    String id = getOptionalString(config, CONFIG_PATH_ID);
    String query = getOptionalString(config, CONFIG_PATH_QUERY);
    Preconditions.checkArgument(StringUtils.isNotBlank(id), "query definition id must be set");
    Preconditions.checkArgument(
        StringUtils.isNotBlank(query), "query definition %s has no query text", id);

    QueryDefinition.QueryDefinitionBuilder builder =
        QueryDefinition.builder()
            .id(id)
            .name(getOptionalString(config, CONFIG_PATH_NAME))
            .description(getOptionalString(config, CONFIG_PATH_DESCRIPTION))
            .query(query)
            .enabled(
                !config.hasPath(CONFIG_PATH_ENABLED) || config.getBoolean(CONFIG_PATH_ENABLED))
            .retryCount(
                config.hasPath(CONFIG_PATH_RETRY_COUNT)
                    ? config.getInt(CONFIG_PATH_RETRY_COUNT)
                    : 0)
            .retryInterval(getOptionalString(config, CONFIG_PATH_RETRY_INTERVAL))
            .timeout(getOptionalString(config, CONFIG_PATH_TIMEOUT));
    if (config.hasPath(CONFIG_PATH_TAGS)) {
      builder.tags(config.getStringList(CONFIG_PATH_TAGS));
    }
    if (config.hasPath(CONFIG_PATH_TIME_RANGE)) {
      builder.timeRange(parseTimeRange(config.getConfig(CONFIG_PATH_TIME_RANGE)));
    }
    return builder.build();
  }

  private static TimeRangeSpec parseTimeRange(Config config) {
    return TimeRangeSpec.of(
        getOptionalString(config, CONFIG_PATH_RANGE_TYPE),
        getOptionalString(config, CONFIG_PATH_RANGE_TIME),
        getOptionalString(config, CONFIG_PATH_RANGE_START),
        getOptionalString(config, CONFIG_PATH_RANGE_END),
        getOptionalString(config, CONFIG_PATH_RANGE_STEP));
  }

  private static String getOptionalString(Config config, String path) {
    return config.hasPath(path) ? config.getString(path) : null;
  }
}
