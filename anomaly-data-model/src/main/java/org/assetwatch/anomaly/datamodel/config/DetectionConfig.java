package org.assetwatch.anomaly.datamodel.config;

import static com.google.common.base.Preconditions.checkArgument;

import com.typesafe.config.Config;
import java.time.Duration;
import java.util.Locale;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DetectionConfig {
  static final String DETECTION_CONFIG = "detection";
  static final String Z_SCORE_THRESHOLD = "zScoreThreshold";
  static final String WINDOW_SIZE_SECONDS = "windowSizeSeconds";
  static final String MIN_SAMPLE_COUNT = "minSampleCount";
  static final String TASK_TIMEOUT_SECONDS = "taskTimeoutSeconds";
  static final String VERBOSE_LOGGING = "verboseLogging";
  static final String SCHEDULE_CONFIG = "schedule";
  static final String SCHEDULE_ENABLED = "enabled";
  static final String SCHEDULE_INTERVAL_SECONDS = "intervalSeconds";
  static final String SCHEDULE_CRON_EXPRESSION = "cronExpression";

  public static final double DEFAULT_Z_SCORE_THRESHOLD = 3.0;
  public static final long DEFAULT_WINDOW_SIZE_SECONDS = 600;
  public static final int DEFAULT_MIN_SAMPLE_COUNT = 10;
  public static final long DEFAULT_SCHEDULE_INTERVAL_SECONDS = 300;

  private static final Set<String> TRUTHY_VALUES = Set.of("1", "true", "yes", "on");

  @Builder.Default double zScoreThreshold = DEFAULT_Z_SCORE_THRESHOLD;
  @Builder.Default Duration windowSize = Duration.ofSeconds(DEFAULT_WINDOW_SIZE_SECONDS);
  @Builder.Default int minimumSampleCount = DEFAULT_MIN_SAMPLE_COUNT;
  @Builder.Default boolean scheduleEnabled = false;
  @Builder.Default
  Duration scheduleInterval = Duration.ofSeconds(DEFAULT_SCHEDULE_INTERVAL_SECONDS);
  String cronExpression;
  Duration taskTimeout;
  boolean verboseLogging;

  public Duration getTaskTimeout() {
    return taskTimeout != null ? taskTimeout : scheduleInterval;
  }

  public static DetectionConfig from(Config appConfig) {
    Config detectionConfig =
        appConfig.hasPath(DETECTION_CONFIG) ? appConfig.getConfig(DETECTION_CONFIG) : null;
    Config scheduleConfig =
        appConfig.hasPath(SCHEDULE_CONFIG) ? appConfig.getConfig(SCHEDULE_CONFIG) : null;

    DetectionConfigBuilder builder = DetectionConfig.builder();
    if (detectionConfig != null) {
      if (detectionConfig.hasPath(Z_SCORE_THRESHOLD)) {
        builder.zScoreThreshold(detectionConfig.getDouble(Z_SCORE_THRESHOLD));
      }
      if (detectionConfig.hasPath(WINDOW_SIZE_SECONDS)) {
        builder.windowSize(Duration.ofSeconds(detectionConfig.getLong(WINDOW_SIZE_SECONDS)));
      }
      if (detectionConfig.hasPath(MIN_SAMPLE_COUNT)) {
        builder.minimumSampleCount(detectionConfig.getInt(MIN_SAMPLE_COUNT));
      }
      if (detectionConfig.hasPath(TASK_TIMEOUT_SECONDS)) {
        builder.taskTimeout(Duration.ofSeconds(detectionConfig.getLong(TASK_TIMEOUT_SECONDS)));
      }
      if (detectionConfig.hasPath(VERBOSE_LOGGING)) {
        builder.verboseLogging(parseFlag(detectionConfig.getString(VERBOSE_LOGGING)));
      }
    }
    if (scheduleConfig != null) {
      if (scheduleConfig.hasPath(SCHEDULE_ENABLED)) {
        builder.scheduleEnabled(parseFlag(scheduleConfig.getString(SCHEDULE_ENABLED)));
      }
      if (scheduleConfig.hasPath(SCHEDULE_INTERVAL_SECONDS)) {
        builder.scheduleInterval(
            Duration.ofSeconds(scheduleConfig.getLong(SCHEDULE_INTERVAL_SECONDS)));
      }
      if (scheduleConfig.hasPath(SCHEDULE_CRON_EXPRESSION)) {
        String cron = scheduleConfig.getString(SCHEDULE_CRON_EXPRESSION).trim();
        builder.cronExpression(cron.isEmpty() ? null : cron);
      }
    }
    return builder.build().validate();
  }

  // 1/true/yes/on, case-insensitive
  static boolean parseFlag(String value) {
    return value != null && TRUTHY_VALUES.contains(value.trim().toLowerCase(Locale.ROOT));
  }

  public DetectionConfig validate() {
    checkArgument(
        zScoreThreshold > 0 && !Double.isNaN(zScoreThreshold),
        "zScoreThreshold must be positive: %s",
        zScoreThreshold);
    checkArgument(
        windowSize != null && !windowSize.isNegative() && !windowSize.isZero(),
        "windowSize must be positive: %s",
        windowSize);
    checkArgument(
        minimumSampleCount >= 2, "minSampleCount must be at least 2: %s", minimumSampleCount);
    checkArgument(
        scheduleInterval != null && !scheduleInterval.isNegative() && !scheduleInterval.isZero(),
        "schedule interval must be positive: %s",
        scheduleInterval);
    checkArgument(
        taskTimeout == null || (!taskTimeout.isNegative() && !taskTimeout.isZero()),
        "taskTimeout must be positive: %s",
        taskTimeout);
    return this;
  }
}
