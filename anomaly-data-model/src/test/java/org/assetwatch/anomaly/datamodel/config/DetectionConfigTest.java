package org.assetwatch.anomaly.datamodel.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

class DetectionConfigTest {

  @Test
  void testDefaultsFromReferenceConf() {
    DetectionConfig config = DetectionConfig.from(ConfigFactory.defaultReference());

    Assertions.assertEquals(3.0, config.getZScoreThreshold());
    Assertions.assertEquals(Duration.ofSeconds(600), config.getWindowSize());
    Assertions.assertEquals(10, config.getMinimumSampleCount());
    Assertions.assertFalse(config.isScheduleEnabled());
    Assertions.assertEquals(Duration.ofSeconds(300), config.getScheduleInterval());
    Assertions.assertEquals(Duration.ofSeconds(300), config.getTaskTimeout());
    Assertions.assertNull(config.getCronExpression());
    Assertions.assertFalse(config.isVerboseLogging());
  }

  @Test
  void testEmptyConfigFallsBackToDefaults() {
    DetectionConfig config = DetectionConfig.from(ConfigFactory.empty());

    Assertions.assertEquals(DetectionConfig.DEFAULT_Z_SCORE_THRESHOLD, config.getZScoreThreshold());
    Assertions.assertEquals(
        DetectionConfig.DEFAULT_MIN_SAMPLE_COUNT, config.getMinimumSampleCount());
  }

  @Test
  void testOverrides() {
    Config appConfig =
        ConfigFactory.parseMap(
            Map.of(
                "detection.zScoreThreshold", 2.5,
                "detection.windowSizeSeconds", 120,
                "detection.minSampleCount", 5,
                "detection.taskTimeoutSeconds", 45,
                "schedule.enabled", "yes",
                "schedule.intervalSeconds", 60,
                "schedule.cronExpression", "0 0/5 * * * ?"));

    DetectionConfig config = DetectionConfig.from(appConfig);

    Assertions.assertEquals(2.5, config.getZScoreThreshold());
    Assertions.assertEquals(Duration.ofMinutes(2), config.getWindowSize());
    Assertions.assertEquals(5, config.getMinimumSampleCount());
    Assertions.assertTrue(config.isScheduleEnabled());
    Assertions.assertEquals(Duration.ofMinutes(1), config.getScheduleInterval());
    Assertions.assertEquals(Duration.ofSeconds(45), config.getTaskTimeout());
    Assertions.assertEquals("0 0/5 * * * ?", config.getCronExpression());
  }

  @ParameterizedTest
  @ValueSource(strings = {"1", "true", "TRUE", "yes", "On", " on "})
  void testTruthyFlags(String value) {
    Assertions.assertTrue(DetectionConfig.parseFlag(value));
  }

  @ParameterizedTest
  @ValueSource(strings = {"0", "false", "no", "off", "", "enabled"})
  void testFalsyFlags(String value) {
    Assertions.assertFalse(DetectionConfig.parseFlag(value));
  }

  @ParameterizedTest
  @MethodSource("provideInvalidConfigs")
  void testInvalidConfigIsRejected(Map<String, Object> values) {
    Config appConfig = ConfigFactory.parseMap(values);
    Assertions.assertThrows(IllegalArgumentException.class, () -> DetectionConfig.from(appConfig));
  }

  private static Stream<Arguments> provideInvalidConfigs() {
    return Stream.of(
        Arguments.arguments(Map.of("detection.zScoreThreshold", 0)),
        Arguments.arguments(Map.of("detection.zScoreThreshold", -1.5)),
        Arguments.arguments(Map.of("detection.windowSizeSeconds", 0)),
        Arguments.arguments(Map.of("detection.minSampleCount", 1)),
        Arguments.arguments(Map.of("schedule.intervalSeconds", 0)),
        Arguments.arguments(Map.of("detection.taskTimeoutSeconds", -5)));
  }
}
