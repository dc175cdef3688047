package org.assetwatch.anomaly.datamodel.store.jdbc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.assetwatch.anomaly.datamodel.ScanPair;
import org.assetwatch.anomaly.datamodel.TelemetrySample;
import org.assetwatch.anomaly.datamodel.store.TelemetryStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcTelemetryStoreTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  private JdbcStore store;
  private TelemetryStore telemetryStore;

  @BeforeEach
  void setUp() {
    store = H2Stores.newInMemoryStore();
    telemetryStore = store.getTelemetryStore();
  }

  @AfterEach
  void tearDown() {
    store.close();
  }

  @Test
  void testWindowQueryIsInclusiveAndAscending() throws Exception {
    Instant start = NOW.minusSeconds(600);
    telemetryStore.append(
        List.of(
            sample("rocket-1", "engine_temp", NOW, 3.0),
            sample("rocket-1", "engine_temp", start, 1.0),
            sample("rocket-1", "engine_temp", start.minusMillis(1), 0.0),
            sample("rocket-1", "engine_temp", NOW.minusSeconds(300), 2.0),
            sample("rocket-1", "engine_temp", NOW.plusMillis(1), 4.0)));

    List<TelemetrySample> samples =
        telemetryStore.querySamples("rocket-1", "engine_temp", start, NOW);

    Assertions.assertEquals(
        List.of(1.0, 2.0, 3.0),
        samples.stream().map(TelemetrySample::getValue).collect(Collectors.toList()));
    Assertions.assertEquals(start, samples.get(0).getTimestamp());
    Assertions.assertEquals(NOW, samples.get(2).getTimestamp());
  }

  @Test
  void testWindowQueryOnlyReturnsExactPair() throws Exception {
    telemetryStore.append(
        List.of(
            sample("rocket-1", "engine_temp", NOW.minusSeconds(10), 1.0),
            sample("rocket-1", "fuel_pressure", NOW.minusSeconds(10), 2.0),
            sample("rocket-2", "engine_temp", NOW.minusSeconds(10), 3.0)));

    List<TelemetrySample> samples =
        telemetryStore.querySamples("rocket-1", "engine_temp", NOW.minusSeconds(600), NOW);

    Assertions.assertEquals(1, samples.size());
    Assertions.assertEquals(1.0, samples.get(0).getValue());
  }

  @Test
  void testSampleFieldsRoundTrip() throws Exception {
    TelemetrySample original =
        TelemetrySample.builder()
            .id(UUID.randomUUID())
            .assetId("rocket-1")
            .metric("engine_temp")
            .timestamp(NOW.minusSeconds(5))
            .value(812.5)
            .unit("C")
            .tags(Map.of("stage", "1", "site", "pad-39a"))
            .build();
    telemetryStore.append(List.of(original));

    List<TelemetrySample> samples =
        telemetryStore.querySamples("rocket-1", "engine_temp", NOW.minusSeconds(60), NOW);

    Assertions.assertEquals(List.of(original), samples);
  }

  @Test
  void testEmptyWindow() throws Exception {
    Assertions.assertTrue(
        telemetryStore.querySamples("rocket-1", "engine_temp", NOW.minusSeconds(600), NOW)
            .isEmpty());
  }

  @Test
  void testDistinctPairs() throws Exception {
    Duration window = Duration.ofSeconds(600);
    telemetryStore.append(
        List.of(
            sample("rocket-1", "engine_temp", NOW.minusSeconds(30), 1.0),
            sample("rocket-1", "engine_temp", NOW.minusSeconds(20), 1.0),
            sample("rocket-1", "fuel_pressure", NOW.minusSeconds(599), 1.0),
            sample("rocket-2", "engine_temp", NOW.minus(window), 1.0),
            sample("rocket-3", "engine_temp", NOW.minusSeconds(601), 1.0)));

    Set<ScanPair> pairs = telemetryStore.findDistinctPairs(NOW.minus(window), NOW);

    Assertions.assertEquals(
        Set.of(
            ScanPair.of("rocket-1", "engine_temp"),
            ScanPair.of("rocket-1", "fuel_pressure"),
            ScanPair.of("rocket-2", "engine_temp")),
        pairs);
  }

  static TelemetrySample sample(String assetId, String metric, Instant timestamp, double value) {
    return TelemetrySample.builder()
        .id(UUID.randomUUID())
        .assetId(assetId)
        .metric(metric)
        .timestamp(timestamp)
        .value(value)
        .build();
  }
}
