package org.assetwatch.anomaly.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.assetwatch.anomaly.datamodel.AnomalyFinding;
import org.assetwatch.anomaly.datamodel.TelemetrySample;
import org.assetwatch.anomaly.datamodel.store.Store;
import org.assetwatch.anomaly.datamodel.store.StoreProvider;
import org.assetwatch.anomaly.task.manager.ScheduleState;
import org.assetwatch.anomaly.task.manager.job.ScanDispatcher;
import org.assetwatch.anomaly.task.manager.job.ScanSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AnomalyEngineEndToEndTest {
  private static final long WAIT_MILLIS = 10_000;

  private String jdbcUrl;
  private AnomalyEngineService service;

  @BeforeEach
  void setUp() {
    jdbcUrl = "jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1";
  }

  @AfterEach
  void tearDown() {
    if (service != null) {
      service.shutdown();
    }
  }

  @Test
  void testScheduledScanFindsSpikeOnce() throws Exception {
    service = new AnomalyEngineService(appConfig(true, "local"));
    service.initialize();
    Assertions.assertEquals(ScheduleState.ARMED, service.getScanScheduler().getState());

    Instant now = Instant.now();
    List<TelemetrySample> samples = new ArrayList<>();
    for (int i = 1; i <= 14; i++) {
      samples.add(sample("rocket-1", "engine_temp", now.minusSeconds(10L * i), 100.0 + (i % 3)));
    }
    TelemetrySample spike = sample("rocket-1", "engine_temp", now.minusSeconds(5), 300.0);
    samples.add(spike);
    service.getStore().getTelemetryStore().append(samples);

    // the armed job fires on start
    service.start();
    List<AnomalyFinding> findings = awaitFindings(service.getStore(), now);
    Assertions.assertEquals(1, findings.size());
    AnomalyFinding finding = findings.get(0);
    Assertions.assertEquals(spike.getId(), finding.getSourceSampleId());
    Assertions.assertEquals("engine_temp", finding.getMetric());
    Assertions.assertTrue(finding.getScore() > 3.0, "score " + finding.getScore());
    Number windowSize = (Number) finding.getDetails().get(AnomalyFinding.DETAIL_WINDOW_SIZE);
    Assertions.assertEquals(15, windowSize.intValue());

    ScanSummary rescan = rescan(service.getScanScheduler().getScanDispatcher());
    Assertions.assertEquals(1, rescan.getPairsFound());
    Assertions.assertEquals(1, rescan.getTasksEnqueued());

    // shutdown drains the worker pool
    service.shutdown();
    try (Store store = openStore()) {
      List<AnomalyFinding> afterRescan =
          store.getFindingsRepository().findByAsset("rocket-1", now.minusSeconds(600), now);
      Assertions.assertEquals(1, afterRescan.size());
      Assertions.assertEquals(finding.getId(), afterRescan.get(0).getId());
    }
  }

  @Test
  void testScheduleIsDisabledByDefault() throws Exception {
    service = new AnomalyEngineService(appConfig(null, "local"));
    service.initialize();
    service.start();

    Assertions.assertEquals(ScheduleState.DISABLED, service.getScanScheduler().getState());
    Assertions.assertNull(service.getScanScheduler().getScanDispatcher());
  }

  @Test
  void testRejectsBrokerQueue() {
    AnomalyEngineService kafkaService = new AnomalyEngineService(appConfig(true, "kafka"));

    Assertions.assertThrows(IllegalArgumentException.class, kafkaService::initialize);
  }

  private static ScanSummary rescan(ScanDispatcher dispatcher) throws InterruptedException {
    long deadline = System.currentTimeMillis() + WAIT_MILLIS;
    ScanSummary summary = dispatcher.runScan();
    while (summary.isSkipped() && System.currentTimeMillis() < deadline) {
      Thread.sleep(50);
      summary = dispatcher.runScan();
    }
    return summary;
  }

  private static List<AnomalyFinding> awaitFindings(Store store, Instant now) throws Exception {
    long deadline = System.currentTimeMillis() + WAIT_MILLIS;
    List<AnomalyFinding> findings =
        store.getFindingsRepository().findByAsset("rocket-1", now.minusSeconds(600), now);
    while (findings.isEmpty() && System.currentTimeMillis() < deadline) {
      Thread.sleep(50);
      findings =
          store.getFindingsRepository().findByAsset("rocket-1", now.minusSeconds(600), now);
    }
    return findings;
  }

  private Store openStore() {
    return StoreProvider.getStore(
        ConfigFactory.parseMap(
            Map.of(
                "type", "jdbc",
                "jdbc.url", jdbcUrl,
                "jdbc.user", "sa",
                "jdbc.password", "",
                "jdbc.initSchema", false)));
  }

  private Config appConfig(Boolean scheduleEnabled, String queueType) {
    Map<String, Object> overrides = new HashMap<>();
    if (scheduleEnabled != null) {
      overrides.put("schedule.enabled", String.valueOf(scheduleEnabled));
    }
    overrides.put("schedule.intervalSeconds", 3600);
    overrides.put("worker.threads", 2);
    overrides.put("queue.type", queueType);
    overrides.put("store.jdbc.url", jdbcUrl);
    overrides.put("store.jdbc.user", "sa");
    overrides.put("store.jdbc.password", "");
    return ConfigFactory.parseMap(overrides).withFallback(ConfigFactory.load()).resolve();
  }

  private static TelemetrySample sample(
      String assetId, String metric, Instant timestamp, double value) {
    return TelemetrySample.builder()
        .id(UUID.randomUUID())
        .assetId(assetId)
        .metric(metric)
        .timestamp(timestamp)
        .value(value)
        .unit("celsius")
        .build();
  }
}
