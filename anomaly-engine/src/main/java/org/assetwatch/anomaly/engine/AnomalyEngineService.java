package org.assetwatch.anomaly.engine;

import static com.google.common.base.Preconditions.checkArgument;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.concurrent.CountDownLatch;
import org.assetwatch.anomaly.datamodel.DetectionContext;
import org.assetwatch.anomaly.datamodel.config.DetectionConfig;
import org.assetwatch.anomaly.datamodel.queue.DetectionTaskQueueProvider;
import org.assetwatch.anomaly.datamodel.service.AnomalyService;
import org.assetwatch.anomaly.datamodel.store.Store;
import org.assetwatch.anomaly.datamodel.store.StoreProvider;
import org.assetwatch.anomaly.detector.DetectionWorkerPool;
import org.assetwatch.anomaly.detector.DetectionWorkerService;
import org.assetwatch.anomaly.task.manager.AnomalyScanScheduler;
import org.assetwatch.anomaly.task.manager.ScheduleState;
import org.assetwatch.anomaly.task.manager.job.AnomalyScanJobConstants;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scheduler and detection workers in one process. Scan ticks hand their tasks straight to the
 * in-process worker pool.
 */
public class AnomalyEngineService extends AnomalyService {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyEngineService.class);

  private final CountDownLatch stopped = new CountDownLatch(1);
  private Store store;
  private DetectionWorkerPool workerPool;
  private AnomalyScanScheduler scanScheduler;

  public AnomalyEngineService(Config appConfig) {
    super(appConfig);
  }

  @Override
  public String getServiceName() {
    return "anomaly-engine";
  }

  @Override
  protected void doInit() {
    Config appConfig = getAppConfig();
    Config queueConfig = appConfig.getConfig(DetectionTaskQueueProvider.QUEUE_CONFIG);
    String queueType = queueConfig.getString(DetectionTaskQueueProvider.QUEUE_TYPE);
    checkArgument(
        DetectionTaskQueueProvider.QUEUE_TYPE_LOCAL.equals(queueType),
        "anomaly-engine runs with the local queue only, got queue.type=%s",
        queueType);

    DetectionConfig detectionConfig = DetectionConfig.from(appConfig);
    store = StoreProvider.getStore(appConfig.getConfig(StoreProvider.STORE_CONFIG));
    DetectionContext workerContext = DetectionContext.forStore(detectionConfig, store).build();
    workerPool = DetectionWorkerService.createWorkerPool(appConfig, workerContext);
    DetectionContext scanContext = workerContext.toBuilder().taskQueue(workerPool).build();
    try {
      scanScheduler =
          new AnomalyScanScheduler(scanContext, AnomalyScanJobConstants.SCHEDULER_INSTANCE_NAME);
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
    if (scanScheduler.getState() == ScheduleState.DISABLED) {
      LOGGER.warn("[scheduler] Schedule disabled; this engine will not scan until it is enabled");
    }
  }

  @Override
  protected void doStart() {
    try {
      scanScheduler.start();
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  @Override
  protected void doStop() {
    try {
      scanScheduler.stop();
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    } finally {
      workerPool.close();
      store.close();
      stopped.countDown();
    }
  }

  AnomalyScanScheduler getScanScheduler() {
    return scanScheduler;
  }

  Store getStore() {
    return store;
  }

  public void awaitShutdown() throws InterruptedException {
    stopped.await();
  }

  public static void main(String[] args) throws InterruptedException {
    AnomalyEngineService service = new AnomalyEngineService(ConfigFactory.load());
    AnomalyService.run(service);
    service.awaitShutdown();
  }
}
