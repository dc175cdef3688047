package org.assetwatch.anomaly.detector;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.assetwatch.anomaly.datamodel.DetectionContext;
import org.assetwatch.anomaly.datamodel.DetectionTask;
import org.assetwatch.anomaly.datamodel.config.DetectionConfig;
import org.assetwatch.anomaly.datamodel.queue.DetectionTaskQueueProvider;
import org.assetwatch.anomaly.datamodel.queue.KafkaDetectionTaskConsumer;
import org.assetwatch.anomaly.datamodel.service.AnomalyService;
import org.assetwatch.anomaly.datamodel.store.Store;
import org.assetwatch.anomaly.datamodel.store.StoreProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DetectionWorkerService extends AnomalyService {
  private static final Logger LOGGER = LoggerFactory.getLogger(DetectionWorkerService.class);

  static final String WORKER_THREADS_CONFIG = "worker.threads";
  static final int DEFAULT_WORKER_THREADS = 4;
  static final String WORKER_QUEUE_CAPACITY_CONFIG = "worker.queueCapacity";
  static final int DEFAULT_WORKER_QUEUE_CAPACITY = 100;
  private static final long STOP_TIMEOUT_SECONDS = 10;

  private final CountDownLatch consumerClosed = new CountDownLatch(1);
  private volatile boolean running;
  private Store store;
  private KafkaDetectionTaskConsumer taskConsumer;
  private DetectionWorkerPool workerPool;

  public DetectionWorkerService(Config appConfig) {
    super(appConfig);
  }

  @Override
  public String getServiceName() {
    return "anomaly-detector";
  }

  @Override
  protected void doInit() {
    Config appConfig = getAppConfig();
    DetectionConfig detectionConfig = DetectionConfig.from(appConfig);
    store = StoreProvider.getStore(appConfig.getConfig(StoreProvider.STORE_CONFIG));
    DetectionContext context = DetectionContext.forStore(detectionConfig, store).build();
    workerPool = createWorkerPool(appConfig, context);
    taskConsumer =
        DetectionTaskQueueProvider.getConsumer(
            appConfig.getConfig(DetectionTaskQueueProvider.QUEUE_CONFIG));
  }

  public static DetectionWorkerPool createWorkerPool(Config appConfig, DetectionContext context) {
    int threads =
        appConfig.hasPath(WORKER_THREADS_CONFIG)
            ? appConfig.getInt(WORKER_THREADS_CONFIG)
            : DEFAULT_WORKER_THREADS;
    int queueCapacity =
        appConfig.hasPath(WORKER_QUEUE_CAPACITY_CONFIG)
            ? appConfig.getInt(WORKER_QUEUE_CAPACITY_CONFIG)
            : DEFAULT_WORKER_QUEUE_CAPACITY;
    return new DetectionWorkerPool(
        new DetectionTaskProcessor(context),
        threads,
        queueCapacity,
        context.getConfig().getTaskTimeout());
  }

  @Override
  protected void doStart() {
    running = true;
    try {
      while (running) {
        try {
          DetectionTask detectionTask = taskConsumer.dequeue();
          if (detectionTask != null) {
            workerPool.enqueue(detectionTask);
          }
        } catch (IOException e) {
          if (running) {
            LOGGER.error("Exception processing record", e);
          }
        }
      }
    } finally {
      taskConsumer.close();
      consumerClosed.countDown();
    }
  }

  @Override
  protected void doStop() {
    running = false;
    taskConsumer.wakeup();
    try {
      if (!consumerClosed.await(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
        LOGGER.warn("Task consumer did not stop within {}s", STOP_TIMEOUT_SECONDS);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    workerPool.close();
    store.close();
  }

  public static void main(String[] args) {
    AnomalyService.run(new DetectionWorkerService(ConfigFactory.load()));
  }
}
