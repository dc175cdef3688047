package org.assetwatch.anomaly.datamodel.service;

import com.typesafe.config.Config;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class AnomalyService {
  private static final Logger LOGGER = LoggerFactory.getLogger(AnomalyService.class);

  private final Config appConfig;
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  protected AnomalyService(Config appConfig) {
    this.appConfig = appConfig;
  }

  protected Config getAppConfig() {
    return appConfig;
  }

  public abstract String getServiceName();

  protected abstract void doInit();

  protected abstract void doStart();

  protected abstract void doStop();

  public void initialize() {
    LOGGER.info("Initializing {}", getServiceName());
    doInit();
  }

  public void start() {
    LOGGER.info("Starting {}", getServiceName());
    doStart();
  }

  public void shutdown() {
    if (stopped.compareAndSet(false, true)) {
      LOGGER.info("Stopping {}", getServiceName());
      doStop();
    }
  }

  public static void run(AnomalyService service) {
    service.initialize();
    Runtime.getRuntime()
        .addShutdownHook(new Thread(service::shutdown, service.getServiceName() + "-shutdown"));
    service.start();
  }
}
