package org.assetwatch.anomaly.detector;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.assetwatch.anomaly.datamodel.DetectionTask;
import org.assetwatch.anomaly.datamodel.queue.DetectionTaskQueue;
import org.assetwatch.anomaly.datamodel.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process task queue: runs detection tasks on a fixed pool of workers behind a bounded queue.
 * {@link #enqueue} blocks while the pool is full. Each task is cancelled once it has been running
 * longer than the task timeout; one task failing or timing out never affects the others.
 */
public class DetectionWorkerPool implements DetectionTaskQueue {
  private static final Logger LOGGER = LoggerFactory.getLogger(DetectionWorkerPool.class);
  private static final String DETECTION_TIMEOUT_COUNTER =
      "assetwatch.anomaly.detector.task.timeout";
  private static final String DETECTION_DROPPED_COUNTER =
      "assetwatch.anomaly.detector.task.dropped";

  private final DetectionTaskProcessor processor;
  private final Duration taskTimeout;
  private final ThreadPoolExecutor workers;
  private final ScheduledExecutorService deadlines;
  // one permit per running or queued task
  private final Semaphore capacity;
  private final Counter timeoutCounter;
  private final Counter droppedCounter;

  public DetectionWorkerPool(
      DetectionTaskProcessor processor, int threads, int queueCapacity, Duration taskTimeout) {
    this.processor = processor;
    this.taskTimeout = taskTimeout;
    this.workers =
        new ThreadPoolExecutor(
            threads,
            threads,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            daemonThreadFactory("detection-worker-%d"));
    this.deadlines =
        Executors.newSingleThreadScheduledExecutor(daemonThreadFactory("detection-deadline-%d"));
    this.capacity = new Semaphore(threads + queueCapacity);
    this.timeoutCounter = Metrics.counter(DETECTION_TIMEOUT_COUNTER);
    this.droppedCounter = Metrics.counter(DETECTION_DROPPED_COUNTER);
  }

  private static ThreadFactory daemonThreadFactory(String nameFormat) {
    return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
  }

  @Override
  public void enqueue(DetectionTask detectionTask) throws IOException {
    submit(detectionTask);
  }

  public Future<String> submit(DetectionTask detectionTask) throws IOException {
    if (workers.isShutdown()) {
      throw new IOException("Worker pool closed, rejected task for " + detectionTask.toPair());
    }
    try {
      capacity.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted waiting for a free worker for " + detectionTask.toPair());
    }
    DeadlineTask task = new DeadlineTask(detectionTask, () -> processor.process(detectionTask));
    try {
      workers.execute(task);
    } catch (RejectedExecutionException e) {
      capacity.release();
      throw new IOException("Worker pool rejected task for " + detectionTask.toPair(), e);
    }
    return task;
  }

  int availableCapacity() {
    return capacity.availablePermits();
  }

  @Override
  public void close() {
    workers.shutdown();
    try {
      if (!workers.awaitTermination(taskTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        LOGGER.warn("Detection workers still busy after {}, interrupting", taskTimeout);
        dropQueued(workers.shutdownNow());
      }
    } catch (InterruptedException e) {
      dropQueued(workers.shutdownNow());
      Thread.currentThread().interrupt();
    } finally {
      deadlines.shutdownNow();
    }
  }

  private void dropQueued(List<Runnable> queued) {
    for (Runnable runnable : queued) {
      DetectionTask detectionTask = ((DeadlineTask) runnable).detectionTask;
      droppedCounter.increment();
      LOGGER.warn(
          "[anomaly] Dropped queued detection for {} (scan {}) on shutdown",
          detectionTask.toPair(),
          detectionTask.getScanId());
    }
  }

  private final class DeadlineTask extends FutureTask<String> {
    private final DetectionTask detectionTask;

    DeadlineTask(DetectionTask detectionTask, Callable<String> callable) {
      super(callable);
      this.detectionTask = detectionTask;
    }

    @Override
    public void run() {
      try {
        ScheduledFuture<?> deadline =
            deadlines.schedule(this::expire, taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
          super.run();
        } finally {
          deadline.cancel(false);
        }
      } finally {
        capacity.release();
      }
      report();
    }

    private void expire() {
      if (cancel(true)) {
        timeoutCounter.increment();
        LOGGER.warn(
            "[anomaly] Detection for {} exceeded {} and was cancelled",
            detectionTask.toPair(),
            taskTimeout);
      }
    }

    private void report() {
      if (isCancelled()) {
        return;
      }
      try {
        LOGGER.debug("[anomaly] {}", get());
      } catch (ExecutionException e) {
        // store failures are logged with their window by the processor
        if (!(e.getCause() instanceof StoreUnavailableException)) {
          LOGGER.error("[anomaly] Detection failed for {}", detectionTask.toPair(), e.getCause());
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
