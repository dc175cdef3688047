package org.assetwatch.anomaly.detector;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.assetwatch.anomaly.datamodel.DetectionTask;
import org.assetwatch.anomaly.datamodel.ScanPair;
import org.assetwatch.anomaly.datamodel.store.StoreUnavailableException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DetectionWorkerPoolTest {
  private final DetectionTaskProcessor processor = mock(DetectionTaskProcessor.class);
  private DetectionWorkerPool pool;

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.close();
    }
  }

  @Test
  void testReturnsStatusLine() throws Exception {
    DetectionTask task = task("rocket-1");
    when(processor.process(task)).thenReturn("No anomalies detected for rocket-1/engine_temp.");
    pool = new DetectionWorkerPool(processor, 2, 10, Duration.ofSeconds(5));

    Future<String> status = pool.submit(task);

    Assertions.assertEquals(
        "No anomalies detected for rocket-1/engine_temp.", status.get(5, TimeUnit.SECONDS));
  }

  @Test
  void testFailingTaskDoesNotAffectOthers() throws Exception {
    DetectionTask failing = task("rocket-1");
    DetectionTask healthy = task("rocket-2");
    when(processor.process(failing)).thenThrow(new StoreUnavailableException("down", null));
    when(processor.process(healthy)).thenReturn("No anomalies detected for rocket-2/engine_temp.");
    pool = new DetectionWorkerPool(processor, 1, 10, Duration.ofSeconds(5));

    Future<String> failed = pool.submit(failing);
    Future<String> succeeded = pool.submit(healthy);

    ExecutionException e =
        Assertions.assertThrows(ExecutionException.class, () -> failed.get(5, TimeUnit.SECONDS));
    Assertions.assertInstanceOf(StoreUnavailableException.class, e.getCause());
    Assertions.assertEquals(
        "No anomalies detected for rocket-2/engine_temp.", succeeded.get(5, TimeUnit.SECONDS));
  }

  @Test
  void testTaskExceedingDeadlineIsCancelled() throws Exception {
    DetectionTask slow = task("rocket-1");
    DetectionTask fast = task("rocket-2");
    CountDownLatch interrupted = new CountDownLatch(1);
    when(processor.process(slow))
        .thenAnswer(
            invocation -> {
              try {
                Thread.sleep(30_000);
              } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
              }
              return "unreachable";
            });
    when(processor.process(fast)).thenReturn("No anomalies detected for rocket-2/engine_temp.");
    pool = new DetectionWorkerPool(processor, 1, 10, Duration.ofMillis(200));

    Future<String> slowStatus = pool.submit(slow);
    Future<String> fastStatus = pool.submit(fast);

    Assertions.assertTrue(interrupted.await(5, TimeUnit.SECONDS));
    Assertions.assertTrue(slowStatus.isCancelled());
    Assertions.assertEquals(
        "No anomalies detected for rocket-2/engine_temp.", fastStatus.get(5, TimeUnit.SECONDS));
  }

  @Test
  void testFullPoolBlocksUntilAWorkerFrees() throws Exception {
    DetectionTask running = task("rocket-1");
    DetectionTask queued = task("rocket-2");
    DetectionTask waiting = task("rocket-3");
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    when(processor.process(running))
        .thenAnswer(
            invocation -> {
              started.countDown();
              release.await();
              return "No anomalies detected for rocket-1/engine_temp.";
            });
    when(processor.process(queued)).thenReturn("No anomalies detected for rocket-2/engine_temp.");
    when(processor.process(waiting)).thenReturn("No anomalies detected for rocket-3/engine_temp.");
    pool = new DetectionWorkerPool(processor, 1, 1, Duration.ofSeconds(10));

    pool.submit(running);
    Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));
    pool.submit(queued);
    Assertions.assertEquals(0, pool.availableCapacity());

    CompletableFuture<Future<String>> blocked =
        CompletableFuture.supplyAsync(
            () -> {
              try {
                return pool.submit(waiting);
              } catch (IOException e) {
                throw new CompletionException(e);
              }
            });
    Thread.sleep(200);
    Assertions.assertFalse(blocked.isDone());

    release.countDown();
    Future<String> status = blocked.get(5, TimeUnit.SECONDS);
    Assertions.assertEquals(
        "No anomalies detected for rocket-3/engine_temp.", status.get(5, TimeUnit.SECONDS));
  }

  @Test
  void testCloseDrainsQueuedTasks() throws Exception {
    DetectionTask first = task("rocket-1");
    DetectionTask second = task("rocket-2");
    when(processor.process(first))
        .thenAnswer(
            invocation -> {
              Thread.sleep(100);
              return "No anomalies detected for rocket-1/engine_temp.";
            });
    when(processor.process(second)).thenReturn("No anomalies detected for rocket-2/engine_temp.");
    pool = new DetectionWorkerPool(processor, 1, 5, Duration.ofSeconds(5));

    pool.submit(first);
    Future<String> queued = pool.submit(second);
    pool.close();

    Assertions.assertTrue(queued.isDone());
    Assertions.assertEquals("No anomalies detected for rocket-2/engine_temp.", queued.get());
  }

  @Test
  void testClosedPoolRejectsTasks() {
    pool = new DetectionWorkerPool(processor, 1, 10, Duration.ofSeconds(1));
    pool.close();

    Assertions.assertThrows(IOException.class, () -> pool.enqueue(task("rocket-1")));
  }

  private static DetectionTask task(String assetId) {
    return DetectionTask.forPair(
        ScanPair.of(assetId, "engine_temp"), "scan-1", Instant.parse("2024-05-01T12:00:00Z"));
  }
}
