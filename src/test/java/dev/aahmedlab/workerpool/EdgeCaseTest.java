package dev.aahmedlab.workerpool;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class EdgeCaseTest {

  private WorkerPool pool;

  @AfterEach
  void tearDown() throws InterruptedException {
    if (pool != null) {
      assertTrue(
          WorkerPoolTestSupport.shutdownAndAwait(pool, 5, TimeUnit.SECONDS),
          "Pool did not terminate");
    }
  }

  @ParameterizedTest
  @ValueSource(ints = {0, -1, Integer.MIN_VALUE})
  void nonPositivePoolSizeIsRejected(int poolSize) {
    IllegalArgumentException thrown =
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(poolSize));
    assertEquals("poolSize must be > 0", thrown.getMessage());
  }

  @ParameterizedTest
  @NullAndEmptySource
  @ValueSource(strings = {"  "})
  void blankThreadNamePrefixIsRejected(String prefix) {
    assertThrows(IllegalArgumentException.class, () -> new WorkerPool(1, prefix));
  }

  @Test
  void nullTaskThrowsNullPointerException() {
    pool = WorkerPool.create(1);

    NullPointerException thrown = assertThrows(NullPointerException.class, () -> pool.run(null));
    assertEquals("task", thrown.getMessage());
  }

  @Test
  void minimumValidParameters() {
    pool = WorkerPool.create(1);

    assertEquals(1, pool.getPoolSize());
    assertEquals(0, pool.getActiveCount());
    assertEquals(PoolState.RUNNING, pool.getPoolState());
    assertEquals("worker-pool-0", pool.getWorkerThreads().get(0).getName());
    assertTrue(pool.getWorkerThreads().get(0).isDaemon());
  }

  @Test
  void factoryMethodsSizeFromProcessors() throws Exception {
    int processors = Runtime.getRuntime().availableProcessors();

    WorkerPool cpu = WorkerPool.createCpuBound();
    try {
      assertEquals(processors, cpu.getPoolSize());
    } finally {
      cpu.shutdown();
    }

    WorkerPool io = WorkerPool.createIoBound();
    try {
      assertEquals(processors * 2, io.getPoolSize());
    } finally {
      io.shutdown();
    }
  }

  @Test
  void runFromWorkerThreadIsRejected() throws Exception {
    pool = WorkerPool.create(1);
    AtomicBoolean nestedRan = new AtomicBoolean();

    TaskOutcome outcome = pool.run(() -> pool.run(() -> nestedRan.set(true)));

    assertInstanceOf(IllegalStateException.class, outcome.getFailure().orElseThrow());
    assertFalse(nestedRan.get());
  }

  @Test
  void shutdownFromWorkerThreadIsRejected() throws Exception {
    pool = WorkerPool.create(1);
    AtomicReference<Throwable> thrown = new AtomicReference<>();

    pool.run(
        () -> {
          try {
            pool.shutdown();
          } catch (IllegalStateException expected) {
            thrown.set(expected);
          }
        });

    assertInstanceOf(IllegalStateException.class, thrown.get());
    assertTrue(pool.isRunning());
  }

  @Test
  void interruptLeftByTaskDoesNotKillWorker() throws Exception {
    pool = WorkerPool.create(1);

    pool.run(() -> Thread.currentThread().interrupt());
    TaskOutcome next = pool.run(() -> Thread.sleep(10));

    assertTrue(next.isSuccess(), "worker carried a stale interrupt into the next task: " + next);
    assertTrue(pool.getWorkerThreads().get(0).isAlive());
  }

  @Test
  void interruptedIdleWorkerKeepsServing() throws Exception {
    pool = WorkerPool.create(1);
    Thread worker = pool.getWorkerThreads().get(0);

    worker.interrupt();
    Thread.sleep(100);

    assertTrue(worker.isAlive(), "worker exited after an idle interrupt");
    ExecutorService callers = Executors.newSingleThreadExecutor();
    try {
      Future<TaskOutcome> outcome = WorkerPoolTestSupport.runAsync(callers, pool, () -> {});
      assertTrue(outcome.get(1, TimeUnit.SECONDS).isSuccess());
    } finally {
      callers.shutdownNow();
    }
    assertTrue(pool.isRunning());
    assertFalse(pool.awaitTermination(50, TimeUnit.MILLISECONDS));
  }

  @Test
  void sameTaskInstanceMayBeSubmittedRepeatedly() throws Exception {
    pool = WorkerPool.create(2);
    AtomicInteger runs = new AtomicInteger();
    Task task = runs::incrementAndGet;

    for (int i = 0; i < 5; i++) {
      assertTrue(pool.run(task).isSuccess());
    }
    assertEquals(5, runs.get());
  }
}
