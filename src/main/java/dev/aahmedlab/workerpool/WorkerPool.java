package dev.aahmedlab.workerpool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed-size pool of worker threads with synchronous handoff.
 *
 * <p>There is no task queue. {@link #run(Task)} hands its task directly to an idle worker and
 * then waits for that task to finish, so at most {@link #getPoolSize()} tasks execute at once and
 * any further callers block until a worker frees up. When {@code run} returns, the task has fully
 * executed, and the returned {@link TaskOutcome} is always the outcome of the caller's own task.
 *
 * <p>Typical usage:
 *
 * <pre>{@code
 * WorkerPool pool = WorkerPool.create(2);
 * TaskOutcome outcome = pool.run(() -> process(item)); // from any number of threads
 * pool.shutdown(); // last operation on the pool
 * }</pre>
 *
 * @author Abdullah Ahmed
 * @since 1.0.0
 */
public final class WorkerPool {
  private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

  static final String DEFAULT_THREAD_NAME_PREFIX = "worker-pool";

  private final HandoffChannel<Handoff> channel = new HandoffChannel<>();
  private final List<Thread> workerThreads;
  private final CountDownLatch workersExited;
  private final AtomicInteger activeCount = new AtomicInteger();
  private final ReentrantLock poolLock = new ReentrantLock();
  private volatile PoolState poolState;

  /**
   * Creates a pool with the specified number of workers, all started before this constructor
   * returns.
   *
   * @param poolSize the number of worker threads
   * @throws IllegalArgumentException if poolSize is less than or equal to 0
   * @since 1.0.0
   */
  public WorkerPool(int poolSize) {
    this(poolSize, DEFAULT_THREAD_NAME_PREFIX);
  }

  /**
   * Creates a pool with the specified number of workers, named {@code threadNamePrefix-<index>}.
   *
   * @param poolSize the number of worker threads
   * @param threadNamePrefix prefix for worker thread names
   * @throws IllegalArgumentException if poolSize is less than or equal to 0, or the prefix is null
   *     or blank
   * @since 1.0.0
   */
  public WorkerPool(int poolSize, String threadNamePrefix) {
    if (poolSize <= 0) throw new IllegalArgumentException("poolSize must be > 0");
    if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
      throw new IllegalArgumentException("threadNamePrefix must not be blank");
    }
    this.workersExited = new CountDownLatch(poolSize);
    this.poolState = PoolState.RUNNING;
    List<Thread> threads = new ArrayList<>(poolSize);

    for (int i = 0; i < poolSize; i++) {
      Thread t = new Thread(new Worker(), threadNamePrefix + "-" + i);
      t.setDaemon(true); // Make daemon to prevent JVM hangs
      threads.add(t);
    }
    this.workerThreads = Collections.unmodifiableList(threads);
    for (Thread t : workerThreads) {
      t.start();
    }
    logger.debug("Started worker pool with {} workers", poolSize);
  }

  /**
   * Creates a pool with the specified number of workers.
   *
   * @param poolSize the number of worker threads
   * @return a new WorkerPool instance
   * @throws IllegalArgumentException if poolSize is less than or equal to 0
   * @since 1.0.0
   */
  public static WorkerPool create(int poolSize) {
    return new WorkerPool(poolSize);
  }

  /**
   * Creates a pool sized for CPU-bound tasks: one worker per available processor.
   *
   * @return a new WorkerPool instance optimized for CPU-bound tasks
   * @since 1.0.0
   */
  public static WorkerPool createCpuBound() {
    return new WorkerPool(Runtime.getRuntime().availableProcessors());
  }

  /**
   * Creates a pool sized for I/O-bound tasks: two workers per available processor.
   *
   * @return a new WorkerPool instance optimized for I/O-bound tasks
   * @since 1.0.0
   */
  public static WorkerPool createIoBound() {
    return new WorkerPool(Runtime.getRuntime().availableProcessors() * 2);
  }

  /**
   * Runs a task on one of the pool's workers and returns its outcome.
   *
   * <p>Blocks until an idle worker accepts the task, then until that task has finished executing.
   * A failure thrown by the task is returned as a failed outcome, never thrown from this method.
   *
   * <p>Once a worker has accepted the task, it runs to completion: interrupting the caller from
   * that point on does not abandon the wait, and the caller's interrupt status is set again when
   * this method returns.
   *
   * @param task the task to execute
   * @return the outcome of {@code task}
   * @throws NullPointerException if task is null
   * @throws RejectedExecutionException if the pool is shut down, including while this call is
   *     waiting for a worker; the task is not executed
   * @throws IllegalStateException if called from one of this pool's worker threads
   * @throws InterruptedException if interrupted while waiting for a worker; the task is not
   *     executed
   * @since 1.0.0
   */
  public TaskOutcome run(Task task) throws InterruptedException {
    if (task == null) throw new NullPointerException("task");
    if (poolState != PoolState.RUNNING) {
      throw new RejectedExecutionException("Pool is shut down");
    }
    checkNotWorkerThread("run");

    Handoff handoff = new Handoff(task);
    try {
      channel.put(handoff);
    } catch (IllegalStateException closedException) {
      throw new RejectedExecutionException("Pool is shut down", closedException);
    }
    return handoff.outcome.awaitUninterruptibly();
  }

  /**
   * Shuts the pool down and waits for every worker to exit.
   *
   * <p>This method:
   *
   * <ul>
   *   <li>Stops accepting tasks; callers still waiting for a worker are rejected
   *   <li>Lets tasks that are already executing run to completion
   *   <li>Blocks until all worker threads have exited
   * </ul>
   *
   * <p>This must be the last operation performed on the pool. If the calling thread is interrupted
   * while waiting, the pool keeps draining and {@link #awaitTermination} can be used to finish
   * waiting.
   *
   * @throws IllegalStateException if the pool has already been shut down, or if called from one
   *     of this pool's worker threads
   * @throws InterruptedException if interrupted while waiting for workers to exit
   * @since 1.0.0
   */
  public void shutdown() throws InterruptedException {
    checkNotWorkerThread("shutdown");
    poolLock.lock();
    try {
      if (poolState != PoolState.RUNNING) {
        throw new IllegalStateException("Pool is already shut down");
      }
      poolState = PoolState.DRAINING;
      channel.close();
    } finally {
      poolLock.unlock();
    }
    logger.debug("Shutdown requested, waiting for {} workers", workerThreads.size());

    workersExited.await();
    for (Thread workerThread : workerThreads) {
      workerThread.join();
    }
    markTerminated();
  }

  /**
   * Blocks until all workers have exited after a shutdown request, or the timeout occurs, or the
   * current thread is interrupted, whichever happens first. Returns false at once if the pool has
   * not been shut down.
   *
   * @param timeout the maximum time to wait
   * @param unit the time unit of the timeout argument
   * @return true if this pool terminated and false if the timeout elapsed before termination
   * @throws InterruptedException if interrupted while waiting
   * @since 1.0.0
   */
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    if (poolState == PoolState.RUNNING) {
      return false;
    }
    long deadlineNanos = System.nanoTime() + unit.toNanos(timeout);
    if (!workersExited.await(timeout, unit)) {
      return false;
    }
    for (Thread workerThread : workerThreads) {
      long remainingNanos = deadlineNanos - System.nanoTime();
      if (remainingNanos <= 0) {
        if (workerThread.isAlive()) {
          return false;
        }
        continue;
      }

      long millis = remainingNanos / 1_000_000L;
      int nanos = (int) (remainingNanos % 1_000_000L);

      workerThread.join(millis, nanos);
      if (workerThread.isAlive()) {
        return false;
      }
    }
    markTerminated();
    return true;
  }

  /**
   * Returns true if {@link #shutdown()} has been called.
   *
   * @return true if this pool has been shut down
   * @since 1.0.0
   */
  public boolean isShutdown() {
    return poolState != PoolState.RUNNING;
  }

  /**
   * Returns true if this pool has been shut down and all worker threads have exited.
   *
   * @return true if this pool has been terminated
   * @since 1.0.0
   */
  public boolean isTerminated() {
    return poolState == PoolState.TERMINATED;
  }

  /**
   * Returns true if this pool is accepting tasks.
   *
   * @return true if this pool is running
   * @since 1.0.0
   */
  public boolean isRunning() {
    return poolState == PoolState.RUNNING;
  }

  PoolState getPoolState() {
    return poolState;
  }

  /**
   * Returns the number of worker threads in this pool.
   *
   * @return the number of worker threads
   * @since 1.0.0
   */
  public int getPoolSize() {
    return workerThreads.size();
  }

  /**
   * Returns the number of tasks executing at this moment. Never exceeds {@link #getPoolSize()}.
   *
   * @return the number of executing tasks
   * @since 1.0.0
   */
  public int getActiveCount() {
    return activeCount.get();
  }

  List<Thread> getWorkerThreads() {
    return workerThreads;
  }

  private void markTerminated() {
    poolLock.lock();
    try {
      if (poolState == PoolState.DRAINING) {
        poolState = PoolState.TERMINATED;
        logger.debug("Worker pool terminated");
      }
    } finally {
      poolLock.unlock();
    }
  }

  private void checkNotWorkerThread(String operation) {
    if (workerThreads.contains(Thread.currentThread())) {
      throw new IllegalStateException(operation + "() called from a worker thread of this pool");
    }
  }

  private static final class Handoff {
    final Task task;
    final OutcomeSlot outcome = new OutcomeSlot();

    Handoff(Task task) {
      this.task = task;
    }
  }

  private final class Worker implements Runnable {
    @Override
    public void run() {
      try {
        while (true) {
          Handoff handoff;
          try {
            handoff = channel.take();
            // If take() returns null, the channel is closed - time to exit
            if (handoff == null) {
              return;
            }
          } catch (InterruptedException e) {
            // Only a closed channel ends the loop; the interrupt status is already cleared.
            logger.warn(
                "Worker {} interrupted while idle, ignoring", Thread.currentThread().getName());
            continue;
          }
          handoff.outcome.complete(execute(handoff.task));
        }
      } finally {
        logger.debug("Worker {} exiting", Thread.currentThread().getName());
        workersExited.countDown();
      }
    }

    private TaskOutcome execute(Task task) {
      activeCount.incrementAndGet();
      try {
        task.execute();
        return TaskOutcome.success();
      } catch (Throwable t) {
        return TaskOutcome.failure(t);
      } finally {
        activeCount.decrementAndGet();
        // A task may leave the interrupt flag set; it must not leak into the next take().
        Thread.interrupted();
      }
    }
  }
}
