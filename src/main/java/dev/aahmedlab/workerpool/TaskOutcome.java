package dev.aahmedlab.workerpool;

import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * The result of executing one {@link Task}: either success, or the failure the task raised.
 *
 * <p>Instances are immutable. The pool never inspects them; it is up to the caller of {@link
 * WorkerPool#run(Task)} to log, propagate or retry.
 *
 * @since 1.0.0
 */
public final class TaskOutcome {
  private static final TaskOutcome SUCCESS = new TaskOutcome(null);

  private final Throwable failure;

  private TaskOutcome(Throwable failure) {
    this.failure = failure;
  }

  /**
   * Returns the outcome of a task that completed normally.
   *
   * @return the shared success outcome
   * @since 1.0.0
   */
  public static TaskOutcome success() {
    return SUCCESS;
  }

  /**
   * Returns the outcome of a task that failed.
   *
   * @param failure what the task threw
   * @return a failed outcome carrying {@code failure}
   * @throws NullPointerException if failure is null
   * @since 1.0.0
   */
  public static TaskOutcome failure(Throwable failure) {
    if (failure == null) throw new NullPointerException("failure");
    return new TaskOutcome(failure);
  }

  public boolean isSuccess() {
    return failure == null;
  }

  public boolean isFailure() {
    return failure != null;
  }

  /**
   * Returns what the task threw, if it failed.
   *
   * @return the failure, or empty for a successful outcome
   * @since 1.0.0
   */
  public Optional<Throwable> getFailure() {
    return Optional.ofNullable(failure);
  }

  /**
   * Does nothing for a successful outcome; otherwise throws the failure wrapped the same way a
   * {@link java.util.concurrent.Future#get()} would report it.
   *
   * @throws ExecutionException wrapping the task's failure
   * @since 1.0.0
   */
  public void orElseThrow() throws ExecutionException {
    if (failure != null) {
      throw new ExecutionException(failure);
    }
  }

  @Override
  public String toString() {
    return failure == null ? "TaskOutcome[success]" : "TaskOutcome[failure=" + failure + "]";
  }
}
