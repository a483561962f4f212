package dev.aahmedlab.workerpool;

/**
 * A unit of work executed by a {@link WorkerPool}.
 *
 * <p>Returning normally reports success; throwing reports a failure, which is delivered as the
 * {@link TaskOutcome} of the {@link WorkerPool#run(Task)} call that submitted the task. A task may
 * run on any worker thread and must synchronize any state it shares with other tasks.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface Task {

  /**
   * Executes this task.
   *
   * @throws Exception to report that the task failed
   * @since 1.0.0
   */
  void execute() throws Exception;
}
