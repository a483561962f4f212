package dev.aahmedlab.workerpool;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

// One-shot conduit for a single run() call. It travels with its task through the handoff, so a
// worker can only ever complete the slot of the caller that submitted the task.
final class OutcomeSlot {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition done = lock.newCondition();

  private TaskOutcome outcome;

  // Called by the worker thread exactly once.
  void complete(TaskOutcome outcome) {
    lock.lock();
    try {
      if (this.outcome != null) {
        throw new IllegalStateException("outcome already set");
      }
      this.outcome = outcome;
      done.signalAll();
    } finally {
      lock.unlock();
    }
  }

  // Execution cannot be cancelled once handed off, so waiting ignores interrupts and restores the
  // flag for the caller afterwards.
  TaskOutcome awaitUninterruptibly() {
    lock.lock();
    try {
      while (outcome == null) {
        done.awaitUninterruptibly();
      }
      return outcome;
    } finally {
      lock.unlock();
    }
  }
}
