package dev.aahmedlab.workerpool;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Internal zero-capacity rendezvous channel. A {@link #put} completes only once a {@link #take}
 * has received that exact item, so a returning sender knows a receiver owns the value. This class
 * is package-private and not part of the public API.
 *
 * <p>Once {@link #close() closed}, takers receive {@code null} and senders (including those
 * already waiting) fail with {@link IllegalStateException}. An item still in the slot at close
 * time is withdrawn by its sender, never handed to a taker.
 *
 * @param <T> the type of elements handed off through this channel
 */
final class HandoffChannel<T> {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition slotFree = lock.newCondition();
  private final Condition itemOffered = lock.newCondition();
  private final Condition itemTaken = lock.newCondition();

  private T slot;
  // Tickets pair each put with the take that received it; equal items may be offered twice.
  private long offered;
  private long taken;
  private boolean closed;

  /**
   * Hands {@code item} to a taker, blocking until one receives it.
   *
   * @throws IllegalStateException if the channel is closed before a taker receives the item
   * @throws InterruptedException if interrupted before a taker receives the item; the item is
   *     withdrawn and will never be delivered
   */
  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  public void put(T item) throws InterruptedException {
    if (item == null) throw new NullPointerException("item");
    lock.lockInterruptibly();
    try {
      while (slot != null && !closed) {
        slotFree.await();
      }
      if (closed) {
        throw new IllegalStateException("channel is closed");
      }
      slot = item;
      long ticket = ++offered;
      itemOffered.signal();

      try {
        while (taken < ticket && !closed) {
          itemTaken.await();
        }
      } catch (InterruptedException e) {
        if (taken >= ticket) {
          // Received just before the interrupt landed; the handoff stands.
          Thread.currentThread().interrupt();
          return;
        }
        withdraw();
        throw e;
      }
      if (taken < ticket) {
        withdraw();
        throw new IllegalStateException("channel is closed");
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Receives the next item, blocking until a sender offers one.
   *
   * @return the item, or {@code null} once the channel is closed
   * @throws InterruptedException if interrupted while waiting
   */
  public T take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (slot == null && !closed) {
        itemOffered.await();
      }
      if (closed) {
        return null;
      }
      T item = slot;
      slot = null;
      // The slot always holds the most recent offer; withdrawn tickets are skipped.
      taken = offered;
      itemTaken.signalAll();
      slotFree.signal();
      return item;
    } finally {
      lock.unlock();
    }
  }

  public void close() {
    lock.lock();
    try {
      closed = true;
      slotFree.signalAll();
      itemOffered.signalAll();
      itemTaken.signalAll();
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  // Caller holds the lock and its item is still in the slot.
  private void withdraw() {
    slot = null;
    slotFree.signal();
  }
}
