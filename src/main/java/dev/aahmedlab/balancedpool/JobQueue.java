package dev.aahmedlab.balancedpool;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Unbounded FIFO of jobs used both as the pool's global queue and as each worker's private queue.
 * This class is package-private and not part of the public API.
 */
final class JobQueue {
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final Deque<Job> queue = new ArrayDeque<>();
  private boolean closed;

  void close() {
    lock.lock();
    try {
      closed = true;
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
  }

  List<Job> drain() {
    lock.lock();
    try {
      List<Job> drained = new ArrayList<>(queue);
      queue.clear();
      return drained;
    } finally {
      lock.unlock();
    }
  }

  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  boolean put(Job job) {
    if (job == null) throw new NullPointerException("job");
    lock.lock();
    try {
      if (closed) return false;
      queue.addLast(job);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  Job poll() {
    lock.lock();
    try {
      return queue.pollFirst();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits for the head job. Returns {@code null} once the queue is closed and nothing is left in
   * it.
   */
  Job take() throws InterruptedException {
    lock.lock();
    try {
      while (queue.isEmpty()) {
        if (closed) {
          return null;
        }
        notEmpty.await();
      }
      return queue.removeFirst();
    } finally {
      lock.unlock();
    }
  }

  int size() {
    lock.lock();
    try {
      return queue.size();
    } finally {
      lock.unlock();
    }
  }
}
