package dev.aahmedlab.balancedpool;

import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves jobs from the pool's global queue to the private queue of the least-loaded live worker.
 * Runs on its own daemon thread. This class is package-private and not part of the public API.
 */
final class Scheduler {
  private static final Logger logger = LoggerFactory.getLogger(Scheduler.class);

  private final ThreadPool pool;
  private final JobQueue globalQueue;
  private final Thread thread;

  Scheduler(ThreadPool pool, JobQueue globalQueue, String name) {
    this.pool = pool;
    this.globalQueue = globalQueue;
    this.thread = new Thread(this::runLoop, name);
    this.thread.setDaemon(true);
  }

  void start() {
    thread.start();
  }

  /**
   * Stops accepting jobs. The loop keeps dispatching until the global queue is empty and then asks
   * every worker to exit.
   */
  void destroy() {
    globalQueue.close();
  }

  boolean join(long timeout, TimeUnit unit) throws InterruptedException {
    long remainingNanos = unit.toNanos(timeout);
    if (remainingNanos <= 0) {
      return !thread.isAlive();
    }
    thread.join(remainingNanos / 1_000_000L, (int) (remainingNanos % 1_000_000L));
    return !thread.isAlive();
  }

  /**
   * Returns the worker with the fewest queued jobs. Ties go to the earliest worker in the list.
   *
   * @throws IllegalArgumentException if workers is empty
   */
  static WorkerThread withMinJobs(List<WorkerThread> workers) {
    if (workers.isEmpty()) throw new IllegalArgumentException("workers must not be empty");
    WorkerThread min = null;
    int minJobs = Integer.MAX_VALUE;
    for (WorkerThread worker : workers) {
      int jobs = worker.getPendingJobs();
      if (jobs < minJobs) {
        min = worker;
        minJobs = jobs;
      }
    }
    return min;
  }

  private void runLoop() {
    try {
      while (true) {
        Job job;
        try {
          job = globalQueue.take();
          // Closed and drained: nothing was taken, so nothing can be lost.
          if (job == null) {
            return;
          }
        } catch (InterruptedException e) {
          logger.warn(
              "Scheduler {} interrupted, no further jobs will be dispatched", thread.getName());
          return;
        }
        dispatch(job);
      }
    } finally {
      pool.exitAllWorkers();
      logger.debug("Scheduler {} stopped", thread.getName());
    }
  }

  private void dispatch(Job job) {
    while (true) {
      // Snapshot under the threads lock; queue sizes are read after it is released.
      WorkerThread target = withMinJobs(pool.awaitAliveThreads());
      if (target.assign(job)) {
        return;
      }
      // The worker exited between the snapshot and the put; pick again.
      logger.debug("Worker {} exited before assignment, rescheduling job", target.getName());
    }
  }
}
