package dev.aahmedlab.balancedpool;

import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handle to one worker of a {@link ThreadPool}. Each worker owns a private job queue and a daemon
 * thread that executes the queue's jobs in order.
 *
 * <p>Workers are created by the pool ({@link ThreadPool#newThread()}, {@link
 * ThreadPool#newThread(Object)}) and are never restarted once they reach {@link
 * WorkerStatus#INACTIVE}.
 *
 * @author Abdullah Ahmed
 * @since 1.0.0
 */
public final class WorkerThread {
  private static final Logger logger = LoggerFactory.getLogger(WorkerThread.class);

  private final int id;
  private final String name;
  private final ThreadPool pool;
  private final JobQueue privateQueue = new JobQueue();
  private final Thread thread;
  private volatile WorkerStatus status = WorkerStatus.INACTIVE;
  private volatile boolean exitRequested;

  WorkerThread(ThreadPool pool, int id, String name) {
    this.pool = pool;
    this.id = id;
    this.name = name;
    this.thread = new Thread(this::runLoop, name);
    this.thread.setDaemon(true); // Make daemon to prevent JVM hangs
  }

  /**
   * Returns the sequential id assigned by the pool.
   *
   * @return the worker id
   * @since 1.0.0
   */
  public int getId() {
    return id;
  }

  /**
   * Returns the name of the underlying thread.
   *
   * @return the thread name
   * @since 1.0.0
   */
  public String getName() {
    return name;
  }

  /**
   * Returns the current lifecycle status.
   *
   * @return the status of this worker
   * @since 1.0.0
   */
  public WorkerStatus getStatus() {
    return status;
  }

  /**
   * Returns true if this worker has started and not yet terminated.
   *
   * @return true if this worker is alive
   * @since 1.0.0
   */
  public boolean isAlive() {
    return status != WorkerStatus.INACTIVE;
  }

  /**
   * Returns the number of jobs assigned to this worker and not yet started.
   *
   * @return the private queue length
   * @since 1.0.0
   */
  public int getPendingJobs() {
    return privateQueue.size();
  }

  /**
   * Queues a job directly on this worker, bypassing load balancing. Jobs added this way run in
   * the order they were added, interleaved with jobs the scheduler assigns.
   *
   * @param block the job to run
   * @throws NullPointerException if block is null
   * @throws RejectedExecutionException if this worker has exited or the pool is shut down
   * @since 1.0.0
   */
  public void addJob(Runnable block) {
    pool.assignDirectly(this, Job.of(block));
  }

  void start() {
    thread.start();
  }

  boolean assign(Job job) {
    return privateQueue.put(job);
  }

  /** Requests a fast stop. Jobs still in the private queue when the loop notices are dropped. */
  void exit() {
    if (exitRequested) {
      return;
    }
    exitRequested = true;
    privateQueue.close();
  }

  boolean join(long timeout, TimeUnit unit) throws InterruptedException {
    long remainingNanos = unit.toNanos(timeout);
    if (remainingNanos <= 0) {
      return !thread.isAlive();
    }
    thread.join(remainingNanos / 1_000_000L, (int) (remainingNanos % 1_000_000L));
    return !thread.isAlive();
  }

  boolean isExitRequested() {
    return exitRequested;
  }

  void setStatus(WorkerStatus status) {
    this.status = status;
  }

  private void runLoop() {
    pool.workerStatusChanged(this, WorkerStatus.WAITING);
    logger.debug("Worker {} is waiting for jobs", name);
    try {
      while (true) {
        Job job;
        try {
          job = privateQueue.take();
          // take() returns null once exit() closed the queue and nothing is left in it
          if (job == null) {
            return;
          }
        } catch (InterruptedException e) {
          logger.debug("Worker {} interrupted while waiting, exiting", name);
          return;
        }

        // Exit was requested after the job was queued: drop it instead of running it.
        if (exitRequested) {
          job.abandon();
          pool.jobsAbandoned(1);
          return;
        }

        status = WorkerStatus.WORKING;
        try {
          job.execute();
        } catch (Throwable t) {
          logger.error("Exception occurred while executing job on {}", name, t);
        } finally {
          Thread.interrupted(); // a job's interrupt must not end the next take()
          status = WorkerStatus.WAITING;
          pool.jobFinished();
        }
      }
    } finally {
      privateQueue.close();
      List<Job> abandoned = privateQueue.drain();
      if (!abandoned.isEmpty()) {
        logger.debug("Worker {} dropped {} queued jobs on exit", name, abandoned.size());
        abandoned.forEach(Job::abandon);
        pool.jobsAbandoned(abandoned.size());
      }
      pool.workerStatusChanged(this, WorkerStatus.INACTIVE);
      logger.debug("Worker {} exited", name);
    }
  }

  @Override
  public String toString() {
    return "WorkerThread[" + name + ", " + status + "]";
  }
}
