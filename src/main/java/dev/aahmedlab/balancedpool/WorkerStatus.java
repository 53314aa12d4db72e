package dev.aahmedlab.balancedpool;

/**
 * Lifecycle status of a {@link WorkerThread}.
 *
 * @since 1.0.0
 */
public enum WorkerStatus {
  /**
   * Not started yet, or terminated. A worker never leaves this state once it has stopped.
   *
   * @since 1.0.0
   */
  INACTIVE,

  /**
   * Idle and blocked on its private queue.
   *
   * @since 1.0.0
   */
  WAITING,

  /**
   * Executing a job.
   *
   * @since 1.0.0
   */
  WORKING
}
