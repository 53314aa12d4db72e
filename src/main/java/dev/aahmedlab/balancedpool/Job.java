package dev.aahmedlab.balancedpool;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A unit of work waiting in a {@link JobQueue}. Both submission forms are reduced to a single
 * {@link Runnable} when the job is built. A job ends exactly once, either executed or abandoned.
 */
final class Job {
  private static final Runnable NO_OP = () -> {};

  private final Runnable block;
  private final Runnable onAbandon;
  private final AtomicBoolean ended = new AtomicBoolean();

  private Job(Runnable block, Runnable onAbandon) {
    this.block = block;
    this.onAbandon = onAbandon;
  }

  static Job of(Runnable block) {
    if (block == null) throw new NullPointerException("block");
    return new Job(block, NO_OP);
  }

  static <T> Job of(Consumer<? super T> function, T argument) {
    if (function == null) throw new NullPointerException("function");
    return new Job(() -> function.accept(argument), NO_OP);
  }

  /** A job that reports its outcome, or its abandonment, through the given future. */
  static Job of(JobFuture<?> future) {
    if (future == null) throw new NullPointerException("future");
    return new Job(future::run, future::abandon);
  }

  /** Runs the job on the calling thread. Anything it throws reaches the caller. */
  void execute() {
    if (!ended.compareAndSet(false, true)) {
      throw new IllegalStateException("job already executed or abandoned");
    }
    block.run();
  }

  /** Marks the job as dropped by a stopping worker. No-op if it already ran. */
  void abandon() {
    if (ended.compareAndSet(false, true)) {
      onAbandon.run();
    }
  }
}
