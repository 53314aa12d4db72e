package dev.aahmedlab.balancedpool;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Outcome of a callable submitted through {@link ThreadPool#submit}. It settles exactly once: with
 * the callable's result, with anything the callable threw (errors included), or as cancelled when a
 * stopping worker drops the job before running it. Callers cannot cancel it themselves.
 */
final class JobFuture<T> implements Future<T> {
  private static final int PENDING = 0;
  private static final int SETTLING = 1;
  private static final int SUCCEEDED = 2;
  private static final int FAILED = 3;
  private static final int DROPPED = 4;

  private final Callable<T> task;
  private final AtomicInteger state = new AtomicInteger(PENDING);
  private final CountDownLatch settled = new CountDownLatch(1);

  // Written before settled is counted down, read after awaiting it.
  private T result;
  private Throwable failure;

  JobFuture(Callable<T> task) {
    this.task = task;
  }

  /** Runs the callable on the worker thread. Never throws; the outcome goes to the future. */
  void run() {
    T value;
    try {
      value = task.call();
    } catch (Throwable t) {
      settle(FAILED, null, t);
      return;
    }
    settle(SUCCEEDED, value, null);
  }

  void abandon() {
    settle(DROPPED, null, null);
  }

  @Override
  public T get() throws InterruptedException, ExecutionException {
    settled.await();
    return outcome();
  }

  @Override
  public T get(long timeout, TimeUnit unit)
      throws InterruptedException, ExecutionException, TimeoutException {
    if (!settled.await(timeout, unit)) {
      throw new TimeoutException();
    }
    return outcome();
  }

  @Override
  public boolean cancel(boolean mayInterruptIfRunning) {
    return false;
  }

  @Override
  public boolean isCancelled() {
    return state.get() == DROPPED;
  }

  @Override
  public boolean isDone() {
    return settled.getCount() == 0;
  }

  private void settle(int outcome, T value, Throwable thrown) {
    if (!state.compareAndSet(PENDING, SETTLING)) {
      return;
    }
    result = value;
    failure = thrown;
    state.set(outcome);
    settled.countDown();
  }

  private T outcome() throws ExecutionException {
    switch (state.get()) {
      case SUCCEEDED:
        return result;
      case FAILED:
        throw new ExecutionException(failure);
      case DROPPED:
        throw new CancellationException("job was dropped by a stopping worker");
      default:
        throw new IllegalStateException("future read before it settled");
    }
  }
}
