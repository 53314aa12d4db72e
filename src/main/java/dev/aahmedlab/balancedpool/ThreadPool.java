package dev.aahmedlab.balancedpool;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A growable thread pool that balances jobs across workers with private queues.
 *
 * <p>Submitted jobs land in a global queue. A scheduler thread moves each job to the private queue
 * of the live worker with the fewest queued jobs, and each worker runs its own queue in order.
 * Callers can block until every submitted job has finished with {@link #awaitCompletion()}, add
 * workers at any time, and register workers under a key to address them directly.
 *
 * <p>Jobs submitted to different workers may run in any relative order. Jobs assigned to the same
 * worker run in the order they were assigned.
 *
 * @author Abdullah Ahmed
 * @since 1.0.0
 */
public final class ThreadPool implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ThreadPool.class);

  static final String DEFAULT_THREAD_NAME_PREFIX = "pool";

  private final String threadNamePrefix;
  private final boolean shared;
  private final JobQueue globalQueue = new JobQueue();
  private final Scheduler scheduler;

  // Guards the worker map, the key index, id assignment and pool state changes.
  private final ReentrantLock threadsLock = new ReentrantLock();
  private final Condition threadsChanged = threadsLock.newCondition();
  private final Map<Integer, WorkerThread> workerThreads = new LinkedHashMap<>();
  private final Map<Object, Integer> userThreadKeys = new HashMap<>();
  private int nextThreadId;

  private final ReentrantLock jobsLock = new ReentrantLock();
  private final Condition jobsFinished = jobsLock.newCondition();
  private final AtomicInteger pendingJobs = new AtomicInteger();
  private int drainingCallers;

  private volatile PoolState poolState;

  /**
   * Creates a thread pool with the specified number of workers. Returns once every worker is
   * waiting for jobs.
   *
   * @param count the number of worker threads
   * @throws IllegalArgumentException if count is less than or equal to 0
   * @since 1.0.0
   */
  public ThreadPool(int count) {
    this(count, DEFAULT_THREAD_NAME_PREFIX);
  }

  /**
   * Creates a thread pool whose thread names start with the given prefix.
   *
   * @param count the number of worker threads
   * @param threadNamePrefix prefix of the worker and scheduler thread names
   * @throws IllegalArgumentException if count is less than or equal to 0
   * @throws NullPointerException if threadNamePrefix is null
   * @since 1.0.0
   */
  public ThreadPool(int count, String threadNamePrefix) {
    this(count, threadNamePrefix, false);
  }

  @SuppressFBWarnings(
      value = "SC_START_IN_CTOR",
      justification = "Workers must be running before the constructor returns")
  private ThreadPool(int count, String threadNamePrefix, boolean shared) {
    if (count <= 0) throw new IllegalArgumentException("count must be > 0");
    if (threadNamePrefix == null) throw new NullPointerException("threadNamePrefix");
    this.threadNamePrefix = threadNamePrefix;
    this.shared = shared;
    this.poolState = PoolState.RUNNING; // Always start as RUNNING

    for (int i = 0; i < count; i++) {
      createThread(null);
    }
    awaitAliveCount(count);

    this.scheduler = new Scheduler(this, globalQueue, threadNamePrefix + "-scheduler");
    this.scheduler.start();
    logger.debug("Thread pool '{}' started with {} workers", threadNamePrefix, count);
  }

  /**
   * Returns the process-wide default pool. It is created on first use with a single worker and
   * lives as long as the process; {@link #destroy()} has no effect on it.
   *
   * @return the shared default pool
   * @since 1.0.0
   */
  public static ThreadPool getDefault() {
    return DefaultPoolHolder.INSTANCE;
  }

  /**
   * Creates a pool optimized for CPU-bound jobs, with one worker per available processor.
   *
   * @return a new ThreadPool instance
   * @since 1.0.0
   */
  public static ThreadPool createCpuBound() {
    return new ThreadPool(Runtime.getRuntime().availableProcessors());
  }

  /**
   * Adds an anonymous worker to the pool.
   *
   * @return the new worker
   * @throws IllegalStateException if the pool has been destroyed
   * @since 1.0.0
   */
  public WorkerThread newThread() {
    return createThread(null);
  }

  /**
   * Adds a worker to the pool and registers it under the given key. If the key is already in use
   * it is re-pointed to the new worker and the previous one stays in the pool anonymously.
   *
   * @param key the key to register the worker under
   * @return the new worker
   * @throws NullPointerException if key is null
   * @throws IllegalStateException if the pool has been destroyed
   * @since 1.0.0
   */
  public WorkerThread newThread(Object key) {
    if (key == null) throw new NullPointerException("key");
    return createThread(key);
  }

  /**
   * Returns the worker registered under the given key.
   *
   * @param key the key the worker was created with
   * @return the worker, or empty if no worker is registered under key
   * @since 1.0.0
   */
  public Optional<WorkerThread> getThread(Object key) {
    threadsLock.lock();
    try {
      Integer id = userThreadKeys.get(key);
      return id == null ? Optional.empty() : Optional.ofNullable(workerThreads.get(id));
    } finally {
      threadsLock.unlock();
    }
  }

  /**
   * Removes the worker registered under the given key and asks it to exit. Jobs still queued on
   * that worker are dropped. Does nothing if the key is unknown.
   *
   * @param key the key the worker was created with
   * @since 1.0.0
   */
  public void destroyThread(Object key) {
    WorkerThread worker;
    threadsLock.lock();
    try {
      Integer id = userThreadKeys.remove(key);
      if (id == null) {
        return;
      }
      worker = workerThreads.remove(id);
    } finally {
      threadsLock.unlock();
    }
    if (worker != null) {
      logger.debug("Destroying worker {} registered under key {}", worker.getName(), key);
      worker.exit();
    }
  }

  /**
   * Submits a job. Returns immediately; the job runs later on the least-loaded worker.
   *
   * @param block the job to run
   * @throws NullPointerException if block is null
   * @throws RejectedExecutionException if the pool has been destroyed
   * @since 1.0.0
   */
  public void addJob(Runnable block) {
    enqueue(Job.of(block));
  }

  /**
   * Submits a job that applies a function to an argument.
   *
   * @param function the function to run
   * @param argument the value passed to function
   * @param <T> the argument type
   * @throws NullPointerException if function is null
   * @throws RejectedExecutionException if the pool has been destroyed
   * @since 1.0.0
   */
  public <T> void addJob(Consumer<? super T> function, T argument) {
    enqueue(Job.of(function, argument));
  }

  /**
   * Submits a callable and returns a future for its result. Anything thrown by the callable,
   * errors included, is reported through {@link Future#get()} as the cause of an {@link
   * java.util.concurrent.ExecutionException} instead of being logged by the worker. If the worker
   * holding the job stops before running it, {@code get()} throws {@link
   * java.util.concurrent.CancellationException}.
   *
   * @param task the callable to run
   * @param <T> the result type
   * @return a future completed when the callable returns or throws, or when its job is dropped
   * @throws NullPointerException if task is null
   * @throws RejectedExecutionException if the pool has been destroyed
   * @since 1.0.0
   */
  public <T> Future<T> submit(Callable<T> task) {
    if (task == null) throw new NullPointerException("task");

    JobFuture<T> future = new JobFuture<>(task);
    enqueue(Job.of(future));
    return future;
  }

  /**
   * Blocks until the global queue is empty and no worker is executing a job. Jobs submitted while
   * waiting extend the wait. Any number of callers may wait at once.
   *
   * @throws InterruptedException if interrupted while waiting
   * @since 1.0.0
   */
  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  public void awaitCompletion() throws InterruptedException {
    jobsLock.lock();
    try {
      drainingCallers++;
      try {
        while (pendingJobs.get() > 0) {
          jobsFinished.await();
        }
      } finally {
        drainingCallers--;
      }
    } finally {
      jobsLock.unlock();
    }
  }

  /**
   * Blocks until all submitted jobs have finished, or the timeout elapses.
   *
   * @param timeout the maximum time to wait
   * @param unit the time unit of the timeout argument
   * @return true if all jobs finished and false if the timeout elapsed first
   * @throws InterruptedException if interrupted while waiting
   * @since 1.0.0
   */
  @SuppressFBWarnings(
      value = "CWO_CLOSED_WITHOUT_OPENED",
      justification = "Lock is properly acquired before the try block and released in finally")
  public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
    long remainingNanos = unit.toNanos(timeout);
    jobsLock.lock();
    try {
      drainingCallers++;
      try {
        while (pendingJobs.get() > 0) {
          if (remainingNanos <= 0) {
            return false;
          }
          remainingNanos = jobsFinished.awaitNanos(remainingNanos);
        }
        return true;
      } finally {
        drainingCallers--;
      }
    } finally {
      jobsLock.unlock();
    }
  }

  /**
   * Returns true while at least one caller is blocked in {@link #awaitCompletion()}.
   *
   * @return true if the pool is being drained
   * @since 1.0.0
   */
  public boolean isDraining() {
    jobsLock.lock();
    try {
      return drainingCallers > 0;
    } finally {
      jobsLock.unlock();
    }
  }

  /**
   * Stops the pool. New jobs and workers are rejected, jobs already in the global queue are still
   * handed to workers, and then every worker is asked to exit. Jobs a worker has not started when
   * it notices the request are dropped. Calling this more than once has no further effect, and it
   * is ignored for the {@link #getDefault() default pool}.
   *
   * @since 1.0.0
   */
  public void destroy() {
    if (shared) {
      logger.warn("Ignoring destroy() on the default thread pool");
      return;
    }
    threadsLock.lock();
    try {
      if (poolState != PoolState.RUNNING) {
        return;
      }
      poolState = PoolState.STOPPING;
    } finally {
      threadsLock.unlock();
    }
    logger.debug("Destroying thread pool '{}'", threadNamePrefix);
    scheduler.destroy();
  }

  /** Same as {@link #destroy()}. */
  @Override
  public void close() {
    destroy();
  }

  /**
   * Blocks until the scheduler and all workers have terminated after a destroy request, or the
   * timeout occurs, or the current thread is interrupted, whichever happens first.
   *
   * @param timeout the maximum time to wait
   * @param unit the time unit of the timeout argument
   * @return true if this pool terminated and false if the timeout elapsed before termination
   * @throws InterruptedException if interrupted while waiting
   * @since 1.0.0
   */
  public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    long deadlineNanos = System.nanoTime() + unit.toNanos(timeout);
    if (!scheduler.join(deadlineNanos - System.nanoTime(), TimeUnit.NANOSECONDS)) {
      return false;
    }
    for (WorkerThread worker : snapshotWorkers()) {
      if (!worker.join(deadlineNanos - System.nanoTime(), TimeUnit.NANOSECONDS)) {
        return false;
      }
    }

    // All threads have terminated, update state
    threadsLock.lock();
    try {
      poolState = PoolState.TERMINATED;
    } finally {
      threadsLock.unlock();
    }
    return true;
  }

  /**
   * Returns true if this pool is running and accepting new jobs.
   *
   * @return true if this pool is running
   * @since 1.0.0
   */
  public boolean isRunning() {
    return poolState == PoolState.RUNNING;
  }

  /**
   * Returns true if this pool has been destroyed.
   *
   * @return true if this pool has been destroyed
   * @since 1.0.0
   */
  public boolean isShutdown() {
    return poolState != PoolState.RUNNING;
  }

  /**
   * Returns true once {@link #awaitTermination} has observed every thread of this pool exit.
   *
   * @return true if this pool has been terminated
   * @since 1.0.0
   */
  public boolean isTerminated() {
    return poolState == PoolState.TERMINATED;
  }

  PoolState getPoolState() {
    return poolState;
  }

  /**
   * Returns the workers that have started and not yet terminated.
   *
   * @return a snapshot of the alive workers
   * @since 1.0.0
   */
  public List<WorkerThread> aliveThreads() {
    threadsLock.lock();
    try {
      List<WorkerThread> alive = new ArrayList<>();
      for (WorkerThread worker : workerThreads.values()) {
        if (worker.getStatus() != WorkerStatus.INACTIVE) {
          alive.add(worker);
        }
      }
      return alive;
    } finally {
      threadsLock.unlock();
    }
  }

  /**
   * Returns the workers that are idle and waiting for jobs.
   *
   * @return a snapshot of the waiting workers
   * @since 1.0.0
   */
  public List<WorkerThread> waitingThreads() {
    return threadsWithStatus(WorkerStatus.WAITING);
  }

  /**
   * Returns the workers that are executing a job.
   *
   * @return a snapshot of the working workers
   * @since 1.0.0
   */
  public List<WorkerThread> workingThreads() {
    return threadsWithStatus(WorkerStatus.WORKING);
  }

  /**
   * Returns the number of workers in this pool, including ones that have not started yet.
   *
   * @return the number of workers
   * @since 1.0.0
   */
  public int getPoolSize() {
    threadsLock.lock();
    try {
      return workerThreads.size();
    } finally {
      threadsLock.unlock();
    }
  }

  /**
   * Returns the number of jobs in the global queue that the scheduler has not assigned yet.
   *
   * @return the global queue length
   * @since 1.0.0
   */
  public int getQueuedJobs() {
    return globalQueue.size();
  }

  /**
   * Returns the number of submitted jobs that have neither finished nor been dropped.
   *
   * @return the number of pending jobs
   * @since 1.0.0
   */
  public int getPendingJobs() {
    return pendingJobs.get();
  }

  // Callbacks from workers and the scheduler

  void workerStatusChanged(WorkerThread worker, WorkerStatus status) {
    threadsLock.lock();
    try {
      worker.setStatus(status);
      threadsChanged.signalAll();
    } finally {
      threadsLock.unlock();
    }
  }

  void jobFinished() {
    releasePendingJobs(1);
  }

  void jobsAbandoned(int count) {
    releasePendingJobs(count);
  }

  /** Returns the alive workers that have not been asked to exit, waiting until there is one. */
  List<WorkerThread> awaitAliveThreads() {
    threadsLock.lock();
    try {
      while (true) {
        List<WorkerThread> available = new ArrayList<>();
        for (WorkerThread worker : workerThreads.values()) {
          if (worker.isAlive() && !worker.isExitRequested()) {
            available.add(worker);
          }
        }
        if (!available.isEmpty()) {
          return available;
        }
        threadsChanged.awaitUninterruptibly();
      }
    } finally {
      threadsLock.unlock();
    }
  }

  void assignDirectly(WorkerThread worker, Job job) {
    if (poolState != PoolState.RUNNING) {
      throw new RejectedExecutionException("Thread pool is destroyed");
    }
    pendingJobs.incrementAndGet();
    if (!worker.assign(job)) {
      jobsAbandoned(1);
      throw new RejectedExecutionException("Worker " + worker.getName() + " has exited");
    }
  }

  void exitAllWorkers() {
    for (WorkerThread worker : snapshotWorkers()) {
      worker.exit();
    }
  }

  private void enqueue(Job job) {
    if (poolState != PoolState.RUNNING) {
      throw new RejectedExecutionException("Thread pool is destroyed");
    }
    pendingJobs.incrementAndGet();
    // The global queue is closed by destroy(); a racing submission is rejected, not lost.
    if (!globalQueue.put(job)) {
      jobsAbandoned(1);
      throw new RejectedExecutionException("Thread pool is destroyed");
    }
  }

  // Signalled outside every queue lock so a waiter never holds two locks.
  private void releasePendingJobs(int count) {
    jobsLock.lock();
    try {
      pendingJobs.addAndGet(-count);
      jobsFinished.signalAll();
    } finally {
      jobsLock.unlock();
    }
  }

  private WorkerThread createThread(Object key) {
    WorkerThread worker;
    threadsLock.lock();
    try {
      if (poolState != PoolState.RUNNING) {
        throw new IllegalStateException("Thread pool is destroyed");
      }
      int id = nextThreadId++;
      worker = new WorkerThread(this, id, threadNamePrefix + "-worker-" + id);
      workerThreads.put(id, worker);
      if (key != null) {
        userThreadKeys.put(key, id);
      }
    } finally {
      threadsLock.unlock();
    }
    worker.start();
    return worker;
  }

  private void awaitAliveCount(int count) {
    threadsLock.lock();
    try {
      while (countAlive() < count) {
        threadsChanged.awaitUninterruptibly();
      }
    } finally {
      threadsLock.unlock();
    }
  }

  private int countAlive() {
    int alive = 0;
    for (WorkerThread worker : workerThreads.values()) {
      if (worker.isAlive()) {
        alive++;
      }
    }
    return alive;
  }

  private List<WorkerThread> threadsWithStatus(WorkerStatus status) {
    threadsLock.lock();
    try {
      List<WorkerThread> matching = new ArrayList<>();
      for (WorkerThread worker : workerThreads.values()) {
        if (worker.getStatus() == status) {
          matching.add(worker);
        }
      }
      return matching;
    } finally {
      threadsLock.unlock();
    }
  }

  private List<WorkerThread> snapshotWorkers() {
    threadsLock.lock();
    try {
      return new ArrayList<>(workerThreads.values());
    } finally {
      threadsLock.unlock();
    }
  }

  private static final class DefaultPoolHolder {
    static final ThreadPool INSTANCE = new ThreadPool(1, "default", true);
  }
}
