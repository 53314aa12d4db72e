package dev.aahmedlab.balancedpool;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BasicExecutionTest {

  private ThreadPool pool;

  @AfterEach
  void tearDown() throws InterruptedException {
    if (pool != null) {
      ThreadPoolTestSupport.destroyAndAwait(pool, 2, TimeUnit.SECONDS);
    }
  }

  @Test
  void constructorReturnsWithAllWorkersWaiting() {
    pool = new ThreadPool(3);

    assertEquals(3, pool.getPoolSize());
    assertEquals(3, pool.aliveThreads().size());
    assertEquals(3, pool.waitingThreads().size());
    assertTrue(pool.workingThreads().isEmpty());
    assertTrue(pool.isRunning());
  }

  @Test
  void twoWorkersRunFourJobsExactlyOnce() throws Exception {
    pool = new ThreadPool(2);
    AtomicInteger counter = new AtomicInteger();

    for (int i = 0; i < 4; i++) {
      pool.addJob(counter::incrementAndGet);
    }

    assertTrue(pool.awaitCompletion(2, TimeUnit.SECONDS), "jobs did not finish in time");
    assertEquals(4, counter.get());
  }

  @Test
  void executesAllSubmittedJobs() throws Exception {
    pool = new ThreadPool(4);

    int n = 100;
    CountDownLatch done = new CountDownLatch(n);
    AtomicInteger counter = new AtomicInteger();

    for (int i = 0; i < n; i++) {
      pool.addJob(
          () -> {
            counter.incrementAndGet();
            done.countDown();
          });
    }

    assertTrue(done.await(2, TimeUnit.SECONDS), "jobs did not finish in time");
    assertEquals(n, counter.get());
  }

  @Test
  void functionJobReceivesItsArgument() throws Exception {
    pool = new ThreadPool(1);
    AtomicReference<String> received = new AtomicReference<>();

    pool.addJob(received::set, "hello");

    assertTrue(pool.awaitCompletion(1, TimeUnit.SECONDS));
    assertEquals("hello", received.get());
  }

  @Test
  void usesOnlyPoolThreads() throws Exception {
    int poolSize = 3;
    pool = new ThreadPool(poolSize, "basic");

    int n = 50;
    Set<String> threadNames = ConcurrentHashMap.newKeySet();

    for (int i = 0; i < n; i++) {
      pool.addJob(() -> threadNames.add(Thread.currentThread().getName()));
    }

    assertTrue(pool.awaitCompletion(2, TimeUnit.SECONDS), "jobs did not finish in time");
    assertTrue(threadNames.size() <= poolSize, "Used more threads than pool size: " + threadNames);
    for (String name : threadNames) {
      assertTrue(name.startsWith("basic-worker-"), "Unexpected thread: " + name);
    }
  }

  @Test
  void newThreadGrowsThePool() throws Exception {
    pool = new ThreadPool(1);

    WorkerThread added = pool.newThread();

    assertEquals(1, added.getId());
    assertEquals("pool-worker-1", added.getName());
    assertEquals(2, pool.getPoolSize());
    assertTrue(ThreadPoolTestSupport.awaitStatus(added, WorkerStatus.WAITING, 1000));
    assertEquals(2, pool.aliveThreads().size());
  }

  @Test
  void workerReportsWorkingWhileJobRuns() throws Exception {
    pool = new ThreadPool(1);
    var latches = ThreadPoolTestSupport.createJobLatches();

    pool.addJob(ThreadPoolTestSupport.createBlockingJob(latches, null));
    assertTrue(latches.started.await(1, TimeUnit.SECONDS));

    assertEquals(1, pool.workingThreads().size());
    assertTrue(pool.waitingThreads().isEmpty());
    assertEquals(1, pool.getPendingJobs());

    latches.finish.countDown();
    assertTrue(pool.awaitCompletion(1, TimeUnit.SECONDS));
    assertTrue(pool.workingThreads().isEmpty());
    assertEquals(0, pool.getPendingJobs());
  }

  @Test
  void invalidArgumentsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ThreadPool(0));
    assertThrows(IllegalArgumentException.class, () -> new ThreadPool(-1));
    assertThrows(NullPointerException.class, () -> new ThreadPool(1, null));
  }

  @Test
  void submitNullJob() {
    pool = new ThreadPool(1);

    NullPointerException thrown =
        assertThrows(NullPointerException.class, () -> pool.addJob((Runnable) null));
    assertEquals("block", thrown.getMessage());
    assertEquals(0, pool.getPendingJobs());
  }

  @Test
  void cpuBoundPoolMatchesProcessorCount() {
    pool = ThreadPool.createCpuBound();

    assertEquals(Runtime.getRuntime().availableProcessors(), pool.getPoolSize());
  }
}
