package dev.aahmedlab.balancedpool;

import static org.junit.jupiter.api.Assertions.*;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AwaitCompletionTest {

  private ThreadPool pool;

  @AfterEach
  void tearDown() throws InterruptedException {
    if (pool != null) {
      ThreadPoolTestSupport.destroyAndAwait(pool, 2, TimeUnit.SECONDS);
    }
  }

  @Test
  void returnsImmediatelyWhenIdle() throws Exception {
    pool = new ThreadPool(2);

    assertTrue(pool.awaitCompletion(100, TimeUnit.MILLISECONDS));
    assertFalse(pool.isDraining());
  }

  @Test
  void leavesNoQueuedOrWorkingJobs() throws Exception {
    pool = new ThreadPool(3);
    AtomicInteger counter = new AtomicInteger();

    for (int i = 0; i < 300; i++) {
      pool.addJob(
          () -> {
            try {
              Thread.sleep(1);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            counter.incrementAndGet();
          });
    }

    pool.awaitCompletion();

    assertEquals(300, counter.get());
    assertEquals(0, pool.getQueuedJobs());
    assertTrue(pool.workingThreads().isEmpty());
    for (WorkerThread worker : pool.aliveThreads()) {
      assertEquals(0, worker.getPendingJobs());
    }
  }

  @Test
  void timesOutWhileJobIsBlocked() throws Exception {
    pool = new ThreadPool(1);
    var latches = ThreadPoolTestSupport.createJobLatches();

    pool.addJob(ThreadPoolTestSupport.createBlockingJob(latches, null));
    assertTrue(latches.started.await(1, TimeUnit.SECONDS));

    assertFalse(pool.awaitCompletion(100, TimeUnit.MILLISECONDS));

    latches.finish.countDown();
    assertTrue(pool.awaitCompletion(1, TimeUnit.SECONDS));
  }

  @Test
  void releasesEveryConcurrentWaiter() throws Exception {
    pool = new ThreadPool(1);
    var latches = ThreadPoolTestSupport.createJobLatches();
    pool.addJob(ThreadPoolTestSupport.createBlockingJob(latches, null));
    assertTrue(latches.started.await(1, TimeUnit.SECONDS));

    ExecutorService waiters = Executors.newFixedThreadPool(2);
    CountDownLatch waitersStarted = new CountDownLatch(2);
    try {
      Future<?> first =
          waiters.submit(
              () -> {
                waitersStarted.countDown();
                pool.awaitCompletion();
                return null;
              });
      Future<?> second =
          waiters.submit(
              () -> {
                waitersStarted.countDown();
                pool.awaitCompletion();
                return null;
              });

      assertTrue(waitersStarted.await(1, TimeUnit.SECONDS));
      Thread.sleep(100); // let both callers block
      assertFalse(first.isDone());
      assertFalse(second.isDone());
      assertTrue(pool.isDraining());

      latches.finish.countDown();

      first.get(2, TimeUnit.SECONDS);
      second.get(2, TimeUnit.SECONDS);
      assertFalse(pool.isDraining());
    } finally {
      waiters.shutdownNow();
    }
  }

  @Test
  void jobsSubmittedWhileWaitingExtendTheWait() throws Exception {
    pool = new ThreadPool(2);
    AtomicInteger counter = new AtomicInteger();
    var latches = ThreadPoolTestSupport.createJobLatches();

    // The blocking job submits a follow-up before it finishes.
    pool.addJob(
        ThreadPoolTestSupport.createBlockingJob(
            latches,
            () ->
                pool.addJob(
                    () -> {
                      try {
                        Thread.sleep(50);
                      } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                      }
                      counter.incrementAndGet();
                    })));
    assertTrue(latches.started.await(1, TimeUnit.SECONDS));

    Thread releaser =
        new Thread(
            () -> {
              try {
                Thread.sleep(50);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              latches.finish.countDown();
            });
    releaser.start();

    assertTrue(pool.awaitCompletion(2, TimeUnit.SECONDS));
    assertEquals(1, counter.get(), "returned before the follow-up job finished");
    releaser.join();
  }

  @Test
  void failingJobsStillCountAsFinished() throws Exception {
    pool = new ThreadPool(2);

    for (int i = 0; i < 10; i++) {
      pool.addJob(
          () -> {
            throw new IllegalStateException("job failure");
          });
    }

    assertTrue(pool.awaitCompletion(2, TimeUnit.SECONDS));
    assertEquals(0, pool.getPendingJobs());
  }
}
