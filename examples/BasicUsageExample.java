package examples;

import dev.aahmedlab.balancedpool.ThreadPool;
import dev.aahmedlab.balancedpool.WorkerThread;

/**
 * Example demonstrating basic usage of ThreadPool.
 * This is not part of the API - just a demonstration.
 */
public class BasicUsageExample {
    public static void main(String[] args) {
        try (ThreadPool pool = new ThreadPool(4)) {
            // Submit jobs; the scheduler spreads them over the least-loaded workers
            for (int i = 0; i < 100; i++) {
                final int jobId = i;
                pool.addJob(() -> {
                    System.out.println("Job " + jobId + " running in " +
                        Thread.currentThread().getName());
                });
            }

            // A dedicated worker for jobs that must run in order on one thread
            WorkerThread io = pool.newThread("io");
            io.addJob(() -> System.out.println("Ordered job on " + io.getName()));

            try {
                pool.awaitCompletion();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                System.err.println("Wait interrupted");
            }

            pool.destroyThread("io");
        }
    }
}
