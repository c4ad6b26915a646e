package dev.docqa.job;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs each job on a worker thread of a fixed-size pool. The submitter's MDC is copied onto the
 * worker so request-scoped log context follows the job.
 */
public class ThreadJobLauncher implements JobLauncher, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(ThreadJobLauncher.class);

  private final JobRunner jobRunner;
  private final ExecutorService executor;

  public ThreadJobLauncher(JobRunner jobRunner, int threads) {
    this(jobRunner, Executors.newFixedThreadPool(threads, namedThreads()));
  }

  ThreadJobLauncher(JobRunner jobRunner, ExecutorService executor) {
    this.jobRunner = jobRunner;
    this.executor = executor;
  }

  @Override
  public String name() {
    return "thread";
  }

  @Override
  public void launch(JobRequest request) {
    Map<String, String> parentMdc = MDC.getCopyOfContextMap();
    executor.execute(
        () -> {
          if (parentMdc != null) {
            MDC.setContextMap(parentMdc);
          }
          try {
            jobRunner.run(request);
          } finally {
            MDC.clear();
          }
        });
    log.debug("Dispatched job {} to worker pool", request.jobKey());
  }

  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        log.warn("Validation jobs still running at shutdown; interrupting");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static ThreadFactory namedThreads() {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "docqa-job-" + counter.incrementAndGet());
      thread.setDaemon(false);
      return thread;
    };
  }
}
