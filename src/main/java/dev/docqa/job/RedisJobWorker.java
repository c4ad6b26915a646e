package dev.docqa.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Consumes the Redis job queue in a background thread and runs each job through the {@link
 * JobRunner}. Enabled with {@code docqa.jobs.worker-enabled=true}; several worker processes may
 * consume the same queue.
 */
public class RedisJobWorker implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(RedisJobWorker.class);

  private static final Duration REDIS_BACKOFF = Duration.ofSeconds(2);

  private final StringRedisTemplate redisTemplate;
  private final RedisJobQueue queue;
  private final JobRunner jobRunner;
  private final Duration pollTimeout;

  private volatile boolean running;
  private Thread thread;

  public RedisJobWorker(
      StringRedisTemplate redisTemplate,
      RedisJobQueue queue,
      JobRunner jobRunner,
      Duration pollTimeout) {
    this.redisTemplate = redisTemplate;
    this.queue = queue;
    this.jobRunner = jobRunner;
    this.pollTimeout = pollTimeout;
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    running = true;
    thread = new Thread(this::consume, "docqa-queue-worker");
    thread.start();
    log.info("Consuming job queue {}", queue.queueName());
  }

  @Override
  public synchronized void stop() {
    running = false;
    if (thread != null) {
      thread.interrupt();
      try {
        thread.join(pollTimeout.toMillis() + 1000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      thread = null;
    }
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  private void consume() {
    while (running) {
      if (!pollOnce()) {
        sleep(REDIS_BACKOFF);
      }
    }
  }

  /**
   * Pop and run at most one job.
   *
   * @return false when Redis could not be reached
   */
  boolean pollOnce() {
    String payload;
    try {
      payload = redisTemplate.opsForList().rightPop(queue.queueName(), pollTimeout);
    } catch (DataAccessException e) {
      if (running) {
        log.warn("Job queue {} unavailable: {}", queue.queueName(), e.getMessage());
      }
      return false;
    }
    if (payload == null) {
      return true;
    }
    JobRequest request;
    try {
      request = queue.decode(payload);
    } catch (JsonProcessingException e) {
      log.error("Discarding malformed job payload from {}: {}", queue.queueName(), payload, e);
      return true;
    }
    jobRunner.run(request);
    return true;
  }

  private void sleep(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      running = false;
    }
  }
}
