package dev.docqa.job;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Job dispatch settings bound from {@code docqa.jobs.*}.
 *
 * @param launcher {@code thread} (default), {@code queue} or {@code sync}
 * @param threads worker pool size of the thread launcher
 * @param queueName Redis list the queue launcher pushes to and workers pop from
 * @param workerEnabled whether this process consumes the Redis queue
 * @param pollTimeoutMs how long a worker blocks on an empty queue before polling again
 */
@ConfigurationProperties(prefix = "docqa.jobs")
public record JobsProperties(
    String launcher, int threads, String queueName, boolean workerEnabled, long pollTimeoutMs) {

  public JobsProperties {
    if (threads < 1) {
      throw new IllegalArgumentException("docqa.jobs.threads must be >= 1, got: " + threads);
    }
    if (pollTimeoutMs < 1) {
      throw new IllegalArgumentException(
          "docqa.jobs.poll-timeout-ms must be >= 1, got: " + pollTimeoutMs);
    }
  }
}
