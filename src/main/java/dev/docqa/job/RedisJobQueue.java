package dev.docqa.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.docqa.failure.DependencyUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;

/**
 * Redis list of pending jobs, each stored as a JSON {@link JobRequest}. Jobs are pushed on the left
 * and popped on the right by {@link RedisJobWorker}, so they run in submission order.
 */
public class RedisJobQueue {

  private static final Logger log = LoggerFactory.getLogger(RedisJobQueue.class);

  private final StringRedisTemplate redisTemplate;
  private final ObjectMapper objectMapper;
  private final String queueName;

  public RedisJobQueue(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, String queueName) {
    this.redisTemplate = redisTemplate;
    this.objectMapper = objectMapper;
    this.queueName = queueName;
  }

  /**
   * Enqueue a job. Retries on transient Redis failures; once retries are exhausted the failure
   * surfaces as a {@link DependencyUnavailableException}.
   */
  @Retryable(
      retryFor = DataAccessException.class,
      maxAttemptsExpression = "${docqa.jobs.enqueue-retry.max-attempts:3}",
      backoff = @Backoff(delayExpression = "${docqa.jobs.enqueue-retry.delay-ms:200}"))
  public void enqueue(JobRequest request) {
    String payload = encode(request);
    Long depth = redisTemplate.opsForList().leftPush(queueName, payload);
    log.info("Queued job {} on {} (depth {})", request.jobKey(), queueName, depth);
  }

  @Recover
  void recoverEnqueue(DataAccessException e, JobRequest request) {
    log.warn("Could not queue job {} after retries: {}", request.jobKey(), e.getMessage());
    throw new DependencyUnavailableException(
        "Job queue " + queueName + " is unavailable: " + e.getMessage(), e);
  }

  public String queueName() {
    return queueName;
  }

  public String encode(JobRequest request) {
    try {
      return objectMapper.writeValueAsString(request);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize job " + request.jobKey(), e);
    }
  }

  public JobRequest decode(String payload) throws JsonProcessingException {
    return objectMapper.readValue(payload, JobRequest.class);
  }
}
