package dev.docqa.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/** Selects the {@link JobLauncher} from {@code docqa.jobs.launcher}. */
@Configuration
@EnableConfigurationProperties(JobsProperties.class)
public class JobLauncherConfig {

  @Bean
  @ConditionalOnProperty(
      name = "docqa.jobs.launcher",
      havingValue = "thread",
      matchIfMissing = true)
  public ThreadJobLauncher threadJobLauncher(JobRunner jobRunner, JobsProperties properties) {
    return new ThreadJobLauncher(jobRunner, properties.threads());
  }

  @Bean
  @ConditionalOnProperty(name = "docqa.jobs.launcher", havingValue = "sync")
  public SynchronousJobLauncher synchronousJobLauncher(JobRunner jobRunner) {
    return new SynchronousJobLauncher(jobRunner);
  }

  @Bean
  public RedisJobQueue redisJobQueue(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, JobsProperties properties) {
    return new RedisJobQueue(redisTemplate, objectMapper, properties.queueName());
  }

  @Bean
  @ConditionalOnProperty(name = "docqa.jobs.launcher", havingValue = "queue")
  public QueueJobLauncher queueJobLauncher(RedisJobQueue queue) {
    return new QueueJobLauncher(queue);
  }

  @Bean
  @ConditionalOnProperty(name = "docqa.jobs.worker-enabled", havingValue = "true")
  public RedisJobWorker redisJobWorker(
      StringRedisTemplate redisTemplate,
      RedisJobQueue queue,
      JobRunner jobRunner,
      JobsProperties properties) {
    return new RedisJobWorker(
        redisTemplate, queue, jobRunner, Duration.ofMillis(properties.pollTimeoutMs()));
  }
}
