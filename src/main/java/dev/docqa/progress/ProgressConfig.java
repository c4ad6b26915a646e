package dev.docqa.progress;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.docqa.failure.PersistenceFailureException;
import dev.docqa.storage.BlobSink;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.retry.support.RetryTemplate;

/**
 * Selects the progress backend from {@code docqa.progress.backend} and builds the single
 * {@link ProgressLedger} shared by runners and pollers.
 */
@Configuration
@EnableConfigurationProperties(ProgressProperties.class)
public class ProgressConfig {

  @Bean
  @ConditionalOnProperty(name = "docqa.progress.backend", havingValue = "redis")
  public ProgressBackend redisProgressBackend(
      StringRedisTemplate redisTemplate, ObjectMapper objectMapper, ProgressProperties properties) {
    return new RedisProgressBackend(redisTemplate, objectMapper, properties.keyPrefix());
  }

  @Bean
  @ConditionalOnProperty(
      name = "docqa.progress.backend",
      havingValue = "file",
      matchIfMissing = true)
  public ProgressBackend fileProgressBackend(
      ObjectMapper objectMapper, BlobSink blobSink, ProgressProperties properties) {
    return new FileProgressBackend(properties.dir(), objectMapper, blobSink);
  }

  @Bean
  public ProgressLedger progressLedger(ProgressBackend backend, ProgressProperties properties) {
    ProgressProperties.TerminalRetry retry = properties.terminalRetry();
    RetryTemplate terminalRetry =
        RetryTemplate.builder()
            .maxAttempts(retry.maxAttempts())
            .fixedBackoff(retry.delayMs())
            .retryOn(PersistenceFailureException.class)
            .build();
    return new ProgressLedger(backend, terminalRetry);
  }
}
