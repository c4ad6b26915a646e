package dev.docqa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the document validation service.
 *
 * <p>The same application serves the HTTP API and, with {@code docqa.jobs.worker-enabled=true},
 * consumes the Redis job queue.
 */
@SpringBootApplication
@EnableRetry
public class DocQaApplication {
  public static void main(String[] args) {
    SpringApplication.run(DocQaApplication.class, args);
  }
}
