package dev.docqa.pipeline;

import dev.docqa.storage.StorageProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Registers the {@link DocumentStore} over the configured uploads directory. */
@Configuration
public class PipelineConfig {

  @Bean
  public DocumentStore documentStore(StorageProperties storageProperties) {
    return new DocumentStore(storageProperties.uploadsDir());
  }
}
