package dev.docqa.storage;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the filesystem-backed storage beans from {@code docqa.storage.*}. */
@Configuration
@EnableConfigurationProperties(StorageProperties.class)
public class StorageConfig {

  @Bean
  public BlobSink blobSink(StorageProperties properties) {
    return new FileSystemBlobSink(properties.exportsDir());
  }
}
