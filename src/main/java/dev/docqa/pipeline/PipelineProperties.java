package dev.docqa.pipeline;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the segmented validation pipeline.
 *
 * <p>Properties are bound from {@code docqa.pipeline.*}.
 *
 * <ul>
 *   <li>{@code segment-size} - number of pages buffered in memory before their rows are
 *       checkpointed as one segment (default 4, must be at least 1)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "docqa.pipeline")
public class PipelineProperties {

  private int segmentSize = 4;

  @PostConstruct
  void validate() {
    if (segmentSize < 1) {
      throw new IllegalStateException(
          "docqa.pipeline.segment-size must be >= 1, got: " + segmentSize);
    }
  }

  public int getSegmentSize() {
    return segmentSize;
  }

  public void setSegmentSize(int segmentSize) {
    this.segmentSize = segmentSize;
  }
}
