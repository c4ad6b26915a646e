package dev.docqa.pipeline;

/**
 * Stages of one validation run: {@code INIT -> STREAMING -> MERGING -> FINALIZING}, ending in
 * {@code COMPLETED} or, from any earlier stage, {@code FAILED}.
 */
public enum PipelineStage {
  INIT,
  STREAMING,
  MERGING,
  FINALIZING,
  COMPLETED,
  FAILED
}
