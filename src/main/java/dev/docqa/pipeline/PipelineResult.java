package dev.docqa.pipeline;

/**
 * Outcome of a completed validation run.
 *
 * @param resultLocator locator of the merged {@code Page,Field,Result,Output} artifact
 * @param fieldSummaryLocator locator of the {@code Field,Status,Output} artifact
 * @param anomaliesLocator locator of the {@code Page,Field,Issue} artifact
 * @param pages number of pages processed
 * @param segments number of segment checkpoints written
 * @param rows data rows in the merged artifact
 * @param anomalies total anomalies found
 * @param criticalIssues out-of-range and inconsistent anomalies
 * @param partial true when a segment could not be merged and the artifact is short
 */
public record PipelineResult(
    String resultLocator,
    String fieldSummaryLocator,
    String anomaliesLocator,
    int pages,
    int segments,
    long rows,
    int anomalies,
    int criticalIssues,
    boolean partial) {}
