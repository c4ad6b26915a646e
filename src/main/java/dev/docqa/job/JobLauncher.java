package dev.docqa.job;

/**
 * Dispatches submitted jobs to a {@link JobRunner}. One implementation is active, selected by
 * {@code docqa.jobs.launcher}:
 *
 * <ul>
 *   <li>{@code thread} - {@link ThreadJobLauncher}, a local worker thread per job
 *   <li>{@code queue} - {@link QueueJobLauncher}, a Redis list consumed by {@link
 *       RedisJobWorker} processes
 *   <li>{@code sync} - {@link SynchronousJobLauncher}, inside the submitting thread
 * </ul>
 */
public interface JobLauncher {

  /** Short name reported by diagnostics. */
  String name();

  /**
   * Dispatch a job. Returns once the job is handed off, or once it ended for the synchronous
   * variant.
   */
  void launch(JobRequest request);
}
