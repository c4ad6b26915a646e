package dev.docqa.job;

/**
 * Runs jobs in the submitting thread. Used when no background transport is available; the caller
 * blocks until the whole document is processed, with no timeout.
 */
public class SynchronousJobLauncher implements JobLauncher {

  private final JobRunner jobRunner;

  public SynchronousJobLauncher(JobRunner jobRunner) {
    this.jobRunner = jobRunner;
  }

  @Override
  public String name() {
    return "sync";
  }

  @Override
  public void launch(JobRequest request) {
    jobRunner.run(request);
  }
}
