package dev.docqa.job;

/**
 * Launches jobs through the {@link RedisJobQueue}. Worker processes sharing the same Redis and
 * uploads directory run them; submission returns as soon as the job is queued.
 */
public class QueueJobLauncher implements JobLauncher {

  private final RedisJobQueue queue;

  public QueueJobLauncher(RedisJobQueue queue) {
    this.queue = queue;
  }

  @Override
  public String name() {
    return "queue";
  }

  @Override
  public void launch(JobRequest request) {
    queue.enqueue(request);
  }
}
