package dev.docqa.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.docqa.failure.DependencyUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

@ExtendWith(MockitoExtension.class)
class RedisJobQueueTest {

  @Mock private StringRedisTemplate redis;

  @Mock private ListOperations<String, String> listOps;

  private RedisJobQueue queue;

  @BeforeEach
  void setUp() {
    queue = new RedisJobQueue(redis, new ObjectMapper(), "docqa:jobs");
  }

  @Test
  void enqueuePushesJsonPayloadOnTheLeft() throws Exception {
    when(redis.opsForList()).thenReturn(listOps);
    when(listOps.leftPush(eq("docqa:jobs"), anyString())).thenReturn(1L);

    queue.enqueue(new JobRequest("job-1", "report.txt"));

    ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
    verify(listOps).leftPush(eq("docqa:jobs"), payload.capture());
    assertThat(queue.decode(payload.getValue())).isEqualTo(new JobRequest("job-1", "report.txt"));
  }

  @Test
  void redisFailurePropagatesForRetry() {
    when(redis.opsForList()).thenReturn(listOps);
    when(listOps.leftPush(eq("docqa:jobs"), anyString()))
        .thenThrow(new RedisConnectionFailureException("refused"));

    assertThatThrownBy(() -> queue.enqueue(new JobRequest("job-1", "report.txt")))
        .isInstanceOf(DataAccessException.class);
  }

  @Test
  void exhaustedRetriesSurfaceAsDependencyUnavailable() {
    assertThatThrownBy(
            () ->
                queue.recoverEnqueue(
                    new RedisConnectionFailureException("refused"),
                    new JobRequest("job-1", "report.txt")))
        .isInstanceOf(DependencyUnavailableException.class)
        .hasMessageContaining("docqa:jobs");
  }

  @Test
  void queueLauncherDelegatesToQueue() {
    when(redis.opsForList()).thenReturn(listOps);
    QueueJobLauncher launcher = new QueueJobLauncher(queue);

    launcher.launch(new JobRequest("job-1", "report.txt"));

    verify(listOps).leftPush(eq("docqa:jobs"), anyString());
    assertThat(launcher.name()).isEqualTo("queue");
  }
}
