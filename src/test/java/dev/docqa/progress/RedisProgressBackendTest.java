package dev.docqa.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.docqa.failure.PersistenceFailureException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.retry.support.RetryTemplate;

@ExtendWith(MockitoExtension.class)
class RedisProgressBackendTest {

  private static final String REDIS_KEY = "docqa:progress:job1";

  @Mock private StringRedisTemplate redis;

  @Mock private HashOperations<String, String, String> hashOps;

  private RedisProgressBackend backend;

  @BeforeEach
  void setUp() {
    lenient().when(redis.<String, String>opsForHash()).thenReturn(hashOps);
    backend = new RedisProgressBackend(redis, new ObjectMapper(), "docqa:progress:");
  }

  @Test
  void updateIsWrittenWithOneMultiFieldSet() {
    backend.write("job1", ProgressUpdate.completed("job1_validation_summary.csv", true));

    Map<String, String> expected = new LinkedHashMap<>();
    expected.put("percent", "100");
    expected.put("done", "true");
    expected.put("result_locator", "job1_validation_summary.csv");
    expected.put("partial", "true");
    verify(hashOps).putAll(REDIS_KEY, expected);
  }

  @Test
  void onlySpecifiedFieldsAreWritten() {
    backend.write("job1", ProgressUpdate.percent(40));

    verify(hashOps).putAll(REDIS_KEY, Map.of("percent", "40"));
  }

  @Test
  void emptyUpdateTouchesNothing() {
    backend.write("job1", new ProgressUpdate(null, null, null, null, null));

    verifyNoInteractions(hashOps);
  }

  @Test
  void failedMultiFieldWriteFallsBackToSingleFields() {
    doThrow(new RedisConnectionFailureException("reset"))
        .when(hashOps)
        .putAll(anyString(), anyMap());

    backend.write("job1", new ProgressUpdate(55, false, null, null, null));

    verify(hashOps).put(REDIS_KEY, "percent", "55");
    verify(hashOps).put(REDIS_KEY, "done", "false");
  }

  @Test
  void failedFallbackIsPersistenceFailure() {
    doThrow(new RedisConnectionFailureException("down"))
        .when(hashOps)
        .putAll(anyString(), anyMap());
    doThrow(new RedisConnectionFailureException("down"))
        .when(hashOps)
        .put(anyString(), anyString(), any());

    assertThatThrownBy(() -> backend.write("job1", ProgressUpdate.percent(10)))
        .isInstanceOf(PersistenceFailureException.class);
  }

  @Test
  void wholeHashIsReadBack() {
    when(hashOps.entries(REDIS_KEY))
        .thenReturn(
            Map.of(
                "percent", "100",
                "done", "true",
                "result_locator", "job1_error.csv",
                "error", "{\"code\":\"EXTRACTION_FAILURE\",\"message\":\"page 3\"}",
                "partial", "false"));

    ProgressRecord record = backend.read("job1").orElseThrow();

    assertThat(record)
        .isEqualTo(
            new ProgressRecord(
                100,
                true,
                "job1_error.csv",
                new ProgressError("EXTRACTION_FAILURE", "page 3"),
                false));
  }

  @Test
  void missingHashIsUnknownKey() {
    when(hashOps.entries(REDIS_KEY)).thenReturn(Map.of());

    assertThat(backend.read("job1")).isEmpty();
  }

  @Test
  void malformedFieldsAreTolerated() {
    when(hashOps.entries(REDIS_KEY)).thenReturn(Map.of("percent", "lots", "error", "plain text"));

    ProgressRecord record = backend.read("job1").orElseThrow();

    assertThat(record.percent()).isZero();
    assertThat(record.done()).isFalse();
    assertThat(record.error()).isEqualTo(ProgressError.of("plain text"));
  }

  @Test
  void readFailureIsPersistenceFailure() {
    when(hashOps.entries(REDIS_KEY)).thenThrow(new RedisConnectionFailureException("down"));

    assertThatThrownBy(() -> backend.read("job1")).isInstanceOf(PersistenceFailureException.class);
  }

  @Test
  void storedLocatorCountsAsReachable() {
    assertThat(backend.isResultReachable(new ProgressRecord(100, false, "r.csv", null, false)))
        .isTrue();
    assertThat(backend.isResultReachable(new ProgressRecord(100, false, null, null, false)))
        .isFalse();
  }

  @Test
  void healMarksHashDoneAndKeepsStoredFields() {
    when(hashOps.entries(REDIS_KEY))
        .thenReturn(
            Map.of(
                "percent", "100",
                "done", "false",
                "result_locator", "job1_validation_summary.csv",
                "partial", "true"));
    ProgressLedger ledger =
        new ProgressLedger(backend, RetryTemplate.builder().maxAttempts(1).noBackoff().build());

    ProgressRecord read = ledger.getProgress("job1");

    assertThat(read)
        .isEqualTo(new ProgressRecord(100, true, "job1_validation_summary.csv", null, true));
    Map<String, String> expected = new LinkedHashMap<>();
    expected.put("percent", "100");
    expected.put("done", "true");
    expected.put("result_locator", "job1_validation_summary.csv");
    expected.put("partial", "true");
    verify(hashOps).putAll(REDIS_KEY, expected);
  }
}
