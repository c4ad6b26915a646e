package dev.docqa.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.docqa.failure.PersistenceFailureException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Centralized {@link ProgressBackend} storing each record as a Redis hash.
 *
 * <p>All fields supplied in one update are written with a single {@code HSET key f1 v1 f2 v2 ...},
 * which Redis applies atomically. If that multi-field write fails, each field is retried with its
 * own {@code HSET} so a transient fault does not lose the whole update; in that case the fields of
 * one update may briefly become visible one at a time. Reads fetch the whole hash with one {@code
 * HGETALL}.
 */
public class RedisProgressBackend implements ProgressBackend {

  private static final Logger log = LoggerFactory.getLogger(RedisProgressBackend.class);

  static final String PERCENT = "percent";
  static final String DONE = "done";
  static final String RESULT_LOCATOR = "result_locator";
  static final String ERROR = "error";
  static final String PARTIAL = "partial";

  private final StringRedisTemplate redis;
  private final ObjectMapper objectMapper;
  private final String keyPrefix;

  public RedisProgressBackend(
      StringRedisTemplate redis, ObjectMapper objectMapper, String keyPrefix) {
    this.redis = redis;
    this.objectMapper = objectMapper;
    this.keyPrefix = keyPrefix;
  }

  @Override
  public String name() {
    return "redis";
  }

  @Override
  public void write(String jobKey, ProgressUpdate update) {
    Map<String, String> fields = toHash(update);
    if (fields.isEmpty()) {
      return;
    }
    String key = redisKey(jobKey);
    HashOperations<String, String, String> hash = redis.opsForHash();
    try {
      hash.putAll(key, fields);
    } catch (DataAccessException e) {
      log.warn(
          "Multi-field progress write failed for {}, falling back to single-field writes: {}",
          jobKey,
          e.getMessage());
      writeFieldByField(hash, key, fields);
    }
  }

  private void writeFieldByField(
      HashOperations<String, String, String> hash, String key, Map<String, String> fields) {
    try {
      for (Map.Entry<String, String> field : fields.entrySet()) {
        hash.put(key, field.getKey(), field.getValue());
      }
    } catch (DataAccessException e) {
      throw new PersistenceFailureException("Failed to write progress hash " + key, e);
    }
  }

  @Override
  public Optional<ProgressRecord> read(String jobKey) {
    Map<String, String> entries;
    try {
      HashOperations<String, String, String> hash = redis.opsForHash();
      entries = hash.entries(redisKey(jobKey));
    } catch (DataAccessException e) {
      throw new PersistenceFailureException("Failed to read progress for " + jobKey, e);
    }
    if (entries == null || entries.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(fromHash(entries));
  }

  /** Locators are only ever written once the artifact exists, so presence is enough. */
  @Override
  public boolean isResultReachable(ProgressRecord record) {
    return record.resultLocator() != null && !record.resultLocator().isBlank();
  }

  String redisKey(String jobKey) {
    return keyPrefix + jobKey;
  }

  private Map<String, String> toHash(ProgressUpdate update) {
    Map<String, String> fields = new LinkedHashMap<>();
    if (update.percent() != null) {
      fields.put(PERCENT, update.percent().toString());
    }
    if (update.done() != null) {
      fields.put(DONE, update.done().toString());
    }
    if (update.resultLocator() != null) {
      fields.put(RESULT_LOCATOR, update.resultLocator());
    }
    if (update.error() != null) {
      try {
        fields.put(ERROR, objectMapper.writeValueAsString(update.error()));
      } catch (JsonProcessingException e) {
        throw new PersistenceFailureException("Failed to serialize progress error", e);
      }
    }
    if (update.partial() != null) {
      fields.put(PARTIAL, update.partial().toString());
    }
    return fields;
  }

  private ProgressRecord fromHash(Map<String, String> entries) {
    return new ProgressRecord(
        parsePercent(entries.get(PERCENT)),
        Boolean.parseBoolean(entries.get(DONE)),
        emptyToNull(entries.get(RESULT_LOCATOR)),
        parseError(entries.get(ERROR)),
        Boolean.parseBoolean(entries.get(PARTIAL)));
  }

  private static int parsePercent(@Nullable String raw) {
    if (raw == null) {
      return 0;
    }
    try {
      return Math.max(0, Math.min(100, Integer.parseInt(raw.trim())));
    } catch (NumberFormatException e) {
      log.warn("Ignoring malformed progress percent '{}'", raw);
      return 0;
    }
  }

  private @Nullable ProgressError parseError(@Nullable String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return objectMapper.readValue(raw, ProgressError.class);
    } catch (JsonProcessingException e) {
      // a non-JSON error field is kept as the message
      return ProgressError.of(raw);
    }
  }

  private static @Nullable String emptyToNull(@Nullable String value) {
    return value == null || value.isEmpty() ? null : value;
  }
}
