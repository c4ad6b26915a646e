package dev.docqa.progress;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Progress ledger settings bound from {@code docqa.progress.*}.
 *
 * @param backend {@code file} (default) or {@code redis}
 * @param dir directory of the file backend's JSON records
 * @param keyPrefix prefix of the redis backend's hash keys
 * @param terminalRetry retry policy for terminal writes
 */
@ConfigurationProperties(prefix = "docqa.progress")
public record ProgressProperties(
    String backend, Path dir, String keyPrefix, TerminalRetry terminalRetry) {

  public record TerminalRetry(int maxAttempts, long delayMs) {}
}
