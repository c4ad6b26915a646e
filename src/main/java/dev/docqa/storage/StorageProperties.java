package dev.docqa.storage;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Filesystem locations bound from {@code docqa.storage.*}.
 *
 * @param exportsDir directory holding segments and job artifacts
 * @param uploadsDir directory holding submitted documents
 */
@ConfigurationProperties(prefix = "docqa.storage")
public record StorageProperties(Path exportsDir, Path uploadsDir) {}
