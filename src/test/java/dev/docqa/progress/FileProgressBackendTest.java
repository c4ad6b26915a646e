package dev.docqa.progress;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.docqa.failure.PersistenceFailureException;
import dev.docqa.storage.BlobSink;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.retry.support.RetryTemplate;

@ExtendWith(MockitoExtension.class)
class FileProgressBackendTest {

  @TempDir Path progressDir;

  @Mock private BlobSink blobSink;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private FileProgressBackend backend;

  @BeforeEach
  void setUp() {
    backend = new FileProgressBackend(progressDir, objectMapper, blobSink);
  }

  @Test
  void writesOneJsonFilePerKey() throws IOException {
    backend.write("job1", ProgressUpdate.initial());

    assertThat(progressDir.resolve("job1.json")).exists();
    ProgressRecord stored =
        objectMapper.readValue(progressDir.resolve("job1.json").toFile(), ProgressRecord.class);
    assertThat(stored).isEqualTo(ProgressRecord.initial());
  }

  @Test
  void partialUpdatesAreMergedIntoStoredRecord() {
    backend.write("job1", ProgressUpdate.initial());
    backend.write("job1", ProgressUpdate.percent(40));
    backend.write("job1", ProgressUpdate.completed("job1_validation_summary.csv", false));

    assertThat(backend.read("job1"))
        .contains(new ProgressRecord(100, true, "job1_validation_summary.csv", null, false));
  }

  @Test
  void recordWrittenByOneInstanceIsVisibleToAnother() {
    backend.write("job1", ProgressUpdate.percent(25));

    FileProgressBackend otherProcess = new FileProgressBackend(progressDir, objectMapper, blobSink);

    assertThat(otherProcess.read("job1").orElseThrow().percent()).isEqualTo(25);
  }

  @Test
  void updateIsMergedIntoRecordWrittenByAnotherInstance() {
    backend.write("job1", ProgressUpdate.initial());
    FileProgressBackend worker = new FileProgressBackend(progressDir, objectMapper, blobSink);
    worker.write("job1", new ProgressUpdate(70, null, null, null, true));

    backend.write(
        "job1", new ProgressUpdate(null, null, "job1_validation_summary.csv", null, null));

    assertThat(backend.read("job1"))
        .contains(new ProgressRecord(70, false, "job1_validation_summary.csv", null, true));
  }

  @Test
  void healedRecordKeepsPercentWrittenByAnotherInstance() {
    String locator = "job1_validation_summary.csv";
    ProgressLedger ledger = new ProgressLedger(backend, singleAttempt());
    ledger.start("job1");
    FileProgressBackend worker = new FileProgressBackend(progressDir, objectMapper, blobSink);
    worker.write("job1", new ProgressUpdate(100, null, locator, null, null));
    when(blobSink.exists(locator)).thenReturn(true);

    ProgressRecord first = ledger.getProgress("job1");
    ProgressRecord second = ledger.getProgress("job1");

    ProgressRecord healed = new ProgressRecord(100, true, locator, null, false);
    assertThat(first).isEqualTo(healed);
    assertThat(second).isEqualTo(healed);
    FileProgressBackend laterReader = new FileProgressBackend(progressDir, objectMapper, blobSink);
    assertThat(laterReader.read("job1")).contains(healed);
  }

  @Test
  void unreadableFileIsReplacedByUpdateOfLastKnownRecord() throws IOException {
    backend.write("job1", ProgressUpdate.percent(60));
    Files.writeString(progressDir.resolve("job1.json"), "{not json");

    backend.write("job1", ProgressUpdate.percent(70));

    FileProgressBackend otherProcess = new FileProgressBackend(progressDir, objectMapper, blobSink);
    assertThat(otherProcess.read("job1").orElseThrow().percent()).isEqualTo(70);
  }

  @Test
  void unreadableFileWithoutLastKnownRecordFailsTheWrite() throws IOException {
    Files.writeString(progressDir.resolve("job1.json"), "{not json");

    assertThatThrownBy(() -> backend.write("job1", ProgressUpdate.percent(10)))
        .isInstanceOf(PersistenceFailureException.class);
  }

  @Test
  void terminalRecordIsNotRetainedInMemory() throws IOException {
    backend.write("job1", ProgressUpdate.percent(60));
    backend.write("job1", ProgressUpdate.completed("job1_validation_summary.csv", false));
    Files.writeString(progressDir.resolve("job1.json"), "{not json");

    assertThat(backend.read("job1")).isEmpty();
  }

  @Test
  void structuredErrorSurvivesRoundTrip() {
    ProgressError error = new ProgressError("PERSISTENCE_FAILURE", "disk full");
    backend.write("job1", ProgressUpdate.failed(error, "job1_error.csv"));

    FileProgressBackend otherProcess = new FileProgressBackend(progressDir, objectMapper, blobSink);

    assertThat(otherProcess.read("job1").orElseThrow().error()).isEqualTo(error);
  }

  @Test
  void unknownKeyIsEmpty() {
    assertThat(backend.read("missing")).isEmpty();
  }

  @Test
  void unreadableFileFallsBackToLastKnownRecord() throws IOException {
    backend.write("job1", ProgressUpdate.percent(60));
    Files.writeString(progressDir.resolve("job1.json"), "{not json");

    assertThat(backend.read("job1").orElseThrow().percent()).isEqualTo(60);
  }

  @Test
  void noTemporaryFilesAreLeftBehind() throws IOException {
    backend.write("job1", ProgressUpdate.initial());
    backend.write("job1", ProgressUpdate.percent(10));

    try (Stream<Path> files = Files.list(progressDir)) {
      assertThat(files)
          .extracting(path -> path.getFileName().toString())
          .containsExactly("job1.json");
    }
  }

  @Test
  void resultIsReachableOnlyWhenArtifactExists() {
    when(blobSink.exists("r.csv")).thenReturn(true);

    assertThat(backend.isResultReachable(new ProgressRecord(100, false, "r.csv", null, false)))
        .isTrue();
    assertThat(backend.isResultReachable(new ProgressRecord(100, false, null, null, false)))
        .isFalse();
  }

  @Test
  void pathTraversalKeysAreRejected() {
    assertThatThrownBy(() -> backend.read("../etc/passwd"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static RetryTemplate singleAttempt() {
    return RetryTemplate.builder().maxAttempts(1).noBackoff().build();
  }
}
