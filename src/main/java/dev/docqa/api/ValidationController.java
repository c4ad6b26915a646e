package dev.docqa.api;

import dev.docqa.job.ValidationJobService;
import dev.docqa.storage.BlobSink;
import java.util.Map;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP adapter for submitting documents, polling progress and downloading artifacts.
 *
 * <p>Documents are posted as plain text with pages separated by form feeds.
 */
@RestController
public class ValidationController {

  private static final MediaType TEXT_CSV = MediaType.parseMediaType("text/csv");

  private final ValidationJobService jobService;
  private final BlobSink blobSink;

  public ValidationController(ValidationJobService jobService, BlobSink blobSink) {
    this.jobService = jobService;
    this.blobSink = blobSink;
  }

  @PostMapping(path = "/api/validate", consumes = MediaType.TEXT_PLAIN_VALUE)
  public Map<String, String> validate(
      @RequestBody String text, @RequestParam(name = "name", required = false) String name) {
    return Map.of("progressKey", jobService.submit(name, text));
  }

  @GetMapping("/api/progress/{key}")
  public ResponseEntity<ProgressResponse> progress(@PathVariable String key) {
    return jobService
        .find(key)
        .map(record -> ResponseEntity.ok(ProgressResponse.from(record)))
        .orElseGet(
            () -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(ProgressResponse.unknownKey()));
  }

  @GetMapping("/download/{file}")
  public ResponseEntity<Resource> download(@PathVariable String file) {
    return blobSink
        .load(file)
        .map(
            resource ->
                ResponseEntity.ok()
                    .contentType(TEXT_CSV)
                    .header(
                        HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(file).build().toString())
                    .body(resource))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @GetMapping("/api/diagnostics")
  public ValidationJobService.Diagnostics diagnostics() {
    return jobService.diagnostics();
  }
}
