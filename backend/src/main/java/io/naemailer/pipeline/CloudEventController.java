package io.naemailer.pipeline;

import io.naemailer.event.CloudEventHttpReader;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP entry point. Accepts a CloudEvent in binary or structured mode; failures surface as {@code
 * ProblemDetail} responses through the global exception handler.
 */
@RestController
public class CloudEventController {

  private final CloudEventHttpReader reader;
  private final EventPipeline pipeline;

  public CloudEventController(CloudEventHttpReader reader, EventPipeline pipeline) {
    this.reader = reader;
    this.pipeline = pipeline;
  }

  @PostMapping({"/", "/events"})
  public ResponseEntity<Void> receive(
      @RequestHeader HttpHeaders headers, @RequestBody(required = false) byte[] body) {
    EventOutcome outcome = pipeline.process(reader.read(headers, body));
    return switch (outcome) {
      case FILTERED -> ResponseEntity.noContent().build();
      case SKIPPED_NO_RECIPIENTS, SKIPPED_DRY_RUN, SENT -> ResponseEntity.accepted().build();
    };
  }
}
