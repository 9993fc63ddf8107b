package uk.curriculum.triplestore.sparql;

import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

@RestController
@ConditionalOnWebApplication
public class PingEndpoint {

  @GetMapping(value = "/$/ping", produces = MediaType.TEXT_PLAIN_VALUE)
  public String ping() {
    return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(OffsetDateTime.now());
  }
}
