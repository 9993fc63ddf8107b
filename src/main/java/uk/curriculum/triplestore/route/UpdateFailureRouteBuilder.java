package uk.curriculum.triplestore.route;

import org.apache.camel.Exchange;
import org.apache.camel.ExchangePattern;
import org.apache.camel.builder.RouteBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;

import static java.time.LocalDateTime.now;
import static uk.curriculum.triplestore.route.Constants.UPDATE_FAILURE_ENDPOINT;

@Component
@ConditionalOnWebApplication
public class UpdateFailureRouteBuilder extends RouteBuilder {
  private static final DateTimeFormatter FILE_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS");

  @Override
  public void configure() throws Exception {
    from(UPDATE_FAILURE_ENDPOINT)
            .routeId("UpdateFailure::Entrypoint")
            .setHeader(Exchange.FILE_NAME, () -> now().format(FILE_NAME_FORMAT).concat(".sparql"))
            .log("writing failed update to ${headers.%s}".formatted(Exchange.FILE_NAME))
            .to(ExchangePattern.InOnly, "file:{{sparql.update.failure.directory}}");
  }
}
