package uk.curriculum.triplestore.route;

import org.apache.camel.Body;
import org.apache.camel.ExchangePattern;
import org.apache.camel.LoggingLevel;
import org.apache.camel.builder.RouteBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Component;
import uk.curriculum.triplestore.tdb.TDBService;

import static uk.curriculum.triplestore.route.Constants.UPDATE_FAILURE_ENDPOINT;
import static uk.curriculum.triplestore.route.Constants.UPDATE_QUEUE;
import static uk.curriculum.triplestore.route.Constants.UPDATE_ROUTE_ID;

@Component
@ConditionalOnWebApplication
public class UpdateRouteBuilder extends RouteBuilder {
  private static final String ORIGINAL_UPDATE = "originalUpdate";

  private final TDBService tdbService;

  @Value("${sparql.update.maxRedeliveries}")
  private int maxRedeliveries;
  @Value("${sparql.update.redeliveryDelay}")
  private long redeliveryDelay;

  public UpdateRouteBuilder(TDBService tdbService) {
    this.tdbService = tdbService;
  }

  @Override
  public void configure() throws Exception {
    onException(Exception.class)
            .handled(true)
            .maximumRedeliveries(maxRedeliveries)
            .redeliveryDelay(redeliveryDelay)
            .log(LoggingLevel.ERROR, "update failed: ${exception.message}")
            .setBody(exchangeProperty(ORIGINAL_UPDATE))
            .choice().when(body().isNotNull())
              .to(ExchangePattern.InOnly, UPDATE_FAILURE_ENDPOINT)
            .otherwise()
              .log("original update was cleared")
            .endChoice();

    from(UPDATE_QUEUE)
            .routeId(UPDATE_ROUTE_ID)
            .setProperty(ORIGINAL_UPDATE, body())
            .log(LoggingLevel.INFO, "receiving update query:\n${body}")
            .bean(() -> this, "process")
            .log(LoggingLevel.DEBUG, "update done")
            .removeProperty(ORIGINAL_UPDATE);
  }

  public void process(@Body String update) {
    tdbService.executeUpdateQuery(update);
  }
}
