package uk.curriculum.triplestore.command;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.stereotype.Component;
import uk.curriculum.triplestore.sparql.RemoteEndpoint;
import uk.curriculum.triplestore.sparql.SparqlClient;

/**
 * {@code smoke --endpoint=https://host/uk-curriculum/query [--user=viewer --password=...]}
 */
@Component
@Slf4j
public class SmokeTestCommand implements Command {
  private final SparqlClient sparqlClient;

  public SmokeTestCommand(SparqlClient sparqlClient) {
    this.sparqlClient = sparqlClient;
  }

  @Override
  public String name() {
    return "smoke";
  }

  @Override
  public int run(ApplicationArguments args) {
    String endpoint = Command.option(args, "endpoint");
    if (endpoint == null) {
      log.error("missing --endpoint");
      return 1;
    }
    RemoteEndpoint remote = new RemoteEndpoint(endpoint, Command.option(args, "user"), Command.option(args, "password"));
    long count = sparqlClient.countTriples(remote);
    if (count > 0) {
      log.info("✓ {} answers with {} triples", endpoint, count);
      return 0;
    }
    log.error("✗ {} returned no triples", endpoint);
    return 1;
  }
}
