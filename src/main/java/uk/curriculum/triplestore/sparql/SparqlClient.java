package uk.curriculum.triplestore.sparql;

import lombok.extern.slf4j.Slf4j;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.sparql.exec.http.QueryExecutionHTTP;
import org.apache.jena.sparql.exec.http.QueryExecutionHTTPBuilder;
import org.apache.jena.sparql.exec.http.QuerySendMode;
import org.springframework.stereotype.Service;

import java.util.function.Function;

@Service
@Slf4j
public class SparqlClient {
  static final String COUNT_TRIPLES = "SELECT (COUNT(*) AS ?count) WHERE { ?s ?p ?o }";

  public <R> R executeSelectQuery(RemoteEndpoint endpoint, String query, Function<ResultSet, R> resultHandler) {
    log.debug("{} <- {}", endpoint.url(), query);
    try (QueryExecution queryExecution = build(endpoint, query)) {
      return resultHandler.apply(queryExecution.execSelect());
    }
  }

  public long countTriples(RemoteEndpoint endpoint) {
    return executeSelectQuery(endpoint, COUNT_TRIPLES, resultSet -> {
      if (!resultSet.hasNext()) {
        return 0L;
      }
      RDFNode count = resultSet.next().get("count");
      return count == null ? 0L : count.asLiteral().getLong();
    });
  }

  private QueryExecution build(RemoteEndpoint endpoint, String query) {
    QueryExecutionHTTPBuilder builder = QueryExecutionHTTP.service(endpoint.url())
                                                          .query(query)
                                                          .sendMode(QuerySendMode.asPost);
    endpoint.authorizationHeader().ifPresent(header -> builder.httpHeader("Authorization", header));
    return builder.build();
  }
}
