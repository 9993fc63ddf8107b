package uk.curriculum.triplestore.sparql;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.ExchangePattern;
import org.apache.camel.ProducerTemplate;
import org.apache.commons.io.IOUtils;
import org.apache.jena.query.Query;
import org.apache.jena.update.UpdateRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;
import uk.curriculum.triplestore.tdb.TDBService;

import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Optional.ofNullable;
import static org.springframework.http.HttpHeaders.ACCEPT;
import static org.springframework.http.HttpHeaders.CONTENT_TYPE;
import static uk.curriculum.triplestore.route.Constants.UPDATE_QUEUE;

@RestController
@ConditionalOnWebApplication
@ConfigurationProperties("application.security.sparql.update")
@Slf4j
public class SparqlEndpoint {
  static final String SPARQL_QUERY = "application/sparql-query";
  static final String SPARQL_UPDATE = "application/sparql-update";

  private final ProducerTemplate producerTemplate;
  private final TDBService tdbService;

  @Value("${application.security.enabled}")
  private boolean securityEnabled;
  @Value("${triplestore.dataset.name}")
  private String datasetName;

  @Setter
  private Set<String> allowedRoles;

  public SparqlEndpoint(ProducerTemplate producerTemplate, TDBService tdbService) {
    this.producerTemplate = producerTemplate;
    this.tdbService = tdbService;
  }

  @RequestMapping(value = {"/{dataset}/sparql", "/{dataset}/query"},
                  method = {RequestMethod.GET, RequestMethod.POST})
  public ResponseEntity<StreamingResponseBody> executeQuery(@PathVariable("dataset") String dataset,
                                                            @RequestParam(value = "query", required = false) String query,
                                                            @RequestHeader(value = ACCEPT, required = false) String accept) {
    return forDataset(dataset, () -> tryExecuteQuery(query, accept));
  }

  @PostMapping(value = {"/{dataset}/sparql", "/{dataset}/query"}, consumes = SPARQL_QUERY)
  public ResponseEntity<StreamingResponseBody> executeQueryBody(@PathVariable("dataset") String dataset,
                                                                @RequestBody(required = false) String query,
                                                                @RequestHeader(value = ACCEPT, required = false) String accept) {
    return forDataset(dataset, () -> tryExecuteQuery(query, accept));
  }

  @PostMapping("/{dataset}/update")
  public ResponseEntity<StreamingResponseBody> executeUpdate(@PathVariable("dataset") String dataset,
                                                             @RequestParam(value = "update", required = false) String update) {
    return forDataset(dataset, () -> tryExecuteUpdate(update));
  }

  @PostMapping(value = "/{dataset}/update", consumes = SPARQL_UPDATE)
  public ResponseEntity<StreamingResponseBody> executeUpdateBody(@PathVariable("dataset") String dataset,
                                                                 @RequestBody(required = false) String update) {
    return forDataset(dataset, () -> tryExecuteUpdate(update));
  }

  ResponseEntity<StreamingResponseBody> forDataset(String dataset, Supplier<ResponseEntity<StreamingResponseBody>> operation) {
    if (!datasetName.equals(dataset)) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND)
                           .body(out -> IOUtils.write("unknown dataset '%s'".formatted(dataset), out, UTF_8));
    }
    return operation.get();
  }

  ResponseEntity<StreamingResponseBody> tryExecuteQuery(String query, String accept) {
    try {
      return QueryParserUtil.parseQuery(query)
                            .map(q -> executeRead(q, accept))
                            .orElseGet(() -> ResponseEntity.noContent().build());
    }
    catch (IllegalArgumentException exc) {
      return badRequest(exc);
    }
  }

  ResponseEntity<StreamingResponseBody> tryExecuteUpdate(String update) {
    try {
      return QueryParserUtil.parseUpdate(update)
                            .map(this::queueUpdate)
                            .orElseGet(() -> ResponseEntity.noContent().build());
    }
    catch (IllegalArgumentException exc) {
      return badRequest(exc);
    }
  }

  ResponseEntity<StreamingResponseBody> executeRead(Query query, String accept) {
    log.debug("receiving query:\n{}", query);
    var response = tdbService.executeQuery(query, accept);
    return ResponseEntity.status(200).header(CONTENT_TYPE, response.getContentType())
                         .body((out) -> {
                           try (var is = response.getBody()) {
                             IOUtils.copyLarge(is, out);
                           }
                         });
  }

  ResponseEntity<StreamingResponseBody> queueUpdate(UpdateRequest update) {
    if (!canUpdate()) {
      return ResponseEntity.status(HttpStatus.FORBIDDEN)
                           .body(out -> IOUtils.write("You cannot perform this action", out, UTF_8));
    }
    this.producerTemplate.sendBody(UPDATE_QUEUE, ExchangePattern.InOnly, update.toString());
    return ResponseEntity.status(200)
                         .body((out) -> IOUtils.write("processing update", out, UTF_8));
  }

  private ResponseEntity<StreamingResponseBody> badRequest(Exception exc) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                         .body((out) -> IOUtils.write("{error: '%s'}".formatted(exc.getMessage()), out, UTF_8));
  }

  boolean canUpdate() {
    if (!securityEnabled) {
      return true;
    }
    List<String> roles = ofNullable(allowedRoles).orElseGet(Set::of)
                                                 .stream()
                                                 .map("ROLE_"::concat)
                                                 .toList();
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    return ofNullable(authentication)
            .stream()
            .map(Authentication::getAuthorities)
            .flatMap(a -> a.stream().map(GrantedAuthority::getAuthority))
            .anyMatch(roles::contains);
  }
}
