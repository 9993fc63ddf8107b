package uk.curriculum.triplestore.route;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.apache.camel.Body;
import org.apache.camel.Exchange;
import org.apache.camel.Header;
import org.apache.camel.builder.RouteBuilder;
import org.apache.commons.io.FilenameUtils;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.riot.Lang;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Component;
import uk.curriculum.triplestore.sparql.ModelUtils;
import uk.curriculum.triplestore.tdb.TDBService;

import java.time.Duration;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Optional.ofNullable;
import static org.apache.commons.io.FilenameUtils.getBaseName;
import static uk.curriculum.triplestore.route.Constants.IMPORT_ROUTE_ID;

/**
 * Watches the import directory. A {@code name.graph} file holds the graph IRI for the RDF file
 * {@code name.*}, a {@code .sparql} file is run as an update, any other RDF file is batch loaded.
 * Files are picked up in name order, so a graph file is read before its data file.
 */
@Component
@ConditionalOnWebApplication
@Slf4j
public class ImportRouteBuilder extends RouteBuilder {
  private final TDBService tdbService;
  private final Cache<String, String> graphCache = Caffeine.newBuilder()
                                                           .expireAfterAccess(Duration.ofMinutes(5))
                                                           .maximumSize(1000)
                                                           .build();

  @Value("${triplestore.migration.defaultGraph}")
  private String defaultGraph;

  public ImportRouteBuilder(TDBService tdbService) {
    this.tdbService = tdbService;
  }

  @Override
  public void configure() throws Exception {
    onException(Exception.class)
            .handled(true)
            .log("import of '${headers.%s}' failed: ${exception.message}".formatted(Exchange.FILE_NAME));

    from("file:{{triplestore.migration.dir}}?sortBy=file:name;file:modified")
            .routeId(IMPORT_ROUTE_ID)
            .log("receiving file '${headers.%s}'".formatted(Exchange.FILE_NAME))
            .convertBodyTo(byte[].class)
            .choice()
              .when(header(Exchange.FILE_NAME).endsWith(".graph"))
                .bean(() -> this, "addGraphToCache")
              .otherwise()
                .bean(() -> this, "performImport")
            .endChoice();
  }

  public void addGraphToCache(@Body byte[] file,
                              @Header(Exchange.FILE_NAME) String fileName) {
    String graph = new String(file, UTF_8).trim();
    log.info("data file(s) '{}' go to graph <{}>", getBaseName(fileName), graph);
    graphCache.put(getBaseName(fileName), graph);
  }

  public void performImport(@Body byte[] file,
                            @Header(Exchange.FILE_NAME) String fileName) {
    if ("sparql".equalsIgnoreCase(FilenameUtils.getExtension(fileName))) {
      tdbService.executeUpdateQuery(new String(file, UTF_8));
      log.info("'{}' has been executed against the triplestore", fileName);
      return;
    }
    Lang lang = ModelUtils.filenameToLang(fileName, null);
    if (lang == null) {
      throw new IllegalArgumentException("cannot guess RDF syntax of " + fileName);
    }
    Model model = ModelUtils.toModel(file, lang);
    String graph = ofNullable(graphCache.getIfPresent(getBaseName(fileName))).orElse(defaultGraph);
    tdbService.batchLoadData(graph, model);
    log.info("'{}' has been imported into <{}>", fileName, graph);
  }
}
