package uk.curriculum.triplestore.tdb;

import org.apache.commons.io.IOUtils;
import org.apache.jena.query.Dataset;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.system.Txn;
import org.apache.jena.tdb2.TDB2Factory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import uk.curriculum.triplestore.sparql.SparqlResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

class TDBServiceTest {
  private static final String GRAPH = "urn:test:graph";

  private Dataset dataset;
  private TDBService tdbService;

  @BeforeEach
  void setUp() {
    dataset = TDB2Factory.createDataset();
    tdbService = new TDBService(dataset);
    ReflectionTestUtils.setField(tdbService, "batchSize", 2);
    ReflectionTestUtils.setField(tdbService, "maxRetry", 2);
    ReflectionTestUtils.setField(tdbService, "timeout", 10L);
  }

  @AfterEach
  void tearDown() {
    dataset.close();
  }

  @Test
  void batchLoadSplitsTheModel() {
    Model model = ModelFactory.createDefaultModel();
    for (int i = 0; i < 5; i++) {
      model.createResource("urn:s:" + i).addProperty(model.createProperty("urn:p"), "value " + i);
    }

    tdbService.batchLoadData(GRAPH, model);

    assertThat(tdbService.size(GRAPH)).isEqualTo(5);
    assertThat(tdbService.isEmpty()).isFalse();
  }

  @Test
  void selectDefaultsToJsonResults() throws IOException {
    tdbService.executeUpdateQuery("INSERT DATA { GRAPH <%s> { <urn:s> <urn:p> \"hello\" } }".formatted(GRAPH));

    SparqlResult result = tdbService.executeQuery(QueryFactory.create("SELECT ?o WHERE { GRAPH ?g { ?s ?p ?o } }"), null);

    assertThat(result.getContentType()).isEqualTo("application/sparql-results+json");
    assertThat(body(result)).contains("\"bindings\"").contains("hello");
  }

  @Test
  void acceptHeaderPicksTheFirstWritableFormat() throws IOException {
    tdbService.executeUpdateQuery("INSERT DATA { GRAPH <%s> { <urn:s> <urn:p> \"o\" } }".formatted(GRAPH));

    SparqlResult select = tdbService.executeQuery(QueryFactory.create("SELECT * WHERE { GRAPH ?g { ?s ?p ?o } }"),
                                                  "text/html, application/sparql-results+xml;q=0.9, */*;q=0.1");
    SparqlResult construct = tdbService.executeQuery(QueryFactory.create("CONSTRUCT { ?s ?p ?o } WHERE { GRAPH ?g { ?s ?p ?o } }"),
                                                     "application/n-triples");

    assertThat(select.getContentType()).isEqualTo("application/sparql-results+xml");
    assertThat(body(select)).contains("<sparql");
    assertThat(construct.getContentType()).isEqualTo("application/n-triples");
    assertThat(body(construct).trim()).isEqualTo("<urn:s> <urn:p> \"o\" .");
  }

  @Test
  void acceptHeaderWeightsWinOverOrder() throws IOException {
    tdbService.executeUpdateQuery("INSERT DATA { GRAPH <%s> { <urn:s> <urn:p> \"o\" } }".formatted(GRAPH));

    SparqlResult select = tdbService.executeQuery(QueryFactory.create("SELECT * WHERE { GRAPH ?g { ?s ?p ?o } }"),
                                                  "text/csv;q=0.1, application/sparql-results+xml");

    assertThat(select.getContentType()).isEqualTo("application/sparql-results+xml");
    assertThat(TDBService.quality("text/csv; q=0.5")).isEqualTo(0.5);
    assertThat(TDBService.quality("text/csv")).isEqualTo(1.0);
  }

  @Test
  void defaultGraphUpdatesLandInTheUpdateGraphWhenUnionIsOn() {
    ReflectionTestUtils.setField(tdbService, "unionDefaultGraph", true);
    ReflectionTestUtils.setField(tdbService, "updateDefaultGraph", GRAPH);

    tdbService.executeUpdateQuery("INSERT DATA { <urn:s> <urn:p> \"o\" . GRAPH <urn:other> { <urn:s> <urn:p> \"x\" } }");

    assertThat(tdbService.size(GRAPH)).isEqualTo(1);
    assertThat(tdbService.size("urn:other")).isEqualTo(1);
    assertThat(Txn.calculateRead(dataset, () -> dataset.getDefaultModel().size())).isZero();

    tdbService.executeUpdateQuery("DELETE DATA { <urn:s> <urn:p> \"o\" }");

    assertThat(tdbService.size(GRAPH)).isZero();
  }

  @Test
  void loadsFilesIntoANamedGraphAndClearsIt() {
    long size = tdbService.loadFiles(GRAPH, List.of(Path.of("src/test/resources/fixtures/valid/key-stage.ttl")));

    assertThat(size).isPositive();
    assertThat(tdbService.size(GRAPH)).isEqualTo(size);

    tdbService.clearGraph(GRAPH);

    assertThat(tdbService.size(GRAPH)).isZero();
    assertThat(tdbService.isEmpty()).isTrue();
  }

  private static String body(SparqlResult result) throws IOException {
    try (var in = result.getBody()) {
      return IOUtils.toString(in, UTF_8);
    }
  }
}
