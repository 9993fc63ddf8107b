package uk.curriculum.triplestore.sparql;

import org.apache.commons.io.IOUtils;
import org.apache.jena.query.QueryFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.RequestBuilder;
import uk.curriculum.triplestore.tdb.TDBService;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

import static org.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class SparqlEndpointTest {
  private static final String SUBJECTS = """
          PREFIX curric: <https://w3id.org/uk/curriculum/core/>
          PREFIX rdfs: <http://www.w3.org/2000/01/rdf-schema#>
          SELECT ?label WHERE { ?s a curric:Subject ; rdfs:label ?label } ORDER BY ?label
          """;

  @Autowired
  private MockMvc mockMvc;
  @Autowired
  private TDBService tdbService;
  @Value("${triplestore.load.graph}")
  private String loadGraph;

  @Test
  void selectOverGetReturnsJsonResults() throws Exception {
    mockMvc.perform(dispatched(get("/uk-curriculum/sparql").param("query", SUBJECTS)))
           .andExpect(status().isOk())
           .andExpect(header().string("Content-Type", containsString("application/sparql-results+json")))
           .andExpect(content().string(containsString("\"History\"")))
           .andExpect(content().string(containsString("\"Science\"")));
  }

  @Test
  void queryAliasAcceptsFormPost() throws Exception {
    mockMvc.perform(dispatched(post("/uk-curriculum/query")
                                       .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                                       .param("query", "ASK { ?s a <https://w3id.org/uk/curriculum/core/KeyStage> }")))
           .andExpect(status().isOk())
           .andExpect(content().string(containsString("true")));
  }

  @Test
  void directPostHonoursAcceptHeader() throws Exception {
    mockMvc.perform(dispatched(post("/uk-curriculum/query")
                                       .contentType("application/sparql-query")
                                       .accept("text/csv")
                                       .content(SUBJECTS)))
           .andExpect(status().isOk())
           .andExpect(header().string("Content-Type", containsString("text/csv")))
           .andExpect(content().string(containsString("label")));
  }

  @Test
  void constructDefaultsToTurtle() throws Exception {
    String construct = "CONSTRUCT { ?s ?p ?o } WHERE { ?s ?p ?o FILTER(?s = <https://w3id.org/uk/curriculum/england/key-stage-3>) }";

    mockMvc.perform(dispatched(get("/uk-curriculum/sparql").param("query", construct)))
           .andExpect(status().isOk())
           .andExpect(header().string("Content-Type", containsString("text/turtle")))
           .andExpect(content().string(containsString("Key Stage 3")));
  }

  @Test
  void unknownDataset() throws Exception {
    mockMvc.perform(dispatched(get("/other/sparql").param("query", SUBJECTS)))
           .andExpect(status().isNotFound())
           .andExpect(content().string("unknown dataset 'other'"));
  }

  @Test
  void blankQueryHasNoContent() throws Exception {
    mockMvc.perform(get("/uk-curriculum/sparql").param("query", " "))
           .andExpect(status().isNoContent());
  }

  @Test
  void malformedQueryIsABadRequest() throws Exception {
    mockMvc.perform(dispatched(get("/uk-curriculum/sparql").param("query", "SELECT WHERE {")))
           .andExpect(status().isBadRequest())
           .andExpect(content().string(containsString("{error: '")));
  }

  @Test
  void updatesAreQueuedThenApplied() throws Exception {
    String graph = "urn:test:queued-update";
    String update = "INSERT DATA { GRAPH <%s> { <urn:s> <urn:p> \"o\" } }".formatted(graph);

    mockMvc.perform(dispatched(post("/uk-curriculum/update")
                                       .contentType("application/sparql-update")
                                       .content(update)))
           .andExpect(status().isOk())
           .andExpect(content().string("processing update"));

    await().atMost(Duration.ofSeconds(10)).until(() -> tdbService.size(graph) == 1);
  }

  @Test
  void updateWithoutGraphIsVisibleToQueries() throws Exception {
    String ask = "ASK { <urn:s:no-graph> ?p ?o }";

    mockMvc.perform(dispatched(post("/uk-curriculum/update")
                                       .param("update", "INSERT DATA { <urn:s:no-graph> <urn:p> \"o\" }")))
           .andExpect(status().isOk());

    await().atMost(Duration.ofSeconds(10)).until(() -> ask(ask));
    assertThat(tdbService.size(loadGraph)).isPositive();
    mockMvc.perform(dispatched(get("/uk-curriculum/sparql").param("query", ask)))
           .andExpect(status().isOk())
           .andExpect(content().string(containsString("true")));

    mockMvc.perform(dispatched(post("/uk-curriculum/update")
                                       .param("update", "DELETE DATA { <urn:s:no-graph> <urn:p> \"o\" }")))
           .andExpect(status().isOk());

    await().atMost(Duration.ofSeconds(10)).until(() -> !ask(ask));
  }

  @Test
  void malformedUpdateIsRejectedBeforeQueueing() throws Exception {
    mockMvc.perform(dispatched(post("/uk-curriculum/update").param("update", "INSERT DATA {")))
           .andExpect(status().isBadRequest())
           .andExpect(content().string(not(containsString("processing"))));
  }

  @Test
  void ping() throws Exception {
    mockMvc.perform(get("/$/ping"))
           .andExpect(status().isOk())
           .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_PLAIN));
  }

  private boolean ask(String query) throws IOException {
    SparqlResult result = tdbService.executeQuery(QueryFactory.create(query), null);
    try (InputStream body = result.getBody()) {
      return IOUtils.toString(body, UTF_8).contains("true");
    }
  }

  private RequestBuilder dispatched(RequestBuilder builder) throws Exception {
    MvcResult result = mockMvc.perform(builder)
                              .andExpect(request().asyncStarted())
                              .andReturn();
    return asyncDispatch(result);
  }
}
