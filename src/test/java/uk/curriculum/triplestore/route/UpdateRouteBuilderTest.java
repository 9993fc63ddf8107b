package uk.curriculum.triplestore.route;

import org.apache.camel.ExchangePattern;
import org.apache.camel.ProducerTemplate;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import uk.curriculum.triplestore.tdb.TDBService;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.UUID;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.awaitility.Awaitility.await;
import static uk.curriculum.triplestore.route.Constants.UPDATE_QUEUE;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class UpdateRouteBuilderTest {
  private static final Path FAILURE_DIR = Path.of("target/update-failures-test");

  @Autowired
  private ProducerTemplate producerTemplate;
  @Autowired
  private TDBService tdbService;

  @Test
  void queuedUpdateIsApplied() {
    String graph = "urn:test:" + UUID.randomUUID();

    producerTemplate.sendBody(UPDATE_QUEUE, ExchangePattern.InOnly,
                              "INSERT DATA { GRAPH <%s> { <urn:s> <urn:p> <urn:o> } }".formatted(graph));

    await().atMost(Duration.ofSeconds(10)).until(() -> tdbService.size(graph) == 1);
  }

  @Test
  void failingUpdateIsKeptForReplay() {
    String marker = "urn:test:" + UUID.randomUUID();

    producerTemplate.sendBody(UPDATE_QUEUE, ExchangePattern.InOnly, "INSERT DATA { GRAPH <%s> { ".formatted(marker));

    await().atMost(Duration.ofSeconds(10)).until(() -> failureFileContaining(marker));
  }

  private static boolean failureFileContaining(String marker) throws IOException {
    if (!Files.isDirectory(FAILURE_DIR)) {
      return false;
    }
    try (Stream<Path> files = Files.list(FAILURE_DIR)) {
      return files.filter(f -> f.getFileName().toString().endsWith(".sparql"))
                  .anyMatch(f -> {
                    try {
                      return Files.readString(f, UTF_8).contains(marker);
                    }
                    catch (IOException e) {
                      return false;
                    }
                  });
    }
  }
}
