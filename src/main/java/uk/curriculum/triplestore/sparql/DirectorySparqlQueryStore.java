package uk.curriculum.triplestore.sparql;

import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;

@Slf4j
public class DirectorySparqlQueryStore implements SparqlQueryStore {
  private static final String SPARQL_EXTENSION = ".sparql";

  private final Map<String, String> queries;

  public DirectorySparqlQueryStore(Path directory) {
    this.queries = load(directory);
  }

  @SneakyThrows
  private static Map<String, String> load(Path directory) {
    if (!Files.isDirectory(directory)) {
      throw new IllegalStateException("query directory not found: " + directory);
    }
    Map<String, String> queries = new TreeMap<>();
    try (Stream<Path> files = Files.list(directory)) {
      for (Path file : files.filter(f -> f.getFileName().toString().endsWith(SPARQL_EXTENSION)).toList()) {
        queries.put(file.getFileName().toString(), Files.readString(file, UTF_8));
      }
    }
    log.debug("loaded queries {} from {}", queries.keySet(), directory);
    return Map.copyOf(queries);
  }

  @Override
  public Map<String, String> asMap() {
    return queries;
  }
}
