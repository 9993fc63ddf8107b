package uk.curriculum.triplestore.source;

import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

@Component
@Slf4j
public class SourceDiscovery {
  private static final String TURTLE_EXTENSION = ".ttl";

  private final SourceProperties properties;

  public SourceDiscovery(SourceProperties properties) {
    this.properties = properties;
  }

  public List<Path> discover() {
    return discover(properties.getRoots().stream().map(Path::of).toList());
  }

  public List<Path> discover(List<Path> roots) {
    List<Path> files = new ArrayList<>();
    for (Path root : roots) {
      if (!Files.isDirectory(root)) {
        log.warn("source directory not found: {}", root);
        continue;
      }
      files.addAll(discoverIn(root));
    }
    log.info("discovered {} turtle files in {}", files.size(), roots);
    return files;
  }

  @SneakyThrows
  private List<Path> discoverIn(Path root) {
    try (Stream<Path> paths = Files.walk(root)) {
      return paths.filter(Files::isRegularFile)
                  .filter(p -> p.getFileName().toString().endsWith(TURTLE_EXTENSION))
                  .sorted()
                  .filter(p -> {
                    if (isExcluded(root, p)) {
                      log.info("skipping excluded file: {}", p);
                      return false;
                    }
                    return true;
                  })
                  .toList();
    }
  }

  private boolean isExcluded(Path root, Path file) {
    Set<String> excluded = properties.getExcludedDirectories();
    Path parent = root.relativize(file).getParent();
    return parent != null && StreamSupport.stream(parent.spliterator(), false)
                                          .map(Path::toString)
                                          .anyMatch(excluded::contains);
  }
}
