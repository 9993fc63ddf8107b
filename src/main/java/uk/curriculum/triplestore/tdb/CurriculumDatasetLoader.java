package uk.curriculum.triplestore.tdb;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Component;
import uk.curriculum.triplestore.source.SourceDiscovery;

import javax.annotation.PostConstruct;
import java.nio.file.Path;
import java.util.List;

@Component
@ConditionalOnWebApplication
@Slf4j
public class CurriculumDatasetLoader {
  private final TDBService tdbService;
  private final SourceDiscovery discovery;

  @Value("${triplestore.load.onStartup}")
  private boolean loadOnStartup;
  @Value("${triplestore.load.reload}")
  private boolean reload;
  @Value("${triplestore.load.graph}")
  private String graph;

  public CurriculumDatasetLoader(TDBService tdbService, SourceDiscovery discovery) {
    this.tdbService = tdbService;
    this.discovery = discovery;
  }

  @PostConstruct
  public void loadOnStartup() {
    if (!loadOnStartup) {
      log.info("loading on startup disabled");
      return;
    }
    if (reload) {
      log.info("clearing graph <{}> before reload", graph);
      tdbService.clearGraph(graph);
    }
    else if (!tdbService.isEmpty()) {
      log.info("store already contains data, skipping load");
      return;
    }
    load();
  }

  public long load() {
    List<Path> files = discovery.discover();
    long triples = tdbService.loadFiles(graph, files);
    log.info("loaded {} files into <{}>, {} triples", files.size(), graph, triples);
    return triples;
  }
}
