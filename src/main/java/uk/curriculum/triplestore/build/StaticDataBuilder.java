package uk.curriculum.triplestore.build;

import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.jena.query.Dataset;
import org.apache.jena.query.DatasetFactory;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryException;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryExecutionDatasetBuilder;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.query.ResultSetFormatter;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.resultset.ResultSetLang;
import org.springframework.stereotype.Service;
import uk.curriculum.triplestore.build.BuildProperties.Job;
import uk.curriculum.triplestore.source.MergedSources;
import uk.curriculum.triplestore.source.SourceDiscovery;
import uk.curriculum.triplestore.source.SourceMerger;
import uk.curriculum.triplestore.sparql.DirectorySparqlQueryStore;
import uk.curriculum.triplestore.sparql.SparqlQueryStore;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

@Service
@Slf4j
public class StaticDataBuilder {
  private static final String JSON_EXTENSION = ".json";

  private final SourceDiscovery discovery;
  private final SourceMerger merger;
  private final BuildProperties properties;

  public StaticDataBuilder(SourceDiscovery discovery, SourceMerger merger, BuildProperties properties) {
    this.discovery = discovery;
    this.merger = merger;
    this.properties = properties;
  }

  @SneakyThrows
  public BuildSummary build() {
    Path outputDir = Path.of(properties.getOutputDir());
    FileUtils.deleteDirectory(outputDir.toFile());
    Files.createDirectories(outputDir);

    log.info("collecting data files");
    MergedSources sources = merger.mergeStrict(discovery.discover());
    Dataset dataset = DatasetFactory.wrap(sources.model());
    SparqlQueryStore queryStore = new DirectorySparqlQueryStore(Path.of(properties.getQueryDir()));

    for (Job job : properties.getJobs()) {
      log.info("generating {}", job.getName());
      Path target = outputDir.resolve(job.getOutput());
      execute(job, queryStore, dataset, target);
      log.info("✓ {}", outputDir.relativize(target));
    }

    BuildSummary summary = summarize(outputDir);
    log.info("generated {} JSON files ({} bytes)", summary.files(), summary.totalBytes());
    summary.outputs().forEach(p -> log.info("  - {}", p));
    return summary;
  }

  @SneakyThrows
  void execute(Job job, SparqlQueryStore queryStore, Dataset dataset, Path target) {
    if (!queryStore.isPresent(job.getQuery())) {
      throw new IllegalStateException("job %s: query %s not found".formatted(job.getName(), job.getQuery()));
    }
    Query query;
    try {
      query = QueryFactory.create(queryStore.getQueryWithParameters(job.getQuery(), job.getParameters()));
    }
    catch (QueryException exc) {
      throw new IllegalStateException("job %s: %s".formatted(job.getName(), exc.getMessage()), exc);
    }

    Path parent = target.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (OutputStream out = Files.newOutputStream(target);
         QueryExecution queryExecution = QueryExecutionDatasetBuilder.create()
                                                                     .query(query)
                                                                     .dataset(dataset)
                                                                     .build()) {
      switch (query.queryType()) {
        case SELECT -> ResultSetFormatter.output(out, queryExecution.execSelect(), ResultSetLang.RS_JSON);
        case ASK -> ResultSetFormatter.output(out, queryExecution.execAsk(), ResultSetLang.RS_JSON);
        case CONSTRUCT -> RDFDataMgr.write(out, queryExecution.execConstruct(), Lang.JSONLD);
        case DESCRIBE -> RDFDataMgr.write(out, queryExecution.execDescribe(), Lang.JSONLD);
        default -> throw new UnsupportedOperationException(query.queryType() + " Not supported");
      }
    }
  }

  @SneakyThrows
  private BuildSummary summarize(Path outputDir) {
    List<Path> outputs = new ArrayList<>();
    long totalBytes = 0;
    try (Stream<Path> files = Files.walk(outputDir)) {
      for (Path file : files.filter(Files::isRegularFile)
                            .filter(p -> p.getFileName().toString().endsWith(JSON_EXTENSION))
                            .sorted()
                            .toList()) {
        outputs.add(file);
        totalBytes += Files.size(file);
      }
    }
    return new BuildSummary(outputs, totalBytes);
  }
}
