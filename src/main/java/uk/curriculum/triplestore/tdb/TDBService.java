package uk.curriculum.triplestore.tdb;

import com.google.common.collect.Lists;
import com.google.common.io.FileBackedOutputStream;
import lombok.SneakyThrows;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.math.NumberUtils;
import org.apache.jena.atlas.web.ContentType;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.query.Dataset;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryExecutionDatasetBuilder;
import org.apache.jena.query.QueryType;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFLanguages;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.sparql.core.DatasetGraph;
import org.apache.jena.system.Txn;
import org.apache.jena.update.UpdateAction;
import org.apache.jena.update.UpdateFactory;
import org.apache.jena.update.UpdateRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.stereotype.Service;
import uk.curriculum.triplestore.sparql.ModelUtils;
import uk.curriculum.triplestore.sparql.SparqlResult;

import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static org.apache.jena.query.ResultSetFormatter.output;
import static org.apache.jena.riot.Lang.TURTLE;
import static org.apache.jena.riot.RDFDataMgr.write;
import static org.apache.jena.riot.resultset.ResultSetLang.RS_CSV;
import static org.apache.jena.riot.resultset.ResultSetLang.RS_JSON;
import static org.apache.jena.riot.resultset.ResultSetLang.RS_TSV;
import static org.apache.jena.riot.resultset.ResultSetLang.RS_Text;
import static org.apache.jena.riot.resultset.ResultSetLang.RS_XML;

@Service
@ConditionalOnWebApplication
@Slf4j
public class TDBService {

  private static final int THRESHOLD = 4 * 1024 * 1024;  // 4mb
  private static final List<Lang> RESULT_SET_LANGS = List.of(RS_JSON, RS_XML, RS_CSV, RS_TSV, RS_Text);

  private final Dataset ds;

  @Value("${triplestore.batchSize}")
  private int batchSize;
  @Value("${triplestore.maxRetry}")
  private int maxRetry;
  @Value("${triplestore.query.timeout}")
  private long timeout;
  @Value("${triplestore.database.unionDefaultGraph}")
  private boolean unionDefaultGraph;
  @Value("${triplestore.update.defaultGraph}")
  private String updateDefaultGraph;

  public TDBService(Dataset ds) {
    this.ds = ds;
  }

  public SparqlResult executeQuery(Query q, String acceptHeader) {
    Supplier<SparqlResult> _executeQuery = () -> {
      try (QueryExecution queryExecution = QueryExecutionDatasetBuilder.create()
                                                                       .query(q)
                                                                       .dataset(ds)
                                                                       .timeout(timeout, TimeUnit.SECONDS)
                                                                       .build()
      ) {
        return switch (q.queryType()) {
          case ASK -> tryFormat((lang, out) -> output(out, queryExecution.execAsk(), lang), acceptHeader, q.queryType());
          case SELECT -> tryFormat((lang, out) -> output(out, queryExecution.execSelect(), lang), acceptHeader, q.queryType());
          case DESCRIBE -> tryFormat((lang, out) -> write(out, queryExecution.execDescribe(), lang), acceptHeader, q.queryType());
          case CONSTRUCT -> tryFormat((lang, out) -> write(out, queryExecution.execConstruct(), lang), acceptHeader, q.queryType());
          default -> throw new UnsupportedOperationException(q.queryType() + " Not supported");
        };
      }
      catch (Exception exc) {
        log.error("exception occurred", exc);
        throw new RuntimeException(exc);
      }
    };
    return this.executeQueryTimeout(() -> Txn.calculateRead(ds, _executeQuery));
  }

  private SparqlResult executeQueryTimeout(Supplier<SparqlResult> supplier) {
    CompletableFuture<SparqlResult> future = CompletableFuture.supplyAsync(supplier);
    try {
      return future.get(timeout, TimeUnit.SECONDS);
    }
    catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new RuntimeException(e);
    }
    catch (TimeoutException | ExecutionException e) {
      future.cancel(true);
      throw new RuntimeException(e);
    }
  }

  private SparqlResult tryFormat(BiConsumer<Lang, OutputStream> consumer, String acceptHeader, QueryType queryType) {
    boolean graphResult = queryType == QueryType.CONSTRUCT || queryType == QueryType.DESCRIBE;
    Lang lang = guessLang(acceptHeader, graphResult ? TURTLE : RS_JSON, graphResult);
    var body = writeToOutputStream(outputStream -> consumer.accept(lang, outputStream));

    return SparqlResult.builder()
                       .contentType(lang.getContentType().getContentTypeStr())
                       .body(body)
                       .build();
  }

  @SneakyThrows
  private InputStream writeToOutputStream(Consumer<OutputStream> consumer) {
    try (var outputStream = new FileBackedOutputStream(THRESHOLD, true)) {
      consumer.accept(outputStream);
      return outputStream.asByteSource().openStream();
    }
  }

  /**
   * Picks the most preferred media range of the accept header that names a writable language: a
   * result set format for SELECT/ASK, a triples format for CONSTRUCT/DESCRIBE. Ranges with equal
   * weight keep their order.
   */
  private Lang guessLang(String acceptHeader, Lang fallback, boolean graphResult) {
    if (acceptHeader == null) {
      return fallback;
    }
    List<Lang> candidates = graphResult
            ? RDFLanguages.getRegisteredLanguages().stream().filter(RDFLanguages::isTriples).toList()
            : RESULT_SET_LANGS;
    return Arrays.stream(acceptHeader.split(","))
                 .map(String::trim)
                 .sorted(Comparator.comparingDouble(TDBService::quality).reversed())
                 .map(this::parseContentType)
                 .filter(Objects::nonNull)
                 .flatMap(ct -> candidates.stream()
                                          .filter(l -> l.getContentType().getContentTypeStr().equalsIgnoreCase(ct.getContentTypeStr())))
                 .findFirst()
                 .orElse(fallback);
  }

  static double quality(String mediaRange) {
    return Arrays.stream(mediaRange.split(";"))
                 .skip(1)
                 .map(String::trim)
                 .filter(param -> param.startsWith("q="))
                 .map(param -> NumberUtils.toDouble(param.substring(2), 0))
                 .findFirst()
                 .orElse(1.0);
  }

  private ContentType parseContentType(String mediaRange) {
    try {
      return ContentType.create(mediaRange);
    }
    catch (Exception exc) {
      log.debug("ignoring media range {}", mediaRange);
      return null;
    }
  }

  public void executeUpdateQuery(String updateQuery) {
    executeUpdate(UpdateFactory.create(updateQuery));
  }

  public void executeUpdate(UpdateRequest updates) {
    Txn.executeWrite(ds, () -> UpdateAction.execute(updates, updateTarget()));
  }

  // the stored default graph is hidden behind the union of named graphs
  private DatasetGraph updateTarget() {
    if (!unionDefaultGraph || updateDefaultGraph == null) {
      return ds.asDatasetGraph();
    }
    return new DefaultGraphRedirect(ds.asDatasetGraph(), NodeFactory.createURI(updateDefaultGraph));
  }

  public void insertModel(String graphUri, Model model) {
    var triples = ModelUtils.toString(model, Lang.NTRIPLES);
    String updateQuery = String.format("INSERT DATA { GRAPH <%s> { %s } }", graphUri, triples);
    executeUpdateQuery(updateQuery);
  }

  public void batchLoadData(String graph, Model model) {
    log.info("running import triples with batch size {}, model size: {}, graph: <{}>", batchSize, model.size(), graph);
    List<Triple> triples = model.getGraph().find().toList(); //duplicate so we can splice
    Lists.partition(triples, batchSize)
         .stream()
         .map(batch -> {
           Model batchModel = ModelFactory.createDefaultModel();
           Graph batchGraph = batchModel.getGraph();
           batch.forEach(batchGraph::add);
           return batchModel;
         })
         .peek(batchModel -> log.info("running import triples with model size {}", batchModel.size()))
         .forEach(batchModel -> this.insertModelOrRetry(graph, batchModel));
  }

  private void insertModelOrRetry(String graph, Model batchModel) {
    int retryCount = 0;
    boolean success = false;
    do {
      try {
        this.insertModel(graph, batchModel);
        success = true;
        break;
      }
      catch (Exception e) {
        log.error("an error occurred, retry count {}, max retry {}, error: {}", retryCount, maxRetry, e.getMessage());
        retryCount += 1;
      }
    } while (retryCount < maxRetry);
    if (!success) {
      throw new RuntimeException("Reaching max retries. Check the logs for further details.");
    }
  }

  /**
   * Parses the files straight into a named graph within one write transaction. Used for the
   * startup load, where going through SPARQL updates would only slow things down.
   */
  public long loadFiles(String graph, List<Path> files) {
    return Txn.calculateWrite(ds, () -> {
      Model target = ds.getNamedModel(graph);
      for (Path file : files) {
        log.info("loading {}", file);
        RDFParser.source(file).lang(TURTLE).parse(target);
      }
      return target.size();
    });
  }

  public void clearGraph(String graph) {
    Txn.executeWrite(ds, () -> ds.removeNamedModel(graph));
  }

  public boolean isEmpty() {
    return Txn.calculateRead(ds, () -> ds.asDatasetGraph().isEmpty());
  }

  public long size(String graph) {
    return Txn.calculateRead(ds, () -> Optional.ofNullable(ds.getNamedModel(graph)).map(Model::size).orElse(0L));
  }
}
